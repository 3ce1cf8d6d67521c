/* (C)2026 */
package com.aethersignal.signal.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Default beans for the evidence and terminology seams.
 *
 * <p>A deployment with its own data access supplies another {@link MetricsProvider} bean,
 * which replaces the in-memory one.
 */
@ApplicationScoped
public class ProviderProducer {

    private static final Logger LOG = Logger.getLogger(ProviderProducer.class);

    @ConfigProperty(name = "signal.metrics.case-file")
    Optional<String> caseFile;

    @Inject ObjectMapper objectMapper;

    @Inject Clock clock;

    @Produces
    @DefaultBean
    @Singleton
    public MetricsProvider metricsProvider() {
        CaseDataset dataset = caseFile.map(this::load).orElseGet(() -> {
            LOG.warn("No signal.metrics.case-file configured; queries will find no evidence");
            return new CaseDataset(null, null);
        });
        LOG.infof("In-memory metrics provider holds %d case reports", dataset.cases().size());
        return new InMemoryCaseMetricsProvider(dataset, clock);
    }

    @Produces
    @DefaultBean
    @Singleton
    public TerminologyNormalizer terminologyNormalizer() {
        return new SynonymTerminologyNormalizer();
    }

    /** Reads the case file from the file system, falling back to the classpath. */
    CaseDataset load(String location) {
        Path path = Path.of(location);
        try {
            if (Files.isReadable(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    return objectMapper.readValue(in, CaseDataset.class);
                }
            }
            String resource = location.startsWith("/") ? location.substring(1) : location;
            try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new IllegalStateException("Case file not found: " + location);
                }
                return objectMapper.readValue(in, CaseDataset.class);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read case file " + location, e);
        }
    }
}
