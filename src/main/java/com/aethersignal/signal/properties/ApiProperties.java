/* (C)2026 */
package com.aethersignal.signal.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Signal detection endpoints
     */
    public static final class Signals {
        private Signals() {}

        public static final String BASE = "/signals";
        public static final String DISPROPORTIONALITY = BASE + "/disproportionality";
        public static final String DETECT = BASE + "/detect";
        public static final String FUSION = BASE + "/fusion";
        public static final String FUSION_BATCH = FUSION + "/batch";
        public static final String QUERY = BASE + "/query";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
    }
}
