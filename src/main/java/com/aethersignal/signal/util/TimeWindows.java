/* (C)2026 */
package com.aethersignal.signal.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jboss.logging.Logger;

/**
 * Parses query time-window tokens into the first day of the window.
 *
 * <p>Recognized tokens: {@code LAST_3_MONTHS}, {@code LAST_6_MONTHS}, {@code LAST_12_MONTHS}
 * (90, 180 and 365 days), {@code LAST_<n>_DAYS}, {@code SINCE_<yyyy>} and an ISO-8601 date.
 */
public final class TimeWindows {

    private static final Logger LOG = Logger.getLogger(TimeWindows.class);

    private static final Pattern LAST_DAYS = Pattern.compile("LAST_(\\d{1,5})_DAYS");
    private static final Pattern SINCE_YEAR = Pattern.compile("SINCE_(\\d{4})");

    private TimeWindows() {}

    /**
     * @return start of the window, or empty for a blank or unrecognized token
     */
    public static Optional<LocalDate> startOf(String token, Clock clock) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        LocalDate today = LocalDate.now(clock);

        switch (normalized) {
            case "LAST_3_MONTHS":
                return Optional.of(today.minusDays(90));
            case "LAST_6_MONTHS":
                return Optional.of(today.minusDays(180));
            case "LAST_12_MONTHS":
                return Optional.of(today.minusDays(365));
            default:
                break;
        }

        Matcher days = LAST_DAYS.matcher(normalized);
        if (days.matches()) {
            return Optional.of(today.minusDays(Long.parseLong(days.group(1))));
        }
        Matcher since = SINCE_YEAR.matcher(normalized);
        if (since.matches()) {
            return Optional.of(LocalDate.of(Integer.parseInt(since.group(1)), 1, 1));
        }
        try {
            return Optional.of(LocalDate.parse(token.trim()));
        } catch (DateTimeParseException e) {
            LOG.warnf("Could not parse time window '%s'; no date filter applied", token);
            return Optional.empty();
        }
    }
}
