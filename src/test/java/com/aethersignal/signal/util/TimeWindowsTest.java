/* (C)2026 */
package com.aethersignal.signal.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class TimeWindowsTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-06-30T12:00:00Z"), ZoneOffset.UTC);

    @ParameterizedTest
    @CsvSource({
        "LAST_3_MONTHS, 2026-04-01",
        "last_6_months, 2026-01-01",
        "LAST_12_MONTHS, 2025-06-30",
        "LAST_30_DAYS, 2026-05-31",
        "SINCE_2020, 2020-01-01",
        "2024-02-15, 2024-02-15"
    })
    void resolvesKnownTokens(String token, LocalDate expected) {
        assertThat(TimeWindows.startOf(token, clock)).contains(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "LAST_WEEK", "SINCE_20", "yesterday"})
    void unknownOrBlankTokensApplyNoFilter(String token) {
        assertThat(TimeWindows.startOf(token, clock)).isEmpty();
    }

    @Test
    void surroundingWhitespaceIsIgnored() {
        assertThat(TimeWindows.startOf(" SINCE_2023 ", clock)).contains(LocalDate.of(2023, 1, 1));
    }
}
