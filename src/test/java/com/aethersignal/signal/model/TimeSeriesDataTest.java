/* (C)2026 */
package com.aethersignal.signal.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aethersignal.signal.exception.ValidationException;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimeSeriesDataTest {

    private static final LocalDate JAN = LocalDate.of(2026, 1, 1);
    private static final LocalDate FEB = LocalDate.of(2026, 2, 1);
    private static final LocalDate MAR = LocalDate.of(2026, 3, 1);

    @Test
    void sortsBucketsByDate() {
        TimeSeriesData series = new TimeSeriesData(List.of(MAR, JAN, FEB), List.of(3, 1, 2));

        assertThat(series.dates()).containsExactly(JAN, FEB, MAR);
        assertThat(series.counts()).containsExactly(1, 2, 3);
        assertThat(series.totalCases()).isEqualTo(6);
        assertThat(series.durationDays()).isEqualTo(59);
        assertThat(series.firstDate()).isEqualTo(JAN);
        assertThat(series.lastDate()).isEqualTo(MAR);
    }

    @Test
    void singleBucketHasNoDuration() {
        TimeSeriesData series = new TimeSeriesData(List.of(JAN), List.of(4));

        assertThat(series.durationDays()).isZero();
        assertThat(series.meanDailyRate()).isZero();
    }

    @Test
    void rejectsMismatchedLengths() {
        assertThatThrownBy(() -> new TimeSeriesData(List.of(JAN, FEB), List.of(1)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("counts.length");
    }

    @Test
    void rejectsNegativeAndMissingCounts() {
        assertThatThrownBy(() -> new TimeSeriesData(List.of(JAN, FEB), List.of(1, -2)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("counts[1]");
        assertThatThrownBy(() -> new TimeSeriesData(List.of(JAN), Arrays.asList((Integer) null)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Required input 'counts[0]' is missing");
    }

    @Test
    void rejectsDuplicateBuckets() {
        assertThatThrownBy(() -> new TimeSeriesData(List.of(JAN, JAN), List.of(1, 2)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unique bucket dates");
    }
}
