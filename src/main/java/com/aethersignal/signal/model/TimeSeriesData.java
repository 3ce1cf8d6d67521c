/* (C)2026 */
package com.aethersignal.signal.model;

import com.aethersignal.signal.exception.ValidationException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Report counts per time bucket, ordered by bucket date.
 *
 * <p>Input pairs are sorted on construction. Lengths must match, counts must be
 * non-negative and each bucket date may appear once.
 */
public record TimeSeriesData(List<LocalDate> dates, List<Integer> counts) {

    public TimeSeriesData {
        if (dates == null) throw ValidationException.missingInput("dates");
        if (counts == null) throw ValidationException.missingInput("counts");
        if (dates.size() != counts.size()) {
            throw ValidationException.invalidParameter(
                    "counts.length", counts.size(), "same length as dates (" + dates.size() + ")");
        }
        List<Integer> order = new ArrayList<>(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            if (dates.get(i) == null) throw ValidationException.missingInput("dates[" + i + "]");
            Integer count = counts.get(i);
            if (count == null) throw ValidationException.missingInput("counts[" + i + "]");
            if (count < 0) throw ValidationException.negativeCount("counts[" + i + "]", count);
            order.add(i);
        }
        order.sort(Comparator.comparing(dates::get));
        List<LocalDate> sortedDates = new ArrayList<>(dates.size());
        List<Integer> sortedCounts = new ArrayList<>(counts.size());
        for (int index : order) {
            LocalDate date = dates.get(index);
            if (!sortedDates.isEmpty() && sortedDates.get(sortedDates.size() - 1).equals(date)) {
                throw ValidationException.invalidParameter("dates", date, "unique bucket dates");
            }
            sortedDates.add(date);
            sortedCounts.add(counts.get(index));
        }
        dates = List.copyOf(sortedDates);
        counts = List.copyOf(sortedCounts);
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public long totalCases() {
        long total = 0;
        for (int count : counts) {
            total += count;
        }
        return total;
    }

    /** Days between the first and last bucket; 0 for fewer than two buckets. */
    public long durationDays() {
        if (dates.size() < 2) {
            return 0;
        }
        return ChronoUnit.DAYS.between(dates.get(0), dates.get(dates.size() - 1));
    }

    public double meanDailyRate() {
        long duration = durationDays();
        return duration == 0 ? 0.0 : (double) totalCases() / duration;
    }

    public double[] countsAsArray() {
        double[] values = new double[counts.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = counts.get(i);
        }
        return values;
    }

    public LocalDate firstDate() {
        return dates.isEmpty() ? null : dates.get(0);
    }

    public LocalDate lastDate() {
        return dates.isEmpty() ? null : dates.get(dates.size() - 1);
    }
}
