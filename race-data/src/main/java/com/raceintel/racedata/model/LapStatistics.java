package com.raceintel.racedata.model;

import java.util.Collection;

/**
 * Lap-time statistics for one vehicle, in milliseconds.
 *
 * Standard deviation is the population form (divide by N). Consistency is the
 * coefficient of variation, stdDev / average.
 */
public record LapStatistics(int count,
                            Double fastest,
                            Double slowest,
                            Double average,
                            double standardDeviation,
                            Double consistency) {

    public static LapStatistics empty() {
        return new LapStatistics(0, null, null, null, 0.0, null);
    }

    public static LapStatistics of(Collection<Double> lapTimes) {
        if (lapTimes.isEmpty()) return empty();

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        double sum = 0;
        for (double t : lapTimes) {
            min = Math.min(min, t);
            max = Math.max(max, t);
            sum += t;
        }
        int n = lapTimes.size();
        double mean = sum / n;

        double squares = 0;
        for (double t : lapTimes) {
            squares += (t - mean) * (t - mean);
        }
        double stdDev = Math.sqrt(squares / n);

        return new LapStatistics(n, min, max, mean, stdDev, mean > 0 ? stdDev / mean : null);
    }
}
