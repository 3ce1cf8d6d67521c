/* (C)2026 */
package com.aethersignal.signal.util;

import java.util.Arrays;
import java.util.List;

/**
 * Special functions and distribution helpers used by the disproportionality, shrinkage
 * and temporal analyzers.
 *
 * <p>All methods are pure and thread-safe. Results follow the usual textbook
 * definitions (Lanczos log-gamma, series/continued-fraction incomplete gamma).
 */
public final class StatisticalFunctions {

    /** Two-sided 95% normal quantile. */
    public static final double Z_95 = 1.96;

    private static final double[] LANCZOS = {
        0.99999999999980993,
        676.5203681218851,
        -1259.1392167224028,
        771.32342877765313,
        -176.61502916214059,
        12.507343278686905,
        -0.13857109526572012,
        9.9843695780195716e-6,
        1.5056327351493116e-7
    };
    private static final double HALF_LOG_TWO_PI = 0.5 * Math.log(2.0 * Math.PI);
    private static final double LN_2 = Math.log(2.0);
    private static final int MAX_ITERATIONS = 500;
    private static final double EPSILON = 1e-14;
    private static final double TINY = 1e-300;

    private StatisticalFunctions() {}

    /**
     * Natural logarithm of the gamma function for {@code x > 0}.
     */
    public static double logGamma(double x) {
        if (x <= 0) {
            throw new IllegalArgumentException("logGamma requires x > 0, got " + x);
        }
        if (x < 0.5) {
            // reflection
            return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x))) - logGamma(1.0 - x);
        }
        double z = x - 1.0;
        double sum = LANCZOS[0];
        double t = z + 7.5;
        for (int i = 1; i < LANCZOS.length; i++) {
            sum += LANCZOS[i] / (z + i);
        }
        return HALF_LOG_TWO_PI + (z + 0.5) * Math.log(t) - t + Math.log(sum);
    }

    /** {@code ln(n!)}. */
    public static double logFactorial(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("logFactorial requires n >= 0, got " + n);
        }
        return n < 2 ? 0.0 : logGamma(n + 1.0);
    }

    /**
     * Digamma function (derivative of log-gamma) for {@code x > 0}.
     */
    public static double digamma(double x) {
        if (x <= 0) {
            throw new IllegalArgumentException("digamma requires x > 0, got " + x);
        }
        double result = 0.0;
        while (x < 6.0) {
            result -= 1.0 / x;
            x += 1.0;
        }
        double inv = 1.0 / x;
        double inv2 = inv * inv;
        result += Math.log(x) - 0.5 * inv
                - inv2 * (1.0 / 12.0 - inv2 * (1.0 / 120.0 - inv2 * (1.0 / 252.0)));
        return result;
    }

    /**
     * Regularized lower incomplete gamma function P(a, x).
     */
    public static double regularizedGammaP(double a, double x) {
        if (a <= 0) {
            throw new IllegalArgumentException("regularizedGammaP requires a > 0, got " + a);
        }
        if (x <= 0) {
            return 0.0;
        }
        if (x < a + 1.0) {
            return gammaSeries(a, x);
        }
        return 1.0 - gammaContinuedFraction(a, x);
    }

    /**
     * Regularized upper incomplete gamma function Q(a, x) = 1 - P(a, x).
     */
    public static double regularizedGammaQ(double a, double x) {
        if (a <= 0) {
            throw new IllegalArgumentException("regularizedGammaQ requires a > 0, got " + a);
        }
        if (x <= 0) {
            return 1.0;
        }
        if (x < a + 1.0) {
            return 1.0 - gammaSeries(a, x);
        }
        return gammaContinuedFraction(a, x);
    }

    /**
     * Quantile of a gamma distribution with the given shape and rate.
     *
     * @param p probability in (0, 1)
     * @param shape shape parameter, must be positive
     * @param rate rate parameter (inverse scale), must be positive
     * @return x such that P(X &lt;= x) = p
     */
    public static double gammaQuantile(double p, double shape, double rate) {
        if (p <= 0.0 || p >= 1.0) {
            throw new IllegalArgumentException("p must be in (0, 1), got " + p);
        }
        if (shape <= 0 || rate <= 0) {
            throw new IllegalArgumentException(
                    "shape and rate must be positive, got " + shape + ", " + rate);
        }
        double lo = 0.0;
        double hi = Math.max(1.0, shape + 10.0 * Math.sqrt(shape));
        while (regularizedGammaP(shape, hi) < p) {
            lo = hi;
            hi *= 2.0;
        }
        for (int i = 0; i < 200; i++) {
            double mid = 0.5 * (lo + hi);
            if (regularizedGammaP(shape, mid) < p) {
                lo = mid;
            } else {
                hi = mid;
            }
            if (hi - lo <= EPSILON * Math.max(1.0, hi)) {
                break;
            }
        }
        return 0.5 * (lo + hi) / rate;
    }

    /**
     * Upper-tail p-value of a chi-square statistic with one degree of freedom.
     */
    public static double chiSquarePValueOneDf(double statistic) {
        if (!(statistic > 0)) {
            return 1.0;
        }
        return regularizedGammaQ(0.5, statistic / 2.0);
    }

    /**
     * P(X &gt;= k) for a Poisson variable with the given mean.
     */
    public static double poissonUpperTail(long k, double mean) {
        if (k <= 0) {
            return 1.0;
        }
        if (mean <= 0) {
            return 0.0;
        }
        return regularizedGammaP(k, mean);
    }

    /**
     * Two-tailed Fisher exact test p-value for the 2x2 table [[a, b], [c, d]].
     *
     * <p>Sums the probabilities of all tables with the same margins that are no more
     * likely than the observed one.
     */
    public static double fisherExactTwoTailed(long a, long b, long c, long d) {
        long row1 = a + b;
        long row2 = c + d;
        long col1 = a + c;
        long n = row1 + row2;
        if (n == 0) {
            return 1.0;
        }
        long min = Math.max(0, col1 - row2);
        long max = Math.min(row1, col1);
        double logTotal = logBinomial(n, col1);
        double observed = logBinomial(row1, a) + logBinomial(row2, col1 - a) - logTotal;
        double pValue = 0.0;
        for (long x = min; x <= max; x++) {
            double logP = logBinomial(row1, x) + logBinomial(row2, col1 - x) - logTotal;
            if (logP <= observed + 1e-7) {
                pValue += Math.exp(logP);
            }
        }
        return Math.min(1.0, pValue);
    }

    /**
     * Regularized incomplete beta function I_x(a, b).
     */
    public static double regularizedBeta(double x, double a, double b) {
        if (a <= 0 || b <= 0) {
            throw new IllegalArgumentException("regularizedBeta requires a, b > 0");
        }
        if (x <= 0) {
            return 0.0;
        }
        if (x >= 1) {
            return 1.0;
        }
        double logFront = logGamma(a + b) - logGamma(a) - logGamma(b)
                + a * Math.log(x) + b * Math.log(1.0 - x);
        if (x < (a + 1.0) / (a + b + 2.0)) {
            return Math.exp(logFront) * betaContinuedFraction(x, a, b) / a;
        }
        return 1.0 - Math.exp(logFront) * betaContinuedFraction(1.0 - x, b, a) / b;
    }

    /**
     * Two-tailed p-value of a Student t statistic.
     *
     * @param t the statistic
     * @param degreesOfFreedom degrees of freedom, must be positive
     */
    public static double studentTTwoTailedPValue(double t, double degreesOfFreedom) {
        if (degreesOfFreedom <= 0) {
            throw new IllegalArgumentException("degrees of freedom must be positive");
        }
        if (Double.isNaN(t)) {
            return 1.0;
        }
        if (Double.isInfinite(t)) {
            return 0.0;
        }
        double x = degreesOfFreedom / (degreesOfFreedom + t * t);
        return regularizedBeta(x, degreesOfFreedom / 2.0, 0.5);
    }

    /** Base-2 logarithm. */
    public static double log2(double value) {
        return Math.log(value) / LN_2;
    }

    /** Arithmetic mean, 0 for an empty array. */
    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Population standard deviation, 0 for fewer than two values. */
    public static double standardDeviation(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return Math.sqrt(sum / values.length);
    }

    /**
     * Linear-interpolation percentile (same convention as a spreadsheet PERCENTILE.INC).
     *
     * @param values unsorted values, not modified
     * @param percentile percentile in [0, 100]
     */
    public static double percentile(List<Integer> values, double percentile) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("percentile requires at least one value");
        }
        double[] sorted = values.stream().mapToDouble(Integer::doubleValue).toArray();
        Arrays.sort(sorted);
        double rank = (percentile / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    /** Clamps a value into [min, max]. */
    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double logBinomial(long n, long k) {
        return logFactorial(n) - logFactorial(k) - logFactorial(n - k);
    }

    private static double betaContinuedFraction(double x, double a, double b) {
        double qab = a + b;
        double qap = a + 1.0;
        double qam = a - 1.0;
        double c = 1.0;
        double d = 1.0 - qab * x / qap;
        if (Math.abs(d) < TINY) {
            d = TINY;
        }
        d = 1.0 / d;
        double h = d;
        for (int m = 1; m <= MAX_ITERATIONS; m++) {
            int m2 = 2 * m;
            double aa = m * (b - m) * x / ((qam + m2) * (a + m2));
            d = 1.0 + aa * d;
            if (Math.abs(d) < TINY) {
                d = TINY;
            }
            c = 1.0 + aa / c;
            if (Math.abs(c) < TINY) {
                c = TINY;
            }
            d = 1.0 / d;
            h *= d * c;
            aa = -(a + m) * (qab + m) * x / ((a + m2) * (qap + m2));
            d = 1.0 + aa * d;
            if (Math.abs(d) < TINY) {
                d = TINY;
            }
            c = 1.0 + aa / c;
            if (Math.abs(c) < TINY) {
                c = TINY;
            }
            d = 1.0 / d;
            double delta = d * c;
            h *= delta;
            if (Math.abs(delta - 1.0) < EPSILON) {
                break;
            }
        }
        return h;
    }

    private static double gammaSeries(double a, double x) {
        double sum = 1.0 / a;
        double term = sum;
        double ap = a;
        for (int n = 0; n < MAX_ITERATIONS; n++) {
            ap += 1.0;
            term *= x / ap;
            sum += term;
            if (Math.abs(term) < Math.abs(sum) * EPSILON) {
                break;
            }
        }
        return sum * Math.exp(-x + a * Math.log(x) - logGamma(a));
    }

    private static double gammaContinuedFraction(double a, double x) {
        double b = x + 1.0 - a;
        double c = 1.0 / TINY;
        double d = 1.0 / b;
        double h = d;
        for (int i = 1; i < MAX_ITERATIONS; i++) {
            double an = -i * (i - a);
            b += 2.0;
            d = an * d + b;
            if (Math.abs(d) < TINY) {
                d = TINY;
            }
            c = b + an / c;
            if (Math.abs(c) < TINY) {
                c = TINY;
            }
            d = 1.0 / d;
            double delta = d * c;
            h *= delta;
            if (Math.abs(delta - 1.0) < EPSILON) {
                break;
            }
        }
        return Math.exp(-x + a * Math.log(x) - logGamma(a)) * h;
    }
}
