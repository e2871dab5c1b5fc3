package org.janelia.astrometry.match;

import java.util.Arrays;

/**
 * Robust location and scale estimators used to summarize matching errors.
 */
public class RobustStatistics {

    /**
     * @return median of the specified values (0 for an empty array).
     */
    public static double median(final double[] values) {
        if (values.length == 0) {
            return 0;
        }
        final double[] sorted = values.clone();
        Arrays.sort(sorted);
        final int middle = sorted.length / 2;
        return (sorted.length % 2 == 1) ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2.0;
    }

    /**
     * @return median absolute deviation from the specified center.
     */
    public static double medianAbsoluteDeviation(final double[] values,
                                                 final double center) {
        final double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return median(deviations);
    }

    /**
     * Biweight midvariance with the usual tuning constant c = 9.
     *
     * @return biweight midvariance about the specified center (0 when it is undefined).
     */
    public static double biweightMidvariance(final double[] values,
                                             final double center) {
        final double mad = medianAbsoluteDeviation(values, center);
        if (mad == 0) {
            return 0;
        }
        final double c = 9.0 * mad;
        double numerator = 0;
        double denominator = 0;
        for (final double value : values) {
            final double d = value - center;
            final double u = d / c;
            final double u2 = u * u;
            if (u2 < 1) {
                final double oneMinusU2 = 1 - u2;
                numerator += d * d * oneMinusU2 * oneMinusU2 * oneMinusU2 * oneMinusU2;
                denominator += oneMinusU2 * (1 - 5 * u2);
            }
        }
        if (denominator == 0) {
            return 0;
        }
        return values.length * numerator / (denominator * denominator);
    }

}
