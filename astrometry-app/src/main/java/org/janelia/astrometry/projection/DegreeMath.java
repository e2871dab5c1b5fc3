package org.janelia.astrometry.projection;

/**
 * Trigonometric functions working in degrees.
 *
 * The sine and cosine of exact multiples of 90 degrees are returned exactly so that
 * pole and meridian special cases in {@link SphericalRotation} compare against zero reliably.
 */
public class DegreeMath {

    public static double sin(final double degrees) {
        final double remainder = degrees % 90.0;
        if (remainder == 0.0) {
            switch (quadrant(degrees)) {
                case 0: return 0.0;
                case 1: return 1.0;
                case 2: return 0.0;
                default: return -1.0;
            }
        }
        return Math.sin(Math.toRadians(degrees));
    }

    public static double cos(final double degrees) {
        final double remainder = degrees % 90.0;
        if (remainder == 0.0) {
            switch (quadrant(degrees)) {
                case 0: return 1.0;
                case 1: return 0.0;
                case 2: return -1.0;
                default: return 0.0;
            }
        }
        return Math.cos(Math.toRadians(degrees));
    }

    public static double tan(final double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }

    public static double asin(final double value) {
        return Math.toDegrees(Math.asin(value));
    }

    public static double acos(final double value) {
        return Math.toDegrees(Math.acos(value));
    }

    public static double atan(final double value) {
        return Math.toDegrees(Math.atan(value));
    }

    public static double atan2(final double y,
                               final double x) {
        return Math.toDegrees(Math.atan2(y, x));
    }

    /**
     * @return the specified angle shifted by whole turns into [min, max).
     *         Angles already inside the range are returned unchanged.
     *
     * @throws IllegalArgumentException
     *   if the angle is not finite.
     */
    public static double wrap(final double degrees,
                              final double min,
                              final double max)
            throws IllegalArgumentException {

        if (! Double.isFinite(degrees)) {
            throw new IllegalArgumentException("cannot wrap non-finite angle " + degrees);
        }

        if ((degrees >= min) && (degrees < max)) {
            return degrees;
        }

        double wrapped = min + (((degrees - min) % 360.0) + 360.0) % 360.0;
        if (wrapped >= min + 360.0) {
            // remainder rounded up to a full turn
            wrapped = min;
        }
        return wrapped;
    }

    private static int quadrant(final double multipleOf90) {
        final long quarterTurns = Math.round(multipleOf90 / 90.0);
        return (int) (((quarterTurns % 4) + 4) % 4);
    }

}
