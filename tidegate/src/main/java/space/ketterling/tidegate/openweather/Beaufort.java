package space.ketterling.tidegate.openweather;

/**
 * Wind speed to Beaufort force conversion.
 */
public final class Beaufort {
    // upper bounds (m/s, exclusive) of forces 0..11
    private static final double[] LIMITS = {
            0.5, 1.5, 3.3, 5.5, 7.9, 10.7, 13.8, 17.1, 20.7, 24.4, 28.4, 32.6
    };

    private Beaufort() {
    }

    /**
     * Converts metres/second to Beaufort force 0-12.
     */
    public static int fromMetersPerSecond(double speed) {
        for (int i = 0; i < LIMITS.length; i++) {
            if (speed < LIMITS[i])
                return i;
        }
        return 12;
    }
}
