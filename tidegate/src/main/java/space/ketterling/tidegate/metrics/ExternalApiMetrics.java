package space.ketterling.tidegate.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks success/failure counts for external API calls (WorldTides,
 * OpenWeather, sunrise-sunset).
 *
 * <p>
 * Uses a rolling 60-minute window to compute basic health status.
 * </p>
 */
public final class ExternalApiMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, ServiceBuckets> SERVICES = new ConcurrentHashMap<>();

    private ExternalApiMetrics() {
    }

    /**
     * Records one call outcome for a named external service.
     */
    public static void record(String service, boolean success) {
        record(service, success, System.currentTimeMillis());
    }

    static void record(String service, boolean success, long nowMs) {
        if (service == null || service.isBlank())
            return;
        SERVICES.computeIfAbsent(service, k -> new ServiceBuckets()).record(success, nowMs / 60000L);
    }

    /**
     * Returns a snapshot of call counts and failure rates by service, sorted by
     * service name.
     */
    public static Map<String, ServiceSnapshot> snapshot() {
        return snapshot(System.currentTimeMillis());
    }

    static Map<String, ServiceSnapshot> snapshot(long nowMs) {
        Map<String, ServiceSnapshot> out = new TreeMap<>();
        for (var e : SERVICES.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot(nowMs / 60000L));
        }
        return out;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /**
     * Summary metrics for a single external service.
     */
    public record ServiceSnapshot(long callsLastHour, long failuresLastHour, double failurePct, String status) {
    }

    /**
     * Ring buffer of per-minute counts for a service.
     */
    private static final class ServiceBuckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] fail = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(boolean success, long nowMin) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
            }
            total[idx] += 1L;
            if (!success) {
                fail[idx] += 1L;
            }
        }

        private synchronized ServiceSnapshot snapshot(long nowMin) {
            long totalSum = 0L;
            long failSum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (minute[i] == 0L || (nowMin - minute[i]) >= WINDOW_MINUTES)
                    continue;
                totalSum += total[i];
                failSum += fail[i];
            }
            double failurePct = totalSum == 0 ? 0.0 : (failSum * 100.0) / totalSum;
            String status;
            if (totalSum == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new ServiceSnapshot(totalSum, failSum, failurePct, status);
        }
    }
}
