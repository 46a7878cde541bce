package space.ketterling.tidegate.metrics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExternalApiMetricsTest {
    private static final long MINUTE = 60_000L;
    private static final long T0 = 1_736_931_600_000L;

    @Test
    void statusFollowsFailureRate() {
        for (int i = 0; i < 9; i++)
            ExternalApiMetrics.record("metrics-test-ok", true, T0);
        ExternalApiMetrics.record("metrics-test-ok", false, T0);

        ExternalApiMetrics.record("metrics-test-down", false, T0);
        ExternalApiMetrics.record("metrics-test-down", true, T0 + MINUTE);

        var snap = ExternalApiMetrics.snapshot(T0 + 2 * MINUTE);

        var ok = snap.get("metrics-test-ok");
        assertEquals(10, ok.callsLastHour());
        assertEquals(1, ok.failuresLastHour());
        assertEquals(10.0, ok.failurePct(), 1e-9);
        assertEquals("degraded", ok.status());
        assertEquals("down", snap.get("metrics-test-down").status());
    }

    @Test
    void oldCallsLeaveTheWindow() {
        ExternalApiMetrics.record("metrics-test-window", false, T0);
        ExternalApiMetrics.record("metrics-test-window", true, T0 + 30 * MINUTE);

        var later = ExternalApiMetrics.snapshot(T0 + 61 * MINUTE).get("metrics-test-window");
        assertEquals(1, later.callsLastHour());
        assertEquals("ok", later.status());

        var gone = ExternalApiMetrics.snapshot(T0 + 120 * MINUTE).get("metrics-test-window");
        assertEquals(0, gone.callsLastHour());
        assertEquals("no-data", gone.status());
    }

    @Test
    void blankServiceIgnored() {
        ExternalApiMetrics.record(" ", true, T0);
        assertFalse(ExternalApiMetrics.snapshot(T0).containsKey(" "));
    }
}
