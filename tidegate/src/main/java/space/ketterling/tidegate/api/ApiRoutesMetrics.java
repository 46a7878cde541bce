package space.ketterling.tidegate.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.tidegate.ingest.RefreshState;
import space.ketterling.tidegate.metrics.ExternalApiMetrics;

/**
 * Routes that report provider health and cache freshness.
 */
final class ApiRoutesMetrics {
    private ApiRoutesMetrics() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/metrics/external", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", ExternalApiMetrics.windowMinutes());
            ArrayNode services = out.putArray("services");

            for (var e : ExternalApiMetrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("service", e.getKey());
                row.put("calls_last_hour", snap.callsLastHour());
                row.put("failures_last_hour", snap.failuresLastHour());
                row.put("failure_pct", snap.failurePct());
                row.put("status", snap.status());
                services.add(row);
            }

            ctx.json(out);
        });

        app.get("/api/metrics/caches", ctx -> {
            ArrayNode arr = om.createArrayNode();
            for (RefreshState s : api.query().cacheStatus()) {
                ObjectNode row = om.createObjectNode();
                row.put("cache", s.cache().jobName());
                row.put("state", s.state().name());
                row.put("refresh_in_progress", s.refreshInProgress());
                row.put("max_age", s.maxAge().toString());
                putNullable(row, "last_successful_fetch", s.lastSuccessfulFetch());
                putNullable(row, "last_failure", s.lastFailure());
                putNullable(row, "last_error", s.lastError());
                arr.add(row);
            }
            ctx.json(arr);
        });
    }

    private static void putNullable(ObjectNode obj, String key, Object value) {
        if (value == null)
            obj.putNull(key);
        else
            obj.put(key, value.toString());
    }
}
