package space.ketterling.tidegate.api;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.tidegate.ingest.RefreshState;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "tidegate",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /api/tide-heights?offset=0&limit=100",
                        "GET /api/tide-heights/range?start=2025-06-01&end=2025-06-07",
                        "GET /api/tides/{date}",
                        "GET /api/gate-times",
                        "GET /api/gate-times/{date}",
                        "GET /api/weather/{date}",
                        "GET /api/sunrise-sunset?date=2025-06-01&lat=53.28&lng=-3.83",
                        "GET /api/moon-phase?date=2025-06-01",
                        "GET /api/marine?lat=53.28&lon=-3.83&forecast_hours=48",
                        "GET /api/metrics/external",
                        "GET /api/metrics/caches"
                })));

        // never triggers a refresh; reports what is cached right now
        app.get("/health", ctx -> {
            ObjectNode out = api.om().createObjectNode();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());
            ArrayNode caches = out.putArray("caches");
            boolean anyData = false;
            for (RefreshState s : api.query().cacheStatus()) {
                caches.add(api.om().createObjectNode()
                        .put("cache", s.cache().jobName())
                        .put("state", s.state().name()));
                anyData |= s.lastSuccessfulFetch() != null;
            }
            if (!anyData)
                out.put("status", "starting");
            ctx.json(out);
        });
    }
}
