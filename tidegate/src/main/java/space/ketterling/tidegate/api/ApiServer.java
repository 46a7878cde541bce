/*
* Copyright 2025 Taylor Ketterling
* API Server for TideGate, a tide and gate-time serving application.
* Utilizes Javalin for the HTTP server and Jackson for JSON processing.
* All data comes from the in-memory caches behind QueryFacade.
*/

package space.ketterling.tidegate.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.config.AppConfig;
import space.ketterling.tidegate.model.CrossingEvent;
import space.ketterling.tidegate.model.Sample;
import space.ketterling.tidegate.model.TideExtreme;
import space.ketterling.tidegate.query.QueryFacade;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final QueryFacade query;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, QueryFacade query) {
        this.cfg = cfg;
        this.om = om;
        this.query = query;
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        // JSON error instead of the default error page
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesTides.register(this);
        ApiRoutesWeather.register(this);
        ApiRoutesMetrics.register(this);

        app.start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    /**
     * Port actually bound (useful when configured with 0).
     */
    public int port() {
        return app.port();
    }

    Javalin app() {
        return app;
    }

    AppConfig cfg() {
        return cfg;
    }

    ObjectMapper om() {
        return om;
    }

    QueryFacade query() {
        return query;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------

    /**
     * Parses an ISO date; on failure answers 400 and returns null.
     */
    LocalDate dayParam(Context ctx, String raw) {
        if (raw == null || raw.isBlank()) {
            ctx.status(400).json(error("date is required"));
            return null;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            ctx.status(400).json(error("Invalid date format"));
            return null;
        }
    }

    void notFound(Context ctx, String message) {
        ctx.status(404).json(error(message));
    }

    ObjectNode error(String message) {
        return om.createObjectNode().put("error", message);
    }

    ArrayNode samplesJson(List<Sample> samples) {
        ZoneId zone = query.zone();
        ArrayNode arr = om.createArrayNode();
        for (Sample s : samples) {
            var local = s.timestamp().atZone(zone);
            arr.add(om.createObjectNode()
                    .put("dt", local.toOffsetDateTime().toString())
                    .put("date", local.toLocalDate().toString())
                    .put("height", s.value()));
        }
        return arr;
    }

    ArrayNode eventsJson(List<CrossingEvent> events) {
        ZoneId zone = query.zone();
        ArrayNode arr = om.createArrayNode();
        for (CrossingEvent e : events) {
            arr.add(om.createObjectNode()
                    .put("datetime", e.instant().atZone(zone).toOffsetDateTime().toString())
                    .put("action", GateAction.of(e.direction()).label())
                    .put("height", e.threshold()));
        }
        return arr;
    }

    ArrayNode extremesJson(List<TideExtreme> extremes) {
        ZoneId zone = query.zone();
        ArrayNode arr = om.createArrayNode();
        for (TideExtreme x : extremes) {
            var local = x.instant().atZone(zone);
            arr.add(om.createObjectNode()
                    .put("dt", local.toOffsetDateTime().toString())
                    .put("date", local.toLocalDate().toString())
                    .put("height", x.height())
                    .put("type", x.type().label()));
        }
        return arr;
    }

    static Integer parseInt(String s, Integer def, int min, int max) {
        if (s == null || s.isBlank())
            return def;
        try {
            int v = Integer.parseInt(s.trim());
            if (v < min)
                v = min;
            if (v > max)
                v = max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    static Double parseDouble(String s, Double def) {
        if (s == null || s.isBlank())
            return def;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
