package space.ketterling.tidegate.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.tidegate.model.CrossingEvent;
import space.ketterling.tidegate.model.EventsByDay;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes for tide heights, high/low water and gate times.
 */
final class ApiRoutesTides {
    private ApiRoutesTides() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get("/api/tide-heights", ctx -> {
            int offset = ApiServer.parseInt(ctx.queryParam("offset"), 0, 0, Integer.MAX_VALUE);
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 100, 1, 10_000);
            ctx.json(api.samplesJson(api.query().samples(offset, limit)));
        });

        app.get("/api/tide-heights/range", ctx -> {
            LocalDate start = api.dayParam(ctx, ctx.queryParam("start"));
            if (start == null)
                return;
            LocalDate end = api.dayParam(ctx, ctx.queryParam("end"));
            if (end == null)
                return;
            ctx.json(api.samplesJson(api.query().samplesBetween(start, end)));
        });

        app.get("/api/tides/{date}", ctx -> {
            LocalDate day = api.dayParam(ctx, ctx.pathParam("date"));
            if (day == null)
                return;
            var extremes = api.query().extremes(day);
            if (extremes.isEmpty()) {
                api.notFound(ctx, "No tide data for this date");
                return;
            }
            ctx.json(api.extremesJson(extremes.get()));
        });

        app.get("/api/gate-times", ctx -> {
            EventsByDay all = api.query().allEvents();
            ObjectNode out = api.om().createObjectNode();
            for (Map.Entry<LocalDate, List<CrossingEvent>> e : all.asMap().entrySet()) {
                out.set(e.getKey().toString(), api.eventsJson(e.getValue()));
            }
            ctx.json(out);
        });

        app.get("/api/gate-times/{date}", ctx -> {
            LocalDate day = api.dayParam(ctx, ctx.pathParam("date"));
            if (day == null)
                return;
            Optional<List<CrossingEvent>> events = api.query().events(day);
            if (events.isEmpty()) {
                api.notFound(ctx, "No gate times for this date");
                return;
            }
            ctx.json(api.eventsJson(events.get()));
        });
    }
}
