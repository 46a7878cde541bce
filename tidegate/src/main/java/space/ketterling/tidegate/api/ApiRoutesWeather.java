package space.ketterling.tidegate.api;

import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.marine.MarineKey;

import java.time.LocalDate;

/**
 * Routes for the daily forecast and the on-demand sun, moon and marine
 * lookups.
 */
final class ApiRoutesWeather {
    private static final Logger log = LoggerFactory.getLogger(ApiRoutesWeather.class);

    private ApiRoutesWeather() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get("/api/weather/{date}", ctx -> {
            LocalDate day = api.dayParam(ctx, ctx.pathParam("date"));
            if (day == null)
                return;
            var weather = api.query().weather(day);
            if (weather.isEmpty()) {
                api.notFound(ctx, "Weather data not found");
                return;
            }
            ctx.json(weather.get());
        });

        app.get("/api/sunrise-sunset", ctx -> {
            LocalDate day = api.dayParam(ctx, ctx.queryParam("date"));
            if (day == null)
                return;
            double lat = ApiServer.parseDouble(ctx.queryParam("lat"), api.cfg().siteLat());
            double lng = ApiServer.parseDouble(ctx.queryParam("lng"), api.cfg().siteLon());
            try {
                ctx.json(api.query().sunTimes(lat, lng, day));
            } catch (FetchException e) {
                log.warn("Sunrise/sunset lookup failed for {},{} {}: {}", lat, lng, day, e.getMessage());
                ctx.status(502).json(api.error("sunrise_sunset_unavailable"));
            }
        });

        app.get("/api/moon-phase", ctx -> {
            LocalDate day = api.dayParam(ctx, ctx.queryParam("date"));
            if (day == null)
                return;
            try {
                ctx.json(api.query().moonPhase(day));
            } catch (FetchException e) {
                log.warn("Moon phase lookup failed for {}: {}", day, e.getMessage());
                ctx.status(502).json(api.error("moon_phase_unavailable"));
            }
        });

        app.get("/api/marine", ctx -> {
            String timeformat = ctx.queryParam("timeformat");
            if (timeformat == null || timeformat.isBlank())
                timeformat = MarineKey.DEFAULT_TIMEFORMAT;
            if (!timeformat.equals("unixtime") && !timeformat.equals("iso8601")) {
                ctx.status(400).json(api.error("timeformat must be unixtime or iso8601"));
                return;
            }
            String hourly = ctx.queryParam("hourly");
            if (hourly == null || hourly.isBlank())
                hourly = MarineKey.DEFAULT_HOURLY;
            MarineKey key = new MarineKey(
                    ApiServer.parseDouble(ctx.queryParam("lat"), api.cfg().siteLat()),
                    ApiServer.parseDouble(ctx.queryParam("lon"), api.cfg().siteLon()),
                    hourly.trim(),
                    timeformat,
                    ApiServer.parseInt(ctx.queryParam("forecast_hours"), MarineKey.DEFAULT_FORECAST_HOURS, 1, 384));
            try {
                ctx.json(api.query().marine(key));
            } catch (FetchException e) {
                log.warn("Marine forecast failed for {}: {}", key, e.getMessage());
                ctx.status(502).json(api.error("marine_unavailable"));
            }
        });
    }
}
