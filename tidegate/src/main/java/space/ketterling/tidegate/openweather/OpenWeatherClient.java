package space.ketterling.tidegate.openweather;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.config.AppConfig;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.http.JsonHttp;
import space.ketterling.tidegate.model.DailyWeather;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the OpenWeather One Call 3.0 daily forecast.
 */
public final class OpenWeatherClient {
    private static final Logger log = LoggerFactory.getLogger(OpenWeatherClient.class);
    public static final String BASE = "https://api.openweathermap.org/data/3.0/onecall";

    private static final String[] TIME_FIELDS = { "dt", "sunrise", "sunset", "moonrise", "moonset" };

    private final JsonHttp http;
    private final String baseUrl;
    private final String apiKey;
    private final double lat;
    private final double lon;
    private final ZoneId zone;

    public OpenWeatherClient(AppConfig cfg, JsonHttp http) {
        this(cfg, http, BASE);
    }

    public OpenWeatherClient(AppConfig cfg, JsonHttp http, String baseUrl) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.apiKey = cfg.openWeatherKey();
        this.lat = cfg.siteLat();
        this.lon = cfg.siteLon();
        this.zone = cfg.clockZoneId();
    }

    /**
     * Loads the daily forecast. Unix times are rewritten to local ISO-8601
     * strings and Beaufort forces are added for wind speed and gusts.
     */
    public DailyWeather fetchDaily() throws FetchException, InterruptedException {
        if (apiKey == null || apiKey.isBlank()) {
            throw FetchException.missingCredential("OpenWeather");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("lat", lat);
        params.put("lon", lon);
        params.put("exclude", "minutely,hourly,alerts,current");
        params.put("units", "metric");
        params.put("appid", apiKey);
        String url = JsonHttp.url(baseUrl, params);

        JsonNode root = http.getJson(url, JsonHttp.redact(url, "appid"));
        JsonNode daily = root.get("daily");
        if (daily == null || !daily.isArray()) {
            throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE, "OpenWeather response has no 'daily'");
        }

        Map<LocalDate, ObjectNode> days = new LinkedHashMap<>();
        for (JsonNode d : daily) {
            if (!d.isObject() || !d.path("dt").isNumber()) {
                throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                        "OpenWeather day without numeric 'dt': " + d);
            }
            ObjectNode day = ((ObjectNode) d).deepCopy();
            LocalDate date = Instant.ofEpochSecond(day.get("dt").asLong()).atZone(zone).toLocalDate();
            for (String f : TIME_FIELDS) {
                JsonNode v = day.get(f);
                if (v != null && v.isNumber()) {
                    day.put(f, Instant.ofEpochSecond(v.asLong()).atZone(zone).toOffsetDateTime().toString());
                }
            }
            day.put("wind_speed_beaufort", Beaufort.fromMetersPerSecond(day.path("wind_speed").asDouble(0.0)));
            if (day.hasNonNull("wind_gust")) {
                day.put("wind_gust_beaufort", Beaufort.fromMetersPerSecond(day.get("wind_gust").asDouble()));
            }
            days.put(date, day);
        }
        log.info("OpenWeather daily forecast: {} days", days.size());
        return DailyWeather.of(days);
    }
}
