package space.ketterling.tidegate.marine;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.http.JsonHttp;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the Open-Meteo marine forecast.
 */
public final class MarineClient {
    private static final Logger log = LoggerFactory.getLogger(MarineClient.class);
    public static final String BASE = "https://api.open-meteo.com/v1/marine";

    private final JsonHttp http;
    private final String baseUrl;

    public MarineClient(JsonHttp http) {
        this(http, BASE);
    }

    public MarineClient(JsonHttp http, String baseUrl) {
        this.http = http;
        this.baseUrl = baseUrl;
    }

    public JsonNode marine(MarineKey key) throws FetchException, InterruptedException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("latitude", key.lat());
        params.put("longitude", key.lon());
        params.put("hourly", key.hourly());
        params.put("timeformat", key.timeformat());
        params.put("forecast_hours", key.forecastHours());
        String url = JsonHttp.url(baseUrl, params);

        JsonNode root = http.getJson(url, url);
        if (root.path("error").asBoolean(false)) {
            throw new FetchException(FetchException.Kind.HTTP_STATUS,
                    "Open-Meteo error: " + root.path("reason").asText("unknown"));
        }
        if (!root.has("hourly")) {
            throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE, "Open-Meteo response has no 'hourly'");
        }
        log.debug("Open-Meteo marine: {} hourly variables for {},{}", root.get("hourly").size(), key.lat(),
                key.lon());
        return root;
    }
}
