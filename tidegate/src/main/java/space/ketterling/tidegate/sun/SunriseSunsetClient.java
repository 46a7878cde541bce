package space.ketterling.tidegate.sun;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.http.JsonHttp;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for api.sunrise-sunset.org.
 */
public final class SunriseSunsetClient {
    public static final String BASE = "https://api.sunrise-sunset.org/json";

    private final JsonHttp http;
    private final String baseUrl;
    private final ZoneId zone;

    public SunriseSunsetClient(JsonHttp http, ZoneId zone) {
        this(http, zone, BASE);
    }

    public SunriseSunsetClient(JsonHttp http, ZoneId zone, String baseUrl) {
        this.http = http;
        this.zone = zone;
        this.baseUrl = baseUrl;
    }

    /**
     * Loads sunrise/sunset times (UTC ISO-8601) for a location and date. The
     * response is tagged with the local zone id as {@code tzid}.
     */
    public JsonNode sunTimes(SunTimesKey key) throws FetchException, InterruptedException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("lat", key.lat());
        params.put("lng", key.lng());
        params.put("date", key.date().toString());
        params.put("formatted", 0);
        String url = JsonHttp.url(baseUrl, params);

        JsonNode root = http.getJson(url, url);
        if (!root.isObject()) {
            throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE, "sunrise-sunset returned " + root);
        }
        String status = root.path("status").asText("OK");
        if (!"OK".equals(status)) {
            throw new FetchException(FetchException.Kind.HTTP_STATUS, "sunrise-sunset status " + status + " for " + url);
        }
        ObjectNode out = (ObjectNode) root;
        out.put("tzid", zone.getId());
        return out;
    }
}
