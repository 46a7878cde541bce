package space.ketterling.tidegate.moon;

import com.fasterxml.jackson.databind.JsonNode;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.http.JsonHttp;

import java.util.Map;

/**
 * HTTP client for the FarmSense moon phase API.
 */
public final class MoonPhaseClient {
    public static final String BASE = "https://api.farmsense.net/v1/moonphases/";

    private final JsonHttp http;
    private final String baseUrl;

    public MoonPhaseClient(JsonHttp http) {
        this(http, BASE);
    }

    public MoonPhaseClient(JsonHttp http, String baseUrl) {
        this.http = http;
        this.baseUrl = baseUrl;
    }

    /**
     * Loads the moon phase for one timestamp. The provider answers with a
     * one-element array; the element is returned.
     */
    public JsonNode moonPhase(MoonPhaseKey key) throws FetchException, InterruptedException {
        String url = JsonHttp.url(baseUrl, Map.of("d", key.unixTime()));
        JsonNode root = http.getJson(url, url);

        JsonNode phase = root.isArray() ? root.path(0) : root;
        if (!phase.isObject()) {
            throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE, "FarmSense returned " + root);
        }
        // errors come back as 200 with a non-zero Error field
        if (phase.path("Error").asInt(0) != 0) {
            throw new FetchException(FetchException.Kind.HTTP_STATUS,
                    "FarmSense error: " + phase.path("ErrorMsg").asText("unknown"));
        }
        return phase;
    }
}
