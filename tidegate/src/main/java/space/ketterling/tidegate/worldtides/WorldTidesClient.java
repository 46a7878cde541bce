package space.ketterling.tidegate.worldtides;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.config.AppConfig;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.http.JsonHttp;
import space.ketterling.tidegate.ingest.SampleFetcher;
import space.ketterling.tidegate.model.ByDay;
import space.ketterling.tidegate.model.Sample;
import space.ketterling.tidegate.model.SampleSeries;
import space.ketterling.tidegate.model.TideExtreme;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the WorldTides v3 API.
 *
 * <p>
 * Heights come back as one series for the whole window; extremes are
 * requested in chunks of at most {@code extremesChunkDays} days and joined.
 * </p>
 */
public final class WorldTidesClient implements SampleFetcher {
    private static final Logger log = LoggerFactory.getLogger(WorldTidesClient.class);
    public static final String BASE = "https://www.worldtides.info/api/v3";

    private final JsonHttp http;
    private final String baseUrl;
    private final String apiKey;
    private final double lat;
    private final double lon;
    private final ZoneId zone;
    private final int extremesChunkDays;

    public WorldTidesClient(AppConfig cfg, JsonHttp http) {
        this(cfg, http, BASE);
    }

    public WorldTidesClient(AppConfig cfg, JsonHttp http, String baseUrl) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.apiKey = cfg.worldTidesKey();
        this.lat = cfg.siteLat();
        this.lon = cfg.siteLon();
        this.zone = cfg.clockZoneId();
        this.extremesChunkDays = cfg.tideExtremesChunkDays();
    }

    /**
     * Fetches tide heights (chart datum) for {@code windowDays} days from
     * {@code windowStart}.
     */
    @Override
    public SampleSeries fetchSamples(LocalDate windowStart, int windowDays)
            throws FetchException, InterruptedException {
        JsonNode root = get("heights", windowStart, windowDays, true);
        JsonNode arr = requireArray(root, "heights");

        List<Sample> out = new ArrayList<>(arr.size());
        for (JsonNode h : arr) {
            out.add(Sample.ofEpochSeconds(requireNumber(h, "dt"), requireNumber(h, "height")));
        }
        log.info("WorldTides heights: {} samples from {} for {} days", out.size(), windowStart, windowDays);
        return SampleSeries.of(out);
    }

    /**
     * Fetches high/low water predictions grouped by local day.
     */
    public ByDay<TideExtreme> fetchExtremes(LocalDate windowStart, int windowDays)
            throws FetchException, InterruptedException {
        ByDay.Builder<TideExtreme> out = new ByDay.Builder<>();
        LocalDate end = windowStart.plusDays(windowDays);
        LocalDate current = windowStart;
        int chunks = 0;
        while (current.isBefore(end)) {
            int chunkDays = (int) Math.min(extremesChunkDays,
                    ChronoUnit.DAYS.between(current, end));
            JsonNode arr = requireArray(get("extremes", current, chunkDays, false), "extremes");
            for (JsonNode e : arr) {
                Sample s = Sample.ofEpochSeconds(requireNumber(e, "dt"), requireNumber(e, "height"));
                TideExtreme.Type type;
                try {
                    type = TideExtreme.Type.parse(e.path("type").asText(null));
                } catch (IllegalArgumentException iae) {
                    throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                            "WorldTides extreme with unknown type: " + e.path("type"), iae);
                }
                out.add(s.timestamp().atZone(zone).toLocalDate(), new TideExtreme(s.timestamp(), s.value(), type));
            }
            current = current.plusDays(chunkDays);
            chunks++;
        }
        ByDay<TideExtreme> built = out.build();
        log.info("WorldTides extremes: {} events in {} chunks from {}", built.size(), chunks, windowStart);
        return built;
    }

    private JsonNode get(String kind, LocalDate start, int days, boolean chartDatum)
            throws FetchException, InterruptedException {
        if (apiKey == null || apiKey.isBlank()) {
            throw FetchException.missingCredential("WorldTides");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(kind, null);
        params.put("lat", lat);
        params.put("lon", lon);
        params.put("date", start.toString());
        params.put("days", days);
        if (chartDatum)
            params.put("datum", "CD");
        params.put("key", apiKey);

        String url = JsonHttp.url(baseUrl, params);
        JsonNode root = http.getJson(url, JsonHttp.redact(url, "key"));

        // errors can arrive as HTTP 200 with a status/error body
        if (root.hasNonNull("error")) {
            int status = root.path("status").asInt(-1);
            throw new FetchException(FetchException.Kind.HTTP_STATUS,
                    "WorldTides error: " + root.get("error").asText(), status, null);
        }
        return root;
    }

    private static JsonNode requireArray(JsonNode root, String field) throws FetchException {
        JsonNode arr = root.get(field);
        if (arr == null || !arr.isArray()) {
            throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                    "WorldTides response has no '" + field + "' array");
        }
        return arr;
    }

    private static double requireNumber(JsonNode n, String field) throws FetchException {
        JsonNode v = n.get(field);
        if (v == null || !v.isNumber()) {
            throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                    "WorldTides entry missing numeric '" + field + "': " + n);
        }
        return v.asDouble();
    }
}
