package space.ketterling.tidegate.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.tidegate.metrics.ExternalApiMetrics;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * GET-and-parse helper shared by the provider clients.
 *
 * <p>
 * Network errors, 429 and 5xx responses are retried with exponential backoff
 * (honouring a numeric {@code Retry-After}); other 4xx responses fail at once.
 * Every call outcome is recorded in {@link ExternalApiMetrics} under the
 * service name.
 * </p>
 */
public final class JsonHttp {
    private static final Logger log = LoggerFactory.getLogger(JsonHttp.class);
    private static final long MAX_RETRY_AFTER_MS = 60_000L;

    private final HttpClient http;
    private final ObjectMapper om;
    private final String service;
    private final Duration requestTimeout;
    private final int maxAttempts;
    private final Duration initialBackoff;

    public JsonHttp(ObjectMapper om, String service, Duration requestTimeout, int maxAttempts,
            Duration initialBackoff) {
        this.om = om;
        this.service = service;
        this.requestTimeout = requestTimeout;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff;
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String service() {
        return service;
    }

    /**
     * Executes a GET request and parses the body as JSON.
     *
     * @param logUrl URL safe to log (API keys removed)
     */
    public JsonNode getJson(String url, String logUrl) throws FetchException, InterruptedException {
        long backoffMs = initialBackoff.toMillis();
        FetchException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();

            HttpResponse<String> resp;
            try {
                log.debug("{} request -> {} attempt={}", service, logUrl, attempt);
                resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                ExternalApiMetrics.record(service, false);
                log.warn("{} request exception for url={} attempt={} err={}", service, logUrl, attempt,
                        e.getMessage());
                last = new FetchException(FetchException.Kind.NETWORK,
                        service + " request failed: " + logUrl, e);
                if (attempt < maxAttempts) {
                    Thread.sleep(backoffMs);
                    backoffMs *= 2;
                }
                continue;
            }

            int code = resp.statusCode();
            if (code >= 200 && code < 300) {
                ExternalApiMetrics.record(service, true);
                log.debug("{} response {} for {}", service, code, logUrl);
                try {
                    return om.readTree(resp.body());
                } catch (JsonProcessingException e) {
                    throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                            service + " returned invalid JSON for " + logUrl, e);
                }
            }

            ExternalApiMetrics.record(service, false);
            last = new FetchException(FetchException.Kind.HTTP_STATUS,
                    service + " request failed: " + code + " url=" + logUrl, code, null);
            if (code != 429 && (code < 500 || code >= 600)) {
                throw last;
            }
            if (attempt < maxAttempts) {
                long waitMs = retryAfterMs(resp).orElse(backoffMs);
                log.warn("{} transient failure code={} url={} attempt={}, waiting {}ms", service, code, logUrl,
                        attempt, waitMs);
                Thread.sleep(waitMs);
                backoffMs *= 2;
            }
        }
        throw last;
    }

    private static OptionalLong retryAfterMs(HttpResponse<?> resp) {
        String ra = resp.headers().firstValue("Retry-After").orElse(null);
        if (ra == null)
            return OptionalLong.empty();
        try {
            long ms = Long.parseLong(ra.trim()) * 1000L;
            return OptionalLong.of(Math.min(Math.max(0L, ms), MAX_RETRY_AFTER_MS));
        } catch (NumberFormatException nfe) {
            // HTTP-date form, fall back to exponential backoff
            return OptionalLong.empty();
        }
    }

    /**
     * Builds {@code base?k=v&...} with URL-encoded values. A null value adds
     * a bare flag ({@code &k}).
     */
    public static String url(String base, Map<String, ?> params) {
        StringJoiner q = new StringJoiner("&");
        for (var e : params.entrySet()) {
            if (e.getValue() == null) {
                q.add(enc(e.getKey()));
            } else {
                q.add(enc(e.getKey()) + "=" + enc(String.valueOf(e.getValue())));
            }
        }
        String qs = q.toString();
        return qs.isEmpty() ? base : base + "?" + qs;
    }

    /**
     * Replaces the value of {@code param} in a URL for logging.
     */
    public static String redact(String url, String param) {
        return url.replaceAll("([?&]" + Pattern.quote(param) + "=)[^&]*", "$1***");
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
