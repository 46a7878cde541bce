package space.ketterling.tidegate.marine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import space.ketterling.tidegate.StubServer;
import space.ketterling.tidegate.http.FetchException;
import space.ketterling.tidegate.http.JsonHttp;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MarineClientTest {
    private final StubServer server;
    private final MarineClient client;

    MarineClientTest() throws Exception {
        server = new StubServer();
        JsonHttp http = new JsonHttp(new ObjectMapper(), "open-meteo", Duration.ofSeconds(5), 1, Duration.ZERO);
        client = new MarineClient(http, server.url("/v1/marine"));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void sendsAllKeyFields() throws Exception {
        server.respond(200, """
                {"latitude":53.25,"longitude":-3.833,"hourly_units":{"time":"unixtime"},
                 "hourly":{"time":[1750032000,1750035600],"sea_level_height_msl":[1.2,1.5]}}""");

        JsonNode n = client.marine(MarineKey.defaults(53.28, -3.83));

        assertEquals(1.5, n.path("hourly").path("sea_level_height_msl").get(1).asDouble());
        String q = server.queries().get(0);
        assertTrue(q.contains("latitude=53.28"), q);
        assertTrue(q.contains("longitude=-3.83"), q);
        assertTrue(q.contains("hourly=sea_level_height_msl%2Cocean_current_velocity%2Cocean_current_direction"), q);
        assertTrue(q.contains("timeformat=unixtime"), q);
        assertTrue(q.contains("forecast_hours=48"), q);
    }

    @Test
    void errorBodyIsFailure() {
        server.respond(200, "{\"error\":true,\"reason\":\"Cannot initialize WeatherVariable\"}");

        FetchException e = assertThrows(FetchException.class,
                () -> client.marine(new MarineKey(53.28, -3.83, "bogus", "unixtime", 48)));

        assertEquals(FetchException.Kind.HTTP_STATUS, e.kind());
        assertTrue(e.getMessage().contains("WeatherVariable"));
    }

    @Test
    void badRequestStatusIsNotRetried() {
        server.respond(400, "{\"error\":true,\"reason\":\"bad\"}");

        FetchException e = assertThrows(FetchException.class,
                () -> client.marine(MarineKey.defaults(91, 0)));

        assertEquals(400, e.httpStatus());
        assertEquals(1, server.requestCount());
    }
}
