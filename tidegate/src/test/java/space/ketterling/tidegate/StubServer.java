package space.ketterling.tidegate;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Local HTTP server standing in for an external provider. Responses are
 * served in the order they were queued; the last one repeats.
 */
public final class StubServer implements AutoCloseable {
    private final HttpServer server;
    private final Deque<Response> responses = new ArrayDeque<>();
    private final List<String> queries = new CopyOnWriteArrayList<>();

    public StubServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    public String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    public StubServer respond(int status, String body) {
        return respond(status, body, null);
    }

    public synchronized StubServer respond(int status, String body, String retryAfter) {
        responses.addLast(new Response(status, body, retryAfter));
        return this;
    }

    /**
     * Raw query strings of every request received, in order.
     */
    public List<String> queries() {
        return queries;
    }

    public int requestCount() {
        return queries.size();
    }

    private void handle(HttpExchange ex) throws IOException {
        String q = ex.getRequestURI().getRawQuery();
        queries.add(q == null ? "" : q);
        Response r;
        synchronized (this) {
            r = responses.size() > 1 ? responses.pollFirst() : responses.peekFirst();
        }
        if (r == null)
            r = new Response(500, "{\"error\":\"no stub response\"}", null);
        byte[] bytes = r.body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json");
        if (r.retryAfter != null)
            ex.getResponseHeaders().add("Retry-After", r.retryAfter);
        ex.sendResponseHeaders(r.status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private record Response(int status, String body, String retryAfter) {
    }
}
