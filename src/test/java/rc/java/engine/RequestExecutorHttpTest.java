package rc.java.engine;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rc.core.error.RetriesExhaustedException;
import rc.core.model.FailureClassification.Exposure;
import rc.core.model.Request;
import rc.core.model.Response;
import rc.core.normalize.FormBody;
import rc.core.normalize.FormCodec;
import rc.core.normalize.FormField;
import rc.core.normalize.JsonBody;
import rc.core.normalize.XmlBody;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end over a local HTTP server with the default {@link java.net.http.HttpClient} transport.
 */
class RequestExecutorHttpTest {

    private HttpServer server;
    private ExecutorService handlers;
    private boolean stopped;
    private String base;
    private final AtomicInteger flakyCalls = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        handlers = Executors.newFixedThreadPool(16);
        server.setExecutor(handlers);
        server.createContext("/json", exchange -> reply(exchange, 200, "application/json; charset=utf-8",
            "{\"accept\":\"" + exchange.getRequestHeaders().getFirst("Accept") + "\"}"));
        server.createContext("/xml", exchange -> reply(exchange, 200, "application/xml",
            "<user id=\"7\"><name>Ada</name></user>"));
        server.createContext("/form", exchange -> {
            byte[] echoed = exchange.getRequestBody().readAllBytes();
            reply(exchange, 200, FormCodec.CONTENT_TYPE, new String(echoed, StandardCharsets.US_ASCII));
        });
        server.createContext("/flaky", exchange -> {
            if (flakyCalls.incrementAndGet() < 3) {
                reply(exchange, 503, "application/json", "{\"error\":\"busy\"}");
            } else {
                reply(exchange, 200, "application/json", "{\"ok\":true}");
            }
        });
        server.createContext("/slow", exchange -> {
            peakActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                active.decrementAndGet();
            }
            reply(exchange, 200, "application/json", "{}");
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        if (!stopped) {
            stopped = true;
            server.stop(0);
        }
        handlers.shutdownNow();
    }

    private static void reply(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static ExecutorConfig.Builder config() {
        return ExecutorConfig.builder()
            .baseDelay(Duration.ofMillis(20))
            .maxDelay(Duration.ofMillis(200))
            .defaultTimeout(Duration.ofSeconds(20));
    }

    @Test
    void jsonWithDefaultAcceptHeader() {
        try (RequestExecutor executor = new RequestExecutor(config().build())) {
            Response response = executor.execute(Request.get(base + "/json").build());
            JsonBody body = assertInstanceOf(JsonBody.class, response.body());
            assertEquals("application/json", body.value().get("accept").asText());
        }
    }

    @Test
    void xmlIsParsed() {
        try (RequestExecutor executor = new RequestExecutor(config().build())) {
            XmlBody body = assertInstanceOf(XmlBody.class,
                executor.execute(Request.get(base + "/xml").build()).body());
            assertEquals("7", body.root().attribute("id").orElseThrow());
            assertEquals("Ada", body.root().child("name").orElseThrow().text());
        }
    }

    @Test
    void formRequestAndResponse() {
        List<FormField> fields = List.of(new FormField("q", "a b"), new FormField("q", "c&d"));
        Request post = Request.post(base + "/form").body(FormCodec.encode(fields), FormCodec.CONTENT_TYPE).build();

        try (RequestExecutor executor = new RequestExecutor(config().build())) {
            FormBody body = assertInstanceOf(FormBody.class, executor.execute(post).body());
            assertEquals(fields, body.fields());
        }
    }

    @Test
    void transientStatusesAreRetriedOverRealConnections() {
        try (RequestExecutor executor = new RequestExecutor(config().build())) {
            Response response = executor.execute(Request.get(base + "/flaky").build());
            assertEquals(3, response.attempts());
        }
        assertEquals(3, flakyCalls.get());
    }

    @Test
    void refusedConnectionExhaustsRetries() {
        String closed = base;
        stopServer();

        try (RequestExecutor executor = new RequestExecutor(config().maxAttempts(2).build())) {
            RetriesExhaustedException e = assertThrows(RetriesExhaustedException.class,
                () -> executor.execute(Request.get(closed + "/json").build()));
            assertEquals(2, e.attempts());
            assertEquals(Exposure.NOT_SENT, e.classification().orElseThrow().exposure());
        }
    }

    @Test
    void concurrentBatchRespectsConnectionLimit() {
        List<Request> batch = new ArrayList<>();
        for (int i = 0; i < 24; i++) batch.add(Request.get(base + "/slow?i=" + i).build());

        ExecutorConfig cfg = config()
            .maxConcurrentRequests(8)
            .maxConnectionsPerHost(3)
            .rateCapacity(100)
            .rateRefillPerSecond(1_000)
            .build();
        try (RequestExecutor executor = new RequestExecutor(cfg)) {
            BatchResult result = executor.executeAll(batch);
            assertTrue(result.allSucceeded(), () -> "failures: " + result.failures());
            assertEquals(24, result.successes().size());
        }
        assertTrue(peakActive.get() <= 3, "peak concurrent exchanges " + peakActive.get());
    }
}
