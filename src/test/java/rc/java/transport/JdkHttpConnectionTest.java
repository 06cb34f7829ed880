package rc.java.transport;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import rc.core.model.FailureClassification;
import rc.core.model.FailureClassification.Reason;
import rc.core.model.HttpMethod;
import rc.core.model.Request;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JdkHttpConnectionTest {

    private HttpServer server;
    private boolean stopped;
    private String base;
    private final AtomicReference<String> seenContentType = new AtomicReference<>();
    private final AtomicReference<String> seenBody = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/echo", exchange -> {
            seenContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            seenBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] out = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.getResponseHeaders().add("X-Trace", "abc");
            exchange.sendResponseHeaders(201, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
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
    }

    @Test
    void sendsBodyAndReadsResponse() throws Exception {
        JdkHttpConnection connection = new JdkHttpConnection(base, Duration.ofSeconds(2));
        Request request = Request.post(base + "/echo")
            .header("Host", "ignored.example.com")
            .body("{\"n\":1}".getBytes(StandardCharsets.UTF_8), "application/json")
            .build();

        RawResponse response = connection.send(request, Duration.ofSeconds(2)).get(5, TimeUnit.SECONDS);

        assertEquals(201, response.statusCode());
        assertEquals("application/json", response.contentType());
        assertEquals("abc", response.header("x-trace").orElseThrow());
        assertEquals("{\"ok\":true}", new String(response.body(), StandardCharsets.UTF_8));
        assertEquals("application/json", seenContentType.get());
        assertEquals("{\"n\":1}", seenBody.get());
        connection.close();
    }

    @Test
    void requestTimeoutIsTransientAndAmbiguous() {
        JdkHttpConnection connection = new JdkHttpConnection(base, Duration.ofSeconds(2));
        Request request = Request.get(base + "/slow").build();

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> connection.send(request, Duration.ofMillis(100)).get(5, TimeUnit.SECONDS));
        FailureClassification f = NetworkErrorClassifier.classify(e);
        assertEquals(Reason.TIMEOUT, f.reason());
        assertEquals(FailureClassification.Exposure.AMBIGUOUS, f.exposure());
    }

    @Test
    void refusedConnectionIsTransientAndUnsent() {
        stopServer();
        JdkHttpConnection connection = new JdkHttpConnection(base, Duration.ofSeconds(2));
        Request request = Request.builder(HttpMethod.GET, URI.create(base + "/echo")).build();

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> connection.send(request, Duration.ofSeconds(2)).get(5, TimeUnit.SECONDS));
        FailureClassification f = NetworkErrorClassifier.classify(e);
        assertTrue(f.isTransient());
        assertEquals(FailureClassification.Exposure.NOT_SENT, f.exposure());
    }

    @Test
    void closedConnectionFailsFast() {
        JdkHttpConnection connection = new JdkHttpConnection(base, Duration.ofSeconds(2));
        connection.close();
        assertFalse(connection.isAlive());

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> connection.send(Request.get(base + "/echo").build(), Duration.ofSeconds(1)).get());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
