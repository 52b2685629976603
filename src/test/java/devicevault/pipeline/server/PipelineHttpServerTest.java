package devicevault.pipeline.server;

import devicevault.pipeline.api.Controller;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PipelineHttpServerTest {

    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    private PipelineHttpServer server;
    private HttpClient httpClient;
    private String baseUrl;

    /** Holds its request until the test releases it, like a download waiting on a storage worker. */
    private class WaitingController implements Controller {
        @Override
        public boolean matches(HttpMethod method, String path) {
            return "/slow".equals(path);
        }

        @Override
        public ControllerResponse handle(FullHttpRequest req, String path) {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ControllerResponse.text("done");
        }
    }

    private static class PingController implements Controller {
        @Override
        public boolean matches(HttpMethod method, String path) {
            return "/ping".equals(path);
        }

        @Override
        public ControllerResponse handle(FullHttpRequest req, String path) {
            return ControllerResponse.ok("{\"ok\":true}");
        }
    }

    @BeforeEach
    void start() {
        RouterHandler router = new RouterHandler()
                .registerController(new WaitingController())
                .registerController(new PingController());
        // a single I/O thread: every connection shares one event loop
        server = new PipelineHttpServer(router, "127.0.0.1", 0, 1, 4);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.boundPort();
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void stop() {
        release.countDown();
        server.stop();
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).timeout(Duration.ofSeconds(15)).GET().build();
    }

    @Test
    @DisplayName("A request blocked in a controller does not hold up other connections")
    void blockedControllerLeavesEventLoopFree() throws Exception {
        CompletableFuture<HttpResponse<String>> slow =
                httpClient.sendAsync(get("/slow"), HttpResponse.BodyHandlers.ofString());
        assertTrue(entered.await(5, TimeUnit.SECONDS), "slow request never reached its controller");

        long started = System.nanoTime();
        HttpResponse<String> ping = httpClient.send(get("/ping"), HttpResponse.BodyHandlers.ofString());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(200, ping.statusCode());
        assertTrue(elapsedMs < 2000, "ping took " + elapsedMs + "ms");
        assertFalse(slow.isDone());

        release.countDown();
        HttpResponse<String> slowResponse = slow.get(5, TimeUnit.SECONDS);
        assertEquals(200, slowResponse.statusCode());
        assertEquals("done", slowResponse.body());
    }

    @Test
    void errorBodiesAreJson() throws Exception {
        HttpResponse<String> response = httpClient.send(get("/missing"), HttpResponse.BodyHandlers.ofString());

        assertEquals(HttpResponseStatus.NOT_FOUND.code(), response.statusCode());
        assertEquals("{\"error\":\"not found\"}", response.body());
    }
}
