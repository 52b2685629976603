package devicevault.pipeline.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.broker.QueueRouter;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.model.SchedulerState;
import devicevault.pipeline.model.StorageJob;
import devicevault.pipeline.model.StorageLocation;
import devicevault.pipeline.model.StorageReadReply;
import devicevault.pipeline.model.StoredArtifact;
import devicevault.pipeline.retrieval.RetrievalBridge;
import devicevault.pipeline.scheduler.BackupDispatcher;
import devicevault.pipeline.server.PipelineHttpServer;
import devicevault.pipeline.server.RouterHandler;
import devicevault.pipeline.service.ArtifactService;
import devicevault.pipeline.service.BackupService;
import devicevault.pipeline.storage.StorageDispatcher;
import devicevault.pipeline.store.Database;
import devicevault.pipeline.store.JdbcDeviceRepository;
import devicevault.pipeline.store.JdbcSchedulerStateRepository;
import devicevault.pipeline.store.JdbcStorageLocationRepository;
import devicevault.pipeline.store.JdbcStoredArtifactRepository;
import devicevault.pipeline.support.Fixtures;
import devicevault.pipeline.support.InMemoryJobQueue;
import devicevault.pipeline.support.InMemoryResultStream;
import devicevault.pipeline.support.MutableClock;
import devicevault.pipeline.support.TestDatabases;
import devicevault.pipeline.util.Json;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Hits the HTTP API through a real Netty server, with the broker replaced by
 * in-memory queues.
 */
class HttpEndpointIntegrationTest {

    private static Database db;
    private static JdbcDeviceRepository devices;
    private static JdbcStorageLocationRepository locations;
    private static JdbcStoredArtifactRepository artifacts;
    private static JdbcSchedulerStateRepository state;

    private static final AtomicBoolean databaseUp = new AtomicBoolean(true);
    private static final AtomicBoolean brokerUp = new AtomicBoolean(true);
    private static final InMemoryJobQueue queue = new InMemoryJobQueue();

    private static PipelineHttpServer server;
    private static String baseUrl;
    private static HttpClient httpClient;

    private Device device;

    @BeforeAll
    static void startServer() {
        db = TestDatabases.inMemory("http");
        devices = new JdbcDeviceRepository(db);
        locations = new JdbcStorageLocationRepository(db);
        artifacts = new JdbcStoredArtifactRepository(db);
        state = new JdbcSchedulerStateRepository(db);

        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        Publisher publisher = new Publisher(queue, new InMemoryResultStream(), 1, Duration.ZERO);
        BackupService backups = new BackupService(devices,
                new BackupDispatcher(publisher, new QueueRouter("collector"), Duration.ofSeconds(240), clock), clock);
        ArtifactService artifactService = new ArtifactService(artifacts, devices, locations,
                new RetrievalBridge(queue, new StorageDispatcher(publisher), Duration.ofSeconds(1)));

        RouterHandler router = new RouterHandler()
                .registerController(new HealthController(databaseUp::get, brokerUp::get, state))
                .registerController(new BackupController(backups))
                .registerController(new ArtifactController(artifactService));
        server = new PipelineHttpServer(router, "127.0.0.1", 0);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.boundPort();
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterAll
    static void stopServer() {
        server.stop();
        db.close();
    }

    @BeforeEach
    void reset() {
        TestDatabases.clear(db);
        databaseUp.set(true);
        brokerUp.set(true);
        queue.setUnavailable(false);
        queue.onPush((name, payload) -> {
        });
        StorageLocation fs = Fixtures.filesystem(locations, "/srv/backups");
        device = Fixtures.device(devices, "core-sw", null, null, fs.id());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder().uri(URI.create(baseUrl + path))
                .POST(HttpRequest.BodyPublishers.noBody()).build(), HttpResponse.BodyHandlers.ofString());
    }

    private StoredArtifact stored(String identifier, ResultStatus status, String ref) {
        artifacts.save(StoredArtifact.builder()
                .taskId("t-" + identifier)
                .taskIdentifier(identifier)
                .deviceId(device.id())
                .storageBackend("fs")
                .storageRef(ref)
                .status(status)
                .timestamp(Instant.parse("2024-03-01T02:00:11Z"))
                .log(List.of("stored"))
                .build());
        return artifacts.findByTaskIdentifier(identifier).orElseThrow();
    }

    @Test
    void healthReportsSchedulerState() throws Exception {
        state.save(SchedulerState.initial().withTick(Instant.parse("2024-03-01T09:59:00Z"), 77));

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        JsonNode body = Json.mapper().readTree(response.body());
        assertEquals("healthy", body.get("status").asText());
        assertTrue(body.get("schedulerRunning").asBoolean());
        assertEquals("1.0.0", body.get("version").asText());
    }

    @Test
    void healthIs503WhenBrokerIsDown() throws Exception {
        brokerUp.set(false);

        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(503, response.statusCode());
        JsonNode body = Json.mapper().readTree(response.body());
        assertEquals("unhealthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertEquals("connection failed", body.get("broker").asText());
    }

    @Test
    @DisplayName("POST backup answers 202 and leaves one job on the collector queue")
    void backupIsAccepted() throws Exception {
        int before = queue.size("collector");

        HttpResponse<String> response = post("/api/v1/devices/" + device.id() + "/backup");

        assertEquals(202, response.statusCode(), response.body());
        JsonNode body = Json.mapper().readTree(response.body());
        assertEquals("queued", body.get("status").asText());
        assertTrue(body.get("task_identifier").asText().startsWith("manual:" + device.id() + ":"));
        assertEquals(before + 1, queue.size("collector"));
    }

    @Test
    void backupErrors() throws Exception {
        assertEquals(404, post("/api/v1/devices/999999/backup").statusCode());
        assertEquals(400, post("/api/v1/devices/abc/backup").statusCode());

        queue.setUnavailable(true);
        assertEquals(503, post("/api/v1/devices/" + device.id() + "/backup").statusCode());
    }

    @Test
    void listsArtifacts() throws Exception {
        stored("scheduled:1:a", ResultStatus.SUCCESS, "1/a.txt");

        HttpResponse<String> response = get("/api/v1/devices/" + device.id() + "/artifacts?limit=5");

        assertEquals(200, response.statusCode());
        JsonNode body = Json.mapper().readTree(response.body());
        assertEquals(1, body.size());
        assertEquals("1/a.txt", body.get(0).get("storage_ref").asText());
        assertEquals(400, get("/api/v1/devices/" + device.id() + "/artifacts?limit=x").statusCode());
    }

    @Test
    void downloadsContent() throws Exception {
        queue.onPush((name, payload) -> {
            if (name.equals("storage.fs")) {
                StorageJob job = Json.read(payload, StorageJob.class);
                queue.push(job.replyTo(),
                        Json.write(StorageReadReply.success(job.taskId(), "hostname core-sw\n", List.of())));
            }
        });
        StoredArtifact artifact = stored("scheduled:1:a", ResultStatus.SUCCESS, "1/a.txt");

        HttpResponse<String> response = get("/api/v1/artifacts/" + artifact.id() + "/content");

        assertEquals(200, response.statusCode());
        assertEquals("hostname core-sw\n", response.body());
        assertTrue(response.headers().firstValue("content-type").orElse("").startsWith("text/plain"));
    }

    @Test
    void contentErrorsMapToStatuses() throws Exception {
        StoredArtifact failed = stored("scheduled:1:f", ResultStatus.FAILURE, "");
        StoredArtifact unanswered = stored("scheduled:1:u", ResultStatus.SUCCESS, "1/u.txt");

        assertEquals(404, get("/api/v1/artifacts/999999/content").statusCode());
        assertEquals(409, get("/api/v1/artifacts/" + failed.id() + "/content").statusCode());
        assertEquals(504, get("/api/v1/artifacts/" + unanswered.id() + "/content").statusCode());

        queue.onPush((name, payload) -> {
            if (name.equals("storage.fs")) {
                StorageJob job = Json.read(payload, StorageJob.class);
                queue.push(job.replyTo(), Json.write(StorageReadReply.failure(job.taskId(), List.of("read failed"))));
            }
        });
        assertEquals(502, get("/api/v1/artifacts/" + unanswered.id() + "/content").statusCode());
    }

    @Test
    void unknownRouteIs404() throws Exception {
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }
}
