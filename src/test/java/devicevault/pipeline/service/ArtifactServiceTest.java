package devicevault.pipeline.service;

import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.model.StorageJob;
import devicevault.pipeline.model.StorageLocation;
import devicevault.pipeline.model.StorageReadReply;
import devicevault.pipeline.model.StoredArtifact;
import devicevault.pipeline.retrieval.RetrievalBridge;
import devicevault.pipeline.retrieval.RetrievalException;
import devicevault.pipeline.storage.StorageDispatcher;
import devicevault.pipeline.store.Database;
import devicevault.pipeline.store.JdbcDeviceRepository;
import devicevault.pipeline.store.JdbcStorageLocationRepository;
import devicevault.pipeline.store.JdbcStoredArtifactRepository;
import devicevault.pipeline.support.Fixtures;
import devicevault.pipeline.support.InMemoryJobQueue;
import devicevault.pipeline.support.InMemoryResultStream;
import devicevault.pipeline.support.TestDatabases;
import devicevault.pipeline.util.Json;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactServiceTest {

    private static Database db;
    private static JdbcDeviceRepository devices;
    private static JdbcStorageLocationRepository locations;
    private static JdbcStoredArtifactRepository artifacts;

    private InMemoryJobQueue queue;
    private ArtifactService service;
    private Device device;

    @BeforeAll
    static void setup() {
        db = TestDatabases.inMemory("artifact-service");
        devices = new JdbcDeviceRepository(db);
        locations = new JdbcStorageLocationRepository(db);
        artifacts = new JdbcStoredArtifactRepository(db);
    }

    @AfterAll
    static void teardown() {
        db.close();
    }

    @BeforeEach
    void reset() {
        TestDatabases.clear(db);
        queue = new InMemoryJobQueue();
        Publisher publisher = new Publisher(queue, new InMemoryResultStream(), 1, Duration.ZERO);
        RetrievalBridge bridge = new RetrievalBridge(queue, new StorageDispatcher(publisher), Duration.ofSeconds(1));
        service = new ArtifactService(artifacts, devices, locations, bridge);
        StorageLocation fs = Fixtures.filesystem(locations, "/srv/backups");
        device = Fixtures.device(devices, "core-sw", null, null, fs.id());
    }

    private StoredArtifact stored(String identifier, ResultStatus status, String ref, Instant at) {
        artifacts.save(StoredArtifact.builder()
                .taskId("t-" + identifier)
                .taskIdentifier(identifier)
                .deviceId(device.id())
                .storageBackend("fs")
                .storageRef(ref)
                .status(status)
                .timestamp(at)
                .log(List.of())
                .build());
        return artifacts.findByTaskIdentifier(identifier).orElseThrow();
    }

    @Test
    void listsNewestFirstWithinLimit() {
        stored("a", ResultStatus.SUCCESS, "1/a.txt", Instant.parse("2024-03-01T02:00:00Z"));
        stored("b", ResultStatus.SUCCESS, "1/b.txt", Instant.parse("2024-03-02T02:00:00Z"));
        stored("c", ResultStatus.FAILURE, "", Instant.parse("2024-03-03T02:00:00Z"));

        List<StoredArtifact> listed = service.listForDevice(device.id(), 2);

        assertEquals(List.of("c", "b"), listed.stream().map(StoredArtifact::taskIdentifier).toList());
        assertThrows(IllegalArgumentException.class, () -> service.listForDevice(device.id(), 0));
    }

    @Test
    void contentIsReadWithLocationConfig() {
        queue.onPush((name, payload) -> {
            if (name.equals("storage.fs")) {
                StorageJob job = Json.read(payload, StorageJob.class);
                String content = job.storageConfig().get("path") + "/" + job.storageRef();
                queue.push(job.replyTo(), Json.write(StorageReadReply.success(job.taskId(), content, List.of())));
            }
        });
        StoredArtifact artifact = stored("a", ResultStatus.SUCCESS, "1/a.txt", Instant.now());

        assertEquals("/srv/backups/1/a.txt", service.content(artifact));
    }

    @Test
    void failedArtifactIsNotRetrievable() {
        StoredArtifact artifact = stored("f", ResultStatus.FAILURE, "", Instant.now());

        RetrievalException e = assertThrows(RetrievalException.class, () -> service.content(artifact));

        assertEquals(RetrievalException.Reason.NOT_RETRIEVABLE, e.reason());
        assertEquals(0, queue.size("storage.fs"));
    }

    @Test
    void noWorkerMeansTimeout() {
        StoredArtifact artifact = stored("a", ResultStatus.SUCCESS, "1/a.txt", Instant.now());

        RetrievalException e = assertThrows(RetrievalException.class, () -> service.content(artifact));

        assertEquals(RetrievalException.Reason.TIMEOUT, e.reason());
    }
}
