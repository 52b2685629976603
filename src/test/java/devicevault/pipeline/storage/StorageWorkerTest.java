package devicevault.pipeline.storage;

import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.model.StorageJob;
import devicevault.pipeline.model.StorageLocation;
import devicevault.pipeline.model.StorageReadReply;
import devicevault.pipeline.model.StorageResultMessage;
import devicevault.pipeline.support.InMemoryJobQueue;
import devicevault.pipeline.support.InMemoryResultStream;
import devicevault.pipeline.support.MutableClock;
import devicevault.pipeline.util.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StorageWorkerTest {

    private static final String STREAM = "storage:results";

    @TempDir
    Path base;

    private InMemoryJobQueue queue;
    private InMemoryResultStream stream;
    private StorageWorker worker;
    private StorageLocation location;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue();
        stream = new InMemoryResultStream();
        worker = new StorageWorker(queue, new Publisher(queue, stream, 1, Duration.ZERO),
                StorageBackendRegistry.withDefaults(), List.of("fs"), STREAM, Duration.ofSeconds(120),
                new MutableClock(Instant.parse("2024-03-01T02:01:00Z")));
        location = new StorageLocation(1, "local", "fs", Map.of("path", base.toString()));
    }

    @Test
    void pathHintSanitizesIdentifier() {
        assertEquals("7/scheduled-7-2024-03-01T02-00-00Z.txt",
                StorageWorker.pathHint(7L, "scheduled:7:2024-03-01T02:00:00Z"));
        assertEquals("unknown/job.txt", StorageWorker.pathHint(null, ""));
    }

    @Test
    void storePublishesReference() throws Exception {
        StorageJob job = StorageJob.store("t-1", "scheduled:7:2024-03-01T02:00:00Z", 7, location,
                "config text", Instant.parse("2024-03-01T02:00:00Z"));

        worker.handle(Json.write(job));

        Map<String, String> fields = stream.entries(STREAM).get(0).fields();
        assertEquals("success", fields.get("status"));
        assertEquals("store", fields.get("operation"));
        assertEquals("fs", fields.get("storage_backend"));
        assertEquals("7/scheduled-7-2024-03-01T02-00-00Z.txt", fields.get("storage_ref"));
        assertEquals("config text", Files.readString(base.resolve(fields.get("storage_ref"))));
    }

    @Test
    void emptyContentIsAFailure() {
        StorageResultMessage result = worker.store(StorageJob.store("t-1", "manual:7:x", 7, location, "",
                Instant.now()));
        assertEquals("failure", result.status());
        assertEquals(List.of("device_config missing; nothing to store"), result.log());
        assertEquals("", result.storageRef());
    }

    @Test
    void unsupportedBackendIsAFailure() {
        StorageLocation s3 = new StorageLocation(2, "cloud", "s3", Map.of());
        StorageResultMessage result = worker.store(StorageJob.store("t-1", "manual:7:x", 7, s3, "data",
                Instant.now()));
        assertEquals("failure", result.status());
        assertEquals("unsupported storage backend: s3", result.log().get(0));
    }

    @Test
    @DisplayName("Read replies go to the reply queue, which gets an expiry")
    void readRepliesOnReplyQueue() {
        String ref = new FilesystemStorageBackend().store("stored text", "7/a.txt", location.config());
        StorageJob read = StorageJob.read("r-1", "read:" + ref, "fs", ref, location.config(), "storage:reply:r-1");

        worker.handle(Json.write(read));

        StorageReadReply reply = Json.read(queue.contents("storage:reply:r-1").get(0), StorageReadReply.class);
        assertTrue(reply.isSuccess());
        assertEquals("stored text", reply.content());
        assertEquals(Duration.ofSeconds(120), queue.expiryOf("storage:reply:r-1").orElseThrow());
        assertTrue(stream.entries(STREAM).isEmpty());
    }

    @Test
    void failedReadIsRepliedAndPublished() {
        StorageJob read = StorageJob.read("r-2", "read:7/missing.txt", "fs", "7/missing.txt", location.config(),
                "storage:reply:r-2");

        StorageReadReply reply = worker.read(read);

        assertFalse(reply.isSuccess());
        assertEquals(1, queue.size("storage:reply:r-2"));
        Map<String, String> fields = stream.entries(STREAM).get(0).fields();
        assertEquals("read", fields.get("operation"));
        assertEquals("failure", fields.get("status"));
    }

    @Test
    void listensOnStorageQueuesPerBackend() {
        assertThrows(IllegalArgumentException.class, () -> new StorageWorker(queue, new Publisher(queue, stream),
                StorageBackendRegistry.withDefaults(), List.of(), STREAM, Duration.ofSeconds(1),
                new MutableClock(Instant.now())));
    }
}
