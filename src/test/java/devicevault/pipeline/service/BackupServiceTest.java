package devicevault.pipeline.service;

import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.broker.QueueRouter;
import devicevault.pipeline.model.CollectionJob;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.scheduler.BackupDispatcher;
import devicevault.pipeline.store.Database;
import devicevault.pipeline.store.JdbcDeviceRepository;
import devicevault.pipeline.support.Fixtures;
import devicevault.pipeline.support.InMemoryJobQueue;
import devicevault.pipeline.support.InMemoryResultStream;
import devicevault.pipeline.support.MutableClock;
import devicevault.pipeline.support.TestDatabases;
import devicevault.pipeline.util.Json;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BackupServiceTest {

    private static Database db;
    private static JdbcDeviceRepository devices;

    private InMemoryJobQueue queue;
    private BackupService service;

    @BeforeAll
    static void setup() {
        db = TestDatabases.inMemory("backup-service");
        devices = new JdbcDeviceRepository(db);
    }

    @AfterAll
    static void teardown() {
        db.close();
    }

    @BeforeEach
    void reset() {
        TestDatabases.clear(db);
        queue = new InMemoryJobQueue();
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:15:30.250Z"));
        BackupDispatcher dispatcher = new BackupDispatcher(
                new Publisher(queue, new InMemoryResultStream(), 1, Duration.ZERO),
                new QueueRouter("collector"), Duration.ofSeconds(240), clock);
        service = new BackupService(devices, dispatcher, clock);
    }

    @Test
    void manualJobUsesDeviceRouting() {
        long groupId = devices.saveCollectionGroup("branch").id();
        Device device = Fixtures.device(devices, "branch-rtr", null, groupId, null);

        CollectionJob job = service.backupNow(device.id()).orElseThrow();

        assertEquals("manual:" + device.id() + ":2024-03-01T10:15:30Z", job.taskIdentifier());
        assertFalse(job.catchUp());
        CollectionJob queued = Json.read(queue.contents("collector.group." + groupId).get(0), CollectionJob.class);
        assertEquals(job.taskId(), queued.taskId());
    }

    @Test
    void unknownDevice() {
        assertTrue(service.backupNow(987654).isEmpty());
    }

    @Test
    void disabledDeviceIsRejected() {
        Device off = devices.save(new Device(0, "sw-off", "10.0.0.9", "noop", false, null, null, null, Map.of(),
                null, null));

        assertThrows(IllegalArgumentException.class, () -> service.backupNow(off.id()));
        assertEquals(0, queue.size("collector"));
    }

    @Test
    void brokerOutageSurfaces() {
        Device device = Fixtures.device(devices, "sw-a", null);
        queue.setUnavailable(true);

        assertThrows(BrokerException.class, () -> service.backupNow(device.id()));
    }
}
