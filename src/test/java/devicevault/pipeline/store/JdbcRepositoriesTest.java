package devicevault.pipeline.store;

import devicevault.pipeline.model.Cadence;
import devicevault.pipeline.model.CollectionGroup;
import devicevault.pipeline.model.CollectionResult;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.ResultStatus;
import devicevault.pipeline.model.Schedule;
import devicevault.pipeline.model.SchedulerState;
import devicevault.pipeline.model.StorageLocation;
import devicevault.pipeline.model.StoredArtifact;
import devicevault.pipeline.support.Fixtures;
import devicevault.pipeline.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRepositoriesTest {

    private static Database db;
    private static JdbcScheduleRepository schedules;
    private static JdbcDeviceRepository devices;
    private static JdbcStorageLocationRepository locations;
    private static JdbcCollectionResultRepository results;
    private static JdbcStoredArtifactRepository artifacts;
    private static JdbcSchedulerStateRepository state;

    @BeforeAll
    static void setup() {
        db = TestDatabases.inMemory("repositories");
        schedules = new JdbcScheduleRepository(db);
        devices = new JdbcDeviceRepository(db);
        locations = new JdbcStorageLocationRepository(db);
        results = new JdbcCollectionResultRepository(db);
        artifacts = new JdbcStoredArtifactRepository(db);
        state = new JdbcSchedulerStateRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() {
        TestDatabases.clear(db);
    }

    private static CollectionResult result(String identifier, long deviceId, Instant at) {
        return CollectionResult.builder()
                .taskId("t-" + identifier)
                .taskIdentifier(identifier)
                .deviceId(deviceId)
                .status(ResultStatus.SUCCESS)
                .timestamp(at)
                .log(List.of("connected", "done"))
                .build();
    }

    @Test
    void scheduleInsertAndUpdate() {
        Schedule weekly = schedules.save(Schedule.builder()
                .name("Sunday night")
                .cadence(Cadence.WEEKLY)
                .hour(23)
                .minute(30)
                .dayOfWeek(6)
                .build());
        assertTrue(weekly.id() > 0);

        schedules.save(weekly.toBuilder().enabled(false).build());

        Schedule loaded = schedules.findById(weekly.id()).orElseThrow();
        assertEquals(Cadence.WEEKLY, loaded.cadence());
        assertEquals(6, loaded.dayOfWeek());
        assertNull(loaded.dayOfMonth());
        assertFalse(loaded.enabled());
        assertTrue(schedules.findEnabled().isEmpty());
    }

    @Test
    void updateRunTimes() {
        Schedule daily = Fixtures.daily(schedules, "Daily", 2, 0);
        Instant last = Instant.parse("2024-03-01T02:00:00Z");
        Instant next = Instant.parse("2024-03-02T02:00:00Z");

        assertTrue(schedules.updateRunTimes(daily.id(), last, next));

        Schedule loaded = schedules.findById(daily.id()).orElseThrow();
        assertEquals(last, loaded.lastRunAt());
        assertEquals(next, loaded.nextRunAt());
        assertFalse(schedules.updateRunTimes(424242, last, next));
    }

    @Test
    void devicesKeepCredentialsAndGroup() {
        CollectionGroup group = devices.saveCollectionGroup("dc-east");
        StorageLocation fs = Fixtures.filesystem(locations, "/srv/backups");
        Schedule daily = Fixtures.daily(schedules, "Daily", 2, 0);

        Device saved = devices.save(new Device(0, "core-sw", "10.1.1.1", "noop", true, daily.id(), group.id(),
                fs.id(), Map.of("username", "backup", "port", 22), null, null));

        Device loaded = devices.findById(saved.id()).orElseThrow();
        assertEquals(group.id(), loaded.collectionGroupId());
        assertEquals(fs.id(), loaded.storageLocationId());
        assertEquals("backup", loaded.credentials().get("username"));
        assertEquals("dc-east", devices.findCollectionGroup(group.id()).orElseThrow().name());
        assertEquals("/srv/backups", locations.findById(fs.id()).orElseThrow().config().get("path"));
    }

    @Test
    void enabledDevicesBySchedule() {
        Schedule daily = Fixtures.daily(schedules, "Daily", 2, 0);
        Device a = Fixtures.device(devices, "sw-a", daily.id());
        devices.save(new Device(0, "sw-off", "10.0.0.9", "noop", false, daily.id(), null, null, Map.of(), null,
                null));
        Fixtures.device(devices, "sw-other", null);

        List<Device> found = devices.findEnabledBySchedule(daily.id());

        assertEquals(1, found.size());
        assertEquals(a.id(), found.get(0).id());
    }

    @Test
    @DisplayName("Saving a result twice under the same task identifier reports a duplicate")
    void duplicateResultIsRejected() {
        Device device = Fixtures.device(devices, "sw-a", null);
        Instant at = Instant.parse("2024-03-01T02:00:05Z");

        assertTrue(results.save(result("scheduled:1:a", device.id(), at)));
        assertFalse(results.save(result("scheduled:1:a", device.id(), at)));
        assertTrue(results.existsByTaskIdentifier("scheduled:1:a"));
        assertEquals(List.of("connected", "done"),
                results.findByTaskIdentifier("scheduled:1:a").orElseThrow().log());
    }

    @Test
    void resultsNewestFirst() {
        Device device = Fixtures.device(devices, "sw-a", null);
        results.save(result("r-1", device.id(), Instant.parse("2024-03-01T02:00:00Z")));
        results.save(result("r-3", device.id(), Instant.parse("2024-03-03T02:00:00Z")));
        results.save(result("r-2", device.id(), Instant.parse("2024-03-02T02:00:00Z")));

        List<CollectionResult> found = results.findByDevice(device.id(), 2);

        assertEquals(List.of("r-3", "r-2"), found.stream().map(CollectionResult::taskIdentifier).toList());
    }

    @Test
    void overallDurationUpdate() {
        Device device = Fixtures.device(devices, "sw-a", null);
        results.save(result("r-1", device.id(), Instant.now()));

        assertTrue(results.updateOverallDuration("r-1", 4_500));
        assertEquals(4_500L, results.findByTaskIdentifier("r-1").orElseThrow().overallDurationMs());
        assertFalse(results.updateOverallDuration("missing", 1));
    }

    @Test
    void artifactsAreUniquePerTask() {
        Device device = Fixtures.device(devices, "sw-a", null);
        StoredArtifact artifact = StoredArtifact.builder()
                .taskId("t-1")
                .taskIdentifier("scheduled:1:a")
                .deviceId(device.id())
                .storageBackend("fs")
                .storageRef("1/a.txt")
                .status(ResultStatus.SUCCESS)
                .timestamp(Instant.parse("2024-03-01T02:00:11Z"))
                .log(List.of())
                .build();

        assertTrue(artifacts.save(artifact));
        assertFalse(artifacts.save(artifact));

        StoredArtifact loaded = artifacts.findByTaskIdentifier("scheduled:1:a").orElseThrow();
        assertEquals(loaded.storageRef(), artifacts.findById(loaded.id()).orElseThrow().storageRef());
        assertEquals(1, artifacts.findByDevice(device.id(), 10).size());
    }

    @Test
    void schedulerStateRowIsCreatedOnFirstLoad() {
        assertEquals(SchedulerState.initial(), state.load());

        Instant tick = Instant.parse("2024-06-09T15:30:00Z");
        state.save(SchedulerState.initial().withTick(tick, 4242).withRestart(tick));

        SchedulerState loaded = state.load();
        assertEquals(tick, loaded.lastTick());
        assertTrue(loaded.running());
        assertEquals(4242L, loaded.ownerPid());
        assertEquals(tick, loaded.lastRestartAt());
    }
}
