package devicevault.pipeline.scheduler;

import devicevault.pipeline.broker.Publisher;
import devicevault.pipeline.broker.QueueRouter;
import devicevault.pipeline.model.CollectionJob;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.Schedule;
import devicevault.pipeline.repository.DeviceRepository;
import devicevault.pipeline.repository.ScheduleRepository;
import devicevault.pipeline.store.Database;
import devicevault.pipeline.store.JdbcDeviceRepository;
import devicevault.pipeline.store.JdbcScheduleRepository;
import devicevault.pipeline.support.Fixtures;
import devicevault.pipeline.support.InMemoryJobQueue;
import devicevault.pipeline.support.InMemoryResultStream;
import devicevault.pipeline.support.MutableClock;
import devicevault.pipeline.support.TestDatabases;
import devicevault.pipeline.util.Json;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleTickerTest {

    private static Database db;
    private static ScheduleRepository schedules;
    private static DeviceRepository devices;

    private InMemoryJobQueue queue;
    private ScheduleTicker ticker;

    @BeforeAll
    static void setup() {
        db = TestDatabases.inMemory("ticker");
        schedules = new JdbcScheduleRepository(db);
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
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T02:00:30Z"));
        BackupDispatcher dispatcher = new BackupDispatcher(
                new Publisher(queue, new InMemoryResultStream(), 1, Duration.ZERO),
                new QueueRouter("collector"), Duration.ofSeconds(240), clock);
        ticker = new ScheduleTicker(schedules, devices, dispatcher, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("A due schedule enqueues exactly one job per enabled device")
    void oneJobPerDevice() {
        Schedule daily = Fixtures.daily(schedules, "Daily 02:00", 2, 0);
        Device a = Fixtures.device(devices, "sw-a", daily.id());
        Device b = Fixtures.device(devices, "sw-b", daily.id());
        Device disabled = devices.save(new Device(0, "sw-off", "10.0.0.9", "noop", false, daily.id(), null, null,
                Map.of(), null, null));

        Instant now = Instant.parse("2024-03-01T02:00:30Z");
        ScheduleTicker.Report report = ticker.tick(Instant.parse("2024-03-01T01:59:30Z"), now);

        assertEquals(1, report.schedulesDue());
        assertEquals(2, report.jobsDispatched());
        List<CollectionJob> jobs = queue.contents("collector").stream()
                .map(p -> Json.read(p, CollectionJob.class))
                .toList();
        assertEquals(2, jobs.size());
        assertEquals(List.of(a.id(), b.id()), jobs.stream().map(CollectionJob::deviceId).sorted().toList());
        assertTrue(jobs.stream().noneMatch(j -> j.deviceId() == disabled.id()));
        assertEquals("scheduled:" + a.id() + ":2024-03-01T02:00:30Z",
                jobs.stream().filter(j -> j.deviceId() == a.id()).findFirst().orElseThrow().taskIdentifier());
        assertTrue(jobs.stream().noneMatch(CollectionJob::catchUp));

        Schedule updated = schedules.findById(daily.id()).orElseThrow();
        assertEquals(now, updated.lastRunAt());
        assertEquals(Instant.parse("2024-03-02T02:00:00Z"), updated.nextRunAt());
    }

    @Test
    void nothingDueOutsideWindow() {
        Schedule daily = Fixtures.daily(schedules, "Daily 02:00", 2, 0);
        Fixtures.device(devices, "sw-a", daily.id());

        ScheduleTicker.Report report = ticker.tick(Instant.parse("2024-03-01T02:00:30Z"),
                Instant.parse("2024-03-01T02:01:30Z"));

        assertEquals(0, report.jobsDispatched());
        assertEquals(0, queue.size("collector"));
    }

    @Test
    @DisplayName("A second tick over the same window does not dispatch again")
    void noDuplicateAcrossTicks() {
        Schedule daily = Fixtures.daily(schedules, "Daily 02:00", 2, 0);
        Fixtures.device(devices, "sw-a", daily.id());

        Instant now = Instant.parse("2024-03-01T02:00:30Z");
        ticker.tick(Instant.parse("2024-03-01T01:59:30Z"), now);
        // window start lagging behind last_run_at is bounded by last_run_at
        ScheduleTicker.Report again = ticker.tick(Instant.parse("2024-03-01T01:59:30Z"), now.plusSeconds(60));

        assertEquals(0, again.jobsDispatched());
        assertEquals(1, queue.size("collector"));
    }

    @Test
    void severalOccurrencesInOneWindowDispatchOnce() {
        Schedule cron = schedules.save(Schedule.builder()
                .name("every 5m")
                .cadence(devicevault.pipeline.model.Cadence.CRON)
                .cronExpression("*/5 * * * *")
                .build());
        Fixtures.device(devices, "sw-a", cron.id());

        ScheduleTicker.Report report = ticker.tick(Instant.parse("2024-03-01T01:00:00Z"),
                Instant.parse("2024-03-01T01:30:00Z"));

        assertEquals(1, report.jobsDispatched());
    }

    @Test
    void groupedDevicesGoToTheirGroupQueue() {
        Schedule daily = Fixtures.daily(schedules, "Daily 02:00", 2, 0);
        long groupId = devices.saveCollectionGroup("dmz").id();
        Fixtures.device(devices, "fw-dmz", daily.id(), groupId, null);

        ticker.tick(Instant.parse("2024-03-01T01:59:30Z"), Instant.parse("2024-03-01T02:00:30Z"));

        assertEquals(1, queue.size(QueueRouter.groupQueue(groupId)));
        assertEquals(0, queue.size("collector"));
    }

    @Test
    void scheduleWithoutDevicesOnlyRefreshesNextRun() {
        Schedule daily = Fixtures.daily(schedules, "empty", 2, 0);

        ScheduleTicker.Report report = ticker.tick(Instant.parse("2024-03-01T01:59:30Z"),
                Instant.parse("2024-03-01T02:00:30Z"));

        assertEquals(0, report.schedulesDue());
        Schedule updated = schedules.findById(daily.id()).orElseThrow();
        assertNull(updated.lastRunAt());
        assertEquals(Instant.parse("2024-03-02T02:00:00Z"), updated.nextRunAt());
    }

    @Test
    void brokerOutageDoesNotAdvanceOtherSchedules() {
        Schedule daily = Fixtures.daily(schedules, "Daily 02:00", 2, 0);
        Fixtures.device(devices, "sw-a", daily.id());
        queue.setUnavailable(true);

        ScheduleTicker.Report report = ticker.tick(Instant.parse("2024-03-01T01:59:30Z"),
                Instant.parse("2024-03-01T02:00:30Z"));

        assertEquals(1, report.schedulesDue());
        assertEquals(0, report.jobsDispatched());
    }
}
