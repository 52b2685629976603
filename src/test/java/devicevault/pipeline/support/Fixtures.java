package devicevault.pipeline.support;

import devicevault.pipeline.model.Cadence;
import devicevault.pipeline.model.Device;
import devicevault.pipeline.model.Schedule;
import devicevault.pipeline.model.StorageLocation;
import devicevault.pipeline.repository.DeviceRepository;
import devicevault.pipeline.repository.ScheduleRepository;
import devicevault.pipeline.repository.StorageLocationRepository;

import java.util.Map;

/**
 * Small builders for rows most tests need.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Schedule daily(ScheduleRepository repo, String name, int hour, int minute) {
        return repo.save(Schedule.builder()
                .name(name)
                .cadence(Cadence.DAILY)
                .hour(hour)
                .minute(minute)
                .build());
    }

    public static Device device(DeviceRepository repo, String name, Long scheduleId, Long groupId,
            Long locationId) {
        return repo.save(new Device(0, name, "10.0.0." + Math.abs(name.hashCode() % 200), "noop", true,
                scheduleId, groupId, locationId, Map.of("username", "backup"), null, null));
    }

    public static Device device(DeviceRepository repo, String name, Long scheduleId) {
        return device(repo, name, scheduleId, null, null);
    }

    public static StorageLocation filesystem(StorageLocationRepository repo, String path) {
        return repo.save(new StorageLocation(0, "local", "fs", Map.of("path", path)));
    }
}
