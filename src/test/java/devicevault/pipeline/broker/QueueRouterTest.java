package devicevault.pipeline.broker;

import devicevault.pipeline.model.Device;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueueRouterTest {

    private final QueueRouter router = new QueueRouter("collector");

    private static Device device(Long groupId) {
        return new Device(5, "sw-5", "10.0.0.5", "noop", true, 1L, groupId, null, Map.of(), null, null);
    }

    @Test
    void groupedDevicesUseGroupQueue() {
        assertEquals("collector.group.12", router.collectorQueue(device(12L)));
    }

    @Test
    void ungroupedDevicesUseDefaultQueue() {
        assertEquals("collector", router.collectorQueue(device(null)));
    }

    @Test
    void storageQueueIsNormalized() {
        assertEquals("storage.fs", QueueRouter.storageQueue(" FS "));
        assertThrows(IllegalArgumentException.class, () -> QueueRouter.storageQueue(""));
    }
}
