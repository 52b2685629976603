package devicevault.pipeline.api.v1;

import devicevault.pipeline.api.Controller;
import devicevault.pipeline.api.v1.dto.HealthResponse;
import devicevault.pipeline.broker.RedisConnection;
import devicevault.pipeline.model.SchedulerState;
import devicevault.pipeline.repository.SchedulerStateRepository;
import devicevault.pipeline.server.RouterHandler;
import devicevault.pipeline.store.Database;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final BooleanSupplier databaseHealthy;
    private final BooleanSupplier brokerHealthy;
    private final SchedulerStateRepository stateRepository;

    public HealthController(Database database, RedisConnection redis, SchedulerStateRepository stateRepository) {
        this(database::isHealthy, redis::isHealthy, stateRepository);
    }

    HealthController(BooleanSupplier databaseHealthy, BooleanSupplier brokerHealthy,
            SchedulerStateRepository stateRepository) {
        this.databaseHealthy = databaseHealthy;
        this.brokerHealthy = brokerHealthy;
        this.stateRepository = stateRepository;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            boolean dbOk = databaseHealthy.getAsBoolean();
            boolean brokerOk = brokerHealthy.getAsBoolean();

            if (!dbOk || !brokerOk) {
                HealthResponse response = HealthResponse.unhealthy(
                        dbOk ? "ok" : "connection failed",
                        brokerOk ? "ok" : "connection failed");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            SchedulerState state = stateRepository.load();
            HealthResponse response = HealthResponse.healthy(
                    formatUptime(), VERSION, state.running(), state.lastTick());

            return ControllerResponse.ok(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.error(HttpResponseStatus.SERVICE_UNAVAILABLE, e.getMessage());
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
