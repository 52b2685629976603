package devicevault.pipeline.api.v1;

import devicevault.pipeline.api.Controller;
import devicevault.pipeline.api.v1.dto.BackupResponse;
import devicevault.pipeline.broker.BrokerException;
import devicevault.pipeline.model.CollectionJob;
import devicevault.pipeline.server.RouterHandler;
import devicevault.pipeline.service.BackupService;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * On-demand backups.
 *
 * POST /api/v1/devices/{id}/backup - enqueue a collection job, 202 with its task identifier
 */
public class BackupController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(BackupController.class);

    private static final Pattern BACKUP_PATTERN = Pattern.compile("^/api/v1/devices/([^/]+)/backup$");

    private final BackupService backupService;

    public BackupController(BackupService backupService) {
        this.backupService = backupService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && BACKUP_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        Matcher matcher = BACKUP_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "unknown backup endpoint");
        }

        try {
            long deviceId = PathIds.parse(matcher.group(1), "device");
            Optional<CollectionJob> job = backupService.backupNow(deviceId);
            if (job.isEmpty()) {
                return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "device not found: " + deviceId);
            }
            return ControllerResponse.json(HttpResponseStatus.ACCEPTED,
                    RouterHandler.mapper().writeValueAsString(BackupResponse.from(job.get())));

        } catch (IllegalArgumentException e) {
            return ControllerResponse.error(HttpResponseStatus.BAD_REQUEST, e.getMessage());
        } catch (BrokerException e) {
            log.error("Failed to enqueue on-demand backup for {}", path, e);
            return ControllerResponse.error(HttpResponseStatus.SERVICE_UNAVAILABLE, "job queue unavailable");
        } catch (Exception e) {
            log.error("Backup controller error", e);
            return ControllerResponse.error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
        }
    }
}
