package devicevault.pipeline.api.v1;

import devicevault.pipeline.api.Controller;
import devicevault.pipeline.api.v1.dto.ArtifactResponse;
import devicevault.pipeline.model.StoredArtifact;
import devicevault.pipeline.retrieval.RetrievalException;
import devicevault.pipeline.server.RouterHandler;
import devicevault.pipeline.service.ArtifactService;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stored artifacts (public API).
 *
 * GET /api/v1/devices/{id}/artifacts?limit=N - artifact index for a device, newest first
 * GET /api/v1/artifacts/{id}/content - synchronous download through the storage worker
 */
public class ArtifactController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ArtifactController.class);

    private static final Pattern DEVICE_ARTIFACTS_PATTERN = Pattern.compile("^/api/v1/devices/([^/]+)/artifacts$");
    private static final Pattern CONTENT_PATTERN = Pattern.compile("^/api/v1/artifacts/([^/]+)/content$");
    private static final int DEFAULT_LIMIT = 50;

    private final ArtifactService artifactService;

    public ArtifactController(ArtifactService artifactService) {
        this.artifactService = artifactService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.GET)) {
            return false;
        }
        return DEVICE_ARTIFACTS_PATTERN.matcher(path).matches() || CONTENT_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            Matcher listMatcher = DEVICE_ARTIFACTS_PATTERN.matcher(path);
            if (listMatcher.matches()) {
                return handleList(PathIds.parse(listMatcher.group(1), "device"), req);
            }

            Matcher contentMatcher = CONTENT_PATTERN.matcher(path);
            if (contentMatcher.matches()) {
                return handleContent(PathIds.parse(contentMatcher.group(1), "artifact"));
            }

            return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "unknown artifact endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.error(HttpResponseStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Artifact controller error", e);
            return ControllerResponse.error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
        }
    }

    private ControllerResponse handleList(long deviceId, FullHttpRequest req) throws Exception {
        int limit = DEFAULT_LIMIT;
        List<String> limitParam = new QueryStringDecoder(req.uri()).parameters().get("limit");
        if (limitParam != null && !limitParam.isEmpty()) {
            try {
                limit = Integer.parseInt(limitParam.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid limit: " + limitParam.get(0));
            }
        }

        List<ArtifactResponse> artifacts = artifactService.listForDevice(deviceId, limit).stream()
                .map(ArtifactResponse::from)
                .toList();
        return ControllerResponse.ok(RouterHandler.mapper().writeValueAsString(artifacts));
    }

    private ControllerResponse handleContent(long artifactId) {
        Optional<StoredArtifact> artifact = artifactService.findById(artifactId);
        if (artifact.isEmpty()) {
            return ControllerResponse.error(HttpResponseStatus.NOT_FOUND, "artifact not found: " + artifactId);
        }

        try {
            return ControllerResponse.text(artifactService.content(artifact.get()));
        } catch (RetrievalException e) {
            log.warn("Retrieval of artifact {} failed ({}): {}", artifactId, e.reason(), e.getMessage());
            switch (e.reason()) {
                case TIMEOUT:
                    return ControllerResponse.error(HttpResponseStatus.GATEWAY_TIMEOUT, e.getMessage());
                case NOT_RETRIEVABLE:
                    return ControllerResponse.error(HttpResponseStatus.CONFLICT, e.getMessage());
                default:
                    return ControllerResponse.error(HttpResponseStatus.BAD_GATEWAY, e.getMessage());
            }
        }
    }
}
