package devicevault.pipeline.api;

import devicevault.pipeline.util.Json;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Map;
import java.util.Objects;

/**
 * One slice of the HTTP API. The router offers each request to the
 * registered controllers in order; the first one that matches answers it.
 */
public interface Controller {

    boolean matches(HttpMethod method, String path);

    /**
     * Runs on the router's handler threads, never on a Netty I/O thread, so
     * it may block.
     *
     * @param path request path with the query string removed
     */
    ControllerResponse handle(FullHttpRequest req, String path);

    record ControllerResponse(HttpResponseStatus status, String contentType, String body) {

        public static ControllerResponse ok(String json) {
            return json(HttpResponseStatus.OK, json);
        }

        public static ControllerResponse json(HttpResponseStatus status, String json) {
            return new ControllerResponse(status, "application/json", json);
        }

        public static ControllerResponse text(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "text/plain", body);
        }

        /** {@code {"error": message}} with the given status. */
        public static ControllerResponse error(HttpResponseStatus status, String message) {
            return json(status, Json.write(Map.of("error", Objects.toString(message, ""))));
        }
    }
}
