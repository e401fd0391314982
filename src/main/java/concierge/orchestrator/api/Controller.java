package concierge.orchestrator.api;

import concierge.orchestrator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body,
            Map<String, String> headers) {

        public ControllerResponse {
            headers = headers == null ? Map.of() : Map.copyOf(headers);
        }

        public ControllerResponse(HttpResponseStatus status, String contentType, String body) {
            this(status, contentType, body, Map.of());
        }

        public ControllerResponse withHeader(String name, String value) {
            Map<String, String> copy = new LinkedHashMap<>(headers);
            copy.put(name, value);
            return new ControllerResponse(status, contentType, body, copy);
        }

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /** Serialize a value with the shared mapper */
        public static ControllerResponse json(HttpResponseStatus status, Object value) {
            return new ControllerResponse(status, "application/json", Json.write(value));
        }

        public static ControllerResponse notFound(String message) {
            return errorBody(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return errorBody(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return errorBody(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse forbidden(String message) {
            return errorBody(HttpResponseStatus.FORBIDDEN, message);
        }

        public static ControllerResponse conflict(String message) {
            return errorBody(HttpResponseStatus.CONFLICT, message);
        }

        private static ControllerResponse errorBody(HttpResponseStatus status, String message) {
            return json(status, Map.of("success", false, "error", message != null ? message : ""));
        }
    }
}
