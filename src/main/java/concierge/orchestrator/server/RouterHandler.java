package concierge.orchestrator.server;

import concierge.orchestrator.api.Controller;
import concierge.orchestrator.api.Controller.ControllerResponse;
import concierge.orchestrator.config.OrchestratorConfig;
import concierge.orchestrator.repository.RunNotFoundException;
import concierge.orchestrator.service.RunBusyException;
import concierge.orchestrator.util.Json;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (internal worker API, optional shared key)
 *
 * All other endpoints return 404. WebSocket upgrades on /ws are consumed
 * earlier in the pipeline and never reach this handler.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    public static final String AGENT_KEY_HEADER = "X-Concierge-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final OrchestratorConfig config;

    public RouterHandler(OrchestratorConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            // Check auth for internal endpoints
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                write(ctx, ControllerResponse.forbidden("forbidden"));
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    write(ctx, controller.handle(ctx, req, path));
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            write(ctx, ControllerResponse.notFound("not found"));

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            write(ctx, ControllerResponse.badRequest(e.getMessage()));
        } catch (RunNotFoundException e) {
            write(ctx, ControllerResponse.notFound(e.getMessage()));
        } catch (RunBusyException e) {
            log.warn("Rejected {} {}: {}", method, path, e.getMessage());
            write(ctx, ControllerResponse.conflict(e.getMessage()));
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            write(ctx, ControllerResponse.error("internal error"));
        }
    }

    /**
     * Check if request requires and passes auth.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasAgentKey()) {
            return true; // No auth configured
        }

        // Only internal endpoints require auth
        if (!path.startsWith("/internal/")) {
            return true;
        }

        String providedKey = req.headers().get(AGENT_KEY_HEADER);
        return config.agentKey().equals(providedKey);
    }

    /**
     * Write the response. Failures are logged and the connection closed.
     */
    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        try {
            String body = response.body() != null ? response.body() : "";
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse httpResponse = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                    Unpooled.wrappedBuffer(bytes));
            httpResponse.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
            httpResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            for (Map.Entry<String, String> header : response.headers().entrySet()) {
                httpResponse.headers().set(header.getKey(), header.getValue());
            }
            ctx.writeAndFlush(httpResponse);
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            write(ctx, new ControllerResponse(INTERNAL_SERVER_ERROR, "application/json",
                    Json.write(Map.of("success", false, "error", "channel error"))));
        } finally {
            ctx.close();
        }
    }
}
