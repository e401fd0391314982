package concierge.orchestrator.api.v1;

import concierge.orchestrator.api.Controller;
import concierge.orchestrator.api.v1.dto.HealthResponse;
import concierge.orchestrator.model.RunStatus;
import concierge.orchestrator.service.RunService;
import concierge.orchestrator.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final RunService runService;

    public HealthController(Database database, RunService runService) {
        this.database = database;
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            // Check database connectivity
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        HealthResponse.unhealthy("connection failed"));
            }

            Map<String, Integer> runs = new LinkedHashMap<>();
            for (Map.Entry<RunStatus, Integer> entry : runService.countsByStatus().entrySet()) {
                runs.put(entry.getKey().wireName(), entry.getValue());
            }

            return ControllerResponse.json(HttpResponseStatus.OK,
                    HealthResponse.healthy(formatUptime(), VERSION, runs));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
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
