package concierge.orchestrator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import concierge.orchestrator.api.Controller;
import concierge.orchestrator.api.internal.v1.dto.CommisActivityRequest;
import concierge.orchestrator.api.internal.v1.dto.CommisCompleteRequest;
import concierge.orchestrator.api.internal.v1.dto.CommisFailRequest;
import concierge.orchestrator.api.internal.v1.dto.OperationResponse;
import concierge.orchestrator.model.CommisReportResult;
import concierge.orchestrator.service.CommisReport;
import concierge.orchestrator.service.RunService;
import concierge.orchestrator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for commis reports from external workers (internal API).
 * POST /internal/v1/commis/{commisId}/complete - Report success (idempotent)
 * POST /internal/v1/commis/{commisId}/fail - Report failure (idempotent)
 * POST /internal/v1/commis/{commisId}/activity - Record tool activity
 */
public class CommisController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CommisController.class);

    private static final Pattern COMPLETE_PATTERN = Pattern.compile("^/internal/v1/commis/([^/]+)/complete$");
    private static final Pattern FAIL_PATTERN = Pattern.compile("^/internal/v1/commis/([^/]+)/fail$");
    private static final Pattern ACTIVITY_PATTERN = Pattern.compile("^/internal/v1/commis/([^/]+)/activity$");

    private final RunService runService;

    public CommisController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return COMPLETE_PATTERN.matcher(path).matches()
                || FAIL_PATTERN.matcher(path).matches()
                || ACTIVITY_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);

            Matcher completeMatcher = COMPLETE_PATTERN.matcher(path);
            if (completeMatcher.matches()) {
                CommisCompleteRequest request = Json.mapper().readValue(body, CommisCompleteRequest.class);
                request.validate();
                return respond(runService.completeCommis(completeMatcher.group(1), request.result()));
            }

            Matcher failMatcher = FAIL_PATTERN.matcher(path);
            if (failMatcher.matches()) {
                CommisFailRequest request = Json.mapper().readValue(body, CommisFailRequest.class);
                request.validate();
                return respond(runService.failCommis(failMatcher.group(1), request.error()));
            }

            Matcher activityMatcher = ACTIVITY_PATTERN.matcher(path);
            if (activityMatcher.matches()) {
                CommisActivityRequest request = Json.mapper().readValue(body, CommisActivityRequest.class);
                request.validate();
                boolean recorded = runService.recordCommisActivity(activityMatcher.group(1),
                        request.eventType(), request.toolName(), request.details());
                return recorded
                        ? ControllerResponse.json(HttpResponseStatus.OK, OperationResponse.success())
                        : ControllerResponse.json(HttpResponseStatus.CONFLICT,
                                OperationResponse.error("commis unknown or already reported"));
            }

            return ControllerResponse.notFound("unknown commis endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Commis controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse respond(CommisReport report) {
        if (report.outcome() == CommisReportResult.NOT_FOUND) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND, OperationResponse.commisNotFound());
        }
        return ControllerResponse.json(HttpResponseStatus.OK, OperationResponse.from(report));
    }
}
