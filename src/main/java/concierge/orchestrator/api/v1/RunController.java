package concierge.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import concierge.orchestrator.api.Controller;
import concierge.orchestrator.api.v1.dto.CommisResponse;
import concierge.orchestrator.api.v1.dto.CreateRunRequest;
import concierge.orchestrator.api.v1.dto.FanOutRequest;
import concierge.orchestrator.api.v1.dto.RunEventResponse;
import concierge.orchestrator.api.v1.dto.RunResponse;
import concierge.orchestrator.model.Commis;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.model.RunEvent;
import concierge.orchestrator.repository.RunNotFoundException;
import concierge.orchestrator.service.RunBusyException;
import concierge.orchestrator.service.RunCreation;
import concierge.orchestrator.service.RunService;
import concierge.orchestrator.util.CorrelationIds;
import concierge.orchestrator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for runs (public API).
 *
 * POST /api/v1/runs - Start a run (idempotent with Idempotency-Key)
 * GET /api/v1/runs - Recent runs
 * GET /api/v1/runs/{runId} - Run status
 * GET /api/v1/runs/{runId}/events?after=N - Ordered events after a watermark
 * GET /api/v1/runs/{runId}/commis - Commis of the run
 * POST /api/v1/runs/{runId}/fan-out - Spawn commis and wait
 */
public class RunController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    public static final String TENANT_HEADER = "X-Tenant-Id";

    private static final Pattern RUNS_PATTERN = Pattern.compile("^/api/v1/runs$");
    private static final Pattern RUN_BY_ID_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)$");
    private static final Pattern RUN_EVENTS_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/events$");
    private static final Pattern RUN_COMMIS_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/commis$");
    private static final Pattern RUN_FAN_OUT_PATTERN = Pattern.compile("^/api/v1/runs/([^/]+)/fan-out$");

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return RUNS_PATTERN.matcher(path).matches()
                    || RUN_FAN_OUT_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return RUNS_PATTERN.matcher(path).matches()
                    || RUN_BY_ID_PATTERN.matcher(path).matches()
                    || RUN_EVENTS_PATTERN.matcher(path).matches()
                    || RUN_COMMIS_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            QueryStringDecoder query = new QueryStringDecoder(req.uri());

            if (RUNS_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST)
                        ? handleCreateRun(req)
                        : handleListRuns(query);
            }

            Matcher fanOutMatcher = RUN_FAN_OUT_PATTERN.matcher(path);
            if (fanOutMatcher.matches()) {
                return handleFanOut(req, fanOutMatcher.group(1));
            }

            Matcher eventsMatcher = RUN_EVENTS_PATTERN.matcher(path);
            if (eventsMatcher.matches()) {
                return handleGetEvents(eventsMatcher.group(1), query);
            }

            Matcher commisMatcher = RUN_COMMIS_PATTERN.matcher(path);
            if (commisMatcher.matches()) {
                return handleGetCommis(commisMatcher.group(1));
            }

            Matcher runMatcher = RUN_BY_ID_PATTERN.matcher(path);
            if (runMatcher.matches()) {
                return handleGetRun(runMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown run endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (RunNotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (RunBusyException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (Exception e) {
            log.error("Run controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/runs - 201 with the new run, or 200 with the run that
     * already holds the idempotency key
     */
    private ControllerResponse handleCreateRun(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateRunRequest request = Json.mapper().readValue(body, CreateRunRequest.class);

        RunCreation creation = runService.createRun(request.toRunRequest(
                req.headers().get(IDEMPOTENCY_KEY_HEADER),
                req.headers().get(CorrelationIds.HEADER),
                req.headers().get(TENANT_HEADER)));

        Run run = creation.run();
        HttpResponseStatus status = creation.created() ? HttpResponseStatus.CREATED : HttpResponseStatus.OK;
        return ControllerResponse.json(status, RunResponse.from(run))
                .withHeader(CorrelationIds.HEADER, run.correlationId())
                .withHeader("Location", "/api/v1/runs/" + run.id());
    }

    /**
     * GET /api/v1/runs?limit=N&createdAfter=ISO
     */
    private ControllerResponse handleListRuns(QueryStringDecoder query) {
        Integer limit = intParam(query, "limit");
        Instant createdAfter = instantParam(query, "createdAfter");

        List<RunResponse> runs = runService.listRuns(createdAfter, limit).stream()
                .map(RunResponse::from)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("runs", runs);
        response.put("count", runs.size());
        return ControllerResponse.json(HttpResponseStatus.OK, response);
    }

    private ControllerResponse handleGetRun(String runId) {
        return ControllerResponse.json(HttpResponseStatus.OK, RunResponse.from(runService.getRun(runId)));
    }

    /**
     * GET /api/v1/runs/{runId}/events?after=N&includeTokens=false
     */
    private ControllerResponse handleGetEvents(String runId, QueryStringDecoder query) {
        Long afterParam = longParam(query, "after");
        long after = afterParam != null ? afterParam : 0L;
        boolean includeTokens = !"false".equalsIgnoreCase(stringParam(query, "includeTokens"));

        List<RunEvent> events = runService.events(runId, after, includeTokens);
        List<RunEventResponse> items = events.stream()
                .map(RunEventResponse::from)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("runId", runId);
        response.put("events", items);
        response.put("lastSeq", events.isEmpty() ? after : events.get(events.size() - 1).sequence());
        return ControllerResponse.json(HttpResponseStatus.OK, response);
    }

    private ControllerResponse handleGetCommis(String runId) {
        List<CommisResponse> commis = runService.commis(runId).stream()
                .map(CommisResponse::from)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("runId", runId);
        response.put("commis", commis);
        return ControllerResponse.json(HttpResponseStatus.OK, response);
    }

    /**
     * POST /api/v1/runs/{runId}/fan-out - 202, the run is now waiting
     */
    private ControllerResponse handleFanOut(FullHttpRequest req, String runId) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        FanOutRequest request = Json.mapper().readValue(body, FanOutRequest.class);

        // Validate
        request.validate();

        List<Commis> spawned = runService.fanOut(runId, request.toSpecs());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("runId", runId);
        response.put("commis", spawned.stream().map(CommisResponse::from).toList());
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED, response);
    }

    private static String stringParam(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static Integer intParam(QueryStringDecoder query, String name) {
        String value = stringParam(query, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }

    private static Long longParam(QueryStringDecoder query, String name) {
        String value = stringParam(query, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }

    private static Instant instantParam(QueryStringDecoder query, String name) {
        String value = stringParam(query, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be an ISO-8601 instant");
        }
    }
}
