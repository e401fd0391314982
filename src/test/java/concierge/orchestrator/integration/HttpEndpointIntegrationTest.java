package concierge.orchestrator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import concierge.orchestrator.config.Dependencies;
import concierge.orchestrator.config.OrchestratorConfig;
import concierge.orchestrator.model.CommisResult;
import concierge.orchestrator.server.OrchestratorServer;
import concierge.orchestrator.server.RouterHandler;
import concierge.orchestrator.service.ConciergeStep;
import concierge.orchestrator.service.ExternalCommisWorker;
import concierge.orchestrator.service.RunContext;
import concierge.orchestrator.service.StepOutcome;
import concierge.orchestrator.simulation.ScriptedConcierge;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 * Commis are reported through the internal API, the way an external worker would.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();
        private static final String AGENT_KEY = "test-agent-key";

        private final CountDownLatch holdRelease = new CountDownLatch(1);

        private Dependencies deps;
        private OrchestratorServer server;
        private HttpClient httpClient;
        private String baseUrl;

        /** Scripted behaviour, except tasks starting with "hold" park in the first step */
        private final ConciergeStep concierge = new ConciergeStep() {
                private final ScriptedConcierge scripted = new ScriptedConcierge();

                @Override
                public StepOutcome start(RunContext context) throws Exception {
                        if (context.task().startsWith("hold")) {
                                holdRelease.await(10, TimeUnit.SECONDS);
                                return StepOutcome.complete("released");
                        }
                        return scripted.start(context);
                }

                @Override
                public StepOutcome resume(RunContext context, List<CommisResult> results) {
                        return scripted.resume(context, results);
                }
        };

        @BeforeEach
        void setUp() {
                OrchestratorConfig config = OrchestratorConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withAgentKey(AGENT_KEY);

                deps = Dependencies.create(config, concierge, new ExternalCommisWorker());
                server = deps.newServer();
                int port = server.start("127.0.0.1", 0);
                baseUrl = "http://127.0.0.1:" + port;

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        @AfterEach
        void tearDown() {
                holdRelease.countDown();
                server.stop();
                deps.close();
        }

        @Test
        @DisplayName("Same Idempotency-Key twice returns the same run: 201 then 200")
        void idempotentCreate() throws Exception {
                HttpResponse<String> first = post("/api/v1/runs", "{\"task\":\"hello\"}", "key-abc");
                HttpResponse<String> second = post("/api/v1/runs", "{\"task\":\"something else\"}", "key-abc");

                assertEquals(201, first.statusCode(), "Body: " + first.body());
                assertEquals(200, second.statusCode(), "Body: " + second.body());

                JsonNode a = MAPPER.readTree(first.body());
                JsonNode b = MAPPER.readTree(second.body());
                assertEquals(a.get("runId").asText(), b.get("runId").asText());
                assertEquals("hello", b.get("task").asText());
                assertEquals(a.get("correlationId").asText(),
                                first.headers().firstValue("X-Correlation-Id").orElseThrow());
                assertEquals("/api/v1/runs/" + a.get("runId").asText(),
                                first.headers().firstValue("Location").orElseThrow());

                // the retry's payload is discarded, so it is not validated either
                HttpResponse<String> blankRetry = post("/api/v1/runs", "{\"task\":\"\"}", "key-abc");
                assertEquals(200, blankRetry.statusCode(), "Body: " + blankRetry.body());
                assertEquals(a.get("runId").asText(), MAPPER.readTree(blankRetry.body()).get("runId").asText());
        }

        @Test
        void createValidation() throws Exception {
                assertEquals(400, post("/api/v1/runs", "{\"task\":\"\"}", null).statusCode());
                assertEquals(400, post("/api/v1/runs", "{not json", null).statusCode());

                HttpResponse<String> badCorrelation = httpClient.send(HttpRequest.newBuilder()
                                .uri(URI.create(baseUrl + "/api/v1/runs"))
                                .header("Content-Type", "application/json")
                                .header("X-Correlation-Id", "nope")
                                .POST(HttpRequest.BodyPublishers.ofString("{\"task\":\"t\"}"))
                                .build(), HttpResponse.BodyHandlers.ofString());
                assertEquals(400, badCorrelation.statusCode());

                HttpResponse<String> longKey = post("/api/v1/runs", "{\"task\":\"t\"}", "k".repeat(256));
                assertEquals(400, longKey.statusCode(), "Body: " + longKey.body());
                assertTrue(longKey.body().contains("idempotencyKey"));
        }

        @Test
        @DisplayName("Full HTTP flow: fan out, report commis internally, poll events to completion")
        void fanOutAndReportOverHttp() throws Exception {
                JsonNode created = MAPPER.readTree(
                                post("/api/v1/runs", "{\"task\":\"flights; hotels\"}", null).body());
                String runId = created.get("runId").asText();

                JsonNode waiting = awaitStatus(runId, "waiting");
                assertNotNull(waiting.get("waitingSince"));

                // Fan-out while waiting is rejected
                HttpResponse<String> busy = post("/api/v1/runs/" + runId + "/fan-out",
                                "{\"commis\":[{\"task\":\"more\"}]}", null);
                assertEquals(409, busy.statusCode(), "Body: " + busy.body());

                JsonNode commis = MAPPER.readTree(get("/api/v1/runs/" + runId + "/commis").body()).get("commis");
                assertEquals(2, commis.size());
                String first = commis.get(0).get("commisId").asText();
                String second = commis.get(1).get("commisId").asText();

                // Internal API requires the agent key
                HttpResponse<String> noKey = httpClient.send(HttpRequest.newBuilder()
                                .uri(URI.create(baseUrl + "/internal/v1/commis/" + first + "/complete"))
                                .POST(HttpRequest.BodyPublishers.ofString("{\"result\":\"x\"}"))
                                .build(), HttpResponse.BodyHandlers.ofString());
                assertEquals(403, noKey.statusCode());

                HttpResponse<String> activity = internal("/internal/v1/commis/" + first + "/activity",
                                "{\"phase\":\"started\",\"toolName\":\"search\"}");
                assertEquals(200, activity.statusCode(), "Body: " + activity.body());

                JsonNode recorded = MAPPER.readTree(
                                internal("/internal/v1/commis/" + first + "/complete", "{\"result\":\"3 flights\"}").body());
                assertEquals("recorded", recorded.get("outcome").asText());

                JsonNode released = MAPPER.readTree(
                                internal("/internal/v1/commis/" + second + "/fail", "{\"error\":\"no hotels\"}").body());
                assertEquals("released", released.get("outcome").asText());

                JsonNode duplicate = MAPPER.readTree(
                                internal("/internal/v1/commis/" + second + "/complete", "{\"result\":\"late\"}").body());
                assertEquals("already_terminal", duplicate.get("outcome").asText());

                assertEquals(409, internal("/internal/v1/commis/" + first + "/activity",
                                "{\"phase\":\"completed\",\"toolName\":\"search\"}").statusCode());
                assertEquals(404, internal("/internal/v1/commis/commis-missing/complete",
                                "{\"result\":\"x\"}").statusCode());

                JsonNode done = awaitStatus(runId, "success");
                assertTrue(done.get("result").asText().contains("[0] ok: 3 flights"));
                assertTrue(done.get("result").asText().contains("[1] failed: no hotels"));

                // Poll the log from a watermark
                JsonNode all = MAPPER.readTree(get("/api/v1/runs/" + runId + "/events").body());
                JsonNode events = all.get("events");
                assertEquals(events.get(events.size() - 1).get("seq").asLong(), all.get("lastSeq").asLong());
                assertEquals("run_started", events.get(0).get("type").asText());
                assertEquals("run_success", events.get(events.size() - 1).get("type").asText());
                for (int i = 0; i < events.size(); i++) {
                        assertEquals(i + 1, events.get(i).get("seq").asInt());
                        assertEquals(created.get("correlationId").asText(), events.get(i).get("correlationId").asText());
                }

                long watermark = events.get(2).get("seq").asLong();
                JsonNode after = MAPPER.readTree(
                                get("/api/v1/runs/" + runId + "/events?after=" + watermark).body()).get("events");
                assertEquals(events.size() - 3, after.size());
                assertEquals(watermark + 1, after.get(0).get("seq").asLong());

                JsonNode withoutTokens = MAPPER.readTree(
                                get("/api/v1/runs/" + runId + "/events?includeTokens=false").body()).get("events");
                for (JsonNode event : withoutTokens) {
                        assertNotEquals("stream_chunk", event.get("type").asText());
                }
                assertTrue(withoutTokens.size() < events.size());
        }

        @Test
        @DisplayName("Explicit fan-out on a running run returns 202 and parks it")
        void explicitFanOut() throws Exception {
                String runId = MAPPER.readTree(post("/api/v1/runs", "{\"task\":\"hold on\"}", null).body())
                                .get("runId").asText();

                HttpResponse<String> fanOut = post("/api/v1/runs/" + runId + "/fan-out",
                                "{\"commis\":[{\"task\":\"a\",\"toolCallId\":\"call-a\"},{\"task\":\"b\"}]}", null);
                assertEquals(202, fanOut.statusCode(), "Body: " + fanOut.body());
                JsonNode spawned = MAPPER.readTree(fanOut.body()).get("commis");
                assertEquals(2, spawned.size());
                assertEquals("call-a", spawned.get(0).get("toolCallId").asText());

                JsonNode run = MAPPER.readTree(get("/api/v1/runs/" + runId).body());
                assertEquals("waiting", run.get("status").asText());

                // the parked first step cannot finish a waiting run
                holdRelease.countDown();
                TimeUnit.MILLISECONDS.sleep(200);
                assertEquals("waiting", MAPPER.readTree(get("/api/v1/runs/" + runId).body()).get("status").asText());

                assertEquals(400, post("/api/v1/runs/" + runId + "/fan-out", "{\"commis\":[]}", null).statusCode());
        }

        @Test
        void listHealthAndNotFound() throws Exception {
                String runId = MAPPER.readTree(post("/api/v1/runs", "{\"task\":\"one\"}", null).body())
                                .get("runId").asText();
                post("/api/v1/runs", "{\"task\":\"two\"}", null);

                JsonNode farAhead = MAPPER.readTree(
                                get("/api/v1/runs/" + runId + "/events?after=3000000000").body());
                assertEquals(0, farAhead.get("events").size());
                assertEquals(3_000_000_000L, farAhead.get("lastSeq").asLong());
                assertEquals(400, get("/api/v1/runs/" + runId + "/events?after=x").statusCode());

                JsonNode list = MAPPER.readTree(get("/api/v1/runs?limit=1").body());
                assertEquals(1, list.get("count").asInt());

                assertEquals(400, get("/api/v1/runs?limit=abc").statusCode());
                assertEquals(404, get("/api/v1/runs/run-missing").statusCode());
                assertEquals(404, get("/api/v1/runs/run-missing/events").statusCode());
                assertEquals(404, get("/api/v1/nothing-here").statusCode());

                HttpResponse<String> health = get("/api/v1/health");
                assertEquals(200, health.statusCode());
                JsonNode body = MAPPER.readTree(health.body());
                assertEquals("healthy", body.get("status").asText());
                assertTrue(body.get("runs").has("success"));
        }

        private JsonNode awaitStatus(String runId, String status) throws Exception {
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
                JsonNode run = null;
                while (System.nanoTime() < deadline) {
                        run = MAPPER.readTree(get("/api/v1/runs/" + runId).body());
                        if (status.equals(run.get("status").asText())) {
                                return run;
                        }
                        TimeUnit.MILLISECONDS.sleep(20);
                }
                fail("run " + runId + " never reached " + status + ", last: " + run);
                return run;
        }

        private HttpResponse<String> get(String path) throws Exception {
                return httpClient.send(HttpRequest.newBuilder()
                                .uri(URI.create(baseUrl + path))
                                .GET()
                                .build(), HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> post(String path, String body, String idempotencyKey) throws Exception {
                HttpRequest.Builder builder = HttpRequest.newBuilder()
                                .uri(URI.create(baseUrl + path))
                                .header("Content-Type", "application/json")
                                .POST(HttpRequest.BodyPublishers.ofString(body));
                if (idempotencyKey != null) {
                        builder.header("Idempotency-Key", idempotencyKey);
                }
                return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        }

        private HttpResponse<String> internal(String path, String body) throws Exception {
                return httpClient.send(HttpRequest.newBuilder()
                                .uri(URI.create(baseUrl + path))
                                .header("Content-Type", "application/json")
                                .header(RouterHandler.AGENT_KEY_HEADER, AGENT_KEY)
                                .POST(HttpRequest.BodyPublishers.ofString(body))
                                .build(), HttpResponse.BodyHandlers.ofString());
        }
}
