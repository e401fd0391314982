package concierge.orchestrator.model;

/**
 * Field names used inside event payloads and push envelope data.
 */
public final class PayloadKeys {

    public static final String RUN_ID = "run_id";
    public static final String SEQ = "seq";
    public static final String CORRELATION_ID = "correlation_id";
    public static final String THREAD_ID = "thread_id";
    public static final String TENANT_ID = "tenant_id";
    public static final String TASK = "task";

    public static final String COMMIS_ID = "commis_id";
    public static final String COMMIS_IDS = "commis_ids";
    public static final String SPAWN_INDEX = "spawn_index";
    public static final String TOOL_CALL_ID = "tool_call_id";
    public static final String TOOL_NAME = "tool_name";
    public static final String EXPECTED = "expected";

    public static final String STATUS = "status";
    public static final String RESULT = "result";
    public static final String RESULTS = "results";
    public static final String ERROR = "error";
    public static final String MESSAGE = "message";
    public static final String MESSAGE_ID = "message_id";
    public static final String TOKEN = "token";

    private PayloadKeys() {
    }
}
