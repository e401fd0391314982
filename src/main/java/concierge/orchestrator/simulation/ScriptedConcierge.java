package concierge.orchestrator.simulation;

import concierge.orchestrator.model.CommisResult;
import concierge.orchestrator.model.WorkSpec;
import concierge.orchestrator.service.ConciergeStep;
import concierge.orchestrator.service.RunContext;
import concierge.orchestrator.service.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic concierge for local runs and tests.
 *
 * A task listing several subtasks separated by {@code ;} fans out one commis
 * per subtask; any other task completes immediately. On resume the run succeeds
 * unless every commis failed.
 */
public final class ScriptedConcierge implements ConciergeStep {

    private static final Logger log = LoggerFactory.getLogger(ScriptedConcierge.class);

    @Override
    public StepOutcome start(RunContext context) {
        List<String> subtasks = subtasks(context.task());
        stream(context, subtasks.size() > 1
                ? "Splitting into " + subtasks.size() + " subtasks"
                : "Working on " + context.task());

        if (subtasks.size() <= 1) {
            return StepOutcome.complete("Done: " + context.task().trim());
        }

        List<WorkSpec> specs = new ArrayList<>(subtasks.size());
        for (int i = 0; i < subtasks.size(); i++) {
            specs.add(new WorkSpec(subtasks.get(i), "call-" + i));
        }
        log.debug("Run {} fans out {} subtasks", context.runId(), specs.size());
        return StepOutcome.fanOut(specs);
    }

    @Override
    public StepOutcome resume(RunContext context, List<CommisResult> results) {
        StringBuilder summary = new StringBuilder();
        int failed = 0;
        for (CommisResult result : results) {
            if (summary.length() > 0) {
                summary.append('\n');
            }
            summary.append('[').append(result.spawnIndex()).append("] ");
            if (result.succeeded()) {
                summary.append("ok: ").append(result.result());
            } else {
                summary.append("failed: ").append(result.error());
                failed++;
            }
        }
        stream(context, "Collected " + results.size() + " results");

        if (!results.isEmpty() && failed == results.size()) {
            return StepOutcome.fail("All commis failed:\n" + summary);
        }
        return StepOutcome.complete(summary.toString());
    }

    static List<String> subtasks(String task) {
        List<String> parts = new ArrayList<>();
        for (String part : task.split(";")) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts;
    }

    private static void stream(RunContext context, String text) {
        String messageId = "msg-" + context.runId() + "-" + System.nanoTime();
        context.streamStart(messageId);
        for (String token : text.split(" ")) {
            context.streamChunk(messageId, token + " ");
        }
        context.streamEnd(messageId);
    }
}
