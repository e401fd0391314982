package concierge.orchestrator.service;

import concierge.orchestrator.model.WorkSpec;

import java.util.List;
import java.util.Objects;

/**
 * What a concierge step decided: finish, fail, or fan out and wait.
 */
public final class StepOutcome {

    public enum Kind {
        COMPLETE, FAIL, FAN_OUT
    }

    private final Kind kind;
    private final String result;
    private final String error;
    private final List<WorkSpec> specs;

    private StepOutcome(Kind kind, String result, String error, List<WorkSpec> specs) {
        this.kind = kind;
        this.result = result;
        this.error = error;
        this.specs = specs;
    }

    public static StepOutcome complete(String result) {
        return new StepOutcome(Kind.COMPLETE, result, null, List.of());
    }

    public static StepOutcome fail(String error) {
        return new StepOutcome(Kind.FAIL, null, Objects.requireNonNull(error, "error is required"), List.of());
    }

    public static StepOutcome fanOut(List<WorkSpec> specs) {
        return new StepOutcome(Kind.FAN_OUT, null, null, List.copyOf(specs));
    }

    public Kind kind() {
        return kind;
    }

    public String result() {
        return result;
    }

    public String error() {
        return error;
    }

    public List<WorkSpec> specs() {
        return specs;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case COMPLETE -> "StepOutcome{complete}";
            case FAIL -> "StepOutcome{fail: " + error + "}";
            case FAN_OUT -> "StepOutcome{fan_out x" + specs.size() + "}";
        };
    }
}
