package concierge.orchestrator.service;

import concierge.orchestrator.model.CommisResult;
import concierge.orchestrator.model.Run;
import concierge.orchestrator.util.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives runs through the concierge: starts new runs, resumes released ones
 * and applies each step's outcome.
 */
public class RunOrchestrator implements ResumeHandler {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    private final RunStateMachine stateMachine;
    private final CommisDispatcher dispatcher;
    private final ConciergeStep concierge;
    private final ExecutorService executor;

    public RunOrchestrator(RunStateMachine stateMachine, CommisDispatcher dispatcher,
            ConciergeStep concierge, ExecutorService executor) {
        this.stateMachine = stateMachine;
        this.dispatcher = dispatcher;
        this.concierge = concierge;
        this.executor = executor;
        dispatcher.setResumeHandler(this);
    }

    /**
     * Create the run and, if this call created it, schedule its first step.
     * Returns as soon as the run is recorded.
     */
    public RunCreation submit(RunRequest request) {
        RunCreation creation = stateMachine.createRun(request);
        if (creation.created()) {
            schedule(creation.run(), concierge::start);
        }
        return creation;
    }

    @Override
    public void onResumed(Run run, List<CommisResult> results) {
        schedule(run, context -> concierge.resume(context, results));
    }

    private void schedule(Run run, Step step) {
        try {
            executor.execute(() -> drive(run, step));
        } catch (RejectedExecutionException e) {
            log.error("Orchestrator executor rejected run {}", run.id(), e);
            failRun(run.id(), "Run could not be scheduled: " + e.getMessage());
        }
    }

    private void drive(Run run, Step step) {
        try (LogContext ignored = LogContext.of(run.id(), run.correlationId())) {
            StepOutcome outcome;
            try {
                outcome = step.call(new RunContext(run, stateMachine));
            } catch (RunBusyException e) {
                log.warn("Concierge step for run {} hit a busy run: {}", run.id(), e.getMessage());
                return;
            } catch (Exception e) {
                log.error("Concierge step for run {} threw", run.id(), e);
                failRun(run.id(), "Concierge step failed: " + e.getMessage());
                return;
            }
            apply(run, outcome);
        }
    }

    private void apply(Run run, StepOutcome outcome) {
        log.debug("Run {} step outcome {}", run.id(), outcome);
        try {
            switch (outcome.kind()) {
                case COMPLETE -> stateMachine.complete(run.id(), outcome.result());
                case FAIL -> stateMachine.fail(run.id(), outcome.error());
                case FAN_OUT -> {
                    if (outcome.specs().isEmpty()) {
                        failRun(run.id(), "Concierge requested a fan-out with no commis");
                    } else {
                        dispatcher.fanOut(run.id(), outcome.specs());
                    }
                }
            }
        } catch (RunBusyException e) {
            log.warn("Could not apply {} to run {}: {}", outcome, run.id(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to apply {} to run {}", outcome, run.id(), e);
            failRun(run.id(), "Orchestration error: " + e.getMessage());
        }
    }

    private void failRun(String runId, String error) {
        try {
            stateMachine.fail(runId, error);
        } catch (RunBusyException e) {
            log.warn("Run {} could not be failed: {}", runId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to record failure of run {} ({})", runId, error, e);
        }
    }

    @FunctionalInterface
    private interface Step {
        StepOutcome call(RunContext context) throws Exception;
    }
}
