package ch.so.arp.assistant.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the steps of a plan strictly in order on the calling thread, feeding
 * the output of earlier steps into the prompt templates of later ones.
 */
public class PlanExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlanExecutor.class);

    private final FailurePolicy failurePolicy;

    public PlanExecutor(FailurePolicy failurePolicy) {
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    public PlanExecutionResult execute(Plan plan, StepDispatcher dispatcher) {
        return execute(plan, dispatcher, PlanProgressListener.NONE, CancellationSignal.none());
    }

    public PlanExecutionResult execute(Plan plan, StepDispatcher dispatcher, PlanProgressListener listener,
            CancellationSignal cancellation) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(dispatcher, "dispatcher");
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(cancellation, "cancellation");

        StepOutputs outputs = new StepOutputs();
        List<StepOutcome> outcomes = new ArrayList<>(plan.size());
        int total = plan.size();
        boolean cancelled = false;
        Exception abortCause = null;

        for (int position = 1; position <= total; position++) {
            PlanStep step = plan.step(position);
            if (abortCause != null || cancelled) {
                outcomes.add(new StepOutcome(position, step, StepStatus.SKIPPED, null, null));
                continue;
            }
            if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                LOGGER.info("Plan execution cancelled before step {} of {}", position, total);
                cancelled = true;
                outcomes.add(new StepOutcome(position, step, StepStatus.SKIPPED, null, null));
                continue;
            }

            String resolvedPrompt = PlaceholderTemplate.parse(step.prompt()).resolve(outputs, position);
            listener.onStepStarted(new StepProgress(position, total, step.agent(), resolvedPrompt));
            LOGGER.debug("Running step {} of {} with {}", position, total, step.agent());

            StepResult result;
            try {
                result = dispatcher.dispatch(step.agent(), resolvedPrompt);
            } catch (RuntimeException ex) {
                LOGGER.warn("Step {} of {} ({}) failed: {}", position, total, step.agent(), ex.getMessage());
                StepResult failed = new StepResult(step.agent(),
                        "Error: " + step.agent() + " failed: " + ex.getMessage());
                outcomes.add(new StepOutcome(position, step, StepStatus.FAILED, resolvedPrompt, failed));
                listener.onStepFailed(position, failed, ex);
                if (failurePolicy == FailurePolicy.ABORT) {
                    abortCause = ex;
                }
                continue;
            }

            outputs.record(position, result.text());
            outcomes.add(new StepOutcome(position, step, StepStatus.COMPLETED, resolvedPrompt, result));
            listener.onStepCompleted(position, result);
        }
        return new PlanExecutionResult(outcomes, cancelled, abortCause);
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }
}
