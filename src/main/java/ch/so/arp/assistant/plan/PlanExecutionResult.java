package ch.so.arp.assistant.plan;

import java.util.List;
import java.util.Optional;

/**
 * Transcript of a plan execution.
 *
 * @param outcomes  one outcome per plan step, in plan order
 * @param cancelled whether dispatching stopped because of a cancellation
 * @param failure   collaborator failure that aborted the run, if any
 */
public record PlanExecutionResult(List<StepOutcome> outcomes, boolean cancelled, Exception failure) {

    public PlanExecutionResult {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Results of all steps that were dispatched, including failed ones.
     */
    public List<StepResult> transcript() {
        return outcomes.stream()
                .filter(outcome -> outcome.result() != null)
                .map(StepOutcome::result)
                .toList();
    }

    /**
     * The answer of the run: the result of the last step, when it completed.
     */
    public Optional<StepResult> finalResult() {
        StepOutcome last = outcomes.get(outcomes.size() - 1);
        return last.status() == StepStatus.COMPLETED ? Optional.of(last.result()) : Optional.empty();
    }

    public boolean aborted() {
        return failure != null;
    }
}
