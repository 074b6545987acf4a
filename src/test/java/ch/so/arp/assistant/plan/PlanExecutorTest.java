package ch.so.arp.assistant.plan;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import ch.so.arp.assistant.llm.LlmException;

class PlanExecutorTest {

    private final List<String> dispatched = new ArrayList<>();

    @Test
    void threadsOutputOfEarlierStepsIntoLaterPrompts() {
        StepDispatcher dispatcher = recording((agent, prompt) -> new StepResult(agent, agent.equals("A") ? "RESULT"
                : "done with " + prompt));
        Plan plan = Plan.of(new PlanStep("A", "x"), new PlanStep("B", "use {{step_1_output}}"));

        PlanExecutionResult result = new PlanExecutor(FailurePolicy.CONTINUE).execute(plan, dispatcher);

        assertThat(dispatched).containsExactly("A:x", "B:use RESULT");
        assertThat(result.finalResult()).contains(new StepResult("B", "done with use RESULT"));
        assertThat(result.transcript()).hasSize(2);
        assertThat(result.outcomes()).extracting(StepOutcome::status)
                .containsExactly(StepStatus.COMPLETED, StepStatus.COMPLETED);
    }

    @Test
    void leavesUnresolvedPlaceholdersLiteral() {
        StepDispatcher dispatcher = recording((agent, prompt) -> new StepResult(agent, "out"));
        Plan plan = Plan.of(new PlanStep("A", "before {{step_3_output}}"), new PlanStep("B", "{{step_2_output}}"));

        new PlanExecutor(FailurePolicy.CONTINUE).execute(plan, dispatcher);

        assertThat(dispatched).containsExactly("A:before {{step_3_output}}", "B:{{step_2_output}}");
    }

    @Test
    void reportsProgressBeforeAndResultAfterEachStep() {
        List<String> events = new ArrayList<>();
        PlanProgressListener listener = new PlanProgressListener() {
            @Override
            public void onStepStarted(StepProgress progress) {
                events.add("start " + progress.current() + "/" + progress.total() + " " + progress.agent() + " "
                        + progress.task());
            }

            @Override
            public void onStepCompleted(int position, StepResult result) {
                events.add("done " + position + " " + result.text());
            }
        };
        StepDispatcher dispatcher = (agent, prompt) -> {
            events.add("dispatch " + agent);
            return new StepResult(agent, prompt.toUpperCase());
        };
        Plan plan = Plan.of(new PlanStep("A", "one"), new PlanStep("B", "{{step_1_output}} two"));

        new PlanExecutor(FailurePolicy.CONTINUE).execute(plan, dispatcher, listener, CancellationSignal.none());

        assertThat(events).containsExactly(
                "start 1/2 A one", "dispatch A", "done 1 ONE",
                "start 2/2 B ONE two", "dispatch B", "done 2 ONE TWO");
    }

    @Test
    void continuesAfterACollaboratorFailureByDefault() {
        List<Integer> failedSteps = new ArrayList<>();
        PlanProgressListener listener = new PlanProgressListener() {
            @Override
            public void onStepFailed(int position, StepResult result, Exception failure) {
                failedSteps.add(position);
            }
        };
        StepDispatcher dispatcher = recording((agent, prompt) -> {
            if (agent.equals("A")) {
                throw new LlmException("API Error: 500");
            }
            return new StepResult(agent, "ok");
        });
        Plan plan = Plan.of(new PlanStep("A", "x"), new PlanStep("B", "use {{step_1_output}}"));

        PlanExecutionResult result = new PlanExecutor(FailurePolicy.CONTINUE)
                .execute(plan, dispatcher, listener, CancellationSignal.none());

        assertThat(failedSteps).containsExactly(1);
        assertThat(dispatched).containsExactly("A:x", "B:use {{step_1_output}}");
        assertThat(result.outcomes()).extracting(StepOutcome::status)
                .containsExactly(StepStatus.FAILED, StepStatus.COMPLETED);
        assertThat(result.outcomes().get(0).result().text()).contains("A failed", "API Error: 500");
        assertThat(result.aborted()).isFalse();
        assertThat(result.finalResult()).contains(new StepResult("B", "ok"));
    }

    @Test
    void abortPolicySkipsRemainingSteps() {
        LlmException failure = new LlmException("API Error: 500");
        StepDispatcher dispatcher = recording((agent, prompt) -> {
            if (agent.equals("B")) {
                throw failure;
            }
            return new StepResult(agent, "ok");
        });
        Plan plan = Plan.of(new PlanStep("A", "x"), new PlanStep("B", "y"), new PlanStep("C", "z"));

        PlanExecutionResult result = new PlanExecutor(FailurePolicy.ABORT).execute(plan, dispatcher);

        assertThat(dispatched).containsExactly("A:x", "B:y");
        assertThat(result.outcomes()).extracting(StepOutcome::status)
                .containsExactly(StepStatus.COMPLETED, StepStatus.FAILED, StepStatus.SKIPPED);
        assertThat(result.failure()).isSameAs(failure);
        assertThat(result.finalResult()).isEmpty();
        assertThat(result.transcript()).hasSize(2);
    }

    @Test
    void stopsDispatchingOnceCancelled() {
        CancellationSignal cancellation = new CancellationSignal();
        StepDispatcher dispatcher = recording((agent, prompt) -> {
            cancellation.cancel();
            return new StepResult(agent, "partial");
        });
        Plan plan = Plan.of(new PlanStep("A", "x"), new PlanStep("B", "y"));

        PlanExecutionResult result = new PlanExecutor(FailurePolicy.CONTINUE)
                .execute(plan, dispatcher, PlanProgressListener.NONE, cancellation);

        assertThat(dispatched).containsExactly("A:x");
        assertThat(result.cancelled()).isTrue();
        assertThat(result.transcript()).containsExactly(new StepResult("A", "partial"));
        assertThat(result.outcomes().get(1).status()).isEqualTo(StepStatus.SKIPPED);
    }

    @Test
    void doesNotMutateThePlan() {
        Plan plan = Plan.of(new PlanStep("A", "{{step_1_output}}"), new PlanStep("B", "{{step_1_output}}"));
        Plan copy = Plan.of(new PlanStep("A", "{{step_1_output}}"), new PlanStep("B", "{{step_1_output}}"));

        new PlanExecutor(FailurePolicy.CONTINUE).execute(plan, (agent, prompt) -> new StepResult(agent, "v"));

        assertThat(plan).isEqualTo(copy);
    }

    private StepDispatcher recording(StepDispatcher delegate) {
        return (agent, prompt) -> {
            dispatched.add(agent + ":" + prompt);
            return delegate.dispatch(agent, prompt);
        };
    }
}
