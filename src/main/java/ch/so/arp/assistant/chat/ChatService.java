package ch.so.arp.assistant.chat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.assistant.capability.CapabilityDispatcher;
import ch.so.arp.assistant.plan.CancellationSignal;
import ch.so.arp.assistant.plan.ConversationTurn;
import ch.so.arp.assistant.plan.Plan;
import ch.so.arp.assistant.plan.PlanExecutionResult;
import ch.so.arp.assistant.plan.PlanExecutor;
import ch.so.arp.assistant.plan.PlanProgressListener;
import ch.so.arp.assistant.plan.Planner;
import ch.so.arp.assistant.plan.StepProgress;
import ch.so.arp.assistant.plan.StepResult;

/**
 * Coordinates planning and plan execution for a session and reports every
 * stage to a {@link PlanStreamHandler}. The work runs on the chat executor.
 */
public class ChatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatService.class);

    private final Planner planner;
    private final PlanExecutor planExecutor;
    private final CapabilityDispatcher dispatcher;
    private final Executor chatExecutor;

    public ChatService(Planner planner, PlanExecutor planExecutor, CapabilityDispatcher dispatcher,
            Executor chatExecutor) {
        this.planner = Objects.requireNonNull(planner, "planner");
        this.planExecutor = Objects.requireNonNull(planExecutor, "planExecutor");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.chatExecutor = Objects.requireNonNull(chatExecutor, "chatExecutor");
    }

    /**
     * Plan and execute the answer to a question.
     *
     * @return signal that stops dispatching further steps when cancelled
     */
    public CancellationSignal streamAnswer(AssistantSession session, String question, PlanStreamHandler handler) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(handler, "handler");
        CancellationSignal cancellation = new CancellationSignal();
        chatExecutor.execute(() -> {
            try {
                List<ConversationTurn> recentHistory = session.recentHistory(Planner.HISTORY_WINDOW);
                Plan plan = planner.createPlan(question, recentHistory);
                LOGGER.info("Session {}: executing plan with {} step(s)", session.getId(), plan.size());
                handler.onPlan(plan);

                PlanExecutionResult result = planExecutor.execute(plan, dispatcher.forContext(session),
                        new ForwardingListener(handler), cancellation);
                session.appendTurns(turnsOf(question, result));

                if (result.aborted()) {
                    LOGGER.error("Session {}: plan aborted: {}", session.getId(), result.failure().getMessage());
                    handler.onError(result.failure());
                } else {
                    handler.onComplete(result);
                }
            } catch (Exception ex) {
                LOGGER.error("Failed to produce response for question '{}': {}", question, ex.getMessage(), ex);
                handler.onError(ex);
            }
        });
        return cancellation;
    }

    private List<ConversationTurn> turnsOf(String question, PlanExecutionResult result) {
        List<ConversationTurn> turns = new ArrayList<>();
        turns.add(ConversationTurn.user(question));
        for (StepResult stepResult : result.transcript()) {
            turns.add(ConversationTurn.assistant(stepResult.text(), stepResult.capability()));
        }
        return turns;
    }

    /**
     * Callback API allowing to react to the progress of a plan execution.
     */
    public interface PlanStreamHandler {

        void onPlan(Plan plan);

        void onStepProgress(StepProgress progress);

        void onStepResult(int position, StepResult result);

        void onStepFailed(int position, StepResult result);

        void onComplete(PlanExecutionResult result);

        void onError(Throwable throwable);
    }

    private static final class ForwardingListener implements PlanProgressListener {

        private final PlanStreamHandler handler;

        private ForwardingListener(PlanStreamHandler handler) {
            this.handler = handler;
        }

        @Override
        public void onStepStarted(StepProgress progress) {
            handler.onStepProgress(progress);
        }

        @Override
        public void onStepCompleted(int position, StepResult result) {
            handler.onStepResult(position, result);
        }

        @Override
        public void onStepFailed(int position, StepResult result, Exception failure) {
            handler.onStepFailed(position, result);
        }
    }
}
