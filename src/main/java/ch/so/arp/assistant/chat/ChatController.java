package ch.so.arp.assistant.chat;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import ch.so.arp.assistant.plan.CancellationSignal;
import ch.so.arp.assistant.plan.Plan;
import ch.so.arp.assistant.plan.PlanExecutionResult;
import ch.so.arp.assistant.plan.StepProgress;
import ch.so.arp.assistant.plan.StepResult;
import jakarta.validation.Valid;

/**
 * REST endpoint streaming plan, step progress and step results of a chat
 * request as server sent events. Closing the stream cancels the plan.
 */
@RestController
@RequestMapping(path = "/api/sessions/{sessionId}/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
@Validated
public class ChatController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatController.class);

    static final String PLAN_EVENT = "plan";
    static final String PROGRESS_EVENT = "progress";
    static final String STEP_EVENT = "step";
    static final String STEP_FAILED_EVENT = "step-failed";
    static final String DONE_EVENT = "done";
    static final String ERROR_EVENT = "error";

    private final ChatService chatService;
    private final SessionRegistry sessionRegistry;
    private final SseEmitterFactory emitterFactory;

    public ChatController(ChatService chatService, SessionRegistry sessionRegistry, SseEmitterFactory emitterFactory) {
        this.chatService = chatService;
        this.sessionRegistry = sessionRegistry;
        this.emitterFactory = emitterFactory;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public SseEmitter chat(@PathVariable String sessionId, @Valid @RequestBody ChatRequest request) {
        AssistantSession session = sessionRegistry.get(sessionId);
        SseEmitter emitter = emitterFactory.create();
        CancellationSignal cancellation = chatService.streamAnswer(session, request.question(),
                new ChatService.PlanStreamHandler() {
                    @Override
                    public void onPlan(Plan plan) {
                        send(emitter, PLAN_EVENT, plan);
                    }

                    @Override
                    public void onStepProgress(StepProgress progress) {
                        send(emitter, PROGRESS_EVENT, progress);
                    }

                    @Override
                    public void onStepResult(int position, StepResult result) {
                        send(emitter, STEP_EVENT, new StepEvent(position, result));
                    }

                    @Override
                    public void onStepFailed(int position, StepResult result) {
                        send(emitter, STEP_FAILED_EVENT, new StepEvent(position, result));
                    }

                    @Override
                    public void onComplete(PlanExecutionResult result) {
                        send(emitter, DONE_EVENT, new DoneEvent(result.finalResult().orElse(null), result.cancelled()));
                        emitter.complete();
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        send(emitter, ERROR_EVENT, new ErrorEvent("Generation failed: " + throwable.getMessage()));
                        emitter.complete();
                    }
                });
        emitter.onCompletion(cancellation::cancel);
        emitter.onTimeout(cancellation::cancel);
        emitter.onError(throwable -> cancellation.cancel());
        return emitter;
    }

    private void send(SseEmitter emitter, String name, Object payload) {
        try {
            emitter.send(SseEmitter.event().name(name).data(payload, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException ex) {
            LOGGER.warn("Unable to stream '{}' event: {}", name, ex.getMessage());
            emitter.completeWithError(ex);
        }
    }

    record StepEvent(int position, StepResult result) {
    }

    record DoneEvent(StepResult answer, boolean cancelled) {
    }

    record ErrorEvent(String message) {
    }
}
