package ch.so.arp.assistant.plan;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.assistant.llm.LlmClient;

/**
 * Turns a user request and the recent conversation into a {@link Plan} by
 * asking the language model for a JSON plan. The planner always returns a
 * usable plan: anything that cannot be parsed, including a failed model call,
 * falls back to a single web search step for the request.
 */
public class Planner {

    private static final Logger LOGGER = LoggerFactory.getLogger(Planner.class);

    public static final int HISTORY_WINDOW = 4;

    private final LlmClient llmClient;
    private final PlanParser planParser;

    public Planner(LlmClient llmClient, PlanParser planParser) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.planParser = Objects.requireNonNull(planParser, "planParser");
    }

    public Plan createPlan(String request, List<ConversationTurn> history) {
        if (request == null) {
            request = "";
        }
        String prompt = buildPrompt(request, history);
        String response;
        try {
            response = llmClient.generate(prompt);
        } catch (RuntimeException ex) {
            LOGGER.warn("Planner call failed, using fallback plan: {}", ex.getMessage());
            return fallbackPlan(request);
        }
        String fallbackRequest = request;
        return planParser.parse(response).orElseGet(() -> {
            LOGGER.warn("Failed to parse plan, using fallback plan");
            return fallbackPlan(fallbackRequest);
        });
    }

    public static Plan fallbackPlan(String request) {
        return Plan.of(PlanStep.of(Capability.WEB_SEARCH, request == null ? "" : request));
    }

    String buildPrompt(String request, List<ConversationTurn> history) {
        String capabilities = Arrays.stream(Capability.values())
                .map(capability -> "- " + capability.wireName() + ": " + capability.description())
                .collect(Collectors.joining("\n"));
        List<ConversationTurn> recent = history == null ? List.of()
                : history.subList(Math.max(0, history.size() - HISTORY_WINDOW), history.size());
        String renderedHistory = recent.stream().map(ConversationTurn::render).collect(Collectors.joining("\n"));
        return """
                You are an expert planning agent. Your job is to analyze a user's prompt and the recent \
                conversation history, then create a step-by-step plan to fulfill the request.
                You have access to the following agents:
                %s

                Based on the user's prompt, create a JSON plan. The plan should be an array of steps. \
                Each step must have an "agent" and a "prompt".
                The "prompt" for a step can be the original user prompt, or it can be the output of a previous \
                step, which you can represent with the placeholder "{{step_1_output}}", "{{step_2_output}}", etc.

                Conversation History:
                %s

                User Prompt: "%s"

                Generate the JSON plan now.
                """.formatted(capabilities, renderedHistory, request);
    }
}
