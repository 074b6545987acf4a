package ch.so.arp.assistant.capability;

import java.util.Objects;

import ch.so.arp.assistant.llm.LlmClient;
import ch.so.arp.assistant.plan.Capability;
import ch.so.arp.assistant.plan.StepResult;

/**
 * Lets the model answer as a web search would, with a few illustrative links.
 */
public class WebSearchHandler implements CapabilityHandler {

    private final LlmClient llmClient;

    public WebSearchHandler(LlmClient llmClient) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    }

    @Override
    public Capability capability() {
        return Capability.WEB_SEARCH;
    }

    @Override
    public StepResult handle(String prompt, CapabilityContext context) {
        String searchPrompt = "You are a web search agent. Find relevant information for the query and provide a "
                + "concise answer with 2-3 simulated markdown links. Query: \"" + prompt + "\"";
        return new StepResult(capability().wireName(), llmClient.generate(searchPrompt));
    }
}
