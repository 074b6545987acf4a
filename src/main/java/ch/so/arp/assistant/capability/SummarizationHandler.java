package ch.so.arp.assistant.capability;

import java.util.Objects;

import ch.so.arp.assistant.llm.LlmClient;
import ch.so.arp.assistant.plan.Capability;
import ch.so.arp.assistant.plan.StepResult;

/**
 * Summarises either a known document, when the prompt names one, or the prompt
 * text itself.
 */
public class SummarizationHandler implements CapabilityHandler {

    private final LlmClient llmClient;

    public SummarizationHandler(LlmClient llmClient) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    }

    @Override
    public Capability capability() {
        return Capability.SUMMARIZATION;
    }

    @Override
    public StepResult handle(String prompt, CapabilityContext context) {
        String text = prompt == null ? "" : context.documentText(prompt.trim()).orElse(prompt);
        if (text.isBlank()) {
            return new StepResult(capability().wireName(),
                    "Error: Could not find document or text to summarize for \"" + prompt + "\".");
        }
        String summaryPrompt = "Provide a concise, professional summary of the following text:\n\n--- TEXT ---\n"
                + text + "\n--- END TEXT ---";
        return new StepResult(capability().wireName(), llmClient.generate(summaryPrompt));
    }
}
