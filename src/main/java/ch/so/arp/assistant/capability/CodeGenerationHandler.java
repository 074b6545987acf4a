package ch.so.arp.assistant.capability;

import java.util.Objects;

import ch.so.arp.assistant.llm.LlmClient;
import ch.so.arp.assistant.plan.Capability;
import ch.so.arp.assistant.plan.StepResult;

/**
 * Asks the model for a single fenced code block. The answer is not validated.
 */
public class CodeGenerationHandler implements CapabilityHandler {

    private final LlmClient llmClient;

    public CodeGenerationHandler(LlmClient llmClient) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    }

    @Override
    public Capability capability() {
        return Capability.CODE_GENERATION;
    }

    @Override
    public StepResult handle(String prompt, CapabilityContext context) {
        String codePrompt = "You are a code generation agent. Generate a code snippet for the request. "
                + "Provide only the code in a markdown block. Request: \"" + prompt + "\"";
        return new StepResult(capability().wireName(), llmClient.generate(codePrompt));
    }
}
