package ch.so.arp.assistant.capability;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import ch.so.arp.assistant.llm.LlmClient;
import ch.so.arp.assistant.plan.Capability;
import ch.so.arp.assistant.plan.SourceReference;
import ch.so.arp.assistant.plan.StepResult;
import ch.so.arp.assistant.retrieval.RetrievedContext;

/**
 * Answers a question strictly from the indexed documents of the session.
 */
public class KnowledgeHandler implements CapabilityHandler {

    static final String NO_CONTEXT_ANSWER =
            "I couldn't find any relevant information in the uploaded documents to answer that.";

    private final LlmClient llmClient;
    private final int contextLimit;

    public KnowledgeHandler(LlmClient llmClient, int contextLimit) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        if (contextLimit < 0) {
            throw new IllegalArgumentException("contextLimit must not be negative");
        }
        this.contextLimit = contextLimit;
    }

    @Override
    public Capability capability() {
        return Capability.KNOWLEDGE;
    }

    @Override
    public StepResult handle(String prompt, CapabilityContext context) {
        List<RetrievedContext> retrieved = context.retrieve(prompt, contextLimit);
        if (retrieved.isEmpty()) {
            return new StepResult(capability().wireName(), NO_CONTEXT_ANSWER);
        }
        String contextBlock = retrieved.stream()
                .map(RetrievedContext::formatForPrompt)
                .collect(Collectors.joining("\n\n---\n\n"));
        String augmentedPrompt = """
                Based *only* on the context below, answer the user's question.

                --- CONTEXT ---
                %s
                --- END CONTEXT ---

                User Question: "%s\"""".formatted(contextBlock, prompt);
        String answer = llmClient.generate(augmentedPrompt);
        List<SourceReference> sources = retrieved.stream()
                .map(hit -> new SourceReference(hit.sourceId(), hit.content()))
                .toList();
        return new StepResult(capability().wireName(), answer, sources);
    }
}
