package ch.so.arp.assistant.llm;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke a hosted model or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Generate text for the given prompt.
     *
     * @param prompt the complete prompt
     * @return the generated text
     * @throws LlmException if the model could not be reached or returned no text
     */
    default String generate(String prompt) {
        return generate(prompt, null);
    }

    /**
     * Generate text for the given prompt and an optional image.
     *
     * @param prompt the complete prompt
     * @param image  inline image payload, may be {@code null}
     * @return the generated text
     * @throws LlmException if the model could not be reached or returned no text
     */
    String generate(String prompt, ImageAttachment image);
}
