package ch.so.arp.assistant.llm;

/**
 * Raised when the language model call fails. The core never retries; callers
 * decide whether the failure is absorbed or surfaced.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
