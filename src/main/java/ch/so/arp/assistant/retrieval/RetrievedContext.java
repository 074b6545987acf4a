package ch.so.arp.assistant.retrieval;

/**
 * Result element returned by the retrieval engine after similarity ranking.
 */
public record RetrievedContext(String sourceId, String content, double score) {

    /**
     * Formats the context in the representation used inside the knowledge
     * prompt, keeping the source next to the text so the model can cite it.
     */
    public String formatForPrompt() {
        return "Source: " + sourceId + "\nContent:\n" + content;
    }
}
