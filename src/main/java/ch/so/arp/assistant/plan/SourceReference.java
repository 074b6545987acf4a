package ch.so.arp.assistant.plan;

/**
 * Retrieved chunk a step result is grounded on.
 */
public record SourceReference(String sourceId, String text) {
}
