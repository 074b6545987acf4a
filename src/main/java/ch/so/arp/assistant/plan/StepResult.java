package ch.so.arp.assistant.plan;

import java.util.List;
import java.util.Objects;

/**
 * Output of one capability invocation. An empty source list means the result
 * is not grounded on retrieved documents.
 */
public record StepResult(String capability, String text, List<SourceReference> sources) {

    public StepResult {
        capability = capability == null ? "" : capability;
        Objects.requireNonNull(text, "text");
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public StepResult(String capability, String text) {
        this(capability, text, List.of());
    }

    public boolean hasSources() {
        return !sources.isEmpty();
    }
}
