package ch.so.arp.assistant.plan;

import java.util.Optional;

/**
 * Closed set of specialised behaviours a plan step can be bound to. The wire
 * name is what the planner emits; the short name is accepted as an alias.
 */
public enum Capability {

    KNOWLEDGE("KnowledgeAgent", "Knowledge", "Searches through uploaded documents to answer questions."),
    WEB_SEARCH("WebSearchAgent", "WebSearch", "Searches the web for real-time information."),
    CODE_GENERATION("CodeGenerationAgent", "CodeGeneration", "Writes code in various programming languages."),
    IMAGE_ANALYSIS("ImageAnalysisAgent", "ImageAnalysis", "Analyzes an attached image."),
    SUMMARIZATION("SummarizationAgent", "Summarization", "Summarizes a given text or document.");

    private final String wireName;
    private final String shortName;
    private final String description;

    Capability(String wireName, String shortName, String description) {
        this.wireName = wireName;
        this.shortName = shortName;
        this.description = description;
    }

    public String wireName() {
        return wireName;
    }

    public String shortName() {
        return shortName;
    }

    public String description() {
        return description;
    }

    public static Optional<Capability> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String candidate = name.trim();
        for (Capability capability : values()) {
            if (capability.wireName.equals(candidate) || capability.shortName.equals(candidate)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }
}
