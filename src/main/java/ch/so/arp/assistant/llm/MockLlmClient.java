package ch.so.arp.assistant.llm;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * hosted model should not be contacted. Planning prompts are answered with a
 * one-step plan so the whole pipeline can be exercised offline.
 */
public class MockLlmClient implements LlmClient {

    static final String PLANNER_MARKER = "Generate the JSON plan now.";

    @Override
    public String generate(String prompt, ImageAttachment image) {
        if (prompt.contains(PLANNER_MARKER)) {
            return """
                    ```json
                    [{"agent": "KnowledgeAgent", "prompt": "%s"}]
                    ```""".formatted(lastQuotedRequest(prompt));
        }
        StringBuilder answer = new StringBuilder("[mocked answer] ");
        if (image != null) {
            answer.append("Image of type ").append(image.mimeType()).append(" received. ");
        }
        answer.append("Prompt was: ").append(prompt);
        return answer.toString();
    }

    private String lastQuotedRequest(String prompt) {
        String marker = "User Prompt: \"";
        int start = prompt.lastIndexOf(marker);
        if (start < 0) {
            return "";
        }
        int end = prompt.indexOf('\n', start);
        String request = end < 0 ? prompt.substring(start + marker.length())
                : prompt.substring(start + marker.length(), end);
        if (request.endsWith("\"")) {
            request = request.substring(0, request.length() - 1);
        }
        return request.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
