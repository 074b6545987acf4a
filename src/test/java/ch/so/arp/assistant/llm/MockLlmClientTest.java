package ch.so.arp.assistant.llm;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MockLlmClientTest {

    private final MockLlmClient client = new MockLlmClient();

    @Test
    void answersPlanningPromptsWithAKnowledgeStep() {
        String plan = client.generate("Conversation History:\n\nUser Prompt: \"Say \"hi\"\"\n\n"
                + "Generate the JSON plan now.\n");

        assertThat(plan).isEqualTo("```json\n[{\"agent\": \"KnowledgeAgent\", \"prompt\": \"Say \\\"hi\\\"\"}]\n```");
    }

    @Test
    void echoesOtherPrompts() {
        assertThat(client.generate("Summarize this")).isEqualTo("[mocked answer] Prompt was: Summarize this");
        assertThat(client.generate("Look", new ImageAttachment("a.png", "image/png", "aGVsbG8=")))
                .isEqualTo("[mocked answer] Image of type image/png received. Prompt was: Look");
    }
}
