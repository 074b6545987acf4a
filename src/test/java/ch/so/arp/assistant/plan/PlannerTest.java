package ch.so.arp.assistant.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.assistant.llm.LlmClient;
import ch.so.arp.assistant.llm.LlmException;

class PlannerTest {

    private final LlmClient llmClient = mock(LlmClient.class);
    private final Planner planner = new Planner(llmClient, new PlanParser(new ObjectMapper()));

    @Test
    void returnsParsedPlan() {
        when(llmClient.generate(anyString())).thenReturn("""
                ```json
                [{"agent": "WebSearchAgent", "prompt": "latest Java release"},
                 {"agent": "CodeGenerationAgent", "prompt": "Hello world in {{step_1_output}}"}]
                ```""");

        Plan plan = planner.createPlan("Write hello world in the latest Java", List.of());

        assertThat(plan.steps()).extracting(PlanStep::capability)
                .containsExactly(Optional.of(Capability.WEB_SEARCH), Optional.of(Capability.CODE_GENERATION));
    }

    @Test
    void fallsBackToWebSearchForUnparsableResponse() {
        when(llmClient.generate(anyString())).thenReturn("Sure! First I will search, then summarise.");

        Plan plan = planner.createPlan("What happened today?", List.of());

        assertThat(plan).isEqualTo(Plan.of(new PlanStep("WebSearchAgent", "What happened today?")));
    }

    @Test
    void fallsBackWhenTheModelFails() {
        when(llmClient.generate(anyString())).thenThrow(new LlmException("API Error: 503"));

        Plan plan = planner.createPlan("What happened today?", List.of());

        assertThat(plan).isEqualTo(Planner.fallbackPlan("What happened today?"));
    }

    @Test
    void missingRequestStillYieldsAPlan() {
        when(llmClient.generate(anyString())).thenThrow(new LlmException("API Error: 503"));

        assertThat(planner.createPlan(null, null)).isEqualTo(Plan.of(new PlanStep("WebSearchAgent", "")));
    }

    @Test
    void fallsBackWhenTheModelReturnsNothing() {
        when(llmClient.generate(anyString())).thenReturn(null);

        assertThat(planner.createPlan("hi", List.of()).size()).isEqualTo(1);
    }

    @Test
    void promptListsCapabilitiesRecentHistoryAndRequest() {
        when(llmClient.generate(anyString())).thenReturn("[]");
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("oldest question"),
                ConversationTurn.assistant("oldest answer", "WebSearchAgent"),
                ConversationTurn.user("second question"),
                ConversationTurn.assistant("second answer", "KnowledgeAgent"),
                ConversationTurn.user("third question"));

        planner.createPlan("Summarize report.pdf", history);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).generate(prompt.capture());
        assertThat(prompt.getValue())
                .contains("- KnowledgeAgent:", "- WebSearchAgent:", "- CodeGenerationAgent:",
                        "- ImageAnalysisAgent:", "- SummarizationAgent:")
                .contains("{{step_1_output}}")
                .contains("assistant: oldest answer\nuser: second question\nassistant: second answer\n"
                        + "user: third question")
                .doesNotContain("oldest question")
                .contains("User Prompt: \"Summarize report.pdf\"")
                .endsWith("Generate the JSON plan now.\n");
    }
}
