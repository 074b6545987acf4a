package ch.so.arp.assistant.plan;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PlaceholderTemplateTest {

    @Test
    void substitutesOutputsOfEarlierSteps() {
        StepOutputs outputs = new StepOutputs();
        outputs.record(1, "RESULT");

        assertThat(PlaceholderTemplate.parse("use {{step_1_output}}").resolve(outputs, 2)).isEqualTo("use RESULT");
    }

    @Test
    void replacesEveryOccurrence() {
        StepOutputs outputs = new StepOutputs();
        outputs.record(1, "A");
        outputs.record(2, "B");

        String resolved = PlaceholderTemplate.parse("{{step_1_output}}+{{step_2_output}}={{step_1_output}}{{step_2_output}}")
                .resolve(outputs, 3);

        assertThat(resolved).isEqualTo("A+B=AB");
    }

    @Test
    void leavesOutOfRangeReferencesUntouched() {
        StepOutputs outputs = new StepOutputs();

        assertThat(PlaceholderTemplate.parse("see {{step_3_output}}").resolve(outputs, 1))
                .isEqualTo("see {{step_3_output}}");
    }

    @Test
    void neverSubstitutesTheCurrentOrLaterSteps() {
        StepOutputs outputs = new StepOutputs();
        outputs.record(1, "one");
        outputs.record(2, "two");

        assertThat(PlaceholderTemplate.parse("{{step_1_output}} {{step_2_output}}").resolve(outputs, 2))
                .isEqualTo("one {{step_2_output}}");
    }

    @Test
    void keepsMalformedMarkersAsLiteralText() {
        StepOutputs outputs = new StepOutputs();
        outputs.record(1, "X");

        String template = "{{step_one_output}} {{step_1_output {step_1_output} {{{step_1_output}}}} {{}}";

        assertThat(PlaceholderTemplate.parse(template).resolve(outputs, 2))
                .isEqualTo("{{step_one_output}} {{step_1_output {step_1_output} {X}} {{}}");
    }

    @Test
    void outputContainingPlaceholderSyntaxIsNotResolvedAgain() {
        StepOutputs outputs = new StepOutputs();
        outputs.record(1, "{{step_2_output}}");
        outputs.record(2, "second");

        assertThat(PlaceholderTemplate.parse("{{step_1_output}}").resolve(outputs, 3)).isEqualTo("{{step_2_output}}");
    }

    @Test
    void exposesReferencedSteps() {
        assertThat(PlaceholderTemplate.parse("{{step_2_output}} and {{step_10_output}} plain").referencedSteps())
                .containsExactly(2, 10);
        assertThat(PlaceholderTemplate.parse("no references").referencedSteps()).isEmpty();
    }

    @Test
    void referencesWithLeadingZerosStayLiteral() {
        StepOutputs outputs = new StepOutputs();
        outputs.record(1, "RESULT");

        assertThat(PlaceholderTemplate.parse("use {{step_01_output}}").resolve(outputs, 2))
                .isEqualTo("use {{step_01_output}}");
    }

    @Test
    void referencesWithNonAsciiDigitsStayLiteral() {
        StepOutputs outputs = new StepOutputs();
        outputs.record(1, "RESULT");

        assertThat(PlaceholderTemplate.parse("use {{step_\u0661_output}}").resolve(outputs, 2))
                .isEqualTo("use {{step_\u0661_output}}");
    }
}
