package ch.so.arp.assistant.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Prompt template split into literal text and {@code {{step_N_output}}}
 * references. Resolution replaces a reference only when the referenced step is
 * an earlier one and has recorded an output; every other reference is written
 * back unchanged.
 */
public final class PlaceholderTemplate {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";
    private static final String PREFIX = "step_";
    private static final String SUFFIX = "_output";
    private static final int MAX_INDEX_DIGITS = 9;

    private final List<Token> tokens;

    private PlaceholderTemplate(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public static PlaceholderTemplate parse(String template) {
        Objects.requireNonNull(template, "template");
        List<Token> tokens = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int position = 0;
        while (position < template.length()) {
            int open = template.indexOf(OPEN, position);
            if (open < 0) {
                literal.append(template, position, template.length());
                break;
            }
            literal.append(template, position, open);
            int close = template.indexOf(CLOSE, open + OPEN.length());
            int stepIndex = close < 0 ? -1 : stepIndex(template.substring(open + OPEN.length(), close));
            if (stepIndex < 0) {
                literal.append(template.charAt(open));
                position = open + 1;
                continue;
            }
            if (literal.length() > 0) {
                tokens.add(new Literal(literal.toString()));
                literal.setLength(0);
            }
            tokens.add(new Placeholder(stepIndex, template.substring(open, close + CLOSE.length())));
            position = close + CLOSE.length();
        }
        if (literal.length() > 0) {
            tokens.add(new Literal(literal.toString()));
        }
        return new PlaceholderTemplate(tokens);
    }

    /**
     * Substitute the outputs of steps before {@code currentPosition}.
     *
     * @param outputs         outputs recorded so far
     * @param currentPosition 1-based position of the step being prepared
     */
    public String resolve(StepOutputs outputs, int currentPosition) {
        StringBuilder resolved = new StringBuilder();
        for (Token token : tokens) {
            if (token instanceof Placeholder placeholder) {
                String output = placeholder.stepIndex() < currentPosition
                        ? outputs.get(placeholder.stepIndex()).orElse(null)
                        : null;
                resolved.append(output != null ? output : placeholder.raw());
            } else {
                resolved.append(((Literal) token).text());
            }
        }
        return resolved.toString();
    }

    public List<Integer> referencedSteps() {
        return tokens.stream()
                .filter(Placeholder.class::isInstance)
                .map(token -> ((Placeholder) token).stepIndex())
                .toList();
    }

    List<Token> tokens() {
        return tokens;
    }

    private static int stepIndex(String inner) {
        if (!inner.startsWith(PREFIX) || !inner.endsWith(SUFFIX)) {
            return -1;
        }
        String digits = inner.substring(PREFIX.length(), inner.length() - SUFFIX.length());
        if (digits.isEmpty() || digits.length() > MAX_INDEX_DIGITS) {
            return -1;
        }
        if (digits.charAt(0) == '0') {
            return -1;
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        return Integer.parseInt(digits);
    }

    sealed interface Token permits Literal, Placeholder {
    }

    record Literal(String text) implements Token {
    }

    record Placeholder(int stepIndex, String raw) implements Token {
    }
}
