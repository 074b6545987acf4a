package ch.so.arp.assistant.plan;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, non-empty ordered list of plan steps.
 */
public record Plan(List<PlanStep> steps) {

    public Plan {
        Objects.requireNonNull(steps, "steps");
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("a plan needs at least one step");
        }
        steps = List.copyOf(steps);
    }

    public static Plan of(PlanStep... steps) {
        return new Plan(List.of(steps));
    }

    public int size() {
        return steps.size();
    }

    /**
     * @param position 1-based step position
     */
    public PlanStep step(int position) {
        return steps.get(position - 1);
    }
}
