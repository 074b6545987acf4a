package ch.so.arp.assistant.plan;

/**
 * Final state of one step after a plan execution. Skipped steps carry neither a
 * resolved prompt nor a result.
 */
public record StepOutcome(int position, PlanStep step, StepStatus status, String resolvedPrompt, StepResult result) {
}
