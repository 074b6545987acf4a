package ch.so.arp.assistant.plan;

/**
 * Notification emitted right before a step is dispatched.
 *
 * @param current 1-based position of the step
 * @param total   number of steps in the plan
 * @param agent   capability name of the step
 * @param task    prompt after placeholder resolution
 */
public record StepProgress(int current, int total, String agent, String task) {
}
