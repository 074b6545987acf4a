package ch.so.arp.assistant.plan;

/**
 * Lifecycle of a plan step during execution.
 */
public enum StepStatus {
    PENDING, RUNNING, COMPLETED, FAILED, SKIPPED
}
