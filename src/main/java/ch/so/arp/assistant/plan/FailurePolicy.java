package ch.so.arp.assistant.plan;

/**
 * What the executor does when a collaborator call fails inside a step.
 */
public enum FailurePolicy {

    /**
     * Mark the step failed, keep an explanatory result and run the next step.
     */
    CONTINUE,

    /**
     * Mark the step failed, skip the remaining steps and report the error.
     */
    ABORT
}
