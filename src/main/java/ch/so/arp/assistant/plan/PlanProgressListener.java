package ch.so.arp.assistant.plan;

/**
 * Observer of a plan execution. All callbacks happen on the executing thread.
 */
public interface PlanProgressListener {

    PlanProgressListener NONE = new PlanProgressListener() {
    };

    default void onStepStarted(StepProgress progress) {
    }

    default void onStepCompleted(int position, StepResult result) {
    }

    default void onStepFailed(int position, StepResult result, Exception failure) {
    }
}
