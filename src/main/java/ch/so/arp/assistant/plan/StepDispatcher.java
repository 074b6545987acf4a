package ch.so.arp.assistant.plan;

/**
 * Executes the capability a step is bound to.
 */
@FunctionalInterface
public interface StepDispatcher {

    /**
     * @param agent  capability name exactly as found in the plan
     * @param prompt resolved prompt
     * @return the step result; unknown capabilities yield an explanatory result
     * @throws RuntimeException when a collaborator of the capability fails
     */
    StepResult dispatch(String agent, String prompt);
}
