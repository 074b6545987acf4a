package ch.so.arp.assistant.capability;

import ch.so.arp.assistant.plan.Capability;
import ch.so.arp.assistant.plan.StepResult;

/**
 * Uniform contract of the handlers registered in the {@link CapabilityDispatcher}.
 */
public interface CapabilityHandler {

    Capability capability();

    /**
     * Run the capability for the resolved prompt. Missing inputs are reported as
     * a result text; failures of the language model propagate.
     */
    StepResult handle(String prompt, CapabilityContext context);
}
