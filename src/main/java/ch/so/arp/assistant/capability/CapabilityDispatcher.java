package ch.so.arp.assistant.capability;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.assistant.plan.Capability;
import ch.so.arp.assistant.plan.StepDispatcher;
import ch.so.arp.assistant.plan.StepResult;

/**
 * Fixed registry from {@link Capability} to handler. Capability names that do
 * not resolve are answered with an explanatory result instead of an exception
 * so the remaining steps of a plan still run.
 */
public class CapabilityDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityDispatcher.class);

    private final Map<Capability, CapabilityHandler> handlers;

    public CapabilityDispatcher(List<CapabilityHandler> handlers) {
        Map<Capability, CapabilityHandler> registry = new EnumMap<>(Capability.class);
        for (CapabilityHandler handler : handlers) {
            CapabilityHandler previous = registry.put(handler.capability(), handler);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate handler for " + handler.capability());
            }
        }
        this.handlers = Collections.unmodifiableMap(registry);
        LOGGER.info("Registered capability handlers: {}", this.handlers.keySet());
    }

    public StepResult dispatch(String agent, String prompt, CapabilityContext context) {
        Objects.requireNonNull(context, "context");
        CapabilityHandler handler = Capability.fromName(agent).map(handlers::get).orElse(null);
        if (handler == null) {
            LOGGER.warn("No handler for capability '{}'", agent);
            return new StepResult(agent, "Error: Unknown agent \"" + agent + "\".");
        }
        return handler.handle(prompt, context);
    }

    /**
     * Bind the dispatcher to one session for a plan execution.
     */
    public StepDispatcher forContext(CapabilityContext context) {
        return (agent, prompt) -> dispatch(agent, prompt, context);
    }

    public boolean supports(Capability capability) {
        return handlers.containsKey(capability);
    }
}
