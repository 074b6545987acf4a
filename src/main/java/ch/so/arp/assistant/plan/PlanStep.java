package ch.so.arp.assistant.plan;

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One step of a plan. The capability name is kept exactly as produced by the
 * planner; resolving it is left to the dispatcher.
 */
public record PlanStep(@JsonProperty("agent") String agent, @JsonProperty("prompt") String prompt) {

    public PlanStep {
        agent = agent == null ? "" : agent;
        Objects.requireNonNull(prompt, "prompt");
    }

    public static PlanStep of(Capability capability, String prompt) {
        return new PlanStep(capability.wireName(), prompt);
    }

    public Optional<Capability> capability() {
        return Capability.fromName(agent);
    }
}
