package ch.so.arp.assistant.plan;

import java.util.Objects;

/**
 * Entry of the conversation memory. The capability is set on assistant turns
 * that were produced by a plan step.
 */
public record ConversationTurn(Role role, String text, String capability) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        text = text == null ? "" : text;
    }

    public static ConversationTurn user(String text) {
        return new ConversationTurn(Role.USER, text, null);
    }

    public static ConversationTurn assistant(String text, String capability) {
        return new ConversationTurn(Role.ASSISTANT, text, capability);
    }

    String render() {
        return role.label() + ": " + text;
    }

    public enum Role {
        USER("user"), ASSISTANT("assistant");

        private final String label;

        Role(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
