package ch.so.arp.assistant.llm;

import java.util.Objects;

/**
 * Image that is sent inline to the language model next to the prompt.
 */
public record ImageAttachment(String name, String mimeType, String base64Data) {

    public ImageAttachment {
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(base64Data, "base64Data");
    }
}
