package ch.so.arp.assistant.capability;

import java.util.List;
import java.util.Optional;

import ch.so.arp.assistant.llm.ImageAttachment;
import ch.so.arp.assistant.retrieval.RetrievedContext;

/**
 * Session state a capability handler may read from while running a step.
 */
public interface CapabilityContext {

    List<RetrievedContext> retrieve(String question, int limit);

    Optional<String> documentText(String sourceId);

    Optional<ImageAttachment> attachedImage();

    /**
     * Detach the given image once it has been analysed. An image attached in the
     * meantime stays attached.
     */
    void consumeAttachedImage(ImageAttachment image);
}
