package ch.so.arp.assistant.chat;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import ch.so.arp.assistant.capability.CapabilityContext;
import ch.so.arp.assistant.llm.ImageAttachment;
import ch.so.arp.assistant.plan.ConversationTurn;
import ch.so.arp.assistant.retrieval.RetrievalService;
import ch.so.arp.assistant.retrieval.RetrievedContext;

/**
 * State of one conversation: its memory, indexed documents and the image
 * attached for the next analysis. Passed explicitly to planner and executor.
 */
public class AssistantSession implements CapabilityContext {

    private final String id;
    private final RetrievalService retrievalService;
    private final List<ConversationTurn> history = new ArrayList<>();
    private final AtomicReference<ImageAttachment> attachedImage = new AtomicReference<>();

    public AssistantSession(String id, RetrievalService retrievalService) {
        this.id = Objects.requireNonNull(id, "id");
        this.retrievalService = Objects.requireNonNull(retrievalService, "retrievalService");
    }

    public String getId() {
        return id;
    }

    public RetrievalService getRetrievalService() {
        return retrievalService;
    }

    public synchronized List<ConversationTurn> history() {
        return List.copyOf(history);
    }

    public synchronized List<ConversationTurn> recentHistory(int limit) {
        return List.copyOf(history.subList(Math.max(0, history.size() - limit), history.size()));
    }

    public synchronized void appendTurns(Collection<ConversationTurn> turns) {
        history.addAll(turns);
    }

    public void attachImage(ImageAttachment image) {
        attachedImage.set(Objects.requireNonNull(image, "image"));
    }

    public void detachImage() {
        attachedImage.set(null);
    }

    /**
     * Remove an uploaded file. An attached image of the same name is detached.
     */
    public void removeDocument(String sourceId) {
        retrievalService.remove(sourceId);
        attachedImage.updateAndGet(image -> image != null && sourceId.equals(image.name()) ? null : image);
    }

    @Override
    public List<RetrievedContext> retrieve(String question, int limit) {
        return retrievalService.query(question, limit);
    }

    @Override
    public Optional<String> documentText(String sourceId) {
        return retrievalService.documentText(sourceId);
    }

    @Override
    public Optional<ImageAttachment> attachedImage() {
        return Optional.ofNullable(attachedImage.get());
    }

    @Override
    public void consumeAttachedImage(ImageAttachment image) {
        attachedImage.compareAndSet(image, null);
    }
}
