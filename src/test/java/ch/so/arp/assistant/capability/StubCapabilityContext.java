package ch.so.arp.assistant.capability;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import ch.so.arp.assistant.llm.ImageAttachment;
import ch.so.arp.assistant.retrieval.RetrievedContext;

class StubCapabilityContext implements CapabilityContext {

    final List<RetrievedContext> retrieved = new ArrayList<>();
    final Map<String, String> documents = new HashMap<>();
    final List<String> questions = new ArrayList<>();
    ImageAttachment image;

    @Override
    public List<RetrievedContext> retrieve(String question, int limit) {
        questions.add(question + "@" + limit);
        return retrieved.subList(0, Math.min(limit, retrieved.size()));
    }

    @Override
    public Optional<String> documentText(String sourceId) {
        return Optional.ofNullable(documents.get(sourceId));
    }

    @Override
    public Optional<ImageAttachment> attachedImage() {
        return Optional.ofNullable(image);
    }

    @Override
    public void consumeAttachedImage(ImageAttachment analysed) {
        if (image == analysed) {
            image = null;
        }
    }
}
