package ch.so.arp.assistant.capability;

import java.util.Objects;
import java.util.Optional;

import ch.so.arp.assistant.llm.ImageAttachment;
import ch.so.arp.assistant.llm.LlmClient;
import ch.so.arp.assistant.plan.Capability;
import ch.so.arp.assistant.plan.StepResult;

/**
 * Sends the prompt together with the attached image to the model. The image is
 * detached after a successful analysis.
 */
public class ImageAnalysisHandler implements CapabilityHandler {

    private final LlmClient llmClient;

    public ImageAnalysisHandler(LlmClient llmClient) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    }

    @Override
    public Capability capability() {
        return Capability.IMAGE_ANALYSIS;
    }

    @Override
    public StepResult handle(String prompt, CapabilityContext context) {
        Optional<ImageAttachment> image = context.attachedImage();
        if (image.isEmpty()) {
            return new StepResult(capability().wireName(), "Error: No image was attached.");
        }
        String answer = llmClient.generate(prompt, image.get());
        context.consumeAttachedImage(image.get());
        return new StepResult(capability().wireName(), answer);
    }
}
