package ch.so.arp.assistant.chat;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.assistant.llm.ImageAttachment;
import ch.so.arp.assistant.plan.ConversationTurn;
import ch.so.arp.assistant.retrieval.SourceDocument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Session lifecycle, knowledge base uploads and image attachment.
 */
@RestController
@RequestMapping(path = "/api/sessions", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class SessionController {

    private final SessionRegistry sessionRegistry;

    public SessionController(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionResponse create() {
        return new SessionResponse(sessionRegistry.create().getId());
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void close(@PathVariable String sessionId) {
        sessionRegistry.get(sessionId);
        sessionRegistry.remove(sessionId);
    }

    @GetMapping("/{sessionId}/history")
    public List<ConversationTurn> history(@PathVariable String sessionId) {
        return sessionRegistry.get(sessionId).history();
    }

    @PostMapping(path = "/{sessionId}/documents", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<DocumentResponse> upload(@PathVariable String sessionId, @Valid @RequestBody IngestRequest request) {
        AssistantSession session = sessionRegistry.get(sessionId);
        List<SourceDocument> documents = request.documents().stream()
                .map(document -> new SourceDocument(document.sourceId(), document.text()))
                .toList();
        Map<String, Integer> counts = session.getRetrievalService().ingestAll(documents);
        return counts.entrySet().stream()
                .map(entry -> new DocumentResponse(entry.getKey(), entry.getValue()))
                .toList();
    }

    @GetMapping("/{sessionId}/documents")
    public Set<String> documents(@PathVariable String sessionId) {
        return sessionRegistry.get(sessionId).getRetrievalService().sourceIds();
    }

    @DeleteMapping("/{sessionId}/documents/{sourceId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeDocument(@PathVariable String sessionId, @PathVariable String sourceId) {
        sessionRegistry.get(sessionId).removeDocument(sourceId);
    }

    @PutMapping(path = "/{sessionId}/image", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void attachImage(@PathVariable String sessionId, @Valid @RequestBody ImageRequest request) {
        sessionRegistry.get(sessionId)
                .attachImage(new ImageAttachment(request.name(), request.mimeType(), request.base64Data()));
    }

    @DeleteMapping("/{sessionId}/image")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void detachImage(@PathVariable String sessionId) {
        sessionRegistry.get(sessionId).detachImage();
    }

    public record SessionResponse(String id) {
    }

    public record DocumentUpload(@NotBlank String sourceId, @NotNull String text) {
    }

    public record IngestRequest(@NotEmpty List<@Valid DocumentUpload> documents) {
    }

    public record DocumentResponse(String sourceId, int chunks) {
    }

    public record ImageRequest(@NotBlank String name, @NotBlank String mimeType, @NotBlank String base64Data) {
    }
}
