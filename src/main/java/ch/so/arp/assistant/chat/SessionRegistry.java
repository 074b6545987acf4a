package ch.so.arp.assistant.chat;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.assistant.retrieval.RetrievalService;

/**
 * Holds the live sessions. Every session gets its own retrieval engine.
 */
public class SessionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, AssistantSession> sessions = new ConcurrentHashMap<>();
    private final Function<String, RetrievalService> retrievalFactory;

    public SessionRegistry(Function<String, RetrievalService> retrievalFactory) {
        this.retrievalFactory = Objects.requireNonNull(retrievalFactory, "retrievalFactory");
    }

    public AssistantSession create() {
        String id = UUID.randomUUID().toString();
        AssistantSession session = new AssistantSession(id, retrievalFactory.apply(id));
        sessions.put(id, session);
        LOGGER.info("Created session {}", id);
        return session;
    }

    /**
     * @throws SessionNotFoundException if no session has the given id
     */
    public AssistantSession get(String id) {
        AssistantSession session = sessions.get(id);
        if (session == null) {
            throw new SessionNotFoundException(id);
        }
        return session;
    }

    public void remove(String id) {
        if (sessions.remove(id) != null) {
            LOGGER.info("Closed session {}", id);
        }
    }

    public int size() {
        return sessions.size();
    }
}
