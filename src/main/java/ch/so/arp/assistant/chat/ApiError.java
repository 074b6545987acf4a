package ch.so.arp.assistant.chat;

import java.time.Instant;

/**
 * Structured error body returned by the REST endpoints.
 */
public record ApiError(String code, String message, String path, Instant timestamp) {

    static final String SESSION_NOT_FOUND = "SESSION_001";
    static final String VALIDATION_ERROR = "VALIDATION_001";
}
