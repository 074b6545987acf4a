package ch.so.arp.assistant.chat;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Creates emitters with the configured timeout; zero keeps the stream open
 * until the plan has finished.
 */
public class DefaultSseEmitterFactory implements SseEmitterFactory {

    private final long timeoutMillis;

    public DefaultSseEmitterFactory(long timeoutMillis) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public SseEmitter create() {
        return new SseEmitter(timeoutMillis);
    }
}
