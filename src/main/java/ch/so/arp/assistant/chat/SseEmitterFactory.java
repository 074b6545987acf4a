package ch.so.arp.assistant.chat;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Factory abstraction to create {@link SseEmitter} instances. This indirection makes
 * it easier to unit test components that rely on server sent events.
 */
@FunctionalInterface
public interface SseEmitterFactory {

    SseEmitter create();
}
