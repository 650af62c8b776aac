package org.relaychat.broker;

/**
 * Publication sur le broker pub/sub. Lève une exception si le broker refuse le message.
 */
public interface EventPublisher {
    void publish(String channel, String payload);
}
