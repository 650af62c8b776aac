package org.relaychat.dto.ws;

/**
 * Enveloppe de chaque envoi vers {@code /user/queue/events}.
 */
public record WsEnvelope(String event, Object data) {
}
