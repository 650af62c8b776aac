package org.relaychat.model;

/**
 * Statut de livraison, ordonné : SENT &lt; DELIVERED &lt; READ.
 */
public enum MessageStatus {
    SENT, DELIVERED, READ;

    public boolean isAtLeast(MessageStatus other) {
        return this.ordinal() >= other.ordinal();
    }

    public static MessageStatus max(MessageStatus a, MessageStatus b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
