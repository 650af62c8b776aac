package org.relaychat.exception;

/**
 * Email ou pseudo déjà utilisé.
 */
public class ConflictException extends RuntimeException {
    public ConflictException(String message) {
        super(message);
    }
}
