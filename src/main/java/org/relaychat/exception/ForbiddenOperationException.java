package org.relaychat.exception;

/**
 * L'appelant n'est pas autorisé (pas participant, pas l'expéditeur).
 */
public class ForbiddenOperationException extends RuntimeException {
    public ForbiddenOperationException(String message) {
        super(message);
    }
}
