package org.relaychat.exception;

/**
 * Opération refusée par une règle métier (message de l'expéditeur, pointeur en arrière, doublon...).
 */
public class InvalidOperationException extends RuntimeException {
    public InvalidOperationException(String message) {
        super(message);
    }
}
