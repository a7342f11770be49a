package de.bsommerfeld.tweetkit.decoder;

/**
 * Thrown when a JSON payload lacks a required field, or carries it in the
 * wrong shape, so no entity can be built from it.
 */
public class MalformedEntityException extends RuntimeException {

    public MalformedEntityException(String message) {
        super(message);
    }

    public MalformedEntityException(String message, Throwable cause) {
        super(message, cause);
    }
}
