package de.bsommerfeld.tweetkit.cache;

/**
 * Thrown when an entity cannot be written to or read from its byte form.
 */
public class EntityCodecException extends RuntimeException {

    public EntityCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
