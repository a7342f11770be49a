package de.bsommerfeld.tweetkit.core.domain;

/**
 * Thrown when a viewer-dependent operation is invoked on a Tweet that is not
 * bound to a viewing user.
 */
public class MissingPerspectiveException extends IllegalStateException {

    public MissingPerspectiveException(String message) {
        super(message);
    }
}
