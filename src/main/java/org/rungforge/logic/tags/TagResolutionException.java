package org.rungforge.logic.tags;

/**
 * Thrown when tag data cannot be resolved, e.g. because an alias chain refers back to itself.
 * This indicates corrupt external data rather than a programming error in the caller.
 */
public class TagResolutionException extends RuntimeException {

    /**
     * @param message The detail message.
     */
    public TagResolutionException(String message) {
        super(message);
    }
}
