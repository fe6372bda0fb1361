package org.rungforge.logic.api;

/**
 * An exception that is thrown when rung text violates the branch structure grammar.
 * <p>
 * No partially built structure is ever exposed when this exception is thrown: rung construction
 * aborts and mutations leave the rung in its previous state.
 */
public class RungParseException extends Exception {

    private final RungErrorCode code;
    private final int position;

    /**
     * Constructs a new parse exception.
     * @param code The error code.
     * @param message The detail message.
     * @param position The token position at which the error was detected, or -1 if not applicable.
     */
    public RungParseException(RungErrorCode code, String message, int position) {
        super(position >= 0 ? String.format("%s at token %d", message, position) : message, null);
        this.code = code;
        this.position = position;
    }

    /**
     * Constructs a new parse exception without position information.
     * @param code The error code.
     * @param message The detail message.
     */
    public RungParseException(RungErrorCode code, String message) {
        this(code, message, -1);
    }

    /**
     * @return The error code describing the structural violation.
     */
    public RungErrorCode getCode() {
        return code;
    }

    /**
     * @return The token position of the violation, or -1 if unknown.
     */
    public int getPosition() {
        return position;
    }
}
