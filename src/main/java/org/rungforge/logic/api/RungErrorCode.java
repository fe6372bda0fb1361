package org.rungforge.logic.api;

/**
 * Defines unique, testable error codes for the structural errors that can occur while parsing rung text.
 * This decouples the test logic from the wording of the error messages.
 */
public enum RungErrorCode {
    // region Branch structure
    /** A next-branch marker ',' was found outside of any open branch. */
    NEXT_OUTSIDE_BRANCH,
    /** A branch end ']' was found without a matching branch start. */
    UNMATCHED_BRANCH_END,
    /** The text ended while at least one branch was still open. */
    UNCLOSED_BRANCH,
    /** A branch without any next-branch marker was found and healing is disabled. */
    DEGENERATE_BRANCH,
    /** Degenerate branches kept appearing after the configured number of heal passes. */
    HEAL_LIMIT_EXCEEDED,
    // endregion

    // region Instructions
    /** An instruction token could not be matched to an extracted instruction. */
    INSTRUCTION_NOT_FOUND
    // endregion
}
