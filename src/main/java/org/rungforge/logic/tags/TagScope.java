package org.rungforge.logic.tags;

/**
 * The visibility of a tag.
 */
public enum TagScope {
    /** Visible controller-wide. */
    CONTROLLER,
    /** Visible only within one program or add-on instruction. */
    PROGRAM
}
