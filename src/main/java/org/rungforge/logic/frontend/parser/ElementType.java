package org.rungforge.logic.frontend.parser;

/**
 * The kinds of elements in a rung sequence.
 */
public enum ElementType {
    INSTRUCTION,
    BRANCH_START,
    BRANCH_NEXT,
    BRANCH_END
}
