package org.rungforge.logic.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link RungLexer} can recognize.
 */
public enum TokenType {
    /** A complete instruction span such as {@code XIC(Tag[0])}. */
    INSTRUCTION("", false),
    /** The '[' character outside of every instruction, opening a parallel branch. */
    BRANCH_START("[", true),
    /** The ',' character outside of every instruction, starting the next arm of a branch. */
    BRANCH_NEXT(",", true),
    /** The ']' character outside of every instruction, closing a parallel branch. */
    BRANCH_END("]", true);

    private final String symbol;
    private final boolean structural;

    TokenType(String symbol, boolean structural) {
        this.symbol = symbol;
        this.structural = structural;
    }

    /**
     * @return The literal text of a structural token, or an empty string for instructions.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} for branch structure tokens.
     */
    public boolean isStructural() {
        return structural;
    }

    /**
     * Maps a structural character to its token type.
     * @param c The character.
     * @return The token type, or {@code null} if the character is not structural.
     */
    public static TokenType ofStructural(char c) {
        return switch (c) {
            case '[' -> BRANCH_START;
            case ',' -> BRANCH_NEXT;
            case ']' -> BRANCH_END;
            default -> null;
        };
    }
}
