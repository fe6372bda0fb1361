package org.rungforge.logic.frontend.lexer;

/**
 * Represents a single token extracted from rung text by the {@link RungLexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token.
 * @param start The character offset where the token begins, or -1 for synthesized tokens.
 * @param end The character offset just past the token, or -1 for synthesized tokens.
 */
public record Token(
        TokenType type,
        String text,
        int start,
        int end
) {

    /**
     * Creates a token that was not read from text, e.g. one inserted by a rung mutation.
     * @param type The token type.
     * @param text The token text.
     * @return The synthesized token.
     */
    public static Token synthesized(TokenType type, String text) {
        return new Token(type, text, -1, -1);
    }

    /**
     * Creates a synthesized structural token.
     * @param type A structural token type.
     * @return The synthesized token.
     */
    public static Token structural(TokenType type) {
        if (!type.isStructural()) {
            throw new IllegalArgumentException("Not a structural token type: " + type);
        }
        return synthesized(type, type.symbol());
    }

    /**
     * Creates a synthesized instruction token.
     * @param text The instruction text.
     * @return The synthesized token.
     */
    public static Token instruction(String text) {
        return synthesized(TokenType.INSTRUCTION, text);
    }

    /**
     * @return {@code true} if this token is an instruction span.
     */
    public boolean isInstruction() {
        return type == TokenType.INSTRUCTION;
    }
}
