package org.rungforge.logic.diagnostics;

/**
 * A piece of rung text the tokenizer could not use.
 *
 * @param kind Why the text was skipped.
 * @param text The skipped text.
 * @param offset The character offset of the text in the rung.
 */
public record Diagnostic(
        Kind kind,
        String text,
        int offset
) {
    /**
     * The reason a piece of text was skipped.
     */
    public enum Kind {
        /** An instruction whose parentheses never close; everything from its opcode on is lost. */
        DROPPED_INSTRUCTION("Dropped instruction with unbalanced parentheses"),
        /** Text between instructions that is neither an instruction nor branch syntax. */
        IGNORED_TEXT("Ignored text outside of instructions");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return String.format("[%s] @%d: %s: %s", kind, offset, kind.getDescription(), text);
    }
}
