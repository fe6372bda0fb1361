package org.rungforge.logic.frontend.parser;

import org.rungforge.logic.diagnostics.Diagnostic;
import org.rungforge.logic.frontend.lexer.Token;
import org.rungforge.logic.model.Instruction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The complete derived structure of one rung text. Built wholesale by the {@link RungParser} and
 * never updated afterwards.
 *
 * @param text The canonical rung text, terminated by ';'.
 * @param tokens The tokens of the text.
 * @param instructions The instructions, in order of appearance.
 * @param sequence One element per token.
 * @param branches All branches and branch arms by id, in order of appearance.
 * @param healPasses The number of degenerate branches removed while parsing.
 * @param diagnostics Warnings raised by the tokenizer.
 */
public record RungStructure(
        String text,
        List<Token> tokens,
        List<Instruction> instructions,
        List<SequenceElement> sequence,
        Map<String, Branch> branches,
        int healPasses,
        List<Diagnostic> diagnostics
) {

    public RungStructure {
        tokens = List.copyOf(tokens);
        instructions = List.copyOf(instructions);
        sequence = List.copyOf(sequence);
        branches = Collections.unmodifiableMap(new LinkedHashMap<>(branches));
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return {@code true} if at least one degenerate branch was removed.
     */
    public boolean wasHealed() {
        return healPasses > 0;
    }
}
