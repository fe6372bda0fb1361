package org.rungforge.logic.frontend.parser;

import org.rungforge.logic.api.RungErrorCode;
import org.rungforge.logic.api.RungParseException;
import org.rungforge.logic.diagnostics.DiagnosticsEngine;
import org.rungforge.logic.frontend.lexer.RungLexer;
import org.rungforge.logic.frontend.lexer.Token;
import org.rungforge.logic.model.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses rung text into a {@link RungStructure}.
 * <p>
 * Each pass tokenizes the text, creates the instructions and runs the {@link SequenceBuilder}.
 * When the builder reports a degenerate branch, its two bracket tokens are removed, the text is
 * rewritten from the remaining tokens and the parse starts over. Every removal strictly shrinks the
 * token list, and the number of passes is additionally capped by
 * {@link ParserSettings#maxHealPasses()}.
 */
public class RungParser {

    private static final Logger LOG = LoggerFactory.getLogger(RungParser.class);

    /**
     * Creates the instruction objects for one parse pass.
     */
    @FunctionalInterface
    public interface InstructionFactory {
        /**
         * @param text The instruction text.
         * @param index The ordinal of the instruction within the rung.
         * @return The new instruction.
         */
        Instruction create(String text, int index);
    }

    private final ParserSettings settings;

    public RungParser(ParserSettings settings) {
        this.settings = settings;
    }

    public RungParser() {
        this(ParserSettings.defaults());
    }

    /**
     * Parses the given text.
     *
     * @param text The rung text, with or without the terminating ';'.
     * @param rungNumber The rung number used for branch ids.
     * @param factory Creates the instructions of the rung.
     * @return The parsed structure. Its text is the given text unless degenerate branches were removed.
     * @throws RungParseException if the branch structure is invalid, or a degenerate branch is found
     *                            while healing is disabled or exhausted.
     */
    public RungStructure parse(String text, int rungNumber, InstructionFactory factory) throws RungParseException {
        String current = terminate(text);
        SequenceBuilder builder = new SequenceBuilder(rungNumber);
        int healPasses = 0;

        while (true) {
            DiagnosticsEngine diagnostics = new DiagnosticsEngine();
            List<Token> tokens = new RungLexer(current, diagnostics).scanTokens();
            List<Instruction> instructions = new ArrayList<>();
            for (Token token : tokens) {
                if (token.isInstruction()) {
                    instructions.add(factory.create(token.text(), instructions.size()));
                }
            }

            SequenceBuilder.Result result = builder.build(tokens, instructions);
            if (!result.isDegenerate()) {
                LOG.debug("Parsed rung {}: {} tokens, {} instructions, {} branches",
                        rungNumber, tokens.size(), instructions.size(), result.branches().size());
                return new RungStructure(current, tokens, instructions, result.sequence(), result.branches(),
                        healPasses, diagnostics.getDiagnostics());
            }

            if (!settings.healDegenerateBranches()) {
                throw new RungParseException(RungErrorCode.DEGENERATE_BRANCH,
                        "Branch without a second arm in rung " + rungNumber, result.degenerateStart());
            }
            if (healPasses >= settings.maxHealPasses()) {
                throw new RungParseException(RungErrorCode.HEAL_LIMIT_EXCEEDED,
                        "More than " + settings.maxHealPasses() + " degenerate branches in rung " + rungNumber,
                        result.degenerateStart());
            }

            List<Token> reduced = new ArrayList<>(tokens);
            reduced.remove(result.degenerateEnd());
            reduced.remove(result.degenerateStart());
            String healed = terminate(RungLexer.join(reduced));
            healPasses++;
            LOG.warn("Removed single-arm branch at tokens {}..{} of rung {}: '{}' -> '{}'",
                    result.degenerateStart(), result.degenerateEnd(), rungNumber, current, healed);
            current = healed;
        }
    }

    /**
     * Appends the terminating ';' if missing. Blank text becomes the empty rung {@code ;}.
     *
     * @param text The rung text.
     * @return The terminated text.
     */
    public static String terminate(String text) {
        if (text == null || text.isBlank()) {
            return ";";
        }
        String trimmed = text.stripTrailing();
        return trimmed.endsWith(";") ? trimmed : trimmed + ";";
    }
}
