package org.rungforge.logic.frontend.lexer;

import org.rungforge.logic.diagnostics.Diagnostic;
import org.rungforge.logic.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits rung text into instruction tokens and branch structure tokens.
 * <p>
 * Instruction spans are found first by expanding a parenthesis-depth counter from every
 * {@code OPCODE(} match, which makes them immune to the array subscripts and nested calls inside
 * their operands. Only a '[', ',' or ']' outside of every instruction span is branch syntax.
 * <p>
 * The lexer is lenient: an instruction whose parentheses never close is dropped and reported as a
 * warning, as is any stray text outside of instructions.
 */
public class RungLexer {

    private static final Logger LOG = LoggerFactory.getLogger(RungLexer.class);

    /** Matches the opcode and opening parenthesis of an instruction. */
    public static final Pattern INSTRUCTION_START = Pattern.compile("[A-Za-z0-9_]+\\(");

    private final String source;
    private final DiagnosticsEngine diagnostics;

    /**
     * Creates a new lexer.
     * @param source The rung text.
     * @param diagnostics The engine for reporting dropped or ignored text.
     */
    public RungLexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source == null ? "" : source;
        this.diagnostics = diagnostics;
    }

    /**
     * Creates a lexer whose diagnostics are discarded.
     * @param source The rung text.
     */
    public RungLexer(String source) {
        this(source, new DiagnosticsEngine());
    }

    /**
     * Performs the tokenization of the entire rung text.
     * @return The ordered tokens.
     */
    public List<Token> scanTokens() {
        List<int[]> spans = findInstructionSpans();
        List<Token> tokens = new ArrayList<>();
        int spanIndex = 0;
        int strayStart = -1;
        int i = 0;
        while (i < source.length()) {
            if (spanIndex < spans.size() && spans.get(spanIndex)[0] == i) {
                strayStart = flushStray(strayStart, i);
                int[] span = spans.get(spanIndex++);
                tokens.add(new Token(TokenType.INSTRUCTION, source.substring(span[0], span[1]), span[0], span[1]));
                i = span[1];
                continue;
            }
            char c = source.charAt(i);
            TokenType structural = TokenType.ofStructural(c);
            if (structural != null) {
                strayStart = flushStray(strayStart, i);
                tokens.add(new Token(structural, String.valueOf(c), i, i + 1));
            } else if (!Character.isWhitespace(c) && c != ';' && strayStart < 0) {
                strayStart = i;
            }
            i++;
        }
        flushStray(strayStart, source.length());
        LOG.trace("Tokenized '{}' into {} tokens", source, tokens.size());
        return tokens;
    }

    /**
     * Extracts the text of every complete instruction span, in order of appearance.
     * @return The instruction texts.
     */
    public List<String> extractInstructionTexts() {
        List<String> result = new ArrayList<>();
        for (int[] span : findInstructionSpans()) {
            result.add(source.substring(span[0], span[1]));
        }
        return result;
    }

    /**
     * Concatenates the text of the given tokens.
     * @param tokens The tokens.
     * @return The joined text, without a terminating ';'.
     */
    public static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.text());
        }
        return sb.toString();
    }

    /**
     * Tokenizes the given text, discarding diagnostics.
     * @param text The rung text.
     * @return The ordered tokens.
     */
    public static List<Token> tokenize(String text) {
        return new RungLexer(text).scanTokens();
    }

    /**
     * Checks whether the given text is exactly one well-formed instruction, e.g. {@code OTE(Tag)}.
     * @param text The candidate instruction text.
     * @return {@code true} if the whole text is a single instruction span.
     */
    public static boolean isSingleInstruction(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        RungLexer lexer = new RungLexer(text);
        List<int[]> spans = lexer.findInstructionSpans();
        return spans.size() == 1 && spans.get(0)[0] == 0 && spans.get(0)[1] == text.length();
    }

    private List<int[]> findInstructionSpans() {
        List<int[]> spans = new ArrayList<>();
        Matcher matcher = INSTRUCTION_START.matcher(source);
        int coveredUntil = 0;
        while (matcher.find()) {
            int start = matcher.start();
            if (start < coveredUntil) {
                // nested call inside an operand, e.g. CPT(Dest,ABS(X))
                continue;
            }
            int depth = 1;
            int pos = matcher.end();
            while (pos < source.length() && depth > 0) {
                char c = source.charAt(pos);
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                }
                pos++;
            }
            if (depth == 0) {
                spans.add(new int[]{start, pos});
                coveredUntil = pos;
            } else {
                String dropped = source.substring(start);
                diagnostics.report(Diagnostic.Kind.DROPPED_INSTRUCTION, dropped, start);
                LOG.warn("Dropped instruction with unbalanced parentheses at offset {}: {}", start, dropped);
            }
        }
        return spans;
    }

    private int flushStray(int strayStart, int end) {
        if (strayStart >= 0) {
            String stray = source.substring(strayStart, end).trim();
            // the tail of a dropped instruction is already reported
            if (!stray.isEmpty() && !diagnostics.hasReportedBefore(Diagnostic.Kind.DROPPED_INSTRUCTION, strayStart)) {
                diagnostics.report(Diagnostic.Kind.IGNORED_TEXT, stray, strayStart);
                LOG.warn("Ignored text outside of instructions at offset {}: {}", strayStart, stray);
            }
        }
        return -1;
    }
}
