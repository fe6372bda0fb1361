package org.rungforge.logic.model;

import org.rungforge.logic.api.RungParseException;
import org.rungforge.logic.frontend.lexer.RungLexer;
import org.rungforge.logic.frontend.lexer.Token;
import org.rungforge.logic.frontend.lexer.TokenType;
import org.rungforge.logic.frontend.parser.Branch;
import org.rungforge.logic.frontend.parser.ParserSettings;
import org.rungforge.logic.frontend.parser.RungParser;
import org.rungforge.logic.frontend.parser.RungStructure;
import org.rungforge.logic.frontend.parser.SequenceElement;
import org.rungforge.logic.isa.OperandRole;
import org.rungforge.logic.tags.TagEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A single rung of ladder logic: its text, comment and number, and the instructions, element
 * sequence and branches derived from the text.
 * <p>
 * The text is the only state; everything else is rebuilt from it whenever it changes. All
 * mutations are expressed as edits of the token list. The edited text is parsed completely before
 * anything is committed, so a mutation that fails leaves the rung exactly as it was.
 * <p>
 * Positions passed to and returned from the structural methods are token indices, which are also
 * the positions of the elements in {@link #getSequence()}.
 * <p>
 * Rungs are not thread-safe.
 */
public class Rung {

    private static final Logger LOG = LoggerFactory.getLogger(Rung.class);

    private final RungParser parser;
    private int number;
    private String comment;
    private Routine routine;
    private TagEnvironment environment;
    private RungStructure structure;

    private final Derived<List<Instruction>> inputInstructions = new Derived<>();
    private final Derived<List<Instruction>> outputInstructions = new Derived<>();

    /**
     * Creates a rung.
     *
     * @param number The rung number.
     * @param text The rung text. A missing terminating ';' is appended.
     * @param comment The rung comment, or {@code null}.
     * @param environment The tag environment used while the rung is not part of a routine.
     * @param settings The parser settings.
     * @throws RungParseException if the text has an invalid branch structure.
     */
    public Rung(int number, String text, String comment, TagEnvironment environment, ParserSettings settings) throws RungParseException {
        if (number < 0) {
            throw new IllegalArgumentException("Rung number must not be negative: " + number);
        }
        this.parser = new RungParser(Objects.requireNonNull(settings, "settings"));
        this.number = number;
        this.comment = comment;
        this.environment = Objects.requireNonNull(environment, "environment");
        apply(parse(text, number));
    }

    public Rung(int number, String text, String comment) throws RungParseException {
        this(number, text, comment, TagEnvironment.empty(), ParserSettings.defaults());
    }

    public Rung(int number, String text) throws RungParseException {
        this(number, text, null);
    }

    // ---------------------------------------------------------------------------------------------
    // Properties
    // ---------------------------------------------------------------------------------------------

    /**
     * @return The rung text, always terminated by ';'.
     */
    public String getText() {
        return structure.text();
    }

    /**
     * Replaces the rung text.
     *
     * @param text The new text. A missing terminating ';' is appended; blank text yields {@code ;}.
     * @throws RungParseException if the text has an invalid branch structure. The rung is unchanged.
     */
    public void setText(String text) throws RungParseException {
        commit(RungParser.terminate(text), "setText");
    }

    public int getNumber() {
        return number;
    }

    /**
     * Changes the rung number. Branch ids embed the number and are regenerated.
     *
     * @param number The new number.
     */
    public void setNumber(int number) {
        if (number < 0) {
            throw new IllegalArgumentException("Rung number must not be negative: " + number);
        }
        if (number == this.number) {
            return;
        }
        try {
            RungStructure renumbered = parse(getText(), number);
            this.number = number;
            apply(renumbered);
        } catch (RungParseException e) {
            throw new IllegalStateException("Rung text no longer parses after renumbering: " + getText(), e);
        }
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    /**
     * @return The number of lines of the comment, 0 without comment.
     */
    public int getCommentLineCount() {
        if (comment == null || comment.isEmpty()) {
            return 0;
        }
        return (int) comment.lines().count();
    }

    public Optional<Routine> getRoutine() {
        return Optional.ofNullable(routine);
    }

    void attach(Routine routine) {
        this.routine = routine;
        invalidateResolution();
    }

    void detach() {
        this.routine = null;
        invalidateResolution();
    }

    /**
     * @return The tag environment of the owning routine, or the rung's own environment.
     */
    public TagEnvironment getEnvironment() {
        return routine != null ? routine.getEnvironment() : environment;
    }

    /**
     * Sets the environment used while the rung is not part of a routine.
     *
     * @param environment The tag environment.
     */
    public void setEnvironment(TagEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
        invalidateResolution();
    }

    /**
     * Discards every resolved operand and instruction form. Called after the tags visible to this
     * rung changed.
     */
    public void invalidateResolution() {
        structure.instructions().forEach(Instruction::invalidate);
        inputInstructions.invalidate();
        outputInstructions.invalidate();
    }

    // ---------------------------------------------------------------------------------------------
    // Instruction queries
    // ---------------------------------------------------------------------------------------------

    public List<Instruction> getInstructions() {
        return structure.instructions();
    }

    /**
     * @return The examine instructions of the rung.
     */
    public List<Instruction> getInputInstructions() {
        return inputInstructions.get(() -> instructionsWithRole(OperandRole.INPUT));
    }

    /**
     * @return The catalogued output instructions of the rung.
     */
    public List<Instruction> getOutputInstructions() {
        return outputInstructions.get(() -> instructionsWithRole(OperandRole.OUTPUT));
    }

    /**
     * Filters the instructions of the rung.
     *
     * @param opcodeFilter The exact opcode to match, or {@code null} for any.
     * @param operandFilter Text that at least one operand must contain, or {@code null} for any.
     * @return The matching instructions.
     */
    public List<Instruction> getInstructions(String opcodeFilter, String operandFilter) {
        List<Instruction> result = new ArrayList<>();
        for (Instruction instruction : getInstructions()) {
            if (opcodeFilter != null && !opcodeFilter.isEmpty() && !opcodeFilter.equals(instruction.getOpcode())) {
                continue;
            }
            if (operandFilter != null && !operandFilter.isEmpty()
                    && instruction.getOperands().stream().noneMatch(o -> o.getText().contains(operandFilter))) {
                continue;
            }
            result.add(instruction);
        }
        return result;
    }

    /**
     * @param index The ordinal of the instruction.
     * @return The instruction, or empty if the ordinal is out of range.
     */
    public Optional<Instruction> getInstructionAt(int index) {
        List<Instruction> instructions = getInstructions();
        return index >= 0 && index < instructions.size() ? Optional.of(instructions.get(index)) : Optional.empty();
    }

    public int getInstructionCount() {
        return getInstructions().size();
    }

    /**
     * @return The number of instructions per opcode, in order of first appearance.
     */
    public Map<String, Integer> getInstructionSummary() {
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (Instruction instruction : getInstructions()) {
            summary.merge(instruction.getOpcode(), 1, Integer::sum);
        }
        return summary;
    }

    /**
     * @param instructionText The instruction text.
     * @return The ordinals of all instructions with exactly this text.
     */
    public List<Integer> findInstructionPositions(String instructionText) {
        List<Integer> positions = new ArrayList<>();
        List<Instruction> instructions = getInstructions();
        for (int i = 0; i < instructions.size(); i++) {
            if (instructions.get(i).getText().equals(instructionText)) {
                positions.add(i);
            }
        }
        return positions;
    }

    public boolean hasInstruction(String instructionText) {
        return getInstructions().stream().anyMatch(i -> i.getText().equals(instructionText));
    }

    // ---------------------------------------------------------------------------------------------
    // Structure queries
    // ---------------------------------------------------------------------------------------------

    public List<Token> getTokens() {
        return structure.tokens();
    }

    public List<SequenceElement> getSequence() {
        return structure.sequence();
    }

    /**
     * @return All branches and branch arms by id, in order of appearance.
     */
    public Map<String, Branch> getBranches() {
        return structure.branches();
    }

    public Optional<Branch> getBranch(String branchId) {
        return Optional.ofNullable(structure.branches().get(branchId));
    }

    public boolean hasBranches() {
        return !structure.branches().isEmpty();
    }

    /**
     * @return The number of bracketed branches, arms not counted.
     */
    public int getBranchCount() {
        return (int) structure.branches().values().stream().filter(b -> !b.isArm()).count();
    }

    /**
     * @param branchId The id of a branch or branch arm.
     * @return The instructions within the branch, nested branches included; empty for an unknown id.
     */
    public List<Instruction> getBranchInstructions(String branchId) {
        Branch branch = structure.branches().get(branchId);
        if (branch == null) {
            return List.of();
        }
        List<Instruction> result = new ArrayList<>();
        for (SequenceElement element : getSequence()) {
            if (element.isInstruction() && branch.contains(element.position())) {
                result.add(element.instruction());
            }
        }
        return result;
    }

    /**
     * @return The instructions outside of every branch.
     */
    public List<Instruction> getMainLineInstructions() {
        List<Instruction> result = new ArrayList<>();
        for (SequenceElement element : getSequence()) {
            if (element.isInstruction() && element.isOnMainLine()) {
                result.add(element.instruction());
            }
        }
        return result;
    }

    /**
     * @return The deepest nesting of '[' in the rung, 0 without branches.
     */
    public int getMaxBranchDepth() {
        int depth = 0;
        int max = 0;
        for (Token token : getTokens()) {
            if (token.type() == TokenType.BRANCH_START) {
                max = Math.max(max, ++depth);
            } else if (token.type() == TokenType.BRANCH_END) {
                depth--;
            }
        }
        return max;
    }

    /**
     * Gets the branch nesting depth at a token. A '[' counts itself, a ']' does not.
     *
     * @param position A token index.
     * @return The nesting depth, 0 on the main line.
     * @throws IndexOutOfBoundsException if the position is not a token index.
     */
    public int getBranchNestingLevel(int position) {
        Objects.checkIndex(position, getTokens().size());
        int depth = 0;
        for (int i = 0; i <= position; i++) {
            TokenType type = getTokens().get(i).type();
            if (type == TokenType.BRANCH_START) {
                depth++;
            } else if (type == TokenType.BRANCH_END) {
                depth--;
            }
        }
        return depth;
    }

    /**
     * Gets how deeply branches are nested inside a branch.
     *
     * @param branchPosition The token index of the branch's '['.
     * @return The maximum depth of branches between the brackets, 0 if the branch has no nested branch.
     */
    public int getBranchInternalNestingLevel(int branchPosition) {
        int end = findMatchingBranchEnd(branchPosition);
        int depth = 0;
        int max = 0;
        for (int i = branchPosition + 1; i < end; i++) {
            TokenType type = getTokens().get(i).type();
            if (type == TokenType.BRANCH_START) {
                max = Math.max(max, ++depth);
            } else if (type == TokenType.BRANCH_END) {
                depth--;
            }
        }
        return max;
    }

    /**
     * @param startPosition The token index of a '['.
     * @return The token index of the matching ']'.
     * @throws IllegalArgumentException if the token at the position is not a '['.
     */
    public int findMatchingBranchEnd(int startPosition) {
        requireTokenType(startPosition, TokenType.BRANCH_START);
        int depth = 0;
        List<Token> tokens = getTokens();
        for (int i = startPosition; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.BRANCH_START) {
                depth++;
            } else if (type == TokenType.BRANCH_END && --depth == 0) {
                return i;
            }
        }
        throw new IllegalStateException("Unbalanced branch at token " + startPosition + " in " + getText());
    }

    /**
     * @return {@code true} if the brackets of the rung are balanced and every ',' is inside a branch.
     */
    public boolean validateBranchStructure() {
        return validateBranchStructure(getTokens());
    }

    /**
     * Checks the branch structure of a token list: '[' and ']' balanced, the open count never
     * negative and no ',' outside of a branch.
     *
     * @param tokens The tokens.
     * @return {@code true} if the structure is valid.
     */
    public static boolean validateBranchStructure(List<Token> tokens) {
        int depth = 0;
        for (Token token : tokens) {
            switch (token.type()) {
                case BRANCH_START -> depth++;
                case BRANCH_END -> {
                    if (--depth < 0) {
                        return false;
                    }
                }
                case BRANCH_NEXT -> {
                    if (depth == 0) {
                        return false;
                    }
                }
                default -> {
                }
            }
        }
        return depth == 0;
    }

    // ---------------------------------------------------------------------------------------------
    // Instruction mutations
    // ---------------------------------------------------------------------------------------------

    /**
     * Appends an instruction at the end of the rung.
     *
     * @param instructionText The instruction, e.g. {@code OTE(Tag)}.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public void addInstruction(String instructionText) throws RungParseException {
        addInstruction(instructionText, getTokens().size());
    }

    /**
     * Inserts an instruction before the token at the given position.
     *
     * @param instructionText The instruction, e.g. {@code OTE(Tag)}.
     * @param position The token index to insert at; the token count appends.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public void addInstruction(String instructionText, int position) throws RungParseException {
        requireInstructionText(instructionText);
        List<Token> tokens = mutableTokens();
        if (position < 0 || position > tokens.size()) {
            throw new IndexOutOfBoundsException("Position " + position + " out of range 0.." + tokens.size());
        }
        tokens.add(position, Token.instruction(instructionText));
        commit(tokens, "addInstruction");
    }

    /**
     * Removes the instruction token at the given position.
     *
     * @param position The token index of an instruction.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public void removeInstruction(int position) throws RungParseException {
        requireTokenType(position, TokenType.INSTRUCTION);
        List<Token> tokens = mutableTokens();
        tokens.remove(position);
        commit(tokens, "removeInstruction");
    }

    /**
     * Removes an occurrence of an instruction.
     *
     * @param instructionText The instruction text.
     * @param occurrence Which occurrence to remove, starting at 0.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public void removeInstruction(String instructionText, int occurrence) throws RungParseException {
        removeInstruction(indexOfInstruction(instructionText, occurrence));
    }

    /**
     * Replaces the instruction token at the given position.
     *
     * @param position The token index of an instruction.
     * @param newInstructionText The replacement instruction.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public void replaceInstruction(int position, String newInstructionText) throws RungParseException {
        requireTokenType(position, TokenType.INSTRUCTION);
        requireInstructionText(newInstructionText);
        List<Token> tokens = mutableTokens();
        tokens.set(position, Token.instruction(newInstructionText));
        commit(tokens, "replaceInstruction");
    }

    public void replaceInstruction(String instructionText, int occurrence, String newInstructionText) throws RungParseException {
        replaceInstruction(indexOfInstruction(instructionText, occurrence), newInstructionText);
    }

    /**
     * Moves the instruction token at the given position.
     *
     * @param position The token index of an instruction.
     * @param newPosition The token index the instruction has after the move.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public void moveInstruction(int position, int newPosition) throws RungParseException {
        requireTokenType(position, TokenType.INSTRUCTION);
        List<Token> tokens = mutableTokens();
        if (newPosition < 0 || newPosition >= tokens.size()) {
            throw new IndexOutOfBoundsException("New position " + newPosition + " out of range 0.." + (tokens.size() - 1));
        }
        if (newPosition == position) {
            return;
        }
        Token moved = tokens.remove(position);
        tokens.add(newPosition, moved);
        commit(tokens, "moveInstruction");
    }

    public void moveInstruction(String instructionText, int occurrence, int newPosition) throws RungParseException {
        moveInstruction(indexOfInstruction(instructionText, occurrence), newPosition);
    }

    // ---------------------------------------------------------------------------------------------
    // Branch mutations
    // ---------------------------------------------------------------------------------------------

    /**
     * Inserts a branch around the tokens {@code [start, end)}, with an empty second arm.
     *
     * @param start The token index of the first token inside the branch.
     * @param end The token index after the last token inside the branch.
     * @return The id of the new branch.
     * @throws RungParseException if the enclosed tokens are not balanced.
     */
    public String insertBranch(int start, int end) throws RungParseException {
        List<Token> tokens = mutableTokens();
        if (start < 0 || end > tokens.size()) {
            throw new IndexOutOfBoundsException("Branch range " + start + ".." + end + " out of range 0.." + tokens.size());
        }
        if (end < start) {
            throw new IllegalArgumentException("Branch end " + end + " is before its start " + start);
        }
        tokens.add(end, Token.structural(TokenType.BRANCH_END));
        tokens.add(end, Token.structural(TokenType.BRANCH_NEXT));
        tokens.add(start, Token.structural(TokenType.BRANCH_START));
        commit(tokens, "insertBranch");
        return getSequence().get(start).branchId();
    }

    /**
     * Wraps the instructions from {@code start} to {@code end}, both inclusive, in a new branch.
     *
     * @param start The token index of the first instruction.
     * @param end The token index of the last instruction.
     * @return The id of the new branch.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public String wrapInstructionsInBranch(int start, int end) throws RungParseException {
        requireTokenType(start, TokenType.INSTRUCTION);
        requireTokenType(end, TokenType.INSTRUCTION);
        if (end < start) {
            throw new IllegalArgumentException("End " + end + " is before start " + start);
        }
        int depth = 0;
        for (int i = start; i <= end; i++) {
            TokenType type = getTokens().get(i).type();
            if (type == TokenType.BRANCH_START) {
                depth++;
            } else if (type == TokenType.BRANCH_END) {
                depth--;
            }
            if (depth < 0 || (depth == 0 && type == TokenType.BRANCH_NEXT)) {
                throw new IllegalArgumentException("Tokens " + start + ".." + end + " cross a branch boundary");
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Tokens " + start + ".." + end + " cross a branch boundary");
        }
        return insertBranch(start, end + 1);
    }

    /**
     * Adds an empty arm to a branch. The new arm is inserted directly after the arm that starts at
     * the given position.
     *
     * @param branchPosition The token index of a '[' or ','.
     * @return The id of the new arm.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public String insertBranchLevel(int branchPosition) throws RungParseException {
        Objects.checkIndex(branchPosition, getTokens().size());
        TokenType type = getTokens().get(branchPosition).type();
        if (type != TokenType.BRANCH_START && type != TokenType.BRANCH_NEXT) {
            throw new IllegalArgumentException("Token " + branchPosition + " is not a branch start or next marker: " + type);
        }
        List<Token> tokens = mutableTokens();
        int depth = 0;
        int insertAt = -1;
        for (int i = branchPosition + 1; i < tokens.size() && insertAt < 0; i++) {
            switch (tokens.get(i).type()) {
                case BRANCH_START -> depth++;
                case BRANCH_END -> {
                    if (depth == 0) {
                        insertAt = i;
                    }
                    depth--;
                }
                case BRANCH_NEXT -> {
                    if (depth == 0) {
                        insertAt = i;
                    }
                }
                default -> {
                }
            }
        }
        if (insertAt < 0) {
            throw new IllegalStateException("No end found for the branch at token " + branchPosition);
        }
        tokens.add(insertAt, Token.structural(TokenType.BRANCH_NEXT));
        commit(tokens, "insertBranchLevel");
        return getSequence().get(insertAt).branchId();
    }

    /**
     * Removes a branch or one arm of a branch, with all instructions inside.
     * <p>
     * Removing a branch deletes everything from its '[' to its ']'. Removing an arm deletes the arm
     * and its separating ','; when only one arm would remain, the brackets are removed as well and
     * the remaining arm joins the enclosing line.
     *
     * @param branchId The id of a branch or arm.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public void removeBranch(String branchId) throws RungParseException {
        Branch branch = requireBranch(branchId);
        List<Token> tokens = mutableTokens();
        if (!branch.isArm()) {
            tokens.subList(branch.getStartPosition(), branch.getEndPosition() + 1).clear();
            commit(tokens, "removeBranch");
            return;
        }

        Branch owner = requireBranch(branch.getRootBranchId().orElseThrow());
        List<Branch> arms = owner.getNestedBranches();
        boolean firstArm = arms.get(0) == branch;
        int from = firstArm ? branch.getStartPosition() + 1 : branch.getStartPosition();
        int to = firstArm ? branch.getEndPosition() + 1 : branch.getEndPosition();
        if (arms.size() == 2) {
            // Single remaining arm: drop the brackets too.
            tokens.remove(owner.getEndPosition());
            tokens.subList(from, to + 1).clear();
            tokens.remove(owner.getStartPosition());
        } else {
            tokens.subList(from, to + 1).clear();
        }
        commit(tokens, "removeBranch");
    }

    /**
     * Moves a whole branch, brackets included, to another position.
     *
     * @param branchId The id of a bracketed branch.
     * @param newPosition The token index of the branch's '[' after the move.
     * @return The id of the moved branch, which changes with its position.
     * @throws RungParseException if the resulting text cannot be parsed.
     */
    public String moveBranch(String branchId, int newPosition) throws RungParseException {
        Branch branch = requireBranch(branchId);
        if (branch.isArm()) {
            throw new IllegalArgumentException("Cannot move branch arm '" + branchId + "'; move its branch instead");
        }
        List<Token> tokens = mutableTokens();
        List<Token> block = new ArrayList<>(tokens.subList(branch.getStartPosition(), branch.getEndPosition() + 1));
        tokens.subList(branch.getStartPosition(), branch.getEndPosition() + 1).clear();
        if (newPosition < 0 || newPosition > tokens.size()) {
            throw new IndexOutOfBoundsException("New position " + newPosition + " out of range 0.." + tokens.size());
        }
        tokens.addAll(newPosition, block);
        commit(tokens, "moveBranch");
        return getSequence().get(newPosition).branchId();
    }

    // ---------------------------------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------------------------------

    private RungStructure parse(String text, int rungNumber) throws RungParseException {
        return parser.parse(text, rungNumber, (instructionText, index) -> new Instruction(instructionText, this, index));
    }

    private void commit(List<Token> tokens, String operation) throws RungParseException {
        commit(RungParser.terminate(RungLexer.join(tokens)), operation);
    }

    private void commit(String newText, String operation) throws RungParseException {
        RungStructure parsed = parse(newText, number);
        String previous = structure == null ? null : structure.text();
        apply(parsed);
        LOG.debug("{} on rung {}: '{}' -> '{}'", operation, number, previous, parsed.text());
    }

    private void apply(RungStructure parsed) {
        this.structure = parsed;
        inputInstructions.invalidate();
        outputInstructions.invalidate();
    }

    private List<Token> mutableTokens() {
        return new ArrayList<>(getTokens());
    }

    private List<Instruction> instructionsWithRole(OperandRole role) {
        return getInstructions().stream().filter(i -> i.getRole() == role).collect(Collectors.toList());
    }

    private int indexOfInstruction(String instructionText, int occurrence) {
        int seen = 0;
        List<Token> tokens = getTokens();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isInstruction() && tokens.get(i).text().equals(instructionText) && seen++ == occurrence) {
                return i;
            }
        }
        throw new IllegalArgumentException("Instruction '" + instructionText + "' (occurrence " + occurrence + ") not found in rung " + number);
    }

    private void requireTokenType(int position, TokenType type) {
        Objects.checkIndex(position, getTokens().size());
        TokenType actual = getTokens().get(position).type();
        if (actual != type) {
            throw new IllegalArgumentException("Token " + position + " is " + actual + ", expected " + type);
        }
    }

    private static void requireInstructionText(String instructionText) {
        if (!RungLexer.isSingleInstruction(instructionText)) {
            throw new IllegalArgumentException("Invalid instruction format: '" + instructionText + "'");
        }
    }

    private Branch requireBranch(String branchId) {
        Branch branch = structure.branches().get(branchId);
        if (branch == null) {
            throw new IllegalArgumentException("Branch '" + branchId + "' not found in rung " + number);
        }
        return branch;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rung other)) {
            return false;
        }
        return getText().equals(other.getText());
    }

    @Override
    public int hashCode() {
        return getText().hashCode();
    }

    @Override
    public String toString() {
        return "Rung{number=" + number + ", text='" + getText() + "'}";
    }
}
