package org.rungforge.logic.frontend.parser;

import org.rungforge.logic.api.RungErrorCode;
import org.rungforge.logic.api.RungParseException;
import org.rungforge.logic.frontend.lexer.Token;
import org.rungforge.logic.model.Instruction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the token stream of a rung into its element sequence and branch table.
 * <p>
 * The builder keeps a stack of open branches, a root cursor naming the branch that was active
 * before the most recent '[', the arm level within the innermost branch and history stacks to
 * restore root, level and active branch on ']'.
 * <p>
 * A branch that is closed without any ',' is degenerate. The builder does not repair it; it
 * reports the token positions of its '[' and ']' in the {@link Result} so the caller can remove
 * them and start over.
 */
public class SequenceBuilder {

    private final int rungNumber;

    /**
     * @param rungNumber The number of the rung, used for branch ids.
     */
    public SequenceBuilder(int rungNumber) {
        this.rungNumber = rungNumber;
    }

    /**
     * The outcome of one build pass: either the sequence and branch table, or the positions of a
     * degenerate branch.
     *
     * @param sequence The element sequence, or {@code null} if degenerate.
     * @param branches The branch table, or {@code null} if degenerate.
     * @param degenerateStart The position of the degenerate branch's '[', or -1.
     * @param degenerateEnd The position of the degenerate branch's ']', or -1.
     */
    public record Result(
            List<SequenceElement> sequence,
            Map<String, Branch> branches,
            int degenerateStart,
            int degenerateEnd
    ) {
        static Result built(List<SequenceElement> sequence, Map<String, Branch> branches) {
            return new Result(sequence, branches, -1, -1);
        }

        static Result degenerate(int start, int end) {
            return new Result(null, null, start, end);
        }

        public boolean isDegenerate() {
            return degenerateStart >= 0;
        }
    }

    /**
     * Builds the sequence for the given tokens.
     *
     * @param tokens The rung tokens.
     * @param instructions The instructions extracted from the same text, in order.
     * @return The build result.
     * @throws RungParseException if the branch structure is unbalanced or an instruction token has
     *                            no matching instruction.
     */
    public Result build(List<Token> tokens, List<Instruction> instructions) throws RungParseException {
        List<SequenceElement> sequence = new ArrayList<>();
        Map<String, Branch> branches = new LinkedHashMap<>();
        List<Branch> stack = new ArrayList<>();
        List<String> rootHistory = new ArrayList<>();
        List<String> branchIdHistory = new ArrayList<>();
        List<Integer> levelHistory = new ArrayList<>();

        String rootBranchId = null;
        String branchId = null;
        int branchLevel = 0;
        int branchCounter = 0;
        int instructionIndex = 0;

        for (int position = 0; position < tokens.size(); position++) {
            Token token = tokens.get(position);
            switch (token.type()) {
                case BRANCH_START -> {
                    String id = "rung_" + rungNumber + "_branch_" + branchCounter++;
                    Branch branch = new Branch(id, position, rootBranchId, false);
                    Branch firstArm = new Branch(id + ":0", position, id, true);
                    branch.addNestedBranch(firstArm);
                    branches.put(id, branch);
                    branches.put(firstArm.getId(), firstArm);

                    levelHistory.add(branchLevel);
                    rootHistory.add(rootBranchId);
                    branchIdHistory.add(branchId);
                    sequence.add(new SequenceElement(ElementType.BRANCH_START, position, null, id, rootBranchId, 0));

                    stack.add(branch);
                    branchLevel = 0;
                    rootBranchId = id;
                    branchId = id;
                }
                case BRANCH_NEXT -> {
                    if (stack.isEmpty()) {
                        throw new RungParseException(RungErrorCode.NEXT_OUTSIDE_BRANCH,
                                "Next branch marker found without an active branch", position);
                    }
                    Branch parent = stack.get(stack.size() - 1);
                    branchLevel++;
                    String armId = parent.getId() + ":" + branchLevel;
                    parent.lastNestedBranch().setEndPosition(position - 1);

                    Branch arm = new Branch(armId, position, parent.getId(), true);
                    parent.addNestedBranch(arm);
                    branches.put(armId, arm);
                    sequence.add(new SequenceElement(ElementType.BRANCH_NEXT, position, null, armId, rootBranchId, branchLevel));
                    branchId = armId;
                }
                case BRANCH_END -> {
                    if (stack.isEmpty()) {
                        throw new RungParseException(RungErrorCode.UNMATCHED_BRANCH_END,
                                "Branch end found without a matching branch start", position);
                    }
                    Branch branch = stack.remove(stack.size() - 1);
                    if (branch.getNestedBranches().size() == 1) {
                        return Result.degenerate(branch.getStartPosition(), position);
                    }
                    branch.lastNestedBranch().setEndPosition(position - 1);
                    branch.setEndPosition(position);

                    branchLevel = levelHistory.remove(levelHistory.size() - 1);
                    rootBranchId = rootHistory.remove(rootHistory.size() - 1);
                    branchId = branchIdHistory.remove(branchIdHistory.size() - 1);
                    sequence.add(new SequenceElement(ElementType.BRANCH_END, position, null,
                            branch.getId(), branch.getRootBranchId().orElse(null), branchLevel));
                }
                case INSTRUCTION -> {
                    Instruction instruction = findInstruction(token, instructions, instructionIndex, position);
                    sequence.add(new SequenceElement(ElementType.INSTRUCTION, position, instruction, branchId, rootBranchId, branchLevel));
                    instructionIndex++;
                }
            }
        }

        if (!stack.isEmpty()) {
            Branch open = stack.get(stack.size() - 1);
            throw new RungParseException(RungErrorCode.UNCLOSED_BRANCH,
                    "Branch '" + open.getId() + "' is never closed", open.getStartPosition());
        }
        return Result.built(sequence, branches);
    }

    private Instruction findInstruction(Token token, List<Instruction> instructions, int index, int position) throws RungParseException {
        for (int i = index; i < instructions.size(); i++) {
            if (instructions.get(i).getText().equals(token.text())) {
                return instructions.get(i);
            }
        }
        if (index < instructions.size()) {
            return instructions.get(index);
        }
        throw new RungParseException(RungErrorCode.INSTRUCTION_NOT_FOUND,
                "Instruction '" + token.text() + "' not found in rung text", position);
    }
}
