package org.rungforge.logic.frontend.parser;

import org.rungforge.logic.model.Instruction;

/**
 * One element of a rung sequence. Each token of the rung produces exactly one element, so the
 * position of an element equals the index of its token.
 *
 * @param type The element type.
 * @param position The sequence-local ordinal.
 * @param instruction The instruction, for {@link ElementType#INSTRUCTION} elements only.
 * @param branchId The branch (or branch arm) the element belongs to, or {@code null} on the main line.
 * @param rootBranchId The enclosing branch, or {@code null}.
 * @param branchLevel The arm index within the enclosing branch (0 = first arm).
 */
public record SequenceElement(
        ElementType type,
        int position,
        Instruction instruction,
        String branchId,
        String rootBranchId,
        int branchLevel
) {

    public boolean isInstruction() {
        return type == ElementType.INSTRUCTION;
    }

    public boolean isOnMainLine() {
        return branchId == null;
    }
}
