package org.rungforge.logic.report;

import org.rungforge.logic.isa.OperandRole;

/**
 * Report entry for one operand.
 *
 * @param baseOperand The operand as written.
 * @param aliasedOperand The operand with aliases resolved.
 * @param qualifiedOperand The aliased operand with its scope prefix.
 * @param argPosition The argument index within the instruction.
 * @param instruction The instruction text.
 * @param role The operand classification.
 * @param program The container name, or {@code null}.
 * @param routine The routine name, or {@code null}.
 * @param rung The rung number, or {@code null}.
 */
public record OperandReport(
        String baseOperand,
        String aliasedOperand,
        String qualifiedOperand,
        int argPosition,
        String instruction,
        OperandRole role,
        String program,
        String routine,
        Integer rung
) {
}
