package org.rungforge.logic.isa;

/**
 * The role an instruction or one of its operands plays in a rung.
 */
public enum OperandRole {
    /** The operand is read (examined) by the instruction. */
    INPUT,
    /** The operand is written by the instruction. */
    OUTPUT,
    /** The operand belongs to a subroutine call. */
    JSR,
    /** The instruction is not catalogued. */
    UNKNOWN
}
