package org.rungforge.logic.report;

/**
 * Report entry for one instruction.
 *
 * @param instruction The instruction text.
 * @param program The container name, or {@code null} if the rung is not bound to one.
 * @param routine The routine name, or {@code null}.
 * @param rung The rung number, or {@code null} for a detached instruction.
 */
public record InstructionReport(String instruction, String program, String routine, Integer rung) {
}
