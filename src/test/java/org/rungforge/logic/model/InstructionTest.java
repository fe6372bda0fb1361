package org.rungforge.logic.model;

import org.rungforge.logic.isa.OperandRole;
import org.rungforge.logic.report.InstructionReport;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Instruction} model: opcode and operand extraction and the
 * instruction-level classification.
 */
@Tag("unit")
class InstructionTest {

    @Test
    void constructor_splitsOperandsOutsideSubscripts() {
        Instruction instruction = new Instruction("MOV(Arr[0],Dest)");

        assertThat(instruction.getOpcode()).isEqualTo("MOV");
        assertThat(instruction.getOperands()).extracting(Operand::getText).containsExactly("Arr[0]", "Dest");
        assertThat(instruction.getOperands()).extracting(Operand::getPosition).containsExactly(0, 1);
        assertThat(instruction.getOperands()).extracting(Operand::getRole).containsExactly(OperandRole.INPUT, OperandRole.OUTPUT);
    }

    @Test
    void constructor_keepsNestedCallsAndMultiDimensionalSubscripts() {
        Instruction instruction = new Instruction("CPT(Result,ABS(Grid[1,2])+Offset)");

        assertThat(instruction.getArguments()).containsExactly("Result", "ABS(Grid[1,2])+Offset");
        assertThat(instruction.getOperands().get(0).getRole()).isEqualTo(OperandRole.OUTPUT);
    }

    /**
     * Verifies that blank arguments produce no operand but still occupy their argument position.
     */
    @Test
    void constructor_skipsBlankArgumentsButKeepsPositions() {
        Instruction instruction = new Instruction("MSG(,Msg1)");

        assertThat(instruction.getArgumentCount()).isEqualTo(2);
        assertThat(instruction.getOperands()).hasSize(1);
        assertThat(instruction.getOperands().get(0).getPosition()).isEqualTo(1);
        assertThat(instruction.getOperands().get(0).getRole()).isEqualTo(OperandRole.OUTPUT);
    }

    @Test
    void constructor_acceptsInstructionWithoutArguments() {
        Instruction instruction = new Instruction("NOP()");

        assertThat(instruction.getOpcode()).isEqualTo("NOP");
        assertThat(instruction.getArguments()).isEmpty();
        assertThat(instruction.getOperands()).isEmpty();
        assertThat(instruction.getRole()).isEqualTo(OperandRole.UNKNOWN);
    }

    @Test
    void constructor_rejectsMalformedText() {
        assertThatThrownBy(() -> new Instruction("OTE")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Instruction("OTE(A)OTE(B)")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Instruction("(A)")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getRole_classifiesByOpcode() {
        assertThat(new Instruction("XIC(A)").getRole()).isEqualTo(OperandRole.INPUT);
        assertThat(new Instruction("TON(T1,?,?)").getRole()).isEqualTo(OperandRole.OUTPUT);
        assertThat(new Instruction("JSR(Sub,0)").getRole()).isEqualTo(OperandRole.JSR);
    }

    /**
     * Verifies that an unknown opcode classifies every operand as unknown.
     */
    @Test
    void unknownOpcode_classifiesAllOperandsUnknown() {
        Instruction instruction = new Instruction("FOO(X,Y)");

        assertThat(instruction.getOperands()).extracting(Operand::getRole).containsOnly(OperandRole.UNKNOWN);
        assertThat(instruction.isAddOnInstruction()).isFalse();
    }

    @Test
    void reportEntry_hasNoContainerWhenDetached() {
        InstructionReport report = new Instruction("OTE(A)").reportEntry();

        assertThat(report.instruction()).isEqualTo("OTE(A)");
        assertThat(report.program()).isNull();
        assertThat(report.routine()).isNull();
        assertThat(report.rung()).isNull();
    }

    @Test
    void aliasedText_withoutTagsEqualsText() {
        Instruction instruction = new Instruction("MOV(Source,Dest)");

        assertThat(instruction.getAliasedText()).isEqualTo("MOV(Source,Dest)");
        assertThat(instruction.getQualifiedText()).isEqualTo("MOV(Source,Dest)");
    }
}
