package org.rungforge.logic.model;

import org.rungforge.logic.api.RungParseException;
import org.rungforge.logic.report.InstructionReport;
import org.rungforge.logic.tags.MapTagTable;
import org.rungforge.logic.tags.Tag;
import org.rungforge.logic.tags.TagEnvironment;
import org.rungforge.logic.tags.TagScope;
import org.rungforge.logic.tags.TagTable;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@org.junit.jupiter.api.Tag("unit")
class RoutineTest {

    @Test
    void addRung_numbersRungsByIndex() throws RungParseException {
        Routine routine = new Routine("MainRoutine");

        routine.addRung("XIC(A)OTE(B)");
        routine.addRung("XIC(C)OTE(D)");
        Rung inserted = new Rung(9, "[XIC(E),XIC(F)]OTE(G)");
        routine.addRung(inserted, 1);

        assertThat(routine.getRungs()).extracting(Rung::getNumber).containsExactly(0, 1, 2);
        assertThat(routine.getRung(1)).containsSame(inserted);
        assertThat(inserted.getRoutine()).containsSame(routine);
        assertThat(inserted.getBranches()).containsKey("rung_1_branch_0");
        assertThat(routine.getRung(3)).isEmpty();
    }

    @Test
    void addRung_withOutOfRangeIndexAppends() throws RungParseException {
        Routine routine = new Routine("MainRoutine");
        routine.addRung("OTE(A)");

        Rung rung = new Rung(0, "OTE(B)");
        routine.addRung(rung, 42);

        assertThat(routine.getRungs()).last().isSameAs(rung);
        assertThat(rung.getNumber()).isEqualTo(1);
    }

    @Test
    void addRung_rejectsRungOfAnotherRoutine() throws RungParseException {
        Routine first = new Routine("First");
        Routine second = new Routine("Second");
        Rung rung = first.addRung("OTE(A)");

        assertThatThrownBy(() -> second.addRung(rung)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeRung_renumbersAndDetaches() throws RungParseException {
        Routine routine = new Routine("MainRoutine");
        Rung first = routine.addRung("OTE(A)");
        Rung second = routine.addRung("OTE(B)");
        Rung third = routine.addRung("OTE(C)");

        Rung removed = routine.removeRung(0);
        routine.removeRung(third);

        assertThat(removed).isSameAs(first);
        assertThat(first.getRoutine()).isEmpty();
        assertThat(third.getRoutine()).isEmpty();
        assertThat(routine.getRungs()).containsExactly(second);
        assertThat(second.getNumber()).isZero();
        assertThatThrownBy(() -> routine.removeRung(third)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> routine.removeRung(5)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void clearRungs_detachesAll() throws RungParseException {
        Routine routine = new Routine("MainRoutine");
        Rung rung = routine.addRung("OTE(A)");

        routine.clearRungs();

        assertThat(routine.getRungs()).isEmpty();
        assertThat(rung.getRoutine()).isEmpty();
    }

    @Test
    void instructionQueries_spanAllRungs() throws RungParseException {
        Routine routine = new Routine("MainRoutine");
        routine.addRung("XIC(Start)OTE(Motor)");
        routine.addRung("XIO(Stop)MOV(Speed,Motor.Speed)");

        assertThat(routine.getInstructions()).hasSize(4);
        assertThat(routine.getInputInstructions()).extracting(Instruction::getText).containsExactly("XIC(Start)", "XIO(Stop)");
        assertThat(routine.getOutputInstructions()).extracting(Instruction::getText)
                .containsExactly("OTE(Motor)", "MOV(Speed,Motor.Speed)");
        assertThat(routine.getInstructions(null, "Motor")).hasSize(2);
    }

    @Test
    void checkForJsr_matchesCalledRoutine() throws RungParseException {
        Routine routine = new Routine("MainRoutine");
        routine.addRung("XIC(Run)JSR(Conveyor,0)");

        assertThat(routine.checkForJsr("Conveyor")).isTrue();
        assertThat(routine.checkForJsr("Mixer")).isFalse();
    }

    /**
     * Verifies that rungs of a routine resolve operands against the routine's environment and pick
     * up a replaced environment.
     */
    @Test
    void environment_isSharedByRungs() throws RungParseException {
        // Arrange
        MapTagTable programTags = new MapTagTable().add(Tag.base("Valve", TagScope.PROGRAM));
        Routine routine = new Routine("Fill", TagEnvironment.of("Tank", programTags, TagTable.empty()));
        Rung rung = new Rung(0, "OTE(Valve.Open)");
        routine.addRung(rung);
        Operand operand = rung.getInstructions().get(0).getOperands().get(0);

        // Act & Assert
        assertThat(operand.getQualified()).isEqualTo("Program:Tank.Valve.Open");

        routine.setEnvironment(TagEnvironment.of("Drain", programTags, TagTable.empty()));
        assertThat(operand.getQualified()).isEqualTo("Program:Drain.Valve.Open");

        routine.removeRung(rung);
        assertThat(operand.getQualified()).isEqualTo("Valve.Open");
    }

    @Test
    void reportEntry_includesRoutineAndRung() throws RungParseException {
        Routine routine = new Routine("Fill", TagEnvironment.of("Tank", TagTable.empty(), TagTable.empty()));
        routine.addRung("OTE(A)");
        Rung rung = routine.addRung("XIC(B)OTE(C)");

        InstructionReport report = rung.getInstructions().get(1).reportEntry();

        assertThat(report).isEqualTo(new InstructionReport("OTE(C)", "Tank", "Fill", 1));
    }
}
