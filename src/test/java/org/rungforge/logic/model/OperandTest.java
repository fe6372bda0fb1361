package org.rungforge.logic.model;

import org.rungforge.logic.api.RungParseException;
import org.rungforge.logic.frontend.parser.ParserSettings;
import org.rungforge.logic.isa.OperandRole;
import org.rungforge.logic.report.OperandReport;
import org.rungforge.logic.tags.MapTagTable;
import org.rungforge.logic.tags.Tag;
import org.rungforge.logic.tags.TagEnvironment;
import org.rungforge.logic.tags.TagScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for operand decomposition and alias resolution. The operands are created
 * through a rung so that they see its tag environment.
 */
@org.junit.jupiter.api.Tag("unit")
class OperandTest {

    private MapTagTable programTags;
    private MapTagTable controllerTags;
    private TagEnvironment environment;

    @BeforeEach
    void setUp() {
        programTags = new MapTagTable()
                .add(Tag.alias("Tag1", TagScope.PROGRAM, "Tag2"))
                .add(Tag.base("Tag2", TagScope.PROGRAM));
        controllerTags = new MapTagTable()
                .add(Tag.base("Conveyor", TagScope.CONTROLLER))
                .add(Tag.alias("StartPB", TagScope.CONTROLLER, "Local:1:I.Data.3"))
                .add(Tag.alias("Speed", TagScope.CONTROLLER, "Conveyor.Speed"));
        environment = TagEnvironment.of("MainProgram", programTags, controllerTags);
    }

    private Operand firstOperand(String instructionText) throws RungParseException {
        Rung rung = new Rung(0, instructionText, null, environment, ParserSettings.defaults());
        return rung.getInstructions().get(0).getOperands().get(0);
    }

    @Test
    void decomposition_splitsMemberPath() throws RungParseException {
        Operand operand = firstOperand("XIC(Motor.Status.Running)");

        assertThat(operand.getBaseName()).isEqualTo("Motor");
        assertThat(operand.getTrailingName()).isEqualTo(".Status.Running");
        assertThat(operand.getParents()).containsExactly("Motor.Status.Running", "Motor.Status", "Motor");
    }

    @Test
    void decomposition_withoutMember() throws RungParseException {
        Operand operand = firstOperand("XIC(Run)");

        assertThat(operand.getTrailingName()).isEmpty();
        assertThat(operand.getParents()).containsExactly("Run");
    }

    /**
     * Verifies that a program alias is replaced by its target and the result is qualified with
     * the program name because the base tag is program-scoped.
     */
    @Test
    void programAlias_isAliasedAndQualified() throws RungParseException {
        // Act
        Operand operand = firstOperand("XIC(Tag1.Member)");

        // Assert
        assertThat(operand.getFirstTag()).hasValueSatisfying(tag -> assertThat(tag.name()).isEqualTo("Tag1"));
        assertThat(operand.getBaseTag()).hasValueSatisfying(tag -> assertThat(tag.name()).isEqualTo("Tag2"));
        assertThat(operand.getAliased()).isEqualTo("Tag2.Member");
        assertThat(operand.getQualified()).isEqualTo("Program:MainProgram.Tag2.Member");
        assertThat(operand.getAliasedParents()).containsExactly("Tag2.Member", "Tag2");
        assertThat(operand.getQualifiedParents())
                .containsExactly("Program:MainProgram.Tag2.Member", "Program:MainProgram.Tag2");
    }

    @Test
    void controllerTag_isNotQualified() throws RungParseException {
        Operand operand = firstOperand("XIC(Conveyor.Running)");

        assertThat(operand.getAliased()).isEqualTo("Conveyor.Running");
        assertThat(operand.getQualified()).isEqualTo("Conveyor.Running");
        assertThat(operand.getQualifiedParents()).containsExactly("Conveyor.Running", "Conveyor");
    }

    @Test
    void controllerAlias_keepsAliasMemberPath() throws RungParseException {
        Operand operand = firstOperand("MOV(Speed.Setpoint,Dest)");

        assertThat(operand.getAliased()).isEqualTo("Conveyor.Speed.Setpoint");
        assertThat(operand.getBaseTag()).hasValueSatisfying(tag -> assertThat(tag.name()).isEqualTo("Conveyor"));
    }

    /**
     * Verifies that an alias whose target is not a known tag (here a module reference) resolves to
     * the alias reference text.
     */
    @Test
    void aliasOfUnknownTarget_usesReferenceText() throws RungParseException {
        Operand operand = firstOperand("XIC(StartPB)");

        assertThat(operand.getAliased()).isEqualTo("Local:1:I.Data.3");
        assertThat(operand.getQualified()).isEqualTo("Local:1:I.Data.3");
        assertThat(operand.getBaseTag()).hasValueSatisfying(tag -> assertThat(tag.name()).isEqualTo("StartPB"));
    }

    @Test
    void unknownTag_keepsRawText() throws RungParseException {
        Operand operand = firstOperand("XIC(S:FS)");

        assertThat(operand.getFirstTag()).isEmpty();
        assertThat(operand.getBaseTag()).isEmpty();
        assertThat(operand.getAliased()).isEqualTo("S:FS");
        assertThat(operand.getQualified()).isEqualTo("S:FS");
        assertThat(operand.getRole()).isEqualTo(OperandRole.INPUT);
    }

    /**
     * Verifies that resolved forms are memoized and only recomputed after the rung's resolution
     * is invalidated.
     */
    @Test
    void resolution_isRecomputedAfterInvalidation() throws RungParseException {
        // Arrange
        Rung rung = new Rung(0, "OTE(Lamp)", null, environment, ParserSettings.defaults());
        Operand operand = rung.getInstructions().get(0).getOperands().get(0);
        assertThat(operand.getAliased()).isEqualTo("Lamp");

        // Act
        programTags.add(Tag.alias("Lamp", TagScope.PROGRAM, "Tag2.Lamp"));

        // Assert
        assertThat(operand.getAliased()).isEqualTo("Lamp");
        rung.invalidateResolution();
        assertThat(operand.getAliased()).isEqualTo("Tag2.Lamp");
        assertThat(operand.getQualified()).isEqualTo("Program:MainProgram.Tag2.Lamp");
    }

    @Test
    void reportEntry_carriesAllForms() throws RungParseException {
        Operand operand = firstOperand("OTE(Tag1)");

        OperandReport report = operand.reportEntry();

        assertThat(report.baseOperand()).isEqualTo("Tag1");
        assertThat(report.aliasedOperand()).isEqualTo("Tag2");
        assertThat(report.qualifiedOperand()).isEqualTo("Program:MainProgram.Tag2");
        assertThat(report.argPosition()).isZero();
        assertThat(report.instruction()).isEqualTo("OTE(Tag1)");
        assertThat(report.role()).isEqualTo(OperandRole.OUTPUT);
        assertThat(report.program()).isEqualTo("MainProgram");
        assertThat(report.routine()).isNull();
        assertThat(report.rung()).isZero();
    }

    @Test
    void instructionText_isRebuiltFromOperandForms() throws RungParseException {
        Rung rung = new Rung(0, "MOV(Tag1.Value,Conveyor.Speed)", null, environment,
                ParserSettings.defaults());
        Instruction instruction = rung.getInstructions().get(0);

        assertThat(instruction.getAliasedText()).isEqualTo("MOV(Tag2.Value,Conveyor.Speed)");
        assertThat(instruction.getQualifiedText()).isEqualTo("MOV(Program:MainProgram.Tag2.Value,Conveyor.Speed)");
    }

    @Test
    void role_ignoresTrailingBlankArgument() throws RungParseException {
        // Arrange
        Rung rung = new Rung(0, "MOV(Src,)", null, environment, ParserSettings.defaults());
        Instruction instruction = rung.getInstructions().get(0);

        // Act
        Operand operand = instruction.getOperands().get(0);

        // Assert
        assertThat(instruction.getArgumentCount()).isEqualTo(2);
        assertThat(instruction.getOperands()).hasSize(1);
        assertThat(operand.getRole()).isEqualTo(OperandRole.OUTPUT);
    }
}
