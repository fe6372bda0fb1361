package org.rungforge.logic.model;

import org.rungforge.logic.frontend.lexer.RungLexer;
import org.rungforge.logic.isa.InstructionCatalog;
import org.rungforge.logic.isa.OperandRole;
import org.rungforge.logic.report.InstructionReport;
import org.rungforge.logic.tags.TagEnvironment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One instruction of a rung, e.g. {@code MOV(Source,Dest)}.
 * <p>
 * Instructions are created by their rung every time its text is parsed and are never reused
 * across text changes. The operands are the non-blank top-level arguments inside the
 * instruction's own parentheses; each keeps its argument index as position.
 */
public class Instruction {

    private final String text;
    private final String opcode;
    private final List<String> arguments;
    private final List<Operand> operands;
    private final Rung rung;
    private final int index;

    private final Derived<OperandRole> role = new Derived<>();
    private final Derived<String> aliasedText = new Derived<>();
    private final Derived<String> qualifiedText = new Derived<>();

    /**
     * Creates an instruction that belongs to a rung.
     *
     * @param text The instruction text.
     * @param rung The owning rung, or {@code null}.
     * @param index The ordinal of the instruction among the rung's instructions.
     * @throws IllegalArgumentException if the text is not exactly one well-formed instruction.
     */
    public Instruction(String text, Rung rung, int index) {
        if (!RungLexer.isSingleInstruction(text)) {
            throw new IllegalArgumentException("Invalid instruction text: '" + text + "'");
        }
        this.text = text;
        this.rung = rung;
        this.index = index;

        int open = text.indexOf('(');
        this.opcode = text.substring(0, open);
        this.arguments = Collections.unmodifiableList(splitArguments(text.substring(open + 1, text.length() - 1)));

        List<Operand> parsed = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            String argument = arguments.get(i);
            if (!argument.isBlank()) {
                parsed.add(new Operand(argument.strip(), this, i));
            }
        }
        this.operands = Collections.unmodifiableList(parsed);
    }

    /**
     * Creates a detached instruction, resolved against an empty tag environment.
     *
     * @param text The instruction text.
     */
    public Instruction(String text) {
        this(text, null, 0);
    }

    public String getText() {
        return text;
    }

    public String getOpcode() {
        return opcode;
    }

    /**
     * @return The raw arguments, including blank ones.
     */
    public List<String> getArguments() {
        return arguments;
    }

    /**
     * @return The number of arguments, blank ones included.
     */
    public int getArgumentCount() {
        return arguments.size();
    }

    public List<Operand> getOperands() {
        return operands;
    }

    public Optional<Rung> getRung() {
        return Optional.ofNullable(rung);
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return The tag environment of the owning rung, or an empty one.
     */
    public TagEnvironment getEnvironment() {
        return rung == null ? TagEnvironment.empty() : rung.getEnvironment();
    }

    /**
     * @return The instruction-level classification of the opcode.
     */
    public OperandRole getRole() {
        return role.get(() -> InstructionCatalog.instructionRole(opcode));
    }

    public boolean isAddOnInstruction() {
        return getEnvironment().isAddOnInstruction(opcode);
    }

    /**
     * @return The instruction text with every operand replaced by its aliased form.
     */
    public String getAliasedText() {
        return aliasedText.get(() -> rebuild(Operand::getAliased));
    }

    /**
     * @return The instruction text with every operand replaced by its qualified form.
     */
    public String getQualifiedText() {
        return qualifiedText.get(() -> rebuild(Operand::getQualified));
    }

    public InstructionReport reportEntry() {
        Integer rungNumber = rung == null ? null : rung.getNumber();
        String routine = rung == null ? null : rung.getRoutine().map(Routine::getName).orElse(null);
        return new InstructionReport(text, getEnvironment().getContainerName().orElse(null), routine, rungNumber);
    }

    /**
     * Discards the memoized values of this instruction and its operands.
     */
    public void invalidate() {
        role.invalidate();
        aliasedText.invalidate();
        qualifiedText.invalidate();
        operands.forEach(Operand::invalidate);
    }

    private String rebuild(Function<Operand, String> form) {
        List<String> rebuilt = new ArrayList<>(arguments);
        for (Operand operand : operands) {
            rebuilt.set(operand.getPosition(), form.apply(operand));
        }
        return opcode + "(" + String.join(",", rebuilt) + ")";
    }

    /**
     * Splits an argument list at its top-level commas. Commas nested in parentheses or square
     * brackets belong to the argument.
     */
    static List<String> splitArguments(String argumentList) {
        List<String> result = new ArrayList<>();
        if (argumentList.isEmpty()) {
            return result;
        }
        int depth = 0;
        int start = 0;
        for (int i = 0; i < argumentList.length(); i++) {
            char c = argumentList.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                result.add(argumentList.substring(start, i));
                start = i + 1;
            }
        }
        result.add(argumentList.substring(start));
        return result;
    }

    @Override
    public String toString() {
        return text;
    }
}
