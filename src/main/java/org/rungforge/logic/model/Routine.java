package org.rungforge.logic.model;

import org.rungforge.logic.api.RungParseException;
import org.rungforge.logic.frontend.parser.ParserSettings;
import org.rungforge.logic.isa.OperandRole;
import org.rungforge.logic.tags.TagEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, ordered collection of rungs that share one tag environment.
 * <p>
 * Rungs are always numbered by their index; every change of the collection renumbers them.
 */
public class Routine {

    private static final Logger LOG = LoggerFactory.getLogger(Routine.class);

    private final String name;
    private final ParserSettings settings;
    private final List<Rung> rungs = new ArrayList<>();
    private TagEnvironment environment;

    public Routine(String name, TagEnvironment environment, ParserSettings settings) {
        this.name = Objects.requireNonNull(name, "name");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public Routine(String name, TagEnvironment environment) {
        this(name, environment, ParserSettings.defaults());
    }

    public Routine(String name) {
        this(name, TagEnvironment.empty());
    }

    public String getName() {
        return name;
    }

    public TagEnvironment getEnvironment() {
        return environment;
    }

    /**
     * Replaces the tag environment and discards every resolved operand of the routine.
     *
     * @param environment The new environment.
     */
    public void setEnvironment(TagEnvironment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
        invalidate();
    }

    public List<Rung> getRungs() {
        return Collections.unmodifiableList(rungs);
    }

    /**
     * @param number The rung number.
     * @return The rung, or empty if there is no rung with this number.
     */
    public Optional<Rung> getRung(int number) {
        return number >= 0 && number < rungs.size() ? Optional.of(rungs.get(number)) : Optional.empty();
    }

    /**
     * Appends a rung.
     *
     * @param rung A rung that is not part of another routine.
     */
    public void addRung(Rung rung) {
        addRung(rung, -1);
    }

    /**
     * Inserts a rung and renumbers all rungs.
     *
     * @param rung A rung that is not part of another routine.
     * @param index The insertion index; a negative or too large index appends.
     */
    public void addRung(Rung rung, int index) {
        Objects.requireNonNull(rung, "rung");
        if (rung.getRoutine().isPresent()) {
            throw new IllegalArgumentException("Rung already belongs to routine '" + rung.getRoutine().get().getName() + "'");
        }
        if (index < 0 || index >= rungs.size()) {
            rungs.add(rung);
        } else {
            rungs.add(index, rung);
        }
        rung.attach(this);
        renumber();
        LOG.debug("Added rung {} to routine {}", rung.getNumber(), name);
    }

    /**
     * Parses and appends a rung.
     *
     * @param text The rung text.
     * @return The new rung.
     * @throws RungParseException if the text has an invalid branch structure.
     */
    public Rung addRung(String text) throws RungParseException {
        Rung rung = new Rung(rungs.size(), text, null, environment, settings);
        addRung(rung);
        return rung;
    }

    /**
     * Removes the rung at the given index and renumbers the remaining rungs.
     *
     * @param index The rung index.
     * @return The removed rung.
     */
    public Rung removeRung(int index) {
        Objects.checkIndex(index, rungs.size());
        Rung removed = rungs.remove(index);
        removed.detach();
        renumber();
        return removed;
    }

    /**
     * Removes a rung of this routine.
     *
     * @param rung The rung instance.
     */
    public void removeRung(Rung rung) {
        for (int i = 0; i < rungs.size(); i++) {
            if (rungs.get(i) == rung) {
                removeRung(i);
                return;
            }
        }
        throw new IllegalArgumentException("Rung " + rung.getNumber() + " is not part of routine '" + name + "'");
    }

    public void clearRungs() {
        LOG.debug("Clearing all rungs from routine {}", name);
        rungs.forEach(Rung::detach);
        rungs.clear();
    }

    public List<Instruction> getInstructions() {
        List<Instruction> result = new ArrayList<>();
        rungs.forEach(rung -> result.addAll(rung.getInstructions()));
        return result;
    }

    public List<Instruction> getInputInstructions() {
        List<Instruction> result = new ArrayList<>();
        rungs.forEach(rung -> result.addAll(rung.getInputInstructions()));
        return result;
    }

    public List<Instruction> getOutputInstructions() {
        List<Instruction> result = new ArrayList<>();
        rungs.forEach(rung -> result.addAll(rung.getOutputInstructions()));
        return result;
    }

    /**
     * @param opcodeFilter The exact opcode, or {@code null} for any.
     * @param operandFilter Text one operand must contain, or {@code null} for any.
     * @return The matching instructions of all rungs.
     */
    public List<Instruction> getInstructions(String opcodeFilter, String operandFilter) {
        List<Instruction> result = new ArrayList<>();
        rungs.forEach(rung -> result.addAll(rung.getInstructions(opcodeFilter, operandFilter)));
        return result;
    }

    /**
     * @param routineName The name of the called routine.
     * @return {@code true} if a subroutine call in this routine targets the named routine.
     */
    public boolean checkForJsr(String routineName) {
        for (Instruction instruction : getInstructions()) {
            if (instruction.getRole() == OperandRole.JSR && !instruction.getOperands().isEmpty()
                    && instruction.getOperands().get(0).getText().equals(routineName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Discards every resolved operand of every rung. Called after the tag tables changed.
     */
    public void invalidate() {
        rungs.forEach(Rung::invalidateResolution);
    }

    private void renumber() {
        for (int i = 0; i < rungs.size(); i++) {
            rungs.get(i).setNumber(i);
        }
    }

    @Override
    public String toString() {
        return "Routine{" + name + ", rungs=" + rungs.size() + "}";
    }
}
