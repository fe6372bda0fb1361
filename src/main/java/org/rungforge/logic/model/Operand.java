package org.rungforge.logic.model;

import org.rungforge.logic.isa.InstructionCatalog;
import org.rungforge.logic.isa.OperandRole;
import org.rungforge.logic.report.InstructionReport;
import org.rungforge.logic.report.OperandReport;
import org.rungforge.logic.tags.AliasResolver;
import org.rungforge.logic.tags.Tag;
import org.rungforge.logic.tags.TagEnvironment;
import org.rungforge.logic.tags.TagScope;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * One operand of an instruction, e.g. {@code Motor.Status.Running}.
 * <p>
 * All forms derived from the tag environment are memoized until {@link #invalidate()} is called.
 * An operand whose base name is not a known tag (a literal, a hardware status bit or a
 * placeholder) keeps its raw text in every form.
 */
public class Operand {

    /** The prefix of references to program-scoped tags. */
    public static final String PROGRAM_PREFIX = "Program:";

    private final String text;
    private final Instruction instruction;
    private final int position;

    private final Derived<String> baseName = new Derived<>();
    private final Derived<List<String>> parents = new Derived<>();
    private final Derived<String> trailingName = new Derived<>();
    private final Derived<Optional<Tag>> firstTag = new Derived<>();
    private final Derived<Optional<Tag>> baseTag = new Derived<>();
    private final Derived<String> aliased = new Derived<>();
    private final Derived<List<String>> aliasedParents = new Derived<>();
    private final Derived<String> qualified = new Derived<>();
    private final Derived<List<String>> qualifiedParents = new Derived<>();
    private final Derived<OperandRole> role = new Derived<>();

    /**
     * @param text The operand text as written.
     * @param instruction The owning instruction.
     * @param position The argument index within the instruction.
     */
    public Operand(String text, Instruction instruction, int position) {
        this.text = text;
        this.instruction = instruction;
        this.position = position;
    }

    public String getText() {
        return text;
    }

    public Instruction getInstruction() {
        return instruction;
    }

    public int getPosition() {
        return position;
    }

    /**
     * @return The leftmost member segment, e.g. {@code Motor} for {@code Motor.Status.Running}.
     */
    public String getBaseName() {
        return baseName.get(() -> text.split("\\.", -1)[0]);
    }

    /**
     * @return Every dot-truncated prefix of the operand, longest first.
     */
    public List<String> getParents() {
        return parents.get(() -> parentsOf(text));
    }

    /**
     * @return The member path after the base name, including its leading '.', or an empty string.
     */
    public String getTrailingName() {
        return trailingName.get(() -> {
            int dot = text.indexOf('.');
            return dot < 0 ? "" : text.substring(dot);
        });
    }

    /**
     * @return The tag the base name refers to before following aliases.
     */
    public Optional<Tag> getFirstTag() {
        return firstTag.get(() -> resolver().firstTag(getBaseName()));
    }

    /**
     * @return The tag at the end of the alias chain.
     */
    public Optional<Tag> getBaseTag() {
        return baseTag.get(() -> getFirstTag().map(tag -> resolver().baseTag(tag)));
    }

    /**
     * @return The operand with every alias replaced by the reference it stands for.
     */
    public String getAliased() {
        return aliased.get(() -> getFirstTag()
                .filter(Tag::isAlias)
                .map(tag -> resolver().aliasString(tag, getTrailingName()))
                .orElse(text));
    }

    public List<String> getAliasedParents() {
        return aliasedParents.get(() -> parentsOf(getAliased()));
    }

    /**
     * @return The aliased operand, prefixed with {@code Program:<container>.} when its base tag is
     *         program-scoped.
     */
    public String getQualified() {
        return qualified.get(() -> qualifier().map(prefix -> prefix + getAliased()).orElse(getAliased()));
    }

    public List<String> getQualifiedParents() {
        return qualifiedParents.get(() -> {
            Optional<String> prefix = qualifier();
            if (prefix.isEmpty()) {
                return getAliasedParents();
            }
            List<String> result = new ArrayList<>();
            for (String parent : getAliasedParents()) {
                result.add(prefix.get() + parent);
            }
            return List.copyOf(result);
        });
    }

    public OperandRole getRole() {
        return role.get(() -> InstructionCatalog.classify(instruction.getOpcode(), position,
                instruction.getOperands().size(), instruction.getEnvironment().getAddOnInstructionNames()));
    }

    public OperandReport reportEntry() {
        InstructionReport owner = instruction.reportEntry();
        return new OperandReport(text, getAliased(), getQualified(), position, instruction.getText(), getRole(),
                owner.program(), owner.routine(), owner.rung());
    }

    /**
     * Discards all memoized forms.
     */
    public void invalidate() {
        baseName.invalidate();
        parents.invalidate();
        trailingName.invalidate();
        firstTag.invalidate();
        baseTag.invalidate();
        aliased.invalidate();
        aliasedParents.invalidate();
        qualified.invalidate();
        qualifiedParents.invalidate();
        role.invalidate();
    }

    private AliasResolver resolver() {
        return new AliasResolver(instruction.getEnvironment());
    }

    private Optional<String> qualifier() {
        Optional<Tag> tag = getBaseTag();
        if (tag.isEmpty() || tag.get().scope() != TagScope.PROGRAM) {
            return Optional.empty();
        }
        TagEnvironment environment = instruction.getEnvironment();
        return environment.getContainerName().map(name -> PROGRAM_PREFIX + name + ".");
    }

    static List<String> parentsOf(String reference) {
        String[] segments = reference.split("\\.", -1);
        List<String> result = new ArrayList<>();
        for (int count = segments.length; count > 0; count--) {
            result.add(String.join(".", Arrays.copyOfRange(segments, 0, count)));
        }
        return List.copyOf(result);
    }

    @Override
    public String toString() {
        return text;
    }
}
