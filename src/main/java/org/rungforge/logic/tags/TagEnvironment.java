package org.rungforge.logic.tags;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The tag context in which the operands of a rung are resolved: the tag table of the immediate
 * container (program or add-on instruction), the controller-global tag table and the names of
 * user-defined instructions.
 */
public final class TagEnvironment {

    private static final TagEnvironment EMPTY = new TagEnvironment(null, TagTable.empty(), TagTable.empty(), Set.of());

    private final String containerName;
    private final TagTable localTags;
    private final TagTable controllerTags;
    private final Set<String> addOnInstructionNames;

    /**
     * Creates a new environment.
     * @param containerName The name of the program or add-on instruction, or {@code null}.
     * @param localTags The container's tag table.
     * @param controllerTags The controller-global tag table.
     * @param addOnInstructionNames The names of the user-defined instructions of the controller.
     */
    public TagEnvironment(String containerName, TagTable localTags, TagTable controllerTags, Set<String> addOnInstructionNames) {
        this.containerName = containerName;
        this.localTags = Objects.requireNonNull(localTags, "localTags");
        this.controllerTags = Objects.requireNonNull(controllerTags, "controllerTags");
        this.addOnInstructionNames = Set.copyOf(addOnInstructionNames);
    }

    /**
     * Creates an environment for a program without add-on instructions.
     * @param containerName The program name.
     * @param localTags The program tags.
     * @param controllerTags The controller tags.
     * @return The environment.
     */
    public static TagEnvironment of(String containerName, TagTable localTags, TagTable controllerTags) {
        return new TagEnvironment(containerName, localTags, controllerTags, Set.of());
    }

    /**
     * @return An environment without any tags, used by rungs that are not attached to a routine.
     */
    public static TagEnvironment empty() {
        return EMPTY;
    }

    public Optional<String> getContainerName() {
        return Optional.ofNullable(containerName);
    }

    public TagTable getLocalTags() {
        return localTags;
    }

    public TagTable getControllerTags() {
        return controllerTags;
    }

    public Set<String> getAddOnInstructionNames() {
        return addOnInstructionNames;
    }

    public boolean isAddOnInstruction(String opcode) {
        return addOnInstructionNames.contains(opcode);
    }
}
