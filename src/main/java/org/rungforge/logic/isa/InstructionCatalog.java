package org.rungforge.logic.isa;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The static opcode catalog used to classify instructions and their operands.
 * <p>
 * The catalog is a fixed contract consumed by validators and diagnostic reports: every
 * always-input opcode classifies all of its operands as {@link OperandRole#INPUT}, every output
 * opcode writes exactly one operand at a fixed index ({@link #LAST_OPERAND} meaning the final
 * operand) and {@link #SUBROUTINE_CALL} forms its own category.
 */
public final class InstructionCatalog {

    /** Output index marker meaning "the last operand of the instruction". */
    public static final int LAST_OPERAND = -1;

    /** The subroutine call opcode. */
    public static final String SUBROUTINE_CALL = "JSR";

    private static final Pattern OPCODE_PATTERN = Pattern.compile("[A-Za-z0-9_]+");

    private static final Set<String> INPUT_OPCODES = new LinkedHashSet<>();
    private static final Map<String, Integer> OUTPUT_INDEX_BY_OPCODE = new LinkedHashMap<>();

    static {
        init();
    }

    private InstructionCatalog() {}

    /**
     * Registers all catalogued instruction families. Called once from the static initializer.
     */
    private static void init() {
        // Examine instructions
        registerInputs(List.of("XIC", "XIO"));

        // Coils
        registerOutputs(List.of("OTE", "OTU", "OTL"), LAST_OPERAND);

        // Timers and counters write their structure operand
        registerOutputs(List.of("TON", "TOF", "RTO", "CTU", "CTD"), 0);
        registerOutputs(List.of("RES"), LAST_OPERAND);

        // Communication and system values
        registerOutputs(List.of("MSG", "GSV", "IOT"), LAST_OPERAND);

        // One-shots
        registerOutputs(List.of("ONS", "OSR", "OSF"), LAST_OPERAND);

        // Compute family
        registerOutputs(List.of("CPT"), 0);
        registerOutputs(List.of("ADD", "SUB", "MUL", "DIV", "MOD", "SQR", "NEG", "ABS"), LAST_OPERAND);

        // Move and logical family
        registerOutputs(List.of("MOV", "MVM", "AND", "OR", "XOR", "NOT", "SWPB", "CLR"), LAST_OPERAND);
        registerOutputs(List.of("BTD"), 2);

        // File and array family
        registerOutputs(List.of("FAL"), 4);
        registerOutputs(List.of("COP", "FLL"), 1);
        registerOutputs(List.of("AVE"), 2);
        registerOutputs(List.of("SIZE"), LAST_OPERAND);
        registerOutputs(List.of("CPS"), 1);
    }

    private static void registerInputs(List<String> opcodes) {
        INPUT_OPCODES.addAll(opcodes);
    }

    private static void registerOutputs(List<String> opcodes, int outputIndex) {
        for (String opcode : opcodes) {
            if (OUTPUT_INDEX_BY_OPCODE.putIfAbsent(opcode, outputIndex) != null) {
                throw new IllegalStateException("Duplicate output opcode registration: " + opcode);
            }
        }
    }

    /**
     * Classifies one operand of an instruction.
     * <p>
     * This is a pure function of its arguments and never fails.
     *
     * @param opcode The instruction opcode.
     * @param position The zero-based operand position.
     * @param operandCount The number of operands of the instruction.
     * @param customInstructionNames Names of user-defined (add-on) instructions; may be empty.
     * @return The role of the operand.
     */
    public static OperandRole classify(String opcode, int position, int operandCount, Set<String> customInstructionNames) {
        if (opcode == null) {
            return OperandRole.UNKNOWN;
        }
        if (SUBROUTINE_CALL.equals(opcode)) {
            return OperandRole.JSR;
        }
        if (INPUT_OPCODES.contains(opcode)) {
            return OperandRole.INPUT;
        }
        Integer outputIndex = OUTPUT_INDEX_BY_OPCODE.get(opcode);
        if (outputIndex != null) {
            if (position == outputIndex || (outputIndex == LAST_OPERAND && position == operandCount - 1)) {
                return OperandRole.OUTPUT;
            }
            return OperandRole.INPUT;
        }
        // Per-parameter direction of add-on instructions is not known here; treat every operand as written.
        if (customInstructionNames != null && customInstructionNames.contains(opcode)) {
            return OperandRole.OUTPUT;
        }
        return OperandRole.UNKNOWN;
    }

    /**
     * Classifies one operand of a catalogued instruction without custom instructions.
     * @param opcode The instruction opcode.
     * @param position The zero-based operand position.
     * @param operandCount The number of operands of the instruction.
     * @return The role of the operand.
     */
    public static OperandRole classify(String opcode, int position, int operandCount) {
        return classify(opcode, position, operandCount, Set.of());
    }

    /**
     * Classifies a whole instruction by its opcode.
     * @param opcode The instruction opcode.
     * @return {@link OperandRole#INPUT} for examine instructions, {@link OperandRole#OUTPUT} for any
     *         catalogued output instruction, {@link OperandRole#JSR} for subroutine calls and
     *         {@link OperandRole#UNKNOWN} otherwise.
     */
    public static OperandRole instructionRole(String opcode) {
        if (INPUT_OPCODES.contains(opcode)) {
            return OperandRole.INPUT;
        }
        if (OUTPUT_INDEX_BY_OPCODE.containsKey(opcode)) {
            return OperandRole.OUTPUT;
        }
        if (SUBROUTINE_CALL.equals(opcode)) {
            return OperandRole.JSR;
        }
        return OperandRole.UNKNOWN;
    }

    public static boolean isInputInstruction(String opcode) {
        return INPUT_OPCODES.contains(opcode);
    }

    public static boolean isOutputInstruction(String opcode) {
        return OUTPUT_INDEX_BY_OPCODE.containsKey(opcode);
    }

    public static boolean isSubroutineCall(String opcode) {
        return SUBROUTINE_CALL.equals(opcode);
    }

    /**
     * Gets the catalogued output operand index of an opcode.
     * @param opcode The instruction opcode.
     * @return The output index ({@link #LAST_OPERAND} for the last operand), or empty if the opcode
     *         is not an output instruction.
     */
    public static Optional<Integer> outputIndex(String opcode) {
        return Optional.ofNullable(OUTPUT_INDEX_BY_OPCODE.get(opcode));
    }

    /**
     * @param opcode A candidate opcode.
     * @return {@code true} if the opcode is a non-empty identifier.
     */
    public static boolean isValidOpcode(String opcode) {
        return opcode != null && OPCODE_PATTERN.matcher(opcode).matches();
    }

    /**
     * @return All always-input opcodes, in registration order.
     */
    public static Set<String> inputOpcodes() {
        return Collections.unmodifiableSet(INPUT_OPCODES);
    }

    /**
     * @return All output opcodes mapped to their output index, in registration order.
     */
    public static Map<String, Integer> outputOpcodes() {
        return Collections.unmodifiableMap(OUTPUT_INDEX_BY_OPCODE);
    }
}
