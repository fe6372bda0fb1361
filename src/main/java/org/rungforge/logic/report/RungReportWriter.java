package org.rungforge.logic.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.rungforge.logic.frontend.parser.Branch;
import org.rungforge.logic.frontend.parser.SequenceElement;
import org.rungforge.logic.isa.OperandRole;
import org.rungforge.logic.model.Instruction;
import org.rungforge.logic.model.Operand;
import org.rungforge.logic.model.Rung;

/**
 * Renders a rung as a JSON document: its text and counts, the execution sequence, the main-line
 * instructions, every branch with its positions and instructions, and one report entry per
 * operand.
 */
public class RungReportWriter {

    private final ObjectMapper mapper;

    public RungReportWriter() {
        this(new ObjectMapper());
    }

    public RungReportWriter(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Builds the report tree of a rung.
     *
     * @param rung The rung.
     * @return The report.
     */
    public ObjectNode toTree(Rung rung) {
        ObjectNode root = mapper.createObjectNode();
        root.put("number", rung.getNumber());
        if (rung.getComment() == null) {
            root.putNull("comment");
        } else {
            root.put("comment", rung.getComment());
        }
        root.put("text", rung.getText());
        root.put("instructionCount", rung.getInstructionCount());
        root.put("branchCount", rung.getBranchCount());
        root.put("maxBranchDepth", rung.getMaxBranchDepth());

        ObjectNode summary = root.putObject("instructionSummary");
        rung.getInstructionSummary().forEach((opcode, count) -> summary.put(opcode, count.intValue()));

        ArrayNode sequence = root.putArray("executionSequence");
        for (SequenceElement element : rung.getSequence()) {
            sequence.add(sequenceEntry(element));
        }

        ArrayNode mainLine = root.putArray("mainLineInstructions");
        rung.getMainLineInstructions().forEach(i -> mainLine.add(i.getText()));

        ArrayNode branches = root.putArray("branches");
        for (Branch branch : rung.getBranches().values()) {
            ObjectNode node = branches.addObject();
            node.put("id", branch.getId());
            node.put("arm", branch.isArm());
            node.put("start", branch.getStartPosition());
            node.put("end", branch.getEndPosition());
            if (branch.getRootBranchId().isPresent()) {
                node.put("root", branch.getRootBranchId().get());
            } else {
                node.putNull("root");
            }
            ArrayNode arms = node.putArray("arms");
            branch.getNestedBranches().forEach(arm -> arms.add(arm.getId()));
            ArrayNode instructions = node.putArray("instructions");
            rung.getBranchInstructions(branch.getId()).forEach(i -> instructions.add(i.getText()));
        }

        ArrayNode operands = root.putArray("operands");
        for (Instruction instruction : rung.getInstructions()) {
            for (Operand operand : instruction.getOperands()) {
                operands.add(mapper.valueToTree(operand.reportEntry()));
            }
        }
        return root;
    }

    /**
     * Renders the report of a rung as indented JSON.
     *
     * @param rung The rung.
     * @return The JSON document.
     * @throws JsonProcessingException if the report cannot be serialized.
     */
    public String write(Rung rung) throws JsonProcessingException {
        return mapper.writeValueAsString(toTree(rung));
    }

    private ObjectNode sequenceEntry(SequenceElement element) {
        ObjectNode node = mapper.createObjectNode();
        node.put("step", element.position());
        node.put("type", element.type().name());
        if (element.isInstruction()) {
            Instruction instruction = element.instruction();
            node.put("opcode", instruction.getOpcode());
            node.put("text", instruction.getText());
            ArrayNode operands = node.putArray("operands");
            instruction.getOperands().forEach(o -> operands.add(o.getText()));
            node.put("input", instruction.getRole() == OperandRole.INPUT);
            node.put("output", instruction.getRole() == OperandRole.OUTPUT);
        }
        if (element.branchId() != null) {
            node.put("branchId", element.branchId());
        }
        if (element.rootBranchId() != null) {
            node.put("rootBranchId", element.rootBranchId());
        }
        node.put("branchLevel", element.branchLevel());
        return node;
    }
}
