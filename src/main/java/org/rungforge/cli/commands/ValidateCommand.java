package org.rungforge.cli.commands;

import org.rungforge.cli.CommandLineInterface;
import org.rungforge.logic.api.RungParseException;
import org.rungforge.logic.frontend.parser.ParserSettings;
import org.rungforge.logic.frontend.parser.RungParser;
import org.rungforge.logic.frontend.parser.RungStructure;
import org.rungforge.logic.model.Instruction;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "validate",
        mixinStandardHelpOptions = true,
        description = "Checks the branch structure of a rung. Exits with 0 if it parses, 1 otherwise.")
public class ValidateCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The rung text.")
    private String text;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        ParserSettings settings = parent.getParserSettings();
        try {
            RungStructure structure = new RungParser(settings).parse(text, 0, (instruction, index) -> new Instruction(instruction));
            long branches = structure.branches().values().stream().filter(b -> !b.isArm()).count();
            out.printf("OK: %d instructions, %d branches%n", structure.instructions().size(), branches);
            if (structure.wasHealed()) {
                out.printf("Normalized to: %s%n", structure.text());
            }
            structure.diagnostics().forEach(out::println);
            return 0;
        } catch (RungParseException e) {
            out.printf("INVALID (%s): %s%n", e.getCode(), e.getMessage());
            return 1;
        }
    }
}
