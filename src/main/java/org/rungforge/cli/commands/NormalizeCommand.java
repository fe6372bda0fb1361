package org.rungforge.cli.commands;

import org.rungforge.cli.CommandLineInterface;
import org.rungforge.logic.api.RungParseException;
import org.rungforge.logic.model.Rung;
import org.rungforge.logic.tags.TagEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(name = "normalize",
        mixinStandardHelpOptions = true,
        description = "Prints the canonical text of a rung, with single-arm branches removed.")
public class NormalizeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(NormalizeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The rung text.")
    private String text;

    @Override
    public Integer call() {
        try {
            Rung rung = new Rung(0, text, null, TagEnvironment.empty(), parent.getParserSettings());
            spec.commandLine().getOut().println(rung.getText());
            return 0;
        } catch (RungParseException e) {
            LOG.error("Invalid rung: {}", e.getMessage());
            return 1;
        }
    }
}
