package org.rungforge.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.typesafe.config.ConfigException;
import org.rungforge.cli.CommandLineInterface;
import org.rungforge.config.TagEnvironmentLoader;
import org.rungforge.logic.api.RungParseException;
import org.rungforge.logic.model.Rung;
import org.rungforge.logic.report.RungReportWriter;
import org.rungforge.logic.tags.TagEnvironment;
import org.rungforge.logic.tags.TagResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.util.concurrent.Callable;

@Command(name = "inspect",
        mixinStandardHelpOptions = true,
        description = "Parses a rung and prints its structure, branches and resolved operands as JSON.")
public class InspectCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(InspectCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The rung text, e.g. \"XIC(Start)OTE(Motor);\".")
    private String text;

    @Option(names = {"-n", "--number"}, defaultValue = "0", description = "The rung number (default: ${DEFAULT-VALUE}).")
    private int number;

    @Option(names = {"-t", "--tags"}, description = "HOCON file with the program name, tags and add-on instructions.")
    private File tagFile;

    @Override
    public Integer call() {
        try {
            TagEnvironment environment = tagFile == null ? TagEnvironment.empty() : TagEnvironmentLoader.load(tagFile);
            Rung rung = new Rung(number, text, null, environment, parent.getParserSettings());
            spec.commandLine().getOut().println(new RungReportWriter().write(rung));
            return 0;
        } catch (RungParseException e) {
            LOG.error("Invalid rung: {}", e.getMessage());
            return 1;
        } catch (IllegalArgumentException | ConfigException | TagResolutionException e) {
            LOG.error("Cannot read tags: {}", e.getMessage());
            return 2;
        } catch (JsonProcessingException e) {
            LOG.error("Failed to render report: {}", e.getMessage(), e);
            return 2;
        }
    }
}
