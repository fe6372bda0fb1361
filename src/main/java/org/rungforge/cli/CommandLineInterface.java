package org.rungforge.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.rungforge.cli.commands.InspectCommand;
import org.rungforge.cli.commands.NormalizeCommand;
import org.rungforge.cli.commands.ValidateCommand;
import org.rungforge.config.ConfigLoader;
import org.rungforge.config.LoggingConfigurator;
import org.rungforge.logic.frontend.parser.ParserSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "rungforge",
    mixinStandardHelpOptions = true,
    version = "RungForge 1.0",
    description = "RungForge - ladder logic rung parser and editor",
    subcommands = {
        InspectCommand.class,
        NormalizeCommand.class,
        ValidateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: rungforge.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("rungforge");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        try {
            // Config load order: System Props > Env Vars > File > Classpath defaults
            this.config = ConfigLoader.load(configFile);
        } catch (IllegalArgumentException | ConfigException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage());
            throw new CommandLine.ParameterException(new CommandLine(this), e.getMessage(), e);
        }

        // Reloading resets logger levels, so it has to happen before the levels are applied.
        final String previousAppender = System.getProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT_PLAIN");
        final String appender = LoggingConfigurator.appenderFor(config);
        if (!previousAppender.equals(appender)) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, appender);
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    /**
     * @return The parser settings of the loaded configuration.
     */
    public ParserSettings getParserSettings() {
        return ParserSettings.fromConfig(getConfig());
    }
}
