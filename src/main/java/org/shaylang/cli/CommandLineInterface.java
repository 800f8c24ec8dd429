package org.shaylang.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.shaylang.cli.commands.CompileCommand;
import org.shaylang.compiler.config.ConfigLoader;
import org.shaylang.compiler.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "shaylang",
    mixinStandardHelpOptions = true,
    version = "ShayLang 1.0",
    description = "ShayLang - source-to-source compiler targeting C",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("shaylang");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        final File file;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            LOG.debug("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            file = configFile;
        } else {
            file = new File(ConfigLoader.CONFIG_FILE_NAME);
        }

        try {
            config = ConfigLoader.load(file);
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    /**
     * @return The merged configuration, loaded on first access.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
