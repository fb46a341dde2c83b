package org.gta3sc.cli;

import com.typesafe.config.Config;
import org.gta3sc.cli.commands.ConfigCommand;
import org.gta3sc.cli.commands.ResolveCommand;
import org.gta3sc.cli.config.ConfigLoader;
import org.gta3sc.cli.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "gta3sc",
    mixinStandardHelpOptions = true,
    version = "gta3sc 0.1.0",
    description = "gta3sc - compiler for GTA3script",
    subcommands = {
        ConfigCommand.class,
        ResolveCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws org.gta3sc.compiler.api.ConfigurationException if it cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
