package com.smartservice;

import ch.qos.logback.classic.Level;
import com.smartservice.cli.CompileCommand;
import com.smartservice.cli.ListCommand;
import com.smartservice.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the SmartService descriptor compiler.
 *
 * <p>Compiles declarative smart-service descriptors (data sources, visualizations, roles and
 * deployment targets) into a validated intermediate representation.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile} - Compile a descriptor and print or write its IR</li>
 *   <li>{@code validate} - Check a descriptor and report diagnostics only</li>
 *   <li>{@code list} - List available providers or visualization types</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Exit codes:</b> 0 on success, 1 if the descriptor has errors, 2 if it is malformed.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Compile to JSON on stdout
 * smartservice compile air-quality.yaml
 *
 * # Compile to a YAML file with a custom configuration
 * smartservice compile air-quality.yaml -c compiler.yaml -o build/ir.yaml --format yaml
 *
 * # List supported providers
 * smartservice list providers
 * }</pre>
 */
@Command(
    name = "smartservice",
    mixinStandardHelpOptions = true,
    version = "SmartService Compiler 1.0.0-SNAPSHOT",
    description = "Compiles smart-service descriptors into a validated intermediate representation",
    subcommands = {
        CompileCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class SmartServiceCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SmartServiceCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("SmartService - Descriptor Compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'smartservice --help' to see available commands");
        System.out.println("Use 'smartservice <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, configuring logging before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SmartServiceCLI cli = new SmartServiceCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
