package com.seqdiag;

import com.seqdiag.cli.RenderCommand;
import com.seqdiag.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for SeqDiag.
 *
 * <p>SeqDiag turns textual sequence descriptions into sequence diagrams.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a sequence file to SVG</li>
 *   <li>{@code validate} - Check a sequence file and report diagnostics</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * seqdiag render login.seq -o login.svg
 * seqdiag -v validate login.seq
 * }</pre>
 */
@Command(
    name = "seqdiag",
    mixinStandardHelpOptions = true,
    version = "SeqDiag 1.0.0-SNAPSHOT",
    description = "Sequence diagrams from textual descriptions",
    subcommands = {
        RenderCommand.class,
        ValidateCommand.class
    }
)
public class SeqDiagCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SeqDiagCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Spec
    private CommandSpec spec;

    /**
     * Without a subcommand there is nothing to do; show the usage instead.
     */
    @Override
    public void run() {
        spec.commandLine().usage(System.out);
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
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Creates the command line with the logging level applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        SeqDiagCLI cli = new SeqDiagCLI();
        CommandLine commandLine = new CommandLine(cli);
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
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
