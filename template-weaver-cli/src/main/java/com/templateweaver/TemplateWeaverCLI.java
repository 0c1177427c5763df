package com.templateweaver;

import ch.qos.logback.classic.Level;
import com.templateweaver.cli.ArnCommand;
import com.templateweaver.cli.DirectivesCommand;
import com.templateweaver.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Template Weaver.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Normalize a template and report directive and model errors</li>
 *   <li>{@code arn} - Verify an ARN</li>
 *   <li>{@code directives} - Print the shorthand tag table</li>
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
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * template-weaver validate template.yaml
 * template-weaver -v validate --strict --config template-weaver.yaml template.json
 * template-weaver arn arn:aws:lambda:us-east-1:123456789012:function:F --service lambda
 * }</pre>
 */
@Command(
    name = "template-weaver",
    mixinStandardHelpOptions = true,
    version = "Template Weaver 1.0.0-SNAPSHOT",
    description = "Infrastructure template normalization and identifier verification",
    subcommands = {
        ValidateCommand.class,
        ArnCommand.class,
        DirectivesCommand.class
    }
)
public class TemplateWeaverCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TemplateWeaverCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("Template Weaver - template normalization and identifier verification");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'template-weaver --help' to see available commands");
        System.out.println("Use 'template-weaver <command> --help' for command-specific help");
    }

    /**
     * Configures the Logback root level from the global options. Subcommands call this
     * before doing any work.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new TemplateWeaverCLI()).execute(args);
        System.exit(exitCode);
    }
}
