package com.templateweaver.cli;

import com.templateweaver.TemplateWeaverCLI;
import com.templateweaver.core.TemplateProcessor;
import com.templateweaver.core.config.ConfigLoader;
import com.templateweaver.core.config.WeaverConfig;
import com.templateweaver.core.directive.DirectiveShapeError;
import com.templateweaver.core.directive.DirectiveShapeException;
import com.templateweaver.core.mapping.MissingRequiredFieldException;
import com.templateweaver.core.mapping.TemplateStructureException;
import com.templateweaver.core.model.Template;
import com.templateweaver.core.parser.DocumentParseException;
import com.templateweaver.core.parser.NormalizedDocument;
import com.templateweaver.core.parser.TemplateFormat;
import com.templateweaver.core.parser.UnrecognizedDirectiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to normalize a template and report directive and model errors.
 *
 * <p>Exit codes: {@code 0} the template is valid, {@code 1} it has directive violations or
 * model errors, {@code 2} the file cannot be read or parsed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * template-weaver validate template.yaml
 * template-weaver validate --format json --strict template.json
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Normalize a template and report directive shape and model errors",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final int EXIT_VALID = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_UNREADABLE = 2;

    @ParentCommand
    private TemplateWeaverCLI parent;

    @Parameters(index = "0", description = "Template file (YAML or JSON)")
    private Path templateFile;

    @Option(names = "--format", description = "Template format: yaml, json or auto (default: from configuration)")
    private String format;

    @Option(names = "--config", description = "Configuration file (default: built-in defaults)")
    private Path configFile;

    @Option(names = "--strict", description = "Stop at directive shape violations instead of also mapping the model")
    private boolean strict;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        WeaverConfig config = configFile == null ? WeaverConfig.defaults() : ConfigLoader.load(configFile);
        if (strict) {
            config = new WeaverConfig(config.parser(), config.identifiers(), new WeaverConfig.ValidationConfig(true));
        }

        TemplateFormat formatHint;
        try {
            formatHint = format == null
                ? config.parser().formatHint().orElse(null)
                : TemplateFormat.fromName(format).orElse(null);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_UNREADABLE;
        }

        byte[] content;
        try {
            content = Files.readAllBytes(templateFile);
        } catch (IOException e) {
            log.error("Cannot read template {}: {}", templateFile, e.getMessage());
            System.err.println("Error: cannot read " + templateFile + ": " + e.getMessage());
            return EXIT_UNREADABLE;
        }

        log.info("Validating template: {}", templateFile);
        TemplateProcessor processor = new TemplateProcessor(config);
        NormalizedDocument document;
        List<DirectiveShapeError> directiveErrors;
        try {
            document = processor.normalize(content, formatHint);
            directiveErrors = processor.validateDirectives(document);
        } catch (DocumentParseException | UnrecognizedDirectiveException e) {
            System.err.println("Parse error: " + e.getMessage());
            return EXIT_UNREADABLE;
        } catch (DirectiveShapeException e) {
            printDirectiveErrors(e.getErrors());
            return EXIT_INVALID;
        }

        if (!directiveErrors.isEmpty()) {
            printDirectiveErrors(directiveErrors);
        }
        try {
            Template template = processor.map(document);
            if (!directiveErrors.isEmpty()) {
                return EXIT_INVALID;
            }
            System.out.printf("%s is valid (%s, %d resources, %d parameters, %d outputs)%n",
                templateFile.getFileName(), document.format(),
                template.resources().size(), template.parameters().size(), template.outputs().size());
            return EXIT_VALID;
        } catch (MissingRequiredFieldException | TemplateStructureException e) {
            System.err.println("Model error: " + e.getMessage());
            return EXIT_INVALID;
        }
    }

    private static void printDirectiveErrors(List<DirectiveShapeError> errors) {
        System.err.printf("%d directive shape violation(s):%n", errors.size());
        errors.forEach(error -> System.err.println("  " + error));
    }
}
