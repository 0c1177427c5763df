package com.templateweaver.core;

import com.templateweaver.core.config.WeaverConfig;
import com.templateweaver.core.directive.DirectiveShapeError;
import com.templateweaver.core.directive.DirectiveShapeException;
import com.templateweaver.core.directive.DirectiveShapeValidator;
import com.templateweaver.core.mapping.TemplateMapper;
import com.templateweaver.core.model.Template;
import com.templateweaver.core.parser.NormalizedDocument;
import com.templateweaver.core.parser.TemplateFormat;
import com.templateweaver.core.parser.TemplateNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the full pipeline on raw template bytes: normalize, validate directive shapes,
 * map to the template model.
 *
 * <p>Parse and model errors are always fatal. Directive shape violations are logged and
 * returned with the result, unless {@code validation.failOnDirectiveErrors} is set, in
 * which case they are thrown as a {@link DirectiveShapeException}.
 *
 * @since 1.0.0
 */
public class TemplateProcessor {

    private static final Logger log = LoggerFactory.getLogger(TemplateProcessor.class);

    private final WeaverConfig config;
    private final TemplateNormalizer normalizer;
    private final DirectiveShapeValidator validator;
    private final TemplateMapper mapper;

    public TemplateProcessor() {
        this(WeaverConfig.defaults());
    }

    public TemplateProcessor(WeaverConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.normalizer = new TemplateNormalizer(config.parser().trackLocations());
        this.validator = new DirectiveShapeValidator();
        this.mapper = new TemplateMapper();
    }

    /**
     * Processes a template in the configured format, detecting it from content when the
     * configuration says {@code auto}.
     *
     * @param content raw UTF-8 bytes
     * @return processed template
     */
    public ProcessedTemplate process(byte[] content) {
        return process(content, config.parser().formatHint().orElse(null));
    }

    /**
     * Processes a template.
     *
     * @param content raw UTF-8 bytes
     * @param format document format, or {@code null} to detect it from content
     * @return processed template
     * @throws TemplateException if the template cannot be parsed or mapped, or has
     *         directive violations and they are configured to be fatal
     */
    public ProcessedTemplate process(byte[] content, TemplateFormat format) {
        NormalizedDocument document = normalize(content, format);
        List<DirectiveShapeError> errors = validateDirectives(document);
        return new ProcessedTemplate(document, map(document), errors);
    }

    // ==================== Stages ====================

    /**
     * Normalizes raw template bytes.
     *
     * @param content raw UTF-8 bytes
     * @param format document format, or {@code null} to detect it from content
     * @return normalized document
     */
    public NormalizedDocument normalize(byte[] content, TemplateFormat format) {
        NormalizedDocument document = normalizer.normalize(content, format);
        log.debug("Detected format {} ({} locations tracked)", document.format(), document.locations().size());
        return document;
    }

    /**
     * Checks every directive in the document. Violations are logged and returned, or thrown
     * when the configuration makes them fatal.
     *
     * @param document normalized document
     * @return violations in document order
     * @throws DirectiveShapeException if there are violations and they are configured to be fatal
     */
    public List<DirectiveShapeError> validateDirectives(NormalizedDocument document) {
        List<DirectiveShapeError> errors = validator.validate(document);
        if (!errors.isEmpty()) {
            if (config.validation().failOnDirectiveErrors()) {
                throw new DirectiveShapeException(errors);
            }
            log.warn("Template has {} directive shape violation(s)", errors.size());
            errors.forEach(error -> log.warn("  {}", error));
        }
        return errors;
    }

    /**
     * Maps a normalized document into the template model.
     *
     * @param document normalized document
     * @return template model
     */
    public Template map(NormalizedDocument document) {
        return mapper.map(document);
    }
}
