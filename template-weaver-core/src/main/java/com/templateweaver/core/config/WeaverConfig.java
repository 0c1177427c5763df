package com.templateweaver.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.templateweaver.core.parser.TemplateFormat;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Root configuration for Template Weaver.
 *
 * <p>Loaded from {@code template-weaver.yaml}. Every section is optional; absent sections
 * and fields take the values of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   trackLocations: true
 *   format: auto          # auto | yaml | json
 *
 * identifiers:
 *   reservedPrefixes:
 *     - Internal
 *   idPrefix: ""
 *
 * validation:
 *   failOnDirectiveErrors: false
 * }</pre>
 *
 * @param parser parser settings
 * @param identifiers identifier settings
 * @param validation validation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WeaverConfig(
    @JsonProperty("parser") ParserConfig parser,
    @JsonProperty("identifiers") IdentifierConfig identifiers,
    @JsonProperty("validation") ValidationConfig validation
) {
    /**
     * Compact constructor filling in absent sections.
     */
    public WeaverConfig {
        parser = parser == null ? ParserConfig.defaults() : parser;
        identifiers = identifiers == null ? IdentifierConfig.defaults() : identifiers;
        validation = validation == null ? ValidationConfig.defaults() : validation;
    }

    /**
     * Creates the default configuration: locations tracked, format detected from content,
     * no extra reserved prefixes, no id prefix, directive violations reported but not fatal.
     *
     * @return default configuration
     */
    public static WeaverConfig defaults() {
        return new WeaverConfig(null, null, null);
    }

    /**
     * Parser settings.
     *
     * @param trackLocations whether to record line/column for every path
     * @param format {@code auto}, {@code yaml} or {@code json}; normalized to lowercase,
     *        with {@code yml} read as {@code yaml}
     * @throws IllegalArgumentException if the format name is not recognized
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserConfig(
        @JsonProperty("trackLocations") Boolean trackLocations,
        @JsonProperty("format") String format
    ) {
        public ParserConfig {
            trackLocations = trackLocations == null ? Boolean.TRUE : trackLocations;
            format = TemplateFormat.fromName(format)
                .map(known -> known.name().toLowerCase(Locale.ROOT))
                .orElse("auto");
        }

        static ParserConfig defaults() {
            return new ParserConfig(null, null);
        }

        /**
         * Returns the configured format, or empty when the format is detected from content.
         *
         * @return format hint
         */
        public Optional<TemplateFormat> formatHint() {
            return TemplateFormat.fromName(format);
        }
    }

    /**
     * Identifier settings.
     *
     * @param reservedPrefixes prefixes reserved in addition to {@code AWS} and {@code Custom}
     * @param idPrefix prefix prepended to generated logical ids
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IdentifierConfig(
        @JsonProperty("reservedPrefixes") List<String> reservedPrefixes,
        @JsonProperty("idPrefix") String idPrefix
    ) {
        public IdentifierConfig {
            reservedPrefixes = reservedPrefixes == null ? List.of() : List.copyOf(reservedPrefixes);
            idPrefix = idPrefix == null ? "" : idPrefix;
        }

        static IdentifierConfig defaults() {
            return new IdentifierConfig(null, null);
        }
    }

    /**
     * Validation settings.
     *
     * @param failOnDirectiveErrors whether directive shape violations abort processing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("failOnDirectiveErrors") Boolean failOnDirectiveErrors
    ) {
        public ValidationConfig {
            failOnDirectiveErrors = failOnDirectiveErrors == null ? Boolean.FALSE : failOnDirectiveErrors;
        }

        static ValidationConfig defaults() {
            return new ValidationConfig(null);
        }
    }
}
