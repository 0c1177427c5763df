package com.templateweaver.core.parser;

/**
 * Parses document text of one {@link TemplateFormat} and normalizes it into a canonical
 * tree.
 *
 * <p>Implementations must rewrite every shorthand directive into its canonical form,
 * reject unknown directive tags and fail with {@link DocumentParseException} on malformed
 * input without returning a partial tree.
 *
 * @see TemplateNormalizer
 */
public interface FormatNormalizer {

    /**
     * Returns the format this normalizer reads.
     *
     * @return supported format
     */
    TemplateFormat format();

    /**
     * Parses and normalizes a document.
     *
     * @param text document text
     * @param trackLocations whether to record the source location of every path
     * @return normalized document
     * @throws DocumentParseException if the text is not a well-formed document
     * @throws UnrecognizedDirectiveException if a shorthand tag is not a known directive
     */
    NormalizedDocument normalize(String text, boolean trackLocations);
}
