package com.templateweaver.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for turning raw template bytes into a canonical tree.
 *
 * <p>Decodes the bytes as UTF-8, picks the format (from the hint, or by sniffing the
 * content) and delegates to the matching {@link FormatNormalizer}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TemplateNormalizer normalizer = new TemplateNormalizer(true);
 * NormalizedDocument document = normalizer.normalize(bytes);
 *
 * document.locations().get("Resources.MyFunc").ifPresent(System.out::println);
 * }</pre>
 */
public class TemplateNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TemplateNormalizer.class);

    private final boolean trackLocations;
    private final Map<TemplateFormat, FormatNormalizer> normalizers = new EnumMap<>(TemplateFormat.class);

    /**
     * Creates a normalizer without location tracking.
     */
    public TemplateNormalizer() {
        this(false);
    }

    /**
     * Creates a normalizer.
     *
     * @param trackLocations whether documents record the source location of every path
     */
    public TemplateNormalizer(boolean trackLocations) {
        this.trackLocations = trackLocations;
        register(new YamlNormalizer());
        register(new JsonNormalizer());
    }

    public boolean isTrackingLocations() {
        return trackLocations;
    }

    /**
     * Normalizes a document, detecting its format from the content.
     *
     * @param content raw UTF-8 bytes
     * @return normalized document
     * @throws DocumentParseException if the bytes are not a well-formed document
     * @throws UnrecognizedDirectiveException if a shorthand tag is not a known directive
     */
    public NormalizedDocument normalize(byte[] content) {
        String text = decode(content);
        return normalize(text, TemplateFormat.sniff(text));
    }

    /**
     * Normalizes a document in a known format.
     *
     * @param content raw UTF-8 bytes
     * @param format document format; {@code null} to detect it from the content
     * @return normalized document
     */
    public NormalizedDocument normalize(byte[] content, TemplateFormat format) {
        String text = decode(content);
        return normalize(text, format == null ? TemplateFormat.sniff(text) : format);
    }

    /**
     * Normalizes document text in a known format.
     *
     * @param text document text
     * @param format document format
     * @return normalized document
     */
    public NormalizedDocument normalize(String text, TemplateFormat format) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(format, "format must not be null");
        log.debug("Normalizing {} document ({} characters)", format, text.length());
        return normalizers.get(format).normalize(stripByteOrderMark(text), trackLocations);
    }

    private void register(FormatNormalizer normalizer) {
        normalizers.put(normalizer.format(), normalizer);
    }

    private static String decode(byte[] content) {
        Objects.requireNonNull(content, "content must not be null");
        try {
            CharBuffer chars = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(content));
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new DocumentParseException("document is not valid UTF-8", null, e);
        }
    }

    private static String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }
}
