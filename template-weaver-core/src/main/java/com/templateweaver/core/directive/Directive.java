package com.templateweaver.core.directive;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of directives a template may contain, with their canonical names and
 * YAML shorthand tags.
 *
 * <p>This enum is the directive tag table: a shorthand tag absent from it is rejected by
 * the normalizers, never passed through as a plain value.
 */
public enum Directive {

    /** Reference to a parameter or resource */
    REF("Ref", "!Ref"),

    /** Attribute lookup on a resource */
    GET_ATT("Fn::GetAtt", "!GetAtt"),

    /** String substitution */
    SUB("Fn::Sub", "!Sub"),

    /** Join values with a delimiter */
    JOIN("Fn::Join", "!Join"),

    /** Conditional branch */
    IF("Fn::If", "!If"),

    /** Indexed select from a list */
    SELECT("Fn::Select", "!Select"),

    /** Two-level map lookup */
    FIND_IN_MAP("Fn::FindInMap", "!FindInMap"),

    /** Base64 encoding */
    BASE64("Fn::Base64", "!Base64"),

    /** CIDR block computation */
    CIDR("Fn::Cidr", "!Cidr"),

    /** Availability-zone list */
    GET_AZS("Fn::GetAZs", "!GetAZs"),

    /** Value exported by another stack */
    IMPORT_VALUE("Fn::ImportValue", "!ImportValue"),

    /** Split a string into a list */
    SPLIT("Fn::Split", "!Split"),

    /** Macro invocation */
    TRANSFORM("Fn::Transform", "!Transform"),

    /** Boolean AND */
    AND("Fn::And", "!And"),

    /** Boolean EQUALS */
    EQUALS("Fn::Equals", "!Equals"),

    /** Boolean NOT */
    NOT("Fn::Not", "!Not"),

    /** Boolean OR */
    OR("Fn::Or", "!Or"),

    /** Reference to a named condition */
    CONDITION("Condition", "!Condition");

    private static final Map<String, Directive> BY_TAG = index(Directive::shorthandTag);
    private static final Map<String, Directive> BY_NAME = index(Directive::canonicalName);

    private final String canonicalName;
    private final String shorthandTag;

    Directive(String canonicalName, String shorthandTag) {
        this.canonicalName = canonicalName;
        this.shorthandTag = shorthandTag;
    }

    public String canonicalName() {
        return canonicalName;
    }

    public String shorthandTag() {
        return shorthandTag;
    }

    /**
     * Looks up a directive by its YAML shorthand tag, e.g. {@code !GetAtt}.
     *
     * @param tag shorthand tag including the leading {@code !}
     * @return the directive, or empty if the tag is not recognized
     */
    public static Optional<Directive> fromTag(String tag) {
        return Optional.ofNullable(tag == null ? null : BY_TAG.get(tag));
    }

    /**
     * Looks up a directive by its canonical name, e.g. {@code Fn::GetAtt}.
     *
     * @param name canonical name
     * @return the directive, or empty if the name is not a directive
     */
    public static Optional<Directive> fromCanonicalName(String name) {
        return Optional.ofNullable(name == null ? null : BY_NAME.get(name));
    }

    public static boolean isDirectiveName(String name) {
        return fromCanonicalName(name).isPresent();
    }

    private static Map<String, Directive> index(Function<Directive, String> key) {
        return Collections.unmodifiableMap(Arrays.stream(values())
            .collect(Collectors.toMap(key, Function.identity())));
    }
}
