package com.templateweaver.core.directive;

import com.templateweaver.core.node.DirectiveNode;
import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.MappingNode;
import com.templateweaver.core.node.ScalarNode;
import com.templateweaver.core.node.SequenceNode;
import com.templateweaver.core.parser.NormalizedDocument;
import com.templateweaver.core.parser.TemplateNormalizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DirectiveShapeValidator}.
 */
class DirectiveShapeValidatorTest {

    private final DirectiveShapeValidator validator = new DirectiveShapeValidator();

    // ==================== Single directives ====================

    @Test
    void validate_ifWithTwoElements_reportsArity() {
        assertThat(validator.validate(Directive.IF, SequenceNode.ofStrings("IsProd", "a")))
            .hasValueSatisfying(error -> {
                assertThat(error.directive()).isEqualTo(Directive.IF);
                assertThat(error.message()).isEqualTo(
                    "Fn::If requires a 3-element sequence [condition-name-string, true-value, false-value], got 2-element sequence");
            });
    }

    @Test
    void validate_ifWithThreeElements_passes() {
        assertThat(validator.validate(Directive.IF, SequenceNode.ofStrings("IsProd", "a", "b"))).isEmpty();
    }

    @Test
    void validate_joinWithDelimiterAndList_passes() {
        DocumentNode value = SequenceNode.of(ScalarNode.of(","), SequenceNode.ofStrings("a", "b"));

        assertThat(validator.validate(Directive.JOIN, value)).isEmpty();
    }

    @Test
    void validate_joinWithScalarSecondElement_fails() {
        assertThat(validator.validate(Directive.JOIN, SequenceNode.ofStrings(",", "a"))).isPresent();
    }

    @Test
    void validate_refWithSequence_fails() {
        assertThat(validator.validate(Directive.REF, SequenceNode.ofStrings("a")))
            .hasValueSatisfying(error -> assertThat(error.message()).endsWith("got 1-element sequence"));
    }

    @Test
    void validate_getAttStringOrPair_passes() {
        assertThat(validator.validate(Directive.GET_ATT, ScalarNode.of("Single"))).isEmpty();
        assertThat(validator.validate(Directive.GET_ATT, SequenceNode.ofStrings("A", "B"))).isEmpty();
        assertThat(validator.validate(Directive.GET_ATT, SequenceNode.ofStrings("A", "B", "C"))).isPresent();
    }

    @Test
    void validate_subForms_followTemplateAndVariableShape() {
        MappingNode variables = MappingNode.of("Name", ScalarNode.of("x"));

        assertThat(validator.validate(Directive.SUB, ScalarNode.of("${Name}"))).isEmpty();
        assertThat(validator.validate(Directive.SUB, SequenceNode.of(ScalarNode.of("${Name}"), variables))).isEmpty();
        assertThat(validator.validate(Directive.SUB, SequenceNode.ofStrings("${Name}", "x"))).isPresent();
        assertThat(validator.validate(Directive.SUB, ScalarNode.of(3L))).isPresent();
    }

    @Test
    void validate_base64_acceptsStringOrNestedDirective() {
        DirectiveNode nested = new DirectiveNode(Directive.SUB, ScalarNode.of("x"));

        assertThat(validator.validate(Directive.BASE64, ScalarNode.of("x"))).isEmpty();
        assertThat(validator.validate(Directive.BASE64, nested)).isEmpty();
        assertThat(validator.validate(Directive.BASE64, SequenceNode.ofStrings("x"))).isPresent();
        assertThat(validator.validate(Directive.GET_AZS, ScalarNode.of(""))).isEmpty();
    }

    @Test
    void validate_booleanOperands_acceptTwoToTen() {
        assertThat(validator.validate(Directive.AND, SequenceNode.ofStrings("a"))).isPresent();
        assertThat(validator.validate(Directive.AND, SequenceNode.ofStrings("a", "b"))).isEmpty();
        assertThat(validator.validate(Directive.OR, new SequenceNode(Collections.nCopies(10, ScalarNode.of("c"))))).isEmpty();
        assertThat(validator.validate(Directive.OR, new SequenceNode(Collections.nCopies(11, ScalarNode.of("c"))))).isPresent();
        assertThat(validator.validate(Directive.NOT, SequenceNode.ofStrings("c"))).isEmpty();
        assertThat(validator.validate(Directive.EQUALS, SequenceNode.ofStrings("a", "b"))).isEmpty();
    }

    static Stream<Arguments> ruleTable() {
        DocumentNode nested = new DirectiveNode(Directive.REF, ScalarNode.of("AWS::Region"));
        DocumentNode list = SequenceNode.ofStrings("a", "b");
        return Stream.of(
            Arguments.of(Directive.REF, ScalarNode.of("Bucket"), true),
            Arguments.of(Directive.REF, ScalarNode.of(1L), false),
            Arguments.of(Directive.GET_ATT, SequenceNode.ofStrings("Role", "Arn"), true),
            Arguments.of(Directive.GET_ATT, MappingNode.empty(), false),
            Arguments.of(Directive.SUB, SequenceNode.of(ScalarNode.of("${A}"), MappingNode.of("A", nested)), true),
            Arguments.of(Directive.SUB, SequenceNode.ofStrings("${A}"), false),
            Arguments.of(Directive.JOIN, SequenceNode.of(ScalarNode.of("-"), list), true),
            Arguments.of(Directive.JOIN, SequenceNode.of(ScalarNode.of("-"), list, list), false),
            Arguments.of(Directive.IF, SequenceNode.of(ScalarNode.of("IsProd"), ScalarNode.of("a"), nested), true),
            Arguments.of(Directive.IF, SequenceNode.of(ScalarNode.of(1L), ScalarNode.of("a"), ScalarNode.of("b")), false),
            Arguments.of(Directive.SELECT, SequenceNode.of(ScalarNode.of(0L), list), true),
            Arguments.of(Directive.SELECT, SequenceNode.of(ScalarNode.of(0L)), false),
            Arguments.of(Directive.FIND_IN_MAP, SequenceNode.ofStrings("RegionMap", "us-east-1", "Ami"), true),
            Arguments.of(Directive.FIND_IN_MAP, SequenceNode.ofStrings("RegionMap", "us-east-1"), false),
            Arguments.of(Directive.BASE64, nested, true),
            Arguments.of(Directive.BASE64, ScalarNode.of(5L), false),
            Arguments.of(Directive.CIDR, SequenceNode.of(ScalarNode.of("10.0.0.0/16"), ScalarNode.of(6L), ScalarNode.of(5L)), true),
            Arguments.of(Directive.CIDR, SequenceNode.ofStrings("10.0.0.0/16", "6"), false),
            Arguments.of(Directive.GET_AZS, nested, true),
            Arguments.of(Directive.GET_AZS, SequenceNode.ofStrings("us-east-1"), false),
            Arguments.of(Directive.AND, list, true),
            Arguments.of(Directive.AND, SequenceNode.ofStrings("a"), false),
            Arguments.of(Directive.AND, new SequenceNode(Collections.nCopies(11, nested)), false),
            Arguments.of(Directive.OR, new SequenceNode(Collections.nCopies(10, nested)), true),
            Arguments.of(Directive.OR, SequenceNode.ofStrings("a"), false),
            Arguments.of(Directive.OR, ScalarNode.of("a"), false),
            Arguments.of(Directive.EQUALS, SequenceNode.of(nested, ScalarNode.of("us-east-1")), true),
            Arguments.of(Directive.EQUALS, SequenceNode.ofStrings("a", "b", "c"), false),
            Arguments.of(Directive.NOT, SequenceNode.of(nested), true),
            Arguments.of(Directive.NOT, list, false)
        );
    }

    @ParameterizedTest(name = "{0} with {1} valid={2}")
    @MethodSource("ruleTable")
    void validate_ruleTable_acceptsRequiredShapeOnly(Directive directive, DocumentNode value, boolean valid) {
        if (valid) {
            assertThat(validator.validate(directive, value)).isEmpty();
        } else {
            assertThat(validator.validate(directive, value)).hasValueSatisfying(error -> {
                assertThat(error.directive()).isEqualTo(directive);
                assertThat(error.message()).startsWith(directive.canonicalName() + " requires ");
            });
        }
    }

    @Test
    void validate_directivesWithoutRule_acceptAnything() {
        assertThat(validator.validate(Directive.IMPORT_VALUE, SequenceNode.ofStrings("a", "b", "c"))).isEmpty();
        assertThat(validator.validate(Directive.TRANSFORM, ScalarNode.of(1L))).isEmpty();
    }

    // ==================== Whole trees ====================

    @Test
    void validate_document_collectsEveryViolationWithLocation() throws IOException {
        NormalizedDocument document = new TemplateNormalizer(true).normalize(fixture("bad-directives.yaml"));

        List<DirectiveShapeError> errors = validator.validate(document);

        assertThat(errors).extracting(DirectiveShapeError::path).containsExactly(
            "Resources.Bucket.Properties.BucketName.Fn::If",
            "Resources.Bucket.Properties.Tags[0].Key.Fn::Join");
        assertThat(errors.get(0).location()).isNotNull();
        assertThat(errors.get(0).location().line()).isEqualTo(5);
        assertThat(errors.get(1).location().line()).isEqualTo(7);
    }

    @Test
    void validate_violationInsideDirectiveValue_isReported() {
        DocumentNode root = MappingNode.of("Value", new DirectiveNode(Directive.IF, SequenceNode.of(
            ScalarNode.of("IsProd"),
            new DirectiveNode(Directive.REF, SequenceNode.ofStrings("bad")),
            ScalarNode.of("b"))));

        assertThat(validator.validate(root)).extracting(DirectiveShapeError::path)
            .containsExactly("Value.Fn::If[1].Ref");
    }

    @Test
    void validate_validTree_returnsEmptyList() {
        DocumentNode root = MappingNode.of("Value", new DirectiveNode(Directive.REF, ScalarNode.of("Bucket")));

        assertThat(validator.validate(root)).isEmpty();
    }

    @Test
    void requireValid_withViolations_throwsWithAllErrors() throws IOException {
        NormalizedDocument document = new TemplateNormalizer(true).normalize(fixture("bad-directives.yaml"));

        assertThatThrownBy(() -> validator.requireValid(document))
            .isInstanceOfSatisfying(DirectiveShapeException.class, e -> {
                assertThat(e.getErrors()).hasSize(2);
                assertThat(e.getPath()).isEqualTo("Resources.Bucket.Properties.BucketName.Fn::If");
                assertThat(e.getMessage()).startsWith("Resources.Bucket.Properties.BucketName.Fn::If: 2 directive shape errors");
            });
    }

    private static byte[] fixture(String name) throws IOException {
        try (InputStream in = DirectiveShapeValidatorTest.class.getResourceAsStream("/templates/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return in.readAllBytes();
        }
    }
}
