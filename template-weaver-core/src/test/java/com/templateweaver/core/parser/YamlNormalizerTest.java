package com.templateweaver.core.parser;

import com.templateweaver.core.directive.Directive;
import com.templateweaver.core.node.DirectiveNode;
import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.MappingNode;
import com.templateweaver.core.node.ScalarNode;
import com.templateweaver.core.node.SequenceNode;
import com.templateweaver.core.node.SourceLocation;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link YamlNormalizer}.
 */
class YamlNormalizerTest {

    private final YamlNormalizer normalizer = new YamlNormalizer();

    // ==================== Shorthand and long form ====================

    @Test
    void normalize_shorthandAndLongForm_produceIdenticalTrees() {
        DocumentNode shorthand = root("Value: !GetAtt MyRole.Arn");
        DocumentNode longForm = root("""
            Value:
              Fn::GetAtt: [MyRole, Arn]
            """);

        assertThat(shorthand).isEqualTo(longForm);
        assertThat(value(shorthand)).isEqualTo(
            new DirectiveNode(Directive.GET_ATT, SequenceNode.ofStrings("MyRole", "Arn")));
    }

    @Test
    void normalize_refShorthand_becomesRefDirective() {
        DocumentNode root = root("Value: !Ref BucketName");

        assertThat(value(root)).isEqualTo(new DirectiveNode(Directive.REF, ScalarNode.of("BucketName")));
    }

    @Test
    void normalize_getAttWithoutDot_keepsSingleString() {
        DocumentNode root = root("Value: !GetAtt SingleToken");

        assertThat(value(root)).isEqualTo(new DirectiveNode(Directive.GET_ATT, ScalarNode.of("SingleToken")));
    }

    @Test
    void normalize_getAttWithSeveralDots_splitsOnFirstDotOnly() {
        DocumentNode root = root("Value: !GetAtt A.B.C");

        assertThat(value(root)).isEqualTo(new DirectiveNode(Directive.GET_ATT, SequenceNode.ofStrings("A", "B.C")));
    }

    @Test
    void normalize_longFormGetAttString_isNotSplit() {
        DocumentNode root = root("""
            Value:
              Fn::GetAtt: MyRole.Arn
            """);

        assertThat(value(root)).isEqualTo(new DirectiveNode(Directive.GET_ATT, ScalarNode.of("MyRole.Arn")));
    }

    @Test
    void normalize_subWithNestedGetAtt_normalizesBothLevels() {
        DocumentNode root = root("""
            Value: !Sub
              - "arn:${FuncArn}"
              - FuncArn: !GetAtt MyFunc.Arn
            """);

        Map<String, DocumentNode> variables = new LinkedHashMap<>();
        variables.put("FuncArn", new DirectiveNode(Directive.GET_ATT, SequenceNode.ofStrings("MyFunc", "Arn")));
        assertThat(value(root)).isEqualTo(new DirectiveNode(Directive.SUB,
            SequenceNode.of(ScalarNode.of("arn:${FuncArn}"), new MappingNode(variables))));
    }

    @Test
    void normalize_directiveInsideDirective_isNormalized() {
        DocumentNode root = root("""
            Value: !Base64
              Fn::Sub: "echo ${AWS::Region}"
            """);

        assertThat(value(root)).isEqualTo(new DirectiveNode(Directive.BASE64,
            new DirectiveNode(Directive.SUB, ScalarNode.of("echo ${AWS::Region}"))));
    }

    @Test
    void normalize_mappingWithDirectiveNameAndOtherKeys_staysMapping() {
        DocumentNode root = root("""
            Value:
              Ref: Bucket
              Other: x
            """);

        assertThat(value(root)).isInstanceOf(MappingNode.class);
    }

    @Test
    void normalize_unknownTag_throwsUnrecognizedDirective() {
        assertThatThrownBy(() -> normalizer.normalize("Value: !Foo bar", false))
            .isInstanceOfSatisfying(UnrecognizedDirectiveException.class, e -> {
                assertThat(e.getTag()).isEqualTo("!Foo");
                assertThat(e.getPath()).isEqualTo("Value");
            });
    }

    @Test
    void normalize_unknownTagOnKey_throwsUnrecognizedDirective() {
        assertThatThrownBy(() -> normalizer.normalize("Properties:\n  !Foo Tagged: 1\n", true))
            .isInstanceOfSatisfying(UnrecognizedDirectiveException.class, e -> {
                assertThat(e.getTag()).isEqualTo("!Foo");
                assertThat(e.getPath()).isEqualTo("Properties.Tagged");
                assertThat(e.getLocation()).hasValueSatisfying(location -> assertThat(location.line()).isEqualTo(2));
            });
    }

    @Test
    void normalize_directiveTagOnKey_throwsParseException() {
        assertThatThrownBy(() -> normalizer.normalize("Properties:\n  !Ref Tagged: 1\n", false))
            .isInstanceOf(DocumentParseException.class)
            .hasMessageContaining("!Ref cannot be used as a mapping key");
    }

    @Test
    void normalize_standardTagOnKey_isAccepted() {
        DocumentNode root = root("!!str Value: 1");

        assertThat(((MappingNode) root).containsKey("Value")).isTrue();
    }

    @Test
    void normalize_standardTag_isNotADirective() {
        DocumentNode root = root("Value: !!str 42");

        assertThat(value(root)).isEqualTo(ScalarNode.of("42"));
    }

    // ==================== Scalars ====================

    @Test
    void normalize_plainScalars_areTypedByYamlResolver() {
        MappingNode root = (MappingNode) root("""
            int: 42
            float: 1.5
            bool: true
            nothing: ~
            quoted: '42'
            date: 2001-12-14
            hex: 0x1F
            big: 99999999999999999999
            text: hello
            """);

        assertThat(root.get("int")).contains(ScalarNode.of(42L));
        assertThat(root.get("float")).contains(ScalarNode.of(1.5));
        assertThat(root.get("bool")).contains(ScalarNode.of(true));
        assertThat(root.get("nothing")).contains(ScalarNode.nullValue());
        assertThat(root.get("quoted")).contains(ScalarNode.of("42"));
        assertThat(root.get("date")).contains(ScalarNode.of("2001-12-14"));
        assertThat(root.get("hex")).contains(ScalarNode.of(31L));
        assertThat(root.get("big")).contains(new ScalarNode(new BigInteger("99999999999999999999")));
        assertThat(root.get("text")).contains(ScalarNode.of("hello"));
    }

    // ==================== Aliases ====================

    @Test
    void normalize_alias_isResolvedToAnchor() {
        MappingNode root = (MappingNode) root("""
            base: &shared
              x: 1
            copy: *shared
            """);

        assertThat(root.get("copy")).isEqualTo(root.get("base"));
    }

    @Test
    void normalize_recursiveAlias_throwsParseException() {
        assertThatThrownBy(() -> normalizer.normalize("a: &loop [*loop]", false))
            .isInstanceOf(DocumentParseException.class)
            .hasMessageContaining("recursive alias");
    }

    // ==================== Malformed input ====================

    @Test
    void normalize_unclosedFlowSequence_throwsWithLocation() {
        assertThatThrownBy(() -> normalizer.normalize("Key: [unclosed\nOther: 1\n", false))
            .isInstanceOfSatisfying(DocumentParseException.class, e ->
                assertThat(e.getLocation()).isPresent());
    }

    @Test
    void normalize_duplicateKeys_throwsParseException() {
        assertThatThrownBy(() -> normalizer.normalize("A: 1\nA: 2\n", false))
            .isInstanceOf(DocumentParseException.class)
            .hasMessageContaining("duplicate mapping key 'A'");
    }

    @Test
    void normalize_emptyDocument_throwsParseException() {
        assertThatThrownBy(() -> normalizer.normalize("", false))
            .isInstanceOf(DocumentParseException.class)
            .hasMessageContaining("document is empty");
    }

    @Test
    void normalize_multipleDocuments_throwsParseException() {
        assertThatThrownBy(() -> normalizer.normalize("a: 1\n---\nb: 2\n", false))
            .isInstanceOf(DocumentParseException.class);
    }

    // ==================== Locations ====================

    @Test
    void normalize_withTracking_recordsEveryPath() {
        NormalizedDocument document = normalizer.normalize("""
            Resources:
              MyFunc:
                Type: AWS::Lambda::Function
                Properties:
                  Role: !GetAtt MyRole.Arn
                  Layers:
                    - LayerA
            """, true);

        assertThat(document.tracksLocations()).isTrue();
        assertThat(document.locations().get("")).contains(new SourceLocation(1, 1));
        assertThat(document.locations().get("Resources.MyFunc.Type")).contains(new SourceLocation(3, 11));
        assertThat(document.locations().get("Resources.MyFunc.Properties.Role")).contains(new SourceLocation(5, 13));
        assertThat(document.locations().get("Resources.MyFunc.Properties.Role.Fn::GetAtt"))
            .contains(new SourceLocation(5, 13));
        assertThat(document.locations().get("Resources.MyFunc.Properties.Layers[0]")).contains(new SourceLocation(7, 11));
    }

    @Test
    void normalize_withoutTracking_hasEmptyLocationTable() {
        NormalizedDocument document = normalizer.normalize("Value: !Ref Bucket", false);

        assertThat(document.tracksLocations()).isFalse();
        assertThat(document.locations().get("Value")).isEmpty();
        assertThat(document.format()).isEqualTo(TemplateFormat.YAML);
    }

    private DocumentNode root(String yaml) {
        return normalizer.normalize(yaml, false).root();
    }

    private static DocumentNode value(DocumentNode root) {
        return ((MappingNode) root).get("Value").orElseThrow();
    }
}
