package com.templateweaver.core.directive;

import com.templateweaver.core.node.DocumentNode;
import com.templateweaver.core.node.MappingNode;
import com.templateweaver.core.node.ScalarNode;
import com.templateweaver.core.parser.YamlNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DirectiveLocator}.
 */
class DirectiveLocatorTest {

    private final DocumentNode root = new YamlNormalizer().normalize("""
        Name: !Sub
          - "${Prefix}-queue"
          - Prefix: !Ref Stage
        Arn: !GetAtt Queue.Arn
        Plain:
          Nested: value
        """, false).root();

    @Test
    void find_returnsOutermostDirectivesWithNested() {
        List<DirectiveOccurrence> found = DirectiveLocator.find(root);

        assertThat(found).extracting(DirectiveOccurrence::directive)
            .containsExactly(Directive.SUB, Directive.GET_ATT);
        assertThat(found.get(0).path()).isEqualTo("Name");
        assertThat(found.get(0).nested()).singleElement().satisfies(nested -> {
            assertThat(nested.directive()).isEqualTo(Directive.REF);
            assertThat(nested.path()).isEqualTo("Name.Fn::Sub[1].Prefix");
        });
        assertThat(found.get(0).totalCount()).isEqualTo(2);
    }

    @Test
    void count_countsOutermostOnly() {
        assertThat(DirectiveLocator.count(root)).isEqualTo(2);
    }

    @Test
    void contains_detectsDirectivesAtAnyDepth() {
        assertThat(DirectiveLocator.contains(root)).isTrue();
        assertThat(DirectiveLocator.contains(MappingNode.of("a", ScalarNode.of("b")))).isFalse();
    }
}
