package com.templateweaver.core.config;

import com.templateweaver.core.parser.TemplateFormat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link WeaverConfig}.
 */
class WeaverConfigTest {

    @Test
    void defaults_detectFormatAndTrackLocations() {
        WeaverConfig config = WeaverConfig.defaults();

        assertThat(config.parser().format()).isEqualTo("auto");
        assertThat(config.parser().formatHint()).isEmpty();
        assertThat(config.parser().trackLocations()).isTrue();
        assertThat(config.validation().failOnDirectiveErrors()).isFalse();
    }

    @Test
    void parserConfig_knownFormat_isNormalized() {
        WeaverConfig.ParserConfig parser = new WeaverConfig.ParserConfig(null, " YML ");

        assertThat(parser.format()).isEqualTo("yaml");
        assertThat(parser.formatHint()).contains(TemplateFormat.YAML);
    }

    @Test
    void parserConfig_unknownFormat_failsOnConstruction() {
        assertThatThrownBy(() -> new WeaverConfig.ParserConfig(true, "xml"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown template format: xml");
    }
}
