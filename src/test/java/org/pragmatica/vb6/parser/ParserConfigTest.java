package org.pragmatica.vb6.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.vb6.Vb6Parser;
import org.pragmatica.vb6.error.RecoveryStrategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserConfigTest {

    @Test
    void defaultConfig_recoversWithDeepLimit() {
        assertThat(ParserConfig.DEFAULT.recoveryStrategy()).isEqualTo(RecoveryStrategy.ADVANCED);
        assertThat(ParserConfig.DEFAULT.maxNestingDepth()).isEqualTo(256);
    }

    @Test
    void withMethods_returnModifiedCopies() {
        var config = ParserConfig.DEFAULT.withRecoveryStrategy(RecoveryStrategy.NONE)
                                         .withMaxNestingDepth(16);

        assertThat(config.recoveryStrategy()).isEqualTo(RecoveryStrategy.NONE);
        assertThat(config.maxNestingDepth()).isEqualTo(16);
        assertThat(ParserConfig.DEFAULT.recoveryStrategy()).isEqualTo(RecoveryStrategy.ADVANCED);
    }

    @Test
    void nonPositiveDepth_isRejected() {
        assertThatThrownBy(() -> new ParserConfig(RecoveryStrategy.ADVANCED, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxNestingDepth");
    }

    @Test
    void missingStrategy_isRejected() {
        assertThatThrownBy(() -> new ParserConfig(null, 10))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void builder_appliesSettings() {
        var parser = Vb6Parser.builder()
                              .recoveryStrategy(RecoveryStrategy.NONE)
                              .maxNestingDepth(8)
                              .build();

        assertThat(parser).isInstanceOf(CstParser.class);
        assertThat(((CstParser) parser).config()).isEqualTo(new ParserConfig(RecoveryStrategy.NONE, 8));
    }

    @Test
    void builder_defaultsMatchDefaultConfig() {
        var parser = (CstParser) Vb6Parser.builder()
                                          .build();

        assertThat(parser.config()).isEqualTo(ParserConfig.DEFAULT);
    }
}
