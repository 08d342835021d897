package org.pragmatica.vb6.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.vb6.lexer.SourceBuffer;
import org.pragmatica.vb6.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;

class FailureTest {
    private static final SourceBuffer SOURCE = SourceBuffer.of("Module1.bas", "Dim x\nIf x = Then\n");

    private static SourceSpan span(int start, int end) {
        return SourceSpan.of(SOURCE.location(start), SOURCE.location(end));
    }

    @Test
    void format_includesHeaderLocationAndUnderline() {
        var failure = Failure.of(FailureKind.UNEXPECTED_TOKEN, span(13, 17), "unexpected 'Then'")
                             .withLabel("expected expression")
                             .withHelp("an If condition must precede Then");

        var formatted = failure.format(SOURCE);

        assertThat(formatted).startsWith("error[V0001]: unexpected 'Then'\n");
        assertThat(formatted).contains("  --> Module1.bas:2:8\n");
        assertThat(formatted).contains("2 | If x = Then\n");
        assertThat(formatted).contains("  |        ^^^^ expected expression\n");
        assertThat(formatted).endsWith("  = help: an If condition must precede Then\n");
    }

    @Test
    void format_zeroWidthSpan_stillUnderlinesOneColumn() {
        var failure = Failure.of(FailureKind.MISSING_TERMINATOR, span(17, 17), "missing 'End If'");

        var formatted = failure.format(SOURCE);

        assertThat(formatted).startsWith("error[V0003]: missing 'End If'");
        assertThat(formatted).contains("  |            ^\n");
    }

    @Test
    void formatSimple_isSingleLine() {
        var failure = Failure.of(FailureKind.MISSING_TOKEN, span(13, 17), "expected expression");

        assertThat(failure.formatSimple("Module1.bas")).isEqualTo("Module1.bas:2:8: error[V0002]: expected expression");
    }

    @Test
    void withNote_keepsEarlierNotes() {
        var failure = Failure.of(FailureKind.NESTING_TOO_DEEP, span(0, 3), "too deep")
                             .withNote("first")
                             .withNote("second");

        assertThat(failure.notes()).containsExactly("first", "second");
        assertThat(failure.kind().code()).isEqualTo("V0005");
    }
}
