package org.pragmatica.vb6.lexer;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceBufferTest {

    @Test
    void location_mapsOffsetsToLineAndColumn() {
        var source = SourceBuffer.of("a.bas", "ab\r\ncd\nef");

        assertThat(source.location(0).toString()).isEqualTo("1:1");
        assertThat(source.location(4).toString()).isEqualTo("2:1");
        assertThat(source.location(5).toString()).isEqualTo("2:2");
        assertThat(source.location(7).toString()).isEqualTo("3:1");
        assertThat(source.location(9).toString()).isEqualTo("3:3");
    }

    @Test
    void location_outsideText_isRejected() {
        var source = SourceBuffer.of("a.bas", "abc");

        assertThatThrownBy(() -> source.location(4)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void lineText_dropsTerminator() {
        var source = SourceBuffer.of("a.bas", "first\r\nsecond\n");

        assertThat(source.lineCount()).isEqualTo(3);
        assertThat(source.lineText(1)).isEqualTo("first");
        assertThat(source.lineText(2)).isEqualTo("second");
        assertThat(source.lineText(3)).isEmpty();
    }

    @Test
    void decode_withoutBom_usesLegacyCodePage() {
        byte[] content = {'x', ' ', '=', ' ', '"', (byte) 0xE9, '"'};

        var source = SourceBuffer.decode("a.bas", content);

        assertThat(source.text()).isEqualTo("x = \"\u00E9\"");
    }

    @Test
    void decode_withBom_readsUtf8AndDropsMark() {
        var body = "x = \"\u00E9\"".getBytes(StandardCharsets.UTF_8);
        var content = new byte[body.length + 3];
        content[0] = (byte) 0xEF;
        content[1] = (byte) 0xBB;
        content[2] = (byte) 0xBF;
        System.arraycopy(body, 0, content, 3, body.length);

        var source = SourceBuffer.decode("a.bas", content);

        assertThat(source.text()).isEqualTo("x = \"\u00E9\"");
        assertThat(source.length()).isEqualTo(7);
    }

    @Test
    void emptyBuffer_hasOneLine() {
        var source = SourceBuffer.of("empty.bas", "");

        assertThat(source.isEmpty()).isTrue();
        assertThat(source.lineCount()).isEqualTo(1);
        assertThat(source.location(0).offset()).isZero();
    }
}
