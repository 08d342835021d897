package org.pragmatica.vb6.lexer;

import com.google.common.base.Preconditions;
import org.pragmatica.vb6.tree.SourceLocation;
import org.pragmatica.vb6.tree.SourceSpan;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable source text together with the name it is reported under.
 *
 * <p>Offsets are char indices into {@link #text()}. Line starts are computed once so that
 * offsets can be mapped back to line/column pairs for failure reporting.
 */
public final class SourceBuffer {
    /**
     * Code page VB6 saves source files in.
     */
    public static final Charset LEGACY_CHARSET = Charset.forName("windows-1252");

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final String fileName;
    private final String text;
    private final int[] lineStarts;

    private SourceBuffer(String fileName, String text) {
        this.fileName = fileName;
        this.text = text;
        this.lineStarts = computeLineStarts(text);
    }

    public static SourceBuffer of(String fileName, String text) {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(text, "text");
        return new SourceBuffer(fileName, text);
    }

    /**
     * Decode raw file content. Files starting with a UTF-8 byte order mark are read as UTF-8
     * (the mark itself is dropped); everything else is read as Windows-1252.
     */
    public static SourceBuffer decode(String fileName, byte[] content) {
        Objects.requireNonNull(content, "content");
        if (content.length >= UTF8_BOM.length
            && Arrays.equals(Arrays.copyOf(content, UTF8_BOM.length), UTF8_BOM)) {
            return of(fileName, new String(content, UTF8_BOM.length, content.length - UTF8_BOM.length,
                                           StandardCharsets.UTF_8));
        }
        return of(fileName, new String(content, LEGACY_CHARSET));
    }

    public String fileName() {
        return fileName;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public String slice(SourceSpan span) {
        return span.extract(text);
    }

    /**
     * Map an offset (0..length inclusive) to its line and column.
     */
    public SourceLocation location(int offset) {
        Preconditions.checkPositionIndex(offset, text.length(), "offset");
        int index = Arrays.binarySearch(lineStarts, offset);
        int lineIndex = index >= 0 ? index : -index - 2;
        return SourceLocation.at(lineIndex + 1, offset - lineStarts[lineIndex] + 1, offset);
    }

    /**
     * Text of the given 1-based line without its line terminator.
     */
    public String lineText(int line) {
        Preconditions.checkElementIndex(line - 1, lineStarts.length, "line");
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] : text.length();
        while (end > start && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(start, end);
    }

    private static int[] computeLineStarts(String text) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                i++;
                starts.add(i + 1);
            } else if (c == '\n' || c == '\r') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return fileName + " (" + text.length() + " chars)";
    }
}
