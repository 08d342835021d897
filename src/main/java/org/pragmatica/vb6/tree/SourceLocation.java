package org.pragmatica.vb6.tree;

/**
 * A position in source text. Line and column are 1-based, offset is the 0-based char index.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location reached after consuming {@code text} starting from this location.
     * A {@code \r\n} pair counts as a single line break, as does a lone {@code \r}.
     */
    public SourceLocation advance(String text) {
        int newLine = line;
        int newColumn = column;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                newLine++;
                newColumn = 1;
            } else if (c != '\r') {
                newColumn++;
            }
        }
        return new SourceLocation(newLine, newColumn, offset + text.length());
    }

    public boolean isBefore(SourceLocation other) {
        return offset < other.offset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
