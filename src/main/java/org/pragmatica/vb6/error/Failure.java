package org.pragmatica.vb6.error;

import org.pragmatica.vb6.lexer.SourceBuffer;
import org.pragmatica.vb6.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * A parse failure tied to the source span of the {@code Unknown} node that replaced the
 * offending input.
 *
 * <p>Example output of {@link #format(SourceBuffer)}:
 * <pre>
 * error[V0001]: unexpected 'Then'
 *   --> Module1.bas:3:10
 *    |
 *  3 | If x = Then
 *    |        ^^^^ expected expression
 *    |
 *    = help: an If condition must precede Then
 * </pre>
 *
 * @param kind    failure classification
 * @param span    source span of the offending input (zero-width when something is missing)
 * @param message primary message
 * @param label   text printed next to the underline, may be empty
 * @param notes   additional notes, printed after the source excerpt
 */
public record Failure(
    FailureKind kind,
    SourceSpan span,
    String message,
    String label,
    List<String> notes
) {
    public Failure {
        notes = List.copyOf(notes);
    }

    public static Failure of(FailureKind kind, SourceSpan span, String message) {
        return new Failure(kind, span, message, "", List.of());
    }

    public Failure withLabel(String newLabel) {
        return new Failure(kind, span, message, newLabel, notes);
    }

    public Failure withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Failure(kind, span, message, label, newNotes);
    }

    public Failure withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this failure in compiler style with an excerpt of the offending line(s).
     */
    public String format(SourceBuffer source) {
        var sb = new StringBuilder();
        sb.append("error[").append(kind.code()).append("]: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ").append(source.fileName()).append(":")
          .append(loc.line()).append(":").append(loc.column()).append("\n");

        int firstLine = span.start().line();
        int lastLine = Math.min(span.end().line(), source.lineCount());
        // a span ending right after a newline does not reach into the next line
        if (lastLine > firstLine && span.end().column() == 1) {
            lastLine--;
        }
        int gutterWidth = String.valueOf(lastLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = firstLine; lineNum <= lastLine; lineNum++) {
            var lineContent = source.lineText(lineNum);
            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(lineContent).append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(underline(lineNum, lastLine, lineContent)).append("\n");
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    private String underline(int lineNum, int lastLine, String lineContent) {
        int startCol = span.start().line() == lineNum ? span.start().column() : 1;
        int endCol = span.end().line() == lineNum && lineNum == lastLine
                     ? span.end().column()
                     : lineContent.length() + 1;
        var sb = new StringBuilder();
        sb.append(" ".repeat(Math.max(0, startCol - 1)));
        sb.append("^".repeat(Math.max(1, endCol - startCol)));
        if (!label.isEmpty() && lineNum == lastLine) {
            sb.append(" ").append(label);
        }
        return sb.toString();
    }

    /**
     * Single-line format for logs and quick display: {@code file:line:column: message}.
     */
    public String formatSimple(String fileName) {
        var loc = span.start();
        return String.format("%s:%d:%d: error[%s]: %s", fileName, loc.line(), loc.column(), kind.code(), message);
    }
}
