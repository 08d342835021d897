package org.pragmatica.vb6.lexer;

import org.pragmatica.vb6.tree.SourceSpan;

/**
 * A single lexical unit: its kind, its exact source text and where it came from.
 */
public record Token(TokenKind kind, String text, SourceSpan span) {

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public boolean isTrivia() {
        return kind.isTrivia();
    }

    /**
     * Same token re-tagged with another kind; text and span are unchanged.
     */
    public Token withKind(TokenKind newKind) {
        return newKind == kind ? this : new Token(newKind, text, span);
    }

    public int startOffset() {
        return span.startOffset();
    }

    public int endOffset() {
        return span.endOffset();
    }

    @Override
    public String toString() {
        return kind.displayName() + "(" + text + ")@" + span;
    }
}
