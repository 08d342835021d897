package org.pragmatica.vb6.parser;

import org.pragmatica.vb6.lexer.TokenKind;

import static org.pragmatica.vb6.lexer.TokenKind.*;

/**
 * Multi-line constructs whose bodies are statement lists, with the tokens that close them.
 */
enum BlockKind {
    SUB("End Sub"),
    FUNCTION("End Function"),
    PROPERTY("End Property"),
    IF("End If"),
    FOR("Next"),
    DO("Loop"),
    WHILE("Wend"),
    SELECT("End Select"),
    WITH("End With");

    private final String terminator;

    BlockKind(String terminator) {
        this.terminator = terminator;
    }

    String terminator() {
        return terminator;
    }

    /**
     * Whether a line starting with {@code first}, {@code second} ends (a section of) this block.
     */
    boolean isClosedBy(TokenKind first, TokenKind second) {
        return switch (this) {
            case SUB -> first == END_KEYWORD && second == SUB_KEYWORD;
            case FUNCTION -> first == END_KEYWORD && second == FUNCTION_KEYWORD;
            case PROPERTY -> first == END_KEYWORD && second == PROPERTY_KEYWORD;
            case IF -> (first == END_KEYWORD && second == IF_KEYWORD) || first == ELSE_KEYWORD
                       || first == ELSE_IF_KEYWORD;
            case FOR -> first == NEXT_KEYWORD;
            case DO -> first == LOOP_KEYWORD;
            case WHILE -> first == WEND_KEYWORD;
            case SELECT -> (first == END_KEYWORD && second == SELECT_KEYWORD) || first == CASE_KEYWORD;
            case WITH -> first == END_KEYWORD && second == WITH_KEYWORD;
        };
    }
}
