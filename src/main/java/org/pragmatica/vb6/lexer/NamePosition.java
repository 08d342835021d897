package org.pragmatica.vb6.lexer;

/**
 * Grammatical position a word occupies, as reported by the parser when it asks
 * {@link KeywordClassifier} how to tag the word.
 */
public enum NamePosition {
    /**
     * First significant word of a logical line.
     */
    STATEMENT_START,

    /**
     * Operand of an expression.
     */
    EXPRESSION,

    /**
     * Right-hand side of a member-access {@code .} or {@code !}.
     */
    MEMBER_NAME,

    /**
     * Name being declared: procedure, parameter, variable, constant, label, type or enum member.
     */
    DECLARATION_NAME
}
