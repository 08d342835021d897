package org.pragmatica.vb6.parser;

import org.pragmatica.vb6.error.Failure;
import org.pragmatica.vb6.error.FailureKind;
import org.pragmatica.vb6.lexer.KeywordClassifier;
import org.pragmatica.vb6.lexer.Lexer;
import org.pragmatica.vb6.lexer.NamePosition;
import org.pragmatica.vb6.lexer.TokenKind;
import org.pragmatica.vb6.tree.NodeKind;

import static org.pragmatica.vb6.lexer.TokenKind.*;

/**
 * Precedence-climbing expression parser.
 *
 * <p>Binding strength, loosest first: {@code Imp}, {@code Eqv}, {@code Xor}, {@code Or},
 * {@code And}, prefix {@code Not}, comparisons ({@code = <> < > <= >= Like Is}), {@code &},
 * {@code + -}, {@code Mod}, {@code \}, {@code * /}, prefix {@code - +}, {@code ^}. All binary
 * operators are left-associative.
 */
final class ExpressionParser {
    private static final int IMP = 1;
    private static final int EQV = 2;
    private static final int XOR = 3;
    private static final int OR = 4;
    private static final int AND = 5;
    private static final int NOT = 6;
    private static final int COMPARISON = 7;
    private static final int CONCATENATION = 8;
    private static final int ADDITIVE = 9;
    private static final int MODULUS = 10;
    private static final int INTEGER_DIVISION = 11;
    private static final int MULTIPLICATIVE = 12;
    private static final int UNARY = 13;
    private static final int EXPONENT = 14;

    private final ParsingContext ctx;

    ExpressionParser(ParsingContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Parse a full expression. Returns {@code false} if no expression could be started; a
     * failure has then been recorded.
     */
    boolean parseExpression() {
        return parseExpression(IMP);
    }

    /**
     * Parse an expression that binds tighter than comparisons, used where a following {@code =}
     * or {@code Is} belongs to the enclosing construct.
     */
    boolean parseOperand() {
        return parseExpression(CONCATENATION);
    }

    static int binaryPrecedence(TokenKind kind) {
        return switch (kind) {
            case IMP_KEYWORD -> IMP;
            case EQV_KEYWORD -> EQV;
            case XOR_KEYWORD -> XOR;
            case OR_KEYWORD -> OR;
            case AND_KEYWORD -> AND;
            case EQUALITY_OPERATOR, INEQUALITY_OPERATOR, LESS_THAN_OPERATOR, GREATER_THAN_OPERATOR,
                 LESS_THAN_OR_EQUAL_OPERATOR, GREATER_THAN_OR_EQUAL_OPERATOR, LIKE_KEYWORD, IS_KEYWORD -> COMPARISON;
            case AMPERSAND -> CONCATENATION;
            case ADDITION_OPERATOR, SUBTRACTION_OPERATOR -> ADDITIVE;
            case MOD_KEYWORD -> MODULUS;
            case BACKWARD_SLASH_OPERATOR -> INTEGER_DIVISION;
            case MULTIPLICATION_OPERATOR, DIVISION_OPERATOR -> MULTIPLICATIVE;
            case EXPONENTIATION_OPERATOR -> EXPONENT;
            default -> 0;
        };
    }

    private boolean parseExpression(int minPrecedence) {
        if (!ctx.enterNesting()) {
            return false;
        }
        try {
            ctx.skipTrivia();
            int checkpoint = ctx.checkpoint();
            if (!parseUnary()) {
                return false;
            }
            while (true) {
                int precedence = binaryPrecedence(ctx.peek());
                if (precedence == 0 || precedence < minPrecedence) {
                    return true;
                }
                ctx.startNodeAt(checkpoint, NodeKind.BINARY_EXPRESSION);
                ctx.bump();
                parseExpression(precedence + 1);
                ctx.finishNode();
            }
        } finally {
            ctx.exitNesting();
        }
    }

    private boolean parseUnary() {
        return switch (ctx.peek()) {
            case SUBTRACTION_OPERATOR, ADDITION_OPERATOR -> parsePrefix(NodeKind.UNARY_EXPRESSION, UNARY);
            case NOT_KEYWORD -> parsePrefix(NodeKind.UNARY_EXPRESSION, NOT);
            case ADDRESS_OF_KEYWORD -> parseAddressOf();
            case NEW_KEYWORD -> parseNew();
            case TYPE_OF_KEYWORD -> parseTypeOf();
            default -> parsePostfix();
        };
    }

    private boolean parsePrefix(NodeKind kind, int operandPrecedence) {
        ctx.startNode(kind);
        ctx.bump();
        parseExpression(operandPrecedence);
        ctx.finishNode();
        return true;
    }

    private boolean parseAddressOf() {
        ctx.startNode(NodeKind.ADDRESS_OF_EXPRESSION);
        ctx.bump();
        parseQualifiedName(NamePosition.EXPRESSION, "procedure name after 'AddressOf'");
        ctx.finishNode();
        return true;
    }

    private boolean parseNew() {
        ctx.startNode(NodeKind.NEW_EXPRESSION);
        ctx.bump();
        parseQualifiedName(NamePosition.DECLARATION_NAME, "class name after 'New'");
        ctx.finishNode();
        return true;
    }

    private boolean parseTypeOf() {
        ctx.startNode(NodeKind.TYPE_OF_EXPRESSION);
        ctx.bump();
        parsePostfix();
        if (ctx.expect(IS_KEYWORD, "'Is' in TypeOf expression")) {
            parseQualifiedName(NamePosition.DECLARATION_NAME, "type name after 'Is'");
        }
        ctx.finishNode();
        return true;
    }

    /**
     * {@code name(.name)*} kept flat, as used by type references and {@code AddressOf}.
     */
    boolean parseQualifiedName(NamePosition position, String description) {
        if (!ctx.expectName(position, description)) {
            return false;
        }
        while (ctx.at(PERIOD_OPERATOR) && KeywordClassifier.accepts(ctx.peek(1), NamePosition.MEMBER_NAME)) {
            ctx.bump();
            ctx.bumpName(NamePosition.MEMBER_NAME);
        }
        return true;
    }

    // === Postfix chains ===

    /**
     * Primary expression followed by any number of calls/indexing and member accesses. Also used
     * for assignment targets and loop variables, where a following {@code =} must not be read
     * as a comparison.
     */
    boolean parsePostfix() {
        ctx.skipTrivia();
        int checkpoint = ctx.checkpoint();
        if (!parsePrimary()) {
            return false;
        }
        parsePostfixOperators(checkpoint, Integer.MAX_VALUE);
        return true;
    }

    /**
     * Callee of a statement-level call: a name chain ending before token index {@code end}.
     */
    void parseCallee(int end) {
        ctx.skipTrivia();
        int checkpoint = ctx.checkpoint();
        if (ctx.atAny(PERIOD_OPERATOR, EXCLAMATION_MARK)) {
            ctx.startNode(NodeKind.MEMBER_ACCESS_EXPRESSION);
            ctx.bump();
            ctx.bumpName(NamePosition.MEMBER_NAME);
            parseTypeSuffix();
            ctx.finishNode();
        } else {
            ctx.bumpName(NamePosition.EXPRESSION);
            parseTypeSuffix();
        }
        parsePostfixOperators(checkpoint, end);
    }

    private void parsePostfixOperators(int checkpoint, int end) {
        while (ctx.peekIndex(0) < end) {
            if (atMemberAccess()) {
                ctx.startNodeAt(checkpoint, NodeKind.MEMBER_ACCESS_EXPRESSION);
                ctx.bump();
                ctx.bumpName(NamePosition.MEMBER_NAME);
                parseTypeSuffix();
                ctx.finishNode();
            } else if (ctx.at(LEFT_PARENTHESIS)) {
                ctx.startNodeAt(checkpoint, NodeKind.CALL_EXPRESSION);
                parseParenthesizedArguments();
                ctx.finishNode();
            } else {
                return;
            }
        }
    }

    private boolean atMemberAccess() {
        int index = ctx.peekIndex(0);
        var kind = ctx.kindAt(index);
        return (kind == PERIOD_OPERATOR || kind == EXCLAMATION_MARK)
               && ctx.touchesPrevious(index)
               && ctx.touchesPrevious(index + 1)
               && KeywordClassifier.accepts(ctx.kindAt(index + 1), NamePosition.MEMBER_NAME);
    }

    /**
     * {@code ( ArgumentList )}; the opening parenthesis is the next significant token.
     */
    void parseParenthesizedArguments() {
        ctx.bump();
        parseArgumentList(true, false);
        ctx.expect(RIGHT_PARENTHESIS, "')' to close the argument list");
    }

    /**
     * Adjacent type-declaration characters such as {@code $} in {@code Time$} or {@code %} in
     * {@code count%}.
     */
    void parseTypeSuffix() {
        if (isTypeSuffixAt(ctx.peekIndex(0))) {
            ctx.bump();
        }
    }

    /**
     * Whether the token at {@code index} is a type-declaration character attached to the word
     * before it. {@code !} followed by a word is a bang member access, and {@code &} is the Long
     * suffix only when no operand follows it ({@code I& = 5}, not {@code a&b}).
     */
    boolean isTypeSuffixAt(int index) {
        if (!ctx.touchesPrevious(index)) {
            return false;
        }
        return switch (ctx.kindAt(index)) {
            case DOLLAR_SIGN, PERCENT, AT_SIGN, OCTOTHORPE -> true;
            case EXCLAMATION_MARK -> !(ctx.touchesPrevious(index + 1) && ctx.kindAt(index + 1)
                                                                             .isWord());
            case AMPERSAND -> !startsOperand(ctx.skipInlineTrivia(index + 1));
            default -> false;
        };
    }

    private boolean startsOperand(int index) {
        var kind = ctx.kindAt(index);
        if (kind.isNumericLiteral() || KeywordClassifier.accepts(kind, NamePosition.EXPRESSION)) {
            return true;
        }
        return switch (kind) {
            case STRING_LITERAL, DATE_LITERAL, TRUE_KEYWORD, FALSE_KEYWORD, NOTHING_KEYWORD, NULL_KEYWORD,
                 EMPTY_KEYWORD, NOT_KEYWORD, NEW_KEYWORD, ADDRESS_OF_KEYWORD, TYPE_OF_KEYWORD, ADDITION_OPERATOR,
                 SUBTRACTION_OPERATOR, PERIOD_OPERATOR, EXCLAMATION_MARK -> true;
            // I&(5) indexes, a& (b) concatenates
            case LEFT_PARENTHESIS -> !ctx.touchesPrevious(index);
            default -> false;
        };
    }

    // === Primaries ===

    private boolean parsePrimary() {
        var kind = ctx.peek();
        if (kind.isNumericLiteral()) {
            return wrapSingle(NodeKind.NUMERIC_LITERAL_EXPRESSION);
        }
        switch (kind) {
            case STRING_LITERAL -> {
                return parseStringLiteral();
            }
            case TRUE_KEYWORD, FALSE_KEYWORD -> {
                return wrapSingle(NodeKind.BOOLEAN_LITERAL_EXPRESSION);
            }
            case NOTHING_KEYWORD, NULL_KEYWORD, EMPTY_KEYWORD, DATE_LITERAL -> {
                return wrapSingle(NodeKind.LITERAL_EXPRESSION);
            }
            case LEFT_PARENTHESIS -> {
                return parseParenthesized();
            }
            case PERIOD_OPERATOR, EXCLAMATION_MARK -> {
                if (KeywordClassifier.accepts(ctx.peek(1), NamePosition.MEMBER_NAME)) {
                    ctx.startNode(NodeKind.MEMBER_ACCESS_EXPRESSION);
                    ctx.bump();
                    ctx.bumpName(NamePosition.MEMBER_NAME);
                    parseTypeSuffix();
                    ctx.finishNode();
                    return true;
                }
            }
            default -> {
                if (ctx.atName(NamePosition.EXPRESSION)) {
                    return parseName();
                }
            }
        }
        reportMissingExpression();
        return false;
    }

    private boolean wrapSingle(NodeKind kind) {
        ctx.startNode(kind);
        ctx.bump();
        ctx.finishNode();
        return true;
    }

    private boolean parseStringLiteral() {
        int index = ctx.peekIndex(0);
        if (Lexer.isTerminatedString(ctx.tokenAt(index)
                                        .text())) {
            return wrapSingle(NodeKind.STRING_LITERAL_EXPRESSION);
        }
        ctx.startNode(NodeKind.UNKNOWN);
        ctx.bump();
        var unknown = ctx.finishNode();
        ctx.addFailure(Failure.of(FailureKind.UNTERMINATED_LITERAL, unknown.span(), "unterminated string literal")
                              .withLabel("missing closing '\"'"));
        return true;
    }

    private boolean parseParenthesized() {
        ctx.startNode(NodeKind.PARENTHESIZED_EXPRESSION);
        ctx.bump();
        parseExpression();
        ctx.expect(RIGHT_PARENTHESIS, "')'");
        ctx.finishNode();
        return true;
    }

    /**
     * A name that is immediately called or member-accessed stays a bare leaf, the postfix node
     * wraps it; otherwise it becomes an {@code IdentifierExpression}.
     */
    private boolean parseName() {
        if (isPostfixFollowing()) {
            ctx.bumpName(NamePosition.EXPRESSION);
            parseTypeSuffix();
            return true;
        }
        ctx.startNode(NodeKind.IDENTIFIER_EXPRESSION);
        ctx.bumpName(NamePosition.EXPRESSION);
        parseTypeSuffix();
        ctx.finishNode();
        return true;
    }

    private boolean isPostfixFollowing() {
        int nameIndex = ctx.peekIndex(0);
        int index = nameIndex + 1;
        if (isTypeSuffixAt(index)) {
            index++;
        }
        int next = index;
        while (next < ctx.tokenCount() && ctx.kindAt(next)
                                             .isInlineTrivia()) {
            next++;
        }
        var kind = ctx.kindAt(next);
        if (kind == LEFT_PARENTHESIS) {
            return true;
        }
        return (kind == PERIOD_OPERATOR || kind == EXCLAMATION_MARK)
               && next == index
               && ctx.touchesPrevious(next + 1)
               && KeywordClassifier.accepts(ctx.kindAt(next + 1), NamePosition.MEMBER_NAME);
    }

    private void reportMissingExpression() {
        if (ctx.atStatementEnd() || ctx.at(RIGHT_PARENTHESIS) || ctx.at(COMMA)) {
            ctx.recover(FailureKind.MISSING_TOKEN, "expected expression", "found " + ctx.describeNext());
        } else {
            ctx.recover(FailureKind.UNEXPECTED_TOKEN, "unexpected " + ctx.describeNext(), "expected expression");
        }
    }

    // === Arguments ===

    /**
     * Argument list inside parentheses ({@code parenthesized}) or after a bare statement-level
     * callee. Empty slots leave only their separators; bare lists also accept {@code ;}.
     */
    void parseArgumentList(boolean parenthesized, boolean allowSemicolon) {
        ctx.startNode(NodeKind.ARGUMENT_LIST);
        while (!ctx.isRecovering()) {
            var kind = ctx.peek();
            if ((parenthesized && kind == RIGHT_PARENTHESIS) || ctx.isStatementEnd(kind)) {
                break;
            }
            if (kind == COMMA || (allowSemicolon && kind == SEMICOLON)) {
                ctx.bump();
                continue;
            }
            if (!parseArgument()) {
                break;
            }
            var after = ctx.peek();
            if (after != COMMA && !(allowSemicolon && after == SEMICOLON)) {
                break;
            }
        }
        ctx.finishNode();
    }

    private boolean parseArgument() {
        ctx.skipTrivia();
        ctx.startNode(NodeKind.ARGUMENT);
        boolean parsed;
        if (ctx.peek(1) == COLON_EQUALS_OPERATOR && ctx.atName(NamePosition.DECLARATION_NAME)) {
            ctx.bumpName(NamePosition.DECLARATION_NAME);
            ctx.bump();
            parsed = parseExpression();
        } else {
            // ByVal at call sites, # before a file number in Input(n, #f)
            if (!ctx.eat(BY_VAL_KEYWORD)) {
                ctx.eat(OCTOTHORPE);
            }
            parsed = parseExpression();
        }
        ctx.finishNode();
        return parsed;
    }
}
