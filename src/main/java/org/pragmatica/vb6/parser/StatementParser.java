package org.pragmatica.vb6.parser;

import org.pragmatica.vb6.error.FailureKind;
import org.pragmatica.vb6.lexer.KeywordClassifier;
import org.pragmatica.vb6.lexer.NamePosition;
import org.pragmatica.vb6.lexer.TokenKind;
import org.pragmatica.vb6.tree.NodeKind;

import static org.pragmatica.vb6.lexer.TokenKind.*;

/**
 * Statement lists and statement dispatch.
 *
 * <p>Dispatch looks at the first significant token of a statement: keyword-led statements go to
 * their production, everything else is an assignment or a call. Calls come in three surface
 * forms ({@code Foo a, b}, {@code Foo(a, b)}, {@code Call Foo(a, b)}) that all produce a
 * {@code CallStatement} with a callee followed by an {@code ArgumentList}.
 */
final class StatementParser {
    private final ParsingContext ctx;
    private final ExpressionParser expressions;
    private final DeclarationParser declarations;
    private final ControlFlowParser controlFlow;
    private final FileStatementParser fileStatements;

    StatementParser(ParsingContext ctx) {
        this.ctx = ctx;
        this.expressions = new ExpressionParser(ctx);
        this.declarations = new DeclarationParser(ctx, this, expressions);
        this.controlFlow = new ControlFlowParser(ctx, this, expressions);
        this.fileStatements = new FileStatementParser(ctx, expressions);
    }

    /**
     * Whole document: statements are direct children of the {@code Root} node.
     */
    void parseModule() {
        ctx.startNode(NodeKind.ROOT);
        parseStatements();
        ctx.finishNode();
    }

    /**
     * Body of a multi-line block, up to a line that closes one of the open blocks.
     */
    void parseBlockBody() {
        ctx.startNode(NodeKind.STATEMENT_LIST);
        parseStatements();
        ctx.finishNode();
    }

    private void parseStatements() {
        while (true) {
            var kind = ctx.peek();
            if (kind == NEWLINE || kind.isComment()) {
                ctx.bump();
                if (kind == NEWLINE) {
                    ctx.exitRecovery();
                }
                continue;
            }
            if (kind == COLON_OPERATOR) {
                ctx.bump();
                ctx.exitRecovery();
                continue;
            }
            if (kind == END_OF_INPUT) {
                ctx.skipTrivia();
                return;
            }
            if (ctx.atOpenBlockCloser()) {
                return;
            }
            ctx.skipTrivia();
            int before = ctx.pos();
            parseStatement();
            if (ctx.pos() == before) {
                ctx.forceProgress();
            }
        }
    }

    /**
     * Statements of a single-line {@code If}, separated by {@code :}, up to {@code Else} or the
     * end of the line.
     */
    void parseSingleLineBody() {
        ctx.startNode(NodeKind.STATEMENT_LIST);
        while (true) {
            var kind = ctx.peek();
            if (kind == COLON_OPERATOR) {
                ctx.bump();
                ctx.exitRecovery();
                continue;
            }
            if (kind == NEWLINE || kind == ELSE_KEYWORD || kind == END_OF_INPUT || kind.isComment()) {
                break;
            }
            ctx.skipTrivia();
            int before = ctx.pos();
            parseStatement();
            if (ctx.pos() == before) {
                ctx.forceProgress();
            }
        }
        ctx.finishNode();
    }

    // === Dispatch ===

    private void parseStatement() {
        var kind = ctx.peek();
        if (!ctx.inSingleLine() && ctx.atLineStart() && isLabelAhead(kind)) {
            parseLabel(kind);
            return;
        }
        int nextIndex = ctx.peekIndex(1);
        if (KeywordClassifier.startsStatement(kind, ctx.kindAt(nextIndex), ctx.touchesPrevious(nextIndex))
            && parseKeywordStatement(kind)) {
            return;
        }
        if (ctx.atName(NamePosition.STATEMENT_START) || kind == PERIOD_OPERATOR || kind == EXCLAMATION_MARK) {
            parseAssignmentOrCall(false);
            return;
        }
        ctx.recover(FailureKind.UNEXPECTED_TOKEN, "unexpected " + ctx.describeNext(), "expected statement");
    }

    private boolean parseKeywordStatement(TokenKind kind) {
        switch (kind) {
            case ATTRIBUTE_KEYWORD -> declarations.parseAttribute();
            case OPTION_KEYWORD -> declarations.parseOption();
            case PUBLIC_KEYWORD, PRIVATE_KEYWORD, FRIEND_KEYWORD, GLOBAL_KEYWORD, STATIC_KEYWORD, DIM_KEYWORD,
                 DECLARE_KEYWORD, SUB_KEYWORD, FUNCTION_KEYWORD, PROPERTY_KEYWORD, CONST_KEYWORD, TYPE_KEYWORD,
                 ENUM_KEYWORD, EVENT_KEYWORD -> declarations.parseDeclaration();
            case IMPLEMENTS_KEYWORD -> declarations.parseImplements();
            case DEF_BOOL_KEYWORD, DEF_BYTE_KEYWORD, DEF_CUR_KEYWORD, DEF_DATE_KEYWORD, DEF_DBL_KEYWORD,
                 DEF_DEC_KEYWORD, DEF_INT_KEYWORD, DEF_LNG_KEYWORD, DEF_OBJ_KEYWORD, DEF_SNG_KEYWORD,
                 DEF_STR_KEYWORD, DEF_VAR_KEYWORD -> declarations.parseDefType();
            case RE_DIM_KEYWORD -> declarations.parseReDim();
            case IF_KEYWORD -> controlFlow.parseIf();
            case FOR_KEYWORD -> controlFlow.parseFor();
            case DO_KEYWORD -> controlFlow.parseDo();
            case WHILE_KEYWORD -> controlFlow.parseWhile();
            case SELECT_KEYWORD -> controlFlow.parseSelectCase();
            case WITH_KEYWORD -> controlFlow.parseWith();
            case EXIT_KEYWORD -> controlFlow.parseExit();
            case END_KEYWORD -> controlFlow.parseEnd();
            case GOTO_KEYWORD -> controlFlow.parseJump(NodeKind.GOTO_STATEMENT);
            case GO_SUB_KEYWORD -> controlFlow.parseJump(NodeKind.GO_SUB_STATEMENT);
            case RETURN_KEYWORD -> controlFlow.parseReturn();
            case RESUME_KEYWORD -> controlFlow.parseResume();
            case ON_KEYWORD -> controlFlow.parseOn();
            case NEXT_KEYWORD, LOOP_KEYWORD, WEND_KEYWORD, CASE_KEYWORD, ELSE_KEYWORD, ELSE_IF_KEYWORD ->
                controlFlow.parseStrayTerminator();
            case CALL_KEYWORD -> parseAssignmentOrCall(true);
            case SET_KEYWORD -> parseSetOrLet(NodeKind.SET_STATEMENT);
            case LET_KEYWORD -> parseSetOrLet(NodeKind.LET_STATEMENT);
            case L_SET_KEYWORD, R_SET_KEYWORD -> parseSetOrLet(NodeKind.ASSIGNMENT_STATEMENT);
            case RAISE_EVENT_KEYWORD -> parseRaiseEvent();
            default -> {
                return fileStatements.parse(kind);
            }
        }
        return true;
    }

    // === Labels ===

    private boolean isLabelAhead(TokenKind kind) {
        if (kind == INTEGER_LITERAL || kind == LONG_LITERAL) {
            return true;
        }
        int colon = ctx.peekIndex(1);
        return kind == IDENTIFIER && ctx.kindAt(colon) == COLON_OPERATOR && ctx.touchesPrevious(colon);
    }

    private void parseLabel(TokenKind kind) {
        ctx.startNode(NodeKind.LABEL_STATEMENT);
        if (kind == IDENTIFIER) {
            ctx.bumpName(NamePosition.DECLARATION_NAME);
            ctx.bump();
        } else {
            ctx.bump();
            if (ctx.at(COLON_OPERATOR) && ctx.touchesPrevious(ctx.peekIndex(0))) {
                ctx.bump();
            }
        }
        if (ctx.atAny(NEWLINE, END_OF_INPUT) || ctx.peek()
                                                   .isComment()) {
            ctx.consumeLineEnd();
        }
        ctx.finishNode();
    }

    // === Assignments and calls ===

    private void parseAssignmentOrCall(boolean withCall) {
        int start = ctx.peekIndex(withCall ? 1 : 0);
        int chainEnd = scanNameChain(start);
        if (chainEnd < 0) {
            if (withCall) {
                ctx.startNode(NodeKind.CALL_STATEMENT);
                ctx.bump();
                ctx.expectName(NamePosition.EXPRESSION, "procedure name after 'Call'");
                ctx.consumeStatementEnd();
                ctx.finishNode();
            } else {
                ctx.recover(FailureKind.UNEXPECTED_TOKEN, "unexpected " + ctx.describeNext(), "expected statement");
            }
            return;
        }
        int next = ctx.skipInlineTrivia(chainEnd);
        var nextKind = ctx.kindAt(next);
        if (!withCall && nextKind == EQUALITY_OPERATOR) {
            parseAssignment();
            return;
        }
        if (nextKind == LEFT_PARENTHESIS && (next == chainEnd || withCall)) {
            int close = matchingParenthesis(next);
            if (close >= 0) {
                var afterKind = ctx.kindAt(ctx.skipInlineTrivia(close + 1));
                if (!withCall && afterKind == EQUALITY_OPERATOR) {
                    parseAssignment();
                    return;
                }
                if (ctx.isStatementEnd(afterKind)) {
                    parseCall(withCall, chainEnd, true);
                    return;
                }
            }
        }
        parseCall(withCall, chainEnd, false);
    }

    private void parseAssignment() {
        ctx.startNode(NodeKind.ASSIGNMENT_STATEMENT);
        expressions.parsePostfix();
        if (ctx.expect(EQUALITY_OPERATOR, "'='")) {
            expressions.parseExpression();
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    private void parseCall(boolean withCall, int calleeEnd, boolean parenthesized) {
        ctx.startNode(NodeKind.CALL_STATEMENT);
        if (withCall) {
            ctx.bump();
        }
        expressions.parseCallee(calleeEnd);
        if (parenthesized) {
            expressions.parseParenthesizedArguments();
        } else {
            ctx.skipTrivia();
            expressions.parseArgumentList(false, true);
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    private void parseSetOrLet(NodeKind kind) {
        ctx.startNode(kind);
        ctx.bump();
        if (expressions.parsePostfix() && ctx.expect(EQUALITY_OPERATOR, "'='")) {
            expressions.parseExpression();
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    private void parseRaiseEvent() {
        ctx.startNode(NodeKind.RAISE_EVENT_STATEMENT);
        ctx.bump();
        if (ctx.expectName(NamePosition.MEMBER_NAME, "event name after 'RaiseEvent'") && ctx.at(LEFT_PARENTHESIS)) {
            expressions.parseParenthesizedArguments();
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    /**
     * End index (exclusive) of the callee chain starting at {@code index}: a name, member
     * accesses and index groups that are followed by a further member access. A trailing
     * parenthesized group is not part of the chain. Returns -1 if no name starts there.
     */
    private int scanNameChain(int index) {
        int cursor = index;
        var first = ctx.kindAt(cursor);
        if (first == PERIOD_OPERATOR || first == EXCLAMATION_MARK) {
            if (!ctx.touchesPrevious(cursor + 1)
                || !KeywordClassifier.accepts(ctx.kindAt(cursor + 1), NamePosition.MEMBER_NAME)) {
                return -1;
            }
            cursor++;
        } else if (!KeywordClassifier.accepts(first, NamePosition.EXPRESSION)) {
            return -1;
        }
        cursor = skipTypeSuffix(cursor + 1);
        while (true) {
            var kind = ctx.kindAt(cursor);
            if ((kind == PERIOD_OPERATOR || kind == EXCLAMATION_MARK)
                && ctx.touchesPrevious(cursor)
                && ctx.touchesPrevious(cursor + 1)
                && KeywordClassifier.accepts(ctx.kindAt(cursor + 1), NamePosition.MEMBER_NAME)) {
                cursor = skipTypeSuffix(cursor + 2);
                continue;
            }
            if (kind == LEFT_PARENTHESIS && ctx.touchesPrevious(cursor)) {
                int close = matchingParenthesis(cursor);
                var afterKind = close < 0 ? END_OF_INPUT : ctx.kindAt(close + 1);
                if ((afterKind == PERIOD_OPERATOR || afterKind == EXCLAMATION_MARK) && ctx.touchesPrevious(close + 1)) {
                    cursor = close + 1;
                    continue;
                }
            }
            return cursor;
        }
    }

    private int skipTypeSuffix(int index) {
        return expressions.isTypeSuffixAt(index) ? index + 1 : index;
    }

    private int matchingParenthesis(int open) {
        int depth = 0;
        for (int index = open; index < ctx.tokenCount(); index++) {
            var kind = ctx.kindAt(index);
            if (kind == LEFT_PARENTHESIS) {
                depth++;
            } else if (kind == RIGHT_PARENTHESIS) {
                depth--;
                if (depth == 0) {
                    return index;
                }
            } else if (kind == NEWLINE || kind == COLON_OPERATOR || kind.isComment()) {
                return -1;
            }
        }
        return -1;
    }
}
