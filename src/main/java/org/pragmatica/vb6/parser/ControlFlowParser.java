package org.pragmatica.vb6.parser;

import org.pragmatica.vb6.error.FailureKind;
import org.pragmatica.vb6.lexer.NamePosition;
import org.pragmatica.vb6.tree.NodeKind;

import static org.pragmatica.vb6.lexer.TokenKind.*;

/**
 * Conditionals, loops, {@code Select Case}, {@code With} and jumps.
 */
final class ControlFlowParser {
    private final ParsingContext ctx;
    private final StatementParser statements;
    private final ExpressionParser expressions;

    ControlFlowParser(ParsingContext ctx, StatementParser statements, ExpressionParser expressions) {
        this.ctx = ctx;
        this.statements = statements;
        this.expressions = expressions;
    }

    // === If ===

    void parseIf() {
        nested(this::parseIfStatement);
    }

    private void parseIfStatement() {
        ctx.startNode(NodeKind.IF_STATEMENT);
        ctx.bump();
        expressions.parseExpression();
        if (!ctx.expect(THEN_KEYWORD, "'Then'")) {
            ctx.consumeStatementEnd();
            ctx.finishNode();
            return;
        }
        if (ctx.at(NEWLINE) || ctx.at(END_OF_INPUT) || ctx.peek()
                                                           .isComment()) {
            parseBlockIf();
        } else {
            parseSingleLineIf();
        }
        ctx.finishNode();
    }

    private void parseBlockIf() {
        ctx.consumeLineEnd();
        body(BlockKind.IF);
        while (ctx.at(ELSE_IF_KEYWORD)) {
            ctx.skipTrivia();
            ctx.startNode(NodeKind.ELSE_IF_CLAUSE);
            ctx.bump();
            expressions.parseExpression();
            ctx.expect(THEN_KEYWORD, "'Then' after 'ElseIf' condition");
            ctx.consumeStatementEnd();
            body(BlockKind.IF);
            ctx.finishNode();
        }
        if (ctx.at(ELSE_KEYWORD)) {
            ctx.skipTrivia();
            ctx.startNode(NodeKind.ELSE_CLAUSE);
            ctx.bump();
            // Else x = 2 keeps its first statement on the Else line
            if (ctx.atStatementEnd()) {
                ctx.consumeStatementEnd();
            }
            body(BlockKind.IF);
            ctx.finishNode();
        }
        ctx.closeWithEnd(BlockKind.IF, "'If' block");
    }

    private void parseSingleLineIf() {
        ctx.enterSingleLine();
        try {
            statements.parseSingleLineBody();
            if (ctx.at(ELSE_KEYWORD)) {
                ctx.skipTrivia();
                ctx.startNode(NodeKind.ELSE_CLAUSE);
                ctx.bump();
                statements.parseSingleLineBody();
                ctx.finishNode();
            }
        } finally {
            ctx.exitSingleLine();
        }
        ctx.consumeStatementEnd();
    }

    // === Loops ===

    void parseFor() {
        nested(this::parseForStatement);
    }

    private void parseForStatement() {
        boolean forEach = ctx.peek(1) == EACH_KEYWORD;
        ctx.startNode(forEach ? NodeKind.FOR_EACH_STATEMENT : NodeKind.FOR_STATEMENT);
        ctx.bump();
        if (forEach) {
            ctx.bump();
            if (expressions.parsePostfix() && ctx.expect(IN_KEYWORD, "'In'")) {
                expressions.parseExpression();
            }
        } else if (expressions.parsePostfix() && ctx.expect(EQUALITY_OPERATOR, "'=' after loop variable")) {
            expressions.parseExpression();
            if (ctx.expect(TO_KEYWORD, "'To'")) {
                expressions.parseExpression();
                if (ctx.eat(STEP_KEYWORD)) {
                    expressions.parseExpression();
                }
            }
        }
        ctx.consumeStatementEnd();
        body(BlockKind.FOR);
        parseNext();
        ctx.finishNode();
    }

    private void parseNext() {
        if (ctx.atDeferredNext()) {
            ctx.takeDeferredNext();
            ctx.bump();
        } else if (ctx.at(NEXT_KEYWORD)) {
            ctx.bump();
        } else {
            ctx.missingTerminator("Next", "'For' loop");
            return;
        }
        if (!ctx.atStatementEnd() && !ctx.at(COMMA)) {
            expressions.parsePostfix();
        }
        if (ctx.at(COMMA) && ctx.deferNextClosure()) {
            return;
        }
        ctx.consumeStatementEnd();
    }

    void parseDo() {
        nested(this::parseDoStatement);
    }

    private void parseDoStatement() {
        ctx.startNode(NodeKind.DO_STATEMENT);
        ctx.bump();
        parseLoopCondition();
        ctx.consumeStatementEnd();
        body(BlockKind.DO);
        if (ctx.at(LOOP_KEYWORD)) {
            ctx.bump();
            parseLoopCondition();
            ctx.consumeStatementEnd();
        } else {
            ctx.missingTerminator("Loop", "'Do' loop");
        }
        ctx.finishNode();
    }

    private void parseLoopCondition() {
        if (ctx.atAny(WHILE_KEYWORD, UNTIL_KEYWORD)) {
            ctx.bump();
            expressions.parseExpression();
        }
    }

    void parseWhile() {
        nested(this::parseWhileStatement);
    }

    private void parseWhileStatement() {
        ctx.startNode(NodeKind.WHILE_STATEMENT);
        ctx.bump();
        expressions.parseExpression();
        ctx.consumeStatementEnd();
        body(BlockKind.WHILE);
        if (ctx.at(WEND_KEYWORD)) {
            ctx.bump();
            ctx.consumeStatementEnd();
        } else {
            ctx.missingTerminator("Wend", "'While' loop");
        }
        ctx.finishNode();
    }

    void parseWith() {
        nested(this::parseWithStatement);
    }

    private void parseWithStatement() {
        ctx.startNode(NodeKind.WITH_STATEMENT);
        ctx.bump();
        expressions.parseExpression();
        ctx.consumeStatementEnd();
        body(BlockKind.WITH);
        ctx.closeWithEnd(BlockKind.WITH, "'With' block");
        ctx.finishNode();
    }

    // === Select Case ===

    void parseSelectCase() {
        nested(this::parseSelectCaseStatement);
    }

    private void parseSelectCaseStatement() {
        ctx.startNode(NodeKind.SELECT_CASE_STATEMENT);
        ctx.bump();
        if (ctx.expect(CASE_KEYWORD, "'Case' after 'Select'")) {
            expressions.parseExpression();
        }
        ctx.consumeStatementEnd();
        ctx.enterBlock(BlockKind.SELECT);
        try {
            parseCaseClauses();
        } finally {
            ctx.exitBlock();
        }
        ctx.closeWithEnd(BlockKind.SELECT, "'Select Case' block");
        ctx.finishNode();
    }

    private void parseCaseClauses() {
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
            if (kind == CASE_KEYWORD) {
                parseCaseClause();
                continue;
            }
            if (kind == END_OF_INPUT || ctx.atOpenBlockCloser()) {
                return;
            }
            int before = ctx.pos();
            ctx.recover(FailureKind.UNEXPECTED_TOKEN, "unexpected " + ctx.describeNext(), "expected 'Case'");
            if (ctx.pos() == before) {
                ctx.forceProgress();
            }
        }
    }

    private void parseCaseClause() {
        ctx.skipTrivia();
        if (ctx.peek(1) == ELSE_KEYWORD) {
            ctx.startNode(NodeKind.CASE_ELSE_CLAUSE);
            ctx.bump();
            ctx.bump();
        } else {
            ctx.startNode(NodeKind.CASE_CLAUSE);
            ctx.bump();
            parseCaseItems();
        }
        ctx.consumeStatementEnd();
        statements.parseBlockBody();
        ctx.finishNode();
    }

    private void parseCaseItems() {
        do {
            if (ctx.at(IS_KEYWORD)) {
                ctx.bump();
                if (ctx.atAny(EQUALITY_OPERATOR, INEQUALITY_OPERATOR, LESS_THAN_OPERATOR, GREATER_THAN_OPERATOR,
                              LESS_THAN_OR_EQUAL_OPERATOR, GREATER_THAN_OR_EQUAL_OPERATOR)) {
                    ctx.bump();
                    expressions.parseExpression();
                } else {
                    ctx.recover(FailureKind.MISSING_TOKEN,
                                "expected comparison operator after 'Is'",
                                "found " + ctx.describeNext());
                }
            } else if (expressions.parseExpression() && ctx.eat(TO_KEYWORD)) {
                expressions.parseExpression();
            }
        } while (!ctx.isRecovering() && ctx.eat(COMMA));
    }

    // === Jumps ===

    void parseExit() {
        ctx.startNode(NodeKind.EXIT_STATEMENT);
        ctx.bump();
        if (ctx.atAny(SUB_KEYWORD, FUNCTION_KEYWORD, PROPERTY_KEYWORD, DO_KEYWORD, FOR_KEYWORD)) {
            ctx.bump();
        } else {
            ctx.recover(FailureKind.MISSING_TOKEN,
                        "expected 'Sub', 'Function', 'Property', 'Do' or 'For' after 'Exit'",
                        "found " + ctx.describeNext());
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    /**
     * Bare {@code End}; {@code End X} with no open {@code X} is reported in place.
     */
    void parseEnd() {
        var second = ctx.peek(1);
        switch (second) {
            case IF_KEYWORD, SELECT_KEYWORD, WITH_KEYWORD, SUB_KEYWORD, FUNCTION_KEYWORD, PROPERTY_KEYWORD,
                 TYPE_KEYWORD, ENUM_KEYWORD -> {
                var closer = "'End " + second.spelling() + "'";
                ctx.recover(FailureKind.UNEXPECTED_TOKEN, closer + " without matching block", "nothing to close");
            }
            default -> {
                ctx.startNode(NodeKind.END_STATEMENT);
                ctx.bump();
                ctx.consumeStatementEnd();
                ctx.finishNode();
            }
        }
    }

    void parseStrayTerminator() {
        var message = switch (ctx.peek()) {
            case NEXT_KEYWORD -> "'Next' without 'For'";
            case LOOP_KEYWORD -> "'Loop' without 'Do'";
            case WEND_KEYWORD -> "'Wend' without 'While'";
            case CASE_KEYWORD -> "'Case' outside 'Select Case'";
            case ELSE_KEYWORD -> "'Else' without 'If'";
            default -> "'ElseIf' without 'If'";
        };
        ctx.recover(FailureKind.UNEXPECTED_TOKEN, message, "no open block here");
    }

    void parseJump(NodeKind kind) {
        ctx.startNode(kind);
        ctx.bump();
        parseLabelReference();
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    void parseReturn() {
        ctx.startNode(NodeKind.RETURN_STATEMENT);
        ctx.bump();
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    void parseResume() {
        ctx.startNode(NodeKind.RESUME_STATEMENT);
        ctx.bump();
        if (!ctx.eat(NEXT_KEYWORD) && !ctx.atStatementEnd()) {
            parseLabelReference();
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    /**
     * {@code On Error ...}, {@code On x GoTo ...} or {@code On x GoSub ...}.
     */
    void parseOn() {
        if (ctx.peek(1) == ERROR_KEYWORD) {
            parseOnError();
            return;
        }
        int checkpoint = ctx.checkpoint();
        ctx.bump();
        expressions.parseExpression();
        ctx.startNodeAt(checkpoint, ctx.at(GO_SUB_KEYWORD) ? NodeKind.ON_GO_SUB_STATEMENT : NodeKind.ON_GO_TO_STATEMENT);
        if (ctx.atAny(GOTO_KEYWORD, GO_SUB_KEYWORD)) {
            ctx.bump();
            do {
                parseLabelReference();
            } while (!ctx.isRecovering() && ctx.eat(COMMA));
        } else {
            ctx.recover(FailureKind.MISSING_TOKEN, "expected 'GoTo' or 'GoSub'", "found " + ctx.describeNext());
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    private void parseOnError() {
        ctx.startNode(NodeKind.ON_ERROR_STATEMENT);
        ctx.bump();
        ctx.bump();
        if (ctx.eat(RESUME_KEYWORD)) {
            ctx.expect(NEXT_KEYWORD, "'Next' after 'Resume'");
        } else if (ctx.eat(GOTO_KEYWORD)) {
            if (ctx.at(SUBTRACTION_OPERATOR) && ctx.peek(1)
                                                   .isNumericLiteral()) {
                ctx.bump();
                ctx.bump();
            } else {
                parseLabelReference();
            }
        } else {
            ctx.recover(FailureKind.MISSING_TOKEN, "expected 'Resume Next' or 'GoTo'", "found " + ctx.describeNext());
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    private void parseLabelReference() {
        if (ctx.peek()
               .isNumericLiteral()) {
            ctx.bump();
            return;
        }
        ctx.expectName(NamePosition.DECLARATION_NAME, "label");
    }

    // === Helpers ===

    private void body(BlockKind kind) {
        ctx.enterBlock(kind);
        try {
            statements.parseBlockBody();
        } finally {
            ctx.exitBlock();
        }
    }

    private void nested(Runnable production) {
        if (!ctx.enterNesting()) {
            return;
        }
        try {
            production.run();
        } finally {
            ctx.exitNesting();
        }
    }
}
