package org.pragmatica.vb6.parser;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.vb6.error.FailureKind;
import org.pragmatica.vb6.lexer.TokenKind;
import org.pragmatica.vb6.tree.NodeKind;

import static org.pragmatica.vb6.lexer.TokenKind.*;

/**
 * File I/O and other built-in statements.
 *
 * <p>Most of them share one shape: the keyword followed by comma-separated arguments, each
 * optionally led by {@code #}, with empty slots and {@code a To b} ranges allowed. {@code Open},
 * {@code Print}/{@code Write}, {@code Line Input} and {@code Name} have productions of their own.
 */
final class FileStatementParser {
    private static final ImmutableMap<TokenKind, NodeKind> BUILT_IN_STATEMENTS = ImmutableMap.<TokenKind, NodeKind>builder()
        .put(CLOSE_KEYWORD, NodeKind.CLOSE_STATEMENT)
        .put(INPUT_KEYWORD, NodeKind.INPUT_STATEMENT)
        .put(GET_KEYWORD, NodeKind.GET_STATEMENT)
        .put(PUT_KEYWORD, NodeKind.PUT_STATEMENT)
        .put(SEEK_KEYWORD, NodeKind.SEEK_STATEMENT)
        .put(LOCK_KEYWORD, NodeKind.LOCK_STATEMENT)
        .put(UNLOCK_KEYWORD, NodeKind.UNLOCK_STATEMENT)
        .put(WIDTH_KEYWORD, NodeKind.WIDTH_STATEMENT)
        .put(MK_DIR_KEYWORD, NodeKind.MK_DIR_STATEMENT)
        .put(RM_DIR_KEYWORD, NodeKind.RM_DIR_STATEMENT)
        .put(CH_DIR_KEYWORD, NodeKind.CH_DIR_STATEMENT)
        .put(CH_DRIVE_KEYWORD, NodeKind.CH_DRIVE_STATEMENT)
        .put(KILL_KEYWORD, NodeKind.KILL_STATEMENT)
        .put(FILE_COPY_KEYWORD, NodeKind.FILE_COPY_STATEMENT)
        .put(SET_ATTR_KEYWORD, NodeKind.SET_ATTR_STATEMENT)
        .put(APP_ACTIVATE_KEYWORD, NodeKind.APP_ACTIVATE_STATEMENT)
        .put(BEEP_KEYWORD, NodeKind.BEEP_STATEMENT)
        .put(SEND_KEYS_KEYWORD, NodeKind.SEND_KEYS_STATEMENT)
        .put(SAVE_SETTING_KEYWORD, NodeKind.SAVE_SETTING_STATEMENT)
        .put(DELETE_SETTING_KEYWORD, NodeKind.DELETE_SETTING_STATEMENT)
        .put(SAVE_PICTURE_KEYWORD, NodeKind.SAVE_PICTURE_STATEMENT)
        .put(LOAD_KEYWORD, NodeKind.LOAD_STATEMENT)
        .put(UNLOAD_KEYWORD, NodeKind.UNLOAD_STATEMENT)
        .put(RANDOMIZE_KEYWORD, NodeKind.RANDOMIZE_STATEMENT)
        .put(RESET_KEYWORD, NodeKind.RESET_STATEMENT)
        .put(STOP_KEYWORD, NodeKind.STOP_STATEMENT)
        .put(ERROR_KEYWORD, NodeKind.ERROR_STATEMENT)
        .put(ERASE_KEYWORD, NodeKind.ERASE_STATEMENT)
        .build();

    private final ParsingContext ctx;
    private final ExpressionParser expressions;

    FileStatementParser(ParsingContext ctx, ExpressionParser expressions) {
        this.ctx = ctx;
        this.expressions = expressions;
    }

    /**
     * Parse the statement headed by {@code keyword}. Returns {@code false}, consuming nothing,
     * if the keyword heads no statement of its own.
     */
    boolean parse(TokenKind keyword) {
        switch (keyword) {
            case OPEN_KEYWORD -> parseOpen();
            case PRINT_KEYWORD -> parsePrint(NodeKind.PRINT_STATEMENT);
            case WRITE_KEYWORD -> parsePrint(NodeKind.WRITE_STATEMENT);
            case LINE_KEYWORD -> parseLineInput();
            case NAME_KEYWORD -> parseName();
            default -> {
                var kind = BUILT_IN_STATEMENTS.get(keyword);
                if (kind == null) {
                    return false;
                }
                parseBuiltIn(kind);
            }
        }
        return true;
    }

    // === Open ===

    /**
     * {@code Open path For mode [Access access] [lock] As [#]number [Len = length]}.
     */
    private void parseOpen() {
        ctx.startNode(NodeKind.OPEN_STATEMENT);
        ctx.bump();
        if (expressions.parseExpression() && ctx.expect(FOR_KEYWORD, "'For' in 'Open' statement")) {
            parseOpenMode();
        }
        if (!ctx.isRecovering() && ctx.eat(ACCESS_KEYWORD)) {
            parseAccessMode();
        }
        if (!ctx.isRecovering()) {
            parseLockMode();
        }
        if (!ctx.isRecovering() && ctx.expect(AS_KEYWORD, "'As' in 'Open' statement")) {
            ctx.eat(OCTOTHORPE);
            expressions.parseExpression();
            if (ctx.at(LEN_KEYWORD)) {
                ctx.bump();
                if (ctx.expect(EQUALITY_OPERATOR, "'=' after 'Len'")) {
                    expressions.parseExpression();
                }
            }
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    private void parseOpenMode() {
        if (ctx.atAny(INPUT_KEYWORD, OUTPUT_KEYWORD, APPEND_KEYWORD, BINARY_KEYWORD, RANDOM_KEYWORD)) {
            ctx.bump();
        } else {
            ctx.recover(FailureKind.MISSING_TOKEN,
                        "expected 'Input', 'Output', 'Append', 'Binary' or 'Random'",
                        "found " + ctx.describeNext());
        }
    }

    private void parseAccessMode() {
        if (ctx.eat(READ_KEYWORD)) {
            ctx.eat(WRITE_KEYWORD);
        } else if (!ctx.eat(WRITE_KEYWORD)) {
            ctx.recover(FailureKind.MISSING_TOKEN, "expected 'Read' or 'Write' after 'Access'",
                        "found " + ctx.describeNext());
        }
    }

    /**
     * {@code Shared}, {@code Lock Read}, {@code Lock Write} or {@code Lock Read Write}. There is
     * no {@code Shared} keyword, so it arrives as an identifier.
     */
    private void parseLockMode() {
        if (ctx.at(IDENTIFIER) && isShared()) {
            ctx.bump();
        } else if (ctx.eat(LOCK_KEYWORD)) {
            parseAccessMode();
        }
    }

    private boolean isShared() {
        return "shared".equalsIgnoreCase(ctx.tokenAt(ctx.peekIndex(0))
                                            .text());
    }

    // === Print and Write ===

    /**
     * {@code [#n,] items} where items are separated by {@code ;} or {@code ,}. Items stay flat.
     */
    private void parsePrint(NodeKind kind) {
        ctx.startNode(kind);
        ctx.bump();
        if (ctx.eat(OCTOTHORPE)) {
            expressions.parseExpression();
            ctx.eat(COMMA);
        }
        while (!ctx.isRecovering() && !ctx.atStatementEnd()) {
            if (ctx.atAny(SEMICOLON, COMMA)) {
                ctx.bump();
            } else if (!expressions.parseExpression()) {
                break;
            }
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    // === Line Input and Name ===

    private void parseLineInput() {
        ctx.startNode(NodeKind.LINE_INPUT_STATEMENT);
        ctx.bump();
        if (ctx.expect(INPUT_KEYWORD, "'Input' after 'Line'")) {
            parseArguments();
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    /**
     * {@code Name old As new}.
     */
    private void parseName() {
        ctx.startNode(NodeKind.NAME_STATEMENT);
        ctx.bump();
        if (expressions.parseExpression() && ctx.expect(AS_KEYWORD, "'As' in 'Name' statement")) {
            expressions.parseExpression();
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    // === Shared production ===

    private void parseBuiltIn(NodeKind kind) {
        ctx.startNode(kind);
        ctx.bump();
        parseArguments();
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    private void parseArguments() {
        while (!ctx.isRecovering() && !ctx.atStatementEnd()) {
            if (ctx.eat(COMMA)) {
                continue;
            }
            ctx.eat(OCTOTHORPE);
            if (!expressions.parseExpression()) {
                break;
            }
            if (ctx.eat(TO_KEYWORD)) {
                expressions.parseExpression();
            }
            if (!ctx.at(COMMA)) {
                break;
            }
        }
    }
}
