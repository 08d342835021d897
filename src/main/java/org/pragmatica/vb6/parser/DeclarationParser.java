package org.pragmatica.vb6.parser;

import org.pragmatica.vb6.error.FailureKind;
import org.pragmatica.vb6.lexer.NamePosition;
import org.pragmatica.vb6.lexer.TokenKind;
import org.pragmatica.vb6.tree.NodeKind;

import static org.pragmatica.vb6.lexer.TokenKind.*;

/**
 * Module-level and procedure-level declarations: variables, constants, user types, enums,
 * procedures and the module header statements ({@code Attribute}, {@code Option},
 * {@code Implements}, {@code DefXxx}).
 *
 * <p>Declarators, bounds and type clauses stay flat inside their statement; only procedure
 * parameters get their own {@code ParameterList}/{@code Parameter} nodes.
 */
final class DeclarationParser {
    private final ParsingContext ctx;
    private final StatementParser statements;
    private final ExpressionParser expressions;

    DeclarationParser(ParsingContext ctx, StatementParser statements, ExpressionParser expressions) {
        this.ctx = ctx;
        this.statements = statements;
        this.expressions = expressions;
    }

    /**
     * Optional access modifiers followed by a declaration; the modifiers become children of
     * whatever statement follows them.
     */
    void parseDeclaration() {
        int checkpoint = ctx.checkpoint();
        while (ctx.atAny(PUBLIC_KEYWORD, PRIVATE_KEYWORD, FRIEND_KEYWORD, GLOBAL_KEYWORD, STATIC_KEYWORD)) {
            ctx.bump();
        }
        switch (ctx.peek()) {
            case SUB_KEYWORD -> parseProcedure(checkpoint, NodeKind.SUB_STATEMENT, BlockKind.SUB, "'Sub'");
            case FUNCTION_KEYWORD ->
                parseProcedure(checkpoint, NodeKind.FUNCTION_STATEMENT, BlockKind.FUNCTION, "'Function'");
            case PROPERTY_KEYWORD ->
                parseProcedure(checkpoint, NodeKind.PROPERTY_STATEMENT, BlockKind.PROPERTY, "'Property'");
            case DECLARE_KEYWORD -> parseDeclare(checkpoint);
            case EVENT_KEYWORD -> parseEvent(checkpoint);
            case TYPE_KEYWORD -> parseType(checkpoint);
            case ENUM_KEYWORD -> parseEnum(checkpoint);
            case CONST_KEYWORD -> parseConst(checkpoint);
            default -> parseDim(checkpoint);
        }
    }

    // === Procedures ===

    private void parseProcedure(int checkpoint, NodeKind kind, BlockKind block, String construct) {
        if (!ctx.enterNesting()) {
            return;
        }
        try {
            ctx.startNodeAt(checkpoint, kind);
            ctx.bump();
            if (kind == NodeKind.PROPERTY_STATEMENT && !eatAccessor()) {
                ctx.recover(FailureKind.MISSING_TOKEN,
                            "expected 'Get', 'Let' or 'Set' after 'Property'",
                            "found " + ctx.describeNext());
            }
            if (ctx.expectName(NamePosition.DECLARATION_NAME, "procedure name")) {
                expressions.parseTypeSuffix();
            }
            if (ctx.at(LEFT_PARENTHESIS)) {
                parseParameterList();
            }
            if (ctx.at(AS_KEYWORD)) {
                parseAsClause();
            }
            ctx.consumeStatementEnd();
            ctx.enterBlock(block);
            try {
                statements.parseBlockBody();
            } finally {
                ctx.exitBlock();
            }
            ctx.closeWithEnd(block, construct);
            ctx.finishNode();
        } finally {
            ctx.exitNesting();
        }
    }

    private boolean eatAccessor() {
        if (ctx.atAny(GET_KEYWORD, LET_KEYWORD, SET_KEYWORD)) {
            ctx.bump();
            return true;
        }
        return false;
    }

    private void parseDeclare(int checkpoint) {
        ctx.startNodeAt(checkpoint, NodeKind.DECLARE_STATEMENT);
        ctx.bump();
        if (!ctx.atAny(SUB_KEYWORD, FUNCTION_KEYWORD)) {
            ctx.recover(FailureKind.MISSING_TOKEN, "expected 'Sub' or 'Function' after 'Declare'",
                        "found " + ctx.describeNext());
        } else {
            ctx.bump();
            if (ctx.expectName(NamePosition.DECLARATION_NAME, "procedure name")) {
                expressions.parseTypeSuffix();
                if (ctx.expect(LIB_KEYWORD, "'Lib'") && ctx.expect(STRING_LITERAL, "library name")) {
                    if (ctx.eat(ALIAS_KEYWORD)) {
                        ctx.expect(STRING_LITERAL, "alias name");
                    }
                    if (ctx.at(LEFT_PARENTHESIS)) {
                        parseParameterList();
                    }
                    if (ctx.at(AS_KEYWORD)) {
                        parseAsClause();
                    }
                }
            }
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    private void parseEvent(int checkpoint) {
        ctx.startNodeAt(checkpoint, NodeKind.EVENT_STATEMENT);
        ctx.bump();
        if (ctx.expectName(NamePosition.DECLARATION_NAME, "event name") && ctx.at(LEFT_PARENTHESIS)) {
            parseParameterList();
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    // === Parameters ===

    private void parseParameterList() {
        ctx.skipTrivia();
        ctx.startNode(NodeKind.PARAMETER_LIST);
        ctx.bump();
        if (!ctx.at(RIGHT_PARENTHESIS)) {
            do {
                parseParameter();
            } while (!ctx.isRecovering() && ctx.eat(COMMA));
        }
        ctx.expect(RIGHT_PARENTHESIS, "')' to close the parameter list");
        ctx.finishNode();
    }

    private void parseParameter() {
        ctx.skipTrivia();
        ctx.startNode(NodeKind.PARAMETER);
        ctx.eat(OPTIONAL_KEYWORD);
        if (ctx.atAny(BY_VAL_KEYWORD, BY_REF_KEYWORD)) {
            ctx.bump();
        }
        ctx.eat(PARAM_ARRAY_KEYWORD);
        if (ctx.expectName(NamePosition.DECLARATION_NAME, "parameter name")) {
            expressions.parseTypeSuffix();
            if (ctx.at(LEFT_PARENTHESIS) && ctx.peek(1) == RIGHT_PARENTHESIS) {
                ctx.bump();
                ctx.bump();
            }
            if (ctx.at(AS_KEYWORD)) {
                parseAsClause();
            }
            if (ctx.eat(EQUALITY_OPERATOR)) {
                expressions.parseExpression();
            }
        }
        ctx.finishNode();
    }

    /**
     * {@code As [New] type [* length]}.
     */
    private void parseAsClause() {
        ctx.bump();
        ctx.eat(NEW_KEYWORD);
        if (expressions.parseQualifiedName(NamePosition.MEMBER_NAME, "type name after 'As'")
            && ctx.eat(MULTIPLICATION_OPERATOR)) {
            expressions.parseOperand();
        }
    }

    // === Variables and constants ===

    private void parseDim(int checkpoint) {
        ctx.startNodeAt(checkpoint, NodeKind.DIM_STATEMENT);
        ctx.eat(DIM_KEYWORD);
        parseDeclarators();
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    void parseReDim() {
        ctx.startNode(NodeKind.RE_DIM_STATEMENT);
        ctx.bump();
        ctx.eat(PRESERVE_KEYWORD);
        parseDeclarators();
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    private void parseDeclarators() {
        do {
            parseDeclarator();
        } while (!ctx.isRecovering() && ctx.eat(COMMA));
    }

    /**
     * {@code [WithEvents] name[suffix][(bounds)] [As ...]}, flat.
     */
    private void parseDeclarator() {
        ctx.eat(WITH_EVENTS_KEYWORD);
        if (!expressions.parseQualifiedName(NamePosition.DECLARATION_NAME, "variable name")) {
            return;
        }
        expressions.parseTypeSuffix();
        if (ctx.at(LEFT_PARENTHESIS)) {
            parseBounds();
        }
        if (ctx.at(AS_KEYWORD)) {
            parseAsClause();
        }
    }

    private void parseBounds() {
        ctx.bump();
        if (!ctx.at(RIGHT_PARENTHESIS)) {
            do {
                if (expressions.parseExpression() && ctx.eat(TO_KEYWORD)) {
                    expressions.parseExpression();
                }
            } while (!ctx.isRecovering() && ctx.eat(COMMA));
        }
        ctx.expect(RIGHT_PARENTHESIS, "')' to close the array bounds");
    }

    private void parseConst(int checkpoint) {
        ctx.startNodeAt(checkpoint, NodeKind.CONST_STATEMENT);
        ctx.bump();
        do {
            if (!ctx.expectName(NamePosition.DECLARATION_NAME, "constant name")) {
                break;
            }
            expressions.parseTypeSuffix();
            if (ctx.at(AS_KEYWORD)) {
                parseAsClause();
            }
            if (ctx.expect(EQUALITY_OPERATOR, "'=' in constant declaration")) {
                expressions.parseExpression();
            }
        } while (!ctx.isRecovering() && ctx.eat(COMMA));
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    // === User types and enums ===

    private void parseType(int checkpoint) {
        ctx.startNodeAt(checkpoint, NodeKind.TYPE_STATEMENT);
        ctx.bump();
        ctx.expectName(NamePosition.DECLARATION_NAME, "type name");
        ctx.consumeStatementEnd();
        parseMembers(TYPE_KEYWORD, this::parseTypeMember);
        closeMembers(TYPE_KEYWORD, "End Type", "'Type' definition");
        ctx.finishNode();
    }

    private void parseTypeMember() {
        parseDeclarator();
        ctx.consumeStatementEnd();
    }

    private void parseEnum(int checkpoint) {
        ctx.startNodeAt(checkpoint, NodeKind.ENUM_STATEMENT);
        ctx.bump();
        ctx.expectName(NamePosition.DECLARATION_NAME, "enum name");
        ctx.consumeStatementEnd();
        parseMembers(ENUM_KEYWORD, this::parseEnumMember);
        closeMembers(ENUM_KEYWORD, "End Enum", "'Enum' definition");
        ctx.finishNode();
    }

    private void parseEnumMember() {
        ctx.bumpName(NamePosition.DECLARATION_NAME);
        if (ctx.eat(EQUALITY_OPERATOR)) {
            expressions.parseExpression();
        }
        ctx.consumeStatementEnd();
    }

    /**
     * Member lines up to {@code End Type}/{@code End Enum}. A line that cannot be a member
     * (for example a procedure header after a forgotten terminator) ends the list.
     */
    private void parseMembers(TokenKind owner, Runnable member) {
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
            if (kind == END_OF_INPUT || (kind == END_KEYWORD && ctx.peek(1) == owner) || !atMemberLine(owner)) {
                return;
            }
            int before = ctx.pos();
            member.run();
            if (ctx.pos() == before) {
                ctx.forceProgress();
            }
        }
    }

    private boolean atMemberLine(TokenKind owner) {
        var kind = ctx.peek();
        if (kind == IDENTIFIER) {
            return true;
        }
        if (!kind.isKeyword()) {
            return false;
        }
        var next = ctx.peek(1);
        if (owner == ENUM_KEYWORD) {
            return next == EQUALITY_OPERATOR || ctx.isStatementEnd(next);
        }
        return next == AS_KEYWORD || next == LEFT_PARENTHESIS;
    }

    private void closeMembers(TokenKind owner, String terminator, String construct) {
        if (ctx.at(END_KEYWORD) && ctx.peek(1) == owner) {
            ctx.bump();
            ctx.bump();
            ctx.consumeStatementEnd();
        } else {
            ctx.missingTerminator(terminator, construct);
        }
    }

    // === Module header ===

    void parseAttribute() {
        ctx.startNode(NodeKind.ATTRIBUTE_STATEMENT);
        ctx.bump();
        if (expressions.parseQualifiedName(NamePosition.MEMBER_NAME, "attribute name")
            && ctx.expect(EQUALITY_OPERATOR, "'=' after attribute name")) {
            do {
                expressions.parseExpression();
            } while (!ctx.isRecovering() && ctx.eat(COMMA));
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    void parseOption() {
        ctx.startNode(NodeKind.OPTION_STATEMENT);
        ctx.bump();
        switch (ctx.peek()) {
            case EXPLICIT_KEYWORD -> ctx.bump();
            case BASE_KEYWORD -> {
                ctx.bump();
                if (ctx.peek()
                       .isNumericLiteral()) {
                    ctx.bump();
                } else {
                    ctx.recover(FailureKind.MISSING_TOKEN, "expected 0 or 1 after 'Option Base'",
                                "found " + ctx.describeNext());
                }
            }
            case COMPARE_KEYWORD -> {
                ctx.bump();
                if (ctx.atAny(BINARY_KEYWORD, TEXT_KEYWORD, DATABASE_KEYWORD)) {
                    ctx.bump();
                } else {
                    ctx.recover(FailureKind.MISSING_TOKEN, "expected 'Binary', 'Text' or 'Database'",
                                "found " + ctx.describeNext());
                }
            }
            case PRIVATE_KEYWORD -> {
                ctx.bump();
                ctx.expect(MODULE_KEYWORD, "'Module' after 'Option Private'");
            }
            default -> ctx.recover(FailureKind.MISSING_TOKEN,
                                   "expected 'Explicit', 'Base', 'Compare' or 'Private Module'",
                                   "found " + ctx.describeNext());
        }
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    void parseImplements() {
        ctx.startNode(NodeKind.IMPLEMENTS_STATEMENT);
        ctx.bump();
        expressions.parseQualifiedName(NamePosition.DECLARATION_NAME, "interface name");
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }

    /**
     * {@code DefInt A-Z, I} and the other {@code DefXxx} statements.
     */
    void parseDefType() {
        ctx.startNode(NodeKind.DEF_TYPE_STATEMENT);
        ctx.bump();
        do {
            if (!ctx.expectName(NamePosition.DECLARATION_NAME, "letter range")) {
                break;
            }
            if (ctx.eat(SUBTRACTION_OPERATOR)) {
                ctx.expectName(NamePosition.DECLARATION_NAME, "end of letter range");
            }
        } while (!ctx.isRecovering() && ctx.eat(COMMA));
        ctx.consumeStatementEnd();
        ctx.finishNode();
    }
}
