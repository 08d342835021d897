package org.pragmatica.vb6.tree;

/**
 * Kinds of composite CST nodes.
 */
public enum NodeKind implements SyntaxKind {
    // Document
    ROOT(Category.ROOT),

    // Statements
    ATTRIBUTE_STATEMENT(Category.STATEMENT),
    OPTION_STATEMENT(Category.STATEMENT),
    DECLARE_STATEMENT(Category.STATEMENT),
    EVENT_STATEMENT(Category.STATEMENT),
    IMPLEMENTS_STATEMENT(Category.STATEMENT),
    DEF_TYPE_STATEMENT(Category.STATEMENT),
    SUB_STATEMENT(Category.STATEMENT),
    FUNCTION_STATEMENT(Category.STATEMENT),
    PROPERTY_STATEMENT(Category.STATEMENT),
    DIM_STATEMENT(Category.STATEMENT),
    RE_DIM_STATEMENT(Category.STATEMENT),
    CONST_STATEMENT(Category.STATEMENT),
    TYPE_STATEMENT(Category.STATEMENT),
    ENUM_STATEMENT(Category.STATEMENT),
    IF_STATEMENT(Category.STATEMENT),
    FOR_STATEMENT(Category.STATEMENT),
    FOR_EACH_STATEMENT(Category.STATEMENT),
    DO_STATEMENT(Category.STATEMENT),
    WHILE_STATEMENT(Category.STATEMENT),
    SELECT_CASE_STATEMENT(Category.STATEMENT),
    WITH_STATEMENT(Category.STATEMENT),
    EXIT_STATEMENT(Category.STATEMENT),
    END_STATEMENT(Category.STATEMENT),
    GOTO_STATEMENT(Category.STATEMENT),
    GO_SUB_STATEMENT(Category.STATEMENT),
    RETURN_STATEMENT(Category.STATEMENT),
    RESUME_STATEMENT(Category.STATEMENT),
    ON_ERROR_STATEMENT(Category.STATEMENT),
    ON_GO_TO_STATEMENT(Category.STATEMENT),
    ON_GO_SUB_STATEMENT(Category.STATEMENT),
    LABEL_STATEMENT(Category.STATEMENT),
    ASSIGNMENT_STATEMENT(Category.STATEMENT),
    LET_STATEMENT(Category.STATEMENT),
    SET_STATEMENT(Category.STATEMENT),
    CALL_STATEMENT(Category.STATEMENT),
    RAISE_EVENT_STATEMENT(Category.STATEMENT),
    OPEN_STATEMENT(Category.STATEMENT),
    CLOSE_STATEMENT(Category.STATEMENT),
    PRINT_STATEMENT(Category.STATEMENT),
    WRITE_STATEMENT(Category.STATEMENT),
    INPUT_STATEMENT(Category.STATEMENT),
    LINE_INPUT_STATEMENT(Category.STATEMENT),
    GET_STATEMENT(Category.STATEMENT),
    PUT_STATEMENT(Category.STATEMENT),
    SEEK_STATEMENT(Category.STATEMENT),
    LOCK_STATEMENT(Category.STATEMENT),
    UNLOCK_STATEMENT(Category.STATEMENT),
    WIDTH_STATEMENT(Category.STATEMENT),
    MK_DIR_STATEMENT(Category.STATEMENT),
    RM_DIR_STATEMENT(Category.STATEMENT),
    CH_DIR_STATEMENT(Category.STATEMENT),
    CH_DRIVE_STATEMENT(Category.STATEMENT),
    KILL_STATEMENT(Category.STATEMENT),
    NAME_STATEMENT(Category.STATEMENT),
    FILE_COPY_STATEMENT(Category.STATEMENT),
    SET_ATTR_STATEMENT(Category.STATEMENT),
    APP_ACTIVATE_STATEMENT(Category.STATEMENT),
    BEEP_STATEMENT(Category.STATEMENT),
    SEND_KEYS_STATEMENT(Category.STATEMENT),
    SAVE_SETTING_STATEMENT(Category.STATEMENT),
    DELETE_SETTING_STATEMENT(Category.STATEMENT),
    SAVE_PICTURE_STATEMENT(Category.STATEMENT),
    LOAD_STATEMENT(Category.STATEMENT),
    UNLOAD_STATEMENT(Category.STATEMENT),
    RANDOMIZE_STATEMENT(Category.STATEMENT),
    RESET_STATEMENT(Category.STATEMENT),
    STOP_STATEMENT(Category.STATEMENT),
    ERROR_STATEMENT(Category.STATEMENT),
    ERASE_STATEMENT(Category.STATEMENT),

    // Clauses
    ELSE_IF_CLAUSE(Category.CLAUSE),
    ELSE_CLAUSE(Category.CLAUSE),
    CASE_CLAUSE(Category.CLAUSE),
    CASE_ELSE_CLAUSE(Category.CLAUSE),

    // Expressions
    BINARY_EXPRESSION(Category.EXPRESSION),
    UNARY_EXPRESSION(Category.EXPRESSION),
    LITERAL_EXPRESSION(Category.EXPRESSION),
    IDENTIFIER_EXPRESSION(Category.EXPRESSION),
    MEMBER_ACCESS_EXPRESSION(Category.EXPRESSION),
    CALL_EXPRESSION(Category.EXPRESSION),
    PARENTHESIZED_EXPRESSION(Category.EXPRESSION),
    NUMERIC_LITERAL_EXPRESSION(Category.EXPRESSION),
    STRING_LITERAL_EXPRESSION(Category.EXPRESSION),
    BOOLEAN_LITERAL_EXPRESSION(Category.EXPRESSION),
    NEW_EXPRESSION(Category.EXPRESSION),
    ADDRESS_OF_EXPRESSION(Category.EXPRESSION),
    TYPE_OF_EXPRESSION(Category.EXPRESSION),

    // Structure
    STATEMENT_LIST(Category.STRUCTURAL),
    PARAMETER_LIST(Category.STRUCTURAL),
    PARAMETER(Category.STRUCTURAL),
    ARGUMENT_LIST(Category.STRUCTURAL),
    ARGUMENT(Category.STRUCTURAL),

    // Recovery
    UNKNOWN(Category.ERROR);

    /**
     * Coarse grouping of node kinds.
     */
    public enum Category {
        ROOT,
        STATEMENT,
        CLAUSE,
        EXPRESSION,
        STRUCTURAL,
        ERROR
    }

    private final Category category;
    private final String displayName;

    NodeKind(Category category) {
        this.category = category;
        this.displayName = SyntaxKind.pascalCase(name());
    }

    public Category category() {
        return category;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    public boolean isExpression() {
        return category == Category.EXPRESSION;
    }
}
