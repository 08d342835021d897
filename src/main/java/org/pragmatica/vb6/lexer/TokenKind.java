package org.pragmatica.vb6.lexer;

import org.pragmatica.vb6.tree.SyntaxKind;

/**
 * Kinds of lexical units. Keyword constants carry their canonical spelling; the keyword
 * table used by {@link KeywordClassifier} is derived from them.
 */
public enum TokenKind implements SyntaxKind {
    // Trivia
    WHITESPACE(Category.TRIVIA),
    NEWLINE(Category.TRIVIA),
    LINE_CONTINUATION(Category.TRIVIA),
    END_OF_LINE_COMMENT(Category.TRIVIA),
    REM_COMMENT(Category.TRIVIA),

    // Literals
    INTEGER_LITERAL(Category.LITERAL),
    LONG_LITERAL(Category.LITERAL),
    SINGLE_LITERAL(Category.LITERAL),
    DOUBLE_LITERAL(Category.LITERAL),
    DECIMAL_LITERAL(Category.LITERAL),
    STRING_LITERAL(Category.LITERAL),
    DATE_LITERAL(Category.LITERAL),

    IDENTIFIER(Category.IDENTIFIER),

    // Operators
    EQUALITY_OPERATOR(Category.OPERATOR),
    INEQUALITY_OPERATOR(Category.OPERATOR),
    LESS_THAN_OPERATOR(Category.OPERATOR),
    GREATER_THAN_OPERATOR(Category.OPERATOR),
    LESS_THAN_OR_EQUAL_OPERATOR(Category.OPERATOR),
    GREATER_THAN_OR_EQUAL_OPERATOR(Category.OPERATOR),
    ADDITION_OPERATOR(Category.OPERATOR),
    SUBTRACTION_OPERATOR(Category.OPERATOR),
    MULTIPLICATION_OPERATOR(Category.OPERATOR),
    DIVISION_OPERATOR(Category.OPERATOR),
    BACKWARD_SLASH_OPERATOR(Category.OPERATOR),
    EXPONENTIATION_OPERATOR(Category.OPERATOR),
    AMPERSAND(Category.OPERATOR),
    PERIOD_OPERATOR(Category.OPERATOR),
    COLON_OPERATOR(Category.OPERATOR),
    COLON_EQUALS_OPERATOR(Category.OPERATOR),

    // Punctuation
    LEFT_PARENTHESIS(Category.PUNCTUATION),
    RIGHT_PARENTHESIS(Category.PUNCTUATION),
    LEFT_CURLY_BRACE(Category.PUNCTUATION),
    RIGHT_CURLY_BRACE(Category.PUNCTUATION),
    LEFT_SQUARE_BRACKET(Category.PUNCTUATION),
    RIGHT_SQUARE_BRACKET(Category.PUNCTUATION),
    COMMA(Category.PUNCTUATION),
    SEMICOLON(Category.PUNCTUATION),
    OCTOTHORPE(Category.PUNCTUATION),
    DOLLAR_SIGN(Category.PUNCTUATION),
    PERCENT(Category.PUNCTUATION),
    AT_SIGN(Category.PUNCTUATION),
    EXCLAMATION_MARK(Category.PUNCTUATION),
    UNDERSCORE(Category.PUNCTUATION),

    // Keywords
    ADDRESS_OF_KEYWORD("AddressOf"),
    ACCESS_KEYWORD("Access"),
    ALIAS_KEYWORD("Alias"),
    AND_KEYWORD("And"),
    APP_ACTIVATE_KEYWORD("AppActivate"),
    APPEND_KEYWORD("Append"),
    AS_KEYWORD("As"),
    ATTRIBUTE_KEYWORD("Attribute"),
    BASE_KEYWORD("Base"),
    BEEP_KEYWORD("Beep"),
    BEGIN_KEYWORD("Begin"),
    BINARY_KEYWORD("Binary"),
    BOOLEAN_KEYWORD("Boolean"),
    BY_REF_KEYWORD("ByRef"),
    BYTE_KEYWORD("Byte"),
    BY_VAL_KEYWORD("ByVal"),
    CALL_KEYWORD("Call"),
    CASE_KEYWORD("Case"),
    CH_DIR_KEYWORD("ChDir"),
    CH_DRIVE_KEYWORD("ChDrive"),
    CLASS_KEYWORD("Class"),
    CLOSE_KEYWORD("Close"),
    COMPARE_KEYWORD("Compare"),
    CONST_KEYWORD("Const"),
    CURRENCY_KEYWORD("Currency"),
    DATABASE_KEYWORD("Database"),
    DATE_KEYWORD("Date"),
    DECIMAL_KEYWORD("Decimal"),
    DECLARE_KEYWORD("Declare"),
    DEF_BOOL_KEYWORD("DefBool"),
    DEF_BYTE_KEYWORD("DefByte"),
    DEF_CUR_KEYWORD("DefCur"),
    DEF_DATE_KEYWORD("DefDate"),
    DEF_DBL_KEYWORD("DefDbl"),
    DEF_DEC_KEYWORD("DefDec"),
    DEF_INT_KEYWORD("DefInt"),
    DEF_LNG_KEYWORD("DefLng"),
    DEF_OBJ_KEYWORD("DefObj"),
    DEF_SNG_KEYWORD("DefSng"),
    DEF_STR_KEYWORD("DefStr"),
    DEF_VAR_KEYWORD("DefVar"),
    DELETE_SETTING_KEYWORD("DeleteSetting"),
    DIM_KEYWORD("Dim"),
    DO_KEYWORD("Do"),
    DOUBLE_KEYWORD("Double"),
    EACH_KEYWORD("Each"),
    ELSE_KEYWORD("Else"),
    ELSE_IF_KEYWORD("ElseIf"),
    EMPTY_KEYWORD("Empty"),
    END_KEYWORD("End"),
    ENUM_KEYWORD("Enum"),
    EQV_KEYWORD("Eqv"),
    ERASE_KEYWORD("Erase"),
    ERROR_KEYWORD("Error"),
    EVENT_KEYWORD("Event"),
    EXIT_KEYWORD("Exit"),
    EXPLICIT_KEYWORD("Explicit"),
    FALSE_KEYWORD("False"),
    FILE_COPY_KEYWORD("FileCopy"),
    FOR_KEYWORD("For"),
    FRIEND_KEYWORD("Friend"),
    FUNCTION_KEYWORD("Function"),
    GET_KEYWORD("Get"),
    GLOBAL_KEYWORD("Global"),
    GO_SUB_KEYWORD("GoSub"),
    GOTO_KEYWORD("Goto"),
    IF_KEYWORD("If"),
    IMP_KEYWORD("Imp"),
    IMPLEMENTS_KEYWORD("Implements"),
    IN_KEYWORD("In"),
    INPUT_KEYWORD("Input"),
    INTEGER_KEYWORD("Integer"),
    IS_KEYWORD("Is"),
    KILL_KEYWORD("Kill"),
    LEN_KEYWORD("Len"),
    LET_KEYWORD("Let"),
    LIB_KEYWORD("Lib"),
    LIKE_KEYWORD("Like"),
    LINE_KEYWORD("Line"),
    LOAD_KEYWORD("Load"),
    LOCK_KEYWORD("Lock"),
    LONG_KEYWORD("Long"),
    LOOP_KEYWORD("Loop"),
    L_SET_KEYWORD("LSet"),
    ME_KEYWORD("Me"),
    MID_KEYWORD("Mid"),
    MID_B_KEYWORD("MidB"),
    MK_DIR_KEYWORD("MkDir"),
    MOD_KEYWORD("Mod"),
    MODULE_KEYWORD("Module"),
    NAME_KEYWORD("Name"),
    NEW_KEYWORD("New"),
    NEXT_KEYWORD("Next"),
    NOT_KEYWORD("Not"),
    NOTHING_KEYWORD("Nothing"),
    NULL_KEYWORD("Null"),
    OBJECT_KEYWORD("Object"),
    ON_KEYWORD("On"),
    OPEN_KEYWORD("Open"),
    OPTION_KEYWORD("Option"),
    OPTIONAL_KEYWORD("Optional"),
    OR_KEYWORD("Or"),
    OUTPUT_KEYWORD("Output"),
    PARAM_ARRAY_KEYWORD("ParamArray"),
    PRESERVE_KEYWORD("Preserve"),
    PRINT_KEYWORD("Print"),
    PRIVATE_KEYWORD("Private"),
    PROPERTY_KEYWORD("Property"),
    PUBLIC_KEYWORD("Public"),
    PUT_KEYWORD("Put"),
    RAISE_EVENT_KEYWORD("RaiseEvent"),
    RANDOM_KEYWORD("Random"),
    RANDOMIZE_KEYWORD("Randomize"),
    READ_KEYWORD("Read"),
    RE_DIM_KEYWORD("ReDim"),
    RESET_KEYWORD("Reset"),
    RESUME_KEYWORD("Resume"),
    RETURN_KEYWORD("Return"),
    RM_DIR_KEYWORD("RmDir"),
    R_SET_KEYWORD("RSet"),
    SAVE_PICTURE_KEYWORD("SavePicture"),
    SAVE_SETTING_KEYWORD("SaveSetting"),
    SEEK_KEYWORD("Seek"),
    SELECT_KEYWORD("Select"),
    SEND_KEYS_KEYWORD("SendKeys"),
    SET_KEYWORD("Set"),
    SET_ATTR_KEYWORD("SetAttr"),
    SINGLE_KEYWORD("Single"),
    STATIC_KEYWORD("Static"),
    STEP_KEYWORD("Step"),
    STOP_KEYWORD("Stop"),
    STRING_KEYWORD("String"),
    SUB_KEYWORD("Sub"),
    TEXT_KEYWORD("Text"),
    THEN_KEYWORD("Then"),
    TIME_KEYWORD("Time"),
    TO_KEYWORD("To"),
    TRUE_KEYWORD("True"),
    TYPE_KEYWORD("Type"),
    TYPE_OF_KEYWORD("TypeOf"),
    UNLOAD_KEYWORD("Unload"),
    UNLOCK_KEYWORD("Unlock"),
    UNTIL_KEYWORD("Until"),
    VARIANT_KEYWORD("Variant"),
    VERSION_KEYWORD("Version"),
    WEND_KEYWORD("Wend"),
    WHILE_KEYWORD("While"),
    WIDTH_KEYWORD("Width"),
    WITH_KEYWORD("With"),
    WITH_EVENTS_KEYWORD("WithEvents"),
    WRITE_KEYWORD("Write"),
    XOR_KEYWORD("Xor"),
    UNKNOWN(Category.UNKNOWN),

    /**
     * Never produced by the lexer; reported by parser lookahead past the last token.
     */
    END_OF_INPUT(Category.END);

    /**
     * Coarse classification of token kinds.
     */
    public enum Category {
        TRIVIA,
        KEYWORD,
        LITERAL,
        IDENTIFIER,
        OPERATOR,
        PUNCTUATION,
        UNKNOWN,
        END
    }

    private final Category category;
    private final String spelling;
    private final String displayName;

    TokenKind(Category category) {
        this(category, null);
    }

    TokenKind(String spelling) {
        this(Category.KEYWORD, spelling);
    }

    TokenKind(Category category, String spelling) {
        this.category = category;
        this.spelling = spelling;
        this.displayName = SyntaxKind.pascalCase(name());
    }

    public Category category() {
        return category;
    }

    /**
     * Canonical spelling of a keyword, or {@code null} for non-keyword kinds.
     */
    public String spelling() {
        return spelling;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    public boolean isKeyword() {
        return category == Category.KEYWORD;
    }

    public boolean isTrivia() {
        return category == Category.TRIVIA;
    }

    public boolean isComment() {
        return this == END_OF_LINE_COMMENT || this == REM_COMMENT;
    }

    /**
     * Trivia that may appear in the middle of a logical line.
     */
    public boolean isInlineTrivia() {
        return this == WHITESPACE || this == LINE_CONTINUATION;
    }

    public boolean isNumericLiteral() {
        return this == INTEGER_LITERAL
               || this == LONG_LITERAL
               || this == SINGLE_LITERAL
               || this == DOUBLE_LITERAL
               || this == DECIMAL_LITERAL;
    }

    /**
     * Identifier or keyword, i.e. anything that lexed as a word.
     */
    public boolean isWord() {
        return this == IDENTIFIER || isKeyword();
    }
}
