package org.pragmatica.vb6.lexer;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static org.pragmatica.vb6.lexer.TokenKind.*;

/**
 * Decides whether a word is a keyword or an identifier.
 *
 * <p>The lexer tags every word found in the keyword table with its keyword kind. Many VB6
 * keywords are also legal names ({@code Text}, {@code Date}, {@code Name}, ...), so the parser
 * asks this class again once it knows the grammatical position of the word.
 */
public final class KeywordClassifier {
    private KeywordClassifier() {}

    private static final ImmutableMap<String, TokenKind> KEYWORDS = Arrays.stream(TokenKind.values())
                                                                          .filter(TokenKind::isKeyword)
                                                                          .collect(ImmutableMap.toImmutableMap(
                                                                              kind -> kind.spelling()
                                                                                          .toLowerCase(Locale.ROOT),
                                                                              kind -> kind));

    /**
     * Keywords that may stand where an expression expects a variable or function name.
     */
    private static final Set<TokenKind> OPERAND_KEYWORDS = EnumSet.of(
        ACCESS_KEYWORD, ALIAS_KEYWORD, APPEND_KEYWORD, BASE_KEYWORD, BEGIN_KEYWORD, BINARY_KEYWORD,
        CLASS_KEYWORD, COMPARE_KEYWORD, DATABASE_KEYWORD, DATE_KEYWORD, ERROR_KEYWORD, EXPLICIT_KEYWORD,
        INPUT_KEYWORD, LEN_KEYWORD, LIB_KEYWORD, LINE_KEYWORD, LOCK_KEYWORD, ME_KEYWORD, MID_KEYWORD,
        MID_B_KEYWORD, MODULE_KEYWORD, NAME_KEYWORD, OBJECT_KEYWORD, OUTPUT_KEYWORD,
        RANDOM_KEYWORD, READ_KEYWORD, RESET_KEYWORD, SEEK_KEYWORD, STEP_KEYWORD, STRING_KEYWORD,
        TEXT_KEYWORD, TIME_KEYWORD, VERSION_KEYWORD, WIDTH_KEYWORD);

    /**
     * Keywords that only start their statement when not used as an assignment target or callee.
     */
    private static final Set<TokenKind> DUAL_STATEMENT_KEYWORDS = EnumSet.of(
        NAME_KEYWORD, LINE_KEYWORD, INPUT_KEYWORD, ERROR_KEYWORD, SEEK_KEYWORD, WIDTH_KEYWORD,
        RESET_KEYWORD, LOCK_KEYWORD, DATE_KEYWORD, TIME_KEYWORD, MID_KEYWORD, MID_B_KEYWORD,
        PROPERTY_KEYWORD);

    /**
     * Reserved words whose {@code $} form is a distinct identifier, e.g. {@code Mid$}.
     */
    private static final Set<TokenKind> DOLLAR_FUSED_KEYWORDS = EnumSet.of(
        ERROR_KEYWORD, LEN_KEYWORD, MID_KEYWORD, MID_B_KEYWORD, DATE_KEYWORD, STRING_KEYWORD);

    /**
     * Legacy string-returning functions written with a {@code $} suffix, lower case.
     */
    private static final ImmutableSet<String> DOLLAR_FUNCTIONS = ImmutableSet.of(
        "chr", "chrb", "chrw", "command", "curdir", "dir", "environ", "format", "hex", "inputb", "lcase",
        "left", "leftb", "ltrim", "oct", "right", "rightb", "rtrim", "space", "str", "trim", "ucase");

    /**
     * Look up a word in the keyword table, ignoring case.
     */
    public static Optional<TokenKind> keyword(String lexeme) {
        return Optional.ofNullable(KEYWORDS.get(lexeme.toLowerCase(Locale.ROOT)));
    }

    /**
     * Number of entries in the keyword table.
     */
    public static int keywordCount() {
        return KEYWORDS.size();
    }

    /**
     * Kind a word should carry in the given position.
     *
     * @param lexed    kind assigned by the lexer ({@link TokenKind#IDENTIFIER} or a keyword)
     * @param position grammatical position supplied by the parser
     */
    public static TokenKind classify(TokenKind lexed, NamePosition position) {
        if (!lexed.isKeyword()) {
            return lexed;
        }
        return switch (position) {
            case DECLARATION_NAME -> IDENTIFIER;
            case MEMBER_NAME, EXPRESSION, STATEMENT_START -> lexed;
        };
    }

    /**
     * Whether a word of this kind may appear in the given position at all.
     */
    public static boolean accepts(TokenKind lexed, NamePosition position) {
        if (lexed == IDENTIFIER) {
            return true;
        }
        if (!lexed.isKeyword()) {
            return false;
        }
        return switch (position) {
            case DECLARATION_NAME, MEMBER_NAME -> true;
            case EXPRESSION, STATEMENT_START -> OPERAND_KEYWORDS.contains(lexed);
        };
    }

    /**
     * Whether the keyword may stand as a variable or function name inside an expression.
     */
    public static boolean isOperand(TokenKind kind) {
        return OPERAND_KEYWORDS.contains(kind);
    }

    /**
     * Whether {@code kind} at the start of a line heads its own statement production, given the
     * kind of the next significant token and whether that token touches the keyword.
     */
    public static boolean startsStatement(TokenKind kind, TokenKind next, boolean nextAdjacent) {
        if (!kind.isKeyword()) {
            return false;
        }
        if (!DUAL_STATEMENT_KEYWORDS.contains(kind)) {
            return true;
        }
        if (next == EQUALITY_OPERATOR || next == PERIOD_OPERATOR || next == EXCLAMATION_MARK || next == DOLLAR_SIGN) {
            return false;
        }
        if (next == LEFT_PARENTHESIS && nextAdjacent) {
            return false;
        }
        return switch (kind) {
            case LINE_KEYWORD -> next == INPUT_KEYWORD;
            case DATE_KEYWORD, TIME_KEYWORD, MID_KEYWORD, MID_B_KEYWORD -> false;
            case PROPERTY_KEYWORD -> next == GET_KEYWORD || next == LET_KEYWORD || next == SET_KEYWORD;
            default -> true;
        };
    }

    /**
     * Whether {@code word} immediately followed by {@code $} lexes as one identifier.
     */
    public static boolean fusesDollar(String word) {
        return keyword(word).map(DOLLAR_FUSED_KEYWORDS::contains)
                            .orElseGet(() -> DOLLAR_FUNCTIONS.contains(word.toLowerCase(Locale.ROOT)));
    }
}
