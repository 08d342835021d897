package org.pragmatica.vb6.lexer;

import org.pragmatica.vb6.tree.SourceLocation;
import org.pragmatica.vb6.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Lossless tokenizer for VB6 source.
 *
 * <p>The lexer is total: every character of the input ends up in exactly one token, trivia
 * included, and characters that fit no rule become {@link TokenKind#UNKNOWN} tokens. Problems
 * such as unterminated strings are left for the parser to report.
 */
public final class Lexer {
    public static final int MAX_INPUT_SIZE = 16_000_000;

    private static final int DEFAULT_TOKEN_CAPACITY = 256;
    private static final Pattern DATE_CONTENT = Pattern.compile("[0-9A-Za-z/:\\-., ]+");
    private static final Pattern DATE_MARKERS = Pattern.compile(
        "(?i).*([/:\\-]|\\b(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\b).*");

    private final String input;
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) {
        Objects.requireNonNull(input, "input");
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Source input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>(Math.max(DEFAULT_TOKEN_CAPACITY, input.length() / 4));
        while (!isAtEnd()) {
            tokens.add(nextToken());
        }
        return tokens;
    }

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();
        if (c == '\r' || c == '\n') {
            return scanNewline(start);
        }
        if (isInlineWhitespace(c)) {
            return scanWhitespace(start);
        }
        if (c == '_' && isLineContinuation()) {
            return scanLineContinuation(start);
        }
        if (c == '\'') {
            return scanToEndOfLine(start, TokenKind.END_OF_LINE_COMMENT);
        }
        if (c == '"') {
            return scanStringLiteral(start);
        }
        if (c == '#' && isDateLiteralAhead()) {
            return scanDateLiteral(start);
        }
        if (isDigit(c) || (c == '.' && isDigit(peekAt(1)))) {
            return scanNumber(start);
        }
        if (c == '&' && isRadixPrefix()) {
            return scanRadixNumber(start);
        }
        if (c == '[' && isBracketedIdentifierAhead()) {
            return scanBracketedIdentifier(start);
        }
        if (isIdentifierStart(c)) {
            return scanWord(start);
        }
        return scanSymbol(start);
    }

    // === Trivia ===

    private Token scanNewline(SourceLocation start) {
        if (advance() == '\r' && !isAtEnd() && peek() == '\n') {
            advance();
        }
        return token(TokenKind.NEWLINE, start);
    }

    private Token scanWhitespace(SourceLocation start) {
        while (!isAtEnd() && isInlineWhitespace(peek())) {
            advance();
        }
        return token(TokenKind.WHITESPACE, start);
    }

    private boolean isLineContinuation() {
        int i = pos + 1;
        while (i < input.length() && (input.charAt(i) == ' ' || input.charAt(i) == '\t')) {
            i++;
        }
        return i < input.length() && (input.charAt(i) == '\n' || input.charAt(i) == '\r');
    }

    private Token scanLineContinuation(SourceLocation start) {
        advance();
        // underscore
        while (peek() == ' ' || peek() == '\t') {
            advance();
        }
        if (advance() == '\r' && !isAtEnd() && peek() == '\n') {
            advance();
        }
        return token(TokenKind.LINE_CONTINUATION, start);
    }

    private Token scanToEndOfLine(SourceLocation start, TokenKind kind) {
        while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
            advance();
        }
        return token(kind, start);
    }

    // === Literals ===

    private Token scanStringLiteral(SourceLocation start) {
        advance();
        // opening quote
        while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
            if (advance() == '"') {
                if (!isAtEnd() && peek() == '"') {
                    advance();
                    // doubled quote
                } else {
                    break;
                }
            }
        }
        return token(TokenKind.STRING_LITERAL, start);
    }

    private boolean isDateLiteralAhead() {
        int close = pos + 1;
        while (close < input.length() && input.charAt(close) != '#') {
            char c = input.charAt(close);
            if (c == '\n' || c == '\r') {
                return false;
            }
            close++;
        }
        if (close >= input.length()) {
            return false;
        }
        var content = input.substring(pos + 1, close);
        return DATE_CONTENT.matcher(content).matches()
               && DATE_MARKERS.matcher(content).matches()
               && content.chars().anyMatch(Character::isDigit);
    }

    private Token scanDateLiteral(SourceLocation start) {
        advance();
        while (peek() != '#') {
            advance();
        }
        advance();
        return token(TokenKind.DATE_LITERAL, start);
    }

    private Token scanNumber(SourceLocation start) {
        boolean fractional = false;
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peekAt(1))) {
            fractional = true;
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        if (isExponentAhead()) {
            fractional = true;
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            while (isDigit(peek())) {
                advance();
            }
        }
        var kind = switch (peek()) {
            case'%' -> TokenKind.INTEGER_LITERAL;
            case'&' -> TokenKind.LONG_LITERAL;
            case'!' -> TokenKind.SINGLE_LITERAL;
            case'#' -> TokenKind.DOUBLE_LITERAL;
            case'@' -> TokenKind.DECIMAL_LITERAL;
            default -> null;
        };
        if (kind != null) {
            advance();
            return token(kind, start);
        }
        return token(fractional ? TokenKind.SINGLE_LITERAL : TokenKind.INTEGER_LITERAL, start);
    }

    private boolean isExponentAhead() {
        char c = peek();
        if (c != 'E' && c != 'e' && c != 'D' && c != 'd') {
            return false;
        }
        char next = peekAt(1);
        return isDigit(next) || ((next == '+' || next == '-') && isDigit(peekAt(2)));
    }

    private boolean isRadixPrefix() {
        char radix = Character.toUpperCase(peekAt(1));
        return (radix == 'H' && isHexDigit(peekAt(2))) || (radix == 'O' && isOctalDigit(peekAt(2)));
    }

    private Token scanRadixNumber(SourceLocation start) {
        advance();
        // ampersand
        boolean hex = Character.toUpperCase(advance()) == 'H';
        while (hex ? isHexDigit(peek()) : isOctalDigit(peek())) {
            advance();
        }
        if (peek() == '&') {
            advance();
            return token(TokenKind.LONG_LITERAL, start);
        }
        if (peek() == '%') {
            advance();
        }
        return token(TokenKind.INTEGER_LITERAL, start);
    }

    // === Words ===

    private boolean isBracketedIdentifierAhead() {
        int i = pos + 1;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == ']') {
                return i > pos + 1;
            }
            if (c == '\n' || c == '\r' || c == '[') {
                return false;
            }
            i++;
        }
        return false;
    }

    private Token scanBracketedIdentifier(SourceLocation start) {
        while (advance() != ']') {
            // consume through the closing bracket
        }
        return token(TokenKind.IDENTIFIER, start);
    }

    private Token scanWord(SourceLocation start) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        var word = input.substring(start.offset(), pos);
        if (word.equalsIgnoreCase("Rem") && (isAtEnd() || isInlineWhitespace(peek()) || peek() == '\n' || peek() == '\r')) {
            return scanToEndOfLine(start, TokenKind.REM_COMMENT);
        }
        if (!isAtEnd() && peek() == '$' && KeywordClassifier.fusesDollar(word)) {
            advance();
            return token(TokenKind.IDENTIFIER, start);
        }
        return token(KeywordClassifier.keyword(word)
                                      .orElse(TokenKind.IDENTIFIER), start);
    }

    // === Operators and punctuation ===

    private Token scanSymbol(SourceLocation start) {
        char c = advance();
        var kind = switch (c) {
            case'<' -> {
                if (match('>')) {
                    yield TokenKind.INEQUALITY_OPERATOR;
                }
                yield match('=') ? TokenKind.LESS_THAN_OR_EQUAL_OPERATOR : TokenKind.LESS_THAN_OPERATOR;
            }
            case'>' -> match('=') ? TokenKind.GREATER_THAN_OR_EQUAL_OPERATOR : TokenKind.GREATER_THAN_OPERATOR;
            case'=' -> TokenKind.EQUALITY_OPERATOR;
            case':' -> match('=') ? TokenKind.COLON_EQUALS_OPERATOR : TokenKind.COLON_OPERATOR;
            case'(' -> TokenKind.LEFT_PARENTHESIS;
            case')' -> TokenKind.RIGHT_PARENTHESIS;
            case'{' -> TokenKind.LEFT_CURLY_BRACE;
            case'}' -> TokenKind.RIGHT_CURLY_BRACE;
            case'[' -> TokenKind.LEFT_SQUARE_BRACKET;
            case']' -> TokenKind.RIGHT_SQUARE_BRACKET;
            case',' -> TokenKind.COMMA;
            case';' -> TokenKind.SEMICOLON;
            case'+' -> TokenKind.ADDITION_OPERATOR;
            case'-' -> TokenKind.SUBTRACTION_OPERATOR;
            case'*' -> TokenKind.MULTIPLICATION_OPERATOR;
            case'/' -> TokenKind.DIVISION_OPERATOR;
            case'\\' -> TokenKind.BACKWARD_SLASH_OPERATOR;
            case'^' -> TokenKind.EXPONENTIATION_OPERATOR;
            case'&' -> TokenKind.AMPERSAND;
            case'.' -> TokenKind.PERIOD_OPERATOR;
            case'!' -> TokenKind.EXCLAMATION_MARK;
            case'#' -> TokenKind.OCTOTHORPE;
            case'$' -> TokenKind.DOLLAR_SIGN;
            case'%' -> TokenKind.PERCENT;
            case'@' -> TokenKind.AT_SIGN;
            case'_' -> TokenKind.UNDERSCORE;
            default -> {
                if (Character.isHighSurrogate(c) && !isAtEnd() && Character.isLowSurrogate(peek())) {
                    advance();
                }
                yield TokenKind.UNKNOWN;
            }
        };
        return token(kind, start);
    }

    /**
     * Whether a {@link TokenKind#STRING_LITERAL} token text ends with its closing quote.
     */
    public static boolean isTerminatedString(String text) {
        int i = 1;
        while (i < text.length()) {
            if (text.charAt(i) == '"') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return i == text.length() - 1;
            }
            i++;
        }
        return false;
    }

    // === Helper methods ===

    private boolean match(char expected) {
        if (!isAtEnd() && peek() == expected) {
            advance();
            return true;
        }
        return false;
    }

    private char peek() {
        return isAtEnd() ? '\0' : input.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n' || (c == '\r' && peek() != '\n')) {
            line++;
            column = 1;
        } else if (c != '\r') {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private Token token(TokenKind kind, SourceLocation start) {
        return new Token(kind, input.substring(start.offset(), pos), SourceSpan.of(start, currentLocation()));
    }

    private static boolean isInlineWhitespace(char c) {
        return c != '\n' && c != '\r' && (c == ' ' || c == '\t' || c == '\u00A0' || Character.isWhitespace(c));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
