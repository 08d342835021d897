package org.pragmatica.vb6.query;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.vb6.lexer.TokenKind;
import org.pragmatica.vb6.tree.NodeKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parser for the textual tree pattern notation.
 *
 * <pre>{@code
 * pattern  <- '_' / Kind ('(' String ')')? ('{' pattern* '}')?
 * }</pre>
 *
 * <p>Kinds are written by display name ({@code AssignmentStatement}, {@code EqualityOperator}).
 * Braces list the exact significant children of a node; a bare node kind matches the kind only;
 * a parenthesized string matches a token's text. Children may be separated by whitespace or
 * commas. {@code Unknown} names the error node unless followed by a text.
 *
 * <p>Example: {@code AssignmentStatement { IdentifierExpression { Identifier("x") }
 * EqualityOperator NumericLiteralExpression }}.
 */
public final class TreePatternParser {
    private static final ImmutableMap<String, NodeKind> NODE_KINDS = Arrays.stream(NodeKind.values())
                                                                           .collect(ImmutableMap.toImmutableMap(NodeKind::displayName,
                                                                                                                Function.identity()));
    private static final ImmutableMap<String, TokenKind> TOKEN_KINDS = Arrays.stream(TokenKind.values())
                                                                             .collect(ImmutableMap.toImmutableMap(TokenKind::displayName,
                                                                                                                  Function.identity()));

    private final String input;
    private int pos;

    private TreePatternParser(String input) {
        this.input = input;
        this.pos = 0;
    }

    /**
     * Parse one pattern.
     *
     * @throws IllegalArgumentException if the text is not a well-formed pattern or names an
     *                                  unknown kind
     */
    public static TreePattern parse(String text) {
        var parser = new TreePatternParser(text);
        var pattern = parser.parsePattern();
        parser.skipSeparators();
        if (!parser.isAtEnd()) {
            throw parser.error("unexpected '" + parser.peek() + "' after pattern");
        }
        return pattern;
    }

    private TreePattern parsePattern() {
        skipSeparators();
        if (isAtEnd()) {
            throw error("expected pattern");
        }
        if (peek() == '_') {
            pos++;
            return TreePattern.any();
        }
        int start = pos;
        var name = scanName();
        skipWhitespace();
        if (!isAtEnd() && peek() == '(') {
            var kind = tokenKind(name, start);
            pos++;
            skipWhitespace();
            var text = scanString();
            skipWhitespace();
            expect(')');
            return TreePattern.token(kind, text);
        }
        if (!isAtEnd() && peek() == '{') {
            var kind = Optional.ofNullable(NODE_KINDS.get(name))
                               .orElseThrow(() -> errorAt(start, "unknown node kind '" + name + "'"));
            pos++;
            var children = new ArrayList<TreePattern>();
            while (true) {
                skipSeparators();
                if (isAtEnd()) {
                    throw error("unterminated '{' for " + name);
                }
                if (peek() == '}') {
                    pos++;
                    return new TreePattern.Node(kind, children);
                }
                children.add(parsePattern());
            }
        }
        var nodeKind = NODE_KINDS.get(name);
        if (nodeKind != null) {
            return TreePattern.anyNode(nodeKind);
        }
        return TreePattern.token(tokenKind(name, start));
    }

    private TokenKind tokenKind(String name, int start) {
        var kind = TOKEN_KINDS.get(name);
        if (kind == null) {
            throw errorAt(start, "unknown kind '" + name + "'");
        }
        return kind;
    }

    private String scanName() {
        int start = pos;
        while (!isAtEnd() && Character.isLetterOrDigit(peek())) {
            pos++;
        }
        if (start == pos) {
            throw error("expected kind name, found '" + peek() + "'");
        }
        return input.substring(start, pos);
    }

    private String scanString() {
        expect('"');
        var sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = input.charAt(pos++);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd()) {
                break;
            }
            char escaped = input.charAt(pos++);
            sb.append(switch (escaped) {
                case 'n' -> '\n';
                case 'r' -> '\r';
                case 't' -> '\t';
                default -> escaped;
            });
        }
        if (isAtEnd()) {
            throw error("unterminated string");
        }
        pos++;
        return sb.toString();
    }

    private void expect(char c) {
        if (isAtEnd() || peek() != c) {
            throw error("expected '" + c + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private void skipSeparators() {
        while (!isAtEnd() && (Character.isWhitespace(peek()) || peek() == ',')) {
            pos++;
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private IllegalArgumentException error(String message) {
        return errorAt(pos, message);
    }

    private static IllegalArgumentException errorAt(int position, String message) {
        return new IllegalArgumentException("Invalid tree pattern at " + position + ": " + message);
    }
}
