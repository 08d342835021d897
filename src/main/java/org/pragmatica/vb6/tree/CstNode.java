package org.pragmatica.vb6.tree;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.vb6.lexer.Token;
import org.pragmatica.vb6.lexer.TokenKind;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Concrete Syntax Tree node - lossless representation preserving all source details.
 *
 * <p>A node is either a {@link Leaf} wrapping one token (trivia included) or a {@link Composite}
 * whose children, concatenated, cover exactly its own span. Nodes do not know their parent;
 * use {@link CstCursor} for upward navigation.
 */
public sealed interface CstNode {

    SyntaxKind kind();

    SourceSpan span();

    List<CstNode> children();

    void appendText(StringBuilder sb);

    /**
     * Exact source text covered by this node.
     */
    default String text() {
        var sb = new StringBuilder(span().length());
        appendText(sb);
        return sb.toString();
    }

    /**
     * Leaf node wrapping a single token.
     */
    record Leaf(Token token) implements CstNode {
        @Override
        public TokenKind kind() {
            return token.kind();
        }

        @Override
        public SourceSpan span() {
            return token.span();
        }

        @Override
        public List<CstNode> children() {
            return List.of();
        }

        @Override
        public void appendText(StringBuilder sb) {
            sb.append(token.text());
        }

        @Override
        public String text() {
            return token.text();
        }
    }

    /**
     * Interior node with an ordered list of children.
     */
    record Composite(NodeKind kind, SourceSpan span, List<CstNode> children) implements CstNode {
        public Composite {
            children = ImmutableList.copyOf(children);
        }

        @Override
        public void appendText(StringBuilder sb) {
            for (var child : children) {
                child.appendText(sb);
            }
        }
    }

    // === Classification ===

    default boolean is(SyntaxKind other) {
        return kind() == other;
    }

    default boolean isToken() {
        return this instanceof Leaf;
    }

    default boolean isTrivia() {
        return this instanceof Leaf leaf && leaf.token().isTrivia();
    }

    default boolean isSignificant() {
        return !isTrivia();
    }

    default boolean isWhitespace() {
        return is(TokenKind.WHITESPACE) || is(TokenKind.LINE_CONTINUATION);
    }

    default boolean isNewline() {
        return is(TokenKind.NEWLINE);
    }

    default boolean isComment() {
        return is(TokenKind.END_OF_LINE_COMMENT) || is(TokenKind.REM_COMMENT);
    }

    // === Children ===

    default int childCount() {
        return children().size();
    }

    default CstNode childAt(int index) {
        Preconditions.checkElementIndex(index, children().size(), "child index");
        return children().get(index);
    }

    default Optional<CstNode> firstChild() {
        return children().isEmpty() ? Optional.empty() : Optional.of(children().get(0));
    }

    default Optional<CstNode> lastChild() {
        var children = children();
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(children.size() - 1));
    }

    default List<CstNode> childrenOfKind(SyntaxKind kind) {
        return children().stream()
                         .filter(child -> child.is(kind))
                         .toList();
    }

    default Optional<CstNode> firstChildOfKind(SyntaxKind kind) {
        return children().stream()
                         .filter(child -> child.is(kind))
                         .findFirst();
    }

    default boolean containsKind(SyntaxKind kind) {
        return children().stream()
                         .anyMatch(child -> child.is(kind));
    }

    /**
     * Children that are not whitespace, newlines, comments or line continuations.
     */
    default List<CstNode> significantChildren() {
        return children().stream()
                         .filter(CstNode::isSignificant)
                         .toList();
    }

    default List<CstNode> compositeChildren() {
        return children().stream()
                         .filter(child -> child instanceof Composite)
                         .toList();
    }

    // === Search (pre-order, this node included) ===

    default Stream<CstNode> descendants() {
        return Stream.concat(Stream.of(this),
                             children().stream()
                                       .flatMap(CstNode::descendants));
    }

    default Optional<CstNode> find(SyntaxKind kind) {
        return findFirst(node -> node.is(kind));
    }

    default List<CstNode> findAll(SyntaxKind kind) {
        return findAll(node -> node.is(kind));
    }

    default Optional<CstNode> findFirst(Predicate<CstNode> predicate) {
        return descendants().filter(predicate)
                            .findFirst();
    }

    default List<CstNode> findAll(Predicate<CstNode> predicate) {
        return descendants().filter(predicate)
                            .toList();
    }

    /**
     * All leaves under this node in document order.
     */
    default List<Token> tokens() {
        return descendants().filter(node -> node instanceof Leaf)
                            .map(node -> ((Leaf) node).token())
                            .toList();
    }
}
