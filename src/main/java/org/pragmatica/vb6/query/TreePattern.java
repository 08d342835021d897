package org.pragmatica.vb6.query;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.vb6.lexer.TokenKind;
import org.pragmatica.vb6.tree.NodeKind;
import org.pragmatica.vb6.tree.SyntaxKind;

import java.util.List;
import java.util.Optional;

/**
 * Expected shape of a (sub)tree, checked by {@link TreeMatcher}.
 *
 * <p>Trivia (whitespace, line continuations, newlines and comments) is never part of a pattern;
 * the matcher compares pattern children with the significant children of a node.
 */
public sealed interface TreePattern {

    /**
     * Composite of the given kind whose significant children match {@code children} exactly, in
     * order.
     */
    record Node(NodeKind kind, List<TreePattern> children) implements TreePattern {
        public Node {
            Preconditions.checkNotNull(kind, "kind");
            children = ImmutableList.copyOf(children);
        }
    }

    /**
     * Node or leaf of the given kind; children and text are not looked at.
     */
    record AnyNode(SyntaxKind kind) implements TreePattern {
        public AnyNode {
            Preconditions.checkNotNull(kind, "kind");
        }
    }

    /**
     * Leaf of the given kind, with exactly the given text when one is present.
     */
    record Token(TokenKind kind, Optional<String> text) implements TreePattern {
        public Token {
            Preconditions.checkNotNull(kind, "kind");
            Preconditions.checkNotNull(text, "text");
        }
    }

    /**
     * Matches any single node.
     */
    record Any() implements TreePattern {}

    static TreePattern node(NodeKind kind, TreePattern... children) {
        return new Node(kind, List.of(children));
    }

    static TreePattern anyNode(SyntaxKind kind) {
        return new AnyNode(kind);
    }

    static TreePattern token(TokenKind kind) {
        return new Token(kind, Optional.empty());
    }

    static TreePattern token(TokenKind kind, String text) {
        return new Token(kind, Optional.of(text));
    }

    static TreePattern any() {
        return new Any();
    }

    /**
     * Pattern in the textual notation accepted by {@link TreePatternParser}.
     */
    default String describe() {
        var sb = new StringBuilder();
        describeTo(sb);
        return sb.toString();
    }

    private void describeTo(StringBuilder sb) {
        if (this instanceof Node node) {
            sb.append(node.kind()
                          .displayName())
              .append(" {");
            for (var child : node.children()) {
                sb.append(' ');
                child.describeTo(sb);
            }
            sb.append(" }");
        } else if (this instanceof AnyNode anyNode) {
            sb.append(anyNode.kind()
                             .displayName());
        } else if (this instanceof Token token) {
            sb.append(token.kind()
                           .displayName());
            token.text()
                 .ifPresent(text -> sb.append('(')
                                      .append(DebugTreePrinter.quote(text))
                                      .append(')'));
        } else {
            sb.append('_');
        }
    }
}
