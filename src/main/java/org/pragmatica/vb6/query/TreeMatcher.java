package org.pragmatica.vb6.query;

import org.pragmatica.vb6.tree.ConcreteSyntaxTree;
import org.pragmatica.vb6.tree.CstNode;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Structural comparison of a tree against a {@link TreePattern}.
 *
 * <p>Mismatches are reported for the first divergent node in document order, with its path from
 * the matched node, e.g. {@code Root/AssignmentStatement[0]/CallExpression[2]}. The index is the
 * position among the parent's significant children.
 */
public final class TreeMatcher {
    private TreeMatcher() {}

    /**
     * Compare a node with a pattern.
     *
     * @return empty when the node matches, otherwise a description of the first difference
     */
    public static Optional<String> match(CstNode node, TreePattern pattern) {
        return match(node, pattern, node.kind()
                                        .displayName());
    }

    public static Optional<String> match(ConcreteSyntaxTree tree, TreePattern pattern) {
        return match(tree.root(), pattern);
    }

    public static Optional<String> match(CstNode node, String pattern) {
        return match(node, TreePatternParser.parse(pattern));
    }

    /**
     * @throws AssertionError naming the first divergent node when the node does not match
     */
    public static void assertTree(CstNode node, TreePattern pattern) {
        match(node, pattern).ifPresent(mismatch -> {
            throw new AssertionError(mismatch);
        });
    }

    public static void assertTree(CstNode node, String pattern) {
        assertTree(node, TreePatternParser.parse(pattern));
    }

    public static void assertTree(ConcreteSyntaxTree tree, String pattern) {
        assertTree(tree.root(), pattern);
    }

    private static Optional<String> match(CstNode node, TreePattern pattern, String path) {
        if (pattern instanceof TreePattern.Any) {
            return Optional.empty();
        }
        if (pattern instanceof TreePattern.AnyNode anyNode) {
            return expectKind(node, anyNode.kind()
                                           .displayName(), node.is(anyNode.kind()), path);
        }
        if (pattern instanceof TreePattern.Token token) {
            var kindMismatch = expectKind(node, token.kind()
                                                     .displayName(), node.isToken() && node.is(token.kind()), path);
            if (kindMismatch.isPresent()) {
                return kindMismatch;
            }
            return token.text()
                        .filter(text -> !text.equals(node.text()))
                        .map(text -> mismatch(path,
                                              "expected text " + DebugTreePrinter.quote(text),
                                              DebugTreePrinter.quote(node.text())));
        }
        var expected = (TreePattern.Node) pattern;
        var kindMismatch = expectKind(node, expected.kind()
                                                    .displayName(), !node.isToken() && node.is(expected.kind()), path);
        if (kindMismatch.isPresent()) {
            return kindMismatch;
        }
        var actualChildren = node.significantChildren();
        var expectedChildren = expected.children();
        int common = Math.min(actualChildren.size(), expectedChildren.size());
        for (int i = 0; i < common; i++) {
            var child = actualChildren.get(i);
            var childPath = path + "/" + child.kind()
                                              .displayName() + "[" + i + "]";
            var childMismatch = match(child, expectedChildren.get(i), childPath);
            if (childMismatch.isPresent()) {
                return childMismatch;
            }
        }
        if (actualChildren.size() != expectedChildren.size()) {
            return Optional.of(mismatch(path,
                                        "expected " + expectedChildren.size() + " children",
                                        actualChildren.size() + " " + describe(actualChildren)));
        }
        return Optional.empty();
    }

    private static Optional<String> expectKind(CstNode node, String expectedKind, boolean matches, String path) {
        if (matches) {
            return Optional.empty();
        }
        return Optional.of(mismatch(path, "expected " + expectedKind, describe(node)));
    }

    private static String mismatch(String path, String expected, String actual) {
        return "at " + path + ": " + expected + ", found " + actual;
    }

    private static String describe(CstNode node) {
        var name = node.kind()
                       .displayName();
        return node.isToken() ? name + "(" + DebugTreePrinter.quote(node.text()) + ")" : name;
    }

    private static String describe(List<CstNode> nodes) {
        return nodes.stream()
                    .map(TreeMatcher::describe)
                    .collect(Collectors.joining(", ", "[", "]"));
    }
}
