package org.pragmatica.vb6.query;

import org.pragmatica.vb6.tree.CstNode;

/**
 * Canonical text dump of a tree, one node per line:
 * <pre>
 * Root@0..8
 *   AssignmentStatement@0..8
 *     IdentifierExpression@0..1
 *       Identifier@0..1 "x"
 *     Whitespace@1..2 " "
 * </pre>
 * Nesting is shown by two spaces per level; leaves carry their text, escaped. The output
 * depends only on the tree, so it is stable for a given input.
 */
public final class DebugTreePrinter {
    private static final String INDENT = "  ";

    private DebugTreePrinter() {}

    public static String print(CstNode node) {
        var sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private static void print(CstNode node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth))
          .append(node.kind()
                      .displayName())
          .append('@')
          .append(node.span());
        if (node instanceof CstNode.Leaf leaf) {
            sb.append(' ')
              .append(quote(leaf.text()));
        }
        sb.append('\n');
        for (var child : node.children()) {
            print(child, depth + 1, sb);
        }
    }

    /**
     * Double-quoted text with backslash, quote and control characters escaped.
     */
    public static String quote(String text) {
        var sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
