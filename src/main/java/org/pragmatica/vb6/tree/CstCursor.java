package org.pragmatica.vb6.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Zipper over an immutable CST: a node together with the path from the root to it.
 *
 * <p>Nodes hold no parent references; cursors are cheap, short-lived views that supply parent
 * and sibling navigation on demand.
 */
public final class CstCursor {
    private final CstNode node;
    private final CstCursor parent;
    private final int index;

    private CstCursor(CstNode node, CstCursor parent, int index) {
        this.node = node;
        this.parent = parent;
        this.index = index;
    }

    public static CstCursor of(CstNode root) {
        return new CstCursor(root, null, 0);
    }

    public CstNode node() {
        return node;
    }

    public Optional<CstCursor> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Position of this node among its parent's children, 0 for the root.
     */
    public int index() {
        return index;
    }

    public int depth() {
        int depth = 0;
        for (var current = parent; current != null; current = current.parent) {
            depth++;
        }
        return depth;
    }

    public List<CstCursor> children() {
        var children = node.children();
        var result = new ArrayList<CstCursor>(children.size());
        for (int i = 0; i < children.size(); i++) {
            result.add(new CstCursor(children.get(i), this, i));
        }
        return result;
    }

    public Optional<CstCursor> firstChild() {
        return node.children().isEmpty()
               ? Optional.empty()
               : Optional.of(new CstCursor(node.children().get(0), this, 0));
    }

    public Optional<CstCursor> nextSibling() {
        return sibling(index + 1);
    }

    public Optional<CstCursor> previousSibling() {
        return sibling(index - 1);
    }

    private Optional<CstCursor> sibling(int siblingIndex) {
        if (parent == null || siblingIndex < 0 || siblingIndex >= parent.node.children().size()) {
            return Optional.empty();
        }
        return Optional.of(new CstCursor(parent.node.children().get(siblingIndex), parent, siblingIndex));
    }

    /**
     * Ancestors from the immediate parent up to the root.
     */
    public List<CstCursor> ancestors() {
        var result = new ArrayList<CstCursor>();
        for (var current = parent; current != null; current = current.parent) {
            result.add(current);
        }
        return result;
    }

    /**
     * Nearest ancestor of the given kind.
     */
    public Optional<CstCursor> ancestor(SyntaxKind kind) {
        for (var current = parent; current != null; current = current.parent) {
            if (current.node.is(kind)) {
                return Optional.of(current);
            }
        }
        return Optional.empty();
    }

    /**
     * First node in pre-order (this node included) matching the predicate.
     */
    public Optional<CstCursor> find(Predicate<CstNode> predicate) {
        if (predicate.test(node)) {
            return Optional.of(this);
        }
        for (var child : children()) {
            var found = child.find(predicate);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public Optional<CstCursor> find(SyntaxKind kind) {
        return find(candidate -> candidate.is(kind));
    }

    /**
     * Slash-separated path of kinds from the root, e.g. {@code Root/SubStatement/StatementList}.
     */
    public String path() {
        var kinds = new ArrayList<String>();
        for (var current = this; current != null; current = current.parent) {
            kinds.add(0, current.node.kind()
                                     .displayName());
        }
        return String.join("/", kinds);
    }

    @Override
    public String toString() {
        return path() + "@" + node.span();
    }
}
