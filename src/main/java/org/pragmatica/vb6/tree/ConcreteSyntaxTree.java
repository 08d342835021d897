package org.pragmatica.vb6.tree;

import com.google.common.base.Preconditions;
import org.pragmatica.vb6.lexer.SourceBuffer;
import org.pragmatica.vb6.query.DebugTreePrinter;

import java.util.List;
import java.util.Optional;

/**
 * A parsed document: the root node together with the source it was built from.
 * Immutable; edits require re-parsing.
 */
public final class ConcreteSyntaxTree {
    private final SourceBuffer source;
    private final CstNode.Composite root;

    private ConcreteSyntaxTree(SourceBuffer source, CstNode.Composite root) {
        this.source = source;
        this.root = root;
    }

    public static ConcreteSyntaxTree of(SourceBuffer source, CstNode.Composite root) {
        Preconditions.checkArgument(root.kind() == NodeKind.ROOT, "root node must be Root, got %s", root.kind());
        return new ConcreteSyntaxTree(source, root);
    }

    public CstNode.Composite root() {
        return root;
    }

    public SourceBuffer source() {
        return source;
    }

    public String fileName() {
        return source.fileName();
    }

    /**
     * Source text reconstructed from the tree's leaves.
     */
    public String text() {
        return root.text();
    }

    /**
     * Canonical indented dump of the tree, stable for a given input.
     */
    public String debugTree() {
        return DebugTreePrinter.print(root);
    }

    public Optional<CstNode> find(SyntaxKind kind) {
        return root.find(kind);
    }

    public List<CstNode> findAll(SyntaxKind kind) {
        return root.findAll(kind);
    }

    public CstCursor cursor() {
        return CstCursor.of(root);
    }

    @Override
    public String toString() {
        return "ConcreteSyntaxTree[" + source.fileName() + ", " + root.children()
                                                                        .size() + " top-level nodes]";
    }
}
