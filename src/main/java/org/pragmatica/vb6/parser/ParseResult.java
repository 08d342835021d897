package org.pragmatica.vb6.parser;

import org.pragmatica.vb6.error.Failure;
import org.pragmatica.vb6.tree.ConcreteSyntaxTree;

import java.util.List;
import java.util.Optional;

/**
 * Result of parsing - best-effort tree and accumulated failures.
 *
 * <p>The tree is present for every non-empty input, however many failures were recorded.
 * Malformed regions appear in it as {@code Unknown} nodes, one per failure.
 *
 * @param tree     the parsed tree, or empty for empty input
 * @param failures failures in source order of discovery (empty on full success)
 */
public record ParseResult(Optional<ConcreteSyntaxTree> tree, List<Failure> failures) {
    public ParseResult {
        failures = List.copyOf(failures);
    }

    /**
     * Check if parsing produced a tree without any failures.
     */
    public boolean isSuccess() {
        return tree.isPresent() && failures.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public boolean hasTree() {
        return tree.isPresent();
    }

    public int failureCount() {
        return failures.size();
    }

    /**
     * Format all failures in Rust style against the parsed source. Empty when there are no
     * failures or no tree to take the source from.
     */
    public String formatFailures() {
        if (failures.isEmpty() || tree.isEmpty()) {
            return "";
        }
        var source = tree.get()
                         .source();
        var sb = new StringBuilder();
        for (var failure : failures) {
            sb.append(failure.format(source));
            sb.append("\n");
        }
        return sb.toString();
    }
}
