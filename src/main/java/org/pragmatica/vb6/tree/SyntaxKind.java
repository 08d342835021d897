package org.pragmatica.vb6.tree;

import java.util.Locale;

/**
 * Common view over token kinds and node kinds, used wherever a tree position is described
 * without caring whether it is a leaf or a composite.
 */
public interface SyntaxKind {

    /**
     * Stable PascalCase name used in debug dumps and tree patterns, e.g. {@code IfKeyword}.
     */
    String displayName();

    /**
     * Converts an enum constant name such as {@code BY_VAL_KEYWORD} to {@code ByValKeyword}.
     */
    static String pascalCase(String constantName) {
        var sb = new StringBuilder(constantName.length());
        for (var part : constantName.split("_")) {
            if (part.isEmpty()) {
                continue;
            }
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
