package org.pragmatica.vb6.parser;

import com.google.common.base.Preconditions;
import org.pragmatica.vb6.error.RecoveryStrategy;

import java.util.Objects;

/**
 * Parser configuration options.
 *
 * @param recoveryStrategy what to do after a failure
 * @param maxNestingDepth  deepest nesting of blocks and sub-expressions parsed before the rest of
 *                         the line is given up as too deep
 */
public record ParserConfig(
    RecoveryStrategy recoveryStrategy,
    int maxNestingDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        RecoveryStrategy.ADVANCED,
        256
    );

    public ParserConfig {
        Objects.requireNonNull(recoveryStrategy, "recoveryStrategy");
        Preconditions.checkArgument(maxNestingDepth > 0, "maxNestingDepth must be positive, got %s", maxNestingDepth);
    }

    public ParserConfig withRecoveryStrategy(RecoveryStrategy strategy) {
        return new ParserConfig(strategy, maxNestingDepth);
    }

    public ParserConfig withMaxNestingDepth(int depth) {
        return new ParserConfig(recoveryStrategy, depth);
    }
}
