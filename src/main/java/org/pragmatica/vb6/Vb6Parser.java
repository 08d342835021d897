package org.pragmatica.vb6;

import org.pragmatica.vb6.error.RecoveryStrategy;
import org.pragmatica.vb6.lexer.Lexer;
import org.pragmatica.vb6.lexer.Token;
import org.pragmatica.vb6.parser.CstParser;
import org.pragmatica.vb6.parser.ParseResult;
import org.pragmatica.vb6.parser.Parser;
import org.pragmatica.vb6.parser.ParserConfig;

import java.util.List;

/**
 * Entry point for parsing VB6 source.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = Vb6Parser.parseText("Module1.bas", """
 *     Sub Main()
 *         MsgBox "Hello"
 *     End Sub
 *     """);
 *
 * result.tree().ifPresent(tree -> System.out.println(tree.debugTree()));
 * }</pre>
 */
public final class Vb6Parser {
    private static final Parser DEFAULT_PARSER = CstParser.create(ParserConfig.DEFAULT);

    private Vb6Parser() {}

    /**
     * Parse source text with the default configuration.
     */
    public static ParseResult parseText(String fileName, String source) {
        return DEFAULT_PARSER.parse(fileName, source);
    }

    /**
     * Create a parser with custom configuration.
     */
    public static Parser create(ParserConfig config) {
        return CstParser.create(config);
    }

    /**
     * Split source text into tokens, trivia included.
     */
    public static List<Token> tokenize(String source) {
        return Lexer.tokenize(source);
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RecoveryStrategy recoveryStrategy = ParserConfig.DEFAULT.recoveryStrategy();
        private int maxNestingDepth = ParserConfig.DEFAULT.maxNestingDepth();

        private Builder() {}

        public Builder recoveryStrategy(RecoveryStrategy strategy) {
            this.recoveryStrategy = strategy;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(recoveryStrategy, maxNestingDepth));
        }
    }
}
