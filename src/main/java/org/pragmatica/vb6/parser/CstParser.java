package org.pragmatica.vb6.parser;

import com.google.common.base.Preconditions;
import org.pragmatica.vb6.lexer.Lexer;
import org.pragmatica.vb6.lexer.SourceBuffer;
import org.pragmatica.vb6.tree.ConcreteSyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Hand-written recursive-descent parsing engine: lexes the buffer, runs the statement
 * productions over a fresh {@link ParsingContext} and packages the result.
 */
public final class CstParser implements Parser {
    private static final Logger LOG = LoggerFactory.getLogger(CstParser.class);

    private final ParserConfig config;

    private CstParser(ParserConfig config) {
        this.config = config;
    }

    public static CstParser create(ParserConfig config) {
        return new CstParser(Preconditions.checkNotNull(config, "config"));
    }

    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseResult parse(String fileName, String source) {
        return parse(SourceBuffer.of(fileName, source));
    }

    @Override
    public ParseResult parse(SourceBuffer source) {
        Preconditions.checkNotNull(source, "source");
        if (source.isEmpty()) {
            LOG.debug("{}: empty input, no tree", source.fileName());
            return new ParseResult(Optional.empty(), List.of());
        }
        var tokens = Lexer.tokenize(source.text());
        LOG.debug("{}: parsing {} tokens", source.fileName(), tokens.size());

        var ctx = ParsingContext.create(source, tokens, config);
        new StatementParser(ctx).parseModule();
        var tree = ConcreteSyntaxTree.of(source, ctx.root());
        var failures = ctx.failures();

        LOG.debug("{}: parsed with {} failure(s)", source.fileName(), failures.size());
        return new ParseResult(Optional.of(tree), failures);
    }
}
