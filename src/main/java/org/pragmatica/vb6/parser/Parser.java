package org.pragmatica.vb6.parser;

import org.pragmatica.vb6.lexer.SourceBuffer;

/**
 * Parser interface - parses VB6 source text into a lossless concrete syntax tree.
 *
 * <p>Implementations are stateless between calls and may be shared across threads.
 */
public interface Parser {

    /**
     * Parse source text. The file name is used only to label failures.
     */
    ParseResult parse(String fileName, String source);

    /**
     * Parse an already prepared source buffer.
     */
    ParseResult parse(SourceBuffer source);
}
