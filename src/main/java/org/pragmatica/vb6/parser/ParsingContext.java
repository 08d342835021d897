package org.pragmatica.vb6.parser;

import com.google.common.base.Preconditions;
import org.pragmatica.vb6.error.Failure;
import org.pragmatica.vb6.error.FailureKind;
import org.pragmatica.vb6.error.RecoveryStrategy;
import org.pragmatica.vb6.lexer.KeywordClassifier;
import org.pragmatica.vb6.lexer.NamePosition;
import org.pragmatica.vb6.lexer.SourceBuffer;
import org.pragmatica.vb6.lexer.Token;
import org.pragmatica.vb6.lexer.TokenKind;
import org.pragmatica.vb6.tree.CstNode;
import org.pragmatica.vb6.tree.NodeKind;
import org.pragmatica.vb6.tree.SourceLocation;
import org.pragmatica.vb6.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mutable state of a single parse: token cursor, tree under construction, failures and
 * recovery bookkeeping. One instance per parse call; never shared.
 *
 * <p>Trivia handling: inline trivia (whitespace and line continuations) is attached to whatever
 * node is open when the next significant token is consumed. Productions therefore call
 * {@link #skipTrivia()} before opening a child node, so whitespace between children stays in
 * the parent.
 */
public final class ParsingContext {
    private static final Logger LOG = LoggerFactory.getLogger(ParsingContext.class);

    private final SourceBuffer source;
    private final List<Token> tokens;
    private final ParserConfig config;
    private final Deque<Frame> frames;
    private final List<Failure> failures;
    private final Deque<BlockKind> openBlocks;

    private int pos;
    private int singleLineDepth;
    private int deferredNextClosures;
    private int nestingDepth;
    private CstNode.Composite finishedRoot;

    // Error recovery state
    private boolean recovering;
    private boolean halted;

    private ParsingContext(SourceBuffer source, List<Token> tokens, ParserConfig config) {
        this.source = source;
        this.tokens = tokens;
        this.config = config;
        this.frames = new ArrayDeque<>();
        this.failures = new ArrayList<>();
        this.openBlocks = new ArrayDeque<>();
        this.pos = 0;
    }

    public static ParsingContext create(SourceBuffer source, List<Token> tokens, ParserConfig config) {
        return new ParsingContext(source, List.copyOf(tokens), config);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public boolean isAtEnd() {
        return pos >= tokens.size();
    }

    /**
     * Location where the next token starts, or end of input.
     */
    public SourceLocation location() {
        if (pos < tokens.size()) {
            return tokens.get(pos)
                         .span()
                         .start();
        }
        if (tokens.isEmpty()) {
            return SourceLocation.START;
        }
        return tokens.get(tokens.size() - 1)
                     .span()
                     .end();
    }

    // === Lookahead ===

    /**
     * Index of the {@code n}-th significant token from the cursor, skipping inline trivia only.
     * Newlines and comments count as significant here: they end logical lines.
     */
    public int peekIndex(int n) {
        int index = pos;
        int remaining = n;
        while (true) {
            while (index < tokens.size() && tokens.get(index)
                                                  .kind()
                                                  .isInlineTrivia()) {
                index++;
            }
            if (remaining == 0 || index >= tokens.size()) {
                return index;
            }
            remaining--;
            index++;
        }
    }

    /**
     * First index at or after {@code index} that is not inline trivia.
     */
    public int skipInlineTrivia(int index) {
        int result = index;
        while (result < tokens.size() && tokens.get(result)
                                               .kind()
                                               .isInlineTrivia()) {
            result++;
        }
        return result;
    }

    /**
     * Whether only inline trivia separates the cursor from the start of a physical line.
     */
    public boolean atLineStart() {
        int index = pos - 1;
        while (index >= 0 && tokens.get(index)
                                   .kind()
                                   .isInlineTrivia()) {
            index--;
        }
        return index < 0 || tokens.get(index)
                                  .is(TokenKind.NEWLINE);
    }

    public TokenKind kindAt(int index) {
        return index < tokens.size() ? tokens.get(index)
                                             .kind() : TokenKind.END_OF_INPUT;
    }

    public Token tokenAt(int index) {
        return tokens.get(index);
    }

    public int tokenCount() {
        return tokens.size();
    }

    public TokenKind peek() {
        return kindAt(peekIndex(0));
    }

    public TokenKind peek(int n) {
        return kindAt(peekIndex(n));
    }

    /**
     * Whether the token at {@code index} directly follows the previous token, with no
     * whitespace or line continuation in between.
     */
    public boolean touchesPrevious(int index) {
        return index > 0 && index < tokens.size() && !tokens.get(index - 1)
                                                            .kind()
                                                            .isInlineTrivia();
    }

    public boolean at(TokenKind kind) {
        return peek() == kind;
    }

    public boolean atAny(TokenKind... kinds) {
        var next = peek();
        for (var kind : kinds) {
            if (next == kind) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the logical statement ends at the next significant token.
     */
    public boolean atStatementEnd() {
        return isStatementEnd(peek());
    }

    public boolean isStatementEnd(TokenKind kind) {
        return kind == TokenKind.NEWLINE
               || kind == TokenKind.COLON_OPERATOR
               || kind == TokenKind.END_OF_INPUT
               || kind.isComment()
               || (kind == TokenKind.ELSE_KEYWORD && singleLineDepth > 0);
    }

    /**
     * Whether the next significant token is a word usable in the given position.
     */
    public boolean atName(NamePosition position) {
        return KeywordClassifier.accepts(peek(), position);
    }

    // === Consumption ===

    /**
     * Attach pending whitespace and line continuations to the open node.
     */
    public void skipTrivia() {
        while (pos < tokens.size() && tokens.get(pos)
                                            .kind()
                                            .isInlineTrivia()) {
            appendLeaf(tokens.get(pos++));
        }
    }

    /**
     * Consume pending trivia and the next significant token.
     */
    public Token bump() {
        skipTrivia();
        Preconditions.checkState(pos < tokens.size(), "bump past end of input");
        var token = tokens.get(pos++);
        appendLeaf(token);
        return token;
    }

    /**
     * Consume the next significant token re-tagged with another kind.
     */
    public Token bumpAs(TokenKind kind) {
        skipTrivia();
        Preconditions.checkState(pos < tokens.size(), "bump past end of input");
        var token = tokens.get(pos++)
                          .withKind(kind);
        appendLeaf(token);
        return token;
    }

    /**
     * Consume a word, tagged as the classifier decides for the given position.
     */
    public Token bumpName(NamePosition position) {
        return bumpAs(KeywordClassifier.classify(peek(), position));
    }

    public boolean eat(TokenKind kind) {
        if (at(kind)) {
            bump();
            return true;
        }
        return false;
    }

    /**
     * Consume the expected token or record a failure and recover to the end of the line.
     */
    public boolean expect(TokenKind kind, String description) {
        if (eat(kind)) {
            return true;
        }
        recover(FailureKind.MISSING_TOKEN, "expected " + description, "found " + describeNext());
        return false;
    }

    public boolean expectName(NamePosition position, String description) {
        if (atName(position)) {
            bumpName(position);
            return true;
        }
        recover(FailureKind.MISSING_TOKEN, "expected " + description, "found " + describeNext());
        return false;
    }

    /**
     * Consume the end of a statement: trailing trivia, an optional comment and the newline.
     * A {@code :} separator is left for the enclosing statement list. Inside a single-line
     * {@code If} nothing is consumed; the {@code If} owns the line end.
     */
    public void consumeStatementEnd() {
        if (singleLineDepth > 0) {
            if (!atStatementEnd()) {
                recover(FailureKind.UNEXPECTED_TOKEN, "unexpected " + describeNext(), "expected end of statement");
            }
            return;
        }
        if (!atStatementEnd()) {
            recover(FailureKind.UNEXPECTED_TOKEN, "unexpected " + describeNext(), "expected end of statement");
        }
        consumeLineEnd();
    }

    /**
     * Consume trailing trivia, an optional comment and a newline, if present.
     */
    public void consumeLineEnd() {
        if (peek().isComment()) {
            bump();
        }
        if (at(TokenKind.NEWLINE)) {
            bump();
            exitRecovery();
        } else if (peek() == TokenKind.END_OF_INPUT) {
            skipTrivia();
        }
    }

    public String describeNext() {
        int index = peekIndex(0);
        if (index >= tokens.size()) {
            return "end of input";
        }
        var token = tokens.get(index);
        if (token.is(TokenKind.NEWLINE)) {
            return "end of line";
        }
        if (token.kind()
                 .isComment()) {
            return "comment";
        }
        return "'" + token.text() + "'";
    }

    // === Tree Building ===

    public void startNode(NodeKind kind) {
        frames.push(new Frame(kind));
    }

    /**
     * Number of children in the open node, to be passed to {@link #startNodeAt(int, NodeKind)}.
     */
    public int checkpoint() {
        return frames.peek().children.size();
    }

    /**
     * Open a node that adopts the children appended to the current node since {@code checkpoint}.
     */
    public void startNodeAt(int checkpoint, NodeKind kind) {
        var parent = frames.peek();
        var frame = new Frame(kind);
        var adopted = parent.children.subList(checkpoint, parent.children.size());
        frame.children.addAll(adopted);
        adopted.clear();
        frames.push(frame);
    }

    public CstNode.Composite finishNode() {
        var frame = frames.pop();
        var span = frame.children.isEmpty()
                   ? SourceSpan.at(location())
                   : frame.children.get(0)
                                   .span()
                                   .cover(frame.children.get(frame.children.size() - 1)
                                                        .span());
        var node = new CstNode.Composite(frame.kind, span, frame.children);
        if (frames.isEmpty()) {
            finishedRoot = node;
        } else {
            frames.peek().children.add(node);
        }
        return node;
    }

    public CstNode.Composite root() {
        Preconditions.checkState(finishedRoot != null && frames.isEmpty(), "tree is not finished");
        return finishedRoot;
    }

    private void appendLeaf(Token token) {
        frames.peek().children.add(new CstNode.Leaf(token));
    }

    // === Failure Collection ===

    /**
     * Record a failure and wrap the offending tokens, up to the next synchronization point, in an
     * {@code Unknown} node. Does nothing while the current line is already being recovered.
     */
    public void recover(FailureKind kind, String message, String label) {
        if (halted || recovering) {
            return;
        }
        skipTrivia();
        startNode(NodeKind.UNKNOWN);
        if (config.recoveryStrategy() == RecoveryStrategy.NONE) {
            while (pos < tokens.size()) {
                appendLeaf(tokens.get(pos++));
            }
        } else {
            int end = syncIndex();
            while (pos < end) {
                appendLeaf(tokens.get(pos++));
            }
        }
        var unknown = finishNode();
        addFailure(Failure.of(kind, unknown.span(), message)
                          .withLabel(label));
        enterRecovery();
    }

    /**
     * Record that a construct ran out of input or was cut short by a foreign terminator.
     */
    public void missingTerminator(String terminator, String construct) {
        if (halted) {
            return;
        }
        startNode(NodeKind.UNKNOWN);
        var unknown = finishNode();
        addFailure(Failure.of(FailureKind.MISSING_TERMINATOR, unknown.span(), "missing '" + terminator + "'")
                          .withLabel("found " + describeNext())
                          .withHelp(construct + " must be closed with '" + terminator + "'"));
    }

    /**
     * Wrap exactly one token in an {@code Unknown} node, regardless of recovery state. Used by
     * statement lists to guarantee forward progress.
     */
    public void forceProgress() {
        skipTrivia();
        if (pos >= tokens.size()) {
            return;
        }
        boolean silent = halted || recovering;
        startNode(NodeKind.UNKNOWN);
        appendLeaf(tokens.get(pos++));
        var unknown = finishNode();
        if (!silent) {
            addFailure(Failure.of(FailureKind.UNEXPECTED_TOKEN, unknown.span(), "unexpected '" + unknown.text() + "'")
                              .withLabel("not a statement"));
            enterRecovery();
        }
    }

    public void addFailure(Failure failure) {
        if (halted) {
            return;
        }
        failures.add(failure);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Recorded {}", failure.formatSimple(source.fileName()));
        }
        if (config.recoveryStrategy() == RecoveryStrategy.NONE) {
            halted = true;
        }
    }

    public List<Failure> failures() {
        return List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    private int syncIndex() {
        int index = pos;
        while (index < tokens.size() && !isStatementEnd(tokens.get(index)
                                                               .kind())) {
            index++;
        }
        while (index > pos && tokens.get(index - 1)
                                    .kind()
                                    .isInlineTrivia()) {
            index--;
        }
        return index;
    }

    // === Error Recovery State ===

    public void enterRecovery() {
        recovering = true;
    }

    /**
     * Leave recovery mode; called at synchronization points (newline, {@code :}).
     */
    public void exitRecovery() {
        recovering = false;
    }

    public boolean isRecovering() {
        return recovering;
    }

    // === Block Tracking ===

    public void enterBlock(BlockKind kind) {
        openBlocks.push(kind);
    }

    public void exitBlock() {
        openBlocks.pop();
    }

    /**
     * Whether the upcoming line closes some open block.
     */
    public boolean atOpenBlockCloser() {
        if (atDeferredNext()) {
            return true;
        }
        var first = peek();
        var second = peek(1);
        for (var block : openBlocks) {
            if (block.isClosedBy(first, second)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Consume {@code End X} closing the given block, or record the missing terminator.
     */
    public boolean closeWithEnd(BlockKind kind, String construct) {
        if (at(TokenKind.END_KEYWORD) && kind.isClosedBy(TokenKind.END_KEYWORD, peek(1))) {
            bump();
            bump();
            consumeStatementEnd();
            return true;
        }
        missingTerminator(kind.terminator(), construct);
        return false;
    }

    /**
     * Leave the rest of {@code Next i, j} to the enclosing {@code For}. Only possible while
     * another {@code For} is open.
     */
    public boolean deferNextClosure() {
        if (!openBlocks.contains(BlockKind.FOR)) {
            return false;
        }
        deferredNextClosures++;
        return true;
    }

    /**
     * Whether the next token is the {@code ,} of a shared {@code Next} owed to an enclosing loop.
     */
    public boolean atDeferredNext() {
        return deferredNextClosures > 0 && at(TokenKind.COMMA);
    }

    public void takeDeferredNext() {
        deferredNextClosures--;
    }

    public void enterSingleLine() {
        singleLineDepth++;
    }

    public void exitSingleLine() {
        singleLineDepth--;
    }

    public boolean inSingleLine() {
        return singleLineDepth > 0;
    }

    /**
     * Enter one level of nesting. Past the configured limit the rest of the line is recovered
     * as too deep and {@code false} is returned; the caller must not call {@link #exitNesting()}.
     */
    public boolean enterNesting() {
        if (nestingDepth >= config.maxNestingDepth()) {
            recover(FailureKind.NESTING_TOO_DEEP,
                    "nesting deeper than " + config.maxNestingDepth() + " levels",
                    "parsing gives up here");
            return false;
        }
        nestingDepth++;
        return true;
    }

    public void exitNesting() {
        nestingDepth--;
    }

    // === Accessors ===

    public SourceBuffer source() {
        return source;
    }

    public ParserConfig config() {
        return config;
    }

    private static final class Frame {
        private final NodeKind kind;
        private final List<CstNode> children = new ArrayList<>();

        private Frame(NodeKind kind) {
            this.kind = kind;
        }
    }
}
