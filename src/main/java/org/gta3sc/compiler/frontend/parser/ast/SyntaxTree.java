package org.gta3sc.compiler.frontend.parser.ast;

import org.gta3sc.compiler.frontend.lexer.TokenSpan;
import org.gta3sc.compiler.frontend.lexer.TokenStream;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Default {@link SyntaxNode} implementation: a node kind, an optional token and ordered children.
 * The token stream is held through a {@link WeakReference}, so a tree never keeps its stream alive.
 */
public final class SyntaxTree implements SyntaxNode {

    /**
     * Coarse node kinds. The parser refines these; the diagnostics only care about text.
     */
    public enum Kind {
        /** A whole translation unit. */
        BLOCK,
        /** A command invocation. */
        COMMAND,
        /** An identifier. */
        IDENTIFIER,
        /** A numeric or string literal. */
        LITERAL,
        /** Any other structural node. */
        OTHER
    }

    private final Kind kind;
    private final TokenSpan token;
    private final boolean hasText;
    private final WeakReference<TokenStream> tokenStream;
    private final List<SyntaxTree> children = new ArrayList<>();

    private SyntaxTree(Kind kind, TokenStream stream, TokenSpan token, boolean hasText) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.token = Objects.requireNonNull(token, "token");
        this.hasText = hasText;
        this.tokenStream = new WeakReference<>(stream);
    }

    /**
     * Creates a node produced from a token.
     *
     * @param kind   The node kind.
     * @param stream The originating token stream.
     * @param token  The token span.
     * @return The new node.
     */
    public static SyntaxTree withText(Kind kind, TokenStream stream, TokenSpan token) {
        return new SyntaxTree(kind, stream, token, true);
    }

    /**
     * Creates a structural node that carries no text of its own.
     *
     * @param kind   The node kind.
     * @param stream The originating token stream.
     * @return The new node.
     */
    public static SyntaxTree structural(Kind kind, TokenStream stream) {
        return new SyntaxTree(kind, stream, TokenSpan.empty(), false);
    }

    /**
     * Appends a child.
     *
     * @param child The child node.
     * @return This node, for chaining.
     */
    public SyntaxTree addChild(SyntaxTree child) {
        children.add(Objects.requireNonNull(child, "child"));
        return this;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public boolean hasText() {
        return hasText;
    }

    @Override
    public TokenSpan getToken() {
        return token;
    }

    @Override
    public List<SyntaxTree> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public Optional<TokenStream> tokenStream() {
        return Optional.ofNullable(tokenStream.get());
    }

    @Override
    public String toString() {
        return "SyntaxTree{" + kind + (hasText ? " " + token : "") + ", children=" + children.size() + '}';
    }
}
