package org.gta3sc.compiler.frontend.parser.ast;

import org.gta3sc.compiler.frontend.lexer.TokenSpan;
import org.gta3sc.compiler.frontend.lexer.TokenStream;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The view of a parsed syntax node that diagnostics need: whether it carries source text,
 * where that text is, and which token stream it came from.
 */
public interface SyntaxNode {

    /**
     * @return {@code true} if this node was produced from a token (an identifier, a literal),
     *         {@code false} for purely structural nodes.
     */
    boolean hasText();

    /**
     * @return The span of this node's token; meaningful only if {@link #hasText()}.
     */
    TokenSpan getToken();

    /**
     * Returns the direct children in source order.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<? extends SyntaxNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Resolves the non-owning reference to the originating token stream.
     *
     * @return The stream, or empty if it has already been released.
     */
    Optional<TokenStream> tokenStream();
}
