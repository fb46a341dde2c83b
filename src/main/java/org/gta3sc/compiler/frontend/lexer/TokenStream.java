package org.gta3sc.compiler.frontend.lexer;

import java.util.Objects;

/**
 * The token stream of one translation unit. Owned by the job compiling that unit; syntax nodes
 * only hold weak references to it, so once the job releases its resources the stream may be
 * collected and nodes can no longer be located in the source.
 */
public final class TokenStream {

    private final TextStream text;

    /**
     * @param text The source text the tokens were scanned from.
     */
    public TokenStream(TextStream text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public TextStream text() {
        return text;
    }

    public String streamName() {
        return text.streamName();
    }
}
