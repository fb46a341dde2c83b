package org.gta3sc.compiler.diagnostics;

import org.gta3sc.compiler.frontend.lexer.TextStream;
import org.gta3sc.compiler.frontend.lexer.TokenSpan;
import org.gta3sc.compiler.frontend.parser.ast.SyntaxNode;
import org.gta3sc.compiler.program.Script;

import java.util.Objects;

/**
 * Where in the source a diagnostic applies. Contexts are borrowed for the duration of a single
 * report; the {@link DiagnosticsEngine} never keeps them.
 * <p>
 * Line and column numbers are 1-based; {@code 0} means unknown.
 */
public sealed interface SourceContext permits SourceContext.NoContext, SourceContext.RawPosition,
        SourceContext.UnitContext, SourceContext.TokenContext, SourceContext.NodeContext {

    /**
     * @return The context without any location.
     */
    static SourceContext none() {
        return NoContext.INSTANCE;
    }

    /**
     * @param stream The source text, may be {@code null} if unavailable.
     * @param name   The display name, may be {@code null}.
     * @param line   The 1-based line, or 0.
     * @param column The 1-based column, or 0.
     * @return A raw position context.
     */
    static SourceContext at(TextStream stream, String name, int line, int column) {
        return new RawPosition(stream, name, line, column);
    }

    /**
     * @param script The translation unit.
     * @return A context naming the whole unit.
     */
    static SourceContext of(Script script) {
        return new UnitContext(script);
    }

    /**
     * @param stream The source text.
     * @param token  The token span.
     * @return A token context.
     */
    static SourceContext of(TextStream stream, TokenSpan token) {
        return new TokenContext(stream, token.begin(), token.end());
    }

    /**
     * @param node The syntax node.
     * @return A node context.
     */
    static SourceContext of(SyntaxNode node) {
        return new NodeContext(node);
    }

    /**
     * No location available.
     */
    enum NoContext implements SourceContext {
        INSTANCE
    }

    /**
     * An explicit position.
     *
     * @param stream The source text used to quote the line, or {@code null}.
     * @param name   The display name, or {@code null}.
     * @param line   The 1-based line, or 0 if unknown.
     * @param column The 1-based column, or 0 if unknown.
     */
    record RawPosition(TextStream stream, String name, int line, int column) implements SourceContext {
        public RawPosition {
            if (line < 0 || column < 0) {
                throw new IllegalArgumentException("Line and column must not be negative");
            }
        }
    }

    /**
     * A whole translation unit: the file is known, the line and column are not.
     *
     * @param script The translation unit.
     */
    record UnitContext(Script script) implements SourceContext {
        public UnitContext {
            Objects.requireNonNull(script, "script");
        }
    }

    /**
     * A token in a stream. If {@code begin == end} the context has no position within the stream.
     *
     * @param stream The source text.
     * @param begin  Offset of the first character.
     * @param end    Offset one past the last character.
     */
    record TokenContext(TextStream stream, int begin, int end) implements SourceContext {
        public TokenContext {
            Objects.requireNonNull(stream, "stream");
        }
    }

    /**
     * A parsed node, located through its own token or its first child that has one.
     *
     * @param node The syntax node.
     */
    record NodeContext(SyntaxNode node) implements SourceContext {
        public NodeContext {
            Objects.requireNonNull(node, "node");
        }
    }
}
