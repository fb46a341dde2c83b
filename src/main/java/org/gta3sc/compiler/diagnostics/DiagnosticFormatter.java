package org.gta3sc.compiler.diagnostics;

import org.gta3sc.compiler.frontend.lexer.LineColumn;
import org.gta3sc.compiler.frontend.lexer.TextStream;
import org.gta3sc.compiler.frontend.lexer.TokenStream;
import org.gta3sc.compiler.frontend.parser.ast.SyntaxNode;
import org.slf4j.helpers.MessageFormatter;

import java.util.Optional;

/**
 * Resolves a {@link SourceContext} to a file, line and column and renders diagnostics in the
 * line format IDE integrations and test harnesses parse:
 * <pre>
 * main.sc:12:5: error: unknown command 'FOO'
 *  FOO 1 2
 *      ^
 * </pre>
 * Message templates use {@code {}} placeholders.
 */
public final class DiagnosticFormatter {

    /** Prefix used when no file name is known. */
    public static final String PROGRAM_TAG = "gta3sc";

    /** Severity label of diagnostics that replace an unresolvable node context. */
    public static final String INTERNAL_ERROR_LABEL = "internal_error";

    /** Message of diagnostics that replace an unresolvable node context. */
    public static final String UNRESOLVED_NODE_MESSAGE = "context.tokenStream() == null during formatError";

    private static final Object[] NO_ARGS = new Object[0];

    private DiagnosticFormatter() {}

    /**
     * A resolved location.
     *
     * @param stream The text to quote, or {@code null}.
     * @param name   The display name, or {@code null}.
     * @param line   The 1-based line, or 0.
     * @param column The 1-based column, or 0.
     */
    public record Location(TextStream stream, String name, int line, int column) {
        static final Location NOWHERE = new Location(null, null, 0, 0);
    }

    /**
     * Resolves, interpolates and renders one diagnostic.
     * <p>
     * A {@link SourceContext.NodeContext} that cannot be located (no token anywhere, or its token
     * stream has been released) is replaced by an internal error without location, so the
     * defect stays visible instead of silently losing the position.
     *
     * @param type     The severity.
     * @param context  Where the diagnostic applies.
     * @param template The message template.
     * @param args     The template arguments.
     * @return The rendered diagnostic.
     */
    public static Diagnostic format(Diagnostic.Type type, SourceContext context, String template, Object... args) {
        Optional<Location> resolved = resolve(context);
        if (resolved.isEmpty()) {
            String rendered = render(INTERNAL_ERROR_LABEL, Location.NOWHERE, UNRESOLVED_NODE_MESSAGE);
            return new Diagnostic(type, UNRESOLVED_NODE_MESSAGE, null, 0, 0, rendered);
        }
        Location location = resolved.get();
        String message = interpolate(template, args);
        String rendered = render(type.label(), location, message);
        return new Diagnostic(type, message, location.name(), location.line(), location.column(), rendered);
    }

    /**
     * Resolves a context to a location.
     *
     * @param context The context.
     * @return The location, or empty if a node context cannot be located.
     */
    public static Optional<Location> resolve(SourceContext context) {
        if (context instanceof SourceContext.NoContext) {
            return Optional.of(Location.NOWHERE);
        }
        if (context instanceof SourceContext.RawPosition raw) {
            return Optional.of(new Location(raw.stream(), raw.name(), raw.line(), raw.column()));
        }
        if (context instanceof SourceContext.UnitContext unit) {
            return Optional.of(new Location(null, unit.script().displayName(), 0, 0));
        }
        if (context instanceof SourceContext.TokenContext token) {
            return Optional.of(resolveToken(token.stream(), token.begin(), token.end()));
        }
        if (context instanceof SourceContext.NodeContext node) {
            return resolveNode(node.node());
        }
        throw new IllegalArgumentException("Unhandled source context " + context);
    }

    /**
     * Renders a resolved diagnostic.
     *
     * @param type     The severity label, e.g. {@code error}; {@code null} for none.
     * @param location The resolved location.
     * @param message  The interpolated message.
     * @return The rendered text; one line, or three when the source line can be quoted.
     */
    public static String render(String type, Location location, String message) {
        StringBuilder sb = new StringBuilder(255);

        if (location.name() != null) {
            sb.append(location.name()).append(':');
        } else {
            sb.append(PROGRAM_TAG).append(':');
        }

        if (location.line() != 0) {
            sb.append(location.line()).append(':');
            // A column is only meaningful together with its line.
            if (location.column() != 0) {
                sb.append(location.column()).append(':');
            }
        }

        if (sb.length() > 0) {
            sb.append(' ');
        }

        if (type != null) {
            sb.append(type).append(": ");
        }

        sb.append(message);

        TextStream stream = location.stream();
        if (stream != null && location.line() != 0 && location.line() <= stream.lineCount()) {
            sb.append("\n ").append(stream.getLine(location.line()));
            if (location.column() != 0) {
                sb.append("\n ").append(" ".repeat(location.column() - 1)).append('^');
            }
        }

        return sb.toString();
    }

    /**
     * Substitutes {@code {}} placeholders.
     *
     * @param template The template.
     * @param args     The arguments, may be {@code null}.
     * @return The message.
     */
    public static String interpolate(String template, Object... args) {
        // an explicit null throwable keeps a trailing Throwable argument as a substituted value
        return MessageFormatter.arrayFormat(template, args == null ? NO_ARGS : args, null).getMessage();
    }

    private static Location resolveToken(TextStream stream, int begin, int end) {
        if (begin == end) {
            return new Location(null, stream.streamName(), 0, 0);
        }
        LineColumn position = stream.lineColFromOffset(begin);
        return new Location(stream, stream.streamName(), position.line(), position.column());
    }

    private static Optional<Location> resolveNode(SyntaxNode node) {
        SyntaxNode target = node;
        if (!target.hasText()) {
            target = null;
            for (SyntaxNode child : node.getChildren()) {
                if (child.hasText()) {
                    target = child;
                    break;
                }
            }
        }
        if (target == null) {
            return Optional.empty();
        }
        Optional<TokenStream> stream = target.tokenStream();
        if (stream.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(resolveToken(stream.get().text(), target.getToken().begin(), target.getToken().end()));
    }
}
