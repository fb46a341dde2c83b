package org.gta3sc.compiler.commands;

import java.util.List;
import java.util.Objects;

/**
 * One overload of a command, selected by the shape of the arguments at a call site.
 *
 * @param name      The overload name, e.g. {@code SET_VAR_INT}.
 * @param id        The opcode emitted for this overload.
 * @param arguments The expected argument kinds in order.
 * @param variadic  If {@code true}, the last kind repeats for any further arguments.
 * @param supported Whether the overload exists in the active dialect.
 */
public record Alternator(
        String name,
        int id,
        List<ArgumentKind> arguments,
        boolean variadic,
        boolean supported
) {

    /**
     * Ensures the argument list is unmodifiable and a variadic tail has a kind to repeat.
     */
    public Alternator {
        Objects.requireNonNull(name, "name");
        arguments = List.copyOf(arguments);
        if (variadic && arguments.isEmpty()) {
            throw new IllegalArgumentException("Variadic overload '" + name + "' needs at least one argument kind");
        }
    }

    /**
     * @param count The number of arguments at a call site.
     * @return {@code true} if this overload can take that many arguments.
     */
    public boolean acceptsArity(int count) {
        return variadic ? count >= arguments.size() - 1 : count == arguments.size();
    }

    /**
     * @param index The 0-based argument position.
     * @return The expected kind at that position, the repeated tail kind past the end of a variadic list.
     */
    public ArgumentKind kindAt(int index) {
        return index < arguments.size() ? arguments.get(index) : arguments.get(arguments.size() - 1);
    }
}
