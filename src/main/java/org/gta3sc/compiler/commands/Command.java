package org.gta3sc.compiler.commands;

import java.util.List;
import java.util.Objects;

/**
 * A built-in operation of the script VM.
 *
 * @param name        The command name as written in scripts.
 * @param alternators The overloads, in declaration order.
 * @param supported   Whether the command is available under the active dialect.
 */
public record Command(
        String name,
        List<Alternator> alternators,
        boolean supported
) {

    /**
     * Ensures the overload list is unmodifiable.
     */
    public Command {
        Objects.requireNonNull(name, "name");
        alternators = List.copyOf(alternators);
    }
}
