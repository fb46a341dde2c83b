package org.gta3sc.compiler.commands;

import org.gta3sc.compiler.config.Language;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The table of built-in commands for one dialect. Built once per run and shared read-only
 * by all translation unit jobs.
 */
public final class CommandCatalog {

    private final TreeMap<String, Command> commands;

    /**
     * @param language The language whose identifier rules govern name lookup.
     * @param commands The commands; a later command replaces an earlier one of the same name.
     */
    public CommandCatalog(Language language, Collection<Command> commands) {
        this.commands = new TreeMap<>(language.identifierOrder());
        for (Command command : commands) {
            this.commands.put(command.name(), command);
        }
    }

    /**
     * @return A catalog without commands.
     */
    public static CommandCatalog empty() {
        return new CommandCatalog(Language.GTA3SCRIPT, List.of());
    }

    /**
     * Looks up a command by name, following the identifier rules of the language.
     *
     * @param name The name as written at the call site.
     * @return The command, or empty if the catalog does not know it.
     */
    public Optional<Command> lookup(CharSequence name) {
        return Optional.ofNullable(commands.get(name));
    }

    /**
     * Picks the overload of a command that best fits the arguments at a call site.
     * Candidates must accept the number of arguments and every argument kind; among those the one
     * with the most exact kind matches wins, ties going to the overload declared first.
     *
     * @param command The command.
     * @param actual  The kinds of the arguments at the call site.
     * @return The best overload, or empty if none fits.
     */
    public Optional<Alternator> findAlternator(Command command, List<ArgumentKind> actual) {
        Alternator best = null;
        int bestScore = -1;
        for (Alternator alternator : command.alternators()) {
            if (!alternator.acceptsArity(actual.size())) {
                continue;
            }
            int score = score(alternator, actual);
            if (score > bestScore) {
                best = alternator;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * @return All commands ordered by name.
     */
    public Collection<Command> commands() {
        return Collections.unmodifiableCollection(commands.values());
    }

    public int size() {
        return commands.size();
    }

    private static int score(Alternator alternator, List<ArgumentKind> actual) {
        int exact = 0;
        for (int i = 0; i < actual.size(); i++) {
            ArgumentKind expected = alternator.kindAt(i);
            if (!expected.accepts(actual.get(i))) {
                return -1;
            }
            if (expected == actual.get(i)) {
                exact++;
            }
        }
        return exact;
    }
}
