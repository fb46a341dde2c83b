package org.gta3sc.compiler.commands;

import org.gta3sc.compiler.config.Language;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.gta3sc.compiler.commands.ArgumentKind.ANY;
import static org.gta3sc.compiler.commands.ArgumentKind.FLOAT;
import static org.gta3sc.compiler.commands.ArgumentKind.INT;
import static org.gta3sc.compiler.commands.ArgumentKind.LABEL;
import static org.gta3sc.compiler.commands.ArgumentKind.VAR_FLOAT;
import static org.gta3sc.compiler.commands.ArgumentKind.VAR_INT;

@Tag("unit")
class CommandCatalogTest {

    private static final Alternator SET_VAR_INT = new Alternator("SET_VAR_INT", 0x4, List.of(VAR_INT, INT), false, true);
    private static final Alternator SET_VAR_FLOAT = new Alternator("SET_VAR_FLOAT", 0x5, List.of(VAR_FLOAT, FLOAT), false, true);
    private static final Command SET = new Command("SET", List.of(SET_VAR_INT, SET_VAR_FLOAT), true);

    private final CommandCatalog catalog = new CommandCatalog(Language.GTA3SCRIPT, List.of(
            SET,
            new Command("WAIT", List.of(new Alternator("WAIT", 0x1, List.of(INT), false, true)), true)));

    @Test
    void lookupIgnoresCaseAndAcceptsAnyCharSequence() {
        assertThat(catalog.lookup("set")).containsSame(SET);
        assertThat(catalog.lookup(new StringBuilder("Set"))).containsSame(SET);
        assertThat(catalog.lookup("SET_VAR_INT")).isEmpty();
        assertThat(catalog.size()).isEqualTo(2);
        assertThat(catalog.commands()).extracting(Command::name).containsExactly("SET", "WAIT");
    }

    @Test
    void selectsOverloadByArgumentKinds() {
        assertThat(catalog.findAlternator(SET, List.of(VAR_INT, INT))).containsSame(SET_VAR_INT);
        assertThat(catalog.findAlternator(SET, List.of(VAR_FLOAT, VAR_FLOAT))).containsSame(SET_VAR_FLOAT);
        assertThat(catalog.findAlternator(SET, List.of(VAR_INT, FLOAT))).isEmpty();
        assertThat(catalog.findAlternator(SET, List.of(VAR_INT))).isEmpty();
    }

    @Test
    void prefersMoreExactMatches() {
        Alternator byValue = new Alternator("BY_VALUE", 1, List.of(INT), false, true);
        Alternator byVariable = new Alternator("BY_VARIABLE", 2, List.of(VAR_INT), false, true);
        Command command = new Command("CMD", List.of(byValue, byVariable), true);

        assertThat(catalog.findAlternator(command, List.of(VAR_INT))).containsSame(byVariable);
        assertThat(catalog.findAlternator(command, List.of(INT))).containsSame(byValue);
    }

    @Test
    void tiesGoToFirstDeclared() {
        Alternator first = new Alternator("FIRST", 1, List.of(ANY), false, true);
        Alternator second = new Alternator("SECOND", 2, List.of(ANY), false, true);
        Command command = new Command("CMD", List.of(first, second), true);

        assertThat(catalog.findAlternator(command, List.of(FLOAT))).containsSame(first);
    }

    @Test
    void variadicTailRepeatsLastKind() {
        Alternator start = new Alternator("START_NEW_SCRIPT", 0x4F, List.of(LABEL, ANY), true, true);
        Command command = new Command("START_NEW_SCRIPT", List.of(start), true);

        assertThat(catalog.findAlternator(command, List.of(LABEL))).containsSame(start);
        assertThat(catalog.findAlternator(command, List.of(LABEL, INT, FLOAT, VAR_INT))).containsSame(start);
        assertThat(catalog.findAlternator(command, List.of())).isEmpty();
        assertThat(catalog.findAlternator(command, List.of(INT))).isEmpty();
    }

    @Test
    void valueKindsAcceptTheirVariables() {
        assertThat(INT.accepts(VAR_INT)).isTrue();
        assertThat(VAR_INT.accepts(INT)).isFalse();
        assertThat(ANY.accepts(LABEL)).isTrue();
        assertThat(LABEL.accepts(INT)).isFalse();
    }
}
