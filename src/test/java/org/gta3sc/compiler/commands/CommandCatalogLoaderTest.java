package org.gta3sc.compiler.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.gta3sc.compiler.api.ConfigurationException;
import org.gta3sc.compiler.config.DialectConfiguration;
import org.gta3sc.compiler.config.TargetDialect;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CommandCatalogLoaderTest {

    private static final Config DEFINITIONS = ConfigFactory.parseString("""
            commands {
              WAIT { id = 1, args = [INT] }
              SET {
                overloads = [
                  { name = SET_VAR_INT, id = 4, args = [VAR_INT, INT] }
                  { name = SET_VAR_TEXT_LABEL, id = "0x5A9", args = [var_text_label, text_label], dialects = [gtasa] }
                ]
              }
              TASK_PLAY_ANIM { id = "0x605", args = [INT, STRING], dialects = [gtasa] }
              REMOVED { id = 99, supported = false }
            }
            """);

    private static DialectConfiguration target(TargetDialect target) {
        return DialectConfiguration.builder().target(target).build();
    }

    @Test
    void commandWithoutOverloadsHasOneNamedAfterIt() {
        CommandCatalog catalog = CommandCatalogLoader.load(DEFINITIONS, target(TargetDialect.GTA3));

        Command wait = catalog.lookup("wait").orElseThrow();
        assertThat(wait.alternators()).singleElement()
                .satisfies(a -> {
                    assertThat(a.name()).isEqualTo("WAIT");
                    assertThat(a.id()).isEqualTo(1);
                    assertThat(a.arguments()).containsExactly(ArgumentKind.INT);
                    assertThat(a.supported()).isTrue();
                });
    }

    @Test
    void dialectListRestrictsSupport() {
        CommandCatalog gta3 = CommandCatalogLoader.load(DEFINITIONS, target(TargetDialect.GTA3));
        CommandCatalog gtasa = CommandCatalogLoader.load(DEFINITIONS, target(TargetDialect.GTASA));

        assertThat(gta3.lookup("TASK_PLAY_ANIM").orElseThrow().supported()).isFalse();
        assertThat(gtasa.lookup("TASK_PLAY_ANIM").orElseThrow().supported()).isTrue();

        assertThat(gta3.lookup("SET").orElseThrow().alternators())
                .extracting(Alternator::supported)
                .containsExactly(true, false);
        assertThat(gtasa.lookup("SET").orElseThrow().alternators())
                .extracting(Alternator::supported)
                .containsExactly(true, true);
    }

    @Test
    void noTargetSupportsEverythingNotExplicitlyDisabled() {
        CommandCatalog catalog = CommandCatalogLoader.load(DEFINITIONS, target(TargetDialect.NONE));

        assertThat(catalog.lookup("TASK_PLAY_ANIM").orElseThrow().supported()).isTrue();
        assertThat(catalog.lookup("REMOVED").orElseThrow().supported()).isFalse();
    }

    @Test
    void unknownArgumentKindIsRejected() {
        Config bad = ConfigFactory.parseString("commands { FOO { id = 1, args = [VECTOR] } }");

        assertThatThrownBy(() -> CommandCatalogLoader.load(bad, target(TargetDialect.GTA3)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("FOO")
                .hasMessageContaining("VECTOR");
    }

    @Test
    void missingIdIsRejected() {
        Config bad = ConfigFactory.parseString("commands { FOO { args = [INT] } }");

        assertThatThrownBy(() -> CommandCatalogLoader.load(bad, target(TargetDialect.GTA3)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void bundledDefinitionsLoad() {
        CommandCatalog catalog = CommandCatalogLoader.loadDefault(target(TargetDialect.GTAVC));

        assertThat(catalog.lookup("WAIT")).isPresent();
        assertThat(catalog.lookup("SET_DEATHARREST_STATE").orElseThrow().supported()).isTrue();
        assertThat(catalog.lookup("START_NEW_STREAMED_SCRIPT").orElseThrow().supported()).isFalse();
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("commands.conf");
        Files.writeString(file, "commands { NOP { id = 0 } }");

        CommandCatalog catalog = CommandCatalogLoader.load(file, target(TargetDialect.GTA3));

        assertThat(catalog.size()).isEqualTo(1);
        assertThatThrownBy(() -> CommandCatalogLoader.load(dir.resolve("missing.conf"), target(TargetDialect.GTA3)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing.conf");
    }
}
