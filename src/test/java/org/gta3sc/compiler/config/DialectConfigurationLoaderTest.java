package org.gta3sc.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.gta3sc.compiler.api.ConfigurationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DialectConfigurationLoaderTest {

    private static final String PRESETS = """
            gta3sc.presets {
              gtasa {
                features { arrays = true, switch = true }
                limits { local-var-limit = 32, switch-case-limit = 75, mission-var-limit = 1024 }
              }
            }
            """;

    @Test
    void presetIsAppliedForSelectedTarget() {
        Config config = ConfigFactory.parseString(PRESETS + "gta3sc.dialect.target = gtasa");

        DialectConfiguration dialect = DialectConfigurationLoader.load(config);

        assertThat(dialect.target()).isEqualTo(TargetDialect.GTASA);
        assertThat(dialect.isEnabled(DialectFeature.ARRAYS)).isTrue();
        assertThat(dialect.localVarLimit()).isEqualTo(32);
        assertThat(dialect.switchCaseLimit()).hasValue(75);
    }

    @Test
    void dialectSectionOverridesPreset() {
        Config config = ConfigFactory.parseString(PRESETS + """
                gta3sc.dialect {
                  target = GTASA
                  language = ir2
                  features { arrays = false, break-continue = true }
                  limits { mission-var-limit = null, local-var-limit = 40 }
                  defines { DEBUG = 1, NAME = "main" }
                }
                """);

        DialectConfiguration dialect = DialectConfigurationLoader.load(config);

        assertThat(dialect.language()).isEqualTo(Language.IR2);
        assertThat(dialect.isEnabled(DialectFeature.ARRAYS)).isFalse();
        assertThat(dialect.isEnabled(DialectFeature.BREAK_CONTINUE)).isTrue();
        assertThat(dialect.isEnabled(DialectFeature.SWITCH)).isTrue();
        assertThat(dialect.localVarLimit()).isEqualTo(40);
        assertThat(dialect.missionVarLimit()).isEmpty();
        assertThat(dialect.definedValue("DEBUG")).contains("1");
        assertThat(dialect.definedValue("NAME")).contains("main");
    }

    @Test
    void missingDialectSectionYieldsDefaults() {
        DialectConfiguration dialect = DialectConfigurationLoader.load(ConfigFactory.empty());

        assertThat(dialect.target()).isEqualTo(TargetDialect.NONE);
        assertThat(dialect.features()).isEqualTo(DialectFeature.defaults());
    }

    @Test
    void unknownFeatureIsRejected() {
        Config config = ConfigFactory.parseString("gta3sc.dialect.features { warp-drive = true }");

        assertThatThrownBy(() -> DialectConfigurationLoader.load(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("warp-drive");
    }

    @Test
    void nonBooleanFeatureIsRejected() {
        Config config = ConfigFactory.parseString("gta3sc.dialect.features { arrays = \"yes\" }");

        assertThatThrownBy(() -> DialectConfigurationLoader.load(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("boolean");
    }

    @Test
    void unknownTargetIsRejected() {
        Config config = ConfigFactory.parseString("gta3sc.dialect.target = gta5");

        assertThatThrownBy(() -> DialectConfigurationLoader.load(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("gta5");
    }

    @Test
    void bundledPresetsAreLoadable() {
        Config config = ConfigFactory.parseString("gta3sc.dialect.target = gtavc")
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();

        DialectConfiguration dialect = DialectConfigurationLoader.load(config);

        assertThat(dialect.target()).isEqualTo(TargetDialect.GTAVC);
        assertThat(dialect.localVarLimit()).isEqualTo(16);
        assertThat(dialect.isEnabled(DialectFeature.SKIP_CUTSCENE)).isTrue();
    }
}
