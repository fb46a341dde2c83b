package org.gta3sc.compiler.config;

import org.gta3sc.compiler.api.ScmVersion;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DialectConfigurationTest {

    @Test
    void builderDefaults() {
        DialectConfiguration config = DialectConfiguration.builder().build();

        assertThat(config.language()).isEqualTo(Language.GTA3SCRIPT);
        assertThat(config.target()).isEqualTo(TargetDialect.NONE);
        assertThat(config.features()).containsExactlyInAnyOrder(DialectFeature.ENTITY_TRACKING, DialectFeature.SCRIPT_NAME_CHECK);
        assertThat(config.missionVarLimit()).isEmpty();
        assertThat(config.switchCaseLimit()).isEmpty();
        assertThat(config.arrayElemLimit()).isEmpty();
        assertThat(config.cleo()).isEmpty();
        assertThat(config.defines()).isEmpty();
    }

    @Test
    void absentLimitIsDistinctFromZero() {
        DialectConfiguration config = DialectConfiguration.builder()
                .switchCaseLimit(OptionalInt.of(0))
                .build();

        assertThat(config.switchCaseLimit()).hasValue(0);
        assertThat(config.arrayElemLimit()).isEmpty();
    }

    @Test
    void defineDefaultsToOneAndOverwrites() {
        DialectConfiguration config = DialectConfiguration.builder()
                .define("DEBUG")
                .define("LEVEL", "2")
                .define("LEVEL", "3")
                .build();

        assertThat(config.definedValue("DEBUG")).contains("1");
        assertThat(config.definedValue("LEVEL")).contains("3");
        assertThat(config.defines()).hasSize(2);
    }

    @Test
    void undefineOfAbsentSymbolIsNoOp() {
        DialectConfiguration config = DialectConfiguration.builder()
                .define("A")
                .undefine("B")
                .undefine("A")
                .build();

        assertThat(config.isDefined("A")).isFalse();
        assertThat(config.defines()).isEmpty();
    }

    @Test
    void symbolsAreCaseSensitiveAndAcceptAnyCharSequence() {
        DialectConfiguration config = DialectConfiguration.builder().define("DEBUG").build();

        assertThat(config.isDefined(new StringBuilder("DEBUG"))).isTrue();
        assertThat(config.isDefined("debug")).isFalse();
        assertThat(config.isDefined("DEBUG_BUILD".subSequence(0, 5))).isTrue();
    }

    @Test
    void builtConfigurationIsUnaffectedByLaterBuilderChanges() {
        DialectConfiguration.Builder builder = DialectConfiguration.builder().define("A");
        DialectConfiguration config = builder.build();

        builder.define("B").enable(DialectFeature.ARRAYS);

        assertThat(config.isDefined("B")).isFalse();
        assertThat(config.isEnabled(DialectFeature.ARRAYS)).isFalse();
        assertThatThrownBy(() -> config.features().add(DialectFeature.SWITCH))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toBuilderCopiesEverything() {
        DialectConfiguration original = DialectConfiguration.builder()
                .target(TargetDialect.GTASA)
                .language(Language.IR2)
                .enable(DialectFeature.SWITCH)
                .localVarLimit(32)
                .missionVarLimit(OptionalInt.of(1024))
                .define("X", "y")
                .build();

        DialectConfiguration copy = original.toBuilder().disable(DialectFeature.SWITCH).build();

        assertThat(copy.target()).isEqualTo(TargetDialect.GTASA);
        assertThat(copy.language()).isEqualTo(Language.IR2);
        assertThat(copy.localVarLimit()).isEqualTo(32);
        assertThat(copy.missionVarLimit()).hasValue(1024);
        assertThat(copy.definedValue("X")).contains("y");
        assertThat(copy.isEnabled(DialectFeature.SWITCH)).isFalse();
        assertThat(original.isEnabled(DialectFeature.SWITCH)).isTrue();
    }

    @Test
    void headerMapsTargetToOutputVersion() {
        assertThat(DialectConfiguration.builder().target(TargetDialect.GTA3).build().header(ScmVersion.class))
                .isEqualTo(ScmVersion.LIBERTY);
        assertThat(DialectConfiguration.builder().target(TargetDialect.GTAVC).build().header(ScmVersion.class))
                .isEqualTo(ScmVersion.MIAMI);
        assertThat(DialectConfiguration.builder().target(TargetDialect.GTASA).build().header(ScmVersion.class))
                .isEqualTo(ScmVersion.SAN_ANDREAS);
    }

    @Test
    void headerWithoutTargetIsProgrammingError() {
        DialectConfiguration config = DialectConfiguration.builder()
                .enable(DialectFeature.SYNTAX_ONLY)
                .build();

        assertThatThrownBy(() -> config.header(ScmVersion.class))
                .isInstanceOf(IllegalStateException.class);
    }
}
