package org.gta3sc.compiler.entities;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ModelRegistryTest {

    @Test
    void findsModelsInEitherTable() {
        ModelRegistry registry = new ModelRegistry();
        registry.setup(
                ModelTable.builder().put("Ped1", 7).build(),
                ModelTable.builder().put("LEVEL_DOOR", 4001).build());

        assertThat(registry.isModelFromIde("PED1")).isTrue();
        assertThat(registry.isModelFromIde("ped1")).isTrue();
        assertThat(registry.isModelFromIde("level_door")).isTrue();
        assertThat(registry.isModelFromIde("unknown")).isFalse();
    }

    @Test
    void defaultTableWinsOverLevelTable() {
        ModelRegistry registry = new ModelRegistry();
        registry.setup(
                ModelTable.builder().put("DOOR", 1).build(),
                ModelTable.builder().put("door", 2).put("GATE", 3).build());

        assertThat(registry.findModel("Door")).hasValue(1);
        assertThat(registry.findModel("gate")).hasValue(3);
        assertThat(registry.findModel("wall")).isEmpty();
    }

    @Test
    void setupReplacesBothTables() {
        ModelRegistry registry = new ModelRegistry();
        registry.setup(ModelTable.builder().put("OLD", 1).build(), ModelTable.empty());

        registry.setup(ModelTable.empty(), ModelTable.builder().put("NEW", 2).build());

        assertThat(registry.isModelFromIde("OLD")).isFalse();
        assertThat(registry.isModelFromIde("NEW")).isTrue();
    }
}
