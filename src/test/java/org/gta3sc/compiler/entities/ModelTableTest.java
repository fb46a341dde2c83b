package org.gta3sc.compiler.entities;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModelTableTest {

    @Test
    void lookupIgnoresCase() {
        ModelTable table = ModelTable.builder().put("Ped1", 7).build();

        assertThat(table.get("PED1")).hasValue(7);
        assertThat(table.get("ped1")).hasValue(7);
        assertThat(table.get(new StringBuilder("pEd1"))).hasValue(7);
        assertThat(table.contains("ped2")).isFalse();
        assertThat(table.get("ped2")).isEmpty();
    }

    @Test
    void namesDifferingOnlyInCaseShareAnEntry() {
        ModelTable table = ModelTable.builder()
                .put("Ped1", 7)
                .put("PED1", 8)
                .build();

        assertThat(table.size()).isEqualTo(1);
        assertThat(table.get("ped1")).hasValue(8);
    }

    @Test
    void entriesAreOrderedCaseInsensitivelyAndUnmodifiable() {
        ModelTable table = ModelTable.builder()
                .put("beta", 2)
                .put("ALPHA", 1)
                .build();

        assertThat(table.entries().keySet()).containsExactly("ALPHA", "beta");
        assertThatThrownBy(() -> table.entries().put("GAMMA", 3))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyTableHasNothing() {
        assertThat(ModelTable.empty().size()).isZero();
        assertThat(ModelTable.builder().build()).isSameAs(ModelTable.empty());
    }
}
