package org.gta3sc.compiler.entities;

import org.gta3sc.compiler.util.CharSequenceOrder;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An immutable table of game object (model) names and their integer IDs.
 * <p>
 * Names are compared case-insensitively through one comparator used both for ordering and
 * for lookup, so keys are stored as spelled and queries never allocate a normalized copy.
 */
public final class ModelTable {

    private static final ModelTable EMPTY = new ModelTable(new TreeMap<>(CharSequenceOrder.CASE_INSENSITIVE));

    private final SortedMap<String, Integer> models;

    private ModelTable(TreeMap<String, Integer> models) {
        this.models = Collections.unmodifiableSortedMap(models);
    }

    /**
     * @return A table without entries.
     */
    public static ModelTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param name The model name, any case.
     * @return The model ID, or empty if the table has no such name.
     */
    public OptionalInt get(CharSequence name) {
        Integer id = models.get(name);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    public boolean contains(CharSequence name) {
        return models.containsKey(name);
    }

    public int size() {
        return models.size();
    }

    /**
     * @return An unmodifiable view of all entries, ordered case-insensitively by name.
     */
    public Map<String, Integer> entries() {
        return models;
    }

    /**
     * Collects entries for a {@link ModelTable}. Not thread-safe.
     */
    public static final class Builder {
        private final TreeMap<String, Integer> models = new TreeMap<>(CharSequenceOrder.CASE_INSENSITIVE);

        private Builder() {}

        /**
         * Adds a model. A name differing only in case from an existing one replaces its ID.
         *
         * @param name The model name.
         * @param id   The model ID.
         * @return This builder.
         */
        public Builder put(String name, int id) {
            models.put(name, id);
            return this;
        }

        public ModelTable build() {
            return models.isEmpty() ? EMPTY : new ModelTable(new TreeMap<>(models));
        }
    }
}
