package org.gta3sc.compiler.entities;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Holds the two model tables of a run: the global defaults and the tables of the current level.
 * <p>
 * {@link #setup(ModelTable, ModelTable)} is not meant to race with readers. Call it before
 * translation unit jobs start or between batches; afterwards the tables are only read.
 */
public final class ModelRegistry {

    private volatile ModelTable defaultModels = ModelTable.empty();
    private volatile ModelTable levelModels = ModelTable.empty();

    /**
     * Replaces both tables.
     *
     * @param defaultModels The models every level knows.
     * @param levelModels   The models of the level being compiled.
     */
    public void setup(ModelTable defaultModels, ModelTable levelModels) {
        this.defaultModels = Objects.requireNonNull(defaultModels, "defaultModels");
        this.levelModels = Objects.requireNonNull(levelModels, "levelModels");
    }

    /**
     * Checks whether a name denotes a known game object.
     *
     * @param name The identifier, any case.
     * @return {@code true} if either table contains it.
     */
    public boolean isModelFromIde(CharSequence name) {
        return defaultModels.contains(name) || levelModels.contains(name);
    }

    /**
     * @param name The identifier, any case.
     * @return The model ID, looked up in the default table first.
     */
    public OptionalInt findModel(CharSequence name) {
        OptionalInt id = defaultModels.get(name);
        return id.isPresent() ? id : levelModels.get(name);
    }

    public ModelTable defaultModels() {
        return defaultModels;
    }

    public ModelTable levelModels() {
        return levelModels;
    }
}
