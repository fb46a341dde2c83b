package org.gta3sc.compiler.entities;

import java.nio.file.Path;

/**
 * Reads model tables from disk. Implementations are not required to be thread-safe and must
 * finish before any job that reads the resulting tables starts.
 */
public interface ModelTableLoader {

    /**
     * @param path The table with the global default models.
     * @return The table.
     * @throws org.gta3sc.compiler.api.ConfigurationException if the input is missing or malformed.
     */
    ModelTable loadDefaultTable(Path path);

    /**
     * @param path The table with the models of one level.
     * @return The table.
     * @throws org.gta3sc.compiler.api.ConfigurationException if the input is missing or malformed.
     */
    ModelTable loadLevelTable(Path path);
}
