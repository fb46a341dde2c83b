package org.gta3sc.compiler.program;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One translation unit of a compilation run.
 *
 * @param path The source file path.
 * @param type The role of the unit.
 */
public record Script(Path path, ScriptType type) {

    /**
     * Validates the components.
     */
    public Script {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(type, "type");
    }

    /**
     * @return The path with {@code /} separators on every platform, as shown in diagnostics.
     */
    public String displayName() {
        return path.toString().replace('\\', '/');
    }
}
