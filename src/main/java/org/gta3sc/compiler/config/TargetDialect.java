package org.gta3sc.compiler.config;

import java.util.Locale;

/**
 * The binary VM generation the compiler emits code for.
 */
public enum TargetDialect {
    /** No code generation. Only meaningful together with {@link DialectFeature#SYNTAX_ONLY}. */
    NONE,
    /** First generation (Liberty City). */
    GTA3,
    /** Second generation (Vice City). */
    GTAVC,
    /** Third generation (San Andreas). */
    GTASA;

    /**
     * Name of the configuration preset for this dialect, e.g. {@code gtasa}.
     *
     * @return The lower-case preset name.
     */
    public String presetName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a dialect name as written on the command line or in a configuration file.
     *
     * @param name The name, case-insensitive (e.g. {@code gta3}, {@code GTASA}, {@code none}).
     * @return The dialect.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static TargetDialect fromName(String name) {
        for (TargetDialect dialect : values()) {
            if (dialect.name().equalsIgnoreCase(name.trim())) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unknown target dialect '" + name + "'");
    }
}
