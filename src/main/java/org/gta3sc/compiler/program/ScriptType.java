package org.gta3sc.compiler.program;

/**
 * The role a translation unit plays in the compiled program.
 */
public enum ScriptType {
    /** The main script. */
    MAIN,
    /** A file included into the main script with GOSUB_FILE. */
    MAIN_EXTENSION,
    /** A script launched with LAUNCH_MISSION. */
    SUBSCRIPT,
    /** A mission script, loaded into the mission space on demand. */
    MISSION,
    /** A streamed script, loaded by the streaming system. */
    STREAMED
}
