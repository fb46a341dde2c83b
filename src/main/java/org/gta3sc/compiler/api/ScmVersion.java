package org.gta3sc.compiler.api;

/**
 * Header layout of a compiled main script, one per VM generation.
 */
public enum ScmVersion {
    /** GTA III header. */
    LIBERTY,
    /** Vice City header. */
    MIAMI,
    /** San Andreas header, with the streamed script and global variable space segments. */
    SAN_ANDREAS
}
