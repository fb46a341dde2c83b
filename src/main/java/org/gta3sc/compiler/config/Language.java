package org.gta3sc.compiler.config;

import org.gta3sc.compiler.util.CharSequenceOrder;

import java.util.Comparator;

/**
 * The source syntax family accepted by the front end.
 */
public enum Language {
    /** The intermediate representation emitted by the decompiler and re-read by the compiler. */
    IR2,
    /** The script language proper. */
    GTA3SCRIPT;

    /**
     * Returns the ordering used to compare identifiers of this language.
     * Both grammars treat command names case-insensitively.
     *
     * @return The identifier comparator.
     */
    public Comparator<CharSequence> identifierOrder() {
        return CharSequenceOrder.CASE_INSENSITIVE;
    }
}
