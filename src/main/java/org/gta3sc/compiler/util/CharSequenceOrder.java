package org.gta3sc.compiler.util;

import java.util.Comparator;

/**
 * Comparators over {@link CharSequence} so that ordered maps keyed by {@code String} can be
 * queried with any borrowed character sequence (a {@code StringBuilder}, a {@code CharBuffer}
 * slice of a source file) without building a temporary {@code String} key.
 */
public final class CharSequenceOrder {

    /** Exact, case-sensitive lexicographic order. */
    public static final Comparator<CharSequence> CASE_SENSITIVE = CharSequence::compare;

    /** Lexicographic order ignoring case, consistent for ordering and lookup. */
    public static final Comparator<CharSequence> CASE_INSENSITIVE = CharSequenceOrder::compareIgnoreCase;

    private CharSequenceOrder() {}

    /**
     * Compares two character sequences ignoring case, with the same per-character folding as
     * {@link String#CASE_INSENSITIVE_ORDER}.
     *
     * @param a The first sequence.
     * @param b The second sequence.
     * @return A negative, zero or positive value.
     */
    public static int compareIgnoreCase(CharSequence a, CharSequence b) {
        int n1 = a.length();
        int n2 = b.length();
        int min = Math.min(n1, n2);
        for (int i = 0; i < min; i++) {
            char c1 = a.charAt(i);
            char c2 = b.charAt(i);
            if (c1 != c2) {
                c1 = Character.toUpperCase(c1);
                c2 = Character.toUpperCase(c2);
                if (c1 != c2) {
                    c1 = Character.toLowerCase(c1);
                    c2 = Character.toLowerCase(c2);
                    if (c1 != c2) {
                        return c1 - c2;
                    }
                }
            }
        }
        return n1 - n2;
    }
}
