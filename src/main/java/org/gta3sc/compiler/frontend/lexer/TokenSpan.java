package org.gta3sc.compiler.frontend.lexer;

/**
 * The half-open character range {@code [begin, end)} a token occupies in its {@link TextStream}.
 * An empty span carries no position.
 *
 * @param begin Offset of the first character.
 * @param end   Offset one past the last character.
 */
public record TokenSpan(int begin, int end) {

    /**
     * Validates the range.
     */
    public TokenSpan {
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("Invalid token span [" + begin + ", " + end + ")");
        }
    }

    /**
     * @return A span that points nowhere.
     */
    public static TokenSpan empty() {
        return new TokenSpan(0, 0);
    }

    public boolean isEmpty() {
        return begin == end;
    }
}
