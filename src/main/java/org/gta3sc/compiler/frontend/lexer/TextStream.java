package org.gta3sc.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The full text of one source file together with a line index, so that token offsets can be
 * mapped back to 1-based line and column numbers and whole lines can be quoted in diagnostics.
 * Instances are immutable and safe to share between threads.
 */
public final class TextStream {

    private final String streamName;
    private final String text;
    private final int[] lineStarts;

    /**
     * @param streamName The display name used in diagnostics, usually the file path.
     * @param text       The file contents.
     */
    public TextStream(String streamName, String text) {
        this.streamName = Objects.requireNonNull(streamName, "streamName");
        this.text = Objects.requireNonNull(text, "text");
        this.lineStarts = indexLines(text);
    }

    /**
     * Convenience factory joining lines with {@code \n}.
     *
     * @param streamName The display name.
     * @param lines      The source lines.
     * @return A new stream.
     */
    public static TextStream ofLines(String streamName, List<String> lines) {
        return new TextStream(streamName, String.join("\n", lines));
    }

    public String streamName() {
        return streamName;
    }

    public String text() {
        return text;
    }

    /**
     * @return The number of lines, at least one.
     */
    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Returns the text of a line without its terminator.
     *
     * @param lineNumber The 1-based line number.
     * @return The line text.
     * @throws IndexOutOfBoundsException if the line does not exist.
     */
    public String getLine(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lineStarts.length) {
            throw new IndexOutOfBoundsException("Line " + lineNumber + " out of range 1.." + lineStarts.length + " in " + streamName);
        }
        int begin = lineStarts[lineNumber - 1];
        int end = lineNumber < lineStarts.length ? lineStarts[lineNumber] - 1 : text.length();
        if (end > begin && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(begin, end);
    }

    /**
     * Maps a character offset to its 1-based line and column. Every character, tabs included,
     * counts as one column.
     *
     * @param offset The offset into {@link #text()}, may equal the text length.
     * @return The position.
     * @throws IndexOutOfBoundsException if the offset is outside the text.
     */
    public LineColumn lineColFromOffset(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " out of range 0.." + text.length() + " in " + streamName);
        }
        int index = Arrays.binarySearch(lineStarts, offset);
        int line = index >= 0 ? index : -index - 2;
        return new LineColumn(line + 1, offset - lineStarts[line] + 1);
    }

    private static int[] indexLines(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return "TextStream[" + streamName + "]";
    }
}
