package org.gta3sc.compiler.frontend.lexer;

/**
 * A 1-based source position.
 *
 * @param line   The line number.
 * @param column The column number.
 */
public record LineColumn(int line, int column) {
}
