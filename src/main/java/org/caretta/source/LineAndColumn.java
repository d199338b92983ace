package org.caretta.source;

/**
 * A resolved, 1-based line and column pair.
 *
 * @param line The line number.
 * @param column The column number, counted in bytes.
 */
public record LineAndColumn(int line, int column) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
