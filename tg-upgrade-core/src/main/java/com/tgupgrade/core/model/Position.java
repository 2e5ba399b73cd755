package com.tgupgrade.core.model;

import java.util.Comparator;

/**
 * Location of a node or comment in a source document.
 *
 * <p>Positions order lexicographically by line, column and absolute offset, which makes
 * them usable as the sort key for "is this comment before that node" queries.
 *
 * @param line 1-based line number
 * @param column 1-based column number
 * @param offset 0-based character offset from the start of the document
 */
public record Position(
    int line,
    int column,
    int offset
) implements Comparable<Position> {

    /**
     * Position used for synthesized nodes that have no source location.
     */
    public static final Position NONE = new Position(0, 0, -1);

    private static final Comparator<Position> ORDER = Comparator
        .comparingInt(Position::line)
        .thenComparingInt(Position::column)
        .thenComparingInt(Position::offset);

    @Override
    public int compareTo(Position other) {
        return ORDER.compare(this, other);
    }

    /**
     * Returns true if this position is strictly before {@code other}.
     *
     * @param other position to compare with
     * @return true if this position sorts before {@code other}
     */
    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
