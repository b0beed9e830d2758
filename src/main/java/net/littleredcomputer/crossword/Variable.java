// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;

import java.util.Objects;

/**
 * A slot of the crossword grid: a maximal run of fillable cells which must
 * receive one word. Variables are immutable and compare by value.
 */
public final class Variable {
    public enum Direction {
        ACROSS,
        DOWN,
    }

    final int i;  // starting row
    final int j;  // starting column
    final Direction direction;
    final int length;
    private final ImmutableList<Cell> cells;

    /** A grid position, row i and column j. */
    static final class Cell {
        final int i;
        final int j;

        Cell(int i, int j) { this.i = i; this.j = j; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Cell)) return false;
            Cell c = (Cell) o;
            return i == c.i && j == c.j;
        }

        @Override
        public int hashCode() { return 31 * i + j; }

        @Override
        public String toString() { return i + "," + j; }
    }

    public Variable(int i, int j, Direction direction, int length) {
        if (length < 1) throw new IllegalArgumentException("variable length must be positive: " + length);
        this.i = i;
        this.j = j;
        this.direction = Objects.requireNonNull(direction);
        this.length = length;
        ImmutableList.Builder<Cell> b = ImmutableList.builder();
        for (int k = 0; k < length; ++k) {
            b.add(direction == Direction.DOWN ? new Cell(i + k, j) : new Cell(i, j + k));
        }
        cells = b.build();
    }

    public int row() { return i; }
    public int column() { return j; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /** @return the cells covered by this variable, in letter order */
    ImmutableList<Cell> cells() { return cells; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable v = (Variable) o;
        return i == v.i && j == v.j && direction == v.direction && length == v.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(i, j, direction, length);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d) %s : %d", i, j, direction, length);
    }
}
