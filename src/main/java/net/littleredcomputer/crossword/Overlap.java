// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

/**
 * The crossing of two variables x and y: letter {@code first} of x's word
 * must equal letter {@code second} of y's word.
 */
public final class Overlap {
    final int first;
    final int second;

    Overlap(int first, int second) { this.first = first; this.second = second; }

    public int first() { return first; }
    public int second() { return second; }

    /** @return the same crossing seen from the other variable */
    Overlap reversed() { return new Overlap(second, first); }

    /**
     * @return true if the two words agree at this crossing; a word too short
     * to reach the crossing agrees with nothing
     */
    boolean agrees(String x, String y) {
        if (first >= x.length() || second >= y.length()) return false;
        return x.charAt(first) == y.charAt(second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap v = (Overlap) o;
        return first == v.first && second == v.second;
    }

    @Override
    public int hashCode() { return 31 * first + second; }

    @Override
    public String toString() { return "(" + first + ", " + second + ")"; }
}
