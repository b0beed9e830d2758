// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.*;
import java.util.stream.Collectors;

/**
 * A crossword puzzle instance: the grid structure, the slots (variables) it
 * contains, the crossings between them, and the pool of candidate words.
 */
public class Crossword {
    private static final Splitter wordSplitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final char FILLABLE = '_';
    private static final char BLOCKED = '█';

    private final int height;
    private final int width;
    private final boolean[][] structure;  // structure[i][j] is true iff cell i,j may hold a letter
    private final ImmutableSortedSet<String> words;
    private final ImmutableSet<Variable> variables;
    private final ImmutableMap<Variable, ImmutableMap<Variable, Overlap>> overlaps;

    private Crossword(boolean[][] structure, Iterable<String> words) {
        this.height = structure.length;
        this.width = height > 0 ? structure[0].length : 0;
        this.structure = structure;
        ImmutableSortedSet.Builder<String> wb = ImmutableSortedSet.naturalOrder();
        for (String w : words) wb.add(w.toUpperCase(Locale.ROOT));
        this.words = wb.build();
        this.variables = findVariables();
        if (variables.isEmpty()) throw new IllegalArgumentException("structure contains no slots");
        this.overlaps = findOverlaps();
    }

    /**
     * Scan the grid for maximal runs of fillable cells of length greater than
     * one. Cells are visited in row-major order; at each start cell a DOWN run
     * is recorded before an ACROSS run.
     */
    private ImmutableSet<Variable> findVariables() {
        ImmutableSet.Builder<Variable> vb = ImmutableSet.builder();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!structure[i][j]) continue;
                if (i == 0 || !structure[i - 1][j]) {
                    int length = 1;
                    while (i + length < height && structure[i + length][j]) ++length;
                    if (length > 1) vb.add(new Variable(i, j, Variable.Direction.DOWN, length));
                }
                if (j == 0 || !structure[i][j - 1]) {
                    int length = 1;
                    while (j + length < width && structure[i][j + length]) ++length;
                    if (length > 1) vb.add(new Variable(i, j, Variable.Direction.ACROSS, length));
                }
            }
        }
        return vb.build();
    }

    private ImmutableMap<Variable, ImmutableMap<Variable, Overlap>> findOverlaps() {
        ImmutableMap.Builder<Variable, ImmutableMap<Variable, Overlap>> mb = ImmutableMap.builder();
        for (Variable v1 : variables) {
            ImmutableMap.Builder<Variable, Overlap> nb = ImmutableMap.builder();
            ImmutableList<Variable.Cell> cells1 = v1.cells();
            for (Variable v2 : variables) {
                if (v1.equals(v2)) continue;
                ImmutableList<Variable.Cell> cells2 = v2.cells();
                for (int k = 0; k < cells1.size(); ++k) {
                    int l = cells2.indexOf(cells1.get(k));
                    if (l >= 0) {
                        // Two maximal runs share at most one cell.
                        nb.put(v2, new Overlap(k, l));
                        break;
                    }
                }
            }
            mb.put(v1, nb.build());
        }
        return mb.build();
    }

    public int height() { return height; }
    public int width() { return width; }

    /** @return true iff the cell at row i, column j can hold a letter */
    public boolean fillable(int i, int j) { return structure[i][j]; }

    /** @return the candidate words, upper-cased, in sorted order */
    public ImmutableSortedSet<String> words() { return words; }

    /** @return the slots of the puzzle, in row-major order of their starting cells */
    public ImmutableSet<Variable> variables() { return variables; }

    /** @return the variables crossing {@code v} */
    public ImmutableSet<Variable> neighbors(Variable v) {
        ImmutableMap<Variable, Overlap> n = overlaps.get(v);
        if (n == null) throw new IllegalArgumentException("unknown variable: " + v);
        return n.keySet();
    }

    /**
     * @return the crossing of x and y, with the first index referring to x's
     * word, or empty if the two do not cross
     */
    public Optional<Overlap> overlap(Variable x, Variable y) {
        ImmutableMap<Variable, Overlap> n = overlaps.get(x);
        return n == null ? Optional.empty() : Optional.ofNullable(n.get(y));
    }

    /**
     * @param assignment mapping from variables to words
     * @return a height x width grid of the assigned letters; cells not covered
     * by the assignment are null
     */
    public Character[][] letterGrid(Map<Variable, String> assignment) {
        Character[][] letters = new Character[height][width];
        assignment.forEach((v, word) -> {
            List<Variable.Cell> cells = v.cells();
            for (int k = 0; k < word.length() && k < cells.size(); ++k) {
                Variable.Cell c = cells.get(k);
                letters[c.i][c.j] = word.charAt(k);
            }
        });
        return letters;
    }

    /**
     * @return the assignment drawn as text, one line per row, with blocked
     * cells shown as solid blocks
     */
    public String render(Map<Variable, String> assignment) {
        Character[][] letters = letterGrid(assignment);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (structure[i][j]) {
                    sb.append(letters[i][j] != null ? letters[i][j] : ' ');
                } else {
                    sb.append(BLOCKED);
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public static Crossword parseFrom(String structure, String words) {
        return parseFrom(new StringReader(structure), new StringReader(words));
    }

    /**
     * Parses a puzzle. The structure has one line per grid row, with '_'
     * marking a fillable cell and any other character a blocked one; short
     * rows are padded with blocked cells. The word list is a whitespace
     * separated sequence of words.
     * @param structure textual grid structure
     * @param words textual word list
     * @return a puzzle instance ready to be solved
     */
    public static Crossword parseFrom(Reader structure, Reader words) {
        List<String> rows = new BufferedReader(structure).lines().collect(Collectors.toList());
        // Trailing blank lines carry no cells.
        while (!rows.isEmpty() && rows.get(rows.size() - 1).trim().isEmpty()) rows.remove(rows.size() - 1);
        if (rows.isEmpty()) throw new IllegalArgumentException("empty crossword structure");
        int w = rows.stream().mapToInt(String::length).max().orElse(0);
        boolean[][] s = new boolean[rows.size()][w];
        for (int i = 0; i < rows.size(); ++i) {
            String row = rows.get(i);
            for (int j = 0; j < row.length(); ++j) {
                s[i][j] = row.charAt(j) == FILLABLE;
            }
        }
        List<String> ws = new BufferedReader(words).lines()
                .flatMap(wordSplitter::splitToStream)
                .collect(Collectors.toList());
        return new Crossword(s, ws);
    }
}
