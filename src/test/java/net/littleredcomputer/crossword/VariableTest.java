// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import org.junit.Test;

import static net.littleredcomputer.crossword.Variable.Direction.ACROSS;
import static net.littleredcomputer.crossword.Variable.Direction.DOWN;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class VariableTest {
    @Test
    public void cells() {
        assertThat(new Variable(1, 2, ACROSS, 3).cells(),
                contains(new Variable.Cell(1, 2), new Variable.Cell(1, 3), new Variable.Cell(1, 4)));
        assertThat(new Variable(1, 2, DOWN, 2).cells(),
                contains(new Variable.Cell(1, 2), new Variable.Cell(2, 2)));
    }

    @Test
    public void valueEquality() {
        assertThat(new Variable(0, 0, ACROSS, 3), is(new Variable(0, 0, ACROSS, 3)));
        assertThat(new Variable(0, 0, ACROSS, 3).hashCode(), is(new Variable(0, 0, ACROSS, 3).hashCode()));
        assertThat(new Variable(0, 0, ACROSS, 3), is(not(new Variable(0, 0, DOWN, 3))));
        assertThat(new Variable(0, 0, ACROSS, 3), is(not(new Variable(0, 0, ACROSS, 4))));
        assertThat(new Variable(0, 0, ACROSS, 3), is(not(new Variable(0, 1, ACROSS, 3))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void lengthMustBePositive() {
        new Variable(0, 0, ACROSS, 0);
    }

    @Test
    public void overlapAgreement() {
        Overlap o = new Overlap(2, 0);
        assertThat(o.agrees("CAT", "TAR"), is(true));
        assertThat(o.agrees("CAT", "RAT"), is(false));
        assertThat(o.reversed(), is(new Overlap(0, 2)));
        assertThat(o.reversed().agrees("TAR", "CAT"), is(true));
        assertThat(o.agrees("AX", "TAR"), is(false));
        assertThat(o.reversed().agrees("TAR", "AX"), is(false));
    }
}
