// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MainTest {
    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private String file(String name, String contents) throws Exception {
        File f = folder.newFile(name);
        Files.write(f.toPath(), contents.getBytes(StandardCharsets.UTF_8));
        return f.getPath();
    }

    private String run(String... args) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        Main.run(args, new PrintStream(bytes, true, "UTF-8"));
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void printsSolvedGrid() throws Exception {
        String structure = file("structure.txt", "#___#\n#_##_\n#_##_\n#_##_\n#____\n");
        String words = file("words.txt", "one\ntwo\nthree\nfour\nfive\nsix\nseven\neight\nnine\nten\n");
        assertThat(run("-structure", structure, "-words", words, "-loginterval", "PT0.1S"),
                is("█SIX█\n" +
                   "█E██F\n" +
                   "█V██I\n" +
                   "█E██V\n" +
                   "█NINE\n"));
        assertThat(run("-structure", structure, "-words", words, "-strategy", "FIRST"),
                is("█SIX█\n" +
                   "█E██F\n" +
                   "█V██I\n" +
                   "█E██V\n" +
                   "█NINE\n"));
    }

    @Test
    public void reportsNoSolution() throws Exception {
        String structure = file("structure.txt", "___\n##_\n##_\n");
        String words = file("words.txt", "abc\nxyz\n");
        assertThat(run("-structure", structure, "-words", words), is("No solution." + System.lineSeparator()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void structureIsRequired() throws Exception {
        run("-words", file("words.txt", "cat\n"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedLogInterval() throws Exception {
        run("-structure", file("structure.txt", "___\n"), "-words", file("words.txt", "cat\n"), "-loginterval", "soon");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownStrategy() throws Exception {
        run("-structure", file("structure.txt", "___\n"), "-words", file("words.txt", "cat\n"), "-strategy", "RANDOM");
    }
}
