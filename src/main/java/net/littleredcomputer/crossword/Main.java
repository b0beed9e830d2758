// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);

    private static Options options() {
        return new Options()
                .addOption("structure", true, "filename of crossword structure ('_' marks a fillable cell)")
                .addOption("words", true, "filename of word list")
                .addOption("strategy", true, "variable selection strategy: FIRST or MRV")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader input(CommandLine cmd, String option) throws FileNotFoundException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        String p = cmd.getOptionValue(option);
        return new BufferedReader(p.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(p), StandardCharsets.UTF_8));
    }

    private static CrosswordCreator.Strategy strategy(CommandLine cmd) {
        String s = cmd.getOptionValue("strategy", "MRV");
        try {
            return CrosswordCreator.Strategy.valueOf(s);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown strategy: " + s, e);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        String s = cmd.getOptionValue("loginterval", "PT1S");
        try {
            return Duration.parse(s);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid log interval: " + s, e);
        }
    }

    /**
     * Solve the puzzle described by the command line and print the filled
     * grid, or "No solution." if there is none.
     */
    static void run(String[] args, PrintStream out) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Crossword crossword;
        try (Reader structure = input(cmd, "structure"); Reader words = input(cmd, "words")) {
            crossword = Crossword.parseFrom(structure, words);
        }
        log.debug("%d x %d grid, %d slots, %d words", crossword.height(), crossword.width(),
                crossword.variables().size(), crossword.words().size());
        Stopwatch sw = Stopwatch.createStarted();
        CrosswordCreator creator = new CrosswordCreator(crossword)
                .setStrategy(strategy(cmd))
                .setLogInterval(logInterval(cmd));
        Optional<Map<Variable, String>> assignment = creator.solve();
        sw.stop();
        log.info("%s after %d nodes in %s", assignment.isPresent() ? "solved" : "unsatisfiable", creator.nodeCount(), sw);
        if (assignment.isPresent()) {
            out.print(crossword.render(assignment.get()));
        } else {
            out.println("No solution.");
        }
    }

    public static void main(String[] args) throws ParseException, IOException {
        run(args, new PrintStream(new FileOutputStream(FileDescriptor.out), true, "UTF-8"));
    }
}
