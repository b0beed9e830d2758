// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import javax.annotation.CheckReturnValue;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Fills a crossword by treating it as a constraint satisfaction problem.
 * Each variable's domain starts as the whole word list; node consistency
 * removes words of the wrong length, AC-3 removes words without support in
 * a crossing slot, and backtracking search with the MRV/degree and
 * least-constraining-value heuristics finds a complete assignment.
 *
 * <p>An instance owns its domains, which shrink as {@link #solve()} proceeds.
 * It is not safe for use by more than one thread.
 */
public class CrosswordCreator {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordCreator.class);

    public enum Strategy {
        FIRST,
        MRV,
    }
    private Strategy strategy = Strategy.MRV;

    /** An ordered pair of crossing variables; revising it prunes x against y. */
    public static final class Arc {
        final Variable x;
        final Variable y;

        private Arc(Variable x, Variable y) { this.x = x; this.y = y; }

        public static Arc of(Variable x, Variable y) { return new Arc(x, y); }

        @Override
        public String toString() { return x + " -> " + y; }
    }

    private final Crossword crossword;
    private final ImmutableList<Variable> variables;  // index to variable
    private final Map<Variable, Integer> variableIndex = new HashMap<>();  // inverse of above mapping
    private final Map<Variable, SortedSet<String>> domains = new LinkedHashMap<>();

    private int logCheckSteps = 1000;
    private long nodeCount = 0;
    private long lastNodeCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public CrosswordCreator(Crossword crossword) {
        this.crossword = crossword;
        this.variables = crossword.variables().asList();
        for (int k = 0; k < variables.size(); ++k) {
            Variable v = variables.get(k);
            variableIndex.put(v, k);
            // One copy per variable; domains shrink independently.
            domains.put(v, new TreeSet<>(crossword.words()));
        }
    }

    public CrosswordCreator setStrategy(Strategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public CrosswordCreator setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /** Sets how many search nodes pass between checks of the log interval. */
    CrosswordCreator setLogCheckSteps(int logCheckSteps) {
        if (logCheckSteps < 1) throw new IllegalArgumentException("logCheckSteps must be positive");
        this.logCheckSteps = logCheckSteps;
        return this;
    }

    /** @return a read-only view of the current domain of each variable */
    public Map<Variable, Set<String>> domains() {
        return Maps.transformValues(domains, Collections::unmodifiableSet);
    }

    /** @return number of partial assignments visited by the search so far */
    public long nodeCount() {
        return nodeCount;
    }

    /**
     * Enforce node and arc consistency, and then search for a complete
     * assignment.
     * @return a complete, consistent assignment, or empty if the puzzle has no
     * solution
     */
    public Optional<Map<Variable, String>> solve() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastNodeCount = nodeCount;
        enforceNodeConsistency();
        if (!ac3()) {
            log.debug("arc consistency emptied a domain after %s", stopwatch);
            return Optional.empty();
        }
        Optional<Map<Variable, String>> result = backtrack(new LinkedHashMap<>());
        log.debug("search %s after %d nodes in %s", result.isPresent() ? "succeeded" : "failed", nodeCount, stopwatch);
        return result;
    }

    /**
     * Remove from each domain the words whose length differs from the
     * variable's length.
     */
    public void enforceNodeConsistency() {
        domains.forEach((v, words) -> {
            words.removeIf(w -> w.length() != v.length);
            log.debug("%s: %d words after node consistency", v, words.size());
        });
    }

    /**
     * Make x arc consistent with y: remove from the domain of x each word for
     * which no word in the domain of y agrees at their crossing.
     * @return true iff the domain of x was changed; false also when x and y do
     * not cross
     */
    @CheckReturnValue
    public boolean revise(Variable x, Variable y) {
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        final Overlap overlap = o.get();
        final Set<String> ys = domains.get(y);
        return domains.get(x).removeIf(w1 -> {
            for (String w2 : ys) {
                if (overlap.agrees(w1, w2)) return false;
            }
            return true;
        });
    }

    /**
     * Run AC-3 starting from every arc of the puzzle.
     * @return false if some domain was emptied, true otherwise
     */
    @CheckReturnValue
    public boolean ac3() {
        TIntArrayList queue = new TIntArrayList();
        for (Variable x : variables) {
            for (Variable y : crossword.neighbors(x)) queue.add(encodeArc(x, y));
        }
        return propagate(queue);
    }

    /**
     * Run AC-3 starting from the given arcs.
     * @return false if some domain was emptied, true otherwise
     */
    @CheckReturnValue
    public boolean ac3(Iterable<Arc> arcs) {
        TIntArrayList queue = new TIntArrayList();
        for (Arc a : arcs) queue.add(encodeArc(a.x, a.y));
        return propagate(queue);
    }

    private boolean propagate(TIntArrayList queue) {
        // The queue only grows at its tail, so a moving head gives FIFO order.
        for (int head = 0; head < queue.size(); ++head) {
            int arc = queue.get(head);
            Variable x = variables.get(arc / variables.size());
            Variable y = variables.get(arc % variables.size());
            if (!revise(x, y)) continue;
            if (domains.get(x).isEmpty()) {
                log.debug("domain of %s emptied by %s", x, y);
                return false;
            }
            for (Variable z : crossword.neighbors(x)) {
                if (!z.equals(y)) queue.add(encodeArc(z, x));
            }
        }
        return true;
    }

    private int encodeArc(Variable x, Variable y) {
        return variableIndex.get(x) * variables.size() + variableIndex.get(y);
    }

    /** @return true iff every variable of the puzzle is assigned */
    public boolean assignmentComplete(Map<Variable, String> assignment) {
        return assignment.keySet().containsAll(variables);
    }

    /**
     * @return true iff the assigned words are distinct, each fits its
     * variable's length, and every pair of assigned crossing variables agrees
     * on the shared letter
     */
    public boolean consistent(Map<Variable, String> assignment) {
        if (new HashSet<>(assignment.values()).size() != assignment.size()) return false;
        for (Map.Entry<Variable, String> e : assignment.entrySet()) {
            Variable x = e.getKey();
            String w1 = e.getValue();
            if (w1.length() != x.length) return false;
            for (Variable y : crossword.neighbors(x)) {
                String w2 = assignment.get(y);
                if (w2 == null) continue;
                // Guards the overlap index below.
                if (w2.length() != y.length) return false;
                if (!crossword.overlap(x, y).map(o -> o.agrees(w1, w2)).orElse(true)) return false;
            }
        }
        return true;
    }

    /**
     * Order the domain of var by the number of words each choice would rule
     * out among the domains of var's unassigned neighbors, fewest first. Ties
     * keep the domain's (alphabetical) order.
     */
    public List<String> orderDomainValues(Variable var, Map<Variable, String> assignment) {
        List<String> values = new ArrayList<>(domains.get(var));
        Map<String, Integer> eliminated = new HashMap<>();
        boolean constrained = false;
        for (Variable n : crossword.neighbors(var)) {
            if (assignment.containsKey(n)) continue;
            constrained = true;
            Overlap overlap = crossword.overlap(var, n).get();
            Set<String> ns = domains.get(n);
            for (String w1 : values) {
                int count = 0;
                for (String w2 : ns) {
                    if (!overlap.agrees(w1, w2)) ++count;
                }
                eliminated.merge(w1, count, Integer::sum);
            }
        }
        if (constrained) values.sort(Comparator.comparingInt(eliminated::get));
        return values;
    }

    /**
     * Choose the next variable to assign. Under MRV this is the unassigned
     * variable with the fewest remaining words, ties going to the one with
     * the most neighbors and then to the earliest in puzzle order.
     */
    public Variable selectUnassignedVariable(Map<Variable, String> assignment) {
        Variable best = null;
        int bestSize = Integer.MAX_VALUE;
        int bestDegree = -1;
        for (Variable v : variables) {
            if (assignment.containsKey(v)) continue;
            if (strategy == Strategy.FIRST) return v;
            int size = domains.get(v).size();
            int degree = crossword.neighbors(v).size();
            if (size < bestSize || (size == bestSize && degree > bestDegree)) {
                best = v;
                bestSize = size;
                bestDegree = degree;
            }
        }
        if (best == null) throw new IllegalStateException("all variables are assigned");
        return best;
    }

    /**
     * Extend a partial assignment to a complete one by depth-first search.
     * Bindings tried and rejected along the way are removed again, so on
     * failure the assignment is left as it was given.
     * @param assignment partial assignment; it is extended in place
     * @return the completed assignment, or empty if none extends the input
     */
    public Optional<Map<Variable, String>> backtrack(Map<Variable, String> assignment) {
        ++nodeCount;
        if (nodeCount % logCheckSteps == 0) maybeReportProgress(assignment);
        if (assignmentComplete(assignment)) return Optional.of(assignment);
        Variable var = selectUnassignedVariable(assignment);
        for (String value : orderDomainValues(var, assignment)) {
            assignment.put(var, value);
            if (consistent(assignment)) {
                Optional<Map<Variable, String>> result = backtrack(assignment);
                if (result.isPresent()) return result;
            }
            assignment.remove(var);
        }
        return Optional.empty();
    }

    /** @return true if a progress line was logged */
    boolean maybeReportProgress(Map<Variable, String> assignment) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return false;
        final double perSec = 1e3 * (nodeCount - lastNodeCount) / Math.max(1, tween.toMillis());
        final int depth = assignment.size();
        log.info(() -> new FormattedMessage("%d nodes %s %.0f/sec depth %d/%d",
                nodeCount, stopwatch, perSec, depth, variables.size()));
        lastLogTime = now;
        lastNodeCount = nodeCount;
        return true;
    }
}
