package net.littleredcomputer.rsolver;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Depth-first search for a satisfying assignment. Each node of the search tree
 * is an {@link Assignment}; a node whose formula value is false and which still
 * has a thawed literal has two children, obtained by freezing that literal at
 * true and then at false. The first node at which the formula is true is the
 * answer. Nodes are kept on an explicit stack rather than the Java call
 * stack, visited in the same order recursion would visit them.
 */
public class BacktrackingSolver {
    private static final Logger log = LogManager.getFormatterLogger(BacktrackingSolver.class);
    private static final boolean[] branchOrder = {true, false};
    int logCheckSteps = 10000;
    private final Formula formula;
    private SearchStatistics stats = new SearchStatistics();
    long stepCount;
    int progressReports;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public BacktrackingSolver(Formula formula) {
        this.formula = formula;
    }

    public BacktrackingSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /** @return counters for the most recent call to {@link #solve()} */
    public SearchStatistics statistics() { return stats; }

    private void start() {
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    private final static int initialStateSegment = 81;
    private final static int finalStateSegment = 16;
    static String stateToString(Assignment a) {
        String s = a.frozenPrefix();
        if (s.length() <= 100) return s;
        return s.substring(0, initialStateSegment) + "..." + s.substring(s.length() - finalStateSegment);
    }

    private void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d steps %s %.0f/sec %s", stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
        ++progressReports;
    }

    /**
     * Check the formula's syntax with every literal thawed, then search.
     * Each call starts from scratch; statistics from an earlier call are discarded.
     *
     * @return the first satisfying assignment in trial order (true before false, registry order), or
     *     unsatisfiable, or the first evaluation error
     */
    public SearchResult solve() {
        stats = new SearchStatistics();
        stepCount = 0;
        progressReports = 0;
        final LiteralRegistry registry = formula.literals();
        if (registry.isEmpty()) return SearchResult.error("There are no literals -- nothing to solve");
        EvalResult check = formula.evaluate(formula.initialAssignment(), stats);
        if (check.isError()) return SearchResult.error("Formula has invalid syntax -- " + check);

        start();
        final Deque<Assignment> pending = new ArrayDeque<>();
        pending.push(formula.initialAssignment());
        while (!pending.isEmpty()) {
            final Assignment a = pending.pop();
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(() -> stateToString(a));
            stats.depth(a.frozenCount());
            EvalResult r = formula.evaluate(a, stats);
            if (r.isError()) return SearchResult.error(r.error().get());
            if (r.isTrue()) {
                stopwatch.stop();
                log.trace("satisfied at depth %d after %d steps: %s", a.frozenCount(), stepCount, a);
                return SearchResult.satisfied(registry, a);
            }
            if (!a.hasThawed()) {
                stats.deadEnd();
                continue;
            }
            // Push in reverse so the first branch value comes off the stack first.
            for (int i = branchOrder.length - 1; i >= 0; --i) pending.push(a.freezeNext(branchOrder[i]));
        }
        stopwatch.stop();
        log.trace("exhausted %d steps in %s: %s", stepCount, stopwatch, stats);
        return SearchResult.unsatisfiable();
    }
}
