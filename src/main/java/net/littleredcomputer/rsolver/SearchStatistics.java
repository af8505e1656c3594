package net.littleredcomputer.rsolver;

/**
 * Counters accumulated during one solve. Nothing in the search reads them back;
 * they exist to be reported.
 */
public final class SearchStatistics {
    private long evaluations;
    private long lookups;
    private long deadEnds;
    private int maxDepth;

    void evaluation() { ++evaluations; }

    void lookup() { ++lookups; }

    void deadEnd() { ++deadEnds; }

    void depth(int d) { if (d > maxDepth) maxDepth = d; }

    /** @return number of whole-formula evaluations, including the initial syntax check */
    public long evaluations() { return evaluations; }

    /** @return number of literal values read by the evaluator */
    public long lookups() { return lookups; }

    /** @return number of fully committed assignments under which the formula was false */
    public long deadEnds() { return deadEnds; }

    /** @return largest number of literals frozen at any node visited */
    public int maxDepth() { return maxDepth; }

    @Override
    public String toString() {
        return String.format("%d evals %d lookups %d dead ends max depth %d", evaluations, lookups, deadEnds, maxDepth);
    }
}
