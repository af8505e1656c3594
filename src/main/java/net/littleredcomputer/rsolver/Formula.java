package net.littleredcomputer.rsolver;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.Map;

/**
 * A formula ready for solving: its tokens, with every literal resolved against
 * the formula's own {@link LiteralRegistry}. Both are built once and never
 * change.
 */
public final class Formula {
    private static final Joiner spaceJoiner = Joiner.on(' ');

    private final ImmutableList<Token> tokens;
    private final LiteralRegistry registry;
    private final Evaluator evaluator;

    private Formula(ImmutableList<Token> tokens) {
        this.registry = LiteralRegistry.of(tokens);
        this.tokens = registry.resolve(tokens);
        this.evaluator = new Evaluator(this.tokens);
    }

    public static Formula parse(CharSequence text) {
        return new Formula(Tokenizer.tokenize(text));
    }

    public ImmutableList<Token> tokens() { return tokens; }

    public LiteralRegistry literals() { return registry; }

    public Assignment initialAssignment() { return Assignment.allThawed(registry.size()); }

    public EvalResult evaluate(Assignment assignment) {
        return evaluate(assignment, new SearchStatistics());
    }

    /**
     * Evaluate the whole formula. Unlike {@link Evaluator#evaluate}, this
     * insists that every token is consumed, so a stray close bracket at the
     * top level is an error.
     */
    public EvalResult evaluate(Assignment assignment, SearchStatistics stats) {
        if (assignment.size() != registry.size()) {
            throw new IllegalArgumentException(String.format("assignment has %d values for %d literals",
                    assignment.size(), registry.size()));
        }
        stats.evaluation();
        EvalResult r = evaluator.evaluate(0, assignment, stats);
        if (!r.isError() && r.end() < tokens.size()) return EvalResult.error(r.end(), "Unexpected close bracket");
        return r;
    }

    /**
     * Evaluate under named truth values. Literals not mentioned in the map are false; null values are rejected.
     */
    public EvalResult evaluate(Map<String, Boolean> values) {
        boolean[] v = new boolean[registry.size()];
        values.forEach((name, value) -> {
            int ix = registry.indexOf(name);
            if (ix == Token.UNRESOLVED) throw new IllegalArgumentException("unknown literal: " + name);
            if (value == null) throw new IllegalArgumentException("no truth value for literal: " + name);
            v[ix] = value;
        });
        return evaluate(Assignment.of(v));
    }

    @Override
    public String toString() { return spaceJoiner.join(tokens); }
}
