package net.littleredcomputer.rsolver;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Objects;
import java.util.Optional;

/**
 * What a solve established: the formula is satisfied by a witness assignment,
 * no assignment satisfies it, or it could not be evaluated at all.
 */
public final class SearchResult {
    public enum Outcome {
        SATISFIED,
        UNSATISFIABLE,
        ERROR,
    }

    private final Outcome outcome;
    private final String error;
    private final Assignment witness;
    private final ImmutableList<String> names;

    private SearchResult(Outcome outcome, String error, Assignment witness, ImmutableList<String> names) {
        this.outcome = outcome;
        this.error = error;
        this.witness = witness;
        this.names = names;
    }

    static SearchResult satisfied(LiteralRegistry registry, Assignment witness) {
        if (witness.size() != registry.size()) throw new IllegalArgumentException("witness does not cover the registry");
        return new SearchResult(Outcome.SATISFIED, null, witness, registry.names());
    }

    static SearchResult unsatisfiable() {
        return new SearchResult(Outcome.UNSATISFIABLE, null, null, ImmutableList.of());
    }

    static SearchResult error(String message) {
        return new SearchResult(Outcome.ERROR, Objects.requireNonNull(message), null, ImmutableList.of());
    }

    public Outcome outcome() { return outcome; }

    public boolean isSatisfied() { return outcome == Outcome.SATISFIED; }

    public boolean isError() { return outcome == Outcome.ERROR; }

    public Optional<String> error() { return Optional.ofNullable(error); }

    /** @return the satisfying assignment; thawed literals in it are false */
    public Optional<Assignment> witness() { return Optional.ofNullable(witness); }

    /**
     * @return the satisfying truth value of every literal, in registry order
     * @throws IllegalStateException if the formula was not satisfied
     */
    public ImmutableMap<String, Boolean> model() {
        if (!isSatisfied()) throw new IllegalStateException("no model: " + outcome);
        ImmutableMap.Builder<String, Boolean> b = ImmutableMap.builderWithExpectedSize(names.size());
        for (int i = 0; i < names.size(); ++i) b.put(names.get(i), witness.value(i));
        return b.build();
    }

    @Override
    public String toString() {
        switch (outcome) {
            case ERROR: return error;
            case UNSATISFIABLE: return "Unstatisfied";
            default:
                StringBuilder s = new StringBuilder("Satisfied with");
                model().forEach((name, value) -> s.append(' ').append(name).append('=').append(value ? "True" : "False"));
                return s.toString();
        }
    }
}
