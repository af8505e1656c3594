package net.littleredcomputer.rsolver;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating a formula (or a prefix of its tokens): a truth value or
 * an error message, never both. {@link #end()} is the cursor position just past
 * the tokens the evaluation consumed; for an error it marks where evaluation
 * stopped.
 */
public final class EvalResult {
    private final boolean value;
    private final String error;
    private final int end;

    private EvalResult(boolean value, String error, int end) {
        this.value = value;
        this.error = error;
        this.end = end;
    }

    static EvalResult of(boolean value, int end) { return new EvalResult(value, null, end); }

    static EvalResult error(int end, String format, Object... args) {
        return new EvalResult(false, String.format(format, args), end);
    }

    public boolean isError() { return error != null; }

    /** @return true iff evaluation succeeded and produced true */
    public boolean isTrue() { return error == null && value; }

    public Optional<Boolean> value() { return isError() ? Optional.empty() : Optional.of(value); }

    public Optional<String> error() { return Optional.ofNullable(error); }

    public int end() { return end; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvalResult)) return false;
        EvalResult r = (EvalResult) o;
        return value == r.value && end == r.end && Objects.equals(error, r.error);
    }

    @Override
    public int hashCode() { return Objects.hash(value, error, end); }

    @Override
    public String toString() {
        if (isError()) return error;
        return value ? "True" : "False";
    }
}
