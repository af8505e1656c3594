package net.littleredcomputer.rsolver;

/**
 * Process exit statuses. These follow minisat's conventions except that a
 * satisfiable formula exits with 0 rather than 10, so that 0 means nothing
 * but "satisfiable".
 */
public enum ExitCode {
    SATISFIABLE(0),
    CANNOT_READ_INPUT(1),
    COMMAND_LINE_FAIL(2),
    CANNOT_PARSE_INPUT(3),
    UNSATISFIABLE(20);

    private final int status;

    ExitCode(int status) { this.status = status; }

    public int status() { return status; }

    static ExitCode of(SearchResult r) {
        switch (r.outcome()) {
            case SATISFIED: return SATISFIABLE;
            case UNSATISFIABLE: return UNSATISFIABLE;
            default: return CANNOT_PARSE_INPUT;
        }
    }
}
