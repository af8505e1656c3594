package net.littleredcomputer.rsolver;

public enum TokenType {
    AND("&"),
    OR("|"),
    NOT("~"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    LITERAL("Literal"),
    UNKNOWN("Unknown"),
    EOF("Eof");

    private final String symbol;

    TokenType(String symbol) { this.symbol = symbol; }

    /** @return the source text of an operator or bracket, or a descriptive word for the other types */
    public String symbol() { return symbol; }

    boolean isBinaryOperator() { return this == AND || this == OR; }
}
