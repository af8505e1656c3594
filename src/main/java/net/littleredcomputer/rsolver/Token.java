package net.littleredcomputer.rsolver;

import java.util.Objects;

/**
 * An immutable lexical token. Literal tokens carry their name and, once a
 * {@link LiteralRegistry} has resolved them, the index of that name in the
 * registry. Unknown tokens remember the offending character so that the
 * evaluator can report it.
 */
public final class Token {
    static final int UNRESOLVED = -1;
    static final Token EOF = new Token(TokenType.EOF, null, UNRESOLVED);

    private final TokenType type;
    private final String text;  // literal name, or the unrecognized character
    private final int index;

    private Token(TokenType type, String text, int index) {
        this.type = type;
        this.text = text;
        this.index = index;
    }

    static Token of(TokenType type) {
        if (type == TokenType.LITERAL || type == TokenType.UNKNOWN) {
            throw new IllegalArgumentException("token type " + type + " requires text");
        }
        return new Token(type, null, UNRESOLVED);
    }

    static Token literal(String name) { return new Token(TokenType.LITERAL, name, UNRESOLVED); }

    static Token unknown(char c) { return new Token(TokenType.UNKNOWN, String.valueOf(c), UNRESOLVED); }

    /**
     * @param index position of this literal's name in the registry
     * @return a copy of this literal token bound to the given index
     */
    Token withIndex(int index) {
        if (type != TokenType.LITERAL) throw new IllegalStateException("only literals can be resolved: " + this);
        return new Token(type, text, index);
    }

    public TokenType type() { return type; }

    public String name() { return text; }

    public int index() { return index; }

    public boolean isLiteral() { return type == TokenType.LITERAL; }

    public boolean isResolved() { return index != UNRESOLVED; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return type == t.type && index == t.index && Objects.equals(text, t.text);
    }

    @Override
    public int hashCode() { return Objects.hash(type, text, index); }

    @Override
    public String toString() { return isLiteral() ? text : type.symbol(); }
}
