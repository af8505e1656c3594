package net.littleredcomputer.rsolver;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/**
 * Splits formula text into tokens. Tokenizing never fails: a character that
 * starts no token becomes an {@link TokenType#UNKNOWN} token, and the
 * evaluator decides whether it is an error.
 */
public final class Tokenizer {
    // The C locale's isspace/isalpha/isalnum, which is what the formula language was defined against.
    private static final CharMatcher space = CharMatcher.anyOf(" \t\n\u000b\f\r");
    private static final CharMatcher letter = CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'));
    private static final CharMatcher letterOrDigit = letter.or(CharMatcher.inRange('0', '9'));

    private final CharSequence text;
    private int position = 0;

    private Tokenizer(CharSequence text) {
        this.text = text;
    }

    public static ImmutableList<Token> tokenize(CharSequence text) {
        Tokenizer t = new Tokenizer(text);
        ImmutableList.Builder<Token> tokens = ImmutableList.builder();
        for (Token token = t.next(); token.type() != TokenType.EOF; token = t.next()) tokens.add(token);
        return tokens.build();
    }

    private Token next() {
        while (position < text.length() && space.matches(text.charAt(position))) ++position;
        if (position >= text.length()) return Token.EOF;
        char c = text.charAt(position++);
        switch (c) {
            case '&': return Token.of(TokenType.AND);
            case '|': return Token.of(TokenType.OR);
            case '~': return Token.of(TokenType.NOT);
            case '(': return Token.of(TokenType.OPEN_PAREN);
            case ')': return Token.of(TokenType.CLOSE_PAREN);
            default:
                if (!letter.matches(c)) return Token.unknown(c);
                int start = position - 1;
                while (position < text.length() && letterOrDigit.matches(text.charAt(position))) ++position;
                return Token.literal(text.subSequence(start, position).toString());
        }
    }
}
