package net.littleredcomputer.rsolver;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.List;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class TokenizerTest {
    private static List<TokenType> types(String s) {
        return Tokenizer.tokenize(s).stream().map(Token::type).collect(toList());
    }

    private static List<String> names(String s) {
        return Tokenizer.tokenize(s).stream().filter(Token::isLiteral).map(Token::name).collect(toList());
    }

    @Test
    public void operatorsAndBrackets() {
        assertThat(types("~(a&b)|c"), contains(TokenType.NOT, TokenType.OPEN_PAREN, TokenType.LITERAL, TokenType.AND,
                TokenType.LITERAL, TokenType.CLOSE_PAREN, TokenType.OR, TokenType.LITERAL));
    }

    @Test
    public void identifiers() {
        assertThat(names("mike & sally2 | ~peter100"), contains("mike", "sally2", "peter100"));
        assertThat(names("aB9c"), contains("aB9c"));
    }

    @Test
    public void identifierCannotStartWithDigit() {
        assertThat(types("2a"), contains(TokenType.UNKNOWN, TokenType.LITERAL));
        assertThat(names("2a"), contains("a"));
    }

    @Test
    public void whitespaceIsInsignificant() {
        assertThat(Tokenizer.tokenize(" a\t&\r\n\u000b\fb "), is(Tokenizer.tokenize("a&b")));
    }

    @Test
    public void emptyText() {
        assertThat(Tokenizer.tokenize(""), is(empty()));
        assertThat(Tokenizer.tokenize(" \n "), is(empty()));
    }

    @Test
    public void unrecognizedCharactersBecomeUnknownTokens() {
        ImmutableList<Token> ts = Tokenizer.tokenize("a_b $é");
        assertThat(ts.stream().map(Token::type).collect(toList()), contains(TokenType.LITERAL, TokenType.UNKNOWN,
                TokenType.LITERAL, TokenType.UNKNOWN, TokenType.UNKNOWN));
        assertThat(ts.get(1).name(), is("_"));
        assertThat(ts.get(3).name(), is("$"));
        assertThat(ts.get(4).name(), is("é"));
    }

    @Test
    public void tokensAreUnresolvedUntilRegistered() {
        assertThat(Tokenizer.tokenize("a b").stream().anyMatch(Token::isResolved), is(false));
    }

    @Test
    public void printedForm() {
        assertThat(Formula.parse("~(mike&sally)|#").toString(), is("~ ( mike & sally ) | Unknown"));
    }
}
