package io.github.ageofwar.lisp.parser;

import io.github.ageofwar.lisp.lexer.Lexer;
import io.github.ageofwar.lisp.lexer.Token;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BufferedTokenStreamTest {
    @Test
    void peekDoesNotConsume() {
        var tokens = new BufferedTokenStream(new Lexer("x y"));
        assertEquals(new Token.Identifier("x"), tokens.peek());
        assertEquals(new Token.Identifier("x"), tokens.peek());
        assertEquals(new Token.Identifier("x"), tokens.next());
        assertEquals(new Token.Space(), tokens.next());
    }

    @Test
    void peeksOneTokenPastTheCurrentOne() {
        var tokens = new BufferedTokenStream(new Lexer("x)"));
        var peek = tokens.peek(2);
        assertEquals(new Token.Identifier("x"), peek[0]);
        assertEquals(new Token.RightParenthesis(), peek[1]);
        assertEquals(new Token.Identifier("x"), tokens.next());
        assertEquals(new Token.RightParenthesis(), tokens.next());
        assertInstanceOf(Token.EndOfFile.class, tokens.next());
        assertInstanceOf(Token.EndOfFile.class, tokens.lastToken());
    }

    @Test
    void rejectsDeeperLookahead() {
        var tokens = new BufferedTokenStream(new Lexer("a b c"));
        assertThrows(IllegalArgumentException.class, () -> tokens.peek(3));
    }

    @Test
    void expectReportsExpectedAndActualKinds() {
        var tokens = new BufferedTokenStream(new Lexer("5"));
        var exception = assertThrows(ParserException.class, () -> Parsers.expect(tokens, Token.Space.class));
        assertEquals(Token.Space.class, exception.expected());
        assertEquals(new Token.IntegerLiteral("5"), exception.actual());
        assertEquals("Expected Space, but got IntegerLiteral '5'", exception.getMessage());
        assertEquals(-1, exception.position());
        assertEquals(new Token.IntegerLiteral("5"), Parsers.expect(tokens, Token.IntegerLiteral.class));
    }
}
