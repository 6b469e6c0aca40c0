package io.github.ageofwar.lisp.lexer;

import io.github.ageofwar.lisp.SyntaxException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {
    private static List<Token> tokenize(String input) {
        var lexer = new Lexer(input);
        var tokens = new ArrayList<Token>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (!(token instanceof Token.EndOfFile));
        return tokens;
    }

    @Test
    void emitsSpacesAsTokens() {
        assertEquals(List.of(
                new Token.LeftParenthesis(),
                new Token.Identifier("add"),
                new Token.Space(),
                new Token.IntegerLiteral("10"),
                new Token.Space(),
                new Token.IntegerLiteral("20"),
                new Token.RightParenthesis(),
                new Token.EndOfFile()
        ), tokenize("(add 10 20)"));
    }

    @Test
    void everyConsecutiveSpaceIsItsOwnToken() {
        assertEquals(List.of(new Token.Space(), new Token.Space(), new Token.IntegerLiteral("1"), new Token.EndOfFile()),
                tokenize("  1"));
    }

    @Test
    void readsNegativeIntegers() {
        assertEquals(List.of(new Token.IntegerLiteral("-42"), new Token.EndOfFile()), tokenize("-42"));
    }

    @Test
    void identifiersMayContainDigitsButNotStartWithThem() {
        assertEquals(List.of(new Token.Identifier("x1y2"), new Token.EndOfFile()), tokenize("x1y2"));
        assertEquals(List.of(new Token.IntegerLiteral("1"), new Token.Identifier("x"), new Token.EndOfFile()), tokenize("1x"));
    }

    @Test
    void integerStopsAtNonDigit() {
        assertEquals(List.of(new Token.IntegerLiteral("12"), new Token.RightParenthesis(), new Token.EndOfFile()), tokenize("12)"));
    }

    @Test
    void keepsReturningEndOfFile() {
        var lexer = new Lexer("");
        assertInstanceOf(Token.EndOfFile.class, lexer.nextToken());
        assertInstanceOf(Token.EndOfFile.class, lexer.nextToken());
    }

    @Test
    void rejectsUnexpectedCharacterWithPosition() {
        var lexer = new Lexer("(+ 1 2)");
        lexer.nextToken();
        var exception = assertThrows(SyntaxException.class, lexer::nextToken);
        assertEquals(1, exception.position());
        assertTrue(exception.getMessage().contains("'+'"), exception.getMessage());
    }

    @Test
    void rejectsMinusNotFollowedByDigit() {
        var exception = assertThrows(Lexer.LexerException.class, () -> tokenize("(add - 1)"));
        assertEquals(5, exception.position());
    }

    @Test
    void rejectsTabs() {
        assertThrows(SyntaxException.class, () -> tokenize("(add\t1 2)"));
    }
}
