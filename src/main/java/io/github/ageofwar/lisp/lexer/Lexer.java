package io.github.ageofwar.lisp.lexer;

import io.github.ageofwar.lisp.SyntaxException;

import java.io.Reader;
import java.io.StringReader;
import java.util.function.IntPredicate;

public class Lexer implements TokenStream {
    private final BufferedCharStream reader;

    public Lexer(Reader reader) {
        this.reader = new BufferedCharStream(reader);
    }

    public Lexer(String input) {
        this(new StringReader(input));
    }

    @Override
    public Token nextToken() {
        var peek = reader.peek(2);
        return switch (peek[0]) {
            case -1 -> new Token.EndOfFile();
            case ' ' -> nextSpace();
            case '(' -> nextLeftParenthesis();
            case ')' -> nextRightParenthesis();
            case '0', '1', '2', '3', '4', '5', '6', '7', '8', '9' -> nextInteger();
            case '-' -> {
                if (isDigit(peek[1])) {
                    yield nextInteger();
                }
                throw new LexerException("Unexpected character: '-'");
            }
            default -> {
                if (Character.isLetter(peek[0])) {
                    yield nextIdentifier();
                }
                throw new LexerException("Unexpected character: '" + Character.toString(peek[0]) + "'");
            }
        };
    }

    public Token.Identifier nextIdentifier() {
        var builder = new StringBuilder();
        builder.appendCodePoint(expect(Character::isLetter, "Expected identifier"));
        while (Character.isLetterOrDigit(reader.peek())) {
            builder.appendCodePoint(reader.next());
        }
        return new Token.Identifier(builder.toString());
    }

    public Token.IntegerLiteral nextInteger() {
        var builder = new StringBuilder();
        if (reader.peek() == '-') {
            builder.appendCodePoint(reader.next());
        }
        builder.appendCodePoint(expect(Lexer::isDigit, "Expected digit"));
        while (isDigit(reader.peek())) {
            builder.appendCodePoint(reader.next());
        }
        return new Token.IntegerLiteral(builder.toString());
    }

    public Token.Space nextSpace() {
        expect(' ');
        return new Token.Space();
    }

    public Token.LeftParenthesis nextLeftParenthesis() {
        expect('(');
        return new Token.LeftParenthesis();
    }

    public Token.RightParenthesis nextRightParenthesis() {
        expect(')');
        return new Token.RightParenthesis();
    }

    private static boolean isDigit(int codePoint) {
        return codePoint >= '0' && codePoint <= '9';
    }

    private int expect(IntPredicate predicate, String message) {
        if (!predicate.test(reader.peek())) {
            throw new LexerException(message);
        }
        return reader.next();
    }

    private void expect(char expected) {
        expect((c) -> c == expected, "Expected '" + expected + "'");
    }

    private String errorMessage(String message) {
        var next = reader.peek();
        var butGot = ", but got " + (next == -1 ? "EOF" : "'" + Character.toString(next) + "'");
        var at = " at position " + reader.position();
        return message.startsWith("Expected") ? message + butGot + at : message + at;
    }

    public class LexerException extends SyntaxException {
        public LexerException(String message) {
            super(errorMessage(message), reader.position());
        }
    }
}
