package io.github.ageofwar.lisp.parser;

import io.github.ageofwar.lisp.lexer.Token;
import io.github.ageofwar.lisp.lexer.TokenStream;

import java.util.ArrayDeque;
import java.util.Deque;

public class BufferedTokenStream {
    public static final int MAX_LOOKAHEAD = 2;

    private final TokenStream stream;
    private final Deque<Token> peek;

    private Token lastToken;

    public BufferedTokenStream(TokenStream stream) {
        this.stream = stream;
        peek = new ArrayDeque<>(MAX_LOOKAHEAD);
    }

    public Token next() {
        lastToken = peek.isEmpty() ? stream.nextToken() : peek.poll();
        return lastToken;
    }

    public Token peek() {
        if (peek.isEmpty()) {
            peek.add(stream.nextToken());
        }
        return peek.peek();
    }

    public Token[] peek(int count) {
        if (count < 1 || count > MAX_LOOKAHEAD) {
            throw new IllegalArgumentException("Lookahead must be between 1 and " + MAX_LOOKAHEAD + ", but got " + count);
        }
        while (peek.size() < count) {
            peek.add(stream.nextToken());
        }
        return peek.toArray(new Token[0]);
    }

    public Token lastToken() {
        return lastToken;
    }
}
