package io.github.ageofwar.lisp.parser;

import io.github.ageofwar.lisp.lexer.Token;

public class Parsers {
    private Parsers() {
    }

    public static <T extends Token> T expect(BufferedTokenStream tokens, Class<T> tokenType) {
        var token = tokens.peek();
        if (!tokenType.isInstance(token)) {
            throw new ParserException(errorMessage("Expected " + tokenType.getSimpleName(), token), tokenType, token);
        }
        return tokenType.cast(tokens.next());
    }

    public static boolean matches(BufferedTokenStream tokens, Class<? extends Token> tokenType) {
        return tokenType.isInstance(tokens.peek());
    }

    public static ParserException error(String message, Token actual) {
        return new ParserException(errorMessage(message, actual), actual);
    }

    private static String errorMessage(String message, Token actual) {
        return message + ", but got " + Token.describe(actual);
    }
}
