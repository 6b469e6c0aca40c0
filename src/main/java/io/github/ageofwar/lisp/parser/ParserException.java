package io.github.ageofwar.lisp.parser;

import io.github.ageofwar.lisp.SyntaxException;
import io.github.ageofwar.lisp.lexer.Token;

public class ParserException extends SyntaxException {
    private final Class<? extends Token> expected;
    private final Token actual;

    public ParserException(String message, Class<? extends Token> expected, Token actual) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }

    public ParserException(String message, Token actual) {
        this(message, null, actual);
    }

    public ParserException(String message, Token actual, Throwable cause) {
        super(message, cause);
        this.expected = null;
        this.actual = actual;
    }

    public Class<? extends Token> expected() {
        return expected;
    }

    public Token actual() {
        return actual;
    }
}
