package io.github.ageofwar.lisp.lexer;

public interface TokenStream {
    Token nextToken();
}
