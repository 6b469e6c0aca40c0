package io.github.ageofwar.lisp.lexer;

public sealed interface Token {
    record LeftParenthesis() implements Token {}
    record RightParenthesis() implements Token {}
    record Identifier(String name) implements Token {}
    record IntegerLiteral(String value) implements Token {}
    record Space() implements Token {}
    record EndOfFile() implements Token {}

    static String describe(Token token) {
        if (token instanceof Identifier identifier) {
            return "Identifier '" + identifier.name() + "'";
        } else if (token instanceof IntegerLiteral literal) {
            return "IntegerLiteral '" + literal.value() + "'";
        } else {
            return token.getClass().getSimpleName();
        }
    }
}
