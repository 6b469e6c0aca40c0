package io.github.ageofwar.lisp.interpreter;

import io.github.ageofwar.lisp.EvaluationException;
import io.github.ageofwar.lisp.ResourceExhaustedException;
import io.github.ageofwar.lisp.lexer.Lexer;
import io.github.ageofwar.lisp.lexer.Token;
import io.github.ageofwar.lisp.lexer.TokenStream;
import io.github.ageofwar.lisp.parser.BufferedTokenStream;
import io.github.ageofwar.lisp.parser.ParserException;

import java.io.Reader;
import java.io.StringReader;

import static io.github.ageofwar.lisp.parser.Parsers.error;
import static io.github.ageofwar.lisp.parser.Parsers.expect;
import static io.github.ageofwar.lisp.parser.Parsers.matches;

public class Evaluator {
    public static final int DEFAULT_MAX_DEPTH = 512;

    private final int maxDepth;

    public Evaluator() {
        this(DEFAULT_MAX_DEPTH);
    }

    public Evaluator(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum depth must be positive, but got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int evaluate(String input) {
        return evaluate(new StringReader(input));
    }

    public int evaluate(Reader reader) {
        return evaluate(new Lexer(reader));
    }

    public int evaluate(TokenStream tokens) {
        return new Evaluation(new BufferedTokenStream(tokens)).run();
    }

    private class Evaluation {
        private final BufferedTokenStream tokens;
        private int depth;

        Evaluation(BufferedTokenStream tokens) {
            this.tokens = tokens;
        }

        int run() {
            if (matches(tokens, Token.Space.class)) {
                tokens.next();
            }
            var result = nextExpression(new Environment());
            if (!matches(tokens, Token.EndOfFile.class)) {
                throw error("Extra characters at end of input", tokens.peek());
            }
            if (!(result instanceof Integer value)) {
                throw new EvaluationException("Final expression did not evaluate to an integer: " + result);
            }
            return value;
        }

        private Object nextExpression(Environment environment) {
            if (++depth > maxDepth) {
                throw new ResourceExhaustedException("Expression nesting exceeds the maximum depth of " + maxDepth, maxDepth);
            }
            try {
                var token = tokens.peek();
                if (token instanceof Token.IntegerLiteral literal) {
                    return nextInteger(literal);
                } else if (token instanceof Token.Identifier identifier) {
                    var value = environment.lookup(identifier.name());
                    tokens.next();
                    return value;
                } else if (token instanceof Token.LeftParenthesis) {
                    return nextForm(environment);
                } else if (token instanceof Token.EndOfFile) {
                    throw new ParserException("Unexpected end of input", token);
                } else {
                    throw new ParserException("Unexpected token: " + Token.describe(token), token);
                }
            } finally {
                depth--;
            }
        }

        private int nextInteger(Token.IntegerLiteral literal) {
            int value;
            try {
                value = Integer.parseInt(literal.value());
            } catch (NumberFormatException e) {
                throw new ParserException("Integer literal out of range: " + literal.value(), literal, e);
            }
            tokens.next();
            return value;
        }

        private int nextForm(Environment environment) {
            expect(tokens, Token.LeftParenthesis.class);
            if (!(tokens.peek() instanceof Token.Identifier operator)) {
                throw error("Expected an operator or keyword after '('", tokens.peek());
            }
            tokens.next();
            var form = Form.fromName(operator.name());
            if (form == null) {
                throw new UnknownOperatorException(operator.name());
            }
            return switch (form) {
                case ADD, MULT -> nextArithmetic(form, environment);
                case LET -> nextLet(environment);
            };
        }

        private int nextArithmetic(Form form, Environment environment) {
            expect(tokens, Token.Space.class);
            var left = (int) nextExpression(environment);
            expect(tokens, Token.Space.class);
            var right = (int) nextExpression(environment);
            expect(tokens, Token.RightParenthesis.class);
            return form == Form.ADD ? left + right : left * right;
        }

        private int nextLet(Environment environment) {
            var scope = new Environment(environment);
            // one Space after each binding name and between bindings, none before ')'
            expect(tokens, Token.Space.class);
            while (tokens.peek() instanceof Token.Identifier name) {
                var following = tokens.peek(2)[1];
                if (following instanceof Token.RightParenthesis) {
                    break;
                }
                if (!(following instanceof Token.Space)) {
                    throw error("Malformed let binding list: expected Space after '" + name.name() + "'", following);
                }
                tokens.next();
                tokens.next();
                scope.define(name.name(), (int) nextExpression(scope));
                if (!matches(tokens, Token.RightParenthesis.class)) {
                    expect(tokens, Token.Space.class);
                }
            }
            var body = (int) nextExpression(scope);
            expect(tokens, Token.RightParenthesis.class);
            return body;
        }
    }
}
