package io.github.ageofwar.lisp;

public class EvaluationException extends LispException {
    public EvaluationException(String message) {
        super(message);
    }
}
