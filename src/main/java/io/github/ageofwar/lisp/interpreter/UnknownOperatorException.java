package io.github.ageofwar.lisp.interpreter;

import io.github.ageofwar.lisp.EvaluationException;

public class UnknownOperatorException extends EvaluationException {
    private final String name;

    public UnknownOperatorException(String name) {
        super("Unknown operator or keyword: '" + name + "'");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
