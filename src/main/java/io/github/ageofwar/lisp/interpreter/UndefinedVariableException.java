package io.github.ageofwar.lisp.interpreter;

import io.github.ageofwar.lisp.EvaluationException;

public class UndefinedVariableException extends EvaluationException {
    private final String name;

    public UndefinedVariableException(String name) {
        super("Undefined variable: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
