package io.github.ageofwar.lisp.interpreter;

import java.util.HashMap;
import java.util.Map;

public class Environment {
    private final Environment parent;
    private final Map<String, Integer> bindings;

    public Environment(Environment parent) {
        this.parent = parent;
        this.bindings = new HashMap<>();
    }

    public Environment() {
        this(null);
    }

    public void define(String name, int value) {
        bindings.put(name, value);
    }

    public int lookup(String name) {
        var value = bindings.get(name);
        if (value != null) {
            return value;
        } else if (parent != null) {
            return parent.lookup(name);
        } else {
            throw new UndefinedVariableException(name);
        }
    }
}
