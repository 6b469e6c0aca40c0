package io.github.ageofwar.lisp.interpreter;

import java.util.HashMap;
import java.util.Map;

public enum Form {
    ADD("add"),
    MULT("mult"),
    LET("let");

    private static final Map<String, Form> byName = new HashMap<>();
    static {
        for (var form : Form.values()) {
            byName.put(form.name, form);
        }
    }

    private final String name;

    public static Form fromName(String name) {
        return byName.get(name);
    }

    Form(String name) {
        this.name = name;
    }
}
