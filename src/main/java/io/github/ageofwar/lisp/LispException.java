package io.github.ageofwar.lisp;

public abstract class LispException extends IllegalStateException {
    protected LispException(String message) {
        super(message);
    }

    protected LispException(String message, Throwable cause) {
        super(message, cause);
    }
}
