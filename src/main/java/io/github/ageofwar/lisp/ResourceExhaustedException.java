package io.github.ageofwar.lisp;

public class ResourceExhaustedException extends LispException {
    private final int limit;

    public ResourceExhaustedException(String message, int limit) {
        super(message);
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
