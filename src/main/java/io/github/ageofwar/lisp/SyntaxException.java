package io.github.ageofwar.lisp;

public class SyntaxException extends LispException {
    private final int position;

    public SyntaxException(String message) {
        this(message, -1);
    }

    public SyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    public SyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.position = -1;
    }

    public int position() {
        return position;
    }
}
