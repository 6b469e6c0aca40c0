package io.github.ageofwar.lisp.lexer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

public class BufferedCharStream {
    private final BufferedReader reader;
    private int position = 0;

    public BufferedCharStream(Reader reader) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    }

    public int peek() {
        return peek(1)[0];
    }

    public int[] peek(int size) {
        var result = new int[size];
        try {
            reader.mark(size);
            for (int i = 0; i < size; i++) {
                result[i] = reader.read();
            }
            reader.reset();
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public int next() {
        try {
            int codePoint = reader.read();
            if (codePoint != -1) position++;
            return codePoint;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public int position() {
        return position;
    }
}
