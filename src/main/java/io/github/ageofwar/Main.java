package io.github.ageofwar;

import io.github.ageofwar.lisp.LispException;
import io.github.ageofwar.lisp.interpreter.Evaluator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class Main {
    static final List<String> DEMO = List.of(
            "(let x 2 y 3 x (mult x y) (add x y))",
            "(let x 2 y 3 (add x (let x 4 (add x y))))",
            "(add (mult 2 3) (let a 5 (add a 1)))",
            "(let x 3 (let x 2 x))",
            "(let x 3 x)",
            "(add 10 20)",
            "42",
            "(let x 10 y (add x 5) (mult x y))",
            "(add x 5)",
            "()",
            "(mult 1 2 3)",
            "(let x 10 y)",
            "(+ 1 2)"
    );

    public static void main(String[] args) throws IOException {
        var evaluator = new Evaluator(Integer.getInteger("lisp.maxDepth", Evaluator.DEFAULT_MAX_DEPTH));
        List<String> inputs;
        if (args.length == 1 && args[0].equals("--demo")) {
            System.out.println("--- Lisp Interpreter Demo ---");
            inputs = DEMO;
        } else if (args.length > 0) {
            inputs = Arrays.asList(args);
        } else {
            inputs = readLines(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }
        System.exit(run(evaluator, inputs, System.out));
    }

    static int run(Evaluator evaluator, List<String> inputs, PrintStream out) {
        var status = 0;
        for (var input : inputs) {
            out.println();
            out.println("Evaluating: \"" + input + "\"");
            try {
                out.println("Result: " + evaluator.evaluate(input));
            } catch (LispException e) {
                out.println("Error: " + e.getMessage());
                status = 1;
            }
        }
        return status;
    }

    private static List<String> readLines(BufferedReader reader) throws IOException {
        var lines = new ArrayList<String>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isEmpty()) lines.add(line);
        }
        return lines;
    }
}
