package de.upb.sse.typefill.exceptions;

import java.util.List;

public class ParsingException extends RuntimeException {
    private final List<String> problems;

    public ParsingException(String message, List<String> problems) {
        super(message + (problems.isEmpty() ? "" : ": " + String.join("; ", problems)));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
