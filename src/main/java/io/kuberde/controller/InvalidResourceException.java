package io.kuberde.controller;

import java.util.List;

public final class InvalidResourceException extends Exception {
    private final List<String> problems;

    public InvalidResourceException(List<String> problems) {
        super(String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
