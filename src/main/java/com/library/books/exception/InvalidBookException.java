package com.library.books.exception;

import java.util.List;

public class InvalidBookException extends RuntimeException {

    private final List<String> violations;

    public InvalidBookException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
