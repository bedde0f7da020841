package com.eventvault.common.config;

import java.util.List;

/**
 * Thrown when the configuration cannot yield a functional process.
 * Never absorbed: startup must fail loudly.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(String message) {
        this(message, List.of(), null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public ConfigurationException(String message, List<String> problems) {
        this(message, problems, null);
    }

    private ConfigurationException(String message, List<String> problems, Throwable cause) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems), cause);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
