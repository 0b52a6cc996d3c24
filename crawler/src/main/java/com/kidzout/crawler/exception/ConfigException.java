package com.kidzout.crawler.exception;

import java.util.List;
import lombok.Getter;

/**
 * Unrecoverable configuration problem detected while loading a run. Lists every offending entry.
 */
@Getter
public class ConfigException extends RuntimeException {

    private final List<String> problems;

    public ConfigException(String message, List<String> problems) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }
}
