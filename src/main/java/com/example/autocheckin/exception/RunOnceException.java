package com.example.autocheckin.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Joint report of every account-level failure collected during a run-once pass
 */
@Getter
public class RunOnceException extends RuntimeException {

    private final List<Exception> failures;

    public RunOnceException(List<Exception> failures) {
        super(String.format("%d error(s): %s", failures.size(),
                failures.stream().map(Exception::getMessage).collect(Collectors.joining("; "))));
        this.failures = List.copyOf(failures);
        this.failures.forEach(this::addSuppressed);
    }
}
