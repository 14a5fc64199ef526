package com.graysky.api.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Submission rejected because one or more fields are malformed or oversized.
 * The message names every offending field.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final Map<String, String> fieldErrors;

    public ValidationException(String subject, Map<String, String> fieldErrors) {
        super(describe(subject, fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    private static String describe(String subject, Map<String, String> fieldErrors) {
        return "Invalid " + subject + " data: " + fieldErrors.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("; "));
    }
}
