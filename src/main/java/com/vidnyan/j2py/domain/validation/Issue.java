package com.vidnyan.j2py.domain.validation;

import lombok.Value;

import java.util.Optional;

/**
 * A single validation finding.
 * Immutable value object.
 */
@Value
public class Issue {
    Severity severity;
    String message;
    String location; // may be null

    public static Issue error(String message, String location) {
        return new Issue(Severity.ERROR, message, location);
    }

    public static Issue warning(String message, String location) {
        return new Issue(Severity.WARNING, message, location);
    }

    public Optional<String> getLocation() {
        return Optional.ofNullable(location);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public String format() {
        return location == null
                ? String.format("[%s] %s", severity, message)
                : String.format("[%s] %s (%s)", severity, message, location);
    }
}
