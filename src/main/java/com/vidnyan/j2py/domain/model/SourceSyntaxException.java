package com.vidnyan.j2py.domain.model;

import lombok.Getter;

/**
 * Raised when source text does not conform to the supported grammar.
 * Fatal for the unit being parsed; no IR is produced.
 */
@Getter
public class SourceSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public SourceSyntaxException(int line, int column, String message) {
        super(String.format("%d:%d: %s", line, column, message));
        this.line = line;
        this.column = column;
    }

    public SourceSyntaxException(int line, int column, String message, Throwable cause) {
        super(String.format("%d:%d: %s", line, column, message), cause);
        this.line = line;
        this.column = column;
    }
}
