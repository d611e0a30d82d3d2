package com.vidnyan.j2py.domain.mapped;

import lombok.Value;

/**
 * Non-fatal finding of the mapping stage. Never blocks later stages.
 */
@Value(staticConstructor = "at")
public class MapperWarning {
    String location;
    String message;

    @Override
    public String toString() {
        return location + ": " + message;
    }
}
