package com.vidnyan.j2py.application.service;

import lombok.Builder;
import lombok.Value;

/**
 * Formatting switches for {@link PythonCodeGenerator}.
 */
@Value
@Builder
public class GeneratorOptions {
    @Builder.Default
    int indent = 4;
    // echo the Java body as comments above the placeholder
    @Builder.Default
    boolean includeSourceBodies = false;

    public static GeneratorOptions defaults() {
        return GeneratorOptions.builder().build();
    }
}
