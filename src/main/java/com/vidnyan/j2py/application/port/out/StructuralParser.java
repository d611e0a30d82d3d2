package com.vidnyan.j2py.application.port.out;

import com.vidnyan.j2py.domain.model.SourceSyntaxException;
import com.vidnyan.j2py.domain.model.StructuralIr;

/**
 * Port for parsing source text into the structural IR.
 * Implemented by adapters (e.g., JavaParser adapter).
 */
public interface StructuralParser {

    /**
     * Parse one unit of source text.
     * @param sourceText UTF-8 source containing one or more type declarations
     * @return complete structural IR; never a partial one
     * @throws SourceSyntaxException when the text is malformed or uses an unsupported construct
     */
    StructuralIr parse(String sourceText);
}
