package com.vidnyan.j2py.domain.mapped;

import com.vidnyan.j2py.domain.model.TypeRef;
import com.vidnyan.j2py.domain.naming.IdentifierKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Optional;
import java.util.Set;

/**
 * Field after translation. Keeps the source name and type for traceability.
 */
@Value
@Builder
public class MappedField {
    String sourceName;
    String name;
    IdentifierKind kind;
    TargetType type;
    TypeRef sourceType;
    @Singular
    Set<TargetMarker> markers;
    String initializer;        // Python expression, null when not translatable or absent
    String sourceInitializer;  // verbatim Java expression, null when absent

    public Optional<String> getInitializer() {
        return Optional.ofNullable(initializer);
    }

    public Optional<String> getSourceInitializer() {
        return Optional.ofNullable(sourceInitializer);
    }

    public boolean isClassLevel() {
        return markers.contains(TargetMarker.CLASS_CONSTANT) || markers.contains(TargetMarker.CLASS_VARIABLE);
    }

    public boolean isConstant() {
        return markers.contains(TargetMarker.CLASS_CONSTANT);
    }
}
