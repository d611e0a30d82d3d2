package com.vidnyan.j2py.domain.mapped;

import com.vidnyan.j2py.domain.model.ClassKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Class after translation. Same shape as its source {@code ClassDecl}.
 * Capabilities (implemented interfaces) are metadata, not inheritance.
 */
@Value
@Builder
public class MappedClass {
    String name;
    ClassKind kind;
    String superclass;
    @Singular
    List<String> capabilities;
    @Singular
    List<String> typeParameters;
    @Singular
    List<MappedField> fields;
    @Singular
    List<MappedConstructor> constructors;
    @Singular
    List<MappedMethod> methods;
    @Singular
    Set<TargetMarker> markers;
    int line;

    public Optional<String> getSuperclass() {
        return Optional.ofNullable(superclass);
    }

    public boolean isAbstract() {
        return markers.contains(TargetMarker.ABSTRACT_CLASS);
    }

    public List<MappedField> classLevelFields() {
        return fields.stream().filter(MappedField::isClassLevel).toList();
    }

    public List<MappedField> instanceFields() {
        return fields.stream().filter(f -> !f.isClassLevel()).toList();
    }

    /**
     * Number of {@code __init__} definitions the generator emits for this class.
     */
    public int expectedInitializerCount() {
        return constructors.isEmpty() && instanceFields().isEmpty() ? 0 : 1;
    }
}
