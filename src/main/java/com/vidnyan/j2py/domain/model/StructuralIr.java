package com.vidnyan.j2py.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Declaration-level structure of one source unit.
 * Immutable after construction; produced once per pipeline run.
 */
@Value
@Builder
public class StructuralIr {
    String packageName;
    @Singular("importName")
    List<String> imports;
    @Singular("classDecl")
    List<ClassDecl> classes;

    public int methodCount() {
        return classes.stream().mapToInt(c -> c.getMethods().size()).sum();
    }

    public int fieldCount() {
        return classes.stream().mapToInt(c -> c.getFields().size()).sum();
    }

    public int constructorCount() {
        return classes.stream().mapToInt(c -> c.getConstructors().size()).sum();
    }
}
