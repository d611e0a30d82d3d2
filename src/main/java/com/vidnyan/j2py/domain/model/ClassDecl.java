package com.vidnyan.j2py.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A top-level class or interface declaration.
 * Immutable entity - the unit every later stage iterates over.
 *
 * Invariants checked on construction: no self-inheritance, unique field names,
 * and method names repeated only as real overloads.
 */
@Value
public class ClassDecl {
    String name;
    ClassKind kind;
    String superclass;
    List<String> interfaces; // implemented, or extended when kind == INTERFACE
    List<String> typeParameters;
    List<FieldDecl> fields;
    List<ConstructorDecl> constructors;
    List<MethodDecl> methods;
    Set<Modifier> modifiers;
    int line;

    @Builder
    private ClassDecl(String name,
                      ClassKind kind,
                      String superclass,
                      @Singular("interfaceName") List<String> interfaces,
                      @Singular List<String> typeParameters,
                      @Singular List<FieldDecl> fields,
                      @Singular List<ConstructorDecl> constructors,
                      @Singular List<MethodDecl> methods,
                      @Singular Set<Modifier> modifiers,
                      int line) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind == null ? ClassKind.CLASS : kind;
        this.superclass = superclass;
        this.interfaces = interfaces;
        this.typeParameters = typeParameters;
        this.fields = fields;
        this.constructors = constructors;
        this.methods = methods;
        this.modifiers = modifiers;
        this.line = line;
        checkInvariants();
    }

    public Optional<String> getSuperclass() {
        return Optional.ofNullable(superclass);
    }

    public boolean isInterface() {
        return kind == ClassKind.INTERFACE;
    }

    public boolean isAbstract() {
        return isInterface() || modifiers.contains(Modifier.ABSTRACT);
    }

    private void checkInvariants() {
        if (name.equals(superclass)) {
            throw new IllegalArgumentException("Class " + name + " cannot extend itself");
        }
        if (interfaces.contains(name)) {
            throw new IllegalArgumentException("Type " + name + " cannot implement itself");
        }
        Set<String> fieldNames = new HashSet<>();
        for (FieldDecl field : fields) {
            if (!fieldNames.add(field.getName())) {
                throw new IllegalArgumentException("Duplicate field " + name + "." + field.getName());
            }
        }
        Set<String> overloads = new HashSet<>();
        for (MethodDecl method : methods) {
            if (!overloads.add(method.getOverloadKey())) {
                throw new IllegalArgumentException("Duplicate method " + name + "." + method.getOverloadKey());
            }
        }
    }
}
