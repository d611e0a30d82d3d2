package com.vidnyan.j2py.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Represents a method declaration.
 * Overload identity is {@link #getOverloadKey()}.
 */
@Value
@Builder
public class MethodDecl {
    String name;
    @Singular
    List<ParamDecl> params;
    TypeRef returnType;
    @Singular
    Set<Modifier> modifiers;
    @Builder.Default
    MethodBody body = MethodBody.absent();
    @Singular
    List<String> typeParameters;

    public String getOverloadKey() {
        return name + params.stream()
                .map(p -> p.getType().render())
                .collect(Collectors.joining(",", "(", ")"));
    }

    public boolean isStatic() {
        return modifiers.contains(Modifier.STATIC);
    }

    public boolean isAbstract() {
        return modifiers.contains(Modifier.ABSTRACT);
    }
}
