package com.vidnyan.j2py.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class ConstructorDecl {
    @Singular
    List<ParamDecl> params;
    @Builder.Default
    MethodBody body = MethodBody.absent();
    @Singular
    Set<Modifier> modifiers;

    public int arity() {
        return params.size();
    }
}
