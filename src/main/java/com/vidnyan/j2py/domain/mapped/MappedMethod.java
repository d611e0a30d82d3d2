package com.vidnyan.j2py.domain.mapped;

import com.vidnyan.j2py.domain.model.MethodBody;
import com.vidnyan.j2py.domain.model.TypeRef;
import com.vidnyan.j2py.domain.naming.IdentifierKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class MappedMethod {
    String sourceName;
    String name;
    IdentifierKind kind;
    @Singular
    List<MappedParam> params;
    TargetType returnType;
    TypeRef sourceReturnType;
    @Singular
    Set<TargetMarker> markers;
    MethodBody body;
    @Singular
    List<String> typeParameters;

    public boolean isStatic() {
        return markers.contains(TargetMarker.STATIC_METHOD);
    }

    public boolean isAbstract() {
        return markers.contains(TargetMarker.ABSTRACT_METHOD);
    }

    public boolean usesGenerics() {
        return sourceReturnType.usesGenerics()
                || params.stream().anyMatch(p -> p.getSourceType().usesGenerics());
    }
}
