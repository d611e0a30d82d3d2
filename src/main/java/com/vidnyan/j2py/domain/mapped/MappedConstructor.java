package com.vidnyan.j2py.domain.mapped;

import com.vidnyan.j2py.domain.model.MethodBody;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Value
@Builder
public class MappedConstructor {
    @Singular
    List<MappedParam> params;
    MethodBody body;
    @Singular
    Set<TargetMarker> markers;

    /**
     * Source-style signature, e.g. {@code (String name, int age)}.
     */
    public String sourceSignature() {
        return params.stream()
                .map(p -> p.getSourceType().render() + " " + p.getSourceName())
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
