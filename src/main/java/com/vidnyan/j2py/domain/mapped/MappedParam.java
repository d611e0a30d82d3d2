package com.vidnyan.j2py.domain.mapped;

import com.vidnyan.j2py.domain.model.TypeRef;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MappedParam {
    String sourceName;
    String name;
    TargetType type;
    TypeRef sourceType;
}
