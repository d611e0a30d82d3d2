package com.vidnyan.j2py.domain.mapped;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Structural IR after type, name and modifier translation.
 * Class, field, constructor and method counts always equal the source IR's.
 */
@Value
@Builder
public class MappedIr {
    @Singular("importLine")
    List<String> imports;
    @Singular("mappedClass")
    List<MappedClass> classes;
    @Singular
    List<MapperWarning> warnings;

    public Optional<MappedClass> findClass(String name) {
        return classes.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

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
