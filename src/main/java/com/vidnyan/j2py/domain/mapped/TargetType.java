package com.vidnyan.j2py.domain.mapped;

import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A Python type annotation as a tree, e.g. {@code Dict[str, List[int]]}.
 * Immutable value object.
 */
@Value
public class TargetType {
    public static final String ANY = "Any";
    public static final String NONE = "None";

    String name;
    List<TargetType> args;

    private TargetType(String name, List<TargetType> args) {
        this.name = name;
        this.args = List.copyOf(args);
    }

    public static TargetType named(String name) {
        return new TargetType(name, List.of());
    }

    public static TargetType of(String name, List<TargetType> args) {
        return new TargetType(name, args);
    }

    public static TargetType any() {
        return named(ANY);
    }

    public static TargetType listOf(TargetType element) {
        return of("List", List.of(element));
    }

    public static TargetType optionalOf(TargetType element) {
        if ("Optional".equals(element.name) || ANY.equals(element.name) || NONE.equals(element.name)) {
            return element;
        }
        return of("Optional", List.of(element));
    }

    public boolean isAny() {
        return ANY.equals(name) && args.isEmpty();
    }

    public boolean isParameterized() {
        return !args.isEmpty();
    }

    /**
     * Adds this name and all nested names to {@code sink}.
     */
    public void collectNames(Set<String> sink) {
        sink.add(name);
        args.forEach(a -> a.collectNames(sink));
    }

    public String render() {
        if (args.isEmpty()) {
            return name;
        }
        return name + args.stream().map(TargetType::render).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        return render();
    }
}
