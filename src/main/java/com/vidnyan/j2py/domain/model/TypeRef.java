package com.vidnyan.j2py.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reference to a source type as written (never resolved).
 * Immutable value object; generic arguments form a navigable tree.
 */
@Value
public class TypeRef {
    String name;
    List<TypeRef> genericArgs;
    int arrayDepth;
    boolean wildcard;
    // ? super T; the name is the lower bound
    boolean lowerBounded;

    public static final String UNBOUNDED_WILDCARD = "?";

    @Builder(toBuilder = true)
    private TypeRef(String name, @Singular List<TypeRef> genericArgs, int arrayDepth, boolean wildcard,
                    boolean lowerBounded) {
        if (arrayDepth < 0) {
            throw new IllegalArgumentException("arrayDepth must be >= 0, was " + arrayDepth);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.genericArgs = genericArgs == null ? List.of() : List.copyOf(genericArgs);
        this.arrayDepth = arrayDepth;
        this.wildcard = wildcard;
        this.lowerBounded = wildcard && lowerBounded;
    }

    public static TypeRef of(String name) {
        return TypeRef.builder().name(name).build();
    }

    public static TypeRef generic(String name, TypeRef... args) {
        return TypeRef.builder().name(name).genericArgs(List.of(args)).build();
    }

    public static TypeRef arrayOf(TypeRef element, int dimensions) {
        return element.toBuilder().arrayDepth(element.getArrayDepth() + dimensions).build();
    }

    public static TypeRef unboundedWildcard() {
        return TypeRef.builder().name(UNBOUNDED_WILDCARD).wildcard(true).build();
    }

    public boolean isParameterized() {
        return !genericArgs.isEmpty();
    }

    public boolean isArray() {
        return arrayDepth > 0;
    }

    /**
     * True when this type or any nested argument uses generics.
     */
    public boolean usesGenerics() {
        return isParameterized() || genericArgs.stream().anyMatch(TypeRef::usesGenerics);
    }

    /**
     * Renders the type back in source syntax, e.g. {@code Map<String, List<Integer>>[]}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        if (wildcard && !UNBOUNDED_WILDCARD.equals(name)) {
            sb.append(lowerBounded ? "? super " : "? extends ");
        }
        sb.append(name);
        if (isParameterized()) {
            sb.append(genericArgs.stream().map(TypeRef::render).collect(Collectors.joining(", ", "<", ">")));
        }
        sb.append("[]".repeat(arrayDepth));
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
