package com.vidnyan.j2py.domain.mapped;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Policy data for the mapper: source type names to target type names, and source imports
 * to target import lines. An import mapped to the empty string has no target counterpart
 * and is dropped silently.
 */
@Value
public class MappingTable {
    Map<String, String> types;
    Map<String, String> imports;

    private MappingTable(Map<String, String> types, Map<String, String> imports) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        this.imports = Collections.unmodifiableMap(new LinkedHashMap<>(imports));
    }

    public static MappingTable of(Map<String, String> types, Map<String, String> imports) {
        return new MappingTable(types, imports);
    }

    public static MappingTable defaults() {
        Map<String, String> types = new LinkedHashMap<>();
        for (String n : new String[]{"int", "long", "short", "byte", "Integer", "Long", "Short", "Byte", "BigInteger"}) {
            types.put(n, "int");
        }
        for (String n : new String[]{"float", "double", "Float", "Double", "BigDecimal", "Number"}) {
            types.put(n, "float");
        }
        types.put("boolean", "bool");
        types.put("Boolean", "bool");
        for (String n : new String[]{"char", "Character", "String", "CharSequence"}) {
            types.put(n, "str");
        }
        types.put("void", TargetType.NONE);
        types.put("Void", TargetType.NONE);
        types.put("Object", TargetType.ANY);
        for (String n : new String[]{"List", "ArrayList", "LinkedList", "Collection", "Iterable"}) {
            types.put(n, "List");
        }
        for (String n : new String[]{"Set", "HashSet", "LinkedHashSet", "TreeSet"}) {
            types.put(n, "Set");
        }
        for (String n : new String[]{"Map", "HashMap", "LinkedHashMap", "TreeMap"}) {
            types.put(n, "Dict");
        }
        types.put("Optional", "Optional");

        Map<String, String> imports = new LinkedHashMap<>();
        imports.put("java.util.List", "from typing import List");
        imports.put("java.util.ArrayList", "");
        imports.put("java.util.LinkedList", "");
        imports.put("java.util.Collection", "from typing import List");
        imports.put("java.util.Set", "from typing import Set");
        imports.put("java.util.HashSet", "");
        imports.put("java.util.LinkedHashSet", "");
        imports.put("java.util.TreeSet", "");
        imports.put("java.util.Map", "from typing import Dict");
        imports.put("java.util.HashMap", "");
        imports.put("java.util.LinkedHashMap", "");
        imports.put("java.util.TreeMap", "");
        imports.put("java.util.Optional", "from typing import Optional");
        imports.put("java.io.IOException", "");
        imports.put("java.math.BigDecimal", "");
        imports.put("java.math.BigInteger", "");
        imports.put("java.util.Objects", "");
        imports.put("java.util.Arrays", "");
        imports.put("java.util.Collections", "");
        return new MappingTable(types, imports);
    }

    /**
     * Returns a copy with {@code typeOverrides} and {@code importOverrides} layered on top.
     */
    public MappingTable withOverrides(Map<String, String> typeOverrides, Map<String, String> importOverrides) {
        Map<String, String> t = new LinkedHashMap<>(types);
        Map<String, String> i = new LinkedHashMap<>(imports);
        if (typeOverrides != null) {
            t.putAll(typeOverrides);
        }
        if (importOverrides != null) {
            i.putAll(importOverrides);
        }
        return new MappingTable(t, i);
    }

    public Optional<String> lookupType(String sourceName) {
        return Optional.ofNullable(types.get(sourceName));
    }

    /**
     * Empty optional when the import is unknown; an empty string when it maps to nothing.
     */
    public Optional<String> lookupImport(String sourceImport) {
        if (sourceImport.startsWith("java.lang.")) {
            return Optional.of("");
        }
        return Optional.ofNullable(imports.get(sourceImport));
    }
}
