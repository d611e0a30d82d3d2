package com.vidnyan.j2py.domain.naming;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts source identifiers to target naming conventions.
 *
 * <p>Pure and idempotent: {@code rename(rename(n, k), k).equals(rename(n, k))} for every
 * name and kind. No state is kept between calls.
 */
public final class IdentifierRenamer {

    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    // digit followed by a capitalised word; a bare capital after a digit is not a boundary
    private static final Pattern DIGIT_BOUNDARY = Pattern.compile("([0-9])([A-Z][a-z])");
    private static final Pattern PASCAL_CASE = Pattern.compile("[A-Z][A-Za-z0-9]*");

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    // keywords plus the receiver names, which members must not shadow
    private static final Set<String> RESERVED = union(KEYWORDS, Set.of("self", "cls"));

    private IdentifierRenamer() {
    }

    public static String rename(String name, IdentifierKind kind) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        name = name.replace('$', '_');
        int start = 0;
        while (start < name.length() && name.charAt(start) == '_') {
            start++;
        }
        String leading = name.substring(0, start);
        String core = name.substring(start);
        if (core.isEmpty()) {
            return name;
        }

        String cased = kind == IdentifierKind.CONSTANT_FIELD
                ? toSnake(core).toUpperCase(Locale.ROOT)
                : toSnake(core);

        String prefix = kind.isPrivate() ? "_" : (kind == IdentifierKind.CONSTANT_FIELD ? "" : leading);
        String result = prefix + cased;
        return RESERVED.contains(result) ? result + "_" : result;
    }

    /**
     * True when {@code name} already follows the convention for {@code kind}.
     */
    public static boolean conforms(String name, IdentifierKind kind) {
        return name != null && name.equals(rename(name, kind));
    }

    /**
     * Name for a declared or referenced type. Case is kept; each dotted segment has {@code $}
     * replaced and gets a {@code _} suffix when it is a keyword.
     */
    public static String typeName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String[] segments = name.replace('$', '_').split("\\.", -1);
        for (int i = 0; i < segments.length; i++) {
            if (KEYWORDS.contains(segments[i])) {
                segments[i] = segments[i] + "_";
            }
        }
        return String.join(".", segments);
    }

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }

    public static boolean isPascalCase(String className) {
        return className != null && PASCAL_CASE.matcher(className).matches();
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new HashSet<>(a);
        all.addAll(b);
        return Set.copyOf(all);
    }

    static String toSnake(String camel) {
        String s = ACRONYM_BOUNDARY.matcher(camel).replaceAll("$1_$2");
        s = CAMEL_BOUNDARY.matcher(s).replaceAll("$1_$2");
        s = DIGIT_BOUNDARY.matcher(s).replaceAll("$1_$2");
        return s.toLowerCase(Locale.ROOT);
    }
}
