package com.vidnyan.j2py.application.service;

import com.vidnyan.j2py.domain.naming.IdentifierRenamer;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the declaration outline of Python text: imports, classes, decorators, defs and
 * class-level attributes. Statement bodies are skipped.
 *
 * <p>Understands indentation, brackets spanning lines and string literals (including triple
 * quoted ones), which is enough to reject text that Python itself would refuse to load.
 */
@Slf4j
@Component
public class PythonOutlineReader {

    private static final Pattern CLASS_LINE =
            Pattern.compile("class\\s+([A-Za-z_]\\w*)\\s*(?:\\((.*)\\))?\\s*:", Pattern.DOTALL);
    private static final Pattern DEF_LINE = Pattern.compile(
            "(?:async\\s+)?def\\s+([A-Za-z_]\\w*)\\s*\\((.*)\\)\\s*(?:->\\s*(.+?))?\\s*:", Pattern.DOTALL);
    private static final Pattern ANNOTATED = Pattern.compile("([A-Za-z_]\\w*)\\s*:(.*)", Pattern.DOTALL);
    private static final Pattern ASSIGNED = Pattern.compile("([A-Za-z_]\\w*)\\s*=(?!=).*", Pattern.DOTALL);
    private static final Pattern IMPORT_LINE = Pattern.compile("(?:from\\s+\\S+\\s+)?import\\s+.+", Pattern.DOTALL);

    public Outline read(String text) {
        List<LogicalLine> lines = logicalLines(text);
        checkIndentation(lines);

        Outline.OutlineBuilder outline = Outline.builder();
        OutlineClass.OutlineClassBuilder current = null;
        int bodyIndent = -1;
        List<String> decorators = new ArrayList<>();

        for (LogicalLine line : lines) {
            String code = line.text().trim();
            if (line.indent() == 0) {
                if (current != null) {
                    outline.outlineClass(current.build());
                    current = null;
                }
                Matcher cls = CLASS_LINE.matcher(code);
                if (code.startsWith("@")) {
                    decorators.add(code.substring(1).trim());
                    continue;
                }
                if (cls.matches()) {
                    requireIdentifier(cls.group(1), "class", line.number());
                    current = OutlineClass.builder()
                            .name(cls.group(1))
                            .bases(cls.group(2) == null ? List.of() : splitTopLevel(cls.group(2)))
                            .line(line.number());
                    bodyIndent = -1;
                } else if (IMPORT_LINE.matcher(code).matches()) {
                    outline.importLine(code);
                } else {
                    Matcher def = DEF_LINE.matcher(code);
                    if (def.matches()) {
                        outline.function(toDef(def, decorators, line.number()));
                    }
                }
                decorators.clear();
                continue;
            }

            if (current == null) {
                continue;
            }
            if (bodyIndent < 0) {
                bodyIndent = line.indent();
            }
            if (line.indent() != bodyIndent) {
                continue;
            }

            if (code.startsWith("@")) {
                decorators.add(code.substring(1).trim());
                continue;
            }
            Matcher def = DEF_LINE.matcher(code);
            if (def.matches()) {
                current.method(toDef(def, decorators, line.number()));
            } else {
                Matcher annotated = ANNOTATED.matcher(code);
                Matcher assigned = ASSIGNED.matcher(code);
                if (annotated.matches() && !isKeyword(annotated.group(1))) {
                    current.attribute(new OutlineAttribute(annotated.group(1), true, line.number()));
                } else if (assigned.matches()) {
                    current.attribute(new OutlineAttribute(assigned.group(1), false, line.number()));
                }
            }
            decorators.clear();
        }
        if (current != null) {
            outline.outlineClass(current.build());
        }
        Outline result = outline.build();
        log.debug("Outlined {} logical lines: {} classes, {} imports",
                lines.size(), result.getClasses().size(), result.getImports().size());
        return result;
    }

    private OutlineDef toDef(Matcher def, List<String> decorators, int line) {
        requireIdentifier(def.group(1), "function", line);
        List<OutlineParam> params = new ArrayList<>();
        for (String raw : splitTopLevel(def.group(2))) {
            String param = raw;
            int eq = indexOfTopLevel(param, '=');
            if (eq >= 0) {
                param = param.substring(0, eq);
            }
            int colon = param.indexOf(':');
            String name = (colon >= 0 ? param.substring(0, colon) : param).trim().replaceFirst("^\\*{1,2}", "");
            if (name.isEmpty() || name.equals("/")) {
                continue;
            }
            requireIdentifier(name, "parameter", line);
            params.add(new OutlineParam(name, colon >= 0));
        }
        return new OutlineDef(def.group(1), List.copyOf(decorators), params, def.group(3) != null, line);
    }

    /**
     * Join physical lines into logical lines, dropping comments and blank lines.
     */
    List<LogicalLine> logicalLines(String text) {
        List<LogicalLine> result = new ArrayList<>();
        String[] physical = text.split("\n", -1);

        StringBuilder buffer = new StringBuilder();
        Deque<int[]> brackets = new ArrayDeque<>(); // {char, line}
        String quote = null;
        int quoteLine = 0;
        int startLine = 0;
        int indent = 0;
        boolean open = false;

        for (int n = 0; n < physical.length; n++) {
            String raw = physical[n];
            int lineNo = n + 1;
            if (raw.endsWith("\r")) {
                raw = raw.substring(0, raw.length() - 1);
            }
            if (!open) {
                String stripped = raw.strip();
                if (stripped.isEmpty() || stripped.startsWith("#")) {
                    continue;
                }
                indent = indentOf(raw);
                startLine = lineNo;
                open = true;
            }

            boolean continued = false;
            for (int i = 0; i < raw.length(); i++) {
                char c = raw.charAt(i);
                if (quote != null) {
                    buffer.append(c);
                    if (c == '\\' && i + 1 < raw.length()) {
                        buffer.append(raw.charAt(++i));
                    } else if (raw.startsWith(quote, i)) {
                        buffer.append(quote, 1, quote.length());
                        i += quote.length() - 1;
                        quote = null;
                    }
                    continue;
                }
                if (c == '#') {
                    break;
                }
                if (c == '"' || c == '\'') {
                    String triple = String.valueOf(c).repeat(3);
                    quote = raw.startsWith(triple, i) ? triple : String.valueOf(c);
                    quoteLine = lineNo;
                    buffer.append(quote);
                    i += quote.length() - 1;
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    brackets.push(new int[]{c, lineNo});
                } else if (c == ')' || c == ']' || c == '}') {
                    if (brackets.isEmpty()) {
                        throw new PythonOutlineException(lineNo, "unmatched '" + c + "'");
                    }
                    char expected = closing((char) brackets.pop()[0]);
                    if (c != expected) {
                        throw new PythonOutlineException(lineNo, "closing '" + c + "' does not match, expected '" + expected + "'");
                    }
                } else if (c == '\\' && i == raw.length() - 1) {
                    continued = true;
                    break;
                }
                buffer.append(c);
            }

            if (quote != null) {
                if (quote.length() == 1) {
                    throw new PythonOutlineException(quoteLine, "unterminated string literal");
                }
                buffer.append('\n');
                continue;
            }
            if (!brackets.isEmpty() || continued) {
                buffer.append(' ');
                continue;
            }
            result.add(new LogicalLine(startLine, indent, buffer.toString()));
            buffer.setLength(0);
            open = false;
        }

        if (quote != null) {
            throw new PythonOutlineException(quoteLine, "unterminated triple-quoted string literal");
        }
        if (!brackets.isEmpty()) {
            int[] unclosed = brackets.peekLast();
            throw new PythonOutlineException(unclosed[1], "'" + (char) unclosed[0] + "' was never closed");
        }
        if (open) {
            throw new PythonOutlineException(startLine, "unexpected end of text after line continuation");
        }
        return result;
    }

    private void checkIndentation(List<LogicalLine> lines) {
        Deque<Integer> levels = new ArrayDeque<>();
        levels.push(0);
        boolean expectIndent = false;
        int headerLine = 0;

        for (LogicalLine line : lines) {
            int top = levels.peek();
            if (expectIndent) {
                if (line.indent() <= top) {
                    throw new PythonOutlineException(line.number(), "expected an indented block after line " + headerLine);
                }
                levels.push(line.indent());
            } else if (line.indent() > top) {
                throw new PythonOutlineException(line.number(), "unexpected indent");
            } else if (line.indent() < top) {
                while (levels.peek() > line.indent()) {
                    levels.pop();
                }
                if (levels.peek() != line.indent()) {
                    throw new PythonOutlineException(line.number(), "unindent does not match any outer indentation level");
                }
            }
            expectIndent = line.text().stripTrailing().endsWith(":");
            headerLine = line.number();
        }
        if (expectIndent) {
            throw new PythonOutlineException(headerLine, "expected an indented block after line " + headerLine);
        }
    }

    private static int indentOf(String raw) {
        int width = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else {
                break;
            }
        }
        return width;
    }

    private static char closing(char opening) {
        return switch (opening) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    private static boolean isKeyword(String word) {
        return IdentifierRenamer.isKeyword(word);
    }

    private static void requireIdentifier(String name, String what, int line) {
        if (isKeyword(name)) {
            throw new PythonOutlineException(line, "keyword '" + name + "' cannot be used as a " + what + " name");
        }
    }

    /**
     * Split on commas outside brackets and strings.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\' && i + 1 < text.length()) {
                    current.append(c).append(text.charAt(++i));
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addPart(parts, current);
                continue;
            }
            current.append(c);
        }
        addPart(parts, current);
        return parts;
    }

    private static void addPart(List<String> parts, StringBuilder current) {
        String part = current.toString().trim();
        if (!part.isEmpty()) {
            parts.add(part);
        }
        current.setLength(0);
    }

    private static int indexOfTopLevel(String text, char target) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == target && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    record LogicalLine(int number, int indent, String text) {}

    /**
     * Declarations found in a Python text.
     */
    @Value
    @Builder
    public static class Outline {
        @Singular("importLine")
        List<String> imports;
        @Singular("outlineClass")
        List<OutlineClass> classes;
        @Singular
        List<OutlineDef> functions;
    }

    @Value
    @Builder
    public static class OutlineClass {
        String name;
        List<String> bases;
        @Singular
        List<OutlineDef> methods;
        @Singular
        List<OutlineAttribute> attributes;
        int line;

        public List<OutlineDef> initializers() {
            return methods.stream().filter(d -> d.getName().equals("__init__")).toList();
        }

        public List<OutlineDef> regularMethods() {
            return methods.stream().filter(d -> !d.getName().equals("__init__")).toList();
        }
    }

    @Value
    public static class OutlineDef {
        String name;
        List<String> decorators;
        List<OutlineParam> params;
        boolean returnAnnotated;
        int line;

        public boolean isStatic() {
            return decorators.contains("staticmethod");
        }
    }

    @Value
    public static class OutlineParam {
        String name;
        boolean annotated;
    }

    @Value
    public static class OutlineAttribute {
        String name;
        boolean annotated;
        int line;
    }

    /**
     * Raised when the text is not well-formed enough to outline.
     */
    @Getter
    public static class PythonOutlineException extends RuntimeException {
        private final int line;

        public PythonOutlineException(int line, String message) {
            super("line " + line + ": " + message);
            this.line = line;
        }
    }
}
