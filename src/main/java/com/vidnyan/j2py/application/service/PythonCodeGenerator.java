package com.vidnyan.j2py.application.service;

import com.vidnyan.j2py.domain.graph.InheritanceGraph;
import com.vidnyan.j2py.domain.mapped.*;
import com.vidnyan.j2py.domain.model.MethodBody;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a mapped IR as Python declarations.
 *
 * <p>Output is a pure function of the IR and the options: same input, same text. Classes are
 * emitted parents first so base classes are defined before use. Bodies are never translated;
 * they become a marked placeholder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PythonCodeGenerator {

    static final String BODY_MARKER = "# [j2py] body not translated";

    private static final Pattern FROM_IMPORT = Pattern.compile("from\\s+([\\w.]+)\\s+import\\s+(.+)");
    private static final Set<String> TYPING_NAMES = Set.of(
            "Any", "List", "Dict", "Set", "Optional", "Tuple", "Union", "Callable", "Iterable", "ClassVar");

    private final GeneratorOptions options;

    public GeneratedSource generate(MappedIr ir) {
        List<String> warnings = new ArrayList<>();
        Set<String> typingNames = new TreeSet<>();
        Set<String> abcNames = new TreeSet<>();

        Set<String> declared = ir.getClasses().stream().map(MappedClass::getName).collect(Collectors.toSet());
        InheritanceGraph graph = InheritanceGraph.build(ir);
        List<String> classOrder = graph.topologicalOrder()
                .orElseThrow(() -> new IllegalStateException("Inheritance cycle in mapped IR"));

        List<String> classBlocks = new ArrayList<>();
        for (String name : classOrder) {
            MappedClass cls = ir.findClass(name)
                    .orElseThrow(() -> new IllegalStateException("Class missing from IR: " + name));
            ClassWriter writer = new ClassWriter(cls, declared, graph, typingNames, abcNames, warnings);
            classBlocks.add(writer.write());
        }

        StringBuilder out = new StringBuilder();
        out.append("\"\"\"Generated by j2py from Java source. Method bodies are not translated.\"\"\"\n\n");
        out.append("from __future__ import annotations\n");

        List<String> typeVars = typeVariables(ir);
        if (!typeVars.isEmpty()) {
            typingNames.add("TypeVar");
        }
        List<String> importLines = importBlock(ir.getImports(), typingNames, abcNames);
        if (!importLines.isEmpty()) {
            out.append('\n');
            importLines.forEach(line -> out.append(line).append('\n'));
        }

        if (!typeVars.isEmpty()) {
            out.append('\n');
            typeVars.forEach(tv -> out.append(tv).append(" = TypeVar('").append(tv).append("')\n"));
        }

        for (String block : classBlocks) {
            out.append("\n\n").append(block);
        }

        log.debug("Generated {} classes, {} warnings", classBlocks.size(), warnings.size());
        return GeneratedSource.of(out.toString(), List.copyOf(warnings));
    }

    /**
     * Group imports per module, deduplicate and sort. Plain {@code import x} lines come first.
     */
    private List<String> importBlock(List<String> mapped, Set<String> typingNames, Set<String> abcNames) {
        Map<String, Set<String>> fromImports = new TreeMap<>();
        Set<String> plainImports = new TreeSet<>();
        for (String line : mapped) {
            Matcher m = FROM_IMPORT.matcher(line.trim());
            if (m.matches()) {
                Set<String> names = fromImports.computeIfAbsent(m.group(1), k -> new TreeSet<>());
                Arrays.stream(m.group(2).split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(names::add);
            } else if (!line.isBlank()) {
                plainImports.add(line.trim());
            }
        }
        if (!typingNames.isEmpty()) {
            fromImports.computeIfAbsent("typing", k -> new TreeSet<>()).addAll(typingNames);
        }
        if (!abcNames.isEmpty()) {
            fromImports.computeIfAbsent("abc", k -> new TreeSet<>()).addAll(abcNames);
        }

        List<String> lines = new ArrayList<>(plainImports);
        fromImports.forEach((module, names) ->
                lines.add("from " + module + " import " + String.join(", ", names)));
        return lines;
    }

    private static List<String> typeVariables(MappedIr ir) {
        Set<String> names = new LinkedHashSet<>();
        for (MappedClass cls : ir.getClasses()) {
            names.addAll(cls.getTypeParameters());
            cls.getMethods().forEach(m -> names.addAll(m.getTypeParameters()));
        }
        return new ArrayList<>(names);
    }

    /**
     * Writes one class block. Collects the typing and abc names it uses.
     */
    private final class ClassWriter {
        private final MappedClass cls;
        private final Set<String> declared;
        private final InheritanceGraph graph;
        private final Set<String> typingNames;
        private final Set<String> abcNames;
        private final List<String> warnings;
        private final StringBuilder sb = new StringBuilder();
        private final String unit;

        ClassWriter(MappedClass cls, Set<String> declared, InheritanceGraph graph, Set<String> typingNames,
                    Set<String> abcNames, List<String> warnings) {
            this.cls = cls;
            this.declared = declared;
            this.graph = graph;
            this.typingNames = typingNames;
            this.abcNames = abcNames;
            this.warnings = warnings;
            this.unit = " ".repeat(options.getIndent());
        }

        String write() {
            writeHeader();
            writeClassLevelFields();
            writeInstanceAnnotations();
            if (cls.expectedInitializerCount() == 1) {
                writeInitializer();
            }
            for (MappedMethod method : cls.getMethods()) {
                sb.append('\n');
                writeMethod(method);
            }
            return sb.toString();
        }

        private void writeHeader() {
            List<String> bases = new ArrayList<>();
            cls.getSuperclass().ifPresent(bases::add);
            List<String> external = new ArrayList<>();
            for (String capability : cls.getCapabilities()) {
                if (!declared.contains(capability)) {
                    external.add(capability);
                } else if (!bases.contains(capability)) {
                    bases.add(capability);
                }
            }
            dropInheritedBases(bases);
            if (!cls.getTypeParameters().isEmpty()) {
                typingNames.add("Generic");
                bases.add("Generic[" + String.join(", ", cls.getTypeParameters()) + "]");
            }
            if (cls.isAbstract()) {
                abcNames.add("ABC");
                bases.add("ABC");
            }

            sb.append("class ").append(cls.getName());
            if (!bases.isEmpty()) {
                sb.append('(').append(String.join(", ", bases)).append(')');
            }
            sb.append(":\n");

            String kind = cls.getKind().name().toLowerCase(Locale.ROOT);
            line(1, "\"\"\"Migrated from Java " + kind + " " + cls.getName() + ".\"\"\"");
            if (!external.isEmpty()) {
                line(1, "# implements: " + String.join(", ", external));
            }
        }

        /**
         * A base that another listed base already inherits from would make the method
         * resolution order inconsistent; it is reached through the other base instead.
         */
        private void dropInheritedBases(List<String> bases) {
            List<String> redundant = new ArrayList<>();
            for (String base : bases) {
                for (String other : bases) {
                    if (!other.equals(base) && graph.ancestors(other).contains(base)) {
                        redundant.add(base);
                        warnings.add(cls.getName() + ": base " + base + " omitted, already inherited through " + other);
                        break;
                    }
                }
            }
            bases.removeAll(redundant);
        }

        private void writeClassLevelFields() {
            List<MappedField> constants = cls.classLevelFields().stream().filter(MappedField::isConstant).toList();
            List<MappedField> variables = cls.classLevelFields().stream().filter(f -> !f.isConstant()).toList();
            if (constants.isEmpty() && variables.isEmpty()) {
                return;
            }
            sb.append('\n');
            for (MappedField field : constants) {
                writeClassAttribute(field);
            }
            for (MappedField field : variables) {
                writeClassAttribute(field);
            }
        }

        private void writeClassAttribute(MappedField field) {
            String annotation = field.getName() + ": " + annotate(field.getType());
            if (field.getInitializer().isPresent()) {
                line(1, annotation + " = " + field.getInitializer().get());
            } else if (field.getSourceInitializer().isPresent()) {
                line(1, annotation + " = None  # [j2py] initializer not translated: "
                        + singleLine(field.getSourceInitializer().get()));
            } else {
                line(1, annotation);
            }
        }

        private void writeInstanceAnnotations() {
            List<MappedField> instanceFields = cls.instanceFields();
            if (instanceFields.isEmpty()) {
                return;
            }
            sb.append('\n');
            for (MappedField field : instanceFields) {
                line(1, field.getName() + ": " + annotate(field.getType()));
            }
        }

        private void writeInitializer() {
            sb.append('\n');
            List<MappedConstructor> ctors = cls.getConstructors();
            List<String> params = new ArrayList<>();
            params.add("self");
            List<String> signatureComments = new ArrayList<>();

            if (ctors.size() == 1) {
                ctors.get(0).getParams().forEach(p -> params.add(p.getName() + ": " + annotate(p.getType())));
            } else if (ctors.size() > 1) {
                Optional<MappedConstructor> longest = prefixCompatibleLongest(ctors);
                if (longest.isPresent()) {
                    int shortest = ctors.stream().mapToInt(c -> c.getParams().size()).min().orElse(0);
                    List<MappedParam> all = longest.get().getParams();
                    for (int i = 0; i < all.size(); i++) {
                        MappedParam p = all.get(i);
                        if (i < shortest) {
                            params.add(p.getName() + ": " + annotate(p.getType()));
                        } else {
                            params.add(p.getName() + ": " + annotate(TargetType.optionalOf(p.getType())) + " = None");
                        }
                    }
                    warnings.add(cls.getName() + ": merged " + ctors.size()
                            + " constructors into one __init__ with optional trailing parameters");
                } else {
                    typingNames.add(TargetType.ANY);
                    params.add("*args: Any");
                    params.add("**kwargs: Any");
                    signatureComments.add("# merged constructor signatures:");
                    ctors.forEach(c -> signatureComments.add("#   " + c.sourceSignature()));
                    warnings.add(cls.getName() + ": merged " + ctors.size()
                            + " constructors with incompatible signatures into __init__(*args, **kwargs)");
                }
            }

            line(1, "def __init__(" + String.join(", ", params) + ") -> None:");
            signatureComments.forEach(c -> line(2, c));
            for (MappedField field : cls.instanceFields()) {
                line(2, "self." + field.getName() + " = " + field.getInitializer().orElse("None"));
            }

            List<MethodBody> bodies = ctors.stream().map(MappedConstructor::getBody).filter(MethodBody::isPresent).toList();
            if (bodies.isEmpty()) {
                if (cls.instanceFields().isEmpty()) {
                    line(2, "pass");
                }
                return;
            }
            bodies.forEach(this::echoBody);
            line(2, BODY_MARKER);
            line(2, "raise NotImplementedError");
        }

        /**
         * The constructor whose parameter list every other constructor is a prefix of, if any.
         */
        private Optional<MappedConstructor> prefixCompatibleLongest(List<MappedConstructor> ctors) {
            MappedConstructor longest = ctors.stream()
                    .max(Comparator.comparingInt(c -> c.getParams().size()))
                    .orElseThrow();
            for (MappedConstructor ctor : ctors) {
                List<MappedParam> params = ctor.getParams();
                for (int i = 0; i < params.size(); i++) {
                    MappedParam p = params.get(i);
                    MappedParam q = longest.getParams().get(i);
                    if (!p.getName().equals(q.getName()) || !p.getType().equals(q.getType())) {
                        return Optional.empty();
                    }
                }
            }
            long distinctArities = ctors.stream().mapToInt(c -> c.getParams().size()).distinct().count();
            return distinctArities == ctors.size() ? Optional.of(longest) : Optional.empty();
        }

        private void writeMethod(MappedMethod method) {
            if (method.isStatic()) {
                line(1, "@staticmethod");
            }
            if (method.isAbstract()) {
                abcNames.add("abstractmethod");
                line(1, "@abstractmethod");
            }
            List<String> params = new ArrayList<>();
            if (!method.isStatic()) {
                params.add("self");
            }
            method.getParams().forEach(p -> params.add(p.getName() + ": " + annotate(p.getType())));
            line(1, "def " + method.getName() + "(" + String.join(", ", params) + ") -> "
                    + annotate(method.getReturnType()) + ":");

            MethodBody body = method.getBody();
            if (body instanceof MethodBody.OpaqueToken) {
                echoBody(body);
                line(2, BODY_MARKER);
                line(2, "raise NotImplementedError");
            } else {
                line(2, "...");
            }
        }

        private void echoBody(MethodBody body) {
            if (!options.isIncludeSourceBodies() || !(body instanceof MethodBody.OpaqueToken token)) {
                return;
            }
            token.rawText().lines().forEach(l -> line(2, "# | " + l.stripTrailing()));
        }

        private String annotate(TargetType type) {
            Set<String> names = new HashSet<>();
            type.collectNames(names);
            names.stream().filter(TYPING_NAMES::contains).forEach(typingNames::add);
            return type.render();
        }

        private void line(int depth, String text) {
            sb.append(unit.repeat(depth)).append(text).append('\n');
        }
    }

    private static String singleLine(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
