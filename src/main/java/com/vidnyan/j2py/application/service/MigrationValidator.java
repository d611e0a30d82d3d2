package com.vidnyan.j2py.application.service;

import com.vidnyan.j2py.application.service.PythonOutlineReader.Outline;
import com.vidnyan.j2py.application.service.PythonOutlineReader.OutlineAttribute;
import com.vidnyan.j2py.application.service.PythonOutlineReader.OutlineClass;
import com.vidnyan.j2py.application.service.PythonOutlineReader.OutlineDef;
import com.vidnyan.j2py.application.service.PythonOutlineReader.OutlineParam;
import com.vidnyan.j2py.application.service.PythonOutlineReader.PythonOutlineException;
import com.vidnyan.j2py.domain.mapped.MappedClass;
import com.vidnyan.j2py.domain.mapped.MappedIr;
import com.vidnyan.j2py.domain.naming.IdentifierKind;
import com.vidnyan.j2py.domain.naming.IdentifierRenamer;
import com.vidnyan.j2py.domain.validation.Issue;
import com.vidnyan.j2py.domain.validation.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checks generated Python text against the mapped IR it came from.
 *
 * <p>Structural mismatches are errors; naming and annotation findings are warnings.
 * Never throws: unreadable text becomes an error issue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationValidator {

    private final PythonOutlineReader outlineReader;

    public ValidationReport validate(String text, MappedIr ir) {
        List<Issue> issues = new ArrayList<>();

        Outline outline;
        try {
            outline = outlineReader.read(text);
        } catch (PythonOutlineException e) {
            issues.add(Issue.error("Generated text is not well-formed Python: " + e.getMessage(), "line " + e.getLine()));
            return ValidationReport.of(issues);
        }

        if (outline.getClasses().size() != ir.getClasses().size()) {
            issues.add(Issue.error("Expected " + ir.getClasses().size() + " classes, found "
                    + outline.getClasses().size(), null));
        }

        checkResolutionOrder(outline, issues);

        Map<String, OutlineClass> byName = outline.getClasses().stream()
                .collect(Collectors.toMap(OutlineClass::getName, Function.identity(), (a, b) -> a));
        for (MappedClass cls : ir.getClasses()) {
            OutlineClass generated = byName.get(cls.getName());
            if (generated == null) {
                issues.add(Issue.error("Class " + cls.getName() + " is missing from the generated text", cls.getName()));
                continue;
            }
            checkCounts(cls, generated, issues);
            checkNaming(cls, generated, issues);
            checkAnnotations(generated, issues);
            if (cls.getMethods().isEmpty() && cls.getFields().isEmpty()) {
                issues.add(Issue.warning("Class " + cls.getName() + " has neither methods nor fields", cls.getName()));
            }
        }

        ValidationReport report = ValidationReport.of(issues);
        log.debug("Validation {}: {} errors, {} warnings",
                report.isPassed() ? "passed" : "failed", report.errors().size(), report.warnings().size());
        return report;
    }

    private void checkCounts(MappedClass cls, OutlineClass generated, List<Issue> issues) {
        String name = cls.getName();
        int methods = generated.regularMethods().size();
        if (methods != cls.getMethods().size()) {
            issues.add(Issue.error("Method count mismatch: expected " + cls.getMethods().size()
                    + ", found " + methods, name));
        }
        int fields = generated.getAttributes().size();
        if (fields != cls.getFields().size()) {
            issues.add(Issue.error("Field count mismatch: expected " + cls.getFields().size()
                    + ", found " + fields, name));
        }
        int initializers = generated.initializers().size();
        if (initializers != cls.expectedInitializerCount()) {
            issues.add(Issue.error("Constructor count mismatch: expected " + cls.expectedInitializerCount()
                    + " __init__, found " + initializers, name));
        }
    }

    private void checkNaming(MappedClass cls, OutlineClass generated, List<Issue> issues) {
        String className = generated.getName();
        if (!IdentifierRenamer.isPascalCase(className)) {
            issues.add(Issue.warning("Class name " + className + " is not PascalCase", className));
        }
        Map<String, IdentifierKind> methodKinds = new HashMap<>();
        cls.getMethods().forEach(m -> methodKinds.put(m.getName(), m.getKind()));
        Map<String, IdentifierKind> fieldKinds = new HashMap<>();
        cls.getFields().forEach(f -> fieldKinds.put(f.getName(), f.getKind()));

        for (OutlineDef def : generated.getMethods()) {
            if (!isDunder(def.getName())) {
                IdentifierKind kind = expectedKind(def.getName(), methodKinds, methodKindByShape(def.getName()));
                if (!IdentifierRenamer.conforms(def.getName(), kind)) {
                    issues.add(Issue.warning("Method name " + def.getName() + " does not follow the "
                            + convention(kind) + " convention", className + "." + def.getName()));
                }
            }
            List<OutlineParam> params = def.getParams();
            for (int i = 0; i < params.size(); i++) {
                OutlineParam param = params.get(i);
                if (isReceiverAt(def, i) || IdentifierRenamer.conforms(param.getName(), IdentifierKind.PARAM)) {
                    continue;
                }
                issues.add(Issue.warning("Parameter name " + param.getName() + " is not snake_case",
                        className + "." + def.getName()));
            }
        }
        for (OutlineAttribute attribute : generated.getAttributes()) {
            IdentifierKind kind = expectedKind(attribute.getName(), fieldKinds, fieldKindByShape(attribute.getName()));
            if (!IdentifierRenamer.conforms(attribute.getName(), kind)) {
                issues.add(Issue.warning("Field name " + attribute.getName() + " does not follow the "
                        + convention(kind) + " convention", className + "." + attribute.getName()));
            }
        }
    }

    private void checkAnnotations(OutlineClass generated, List<Issue> issues) {
        for (OutlineDef def : generated.getMethods()) {
            String location = generated.getName() + "." + def.getName();
            List<OutlineParam> params = def.getParams();
            for (int i = 0; i < params.size(); i++) {
                OutlineParam param = params.get(i);
                if (!isReceiverAt(def, i) && !param.isAnnotated()) {
                    issues.add(Issue.warning("Parameter " + param.getName() + " has no type annotation", location));
                }
            }
            if (!def.isReturnAnnotated()) {
                issues.add(Issue.warning("Method " + def.getName() + " has no return annotation", location));
            }
        }
    }

    /**
     * C3 linearisation over the classes of the outline. Bases defined elsewhere count as
     * leaves. A class whose bases cannot be linearised fails to load in Python.
     */
    private void checkResolutionOrder(Outline outline, List<Issue> issues) {
        Map<String, List<String>> bases = new LinkedHashMap<>();
        for (OutlineClass cls : outline.getClasses()) {
            bases.putIfAbsent(cls.getName(), cls.getBases().stream()
                    .filter(b -> !b.contains("="))
                    .map(MigrationValidator::baseName)
                    .toList());
        }
        Map<String, List<String>> linearised = new HashMap<>();
        for (String name : bases.keySet()) {
            if (linearise(name, bases, linearised, new HashSet<>()) == null) {
                issues.add(Issue.error("Bases of " + name + " " + bases.get(name)
                        + " do not allow a consistent method resolution order", name));
            }
        }
    }

    private static List<String> linearise(String name, Map<String, List<String>> bases,
                                          Map<String, List<String>> done, Set<String> visiting) {
        if (done.containsKey(name)) {
            return done.get(name);
        }
        List<String> direct = bases.get(name);
        if (direct == null) {
            return List.of(name);
        }
        if (!visiting.add(name)) {
            return null;
        }
        List<List<String>> sequences = new ArrayList<>();
        for (String base : direct) {
            List<String> parent = linearise(base, bases, done, visiting);
            if (parent == null) {
                return null;
            }
            sequences.add(new ArrayList<>(parent));
        }
        sequences.add(new ArrayList<>(direct));

        List<String> result = new ArrayList<>();
        result.add(name);
        while (sequences.stream().anyMatch(seq -> !seq.isEmpty())) {
            String head = null;
            for (List<String> seq : sequences) {
                if (!seq.isEmpty() && sequences.stream().noneMatch(o -> o.indexOf(seq.get(0)) > 0)) {
                    head = seq.get(0);
                    break;
                }
            }
            if (head == null) {
                return null;
            }
            result.add(head);
            for (List<String> seq : sequences) {
                if (!seq.isEmpty() && seq.get(0).equals(head)) {
                    seq.remove(0);
                }
            }
        }
        visiting.remove(name);
        done.put(name, result);
        return result;
    }

    private static String baseName(String base) {
        int subscript = base.indexOf('[');
        return (subscript >= 0 ? base.substring(0, subscript) : base).trim();
    }

    /**
     * Kind recorded in the IR for {@code name}. A name not found as written is matched
     * ignoring case and underscores, so a mis-cased member is still checked against its kind.
     */
    private static IdentifierKind expectedKind(String name, Map<String, IdentifierKind> kinds, IdentifierKind fallback) {
        IdentifierKind exact = kinds.get(name);
        if (exact != null) {
            return exact;
        }
        String key = looseKey(name);
        return kinds.entrySet().stream()
                .filter(e -> looseKey(e.getKey()).equals(key))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(fallback);
    }

    private static String looseKey(String name) {
        return name.replace("_", "").toLowerCase(Locale.ROOT);
    }

    private static IdentifierKind methodKindByShape(String name) {
        return name.startsWith("_") ? IdentifierKind.PRIVATE_METHOD : IdentifierKind.METHOD;
    }

    private static IdentifierKind fieldKindByShape(String name) {
        boolean upper = name.chars().anyMatch(Character::isLetter) && name.equals(name.toUpperCase(Locale.ROOT));
        if (upper) {
            return IdentifierKind.CONSTANT_FIELD;
        }
        return name.startsWith("_") ? IdentifierKind.PRIVATE_FIELD : IdentifierKind.FIELD;
    }

    private static String convention(IdentifierKind kind) {
        return switch (kind) {
            case CONSTANT_FIELD -> "UPPER_SNAKE_CASE";
            case PRIVATE_FIELD, PRIVATE_METHOD -> "_private snake_case";
            default -> "snake_case";
        };
    }

    private static boolean isReceiverAt(OutlineDef def, int index) {
        return index == 0 && !def.isStatic() && isReceiver(def.getParams().get(0).getName());
    }

    private static boolean isReceiver(String name) {
        return "self".equals(name) || "cls".equals(name);
    }

    private static boolean isDunder(String name) {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }
}
