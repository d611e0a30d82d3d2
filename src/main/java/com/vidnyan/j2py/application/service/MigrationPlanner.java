package com.vidnyan.j2py.application.service;

import com.vidnyan.j2py.domain.graph.InheritanceGraph;
import com.vidnyan.j2py.domain.mapped.MappedClass;
import com.vidnyan.j2py.domain.mapped.MappedField;
import com.vidnyan.j2py.domain.mapped.MappedIr;
import com.vidnyan.j2py.domain.mapped.MappedMethod;
import com.vidnyan.j2py.domain.plan.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Orders the migration of a mapped unit: parents before children, and per class the
 * components CLASS, FIELDS, CONSTRUCTOR, METHODS. Each step is scored with the configured
 * {@link ComplexityPolicy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationPlanner {

    private static final int LARGE_CLASS_METHODS = 10;
    private static final int MANY_CLASSES = 3;
    private static final int MANY_IMPORTS = 10;

    private final ComplexityPolicy policy;

    /**
     * Build the plan for one unit.
     * @throws CyclicDependencyException when inheritance edges inside the unit form a cycle
     */
    public MigrationPlan plan(MappedIr ir) {
        InheritanceGraph graph = InheritanceGraph.build(ir);
        List<String> order = graph.topologicalOrder()
                .orElseThrow(() -> new CyclicDependencyException(graph.findCycle()));

        List<PlanStep> steps = new ArrayList<>();
        Map<String, Integer> classStepIds = new HashMap<>();

        for (String className : order) {
            MappedClass cls = ir.findClass(className)
                    .orElseThrow(() -> new IllegalStateException("Class missing from IR: " + className));
            planClass(cls, ir, graph, classStepIds, steps);
        }

        MigrationPlan plan = MigrationPlan.of(List.copyOf(steps), summarize(ir));
        log.debug("Planned {} steps for {} classes, difficulty {}",
                steps.size(), order.size(), plan.getSummary().getDifficulty());
        return plan;
    }

    private void planClass(MappedClass cls, MappedIr ir, InheritanceGraph graph,
                           Map<String, Integer> classStepIds, List<PlanStep> steps) {
        String name = cls.getName();
        int depth = graph.inheritanceDepth(ir, name);
        int classScore = classScore(cls, depth);

        // CLASS
        List<String> classWarnings = new ArrayList<>();
        cls.getSuperclass()
                .filter(parent -> ir.findClass(parent).isEmpty())
                .ifPresent(parent -> classWarnings.add(
                        "Superclass " + parent + " is outside this unit and must be migrated first"));
        if (!cls.getCapabilities().isEmpty()) {
            classWarnings.add("Implements interfaces: " + String.join(", ", cls.getCapabilities())
                    + "; carried as capability metadata, not inheritance");
        }
        if (cls.getMethods().size() > LARGE_CLASS_METHODS) {
            classWarnings.add("Class has " + cls.getMethods().size() + " methods; consider migrating it in stages");
        }

        int classStepId = steps.size() + 1;
        PlanStep.PlanStepBuilder classStep = PlanStep.builder()
                .id(classStepId)
                .targetClass(name)
                .component(StepComponent.CLASS)
                .description("Migrate definition of class " + name)
                .score(classScore)
                .complexity(policy.classify(classScore))
                .warnings(classWarnings);
        for (String parent : graph.getParents(name)) {
            classStep.dependency(classStepIds.get(parent));
        }
        steps.add(classStep.build());
        classStepIds.put(name, classStepId);

        // FIELDS
        if (!cls.getFields().isEmpty()) {
            List<String> warnings = new ArrayList<>();
            for (MappedField field : cls.getFields()) {
                if (field.isConstant() && !field.getName().equals(field.getSourceName())) {
                    warnings.add("Constant " + field.getSourceName() + " renamed to " + field.getName());
                }
            }
            int score = cls.getFields().size() * policy.getFieldWeight();
            steps.add(componentStep(steps.size() + 1, classStepId, name, StepComponent.FIELDS,
                    "Migrate " + cls.getFields().size() + " fields of class " + name, score, warnings));
        }

        // CONSTRUCTOR
        if (!cls.getConstructors().isEmpty()) {
            List<String> warnings = new ArrayList<>();
            if (cls.getConstructors().size() > 1) {
                warnings.add(cls.getConstructors().size() + " constructors of " + name
                        + " will be merged into a single __init__");
            }
            int score = cls.getConstructors().size() * policy.getConstructorWeight();
            steps.add(componentStep(steps.size() + 1, classStepId, name, StepComponent.CONSTRUCTOR,
                    "Migrate constructors of class " + name + " to __init__", score, warnings));
        }

        // METHODS
        if (!cls.getMethods().isEmpty()) {
            long genericMethods = cls.getMethods().stream().filter(MappedMethod::usesGenerics).count();
            int score = cls.getMethods().size() * policy.getMethodWeight()
                    + (int) genericMethods * policy.getGenericWeight();
            steps.add(componentStep(steps.size() + 1, classStepId, name, StepComponent.METHODS,
                    "Migrate " + cls.getMethods().size() + " methods of class " + name, score, methodWarnings(cls)));
        }
    }

    private PlanStep componentStep(int id, int classStepId, String className, StepComponent component,
                                   String description, int score, List<String> warnings) {
        return PlanStep.builder()
                .id(id)
                .targetClass(className)
                .component(component)
                .description(description)
                .score(score)
                .complexity(policy.classify(score))
                .dependency(classStepId)
                .warnings(warnings)
                .build();
    }

    /**
     * Overloads collapsing onto one target name, and static/instance pairs sharing a name.
     */
    private List<String> methodWarnings(MappedClass cls) {
        Map<String, List<MappedMethod>> byName = cls.getMethods().stream()
                .collect(Collectors.groupingBy(MappedMethod::getName, LinkedHashMap::new, Collectors.toList()));

        List<String> warnings = new ArrayList<>();
        byName.forEach((target, methods) -> {
            if (methods.size() < 2) {
                return;
            }
            boolean hasStatic = methods.stream().anyMatch(MappedMethod::isStatic);
            boolean hasInstance = methods.stream().anyMatch(m -> !m.isStatic());
            if (hasStatic && hasInstance) {
                warnings.add("Static and instance methods of " + cls.getName() + " collide on name " + target);
            }
            String sources = methods.stream()
                    .map(MappedMethod::getSourceName)
                    .distinct()
                    .collect(Collectors.joining(", "));
            warnings.add(methods.size() + " overloads (" + sources + ") collapse onto Python method " + target);
        });
        return warnings;
    }

    private int classScore(MappedClass cls, int depth) {
        boolean generic = !cls.getTypeParameters().isEmpty()
                || cls.getMethods().stream().anyMatch(MappedMethod::usesGenerics)
                || cls.getFields().stream().anyMatch(f -> f.getSourceType().usesGenerics());
        return cls.getMethods().size() * policy.getMethodWeight()
                + cls.getFields().size() * policy.getFieldWeight()
                + cls.getConstructors().size() * policy.getConstructorWeight()
                + depth * policy.getInheritanceWeight()
                + (generic ? policy.getGenericWeight() : 0)
                + cls.getCapabilities().size() * policy.getCapabilityWeight();
    }

    /**
     * Unit totals, flags, overall difficulty and recommendations.
     */
    PlanSummary summarize(MappedIr ir) {
        List<MappedClass> classes = ir.getClasses();
        boolean inheritance = classes.stream().anyMatch(c -> c.getSuperclass().isPresent());
        boolean interfaces = classes.stream().anyMatch(c -> !c.getCapabilities().isEmpty());
        boolean generics = classes.stream().anyMatch(c -> !c.getTypeParameters().isEmpty()
                || c.getMethods().stream().anyMatch(MappedMethod::usesGenerics)
                || c.getFields().stream().anyMatch(f -> f.getSourceType().usesGenerics()));
        int methods = ir.methodCount();

        int score = 0;
        if (classes.size() > 5) {
            score += 2;
        }
        if (methods > 20) {
            score += 2;
        }
        if (inheritance) {
            score += 1;
        }
        if (interfaces) {
            score += 1;
        }
        if (generics) {
            score += 1;
        }
        Difficulty difficulty = score <= 2 ? Difficulty.EASY : score <= 5 ? Difficulty.MODERATE : Difficulty.COMPLEX;

        PlanSummary.PlanSummaryBuilder summary = PlanSummary.builder()
                .totalClasses(classes.size())
                .totalMethods(methods)
                .totalFields(ir.fieldCount())
                .totalImports(ir.getImports().size())
                .inheritanceUsed(inheritance)
                .interfacesUsed(interfaces)
                .genericsUsed(generics)
                .difficulty(difficulty);

        if (classes.size() > MANY_CLASSES) {
            summary.recommendation("Migrate class by class and verify each batch before moving on");
        }
        if (inheritance) {
            summary.recommendation("Migrate parent classes before their subclasses");
        }
        if (interfaces) {
            summary.recommendation("Model interfaces as abstract base classes using the abc module");
        }
        if (generics) {
            summary.recommendation("Use the typing module for generic type annotations");
        }
        if (ir.getImports().size() > MANY_IMPORTS) {
            summary.recommendation("Review third-party dependencies and find Python equivalents");
        }
        return summary.build();
    }
}
