package com.vidnyan.j2py.application.service;

import com.vidnyan.j2py.Fixtures;
import com.vidnyan.j2py.adapter.out.parser.JavaParserStructuralParser;
import com.vidnyan.j2py.domain.mapped.MappedIr;
import com.vidnyan.j2py.domain.mapped.MappingTable;
import com.vidnyan.j2py.domain.plan.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MigrationPlannerTest {

    private final JavaParserStructuralParser parser = new JavaParserStructuralParser();
    private final SemanticMapper mapper = new SemanticMapper(MappingTable.defaults());
    private final MigrationPlanner planner = new MigrationPlanner(ComplexityPolicy.defaults());

    private MappedIr mapped(String source) {
        return mapper.map(parser.parse(source));
    }

    @Test
    void plan_ShouldOrderParentsBeforeChildren() {
        // Arrange
        MappedIr ir = mapped("class Child extends Base { void run() {} }\nclass Base { void stop() {} }\n");

        // Act
        MigrationPlan plan = planner.plan(ir);

        // Assert
        assertEquals(List.of("Base", "Base", "Child", "Child"),
                plan.getSteps().stream().map(PlanStep::getTargetClass).toList());
        PlanStep baseClass = plan.step("Base", StepComponent.CLASS).orElseThrow();
        PlanStep childClass = plan.step("Child", StepComponent.CLASS).orElseThrow();
        assertEquals(Set.of(baseClass.getId()), childClass.getDependsOn());
    }

    @Test
    void plan_ShouldNumberStepsAndOrderComponents() {
        // Act
        MigrationPlan plan = planner.plan(mapped(Fixtures.load("Shapes.java")));

        // Assert
        assertEquals(14, plan.getSteps().size());
        for (int i = 0; i < plan.getSteps().size(); i++) {
            assertEquals(i + 1, plan.getSteps().get(i).getId());
        }
        assertEquals(List.of(StepComponent.CLASS, StepComponent.FIELDS, StepComponent.CONSTRUCTOR, StepComponent.METHODS),
                plan.stepsFor("Circle").stream().map(PlanStep::getComponent).toList());
        assertEquals(List.of(StepComponent.CLASS, StepComponent.FIELDS, StepComponent.METHODS),
                plan.stepsFor("Shape").stream().map(PlanStep::getComponent).toList());

        PlanStep circleClass = plan.step("Circle", StepComponent.CLASS).orElseThrow();
        PlanStep abstractClass = plan.step("AbstractShape", StepComponent.CLASS).orElseThrow();
        assertEquals(Set.of(abstractClass.getId()), circleClass.getDependsOn());
        assertEquals(Set.of(circleClass.getId()), plan.step("Circle", StepComponent.METHODS).orElseThrow().getDependsOn());
        assertTrue(plan.step("Shape", StepComponent.CLASS).orElseThrow().getDependsOn().isEmpty());
    }

    @Test
    void plan_ShouldFailOnInheritanceCycle() {
        // Arrange
        MappedIr ir = mapped("class A extends B {}\nclass B extends A {}\n");

        // Act
        CyclicDependencyException e = assertThrows(CyclicDependencyException.class, () -> planner.plan(ir));

        // Assert
        assertEquals(List.of("A", "B", "A"), e.getCycle());
    }

    @Test
    void plan_ShouldListAllImplementedInterfaces() {
        // Arrange
        MappedIr ir = mapped("public class Worker implements Runnable, AutoCloseable {\n"
                + "    public void run() {}\n    public void close() {}\n}\n");

        // Act
        PlanStep classStep = planner.plan(ir).step("Worker", StepComponent.CLASS).orElseThrow();

        // Assert
        assertEquals(1, classStep.getWarnings().size());
        String warning = classStep.getWarnings().get(0);
        assertTrue(warning.contains("Runnable"));
        assertTrue(warning.contains("AutoCloseable"));
    }

    @Test
    void plan_ShouldWarnAboutMergedConstructorsAndRenamedConstants() {
        // Act
        MigrationPlan plan = planner.plan(mapped(Fixtures.load("Account.java")));

        // Assert
        List<PlanStep> ctorSteps = plan.getSteps().stream()
                .filter(s -> s.getComponent() == StepComponent.CONSTRUCTOR)
                .toList();
        assertEquals(1, ctorSteps.size());
        assertEquals(List.of("2 constructors of Account will be merged into a single __init__"), ctorSteps.get(0).getWarnings());
        assertEquals(List.of("Constant minBalance renamed to MIN_BALANCE"),
                plan.step("Account", StepComponent.FIELDS).orElseThrow().getWarnings());
    }

    @Test
    void plan_ShouldWarnWhenOverloadsCollapse() {
        // Arrange
        MappedIr ir = mapped("""
                class MathUtil {
                    int add(int a, int b) { return a + b; }
                    double add(double a, double b) { return a + b; }
                    static int add(int a) { return a; }
                }
                """);

        // Act
        List<String> warnings = planner.plan(ir).step("MathUtil", StepComponent.METHODS).orElseThrow().getWarnings();

        // Assert
        assertTrue(warnings.contains("Static and instance methods of MathUtil collide on name add"));
        assertTrue(warnings.contains("3 overloads (add) collapse onto Python method add"));
    }

    @Test
    void plan_ShouldWarnAboutExternalSuperclass() {
        PlanStep classStep = planner.plan(mapped("class AppError extends RuntimeException {}"))
                .step("AppError", StepComponent.CLASS).orElseThrow();

        assertEquals(List.of("Superclass RuntimeException is outside this unit and must be migrated first"),
                classStep.getWarnings());
    }

    @Test
    void plan_ShouldScoreStepsWithPolicy() {
        // Act
        MigrationPlan plan = planner.plan(mapped(Fixtures.load("Account.java")));

        // Assert
        PlanStep classStep = plan.step("Account", StepComponent.CLASS).orElseThrow();
        // 5 methods + 5 fields + 2 constructors * 2 + generic field
        assertEquals(15, classStep.getScore());
        assertEquals(Complexity.HIGH, classStep.getComplexity());
        PlanStep ctorStep = plan.step("Account", StepComponent.CONSTRUCTOR).orElseThrow();
        assertEquals(4, ctorStep.getScore());
        assertEquals(Complexity.MEDIUM, ctorStep.getComplexity());
        PlanStep methodStep = plan.step("Account", StepComponent.METHODS).orElseThrow();
        assertEquals(5, methodStep.getScore());
        assertEquals(Complexity.MEDIUM, methodStep.getComplexity());
    }

    @Test
    void plan_ShouldSkipComponentsOfEmptyClass() {
        MigrationPlan plan = planner.plan(mapped("class Marker {}"));

        assertEquals(1, plan.getSteps().size());
        assertEquals(Complexity.LOW, plan.getSteps().get(0).getComplexity());
    }

    @Test
    void summarize_ShouldFlagFeaturesAndRecommend() {
        // Act
        PlanSummary summary = planner.plan(mapped(Fixtures.load("Shapes.java"))).getSummary();

        // Assert
        assertEquals(4, summary.getTotalClasses());
        assertEquals(9, summary.getTotalMethods());
        assertEquals(4, summary.getTotalFields());
        assertEquals(2, summary.getTotalImports());
        assertTrue(summary.isInheritanceUsed());
        assertTrue(summary.isInterfacesUsed());
        assertTrue(summary.isGenericsUsed());
        assertEquals(Difficulty.MODERATE, summary.getDifficulty());
        assertEquals(List.of(
                "Migrate class by class and verify each batch before moving on",
                "Migrate parent classes before their subclasses",
                "Model interfaces as abstract base classes using the abc module",
                "Use the typing module for generic type annotations"), summary.getRecommendations());
    }

    @Test
    void summarize_ShouldRateSingleSimpleClassEasy() {
        PlanSummary summary = planner.plan(mapped("class Counter { int n; int next() { return ++n; } }")).getSummary();

        assertEquals(Difficulty.EASY, summary.getDifficulty());
        assertTrue(summary.getRecommendations().isEmpty());
    }
}
