package com.vidnyan.j2py.adapter.out.parser;

import com.vidnyan.j2py.Fixtures;
import com.vidnyan.j2py.domain.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JavaParserStructuralParserTest {

    private final JavaParserStructuralParser parser = new JavaParserStructuralParser();

    @Test
    void parse_ShouldExtractDeclarationsOfAccount() {
        // Act
        StructuralIr ir = parser.parse(Fixtures.load("Account.java"));

        // Assert
        assertEquals("com.example.bank", ir.getPackageName());
        assertEquals(List.of("java.util.ArrayList", "java.util.List"), ir.getImports());
        assertEquals(1, ir.getClasses().size());

        ClassDecl account = ir.getClasses().get(0);
        assertEquals("Account", account.getName());
        assertEquals(ClassKind.CLASS, account.getKind());
        assertEquals(6, account.getLine());
        assertTrue(account.getSuperclass().isEmpty());
        assertEquals(5, account.getFields().size());
        assertEquals(2, account.getConstructors().size());
        assertEquals(5, account.getMethods().size());

        FieldDecl minBalance = account.getFields().get(0);
        assertEquals("minBalance", minBalance.getName());
        assertEquals("double", minBalance.getType().getName());
        assertEquals(Set.of(Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL), minBalance.getModifiers());
        assertEquals("10.0", minBalance.getInitializer().orElseThrow());
        assertTrue(minBalance.isConstant());

        FieldDecl history = account.getFields().get(4);
        assertEquals("List<String>", history.getType().render());
        assertEquals("new ArrayList<>()", history.getInitializer().orElseThrow());
    }

    @Test
    void parse_ShouldKeepBodiesOpaqueAndVerbatim() {
        // Act
        ClassDecl account = parser.parse(Fixtures.load("Account.java")).getClasses().get(0);

        // Assert
        MethodDecl withdraw = account.getMethods().get(3);
        assertEquals("withdraw", withdraw.getName());
        assertTrue(withdraw.getBody().isPresent());
        String raw = ((MethodBody.OpaqueToken) withdraw.getBody()).rawText();
        assertTrue(raw.startsWith("{"));
        assertTrue(raw.endsWith("}"));
        assertTrue(raw.contains("balance -= amount;"));

        MethodDecl deposit = account.getMethods().get(2);
        assertTrue(deposit.getModifiers().contains(Modifier.SYNCHRONIZED));
        assertEquals("void", deposit.getReturnType().getName());

        MethodDecl open = account.getMethods().get(4);
        assertTrue(open.isStatic());
        assertEquals("Account", open.getReturnType().getName());
    }

    @Test
    void parse_ShouldExtractInterfacesWithImplicitModifiers() {
        // Act
        StructuralIr ir = parser.parse(Fixtures.load("Shapes.java"));

        // Assert
        assertEquals(List.of("Shape", "AbstractShape", "Circle", "ShapeRegistry"),
                ir.getClasses().stream().map(ClassDecl::getName).toList());

        ClassDecl shape = ir.getClasses().get(0);
        assertEquals(ClassKind.INTERFACE, shape.getKind());
        assertTrue(shape.getFields().get(0).isConstant());
        assertTrue(shape.getMethods().stream().allMatch(MethodDecl::isAbstract));
        assertTrue(shape.getMethods().stream().noneMatch(m -> m.getBody().isPresent()));

        ClassDecl abstractShape = ir.getClasses().get(1);
        assertTrue(abstractShape.isAbstract());
        assertEquals(List.of("Shape"), abstractShape.getInterfaces());

        ClassDecl circle = ir.getClasses().get(2);
        assertEquals("AbstractShape", circle.getSuperclass().orElseThrow());

        ClassDecl registry = ir.getClasses().get(3);
        assertEquals(List.of("T"), registry.getTypeParameters());
        TypeRef byName = registry.getFields().get(0).getType();
        assertEquals("Map", byName.getName());
        assertEquals("String", byName.getGenericArgs().get(0).getName());
        assertEquals("List", byName.getGenericArgs().get(1).getName());
        assertEquals("T", byName.getGenericArgs().get(1).getGenericArgs().get(0).getName());
    }

    @Test
    void parse_ShouldCountArrayDimensionsAndVarargs() {
        // Arrange
        String source = """
                class Grid {
                    int[][] cells;
                    String labels[];
                    void log(String... parts) {}
                }
                """;

        // Act
        ClassDecl grid = parser.parse(source).getClasses().get(0);

        // Assert
        assertEquals(2, grid.getFields().get(0).getType().getArrayDepth());
        assertEquals("int", grid.getFields().get(0).getType().getName());
        assertEquals(1, grid.getFields().get(1).getType().getArrayDepth());
        ParamDecl parts = grid.getMethods().get(0).getParams().get(0);
        assertEquals("String", parts.getType().getName());
        assertEquals(1, parts.getType().getArrayDepth());
    }

    @Test
    void parse_ShouldSplitMultipleDeclarators() {
        // Act
        ClassDecl point = parser.parse("class Point { int x, y = 2; }").getClasses().get(0);

        // Assert
        assertEquals(2, point.getFields().size());
        assertEquals("x", point.getFields().get(0).getName());
        assertTrue(point.getFields().get(0).getInitializer().isEmpty());
        assertEquals("2", point.getFields().get(1).getInitializer().orElseThrow());
    }

    @Test
    void parse_ShouldRecordWildcards() {
        // Arrange
        String source = """
                import java.util.*;
                import static java.lang.Math.max;

                class Bag {
                    List<? extends Number> numbers;
                    List<?> anything;
                }
                """;

        // Act
        StructuralIr ir = parser.parse(source);

        // Assert
        assertEquals(List.of("java.util.*", "static java.lang.Math.max"), ir.getImports());
        TypeRef bounded = ir.getClasses().get(0).getFields().get(0).getType().getGenericArgs().get(0);
        assertEquals("Number", bounded.getName());
        assertTrue(bounded.isWildcard());
        TypeRef unbounded = ir.getClasses().get(0).getFields().get(1).getType().getGenericArgs().get(0);
        assertEquals(TypeRef.UNBOUNDED_WILDCARD, unbounded.getName());
    }

    @Test
    void parse_ShouldKeepDirectionOfWildcardBound() {
        // Arrange
        String source = """
                import java.util.List;

                class Sink {
                    void drain(List<? extends Number> source) {}
                    void fill(List<? super Integer> target) {}
                }
                """;

        // Act
        ClassDecl sink = parser.parse(source).getClasses().get(0);

        // Assert
        TypeRef upper = sink.getMethods().get(0).getParams().get(0).getType();
        TypeRef lower = sink.getMethods().get(1).getParams().get(0).getType();
        assertFalse(upper.getGenericArgs().get(0).isLowerBounded());
        assertTrue(lower.getGenericArgs().get(0).isLowerBounded());
        assertEquals("List<? extends Number>", upper.render());
        assertEquals("List<? super Integer>", lower.render());
        assertEquals("fill(List<? super Integer>)", sink.getMethods().get(1).getOverloadKey());
    }

    @Test
    void parse_ShouldReportPositionOfSyntaxError() {
        // Act
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                () -> parser.parse(Fixtures.load("Broken.java")));

        // Assert
        assertTrue(e.getLine() >= 1);
        assertTrue(e.getColumn() >= 1);
    }

    @Test
    void parse_ShouldRejectEnums() {
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                () -> parser.parse("enum Color { RED, GREEN }"));

        assertTrue(e.getMessage().contains("enum"));
        assertEquals(1, e.getLine());
    }

    @Test
    void parse_ShouldRejectNestedTypesWithTheirPosition() {
        // Arrange
        String source = """
                class Outer {
                    int a;
                    static class Inner {}
                }
                """;

        // Act
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class, () -> parser.parse(source));

        // Assert
        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().contains("Inner"));
    }

    @Test
    void parse_ShouldRejectInitializerBlocks() {
        SourceSyntaxException e = assertThrows(SourceSyntaxException.class,
                () -> parser.parse("class Counter {\n    static int n;\n    static { n = 1; }\n}\n"));

        assertTrue(e.getMessage().contains("initializer"));
        assertEquals(3, e.getLine());
    }

    @Test
    void parse_ShouldRejectDuplicateTypesAndFields() {
        assertThrows(SourceSyntaxException.class, () -> parser.parse("class A {}\nclass A {}\n"));
        assertThrows(SourceSyntaxException.class, () -> parser.parse("class A { int x; String x; }"));
        assertThrows(SourceSyntaxException.class, () -> parser.parse("class A extends A {}"));
    }

    @Test
    void parse_ShouldAcceptEmptySource() {
        StructuralIr ir = parser.parse("");

        assertTrue(ir.getClasses().isEmpty());
        assertEquals("", ir.getPackageName());
    }
}
