package com.vidnyan.j2py.application.service;

import com.vidnyan.j2py.application.service.PythonOutlineReader.Outline;
import com.vidnyan.j2py.application.service.PythonOutlineReader.OutlineClass;
import com.vidnyan.j2py.application.service.PythonOutlineReader.OutlineDef;
import com.vidnyan.j2py.application.service.PythonOutlineReader.PythonOutlineException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonOutlineReaderTest {

    private final PythonOutlineReader reader = new PythonOutlineReader();

    @Test
    void read_ShouldOutlineClassesMethodsAndAttributes() {
        // Arrange
        String text = """
                \"""Module docstring.
                class NotAClass:
                \"""
                from typing import List

                class Box(Base, ABC):
                    \"""Doc.\"""
                    LIMIT: int = 3
                    items: List[int]

                    def __init__(self, items: List[int]) -> None:
                        self.items = items

                    @staticmethod
                    def make(
                        size: int,
                        fill=0,
                    ) -> Box:
                        return Box([fill] * size)  # trailing ) comment
                """;

        // Act
        Outline outline = reader.read(text);

        // Assert
        assertEquals(List.of("from typing import List"), outline.getImports());
        assertEquals(1, outline.getClasses().size());
        OutlineClass box = outline.getClasses().get(0);
        assertEquals("Box", box.getName());
        assertEquals(List.of("Base", "ABC"), box.getBases());
        assertEquals(List.of("LIMIT", "items"), box.getAttributes().stream().map(a -> a.getName()).toList());
        assertEquals(1, box.initializers().size());

        OutlineDef make = box.regularMethods().get(0);
        assertEquals("make", make.getName());
        assertTrue(make.isStatic());
        assertTrue(make.isReturnAnnotated());
        assertTrue(make.getParams().get(0).isAnnotated());
        assertFalse(make.getParams().get(1).isAnnotated());
        assertEquals(15, make.getLine());
    }

    @Test
    void read_ShouldRejectUnclosedBracket() {
        PythonOutlineException e = assertThrows(PythonOutlineException.class,
                () -> reader.read("class A:\n    def f(self, x: int -> None:\n        pass\n"));

        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().contains("never closed"));
    }

    @Test
    void read_ShouldRejectMismatchedBracket() {
        PythonOutlineException e = assertThrows(PythonOutlineException.class,
                () -> reader.read("x = [1, 2)\n"));

        assertEquals(1, e.getLine());
    }

    @Test
    void read_ShouldRejectUnexpectedIndent() {
        PythonOutlineException e = assertThrows(PythonOutlineException.class,
                () -> reader.read("class A:\n    x: int\n        y: int\n"));

        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().contains("unexpected indent"));
    }

    @Test
    void read_ShouldRejectMissingBlock() {
        PythonOutlineException e = assertThrows(PythonOutlineException.class,
                () -> reader.read("class A:\nclass B:\n    pass\n"));

        assertEquals(2, e.getLine());
    }

    @Test
    void read_ShouldRejectInconsistentDedent() {
        PythonOutlineException e = assertThrows(PythonOutlineException.class,
                () -> reader.read("class A:\n    def f(self):\n        pass\n  x = 1\n"));

        assertEquals(4, e.getLine());
    }

    @Test
    void read_ShouldRejectUnterminatedStrings() {
        assertThrows(PythonOutlineException.class, () -> reader.read("x = 'abc\n"));
        assertThrows(PythonOutlineException.class, () -> reader.read("\"\"\"never closed\nclass A:\n    pass\n"));
    }

    @Test
    void read_ShouldRejectKeywordsAsNames() {
        PythonOutlineException cls = assertThrows(PythonOutlineException.class,
                () -> reader.read("class lambda:\n    x: int\n"));
        PythonOutlineException def = assertThrows(PythonOutlineException.class,
                () -> reader.read("class A:\n    def pass(self) -> None:\n        ...\n"));
        PythonOutlineException param = assertThrows(PythonOutlineException.class,
                () -> reader.read("class A:\n    def f(self, from: int) -> None:\n        ...\n"));

        assertEquals(1, cls.getLine());
        assertTrue(cls.getMessage().contains("keyword 'lambda'"));
        assertEquals(2, def.getLine());
        assertEquals(2, param.getLine());
    }

    @Test
    void read_ShouldAcceptEscapedKeywordNames() {
        Outline outline = reader.read("class lambda_:\n    def pass_(self, from_: int) -> None:\n        ...\n");

        assertEquals("lambda_", outline.getClasses().get(0).getName());
        assertEquals("pass_", outline.getClasses().get(0).getMethods().get(0).getName());
    }

    @Test
    void splitTopLevel_ShouldIgnoreNestedCommas() {
        assertEquals(List.of("a: Dict[str, int]", "b='x,y'", "c"),
                PythonOutlineReader.splitTopLevel("a: Dict[str, int], b='x,y', c"));
    }
}
