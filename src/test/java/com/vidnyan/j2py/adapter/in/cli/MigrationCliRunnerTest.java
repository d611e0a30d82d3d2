package com.vidnyan.j2py.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.j2py.Fixtures;
import com.vidnyan.j2py.adapter.out.json.IrJsonSerializer;
import com.vidnyan.j2py.adapter.out.parser.JavaParserStructuralParser;
import com.vidnyan.j2py.application.service.*;
import com.vidnyan.j2py.config.MigrationProperties;
import com.vidnyan.j2py.domain.mapped.MappingTable;
import com.vidnyan.j2py.domain.plan.ComplexityPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MigrationCliRunnerTest {

    @TempDir
    Path tempDir;

    private MigrationProperties properties;
    private MigrationCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new MigrationProperties();
        MigrationPipelineService pipeline = new MigrationPipelineService(
                new JavaParserStructuralParser(),
                new SemanticMapper(MappingTable.defaults()),
                new MigrationPlanner(ComplexityPolicy.defaults()),
                new PythonCodeGenerator(GeneratorOptions.defaults()),
                new MigrationValidator(new PythonOutlineReader()),
                Runnable::run,
                Runnable::run);
        runner = new MigrationCliRunner(pipeline, new IrJsonSerializer(new ObjectMapper()), properties);
    }

    @Test
    void run_ShouldWritePythonNextToSources() throws Exception {
        // Arrange
        Files.writeString(tempDir.resolve("Account.java"), Fixtures.load("Account.java"));
        Path nested = Files.createDirectories(tempDir.resolve("geometry"));
        Files.writeString(nested.resolve("Shapes.java"), Fixtures.load("Shapes.java"));
        Files.writeString(tempDir.resolve("notes.txt"), "not java");

        // Act
        runner.run(tempDir.toString());

        // Assert
        assertEquals(0, runner.getExitCode());
        String account = Files.readString(tempDir.resolve("Account.py"));
        assertTrue(account.startsWith("\"\"\"Generated by j2py"));
        assertTrue(account.contains("class Account:"));
        assertTrue(Files.exists(nested.resolve("Shapes.py")));
        assertFalse(Files.exists(tempDir.resolve("Account.j2py.json")));
        assertFalse(Files.exists(tempDir.resolve("notes.py")));
    }

    @Test
    void run_ShouldMigrateReadableFilesWhenOneIsNotUtf8() throws Exception {
        // Arrange
        Files.writeString(tempDir.resolve("Account.java"), Fixtures.load("Account.java"));
        Files.write(tempDir.resolve("Latin1.java"), new byte[]{'c', 'l', 'a', 's', 's', ' ', (byte) 0xFF, ' ', '{', '}'});

        // Act
        assertDoesNotThrow(() -> runner.run(tempDir.toString()));

        // Assert
        assertEquals(MigrationCliRunner.EXIT_FAILED, runner.getExitCode());
        assertTrue(Files.exists(tempDir.resolve("Account.py")));
        assertFalse(Files.exists(tempDir.resolve("Latin1.py")));
    }

    @Test
    void run_ShouldMirrorLayoutUnderOutputAndWriteJson() throws Exception {
        // Arrange
        Path source = Files.createDirectories(tempDir.resolve("src"));
        Path nested = Files.createDirectories(source.resolve("bank"));
        Files.writeString(nested.resolve("Account.java"), Fixtures.load("Account.java"));
        Path output = tempDir.resolve("out");
        properties.getMigrate().setPath(source.toString());
        properties.getMigrate().setOutput(output.toString());
        properties.getMigrate().setWriteJson(true);

        // Act
        runner.run();

        // Assert
        assertEquals(0, runner.getExitCode());
        assertTrue(Files.exists(output.resolve("bank").resolve("Account.py")));
        assertTrue(Files.exists(output.resolve("bank").resolve("Account.j2py.json")));
        assertFalse(Files.exists(nested.resolve("Account.py")));
    }

    @Test
    void run_ShouldSetFailureExitCodeButKeepOtherFiles() throws Exception {
        // Arrange
        Files.writeString(tempDir.resolve("Account.java"), Fixtures.load("Account.java"));
        Files.writeString(tempDir.resolve("Broken.java"), Fixtures.load("Broken.java"));
        properties.getMigrate().setWriteJson(true);

        // Act
        runner.run(tempDir.toString());

        // Assert
        assertEquals(MigrationCliRunner.EXIT_FAILED, runner.getExitCode());
        assertTrue(Files.exists(tempDir.resolve("Account.py")));
        assertFalse(Files.exists(tempDir.resolve("Broken.py")));
        String json = Files.readString(tempDir.resolve("Broken.j2py.json"));
        assertTrue(json.contains("\"PARSE\""));
    }

    @Test
    void run_ShouldMigrateSingleFile() throws Exception {
        // Arrange
        Path file = tempDir.resolve("Shapes.java");
        Files.writeString(file, Fixtures.load("Shapes.java"));

        // Act
        runner.run("--spring.main.banner-mode=off", file.toString());

        // Assert
        assertEquals(0, runner.getExitCode());
        assertTrue(Files.exists(tempDir.resolve("Shapes.py")));
    }

    @Test
    void run_ShouldRejectMissingInput() throws Exception {
        runner.run(tempDir.resolve("missing").toString());

        assertEquals(MigrationCliRunner.EXIT_BAD_INPUT, runner.getExitCode());
    }

    @Test
    void run_ShouldDoNothingWithoutPath() throws Exception {
        runner.run();

        assertEquals(0, runner.getExitCode());
    }
}
