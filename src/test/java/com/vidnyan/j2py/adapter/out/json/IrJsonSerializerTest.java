package com.vidnyan.j2py.adapter.out.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.j2py.Fixtures;
import com.vidnyan.j2py.adapter.out.parser.JavaParserStructuralParser;
import com.vidnyan.j2py.application.port.in.MigrateSourceUseCase.MigrationResult;
import com.vidnyan.j2py.application.port.in.MigrateSourceUseCase.SourceUnit;
import com.vidnyan.j2py.application.service.*;
import com.vidnyan.j2py.domain.mapped.MappingTable;
import com.vidnyan.j2py.domain.plan.ComplexityPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class IrJsonSerializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final IrJsonSerializer serializer = new IrJsonSerializer(objectMapper);
    private final MigrationPipelineService pipeline = new MigrationPipelineService(
            new JavaParserStructuralParser(),
            new SemanticMapper(MappingTable.defaults()),
            new MigrationPlanner(ComplexityPolicy.defaults()),
            new PythonCodeGenerator(GeneratorOptions.defaults()),
            new MigrationValidator(new PythonOutlineReader()),
            Runnable::run,
            Runnable::run);

    @Test
    void resultTree_ShouldKeyClassesByName() {
        // Arrange
        MigrationResult result = pipeline.migrate(SourceUnit.of("Account.java", Fixtures.load("Account.java")));

        // Act
        JsonNode tree = serializer.resultTree(result);

        // Assert
        assertEquals("Account.java", tree.get("unit").asText());
        assertEquals("SUCCEEDED", tree.get("status").asText());
        assertFalse(tree.has("error"));

        JsonNode structural = tree.get("structural").get("classes").get("Account");
        assertEquals(5, structural.get("fields").size());
        assertEquals("minBalance", structural.get("fields").get(0).get("name").asText());
        assertEquals("opaque", structural.get("methods").get(0).get("body").asText());

        JsonNode mapped = tree.get("mapped").get("classes").get("Account");
        JsonNode constant = mapped.get("fields").get(0);
        assertEquals("MIN_BALANCE", constant.get("name").asText());
        assertEquals("float", constant.get("type").asText());
        assertEquals("CLASS_CONSTANT", constant.get("markers").get(0).asText());
        assertEquals("PRIVATE", constant.get("markers").get(1).asText());
        assertEquals("(String owner, double balance)", mapped.get("constructors").get(1).get("sourceSignature").asText());

        JsonNode plan = tree.get("plan");
        assertEquals(1, plan.get("summary").get("totalClasses").asInt());
        assertEquals("CLASS", plan.get("steps").get(0).get("component").asText());
        assertEquals(1, plan.get("steps").get(1).get("dependsOn").get(0).asInt());
        assertTrue(tree.get("report").get("passed").asBoolean());
        assertTrue(tree.get("issues").size() > 0);
    }

    @Test
    void resultTree_ShouldOmitStagesThatDidNotRun() {
        // Arrange
        MigrationResult result = pipeline.migrate(SourceUnit.of("Broken.java", Fixtures.load("Broken.java")));

        // Act
        JsonNode tree = serializer.resultTree(result);

        // Assert
        assertEquals("FAILED", tree.get("status").asText());
        assertEquals("PARSE", tree.get("error").get("stage").asText());
        assertTrue(tree.get("error").has("line"));
        assertFalse(tree.has("structural"));
        assertFalse(tree.has("mapped"));
        assertFalse(tree.has("plan"));
    }

    @Test
    void write_ShouldProduceReadableJsonFile(@TempDir Path tempDir) throws Exception {
        // Arrange
        MigrationResult result = pipeline.migrate(SourceUnit.of("Shapes.java", Fixtures.load("Shapes.java")));
        Path target = tempDir.resolve("Shapes.j2py.json");

        // Act
        serializer.write(result, target);

        // Assert
        JsonNode read = objectMapper.readTree(Files.readString(target));
        assertTrue(read.get("mapped").get("classes").has("ShapeRegistry"));
        assertEquals("MODERATE", read.get("plan").get("summary").get("difficulty").asText());
        assertEquals("INTERFACE", read.get("structural").get("classes").get("Shape").get("kind").asText());
    }
}
