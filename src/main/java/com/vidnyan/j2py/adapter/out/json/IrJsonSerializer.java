package com.vidnyan.j2py.adapter.out.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.j2py.application.port.in.MigrateSourceUseCase.MigrationResult;
import com.vidnyan.j2py.application.port.in.MigrateSourceUseCase.PipelineError;
import com.vidnyan.j2py.domain.mapped.*;
import com.vidnyan.j2py.domain.model.*;
import com.vidnyan.j2py.domain.plan.MigrationPlan;
import com.vidnyan.j2py.domain.plan.PlanStep;
import com.vidnyan.j2py.domain.plan.PlanSummary;
import com.vidnyan.j2py.domain.validation.Issue;
import com.vidnyan.j2py.domain.validation.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Renders IRs, plans and reports as JSON trees. Classes are keyed by name.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IrJsonSerializer {

    private final ObjectMapper objectMapper;

    public ObjectNode structuralTree(StructuralIr ir) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("package", ir.getPackageName());
        strings(root.putArray("imports"), ir.getImports());
        ObjectNode classes = root.putObject("classes");
        for (ClassDecl cls : ir.getClasses()) {
            ObjectNode node = classes.putObject(cls.getName());
            node.put("kind", cls.getKind().name());
            node.put("line", cls.getLine());
            node.put("superclass", cls.getSuperclass().orElse(null));
            strings(node.putArray("interfaces"), cls.getInterfaces());
            strings(node.putArray("typeParameters"), cls.getTypeParameters());
            modifiers(node.putArray("modifiers"), cls.getModifiers());

            ArrayNode fields = node.putArray("fields");
            for (FieldDecl field : cls.getFields()) {
                ObjectNode f = fields.addObject();
                f.put("name", field.getName());
                f.put("type", field.getType().render());
                modifiers(f.putArray("modifiers"), field.getModifiers());
                f.put("initializer", field.getInitializer().orElse(null));
            }

            ArrayNode ctors = node.putArray("constructors");
            for (ConstructorDecl ctor : cls.getConstructors()) {
                ObjectNode c = ctors.addObject();
                params(c.putArray("params"), ctor.getParams());
                modifiers(c.putArray("modifiers"), ctor.getModifiers());
                c.put("body", bodyKind(ctor.getBody()));
            }

            ArrayNode methods = node.putArray("methods");
            for (MethodDecl method : cls.getMethods()) {
                ObjectNode m = methods.addObject();
                m.put("name", method.getName());
                params(m.putArray("params"), method.getParams());
                m.put("returnType", method.getReturnType().render());
                modifiers(m.putArray("modifiers"), method.getModifiers());
                strings(m.putArray("typeParameters"), method.getTypeParameters());
                m.put("body", bodyKind(method.getBody()));
            }
        }
        return root;
    }

    public ObjectNode mappedTree(MappedIr ir) {
        ObjectNode root = objectMapper.createObjectNode();
        strings(root.putArray("imports"), ir.getImports());
        ArrayNode warnings = root.putArray("warnings");
        ir.getWarnings().forEach(w -> warnings.add(w.toString()));

        ObjectNode classes = root.putObject("classes");
        for (MappedClass cls : ir.getClasses()) {
            ObjectNode node = classes.putObject(cls.getName());
            node.put("kind", cls.getKind().name());
            node.put("superclass", cls.getSuperclass().orElse(null));
            strings(node.putArray("capabilities"), cls.getCapabilities());
            strings(node.putArray("typeParameters"), cls.getTypeParameters());
            markers(node.putArray("markers"), cls.getMarkers());

            ArrayNode fields = node.putArray("fields");
            for (MappedField field : cls.getFields()) {
                ObjectNode f = fields.addObject();
                f.put("name", field.getName());
                f.put("sourceName", field.getSourceName());
                f.put("type", field.getType().render());
                markers(f.putArray("markers"), field.getMarkers());
                f.put("initializer", field.getInitializer().orElse(null));
            }

            ArrayNode ctors = node.putArray("constructors");
            for (MappedConstructor ctor : cls.getConstructors()) {
                ObjectNode c = ctors.addObject();
                c.put("sourceSignature", ctor.sourceSignature());
                mappedParams(c.putArray("params"), ctor.getParams());
            }

            ArrayNode methods = node.putArray("methods");
            for (MappedMethod method : cls.getMethods()) {
                ObjectNode m = methods.addObject();
                m.put("name", method.getName());
                m.put("sourceName", method.getSourceName());
                mappedParams(m.putArray("params"), method.getParams());
                m.put("returnType", method.getReturnType().render());
                markers(m.putArray("markers"), method.getMarkers());
                m.put("body", bodyKind(method.getBody()));
            }
        }
        return root;
    }

    public ObjectNode planTree(MigrationPlan plan) {
        ObjectNode root = objectMapper.createObjectNode();
        PlanSummary summary = plan.getSummary();
        ObjectNode s = root.putObject("summary");
        s.put("totalClasses", summary.getTotalClasses());
        s.put("totalMethods", summary.getTotalMethods());
        s.put("totalFields", summary.getTotalFields());
        s.put("totalImports", summary.getTotalImports());
        s.put("inheritance", summary.isInheritanceUsed());
        s.put("interfaces", summary.isInterfacesUsed());
        s.put("generics", summary.isGenericsUsed());
        s.put("difficulty", summary.getDifficulty().name());
        strings(s.putArray("recommendations"), summary.getRecommendations());

        ArrayNode steps = root.putArray("steps");
        for (PlanStep step : plan.getSteps()) {
            ObjectNode node = steps.addObject();
            node.put("id", step.getId());
            node.put("targetClass", step.getTargetClass());
            node.put("component", step.getComponent().name());
            node.put("description", step.getDescription());
            node.put("complexity", step.getComplexity().name());
            node.put("score", step.getScore());
            ArrayNode deps = node.putArray("dependsOn");
            step.getDependsOn().stream().sorted().forEach(deps::add);
            strings(node.putArray("warnings"), step.getWarnings());
        }
        return root;
    }

    public ObjectNode reportTree(ValidationReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("passed", report.isPassed());
        issues(root.putArray("issues"), report.getIssues());
        return root;
    }

    /**
     * Whole result of one unit. Stages that did not run are omitted.
     */
    public ObjectNode resultTree(MigrationResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("unit", result.unitName());
        root.put("status", result.status().name());
        root.put("durationMs", result.durationMs());
        if (result.error() != null) {
            PipelineError error = result.error();
            ObjectNode e = root.putObject("error");
            e.put("stage", error.stage().name());
            e.put("message", error.message());
            if (error.line() != null) {
                e.put("line", error.line());
                e.put("column", error.column());
            }
        }
        if (result.structuralIr() != null) {
            root.set("structural", structuralTree(result.structuralIr()));
        }
        if (result.mappedIr() != null) {
            root.set("mapped", mappedTree(result.mappedIr()));
        }
        if (result.plan() != null) {
            root.set("plan", planTree(result.plan()));
        }
        if (result.report() != null) {
            root.set("report", reportTree(result.report()));
        }
        issues(root.putArray("issues"), result.issues());
        return root;
    }

    public String toJson(MigrationResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(resultTree(result));
    }

    public void write(MigrationResult result, Path target) throws IOException {
        Files.writeString(target, toJson(result));
        log.debug("Wrote {}", target);
    }

    private void issues(ArrayNode array, Collection<Issue> issues) {
        for (Issue issue : issues) {
            ObjectNode node = array.addObject();
            node.put("severity", issue.getSeverity().name());
            node.put("message", issue.getMessage());
            node.put("location", issue.getLocation().orElse(null));
        }
    }

    private static void params(ArrayNode array, Collection<ParamDecl> params) {
        for (ParamDecl param : params) {
            array.addObject().put("name", param.getName()).put("type", param.getType().render());
        }
    }

    private static void mappedParams(ArrayNode array, Collection<MappedParam> params) {
        for (MappedParam param : params) {
            array.addObject()
                    .put("name", param.getName())
                    .put("sourceName", param.getSourceName())
                    .put("type", param.getType().render());
        }
    }

    private static void strings(ArrayNode array, Collection<String> values) {
        values.forEach(array::add);
    }

    private static void modifiers(ArrayNode array, Collection<Modifier> modifiers) {
        modifiers.stream().sorted().forEach(m -> array.add(m.name()));
    }

    private static void markers(ArrayNode array, Collection<TargetMarker> markers) {
        markers.stream().sorted().forEach(m -> array.add(m.name()));
    }

    private static String bodyKind(MethodBody body) {
        return body.isPresent() ? "opaque" : "absent";
    }
}
