package com.vidnyan.j2py.application.service;

import com.vidnyan.j2py.application.port.in.MigrateSourceUseCase;
import com.vidnyan.j2py.application.port.out.StructuralParser;
import com.vidnyan.j2py.domain.mapped.MappedIr;
import com.vidnyan.j2py.domain.mapped.MapperWarning;
import com.vidnyan.j2py.domain.model.SourceSyntaxException;
import com.vidnyan.j2py.domain.model.StructuralIr;
import com.vidnyan.j2py.domain.plan.CyclicDependencyException;
import com.vidnyan.j2py.domain.plan.MigrationPlan;
import com.vidnyan.j2py.domain.plan.PlanStep;
import com.vidnyan.j2py.domain.validation.Issue;
import com.vidnyan.j2py.domain.validation.ValidationReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main application service that runs source units through the migration pipeline.
 * Implements the primary use case.
 *
 * <p>Each unit is isolated: a fatal error in one unit yields a FAILED result for that unit
 * only. Planning runs on the stage executor while generation runs on the calling thread;
 * the two only read the mapped IR.
 */
@Slf4j
@Service
public class MigrationPipelineService implements MigrateSourceUseCase {

    private final StructuralParser structuralParser;
    private final SemanticMapper semanticMapper;
    private final MigrationPlanner migrationPlanner;
    private final PythonCodeGenerator codeGenerator;
    private final MigrationValidator validator;
    private final Executor workerExecutor;
    private final Executor stageExecutor;

    public MigrationPipelineService(StructuralParser structuralParser,
                                    SemanticMapper semanticMapper,
                                    MigrationPlanner migrationPlanner,
                                    PythonCodeGenerator codeGenerator,
                                    MigrationValidator validator,
                                    @Qualifier("migrationWorkerExecutor") Executor workerExecutor,
                                    @Qualifier("migrationStageExecutor") Executor stageExecutor) {
        this.structuralParser = structuralParser;
        this.semanticMapper = semanticMapper;
        this.migrationPlanner = migrationPlanner;
        this.codeGenerator = codeGenerator;
        this.validator = validator;
        this.workerExecutor = workerExecutor;
        this.stageExecutor = stageExecutor;
    }

    @Override
    public MigrationResult migrate(SourceUnit unit) {
        return run(unit, new AtomicBoolean(false));
    }

    @Override
    public MigrationHandle submit(SourceUnit unit) {
        AtomicBoolean cancelFlag = new AtomicBoolean(false);
        CompletableFuture<MigrationResult> result =
                CompletableFuture.supplyAsync(() -> run(unit, cancelFlag), workerExecutor);
        return new MigrationHandle(unit.name(), result, cancelFlag);
    }

    @Override
    public List<MigrationResult> migrateAll(List<SourceUnit> units) {
        log.info("Migrating {} units", units.size());
        List<MigrationHandle> handles = units.stream().map(this::submit).toList();
        List<MigrationResult> results = handles.stream().map(h -> h.result().join()).toList();

        long failed = results.stream().filter(r -> r.status() == Status.FAILED).count();
        log.info("Migration complete: {} succeeded, {} failed, {} cancelled",
                results.stream().filter(MigrationResult::isSucceeded).count(), failed,
                results.stream().filter(r -> r.status() == Status.CANCELLED).count());
        return results;
    }

    private MigrationResult run(SourceUnit unit, AtomicBoolean cancelFlag) {
        long start = System.nanoTime();
        List<Issue> issues = new ArrayList<>();
        Stage stage = Stage.PARSE;

        try {
            // Step 1: Parse
            if (cancelFlag.get()) {
                return cancelled(unit, start);
            }
            log.debug("[{}] parsing", unit.name());
            StructuralIr structural = structuralParser.parse(unit.sourceText());

            // Step 2: Map
            if (cancelFlag.get()) {
                return cancelled(unit, start);
            }
            stage = Stage.MAP;
            MappedIr mapped = semanticMapper.map(structural);
            for (MapperWarning warning : mapped.getWarnings()) {
                issues.add(Issue.warning(warning.getMessage(), warning.getLocation()));
            }

            // Step 3: Plan and generate
            if (cancelFlag.get()) {
                return cancelled(unit, start);
            }
            stage = Stage.PLAN;
            CompletableFuture<MigrationPlan> planned =
                    CompletableFuture.supplyAsync(() -> migrationPlanner.plan(mapped), stageExecutor);

            GeneratedSource generated = null;
            RuntimeException generateFailure = null;
            try {
                generated = codeGenerator.generate(mapped);
            } catch (RuntimeException e) {
                generateFailure = e;
            }
            MigrationPlan plan = await(planned);
            if (generateFailure != null) {
                stage = Stage.GENERATE;
                throw generateFailure;
            }
            for (PlanStep step : plan.getSteps()) {
                step.getWarnings().forEach(w -> issues.add(Issue.warning(w, step.getTargetClass())));
            }
            generated.getWarnings().forEach(w -> issues.add(Issue.warning(w, null)));

            // Step 4: Validate
            if (cancelFlag.get()) {
                return cancelled(unit, start);
            }
            stage = Stage.VALIDATE;
            ValidationReport report = validator.validate(generated.getText(), mapped);
            issues.addAll(report.getIssues());

            log.info("[{}] migrated {} classes: {} steps, validation {} ({} issues)",
                    unit.name(), mapped.getClasses().size(), plan.getSteps().size(),
                    report.isPassed() ? "passed" : "failed", issues.size());
            return new MigrationResult(unit.name(), Status.SUCCEEDED, structural, mapped, plan,
                    generated.getText(), report, List.copyOf(issues), null, elapsedMs(start));

        } catch (SourceSyntaxException e) {
            log.warn("[{}] syntax error at {}:{}", unit.name(), e.getLine(), e.getColumn());
            return MigrationResult.failed(unit.name(),
                    new PipelineError(Stage.PARSE, e.getMessage(), e.getLine(), e.getColumn()), issues, elapsedMs(start));
        } catch (CyclicDependencyException e) {
            log.warn("[{}] {}", unit.name(), e.getMessage());
            return MigrationResult.failed(unit.name(), PipelineError.at(Stage.PLAN, e.getMessage()), issues, elapsedMs(start));
        } catch (RuntimeException e) {
            log.error("[{}] unexpected failure in {} stage: {}", unit.name(), stage, e.getMessage(), e);
            return MigrationResult.failed(unit.name(), PipelineError.at(stage, String.valueOf(e.getMessage())),
                    issues, elapsedMs(start));
        }
    }

    private static MigrationPlan await(CompletableFuture<MigrationPlan> planned) {
        try {
            return planned.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static MigrationResult cancelled(SourceUnit unit, long start) {
        log.info("[{}] cancelled", unit.name());
        return MigrationResult.cancelled(unit.name(), elapsedMs(start));
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
