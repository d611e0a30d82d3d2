package com.vidnyan.j2py.application.port.in;

import com.vidnyan.j2py.domain.mapped.MappedIr;
import com.vidnyan.j2py.domain.model.StructuralIr;
import com.vidnyan.j2py.domain.plan.MigrationPlan;
import com.vidnyan.j2py.domain.validation.Issue;
import com.vidnyan.j2py.domain.validation.ValidationReport;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Primary use case: migrate Java source units to Python declarations.
 * This is the main entry point to the application.
 */
public interface MigrateSourceUseCase {

    /**
     * Run one unit through parse, map, plan, generate and validate.
     * @param unit source unit
     * @return result; FAILED results carry a {@link PipelineError} and no generated text
     */
    MigrationResult migrate(SourceUnit unit);

    /**
     * Schedule one unit on the worker pool.
     */
    MigrationHandle submit(SourceUnit unit);

    /**
     * Migrate every unit independently. Results keep input order.
     */
    List<MigrationResult> migrateAll(List<SourceUnit> units);

    /**
     * One source text with a display name (usually the file name).
     */
    record SourceUnit(String name, String sourceText) {
        public static SourceUnit of(String name, String sourceText) {
            return new SourceUnit(name, sourceText);
        }
    }

    enum Status {
        SUCCEEDED,
        FAILED,
        CANCELLED
    }

    enum Stage {
        PARSE,
        MAP,
        PLAN,
        GENERATE,
        VALIDATE
    }

    /**
     * Fatal error of one unit. Line and column are null when the stage has no source position.
     */
    record PipelineError(Stage stage, String message, Integer line, Integer column) {
        public static PipelineError at(Stage stage, String message) {
            return new PipelineError(stage, message, null, null);
        }

        public String format() {
            return line == null
                    ? String.format("%s failed: %s", stage, message)
                    : String.format("%s failed at %d:%d: %s", stage, line, column, message);
        }
    }

    /**
     * Outcome of one unit.
     */
    record MigrationResult(
        String unitName,
        Status status,
        StructuralIr structuralIr,
        MappedIr mappedIr,
        MigrationPlan plan,
        String generatedText,
        ValidationReport report,
        List<Issue> issues,
        PipelineError error,
        long durationMs
    ) {
        public static MigrationResult failed(String unitName, PipelineError error, List<Issue> issues, long durationMs) {
            return new MigrationResult(unitName, Status.FAILED, null, null, null, null, null,
                    List.copyOf(issues), error, durationMs);
        }

        public static MigrationResult cancelled(String unitName, long durationMs) {
            return new MigrationResult(unitName, Status.CANCELLED, null, null, null, null, null,
                    List.of(), null, durationMs);
        }

        public boolean isSucceeded() {
            return status == Status.SUCCEEDED;
        }

        public Optional<String> generated() {
            return Optional.ofNullable(generatedText);
        }

        public Optional<PipelineError> failure() {
            return Optional.ofNullable(error);
        }

        /**
         * True when the unit failed or its validation report carries an error.
         */
        public boolean hasErrors() {
            return status == Status.FAILED || issues.stream().anyMatch(Issue::isError);
        }
    }

    /**
     * Handle on a scheduled unit. {@link #cancel()} is honoured between stages.
     */
    record MigrationHandle(String unitName, CompletableFuture<MigrationResult> result, AtomicBoolean cancelFlag) {
        public void cancel() {
            cancelFlag.set(true);
        }

        public boolean isCancelled() {
            return cancelFlag.get();
        }
    }
}
