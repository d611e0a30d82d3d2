package com.vidnyan.j2py.adapter.in.cli;

import com.vidnyan.j2py.adapter.out.json.IrJsonSerializer;
import com.vidnyan.j2py.application.port.in.MigrateSourceUseCase;
import com.vidnyan.j2py.application.port.in.MigrateSourceUseCase.MigrationResult;
import com.vidnyan.j2py.application.port.in.MigrateSourceUseCase.SourceUnit;
import com.vidnyan.j2py.application.port.in.MigrateSourceUseCase.Status;
import com.vidnyan.j2py.config.MigrationProperties;
import com.vidnyan.j2py.domain.validation.Issue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

/**
 * Command Line Runner for migration.
 * Reads .java files from {@code j2py.migrate.path} (or the first non-option argument),
 * migrates them in parallel and writes one .py file per source.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILED = 1;
    static final int EXIT_BAD_INPUT = 2;

    private final MigrateSourceUseCase migrateSourceUseCase;
    private final IrJsonSerializer jsonSerializer;
    private final MigrationProperties properties;

    private int exitCode = 0;

    @Override
    public void run(String... args) throws IOException {
        String path = Arrays.stream(args)
                .filter(a -> !a.startsWith("--") && !a.isBlank())
                .findFirst()
                .orElse(properties.getMigrate().getPath());

        if (path == null || path.isBlank()) {
            log.info("No input path given. Set j2py.migrate.path or pass a .java file or directory.");
            return;
        }

        Path input = Path.of(path).toAbsolutePath().normalize();
        if (!Files.exists(input)) {
            log.error("Input path does not exist: {}", input);
            exitCode = EXIT_BAD_INPUT;
            return;
        }

        Path root = Files.isDirectory(input) ? input : input.getParent();
        List<Path> files = collectSources(input);
        log.info("j2py: migrating {} Java files from {}", files.size(), input);

        List<Path> readable = new ArrayList<>();
        List<SourceUnit> units = new ArrayList<>();
        int unreadable = 0;
        for (Path file : files) {
            try {
                units.add(SourceUnit.of(relativeName(root, file), Files.readString(file, StandardCharsets.UTF_8)));
                readable.add(file);
            } catch (IOException e) {
                log.error("  {}: cannot read source: {}", relativeName(root, file), e.toString());
                unreadable++;
            }
        }

        List<MigrationResult> results = migrateSourceUseCase.migrateAll(units);

        int failed = unreadable;
        for (int i = 0; i < results.size(); i++) {
            MigrationResult result = results.get(i);
            Path targetDir = targetDirectory(root, readable.get(i));
            writeOutputs(result, readable.get(i), targetDir);
            report(result);
            if (result.hasErrors()) {
                failed++;
            }
        }

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("  Files migrated:   {}", files.size() - failed);
        log.info("  Files with errors: {}", failed);
        if (unreadable > 0) {
            log.info("  Files unreadable:  {}", unreadable);
        }
        log.info("═══════════════════════════════════════════════════════════════");
        exitCode = failed > 0 ? EXIT_FAILED : 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private List<Path> collectSources(Path input) throws IOException {
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        try (Stream<Path> walk = Files.walk(input)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".java"))
                    .sorted()
                    .toList();
        }
    }

    private Path targetDirectory(Path root, Path source) throws IOException {
        String output = properties.getMigrate().getOutput();
        if (output == null || output.isBlank()) {
            return source.getParent();
        }
        Path relativeParent = root.relativize(source).getParent();
        Path dir = relativeParent == null ? Path.of(output) : Path.of(output).resolve(relativeParent);
        Files.createDirectories(dir);
        return dir;
    }

    private void writeOutputs(MigrationResult result, Path source, Path targetDir) throws IOException {
        String stem = source.getFileName().toString().replaceFirst("\\.java$", "");
        if (result.generated().isPresent()) {
            Path py = targetDir.resolve(stem + ".py");
            Files.writeString(py, result.generated().get(), StandardCharsets.UTF_8);
            log.debug("Wrote {}", py);
        }
        if (properties.getMigrate().isWriteJson()) {
            jsonSerializer.write(result, targetDir.resolve(stem + ".j2py.json"));
        }
    }

    private void report(MigrationResult result) {
        if (result.status() == Status.FAILED) {
            log.error("  {}: {}", result.unitName(), result.error().format());
            return;
        }
        if (result.status() == Status.CANCELLED) {
            log.warn("  {}: cancelled", result.unitName());
            return;
        }
        long errors = result.issues().stream().filter(Issue::isError).count();
        log.info("  {}: {} issues ({} errors)", result.unitName(), result.issues().size(), errors);
        result.issues().stream()
                .filter(Issue::isError)
                .forEach(issue -> log.warn("    - {}", issue.format()));
    }

    private static String relativeName(Path root, Path file) {
        return root.relativize(file).toString();
    }
}
