package com.vidnyan.j2py.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.j2py.application.service.GeneratorOptions;
import com.vidnyan.j2py.domain.mapped.MappingTable;
import com.vidnyan.j2py.domain.plan.ComplexityPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Spring configuration for j2py components.
 * Turns bound properties into the policy objects the services take.
 */
@Slf4j
@Configuration
public class J2pyConfiguration {

    /**
     * ObjectMapper for JSON export.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public MappingTable mappingTable(MigrationProperties properties) {
        MigrationProperties.Mapping mapping = properties.getMapping();
        MappingTable table = MappingTable.defaults().withOverrides(mapping.getTypes(), mapping.getImports());
        log.info("Type table: {} entries ({} overrides), import table: {} entries ({} overrides)",
                table.getTypes().size(), mapping.getTypes().size(),
                table.getImports().size(), mapping.getImports().size());
        return table;
    }

    @Bean
    public ComplexityPolicy complexityPolicy(MigrationProperties properties) {
        return properties.getComplexity().toPolicy();
    }

    @Bean
    public GeneratorOptions generatorOptions(MigrationProperties properties) {
        return properties.getGenerator().toOptions();
    }

    /**
     * Runs whole units. Bounded by {@code j2py.pipeline.workers}.
     */
    @Bean
    public ThreadPoolTaskExecutor migrationWorkerExecutor(MigrationProperties properties) {
        int workers = properties.getPipeline().getWorkers();
        log.info("Migration worker pool: {} threads", workers);
        return executor("j2py-worker-", workers);
    }

    /**
     * Runs the planner beside the generator. Separate from the worker pool so a unit never
     * waits on a thread its own pool is holding.
     */
    @Bean
    public ThreadPoolTaskExecutor migrationStageExecutor(MigrationProperties properties) {
        return executor("j2py-stage-", properties.getPipeline().getWorkers());
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
