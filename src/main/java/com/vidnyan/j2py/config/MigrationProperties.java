package com.vidnyan.j2py.config;

import com.vidnyan.j2py.application.service.GeneratorOptions;
import com.vidnyan.j2py.domain.plan.ComplexityPolicy;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the migration engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "j2py")
public class MigrationProperties {

    private Mapping mapping = new Mapping();
    private Complexity complexity = new Complexity();
    private Generator generator = new Generator();
    private Pipeline pipeline = new Pipeline();
    private Migrate migrate = new Migrate();

    @PostConstruct
    public void init() {
        // 0 means one worker per available processor
        if (pipeline.getWorkers() <= 0) {
            pipeline.setWorkers(Runtime.getRuntime().availableProcessors());
        }
    }

    /**
     * Overrides layered on top of the built-in type and import tables.
     * Keys containing dots must be bracketed in YAML, e.g. {@code "[java.util.UUID]"}.
     */
    @Data
    public static class Mapping {
        private Map<String, String> types = new LinkedHashMap<>();
        private Map<String, String> imports = new LinkedHashMap<>();
    }

    @Data
    public static class Complexity {
        private int methodWeight = 1;
        private int fieldWeight = 1;
        private int constructorWeight = 2;
        private int inheritanceWeight = 2;
        private int genericWeight = 1;
        private int capabilityWeight = 1;
        private int lowMax = 3;
        private int mediumMax = 7;

        public ComplexityPolicy toPolicy() {
            return ComplexityPolicy.builder()
                    .methodWeight(methodWeight)
                    .fieldWeight(fieldWeight)
                    .constructorWeight(constructorWeight)
                    .inheritanceWeight(inheritanceWeight)
                    .genericWeight(genericWeight)
                    .capabilityWeight(capabilityWeight)
                    .lowMax(lowMax)
                    .mediumMax(mediumMax)
                    .build();
        }
    }

    @Data
    public static class Generator {
        private int indent = 4;
        private boolean includeSourceBodies = false;

        public GeneratorOptions toOptions() {
            return GeneratorOptions.builder()
                    .indent(indent)
                    .includeSourceBodies(includeSourceBodies)
                    .build();
        }
    }

    @Data
    public static class Pipeline {
        private int workers = 0;
    }

    @Data
    public static class Migrate {
        /**
         * A .java file or a directory to walk. Empty disables the command line run.
         */
        private String path = "";

        /**
         * Output directory. Empty writes each .py file next to its source.
         */
        private String output = "";

        private boolean writeJson = false;
    }
}
