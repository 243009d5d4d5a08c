package com.jay.underwriter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.underwriter.model.enums.ColumnType;
import com.jay.underwriter.model.enums.InputField;
import com.jay.underwriter.model.enums.Metric;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Loads and exposes all configuration from config.yaml.
 * Values are read once at startup. Credentials and identifiers may use
 * ${VAR:default} placeholders, resolved against the Spring Environment.
 */
@Slf4j
@Component
public class UnderwriterConfig {

    @Value("${underwriter.config-file:config.yaml}")
    private String configFile;

    @Autowired
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "on");

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null || env == null) return value;
        return PLACEHOLDER_HELPER.replacePlaceholders(value, key -> env.getProperty(key));
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Monday monday = new Monday();
    private Sync sync = new Sync();
    private Irr irr = new Irr();
    private Fields fields = new Fields();
    private FieldMapping fieldMapping = new FieldMapping(Map.of(), Map.of());

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            try (is) {
                apply(mapper.readValue(is, ConfigRoot.class));
            }
            log.info("UnderwriterConfig loaded from '{}'. Board: {}, dry-run: {}, {} input / {} output columns mapped",
                configFile, monday.getBoardId(), sync.isDryRunEnabled(),
                fieldMapping.inputColumns().size(), fieldMapping.outputColumns().size());
        } catch (Exception e) {
            log.error("Failed to load {} — service will use defaults: {}", configFile, e.getMessage());
        }
    }

    /** Replaces every section with the given root and rebuilds the field mapping. */
    public void apply(ConfigRoot root) {
        this.monday = root.getMonday() != null ? root.getMonday() : new Monday();
        this.sync   = root.getSync() != null ? root.getSync() : new Sync();
        this.irr    = root.getIrr() != null ? root.getIrr() : new Irr();
        this.fields = root.getFields() != null ? root.getFields() : new Fields();

        // Resolve ${VAR:default} placeholders that Jackson reads as literal strings
        this.monday.setApiKey(resolve(this.monday.getApiKey()));
        this.monday.setBoardId(resolve(this.monday.getBoardId()));
        this.sync.setDryRun(resolve(this.sync.getDryRun()));

        this.fieldMapping = buildFieldMapping(this.fields);
    }

    private FieldMapping buildFieldMapping(Fields f) {
        Map<InputField, String> inputs = new EnumMap<>(InputField.class);
        if (f.getInputs() != null) {
            f.getInputs().forEach((key, columnId) -> {
                if (columnId == null || columnId.isBlank()) return;
                InputField.fromKey(key).ifPresentOrElse(
                    field -> inputs.put(field, columnId.trim()),
                    () -> log.warn("Unknown input field '{}' in config — ignored", key));
            });
        }

        Map<Metric, OutputColumn> outputs = new EnumMap<>(Metric.class);
        if (f.getOutputs() != null) {
            f.getOutputs().forEach((key, out) -> {
                if (out == null || out.getColumnId() == null || out.getColumnId().isBlank()) return;
                Metric.fromKey(key).ifPresentOrElse(
                    metric -> outputs.put(metric, new OutputColumn(out.getColumnId().trim(),
                        out.getType() != null ? out.getType() : ColumnType.WRAPPED_NUMBER)),
                    () -> log.warn("Unknown output metric '{}' in config — ignored", key));
            });
        }
        return new FieldMapping(inputs, outputs);
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Monday monday()             { return monday; }
    public Sync sync()                 { return sync; }
    public Irr irr()                   { return irr; }
    public FieldMapping fieldMapping() { return fieldMapping; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Monday monday = new Monday();
        private Sync sync = new Sync();
        private Irr irr = new Irr();
        private Fields fields = new Fields();
    }

    @Data public static class Monday {
        private String apiUrl = "https://api.monday.com/v2";
        private String apiVersion = "2024-01";
        private String apiKey = "";
        private String boardId = "";
        private int pageLimit = 500;
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 30;

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank() && boardId != null && !boardId.isBlank();
        }
    }

    @Data public static class Sync {
        private String dryRun = "false";
        private int maxAttempts = 5;
        private long baseDelayMs = 1000;
        private boolean runOnStartup = false;

        public boolean isDryRunEnabled() {
            return dryRun != null && TRUE_VALUES.contains(dryRun.trim().toLowerCase());
        }
    }

    @Data public static class Irr {
        private double initialGuess = 0.1;
        private double tolerance = 1e-7;
        private int maxIterations = 100;
        private double gridMin = -0.99;
        private double gridMax = 10.0;
        private int gridSteps = 1000;
    }

    @Data public static class Fields {
        private Map<String, String> inputs = new LinkedHashMap<>();
        private Map<String, Output> outputs = new LinkedHashMap<>();
    }

    @Data public static class Output {
        private String columnId;
        private ColumnType type = ColumnType.WRAPPED_NUMBER;
    }
}
