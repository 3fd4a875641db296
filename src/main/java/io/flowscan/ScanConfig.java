package io.flowscan;

import io.flowscan.analysis.LoopDetector;
import io.flowscan.model.RiskLevel;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Configuration loaded from a YAML file ({@code flow-scan.yaml} by default).
 * Every key is optional; missing keys keep their defaults.
 */
public class ScanConfig {

    public static final String DEFAULT_FILE_NAME = "flow-scan.yaml";

    private final int complexityThreshold;
    private final int maxFindings;
    private final boolean detectUnreachable;
    private final boolean detectInfiniteLoops;
    private final List<String> unboundedIterators;
    private final int minCycleSize;
    private final int parallelism;
    private final RiskLevel riskThreshold;
    private final List<String> excludeFunctions;

    private ScanConfig(Builder builder) {
        if (builder.complexityThreshold < 1) {
            throw new IllegalArgumentException("complexityThreshold must be positive");
        }
        if (builder.maxFindings < 1) {
            throw new IllegalArgumentException("maxFindings must be positive");
        }
        if (builder.minCycleSize < 2) {
            throw new IllegalArgumentException("minCycleSize must be at least 2");
        }
        if (builder.parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.complexityThreshold = builder.complexityThreshold;
        this.maxFindings = builder.maxFindings;
        this.detectUnreachable = builder.detectUnreachable;
        this.detectInfiniteLoops = builder.detectInfiniteLoops;
        this.unboundedIterators = List.copyOf(builder.unboundedIterators);
        this.minCycleSize = builder.minCycleSize;
        this.parallelism = builder.parallelism;
        this.riskThreshold = builder.riskThreshold;
        this.excludeFunctions = List.copyOf(builder.excludeFunctions);
    }

    public static ScanConfig defaults() {
        return builder().build();
    }

    /**
     * Load configuration from a YAML file.
     *
     * @throws IOException if the file cannot be read, is empty, or holds invalid values
     */
    @SuppressWarnings("unchecked")
    public static ScanConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Object loaded = yaml.load(in);
            if (!(loaded instanceof Map)) {
                throw new IOException("Empty or invalid config file: " + configPath);
            }
            Map<String, Object> data = (Map<String, Object>) loaded;

            Builder builder = builder();
            if (data.containsKey("complexityThreshold")) {
                builder.complexityThreshold(toInt(data, "complexityThreshold"));
            }
            if (data.containsKey("maxFindings")) {
                builder.maxFindings(toInt(data, "maxFindings"));
            }
            if (data.containsKey("detectUnreachable")) {
                builder.detectUnreachable(toBoolean(data, "detectUnreachable"));
            }
            if (data.containsKey("detectInfiniteLoops")) {
                builder.detectInfiniteLoops(toBoolean(data, "detectInfiniteLoops"));
            }
            if (data.containsKey("unboundedIterators")) {
                builder.unboundedIterators(toList(data, "unboundedIterators"));
            }
            if (data.containsKey("minCycleSize")) {
                builder.minCycleSize(toInt(data, "minCycleSize"));
            }
            if (data.containsKey("parallelism")) {
                builder.parallelism(toInt(data, "parallelism"));
            }
            if (data.containsKey("riskThreshold")) {
                builder.riskThreshold(toRiskLevel(data.get("riskThreshold")));
            }
            if (data.containsKey("excludeFunctions")) {
                builder.excludeFunctions(toList(data, "excludeFunctions"));
            }
            return builder.build();
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in config file " + configPath + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid config file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the given file, or defaults when it does not exist.
     */
    public static ScanConfig loadOrDefaults(Path configPath) throws IOException {
        if (configPath == null || !Files.exists(configPath)) {
            return defaults();
        }
        return load(configPath);
    }

    private static int toInt(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Integer i) {
            return i;
        }
        throw new IllegalArgumentException("'" + key + "' must be an integer, got " + value);
    }

    private static boolean toBoolean(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("'" + key + "' must be true or false, got " + value);
    }

    private static List<String> toList(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("'" + key + "' must be a list");
        }
        return list.stream()
            .filter(s -> s != null && !s.toString().trim().isEmpty())
            .map(s -> s.toString().trim())
            .toList();
    }

    static RiskLevel toRiskLevel(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("'riskThreshold' cannot be empty");
        }
        try {
            return RiskLevel.valueOf(value.toString().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown risk level: " + value, e);
        }
    }

    public int getComplexityThreshold() {
        return complexityThreshold;
    }

    public int getMaxFindings() {
        return maxFindings;
    }

    public boolean isDetectUnreachable() {
        return detectUnreachable;
    }

    public boolean isDetectInfiniteLoops() {
        return detectInfiniteLoops;
    }

    public List<String> getUnboundedIterators() {
        return unboundedIterators;
    }

    public int getMinCycleSize() {
        return minCycleSize;
    }

    public int getParallelism() {
        return parallelism;
    }

    public RiskLevel getRiskThreshold() {
        return riskThreshold;
    }

    public List<String> getExcludeFunctions() {
        return excludeFunctions;
    }

    /**
     * Check if a value matches a pattern.
     * Trailing dot means prefix match, otherwise exact match.
     */
    private static boolean matchesPattern(String value, String pattern) {
        if (pattern.endsWith(".")) {
            return value.startsWith(pattern);
        }
        return value.equals(pattern);
    }

    /**
     * Check if findings for a function are suppressed. Patterns match the qualified name;
     * {@code Legacy.} excludes every method of {@code Legacy}.
     */
    public boolean isFunctionExcluded(String qualifiedName) {
        if (qualifiedName == null) {
            return false;
        }
        for (String pattern : excludeFunctions) {
            if (matchesPattern(qualifiedName, pattern)) {
                return true;
            }
        }
        return false;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return builder()
                .complexityThreshold(complexityThreshold)
                .maxFindings(maxFindings)
                .detectUnreachable(detectUnreachable)
                .detectInfiniteLoops(detectInfiniteLoops)
                .unboundedIterators(unboundedIterators)
                .minCycleSize(minCycleSize)
                .parallelism(parallelism)
                .riskThreshold(riskThreshold)
                .excludeFunctions(excludeFunctions);
    }

    public static class Builder {
        private int complexityThreshold = 15;
        private int maxFindings = 100;
        private boolean detectUnreachable = true;
        private boolean detectInfiniteLoops = true;
        private List<String> unboundedIterators = LoopDetector.DEFAULT_UNBOUNDED_ITERATORS;
        private int minCycleSize = 2;
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        private RiskLevel riskThreshold = RiskLevel.INFO;
        private List<String> excludeFunctions = List.of();

        public Builder complexityThreshold(int complexityThreshold) {
            this.complexityThreshold = complexityThreshold;
            return this;
        }

        public Builder maxFindings(int maxFindings) {
            this.maxFindings = maxFindings;
            return this;
        }

        public Builder detectUnreachable(boolean detectUnreachable) {
            this.detectUnreachable = detectUnreachable;
            return this;
        }

        public Builder detectInfiniteLoops(boolean detectInfiniteLoops) {
            this.detectInfiniteLoops = detectInfiniteLoops;
            return this;
        }

        public Builder unboundedIterators(List<String> unboundedIterators) {
            this.unboundedIterators = unboundedIterators;
            return this;
        }

        public Builder minCycleSize(int minCycleSize) {
            this.minCycleSize = minCycleSize;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder riskThreshold(RiskLevel riskThreshold) {
            this.riskThreshold = riskThreshold;
            return this;
        }

        public Builder excludeFunctions(List<String> excludeFunctions) {
            this.excludeFunctions = excludeFunctions;
            return this;
        }

        public ScanConfig build() {
            return new ScanConfig(this);
        }
    }
}
