package com.rapid.analyzer.core;

import com.rapid.analyzer.scoring.PenaltyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Configuration for a RAPID analysis run.
 * Loaded from rapid-analyzer.yaml in the analyzed folder or uses the built-in defaults.
 */
public class AnalyzerConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerConfig.class);

    public static final String CONFIG_FILE_NAME = "rapid-analyzer.yaml";

    /**
     * How a CallByVar prefix is turned into call edges.
     */
    public enum DynamicDispatchMode {
        /** Every procedure whose name starts with the prefix, in every module. */
        ALL_VARIANTS,
        /** Only the first matching procedure name, in its first module. */
        FIRST_VARIANT
    }

    // Analysis switches
    private boolean excludeNoStepInModules = true;
    private DynamicDispatchMode dynamicDispatchMode = DynamicDispatchMode.ALL_VARIANTS;
    private Set<String> extensions = new LinkedHashSet<>(List.of(".mod", ".prg", ".sys", ".cfg"));

    // Exclusion patterns
    private Set<String> exclusions = new LinkedHashSet<>();

    // Penalty defaults
    private PenaltyRule complexityPenalty = PenaltyRule.capped(50, 1.0, 30);
    private PenaltyRule nestingPenalty = PenaltyRule.capped(8, 5.0, 30);
    private PenaltyRule callDepthPenalty = PenaltyRule.capped(3, 15.0, 50);
    private PenaltyRule procedureCountPenalty = PenaltyRule.capped(20, 1.0, 20);
    private PenaltyRule procedureSizePenalty = PenaltyRule.uncapped(0.60, 50.0);
    private int procedureSizeMinTotalLines = 300;
    private PenaltyRule fileSizePenalty = PenaltyRule.capped(600, 0.05, 20);
    private PenaltyRule unusedVariablePenalty = PenaltyRule.capped(0, 0.5, 20);
    private PenaltyRule badWordPenalty = PenaltyRule.capped(0, 0.5, 20);

    // Project aggregate
    private int worstFileCount = 3;
    private double worstFileMargin = 40.0;

    /**
     * Load configuration from the folder's YAML file or return defaults.
     */
    public static AnalyzerConfig load(Path projectRoot) {
        AnalyzerConfig config = new AnalyzerConfig();
        Path configFile = projectRoot.resolve(CONFIG_FILE_NAME);

        if (Files.exists(configFile)) {
            try {
                config.readYaml(configFile);
                log.info("Loaded configuration from: {}", configFile);
            } catch (IOException e) {
                log.warn("Could not read config file, using defaults: {}", e.getMessage());
            }
        }
        return config;
    }

    /**
     * Load configuration from an explicitly named file. Unlike {@link #load(Path)}
     * a missing, unreadable or malformed file is an error.
     */
    public static AnalyzerConfig loadFile(Path configFile) throws IOException {
        AnalyzerConfig config = new AnalyzerConfig();
        config.readYaml(configFile);
        log.info("Loaded configuration from: {}", configFile);
        return config;
    }

    /**
     * Default configuration.
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig();
    }

    /**
     * @throws IOException when the file cannot be read, is not valid YAML or its root is not a mapping
     */
    @SuppressWarnings("unchecked")
    private void readYaml(Path configFile) throws IOException {
        Object data;
        try (InputStream is = Files.newInputStream(configFile)) {
            data = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in " + configFile + ": " + e.getMessage(), e);
        }
        if (data == null) {
            return;
        }
        if (!(data instanceof Map)) {
            throw new IOException("Expected a mapping at the top of " + configFile
                    + " but found " + data.getClass().getSimpleName());
        }
        parseYaml((Map<String, Object>) data);
    }

    @SuppressWarnings("unchecked")
    private void parseYaml(Map<String, Object> data) {
        if (data.get("analysis") instanceof Map) {
            Map<String, Object> analysis = (Map<String, Object>) data.get("analysis");
            excludeNoStepInModules = getBool(analysis, "exclude_nostepin_modules", excludeNoStepInModules);

            Object mode = analysis.get("dynamic_calls");
            if (mode instanceof String) {
                dynamicDispatchMode = parseMode((String) mode, dynamicDispatchMode);
            }

            if (analysis.get("extensions") instanceof List) {
                List<Object> extList = (List<Object>) analysis.get("extensions");
                Set<String> parsed = new LinkedHashSet<>();
                for (Object ext : extList) {
                    parsed.add(normalizeExtension(String.valueOf(ext)));
                }
                if (!parsed.isEmpty()) {
                    extensions = parsed;
                }
            }
        }

        // Parse exclusions
        if (data.get("exclusions") instanceof List) {
            List<Object> excList = (List<Object>) data.get("exclusions");
            exclusions = new LinkedHashSet<>();
            for (Object exc : excList) {
                exclusions.add(String.valueOf(exc));
            }
        }

        // Parse penalties
        if (data.get("penalties") instanceof Map) {
            Map<String, Object> penalties = (Map<String, Object>) data.get("penalties");
            complexityPenalty = getRule(penalties, "complexity", complexityPenalty);
            nestingPenalty = getRule(penalties, "nesting", nestingPenalty);
            callDepthPenalty = getRule(penalties, "call_depth", callDepthPenalty);
            procedureCountPenalty = getRule(penalties, "procedure_count", procedureCountPenalty);
            procedureSizePenalty = getRule(penalties, "procedure_size", procedureSizePenalty);
            fileSizePenalty = getRule(penalties, "file_size", fileSizePenalty);
            unusedVariablePenalty = getRule(penalties, "unused_variables", unusedVariablePenalty);
            badWordPenalty = getRule(penalties, "bad_words", badWordPenalty);

            if (penalties.get("procedure_size") instanceof Map) {
                Map<String, Object> ps = (Map<String, Object>) penalties.get("procedure_size");
                procedureSizeMinTotalLines = getInt(ps, "min_total_lines", procedureSizeMinTotalLines);
            }
        }

        if (data.get("project") instanceof Map) {
            Map<String, Object> project = (Map<String, Object>) data.get("project");
            worstFileCount = Math.max(1, getInt(project, "worst_file_count", worstFileCount));
            worstFileMargin = getDouble(project, "worst_file_margin", worstFileMargin);
        }
    }

    @SuppressWarnings("unchecked")
    private PenaltyRule getRule(Map<String, Object> penalties, String key, PenaltyRule defaultRule) {
        if (!(penalties.get(key) instanceof Map)) {
            return defaultRule;
        }
        Map<String, Object> rule = (Map<String, Object>) penalties.get(key);
        return new PenaltyRule(
                getDouble(rule, "threshold", defaultRule.threshold()),
                getDouble(rule, "weight", defaultRule.weight()),
                getDouble(rule, "cap", defaultRule.cap()));
    }

    private static DynamicDispatchMode parseMode(String value, DynamicDispatchMode defaultMode) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "all_variants", "all" -> DynamicDispatchMode.ALL_VARIANTS;
            case "first_variant", "first" -> DynamicDispatchMode.FIRST_VARIANT;
            default -> {
                log.warn("Unknown dynamic_calls mode '{}', keeping {}", value, defaultMode);
                yield defaultMode;
            }
        };
    }

    private static String normalizeExtension(String ext) {
        String e = ext.trim().toLowerCase(Locale.ROOT);
        return e.startsWith(".") ? e : "." + e;
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).intValue();
        return defaultVal;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number)
            return ((Number) val).doubleValue();
        return defaultVal;
    }

    private boolean getBool(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val instanceof Boolean)
            return (Boolean) val;
        return defaultVal;
    }

    // === Getters ===

    public boolean isExcludeNoStepInModules() {
        return excludeNoStepInModules;
    }

    public DynamicDispatchMode getDynamicDispatchMode() {
        return dynamicDispatchMode;
    }

    public Set<String> getExtensions() {
        return Collections.unmodifiableSet(extensions);
    }

    public Set<String> getExclusions() {
        return Collections.unmodifiableSet(exclusions);
    }

    public PenaltyRule getComplexityPenalty() {
        return complexityPenalty;
    }

    public PenaltyRule getNestingPenalty() {
        return nestingPenalty;
    }

    public PenaltyRule getCallDepthPenalty() {
        return callDepthPenalty;
    }

    public PenaltyRule getProcedureCountPenalty() {
        return procedureCountPenalty;
    }

    public PenaltyRule getProcedureSizePenalty() {
        return procedureSizePenalty;
    }

    public int getProcedureSizeMinTotalLines() {
        return procedureSizeMinTotalLines;
    }

    public PenaltyRule getFileSizePenalty() {
        return fileSizePenalty;
    }

    public PenaltyRule getUnusedVariablePenalty() {
        return unusedVariablePenalty;
    }

    public PenaltyRule getBadWordPenalty() {
        return badWordPenalty;
    }

    public int getWorstFileCount() {
        return worstFileCount;
    }

    public double getWorstFileMargin() {
        return worstFileMargin;
    }

    /**
     * True when the file has one of the analyzed extensions.
     */
    public boolean isSourceFile(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }

    public boolean shouldExclude(Path path) {
        String pathStr = path.toString().replace('\\', '/');
        for (String pattern : exclusions) {
            if (matchesGlob(pathStr, pattern)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesGlob(String path, String glob) {
        // A leading or inner "**/" may also stand for no directory at all
        String regex = glob
                .replace(".", "\\.")
                .replace("**/", "<<<ANYDIRS>>>")
                .replace("**", "<<<DOUBLESTAR>>>")
                .replace("*", "[^/]*")
                .replace("<<<ANYDIRS>>>", "(?:.*/)?")
                .replace("<<<DOUBLESTAR>>>", ".*");
        return path.matches(".*" + regex + ".*");
    }

    // === Command-line overrides ===

    public AnalyzerConfig withExcludeNoStepInModules(boolean exclude) {
        this.excludeNoStepInModules = exclude;
        return this;
    }

    public AnalyzerConfig withDynamicDispatchMode(DynamicDispatchMode mode) {
        this.dynamicDispatchMode = Objects.requireNonNull(mode);
        return this;
    }
}
