package io.flowdetect.config;

import io.flowdetect.database.DatabaseMode;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Engine settings loaded from a YAML file.
 * Missing keys keep their default value.
 */
public class EngineConfig {

    public static final String DEFAULT_RESOURCE = "flow-detect.yaml";

    private final int subtemplateRadius;
    private final int maxSubtemplateRadius;
    private final int parallelism;
    private final DatabaseMode databaseMode;
    private final boolean loopSanityCheck;

    private EngineConfig(int subtemplateRadius,
                         int maxSubtemplateRadius,
                         int parallelism,
                         DatabaseMode databaseMode,
                         boolean loopSanityCheck) {
        this.subtemplateRadius = subtemplateRadius;
        this.maxSubtemplateRadius = maxSubtemplateRadius;
        this.parallelism = parallelism;
        this.databaseMode = databaseMode;
        this.loopSanityCheck = loopSanityCheck;
    }

    public static EngineConfig defaults() {
        return new EngineConfig(2, 4, 0, DatabaseMode.COMPUTE, true);
    }

    /**
     * Load the configuration bundled with the engine, falling back to {@link #defaults()}
     * when the resource is absent.
     */
    public static EngineConfig loadDefault() throws IOException {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            return load(in, "classpath:" + DEFAULT_RESOURCE);
        }
    }

    /**
     * Load configuration from a YAML file.
     */
    public static EngineConfig load(Path configPath) throws IOException {
        try (InputStream in = Files.newInputStream(configPath)) {
            return load(in, configPath.toString());
        }
    }

    @SuppressWarnings("unchecked")
    static EngineConfig load(InputStream in, String source) throws IOException {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(in);
        if (!(loaded instanceof Map)) {
            throw new IOException("Empty or invalid config file: " + source);
        }
        Map<String, Object> data = (Map<String, Object>) loaded;
        EngineConfig defaults = defaults();

        int radius = intValue(data, "subtemplateRadius", defaults.subtemplateRadius, source);
        if (radius < 0) {
            throw new IOException("'subtemplateRadius' must be non-negative in " + source + ", got " + radius);
        }
        int maxRadius = intValue(data, "maxSubtemplateRadius", Math.max(defaults.maxSubtemplateRadius, radius + 1), source);
        if (maxRadius <= radius) {
            throw new IOException("'maxSubtemplateRadius' (" + maxRadius + ") must be greater than "
                    + "'subtemplateRadius' (" + radius + ") in " + source);
        }
        int parallelism = intValue(data, "parallelism", defaults.parallelism, source);
        if (parallelism < 0) {
            throw new IOException("'parallelism' must be non-negative in " + source + ", got " + parallelism);
        }

        DatabaseMode mode = defaults.databaseMode;
        Object modeValue = data.get("databaseMode");
        if (modeValue != null) {
            try {
                mode = DatabaseMode.valueOf(modeValue.toString().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IOException("Unknown 'databaseMode' " + modeValue + " in " + source
                        + ", expected one of compute, strict, disabled", e);
            }
        }

        boolean loopSanityCheck = defaults.loopSanityCheck;
        Object check = data.get("loopSanityCheck");
        if (check != null) {
            if (!(check instanceof Boolean b)) {
                throw new IOException("'loopSanityCheck' must be a boolean in " + source + ", got " + check);
            }
            loopSanityCheck = b;
        }

        return new EngineConfig(radius, maxRadius, parallelism, mode, loopSanityCheck);
    }

    private static int intValue(Map<String, Object> data, String key, int defaultValue, String source)
            throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Integer i)) {
            throw new IOException("'" + key + "' must be an integer in " + source + ", got " + value);
        }
        return i;
    }

    public EngineConfig withSubtemplateRadius(int radius, int maxRadius) {
        if (radius < 0 || maxRadius <= radius) {
            throw new IllegalArgumentException("Invalid radius range [" + radius + ", " + maxRadius + "]");
        }
        return new EngineConfig(radius, maxRadius, parallelism, databaseMode, loopSanityCheck);
    }

    public EngineConfig withDatabaseMode(DatabaseMode mode) {
        return new EngineConfig(subtemplateRadius, maxSubtemplateRadius, parallelism, mode, loopSanityCheck);
    }

    public EngineConfig withLoopSanityCheck(boolean enabled) {
        return new EngineConfig(subtemplateRadius, maxSubtemplateRadius, parallelism, databaseMode, enabled);
    }

    public int getSubtemplateRadius() {
        return subtemplateRadius;
    }

    public int getMaxSubtemplateRadius() {
        return maxSubtemplateRadius;
    }

    public int getParallelism() {
        return parallelism;
    }

    public DatabaseMode getDatabaseMode() {
        return databaseMode;
    }

    public boolean isLoopSanityCheck() {
        return loopSanityCheck;
    }

    @Override
    public String toString() {
        return "EngineConfig{radius=" + subtemplateRadius + ", maxRadius=" + maxSubtemplateRadius
                + ", parallelism=" + parallelism + ", databaseMode=" + databaseMode
                + ", loopSanityCheck=" + loopSanityCheck + "}";
    }
}
