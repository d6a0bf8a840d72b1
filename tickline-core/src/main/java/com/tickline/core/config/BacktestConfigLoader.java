package com.tickline.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.BacktestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link BacktestConfig} as YAML.
 *
 * Keys missing from a file keep their {@link BacktestConfig#defaults()} value,
 * so a file only needs the options it changes:
 * <pre>
 * initialCapital: 50000
 * slippageBps: 10
 * fillOnNextBar: false
 * </pre>
 */
public final class BacktestConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(BacktestConfigLoader.class);

    private static final ObjectMapper YAML;

    static {
        YAMLFactory factory = new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER);
        YAML = new ObjectMapper(factory);
    }

    private BacktestConfigLoader() {
    }

    /**
     * Load config from a YAML file.
     *
     * @throws BacktestException with INVALID_CONFIG when the file holds invalid values
     * @throws UncheckedIOException when the file cannot be read or parsed
     */
    public static BacktestConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            BacktestConfig config = load(in);
            log.debug("Loaded backtest config from {}", file);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read backtest config " + file, e);
        }
    }

    /**
     * Load config from a file if it exists, defaults otherwise.
     */
    public static BacktestConfig loadOrDefault(Path file) {
        if (Files.exists(file)) {
            return load(file);
        }
        log.info("No backtest config at {}, using defaults", file);
        return BacktestConfig.defaults();
    }

    /**
     * Load config from a classpath resource.
     */
    public static BacktestConfig loadResource(String resource) {
        InputStream in = BacktestConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new UncheckedIOException(new IOException("Config resource not found: " + resource));
        }
        try (in) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config resource " + resource, e);
        }
    }

    /**
     * Load config from a YAML stream. The stream is not closed.
     */
    public static BacktestConfig load(InputStream in) throws IOException {
        JsonNode overrides = YAML.readTree(in);
        return overlay(overrides);
    }

    /**
     * Parse config from a YAML string.
     */
    public static BacktestConfig parse(String yaml) {
        try {
            return overlay(YAML.readTree(yaml));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse backtest config", e);
        }
    }

    /**
     * Save config to a YAML file.
     */
    public static void save(BacktestConfig config, Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            YAML.writeValue(file.toFile(), config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save backtest config " + file, e);
        }
    }

    public static String toYaml(BacktestConfig config) {
        try {
            return YAML.writeValueAsString(config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize backtest config", e);
        }
    }

    private static BacktestConfig overlay(JsonNode overrides) throws IOException {
        ObjectNode merged = YAML.valueToTree(BacktestConfig.defaults());
        if (overrides != null && overrides.isObject()) {
            merged.setAll((ObjectNode) overrides);
        } else if (overrides != null && !overrides.isNull() && !overrides.isMissingNode()) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_CONFIG,
                "Backtest config must be a YAML mapping, was " + overrides.getNodeType());
        }
        try {
            return YAML.treeToValue(merged, BacktestConfig.class);
        } catch (ValueInstantiationException e) {
            // Validation failures surface wrapped by Jackson
            if (e.getCause() instanceof BacktestException be) {
                throw be;
            }
            throw e;
        }
    }
}
