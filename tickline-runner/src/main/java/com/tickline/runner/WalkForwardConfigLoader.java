package com.tickline.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tickline.core.model.BacktestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link WalkForwardConfig} from YAML, filling absent keys from
 * {@link WalkForwardConfig#defaults()}.
 */
public final class WalkForwardConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(WalkForwardConfigLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private WalkForwardConfigLoader() {
    }

    public static WalkForwardConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            WalkForwardConfig config = overlay(YAML.readTree(in));
            log.debug("Loaded walk-forward config from {}", file);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read walk-forward config " + file, e);
        }
    }

    public static WalkForwardConfig parse(String yaml) {
        try {
            return overlay(YAML.readTree(yaml));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse walk-forward config", e);
        }
    }

    private static WalkForwardConfig overlay(JsonNode overrides) throws IOException {
        ObjectNode merged = YAML.valueToTree(WalkForwardConfig.defaults());
        if (overrides != null && overrides.isObject()) {
            merged.setAll((ObjectNode) overrides);
        } else if (overrides != null && !overrides.isNull() && !overrides.isMissingNode()) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_CONFIG,
                "Walk-forward config must be a YAML mapping, was " + overrides.getNodeType());
        }
        try {
            return YAML.treeToValue(merged, WalkForwardConfig.class);
        } catch (ValueInstantiationException e) {
            if (e.getCause() instanceof BacktestException be) {
                throw be;
            }
            throw e;
        }
    }
}
