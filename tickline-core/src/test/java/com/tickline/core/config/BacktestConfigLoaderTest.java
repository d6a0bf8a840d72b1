package com.tickline.core.config;

import com.tickline.core.model.BacktestConfig;
import com.tickline.core.model.BacktestException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BacktestConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Partial file overlays the defaults")
    void loadsPartialResource() {
        BacktestConfig config = BacktestConfigLoader.loadResource("backtest-config.yaml");

        assertEquals(50000, config.initialCapital());
        assertEquals(0.01, config.commissionPerShare());
        assertEquals(10, config.slippageBps());
        assertFalse(config.fillOnNextBar());
        assertEquals(20, config.featureWindowBars());
        // untouched keys keep their defaults
        assertTrue(config.allowFractionalShares());
        assertEquals(1.0, config.maxPositionPct());
    }

    @Test
    @DisplayName("Invalid values surface as INVALID_CONFIG")
    void invalidValueIsConfigError() {
        BacktestException e = assertThrows(BacktestException.class,
            () -> BacktestConfigLoader.parse("initialCapital: -5"));
        assertEquals(BacktestException.ErrorCode.INVALID_CONFIG, e.getErrorCode());

        assertThrows(BacktestException.class, () -> BacktestConfigLoader.parse("- 1\n- 2"));
    }

    @Test
    @DisplayName("Empty document yields defaults, unknown keys are ignored")
    void emptyAndUnknownKeys() {
        assertEquals(BacktestConfig.defaults(), BacktestConfigLoader.parse(""));
        assertEquals(BacktestConfig.defaults(), BacktestConfigLoader.parse("somethingElse: 3"));
    }

    @Test
    @DisplayName("Saved config loads back equal")
    void saveAndLoad() {
        BacktestConfig config = BacktestConfig.frictionless(2500).withFeatureWindowBars(50);
        Path file = tempDir.resolve("nested/config.yaml");

        BacktestConfigLoader.save(config, file);

        assertEquals(config, BacktestConfigLoader.load(file));
        assertEquals(config, BacktestConfigLoader.loadOrDefault(file));
        assertEquals(BacktestConfig.defaults(), BacktestConfigLoader.loadOrDefault(tempDir.resolve("missing.yaml")));
        assertFalse(BacktestConfigLoader.toYaml(config).startsWith("---"));
    }
}
