package com.jay.dcf.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jay.dcf.model.AssumptionSet;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads and exposes all configuration from valuation.yaml.
 * Values are read once at startup and cached. Edit valuation.yaml and restart to apply changes.
 */
@Slf4j
@Component
public class ValuationConfig {

    @Value("${valuation.config-file:valuation.yaml}")
    private String configFile = "valuation.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Defaults defaults = new Defaults();
    private Sensitivity sensitivity = new Sensitivity();
    private Map<String, AssumptionSet> scenarios = new LinkedHashMap<>();

    @PostConstruct
    public void load() {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            InputStream is = getClass().getClassLoader().getResourceAsStream(configFile);
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
                return;
            }
            ConfigRoot root;
            try (is) {
                root = mapper.readValue(is, ConfigRoot.class);
            }
            if (root.getDefaults() != null)    this.defaults    = root.getDefaults();
            if (root.getSensitivity() != null) this.sensitivity = root.getSensitivity();
            this.scenarios = root.getScenarios() != null ? root.getScenarios() : new LinkedHashMap<>();
            log.info("ValuationConfig loaded from '{}'. {} scenario(s): {}",
                configFile, scenarios.size(), scenarios.keySet());
        } catch (Exception e) {
            log.error("Failed to load {}, engine will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Defaults defaults()                    { return defaults; }
    public Sensitivity sensitivity()              { return sensitivity; }
    public Map<String, AssumptionSet> scenarios() { return scenarios; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Defaults defaults = new Defaults();
        private Sensitivity sensitivity = new Sensitivity();
        private LinkedHashMap<String, AssumptionSet> scenarios;
    }

    @Data public static class Defaults {
        private double discountRate = 0.10;
        private double terminalGrowthRate = 0.03;
        private int displayDecimals = 2;
    }

    @Data public static class AxisRange {
        private double start;
        private double end;
        private int steps;

        public AxisRange() {}

        public AxisRange(double start, double end, int steps) {
            this.start = start;
            this.end = end;
            this.steps = steps;
        }
    }

    @Data public static class Sensitivity {
        private AxisRange discountRateAxis = new AxisRange(0.10, 0.15, 6);
        private AxisRange terminalGrowthAxis = new AxisRange(0.03, 0.05, 6);
        private boolean parallel = false;
        private int parallelism = 4;
    }
}
