package de.bsommerfeld.upvision.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to one TOML table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("engine")
    private EngineConfig engine = new EngineConfig();

    @JsonProperty("first-run")
    private FirstRunConfig firstRun = new FirstRunConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public EngineConfig getEngine() {
        return engine;
    }

    public void setEngine(EngineConfig engine) {
        this.engine = engine;
    }

    public FirstRunConfig getFirstRun() {
        return firstRun;
    }

    public void setFirstRun(FirstRunConfig firstRun) {
        this.firstRun = firstRun;
    }
}
