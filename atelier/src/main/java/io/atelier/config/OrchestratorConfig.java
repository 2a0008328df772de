package io.atelier.config;

import io.atelier.util.Env;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Process-level settings for the agent orchestrator.
 *
 * <p>Read from the environment (or system properties) by {@link #fromEnv()}:
 * <ul>
 *   <li>{@code ATELIER_PREFS_DIR} - directory of the file-backed preferences store</li>
 *   <li>{@code ATELIER_ANALYSIS_STEP_MS} - delay between analysis progress ticks</li>
 *   <li>{@code ATELIER_ANALYSIS_STEP_PERCENT} - progress added per tick</li>
 * </ul>
 */
public record OrchestratorConfig(
    Path preferencesDir,
    long analysisStepMs,
    int analysisStepPercent
) {
    public static final String DEFAULT_PREFS_DIR = "./config";
    public static final long DEFAULT_ANALYSIS_STEP_MS = 100;
    public static final int DEFAULT_ANALYSIS_STEP_PERCENT = 10;

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig(Path.of(DEFAULT_PREFS_DIR), DEFAULT_ANALYSIS_STEP_MS, DEFAULT_ANALYSIS_STEP_PERCENT);
    }

    /**
     * Load settings, falling back to defaults for anything missing or invalid.
     */
    public static OrchestratorConfig fromEnv() {
        OrchestratorConfig config = new OrchestratorConfig(
            Path.of(Env.get("ATELIER_PREFS_DIR", DEFAULT_PREFS_DIR)),
            Env.getLong("ATELIER_ANALYSIS_STEP_MS", DEFAULT_ANALYSIS_STEP_MS),
            Env.getInt("ATELIER_ANALYSIS_STEP_PERCENT", DEFAULT_ANALYSIS_STEP_PERCENT)
        );
        return config.isValid() ? config : defaults();
    }

    public Duration analysisStepDelay() {
        return Duration.ofMillis(analysisStepMs);
    }

    public boolean isValid() {
        return preferencesDir != null
            && analysisStepMs >= 0
            && analysisStepPercent > 0 && analysisStepPercent <= 100;
    }
}
