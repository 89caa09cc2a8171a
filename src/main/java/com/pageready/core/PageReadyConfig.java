package com.pageready.core;

import java.time.Duration;

/**
 * Configuration for page readiness checking.
 *
 * Load from environment variables or construct programmatically.
 *
 * Recognised environment variables:
 *   PAGEREADY_DEFAULT_LOAD_VALIDATIONS - Seed the built-in "displayed" check on root pages (default: true)
 *   PAGEREADY_LOAD_TIMEOUT_SECONDS     - How long LoadWait polls before giving up (default: 10)
 *   PAGEREADY_LOAD_POLL_MILLIS         - Interval between LoadWait polls (default: 250)
 *
 * Blank, unparseable or out-of-range values fall back to the default.
 */
public class PageReadyConfig {

    public static final int DEFAULT_LOAD_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_LOAD_POLL_MILLIS = 250;

    private final boolean defaultLoadValidations;
    private final Duration loadTimeout;
    private final Duration pollInterval;

    private PageReadyConfig(Builder b) {
        this.defaultLoadValidations = b.defaultLoadValidations;
        this.loadTimeout            = b.loadTimeout;
        this.pollInterval           = b.pollInterval;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static PageReadyConfig fromEnvironment() {
        return builder()
            .defaultLoadValidations(boolEnvOrDefault("PAGEREADY_DEFAULT_LOAD_VALIDATIONS", true))
            .loadTimeout(Duration.ofSeconds(
                intOrDefault(System.getenv("PAGEREADY_LOAD_TIMEOUT_SECONDS"), 0, DEFAULT_LOAD_TIMEOUT_SECONDS)))
            .pollInterval(Duration.ofMillis(
                intOrDefault(System.getenv("PAGEREADY_LOAD_POLL_MILLIS"), 1, DEFAULT_LOAD_POLL_MILLIS)))
            .build();
    }

    /** All defaults, ignoring the environment. */
    public static PageReadyConfig defaults() {
        return builder().build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public boolean isDefaultLoadValidations() { return defaultLoadValidations; }
    public Duration getLoadTimeout()          { return loadTimeout; }
    public Duration getPollInterval()         { return pollInterval; }

    @Override
    public String toString() {
        return String.format("PageReadyConfig{defaultLoadValidations=%s, loadTimeout=%s, pollInterval=%s}",
            defaultLoadValidations, loadTimeout, pollInterval);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private boolean defaultLoadValidations = true;
        private Duration loadTimeout = Duration.ofSeconds(DEFAULT_LOAD_TIMEOUT_SECONDS);
        private Duration pollInterval = Duration.ofMillis(DEFAULT_LOAD_POLL_MILLIS);

        public Builder defaultLoadValidations(boolean b) { this.defaultLoadValidations = b; return this; }
        public Builder loadTimeout(Duration d)            { this.loadTimeout = d; return this; }
        public Builder pollInterval(Duration d)           { this.pollInterval = d; return this; }

        public PageReadyConfig build() {
            if (loadTimeout == null || loadTimeout.isNegative()) {
                throw new IllegalArgumentException("loadTimeout must be zero or positive: " + loadTimeout);
            }
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
            }
            return new PageReadyConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    /** {@code raw} as an int, or {@code defaultValue} if it is missing, unparseable or below {@code min}. */
    static int intOrDefault(String raw, int min, int defaultValue) {
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed >= min ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }
}
