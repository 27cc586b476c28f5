package com.brokerbridge.metrics;

import com.typesafe.config.Config;

/**
 * Configuration for {@link BrokerMetrics}.
 * Parsed from the HOCON block {@code metrics { ... }}.
 */
public class MetricsConfig {

    private final boolean enabled;
    private final boolean includeJvm;

    private MetricsConfig(boolean enabled, boolean includeJvm) {
        this.enabled = enabled;
        this.includeJvm = includeJvm;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isIncludeJvm() {
        return includeJvm;
    }

    /**
     * Parse config from HOCON.
     * Expected format:
     * <pre>
     * metrics {
     *   enabled = true
     *   include-jvm = true
     * }
     * </pre>
     */
    public static MetricsConfig fromConfig(Config config) {
        boolean enabled = true;
        boolean includeJvm = true;

        if (config.hasPath("metrics")) {
            Config metricsConfig = config.getConfig("metrics");

            if (metricsConfig.hasPath("enabled")) {
                enabled = metricsConfig.getBoolean("enabled");
            }
            if (metricsConfig.hasPath("include-jvm")) {
                includeJvm = metricsConfig.getBoolean("include-jvm");
            }
        }

        return new MetricsConfig(enabled, includeJvm);
    }

    public static MetricsConfig defaults() {
        return new MetricsConfig(true, true);
    }

    @Override
    public String toString() {
        return "MetricsConfig{enabled=" + enabled + ", includeJvm=" + includeJvm + "}";
    }
}
