package com.brokerbridge.metrics;

import com.brokerbridge.engine.BrokerSession;
import com.brokerbridge.metrics.binder.BrokerSessionMetricsBinder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmInfoMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus registry for a process running one or more broker sessions.
 *
 * <p>Each bound session registers its own meters (tagged with the session name) and
 * joins the aggregate gauges of a {@link BrokerSessionMetricsBinder}. JVM binders are
 * registered on creation when enabled.</p>
 */
public class BrokerMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrokerMetrics.class);

    private final MetricsConfig config;
    private final PrometheusMeterRegistry registry;
    private final BrokerSessionMetricsBinder sessions = new BrokerSessionMetricsBinder();
    private JvmGcMetrics gcMetrics;

    public BrokerMetrics(MetricsConfig config) {
        this.config = config;
        if (!config.isEnabled()) {
            log.info("Metrics disabled");
            this.registry = null;
            return;
        }

        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        sessions.bindTo(registry);

        if (config.isIncludeJvm()) {
            gcMetrics = new JvmGcMetrics();
            new JvmMemoryMetrics().bindTo(registry);
            gcMetrics.bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new JvmInfoMetrics().bindTo(registry);
            new ClassLoaderMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
            new UptimeMetrics().bindTo(registry);
            log.info("JVM metrics binders registered");
        }
        log.info("Metrics registry initialized");
    }

    /**
     * Register a session's meters. A no-op when metrics are disabled.
     */
    public void bind(BrokerSession session) {
        if (registry == null) {
            return;
        }
        session.bindMetrics(registry);
        sessions.addSession(session);
    }

    public boolean isEnabled() {
        return registry != null;
    }

    /**
     * @return the registry, or null when metrics are disabled
     */
    public MeterRegistry getMeterRegistry() {
        return registry;
    }

    public MetricsConfig getConfig() {
        return config;
    }

    /**
     * Scrape all metrics in Prometheus text format.
     */
    public String scrape() {
        if (registry == null) {
            return "";
        }
        return registry.scrape();
    }

    @Override
    public void close() {
        if (registry == null) {
            return;
        }
        if (gcMetrics != null) {
            gcMetrics.close();
        }
        registry.close();
        log.info("Metrics registry closed");
    }
}
