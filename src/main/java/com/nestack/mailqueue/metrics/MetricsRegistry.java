package com.nestack.mailqueue.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.graphite.GraphiteMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Global access to metric registries for queue components and background jobs.
 */
public final class MetricsRegistry {
    private static volatile PrometheusMeterRegistry prometheusRegistry;
    private static volatile GraphiteMeterRegistry graphiteRegistry;

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
    }

    /**
     * Register the metric registries.
     *
     * @param prom     Prometheus registry.
     * @param graphite Graphite registry.
     */
    public static void register(PrometheusMeterRegistry prom, GraphiteMeterRegistry graphite) {
        prometheusRegistry = prom;
        graphiteRegistry = graphite;
    }

    /**
     * Get the Prometheus registry.
     *
     * @return Prometheus registry.
     */
    public static PrometheusMeterRegistry getPrometheusRegistry() {
        return prometheusRegistry;
    }

    /**
     * Get the Graphite registry.
     *
     * @return Graphite registry.
     */
    public static GraphiteMeterRegistry getGraphiteRegistry() {
        return graphiteRegistry;
    }

    /**
     * Get all registered registries.
     *
     * @return List of non-null registries, possibly empty.
     */
    static List<MeterRegistry> getRegistries() {
        List<MeterRegistry> registries = new ArrayList<>(2);
        if (prometheusRegistry != null) {
            registries.add(prometheusRegistry);
        }
        if (graphiteRegistry != null) {
            registries.add(graphiteRegistry);
        }
        return registries;
    }
}
