/**
 * Micrometer metrics for the email queue.
 *
 * <p>Registries are registered once at startup through {@link com.nestack.mailqueue.metrics.MetricsRegistry}.
 * <br>Queue components report through {@link com.nestack.mailqueue.metrics.EmailQueueMetrics}.
 */
package com.nestack.mailqueue.metrics;
