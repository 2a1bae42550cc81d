/**
 * Queue metrics.
 *
 * <p>The {@link com.mimecast.outpost.metrics.MetricsRegistry} holds the Micrometer registry
 * <br>that {@link com.mimecast.outpost.metrics.QueueMetrics} records into.
 */
package com.mimecast.outpost.metrics;
