/**
 * Queue configuration.
 *
 * <p>The {@link com.mimecast.outpost.config.queue.QueueConfigLoader} reads the {@code queue} and {@code report}
 * <br>sections into a {@link com.mimecast.outpost.config.queue.StrategyCatalog}.
 *
 * <h2>Sections:</h2>
 * <ul>
 *     <li><b>queue.strategy</b> - If blocks selecting the schedule, route, connection and TLS strategy by name.</li>
 *     <li><b>queue.schedule</b> - Retry intervals, notify intervals, expiry and virtual queue.</li>
 *     <li><b>queue.route</b> - Local, MX or relay delivery.</li>
 *     <li><b>queue.connection</b> / <b>queue.tls</b> - Outbound connection and TLS requirements.</li>
 *     <li><b>queue.virtual</b> - Worker threads per virtual queue.</li>
 *     <li><b>queue.limiter</b> / <b>queue.quota</b> - Rate, concurrency and size limits.</li>
 *     <li><b>report.dsn</b> - DSN sender name, address and signatures.</li>
 * </ul>
 *
 * <p>Invalid entries are recorded as {@link com.mimecast.outpost.config.ConfigError} and skipped, never fatal.
 */
package com.mimecast.outpost.config.queue;
