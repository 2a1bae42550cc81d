/**
 * Static containers.
 *
 * <h2>Config</h2>
 * <p>Static container for the queue configuration, strategy catalog and policy resolver.
 *
 * <h2>Factories</h2>
 * <p>For all pluggable components.
 * <ul>
 *     <li><b>QueueStore</b> - Messages, queue events and content blobs. <i>In memory by default.</i>
 *     <li><b>CounterStore</b> - Limiter windows and quota usage. <i>Redis when enabled.</i>
 *     <li><b>DeliveryTransport</b> - Performs delivery attempts. <i>No default provided.</i>
 * </ul>
 */
package com.mimecast.outpost.main;
