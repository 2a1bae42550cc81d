/**
 * Delivery status notifications.
 *
 * <p>{@link com.mimecast.outpost.queue.bounce.DsnBuilder} composes RFC 3464 reports.
 * <br>{@link com.mimecast.outpost.queue.bounce.DsnSender} signs and queues them and writes the delivery log.
 */
package com.mimecast.outpost.queue.bounce;
