/**
 * Queue data model.
 *
 * <p>A {@link com.mimecast.outpost.queue.Message} carries its recipients, each with its own
 * <br>{@link com.mimecast.outpost.queue.Status}, retry and notify {@link com.mimecast.outpost.queue.Schedule} and expiry.
 * <br>Times are seconds since epoch.
 */
package com.mimecast.outpost.queue;
