/**
 * Rate limiters, concurrency limiters and quotas.
 *
 * <p>Counters live in a {@link com.mimecast.outpost.queue.limit.CounterStore}.
 * <br>The in memory store serves a single node, the Redis store is shared by a cluster.
 */
package com.mimecast.outpost.queue.limit;
