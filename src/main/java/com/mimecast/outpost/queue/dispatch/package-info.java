/**
 * Queue housekeeping and dispatch.
 *
 * <p>The {@link com.mimecast.outpost.queue.dispatch.QueueManager} admits messages and periodically hands due events
 * <br>to the {@link com.mimecast.outpost.queue.dispatch.VirtualQueueDispatcher}, which runs a
 * <br>{@link com.mimecast.outpost.queue.dispatch.QueueWorker} per message on the pool of its virtual queue.
 *
 * @see com.mimecast.outpost.queue.dispatch.QueueManager
 * @see com.mimecast.outpost.queue.dispatch.QueueWorker
 */
package com.mimecast.outpost.queue.dispatch;
