/**
 * Outbound delivery queue with delivery status notifications.
 *
 * <p>The {@link com.mimecast.outpost.Main} runnable validates a queue configuration with {@code --check}
 * <br>or runs the queue housekeeper with {@code --run}.
 */
package com.mimecast.outpost;
