package com.mimecast.outpost.queue.delivery;

import com.mimecast.outpost.queue.ErrorDetails;
import com.mimecast.outpost.queue.HostResponse;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.Status;

/**
 * Performs one delivery attempt for one recipient.
 *
 * <p>Implementations resolve the remote hosts, open the connection and run the SMTP or LMTP
 * transaction as the plan prescribes. Failures are returned as statuses, not thrown.
 */
@FunctionalInterface
public interface DeliveryTransport {

    /**
     * Delivers a message to a recipient.
     *
     * @param message   Message.
     * @param recipient Recipient.
     * @param plan      Resolved strategies.
     * @return Completed, temporary failure or permanent failure.
     */
    Status<HostResponse, ErrorDetails> deliver(Message message, Recipient recipient, DeliveryPlan plan);
}
