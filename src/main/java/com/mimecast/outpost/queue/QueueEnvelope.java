package com.mimecast.outpost.queue;

import com.mimecast.outpost.expr.Variable;
import com.mimecast.outpost.expr.VariableResolver;
import org.apache.commons.lang3.StringUtils;

import java.util.OptionalLong;

/**
 * Variable values of a message, optionally narrowed to one recipient and one remote host.
 */
public class QueueEnvelope implements VariableResolver {

    private final Message message;
    private final Recipient recipient;
    private final String mx;
    private final String remoteIp;
    private final String localIp;
    private final long now;

    private QueueEnvelope(Message message, Recipient recipient, String mx, String remoteIp, String localIp, long now) {
        this.message = message;
        this.recipient = recipient;
        this.mx = mx;
        this.remoteIp = remoteIp;
        this.localIp = localIp;
        this.now = now;
    }

    /**
     * Message scope, used at admission and for notification settings.
     * <p>Remote and local IP are the addresses the message was received on.
     *
     * @param message Message.
     * @param now     Current time.
     * @return QueueEnvelope.
     */
    public static QueueEnvelope of(Message message, long now) {
        return new QueueEnvelope(message, null, "", message.getReceivedFromIp(), message.getReceivedViaIp(), now);
    }

    /**
     * Recipient scope.
     *
     * @param message   Message.
     * @param recipient Recipient.
     * @param now       Current time.
     * @return QueueEnvelope.
     */
    public static QueueEnvelope of(Message message, Recipient recipient, long now) {
        return new QueueEnvelope(message, recipient, "", message.getReceivedFromIp(), message.getReceivedViaIp(), now);
    }

    /**
     * Remote host scope.
     *
     * @param message   Message.
     * @param recipient Recipient.
     * @param mx        MX host name.
     * @param remoteIp  Remote address.
     * @param localIp   Local source address.
     * @param now       Current time.
     * @return QueueEnvelope.
     */
    public static QueueEnvelope of(Message message, Recipient recipient, String mx, String remoteIp, String localIp, long now) {
        return new QueueEnvelope(message, recipient, StringUtils.defaultString(mx), StringUtils.defaultString(remoteIp), StringUtils.defaultString(localIp), now);
    }

    public Message getMessage() {
        return message;
    }

    public Recipient getRecipient() {
        return recipient;
    }

    @Override
    public Object resolve(Variable variable) {
        switch (variable) {
            case RCPT:
                return recipient != null ? recipient.getAddressLcase() : "";
            case RCPT_DOMAIN:
                return recipient != null ? recipient.getDomain() : "";
            case SENDER:
                return message.getReturnPathLcase();
            case SENDER_DOMAIN:
                return message.getReturnPathDomain();
            case HELO_DOMAIN:
                return message.getHeloDomain();
            case AUTHENTICATED_AS:
                return message.getAuthenticatedAs();
            case LISTENER:
                return message.getListener();
            case REMOTE_IP:
                return remoteIp;
            case LOCAL_IP:
                return localIp;
            case MX:
                return mx;
            case PRIORITY:
                return (long) message.getPriority();
            case SIZE:
                return message.getSize();
            case SOURCE:
                return message.getSource().getId();
            case QUEUE_NAME:
                return recipient != null ? recipient.getQueue().asString() : "";
            case RETRY_NUM:
                return recipient != null ? (long) recipient.getRetry().getAttempt() : 0L;
            case NOTIFY_NUM:
                return recipient != null ? (long) recipient.getNotify().getAttempt() : 0L;
            case LAST_ERROR:
                return lastError();
            case LAST_STATUS:
                return lastStatus();
            case EXPIRES_IN:
                return expiresIn();
            case ENV_ID:
                return message.getEnvId().orElse("");
            default:
                return "";
        }
    }

    private String lastError() {
        if (recipient == null) {
            return "none";
        }
        return recipient.getStatus().getError()
                .map(details -> details.getError().getType().getId())
                .orElse("none");
    }

    private long lastStatus() {
        if (recipient == null) {
            return 0;
        }
        Status<HostResponse, ErrorDetails> status = recipient.getStatus();
        if (status.getResponse().isPresent()) {
            return status.getResponse().get().getResponse().getCode();
        }
        return status.getError()
                .map(ErrorDetails::getError)
                .filter(error -> error.getResponse() != null)
                .map(error -> (long) error.getResponse().getCode())
                .orElse(0L);
    }

    // Seconds left for time based expiry, attempts left otherwise.
    private long expiresIn() {
        if (recipient == null) {
            return 0;
        }
        OptionalLong expiration = recipient.expirationTime(message.getCreated());
        if (expiration.isPresent()) {
            return Math.max(0, expiration.getAsLong() - now);
        }
        return Math.max(0, recipient.getExpiry().getValue() - recipient.getRetry().getAttempt());
    }
}
