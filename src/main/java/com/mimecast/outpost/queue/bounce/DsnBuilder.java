package com.mimecast.outpost.queue.bounce;

import com.mimecast.outpost.config.queue.DsnConfig;
import com.mimecast.outpost.metrics.QueueMetrics;
import com.mimecast.outpost.queue.DeliveryError;
import com.mimecast.outpost.queue.ErrorDetails;
import com.mimecast.outpost.queue.HostResponse;
import com.mimecast.outpost.queue.Message;
import com.mimecast.outpost.queue.QueueEnvelope;
import com.mimecast.outpost.queue.Recipient;
import com.mimecast.outpost.queue.RecipientFlags;
import com.mimecast.outpost.queue.SmtpResponse;
import com.mimecast.outpost.queue.Status;
import com.mimecast.outpost.queue.delivery.DeliveryStateMachine;
import com.mimecast.outpost.queue.delivery.StrategyResolver;
import com.mimecast.outpost.store.QueueStorageException;
import com.mimecast.outpost.store.QueueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.mail.internet.MimeUtility;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Builds multipart/report delivery status notifications.
 *
 * <p>Building marks reported recipients with {@link RecipientFlags#DSN_SENT} and advances every
 * due notification schedule, so the message must be saved afterwards.
 * <p>The report carries a human readable part, a message/delivery-status part and the
 * headers of the original message.
 */
public class DsnBuilder {
    private static final Logger log = LogManager.getLogger(DsnBuilder.class);

    static final int MAX_HEADER_SIZE = 4096;

    static final String DEFAULT_FROM_NAME = "Mail Delivery Subsystem";
    static final String DEFAULT_FROM_ADDRESS = "MAILER-DAEMON@localhost";
    static final String DEFAULT_REPORTING_MTA = "localhost";

    private static final String CRLF = "\r\n";

    private final StrategyResolver strategies;
    private final QueueStore store;

    /**
     * Constructs a new DsnBuilder instance.
     *
     * @param strategies Strategy resolver.
     * @param store      Queue store holding the original message content.
     */
    public DsnBuilder(StrategyResolver strategies, QueueStore store) {
        this.strategies = strategies;
        this.store = store;
    }

    /**
     * Builds the DSN for every recipient that owes one.
     *
     * @param message Message, flags and notify schedules are updated.
     * @param now     Current time.
     * @return Optional of the DSN bytes, empty if nothing needs reporting.
     */
    public Optional<byte[]> build(Message message, long now) {
        StringBuilder txtSuccess = new StringBuilder();
        StringBuilder txtDelay = new StringBuilder();
        StringBuilder txtFailed = new StringBuilder();
        StringBuilder dsn = new StringBuilder();

        for (Recipient rcpt : message.getRecipients()) {
            if (rcpt.hasFlag(RecipientFlags.DSN_SENT | RecipientFlags.NOTIFY_NEVER)) {
                continue;
            }
            Status<HostResponse, ErrorDetails> status = rcpt.getStatus();
            boolean delayDue = rcpt.getNotify().getDue() <= now && rcpt.hasFlag(RecipientFlags.NOTIFY_DELAY);

            if (status.isCompleted()) {
                rcpt.addFlags(RecipientFlags.DSN_SENT);
                if (!rcpt.hasFlag(RecipientFlags.NOTIFY_SUCCESS)) {
                    continue;
                }
                writeRecipient(rcpt, dsn);
                writeStatus(status, dsn);
                writeText(status.getResponse().orElseThrow(), rcpt.getAddress(), txtSuccess);
            } else if (status.isTemporary() && delayDue) {
                writeRecipient(rcpt, dsn);
                writeStatus(status, dsn);
                writeWillRetryUntil(rcpt, message.getCreated(), now, dsn);
                writeText(status.getError().orElseThrow(), rcpt.getAddress(), txtDelay);
            } else if (status.isPermanent()) {
                rcpt.addFlags(RecipientFlags.DSN_SENT);
                if (!rcpt.hasFlag(RecipientFlags.NOTIFY_FAILURE)) {
                    continue;
                }
                writeRecipient(rcpt, dsn);
                writeStatus(status, dsn);
                writeText(status.getError().orElseThrow(), rcpt.getAddress(), txtFailed);
            } else if (status.isScheduled() && delayDue) {
                writeRecipient(rcpt, dsn);
                writeStatus(status, dsn);
                writeWillRetryUntil(rcpt, message.getCreated(), now, dsn);
                writeText(new ErrorDetails("localhost", DeliveryError.concurrencyLimited()), rcpt.getAddress(), txtDelay);
            } else {
                continue;
            }

            dsn.append(CRLF);
        }

        if (txtSuccess.length() + txtDelay.length() + txtFailed.length() == 0) {
            return Optional.empty();
        }

        boolean hasSuccess = txtSuccess.length() > 0;
        boolean hasDelay = txtDelay.length() > 0;
        boolean hasFailure = txtFailed.length() > 0;

        if (hasDelay) {
            advanceNotify(message, now);
        }

        StringBuilder txt = new StringBuilder();
        String subject;
        boolean mixed = false;
        if (hasSuccess && !hasDelay && !hasFailure) {
            txt.append("Your message has been successfully delivered to the following recipients:\r\n\r\n");
            subject = "Successfully delivered message";
            QueueMetrics.incrementDsn("success");
        } else if (hasDelay && !hasSuccess && !hasFailure) {
            txt.append("There was a temporary problem delivering your message to the following recipients:\r\n\r\n");
            subject = "Warning: Delay in message delivery";
            QueueMetrics.incrementDsn("delay");
        } else if (hasFailure && !hasSuccess && !hasDelay) {
            txt.append("Your message could not be delivered to the following recipients:\r\n\r\n");
            subject = "Failed to deliver message";
            QueueMetrics.incrementDsn("failure");
        } else if (hasSuccess) {
            txt.append("Your message has been partially delivered:\r\n\r\n");
            subject = "Partially delivered message";
            mixed = true;
            QueueMetrics.incrementDsn("mixed");
        } else {
            txt.append("Your message could not be delivered to some recipients:\r\n\r\n");
            subject = "Warning: Temporary and permanent failures during message delivery";
            mixed = true;
            QueueMetrics.incrementDsn("mixed");
        }

        if (hasSuccess) {
            if (mixed) {
                txt.append("    ----- Delivery to the following addresses was successful -----\r\n");
            }
            txt.append(txtSuccess).append(CRLF);
        }
        if (hasDelay) {
            if (mixed) {
                txt.append("    ----- There was a temporary problem delivering to these addresses -----\r\n");
            }
            txt.append(txtDelay).append(CRLF);
        }
        if (hasFailure) {
            if (mixed) {
                txt.append("    ----- Delivery to the following addresses failed -----\r\n");
            }
            txt.append(txtFailed).append(CRLF);
        }

        QueueEnvelope envelope = QueueEnvelope.of(message, now);
        DsnConfig config = strategies.getCatalog().getDsn();
        String fromName = strategies.getResolver().resolve(config.getFromName(), envelope).orElse(DEFAULT_FROM_NAME);
        String fromAddress = strategies.getResolver().resolve(config.getFromAddress(), envelope)
                .filter(address -> !address.endsWith("@"))
                .orElse(DEFAULT_FROM_ADDRESS);
        String reportingMta = strategies.getResolver().resolve(config.getSubmitter(), envelope).orElse(DEFAULT_REPORTING_MTA);

        StringBuilder status = new StringBuilder();
        status.append("Reporting-MTA: dns;").append(reportingMta).append(CRLF);
        status.append("Arrival-Date: ").append(rfc822(message.getCreated())).append(CRLF);
        message.getEnvId().ifPresent(envId -> status.append("Original-Envelope-Id: ").append(envId).append(CRLF));
        status.append(CRLF).append(dsn);

        String headers = readHeaders(message);

        log.debug("Built DSN: uid={} subject=\"{}\" success={} delay={} failure={}",
                message.getQueueId(), subject, hasSuccess, hasDelay, hasFailure);
        return Optional.of(writeMessage(fromName, fromAddress, message.getReturnPath(), reportingMta, subject, now,
                txt.toString(), status.toString(), headers));
    }

    // Moves every due notification on to the next notify interval.
    private void advanceNotify(Message message, long now) {
        for (Recipient rcpt : message.getRecipients()) {
            if ((rcpt.getStatus().isTemporary() || rcpt.getStatus().isScheduled()) && rcpt.getNotify().getDue() <= now) {
                DeliveryStateMachine.advanceNotify(rcpt, strategies.schedule(message, rcpt, now).getNotify(), now);
            }
        }
    }

    /**
     * Reads the original message headers.
     * <p>Reads at most {@value #MAX_HEADER_SIZE} bytes and cuts at the end of the header block,
     * or at the last complete line when the block is longer.
     *
     * @param message Message.
     * @return String, empty if the content is unavailable.
     */
    String readHeaders(Message message) {
        Optional<byte[]> blob;
        try {
            blob = store.getBlob(message.getBlobHash(), 0, MAX_HEADER_SIZE);
        } catch (QueueStorageException e) {
            log.error("Failed to fetch message content: uid={} blob={} error={}", message.getQueueId(), message.getBlobHash(), e.getMessage(), e);
            return "";
        }
        if (blob.isEmpty()) {
            log.warn("Message content not found: uid={} blob={}", message.getQueueId(), message.getBlobHash());
            return "";
        }
        return new String(truncateHeaders(blob.get()), StandardCharsets.UTF_8);
    }

    /**
     * Cuts a content prefix down to its header block.
     *
     * @param buf Up to {@value #MAX_HEADER_SIZE} bytes of content.
     * @return Header bytes.
     */
    static byte[] truncateHeaders(byte[] buf) {
        int prev = 0;
        int lastLf = buf.length;
        for (int pos = 0; pos < buf.length; pos++) {
            byte ch = buf[pos];
            if (ch == '\n') {
                lastLf = pos + 1;
                if (prev != '\n') {
                    prev = ch;
                } else {
                    break;
                }
            } else if (ch == 0) {
                break;
            } else if (ch != '\r') {
                prev = ch;
            }
        }
        if (lastLf < MAX_HEADER_SIZE && lastLf < buf.length) {
            byte[] cut = new byte[lastLf];
            System.arraycopy(buf, 0, cut, 0, lastLf);
            return cut;
        }
        return buf;
    }

    private byte[] writeMessage(String fromName, String fromAddress, String to, String reportingMta, String subject,
                                long now, String txt, String status, String headers) {
        String boundary = "outpostReport" + UUID.randomUUID().toString().replace("-", "");
        StringBuilder sb = new StringBuilder();
        sb.append("From: ").append(displayName(fromName)).append(" <").append(fromAddress).append(">").append(CRLF);
        sb.append("To: ").append(to).append(CRLF);
        sb.append("Auto-Submitted: auto-generated").append(CRLF);
        sb.append("Message-ID: <").append(UUID.randomUUID()).append('@').append(reportingMta).append(">").append(CRLF);
        sb.append("Subject: ").append(encode(subject)).append(CRLF);
        sb.append("Date: ").append(rfc822(now)).append(CRLF);
        sb.append("MIME-Version: 1.0").append(CRLF);
        sb.append("Content-Type: multipart/report; report-type=\"delivery-status\";").append(CRLF)
                .append("\tboundary=\"").append(boundary).append("\"").append(CRLF);
        sb.append(CRLF);

        writePart(sb, boundary, "text/plain; charset=\"utf-8\"", txt);
        writePart(sb, boundary, "message/delivery-status; charset=\"utf-8\"", status);
        writePart(sb, boundary, "message/rfc822", headers);
        sb.append("--").append(boundary).append("--").append(CRLF);

        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static void writePart(StringBuilder sb, String boundary, String contentType, String body) {
        sb.append("--").append(boundary).append(CRLF);
        sb.append("Content-Type: ").append(contentType).append(CRLF);
        sb.append("Content-Transfer-Encoding: ").append(isAscii(body) ? "7bit" : "8bit").append(CRLF);
        sb.append(CRLF);
        sb.append(body);
        if (!body.endsWith(CRLF)) {
            sb.append(CRLF);
        }
    }

    private static boolean isAscii(String value) {
        return value.chars().allMatch(c -> c < 128);
    }

    private static String displayName(String name) {
        String encoded = encode(name);
        if (!encoded.equals(name)) {
            return encoded;
        }
        return "\"" + name.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String encode(String value) {
        try {
            return MimeUtility.encodeText(value, "UTF-8", null);
        } catch (UnsupportedEncodingException e) {
            log.warn("Unable to encode header value: {}", e.getMessage());
            return value;
        }
    }

    static String rfc822(long epochSeconds) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(Instant.ofEpochSecond(epochSeconds).atOffset(ZoneOffset.UTC));
    }

    private static void writeRecipient(Recipient rcpt, StringBuilder dsn) {
        rcpt.getOrcpt().ifPresent(orcpt -> dsn.append("Original-Recipient: rfc822;").append(orcpt).append(CRLF));
        dsn.append("Final-Recipient: rfc822;").append(rcpt.getAddress()).append(CRLF);
    }

    private static void writeWillRetryUntil(Recipient rcpt, long created, long now, StringBuilder dsn) {
        OptionalLong expires = rcpt.expirationTime(created);
        if (expires.isPresent() && expires.getAsLong() > now) {
            dsn.append("Will-Retry-Until: ").append(rfc822(expires.getAsLong())).append(CRLF);
        }
    }

    private static void writeStatus(Status<HostResponse, ErrorDetails> status, StringBuilder dsn) {
        dsn.append("Action: ");
        if (status.isCompleted()) {
            dsn.append("delivered");
        } else if (status.isPermanent()) {
            dsn.append("failed");
        } else {
            dsn.append("delayed");
        }
        dsn.append(CRLF);

        SmtpResponse response = status.getResponse().map(HostResponse::getResponse)
                .orElseGet(() -> status.getError().map(e -> e.getError().getResponse()).orElse(null));
        dsn.append("Status: ");
        if (response != null) {
            dsn.append(response.getStatusCode());
        } else {
            dsn.append(status.isPermanent() ? "5.0.0" : "4.0.0");
        }
        dsn.append(CRLF);

        if (!status.isCompleted() && response != null) {
            dsn.append("Diagnostic-Code: smtp;").append(response.getCode()).append(' ')
                    .append(response.getSingleLineMessage()).append(CRLF);
        }

        if (status.getResponse().isPresent()) {
            dsn.append("Remote-MTA: dns;").append(status.getResponse().get().getHostname()).append(CRLF);
        } else if (status.getError().isPresent()) {
            ErrorDetails details = status.getError().get();
            switch (details.getError().getType()) {
                case UNEXPECTED_RESPONSE:
                case CONNECTION_ERROR:
                case TLS_ERROR:
                case DANE_ERROR:
                    dsn.append("Remote-MTA: dns;").append(details.getEntity()).append(CRLF);
                    break;
                default:
                    break;
            }
        }
    }

    /**
     * Writes the human readable line of a delivered recipient.
     *
     * @param response Host response.
     * @param address  Recipient address.
     * @param txt      Output.
     */
    static void writeText(HostResponse response, String address, StringBuilder txt) {
        SmtpResponse reply = response.getResponse();
        int[] esc = reply.getEsc();
        txt.append('<').append(address).append("> (delivered to '").append(response.getHostname())
                .append("' with code ").append(reply.getCode())
                .append(" (").append(esc[0]).append('.').append(esc[1]).append('.').append(esc[2]).append(") '")
                .append(reply.getSingleLineMessage()).append("')").append(CRLF);
    }

    /**
     * Writes the human readable line of a failed or delayed recipient.
     *
     * @param details Error details.
     * @param address Recipient address.
     * @param txt     Output.
     */
    static void writeText(ErrorDetails details, String address, StringBuilder txt) {
        String entity = details.getEntity();
        DeliveryError error = details.getError();
        txt.append('<').append(address).append("> (");
        switch (error.getType()) {
            case UNEXPECTED_RESPONSE:
                SmtpResponse reply = error.getResponse();
                int[] esc = reply.getEsc();
                txt.append("host '").append(entity).append("' rejected ");
                if (!error.getCommand().isEmpty()) {
                    txt.append("command '").append(error.getCommand()).append('\'');
                } else {
                    txt.append("transaction");
                }
                txt.append(" with code ").append(reply.getCode())
                        .append(" (").append(esc[0]).append('.').append(esc[1]).append('.').append(esc[2]).append(") '")
                        .append(reply.getSingleLineMessage()).append('\'');
                break;
            case DNS_ERROR:
                txt.append("failed to lookup '").append(entity).append("': ").append(error.getDetails());
                break;
            case CONNECTION_ERROR:
                txt.append("connection to '").append(entity).append("' failed: ").append(error.getDetails());
                break;
            case TLS_ERROR:
                txt.append("TLS error from '").append(entity).append("': ").append(error.getDetails());
                break;
            case DANE_ERROR:
                txt.append("DANE failed to authenticate '").append(entity).append("': ").append(error.getDetails());
                break;
            case MTA_STS_ERROR:
                txt.append("MTA-STS failed to authenticate '").append(entity).append("': ").append(error.getDetails());
                break;
            case RATE_LIMITED:
                txt.append("rate limited");
                break;
            case CONCURRENCY_LIMITED:
                txt.append("too many concurrent connections to remote server");
                break;
            default:
                txt.append("queue error: ").append(error.getDetails());
                break;
        }
        txt.append(')').append(CRLF);
    }
}
