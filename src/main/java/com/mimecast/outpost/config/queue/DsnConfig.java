package com.mimecast.outpost.config.queue;

import com.mimecast.outpost.expr.IfBlock;

import java.util.List;

/**
 * Delivery status notification settings.
 *
 * <p>All values are expressions evaluated against the original message.
 */
public final class DsnConfig {

    public static final String FROM_NAME_KEY = "report.dsn.from-name";
    public static final String FROM_ADDRESS_KEY = "report.dsn.from-address";
    public static final String SIGN_KEY = "report.dsn.sign";
    public static final String SUBMITTER_KEY = "report.submitter";

    /**
     * Built-in settings.
     */
    public static final DsnConfig DEFAULT = new DsnConfig(
            IfBlock.of(FROM_NAME_KEY, List.of(), "'Mail Delivery Subsystem'"),
            IfBlock.of(FROM_ADDRESS_KEY, List.of(), "'MAILER-DAEMON@' + config_get('report.domain')"),
            IfBlock.of(SIGN_KEY, List.of(),
                    "['rsa-' + config_get('report.domain'), 'ed25519-' + config_get('report.domain')]"),
            IfBlock.of(SUBMITTER_KEY, List.of(), "config_get('server.hostname')"));

    private final IfBlock fromName;
    private final IfBlock fromAddress;
    private final IfBlock sign;
    private final IfBlock submitter;

    /**
     * Constructs a new DsnConfig instance.
     *
     * @param fromName    Sender display name.
     * @param fromAddress Sender address.
     * @param sign        Signer names.
     * @param submitter   Reporting MTA host name.
     */
    public DsnConfig(IfBlock fromName, IfBlock fromAddress, IfBlock sign, IfBlock submitter) {
        this.fromName = fromName;
        this.fromAddress = fromAddress;
        this.sign = sign;
        this.submitter = submitter;
    }

    public IfBlock getFromName() {
        return fromName;
    }

    public IfBlock getFromAddress() {
        return fromAddress;
    }

    public IfBlock getSign() {
        return sign;
    }

    public IfBlock getSubmitter() {
        return submitter;
    }
}
