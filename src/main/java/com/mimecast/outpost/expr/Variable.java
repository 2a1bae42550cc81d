package com.mimecast.outpost.expr;

import java.util.Optional;

/**
 * Variables available to policy expressions.
 */
public enum Variable {
    RCPT("rcpt"),
    RCPT_DOMAIN("rcpt_domain"),
    SENDER("sender"),
    SENDER_DOMAIN("sender_domain"),
    HELO_DOMAIN("helo_domain"),
    AUTHENTICATED_AS("authenticated_as"),
    LISTENER("listener"),
    REMOTE_IP("remote_ip"),
    LOCAL_IP("local_ip"),
    MX("mx"),
    PRIORITY("priority"),
    SIZE("size"),
    SOURCE("source"),
    QUEUE_NAME("queue_name"),
    RETRY_NUM("retry_num"),
    NOTIFY_NUM("notify_num"),
    LAST_ERROR("last_error"),
    LAST_STATUS("last_status"),
    EXPIRES_IN("expires_in"),
    ENV_ID("env_id");

    private final String name;

    Variable(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Looks up a variable by its expression name.
     *
     * @param name Name.
     * @return Optional of Variable.
     */
    public static Optional<Variable> byName(String name) {
        for (Variable variable : values()) {
            if (variable.name.equals(name)) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }
}
