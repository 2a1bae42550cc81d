package com.mimecast.outpost.expr;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.mimecast.outpost.expr.Variable.*;

/**
 * Evaluation contexts and the variables each one provides.
 */
public enum VariableContext {

    /**
     * Queue expressions evaluated per recipient: route and schedule selection.
     */
    RECIPIENT(EnumSet.of(RCPT, RCPT_DOMAIN, Variable.SENDER, SENDER_DOMAIN, PRIORITY, SIZE, SOURCE, QUEUE_NAME,
            RETRY_NUM, NOTIFY_NUM, LAST_ERROR, LAST_STATUS, EXPIRES_IN, ENV_ID)),

    /**
     * Expressions evaluated once per message: DSN sender name, address and signers.
     */
    SENDER(EnumSet.of(Variable.SENDER, SENDER_DOMAIN, PRIORITY, SIZE, SOURCE, ENV_ID)),

    /**
     * Expressions evaluated against a remote host: connection, TLS, outbound limiters and quotas.
     */
    HOST(EnumSet.of(RCPT, RCPT_DOMAIN, Variable.SENDER, SENDER_DOMAIN, PRIORITY, SIZE, SOURCE, QUEUE_NAME,
            RETRY_NUM, NOTIFY_NUM, LAST_ERROR, LAST_STATUS, EXPIRES_IN, ENV_ID, MX, REMOTE_IP, LOCAL_IP)),

    /**
     * Expressions evaluated at message admission: inbound limiters.
     */
    INBOUND(EnumSet.of(LISTENER, REMOTE_IP, LOCAL_IP, AUTHENTICATED_AS, HELO_DOMAIN, RCPT, RCPT_DOMAIN,
            Variable.SENDER, SENDER_DOMAIN, PRIORITY, SIZE));

    private final Set<Variable> variables;

    VariableContext(Set<Variable> variables) {
        this.variables = Collections.unmodifiableSet(variables);
    }

    public Set<Variable> getVariables() {
        return variables;
    }

    public boolean allows(Variable variable) {
        return variables.contains(variable);
    }
}
