package com.mimecast.outpost.queue;

import java.io.Serial;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * SMTP reply as reported by the delivery transport.
 *
 * <p>Holds the basic code, the enhanced status code (all zero when the server sent none) and the text.
 */
public final class SmtpResponse implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int code;
    private final int[] esc;
    private final String message;

    /**
     * Constructs a new SmtpResponse instance.
     *
     * @param code    Basic reply code.
     * @param esc     Enhanced status code, three numbers.
     * @param message Reply text.
     */
    public SmtpResponse(int code, int[] esc, String message) {
        this.code = code;
        this.esc = esc != null && esc.length == 3 ? esc.clone() : new int[]{0, 0, 0};
        this.message = message != null ? message : "";
    }

    /**
     * Parses a reply line such as {@code 550 5.1.1 Mailbox not found}.
     *
     * @param line Reply line.
     * @return SmtpResponse.
     */
    public static SmtpResponse parse(String line) {
        String rest = line != null ? line.trim() : "";
        int code = 0;
        if (rest.length() >= 3 && rest.substring(0, 3).chars().allMatch(Character::isDigit)) {
            code = Integer.parseInt(rest.substring(0, 3));
            rest = rest.substring(3).replaceFirst("^[ -]", "");
        }

        int[] esc = new int[]{0, 0, 0};
        int space = rest.indexOf(' ');
        String first = space > 0 ? rest.substring(0, space) : rest;
        if (first.matches("[245]\\.\\d{1,3}\\.\\d{1,3}")) {
            String[] parts = first.split("\\.");
            for (int i = 0; i < 3; i++) {
                esc[i] = Integer.parseInt(parts[i]);
            }
            rest = space > 0 ? rest.substring(space + 1) : "";
        }

        return new SmtpResponse(code, esc, rest);
    }

    public int getCode() {
        return code;
    }

    public int[] getEsc() {
        return esc.clone();
    }

    public String getMessage() {
        return message;
    }

    /**
     * Gets the enhanced status code, derived from the basic code when none was sent.
     *
     * @return String such as {@code 5.1.1}.
     */
    public String getStatusCode() {
        if (esc[0] > 0) {
            return esc[0] + "." + esc[1] + "." + esc[2];
        }
        return (code / 100) + "." + ((code / 10) % 10) + "." + (code % 10);
    }

    /**
     * Gets the reply text with line breaks removed.
     *
     * @return String.
     */
    public String getSingleLineMessage() {
        return message.replace("\r", "").replace("\n", "");
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof SmtpResponse)) {
            return false;
        }
        SmtpResponse other = (SmtpResponse) obj;
        return code == other.code && Arrays.equals(esc, other.esc) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, Arrays.hashCode(esc), message);
    }

    @Override
    public String toString() {
        return code + " " + (esc[0] > 0 ? getStatusCode() + " " : "") + message;
    }
}
