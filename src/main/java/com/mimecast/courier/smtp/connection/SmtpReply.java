package com.mimecast.courier.smtp.connection;

import java.util.List;

/**
 * SMTP server reply.
 *
 * <p>Multiline replies keep every line, the code is taken from the last one.
 */
public final class SmtpReply {
    private final int code;
    private final List<String> lines;

    /**
     * Constructs a new SmtpReply instance.
     *
     * @param code  Reply code.
     * @param lines Reply lines without code and separator.
     */
    public SmtpReply(int code, List<String> lines) {
        this.code = code;
        this.lines = List.copyOf(lines);
    }

    public int getCode() {
        return code;
    }

    public List<String> getLines() {
        return lines;
    }

    /**
     * Is positive completion (2xx).
     *
     * @return Boolean.
     */
    public boolean isPositive() {
        return code >= 200 && code < 300;
    }

    /**
     * Is code.
     *
     * @param expected Expected code.
     * @return Boolean.
     */
    public boolean is(int expected) {
        return code == expected;
    }

    @Override
    public String toString() {
        return code + " " + String.join(" ", lines);
    }
}
