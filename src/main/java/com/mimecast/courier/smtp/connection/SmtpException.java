package com.mimecast.courier.smtp.connection;

import java.io.IOException;

/**
 * SMTP protocol exception.
 *
 * <p>Carries the server reply that caused it, if any.
 */
public class SmtpException extends IOException {

    /**
     * Offending reply, may be null.
     */
    private final transient SmtpReply reply;

    /**
     * Constructs a new SmtpException instance.
     *
     * @param message Detail message.
     */
    public SmtpException(String message) {
        this(message, (SmtpReply) null);
    }

    /**
     * Constructs a new SmtpException instance with reply.
     *
     * @param message Detail message.
     * @param reply   SmtpReply instance.
     */
    public SmtpException(String message, SmtpReply reply) {
        super(message);
        this.reply = reply;
    }

    /**
     * Constructs a new SmtpException instance with cause.
     *
     * @param message Detail message.
     * @param cause   Underlying cause.
     */
    public SmtpException(String message, Throwable cause) {
        super(message, cause);
        this.reply = null;
    }

    /**
     * Gets reply.
     *
     * @return SmtpReply or null.
     */
    public SmtpReply getReply() {
        return reply;
    }
}
