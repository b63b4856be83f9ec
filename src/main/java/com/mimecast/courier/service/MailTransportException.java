package com.mimecast.courier.service;

/**
 * Raised when talking to a mail server fails.
 *
 * <p>Covers connect, TLS negotiation, authentication and protocol command failures.
 * <br>The last server reply, when there was one, is kept as the protocol detail.
 */
public class MailTransportException extends MailException {

    /**
     * Last server reply or protocol detail, may be null.
     */
    private final String detail;

    /**
     * Constructs a new MailTransportException instance.
     *
     * @param message Detail message.
     * @param detail  Protocol detail.
     */
    public MailTransportException(String message, String detail) {
        super(message);
        this.detail = detail;
    }

    /**
     * Constructs a new MailTransportException instance with cause.
     *
     * @param message Detail message.
     * @param detail  Protocol detail.
     * @param cause   Underlying cause.
     */
    public MailTransportException(String message, String detail, Throwable cause) {
        super(message, cause);
        this.detail = detail;
    }

    /**
     * Gets protocol detail.
     *
     * @return Detail string or null.
     */
    public String getDetail() {
        return detail;
    }

    @Override
    public Kind getKind() {
        return Kind.TRANSPORT;
    }

    @Override
    public String getMessage() {
        return detail == null || detail.isEmpty() ? super.getMessage() : super.getMessage() + ": " + detail;
    }
}
