package com.mimecast.courier.service;

/**
 * Base of the typed failures returned to callers of the mail service.
 *
 * <p>Every failure carries a {@link Kind} so an outer layer can map it without
 * inspecting the concrete class, for example an HTTP handler answering 500 for
 * configuration problems and 502 for upstream transport problems.
 *
 * @see MailConfigurationException
 * @see MailTransportException
 */
public abstract class MailException extends Exception {

    /**
     * Failure kinds.
     */
    public enum Kind {
        /**
         * Something required was missing or invalid before any network I/O happened.
         */
        CONFIGURATION,

        /**
         * Connect, TLS, authentication or protocol command failure.
         */
        TRANSPORT
    }

    /**
     * Constructs a new MailException instance.
     *
     * @param message Detail message.
     */
    protected MailException(String message) {
        super(message);
    }

    /**
     * Constructs a new MailException instance with cause.
     *
     * @param message Detail message.
     * @param cause   Underlying cause.
     */
    protected MailException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Gets failure kind.
     *
     * @return Kind.
     */
    public abstract Kind getKind();
}
