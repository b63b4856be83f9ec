package com.mimecast.courier.service;

/**
 * Raised when a call cannot proceed because the configuration or the call arguments lack
 * something required, such as a fetch host or a sender address.
 *
 * <p>Always raised before a connection is opened.
 */
public class MailConfigurationException extends MailException {

    /**
     * Constructs a new MailConfigurationException instance.
     *
     * @param message Detail message.
     */
    public MailConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new MailConfigurationException instance with cause.
     *
     * @param message Detail message.
     * @param cause   Underlying cause.
     */
    public MailConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public Kind getKind() {
        return Kind.CONFIGURATION;
    }
}
