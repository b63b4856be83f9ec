package com.mimecast.courier.config;

import org.apache.commons.lang3.StringUtils;

/**
 * Immutable mail client configuration.
 *
 * <p>Holds SMTP submission settings and the optional IMAP and POP3 mailbox settings.
 * <br>An absent IMAP or POP3 host disables the matching fetch operation.
 * <br>Blank strings given to the builder are stored as null.
 *
 * <p>Instances are safe to share between threads.
 *
 * @see MailConfigLoader
 */
public final class MailConfig {

    public static final int DEFAULT_SMTP_PORT = 587;
    public static final int DEFAULT_IMAP_PORT = 993;
    public static final int DEFAULT_POP3_PORT = 995;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    /**
     * Largest timeout whose milliseconds still fit a socket timeout.
     */
    public static final int MAX_TIMEOUT_SECONDS = Integer.MAX_VALUE / 1000;

    private final String smtpHost;
    private final int smtpPort;
    private final boolean smtpUseStartTls;
    private final String smtpUser;
    private final String smtpPassword;
    private final String defaultFrom;

    private final String imapHost;
    private final int imapPort;
    private final boolean imapUseSsl;

    private final String pop3Host;
    private final int pop3Port;
    private final boolean pop3UseSsl;

    /**
     * Socket connect and read timeout in seconds.
     */
    private final int timeoutSeconds;

    private MailConfig(Builder builder) {
        this.smtpHost = builder.smtpHost;
        this.smtpPort = builder.smtpPort;
        this.smtpUseStartTls = builder.smtpUseStartTls;
        this.smtpUser = builder.smtpUser;
        this.smtpPassword = builder.smtpPassword;
        this.defaultFrom = builder.defaultFrom;
        this.imapHost = builder.imapHost;
        this.imapPort = builder.imapPort;
        this.imapUseSsl = builder.imapUseSsl;
        this.pop3Host = builder.pop3Host;
        this.pop3Port = builder.pop3Port;
        this.pop3UseSsl = builder.pop3UseSsl;
        this.timeoutSeconds = builder.timeoutSeconds;
    }

    /**
     * Gets a new builder with defaults applied.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    public String getSmtpHost() {
        return smtpHost;
    }

    public int getSmtpPort() {
        return smtpPort;
    }

    /**
     * Is STARTTLS upgrade used.
     * <p>When false the SMTP connection uses implicit TLS from the first byte.
     *
     * @return Boolean.
     */
    public boolean isSmtpUseStartTls() {
        return smtpUseStartTls;
    }

    public String getSmtpUser() {
        return smtpUser;
    }

    public String getSmtpPassword() {
        return smtpPassword;
    }

    public String getDefaultFrom() {
        return defaultFrom;
    }

    public String getImapHost() {
        return imapHost;
    }

    public int getImapPort() {
        return imapPort;
    }

    public boolean isImapUseSsl() {
        return imapUseSsl;
    }

    public String getPop3Host() {
        return pop3Host;
    }

    public int getPop3Port() {
        return pop3Port;
    }

    public boolean isPop3UseSsl() {
        return pop3UseSsl;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    /**
     * Gets timeout in milliseconds as used by sockets.
     *
     * @return Timeout in milliseconds.
     */
    public int getTimeoutMillis() {
        return timeoutSeconds * 1000;
    }

    /**
     * Has SMTP host.
     *
     * @return Boolean.
     */
    public boolean hasSmtp() {
        return smtpHost != null;
    }

    /**
     * Has IMAP host.
     *
     * @return Boolean.
     */
    public boolean hasImap() {
        return imapHost != null;
    }

    /**
     * Has POP3 host.
     *
     * @return Boolean.
     */
    public boolean hasPop3() {
        return pop3Host != null;
    }

    /**
     * Has both SMTP user and password.
     * <p>The same credentials are used for the IMAP and POP3 mailboxes.
     *
     * @return Boolean.
     */
    public boolean hasCredentials() {
        return smtpUser != null && smtpPassword != null;
    }

    @Override
    public String toString() {
        return "MailConfig{" +
                "smtp=" + smtpHost + ":" + smtpPort +
                ", startTls=" + smtpUseStartTls +
                ", user=" + smtpUser +
                ", password=" + (smtpPassword == null ? "null" : "*****") +
                ", defaultFrom=" + defaultFrom +
                ", imap=" + imapHost + ":" + imapPort + (imapUseSsl ? "/ssl" : "") +
                ", pop3=" + pop3Host + ":" + pop3Port + (pop3UseSsl ? "/ssl" : "") +
                ", timeout=" + timeoutSeconds + "s" +
                '}';
    }

    /**
     * MailConfig builder.
     */
    public static final class Builder {
        private String smtpHost;
        private int smtpPort = DEFAULT_SMTP_PORT;
        private boolean smtpUseStartTls = true;
        private String smtpUser;
        private String smtpPassword;
        private String defaultFrom;
        private String imapHost;
        private int imapPort = DEFAULT_IMAP_PORT;
        private boolean imapUseSsl = true;
        private String pop3Host;
        private int pop3Port = DEFAULT_POP3_PORT;
        private boolean pop3UseSsl = true;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

        private Builder() {
        }

        public Builder smtpHost(String smtpHost) {
            this.smtpHost = StringUtils.trimToNull(smtpHost);
            return this;
        }

        public Builder smtpPort(int smtpPort) {
            this.smtpPort = port("smtpPort", smtpPort);
            return this;
        }

        public Builder smtpUseStartTls(boolean smtpUseStartTls) {
            this.smtpUseStartTls = smtpUseStartTls;
            return this;
        }

        public Builder smtpUser(String smtpUser) {
            this.smtpUser = StringUtils.trimToNull(smtpUser);
            return this;
        }

        // Passwords are not trimmed.
        public Builder smtpPassword(String smtpPassword) {
            this.smtpPassword = StringUtils.isEmpty(smtpPassword) ? null : smtpPassword;
            return this;
        }

        public Builder defaultFrom(String defaultFrom) {
            this.defaultFrom = StringUtils.trimToNull(defaultFrom);
            return this;
        }

        public Builder imapHost(String imapHost) {
            this.imapHost = StringUtils.trimToNull(imapHost);
            return this;
        }

        public Builder imapPort(int imapPort) {
            this.imapPort = port("imapPort", imapPort);
            return this;
        }

        public Builder imapUseSsl(boolean imapUseSsl) {
            this.imapUseSsl = imapUseSsl;
            return this;
        }

        public Builder pop3Host(String pop3Host) {
            this.pop3Host = StringUtils.trimToNull(pop3Host);
            return this;
        }

        public Builder pop3Port(int pop3Port) {
            this.pop3Port = port("pop3Port", pop3Port);
            return this;
        }

        public Builder pop3UseSsl(boolean pop3UseSsl) {
            this.pop3UseSsl = pop3UseSsl;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            if (timeoutSeconds <= 0) {
                throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
            }
            if (timeoutSeconds > MAX_TIMEOUT_SECONDS) {
                throw new IllegalArgumentException("timeoutSeconds too large: " + timeoutSeconds);
            }
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public MailConfig build() {
            return new MailConfig(this);
        }

        private static int port(String name, int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException(name + " out of range: " + port);
            }
            return port;
        }
    }
}
