package com.mimecast.courier.transport;

import java.util.Properties;

/**
 * Builds Jakarta Mail session properties for mailbox stores.
 *
 * <p>Sets host, port and timeouts for the given store protocol.
 * <br>For the SSL variants (imaps, pop3s) server identity checking is enabled against the default trust store.
 */
public final class MailSessionProperties {

    private MailSessionProperties() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Builds properties for a store protocol.
     *
     * @param protocol      Store protocol: imap, imaps, pop3 or pop3s.
     * @param host          Server host.
     * @param port          Server port.
     * @param timeoutMillis Connect and read timeout.
     * @return Properties instance.
     */
    public static Properties forStore(String protocol, String host, int port, int timeoutMillis) {
        Properties props = new Properties();
        String prefix = "mail." + protocol + ".";
        String timeout = String.valueOf(timeoutMillis);

        props.put("mail.store.protocol", protocol);
        props.put(prefix + "host", host);
        props.put(prefix + "port", String.valueOf(port));
        props.put(prefix + "connectiontimeout", timeout);
        props.put(prefix + "timeout", timeout);
        props.put(prefix + "writetimeout", timeout);

        if (protocol.endsWith("s")) {
            props.put(prefix + "ssl.enable", "true");
            props.put(prefix + "ssl.checkserveridentity", "true");
        }

        // Ensure not disabled by defaults.
        props.put(prefix + "auth.login.disable", "false");
        props.put(prefix + "auth.plain.disable", "false");

        return props;
    }
}
