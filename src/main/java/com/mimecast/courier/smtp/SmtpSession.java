package com.mimecast.courier.smtp;

import com.mimecast.courier.transport.Outcome;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.util.List;

/**
 * One SMTP submission session.
 *
 * <p>A session is connected and has read the server banner when handed out.
 * <br>Callers drive the protocol steps in order and close the session in a try-with-resources block.
 * <br>Closing sends QUIT and aborts the connection if QUIT fails, it never throws.
 *
 * <p>Protocol failures are reported as {@link com.mimecast.courier.smtp.connection.SmtpException}.
 */
public interface SmtpSession extends AutoCloseable {

    /**
     * Sends the EHLO greeting, HELO if EHLO is refused.
     *
     * @throws IOException Unable to communicate or greeting refused.
     */
    void ehlo() throws IOException;

    /**
     * Upgrades the connection to TLS with STARTTLS.
     * <p>The caller must greet again afterwards.
     *
     * @param context SSLContext to wrap the socket with.
     * @throws IOException Unable to communicate, extension missing or handshake failure.
     */
    void startTls(SSLContext context) throws IOException;

    /**
     * Authenticates.
     *
     * @param username Username.
     * @param password Password.
     * @throws IOException Unable to communicate or credentials refused.
     */
    void login(String username, String password) throws IOException;

    /**
     * Submits one message to all recipients.
     * <p>Any refused recipient fails the whole submission.
     *
     * @param from       Envelope sender.
     * @param recipients Envelope recipients.
     * @param message    Message bytes.
     * @throws IOException Unable to communicate or submission refused.
     */
    void send(String from, List<String> recipients, byte[] message) throws IOException;

    /**
     * Sends QUIT and closes the connection.
     *
     * @return Outcome instance.
     */
    Outcome quit();

    /**
     * Closes the connection without QUIT.
     */
    void abort();

    /**
     * Graceful close with forced fallback.
     */
    @Override
    default void close() {
        if (!quit().isOk()) {
            abort();
        }
    }
}
