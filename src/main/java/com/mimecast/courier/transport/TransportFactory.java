package com.mimecast.courier.transport;

import com.mimecast.courier.config.MailConfig;
import com.mimecast.courier.imap.ImapSession;
import com.mimecast.courier.pop3.Pop3Session;
import com.mimecast.courier.smtp.SmtpSession;
import jakarta.mail.MessagingException;

import java.io.IOException;

/**
 * Opens protocol sessions for a configuration.
 *
 * <p>Each call returns a new exclusive session the caller must close.
 */
public interface TransportFactory {

    /**
     * Opens an SMTP session, connected and past the banner.
     *
     * @param config MailConfig instance.
     * @return SmtpSession instance.
     * @throws IOException Unable to connect or banner refused.
     */
    SmtpSession openSmtp(MailConfig config) throws IOException;

    /**
     * Creates an IMAP session.
     *
     * @param config MailConfig instance.
     * @return ImapSession instance.
     * @throws MessagingException Unable to create session.
     */
    ImapSession openImap(MailConfig config) throws MessagingException;

    /**
     * Creates a POP3 session.
     *
     * @param config MailConfig instance.
     * @return Pop3Session instance.
     * @throws MessagingException Unable to create session.
     */
    Pop3Session openPop3(MailConfig config) throws MessagingException;
}
