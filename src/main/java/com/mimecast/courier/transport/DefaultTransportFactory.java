package com.mimecast.courier.transport;

import com.mimecast.courier.config.MailConfig;
import com.mimecast.courier.imap.ImapSession;
import com.mimecast.courier.imap.JakartaImapSession;
import com.mimecast.courier.pop3.JakartaPop3Session;
import com.mimecast.courier.pop3.Pop3Session;
import com.mimecast.courier.smtp.SmtpSession;
import com.mimecast.courier.smtp.connection.SmtpConnection;
import jakarta.mail.MessagingException;

import java.io.IOException;

/**
 * Network backed sessions.
 *
 * <p>SMTP goes over {@link SmtpConnection}, plaintext when STARTTLS is to be used, implicit TLS otherwise.
 * <br>IMAP and POP3 go over Jakarta Mail stores.
 */
public class DefaultTransportFactory implements TransportFactory {

    @Override
    public SmtpSession openSmtp(MailConfig config) throws IOException {
        return SmtpConnection.open(config.getSmtpHost(), config.getSmtpPort(),
                !config.isSmtpUseStartTls(), config.getTimeoutMillis());
    }

    @Override
    public ImapSession openImap(MailConfig config) throws MessagingException {
        return new JakartaImapSession(config.getImapHost(), config.getImapPort(),
                config.isImapUseSsl(), config.getTimeoutMillis());
    }

    @Override
    public Pop3Session openPop3(MailConfig config) throws MessagingException {
        return new JakartaPop3Session(config.getPop3Host(), config.getPop3Port(),
                config.isPop3UseSsl(), config.getTimeoutMillis());
    }
}
