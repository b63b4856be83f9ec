package com.mimecast.courier.imap;

import com.mimecast.courier.config.MailConfig;
import com.mimecast.courier.service.MailService;
import com.mimecast.courier.service.MailTransportException;
import jakarta.mail.MessagingException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;

import static org.junit.jupiter.api.Assertions.*;

class JakartaImapSessionTest {

    private static int closedPort;

    @BeforeAll
    static void before() throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = socket.getLocalPort();
        }
    }

    @Test
    void loginConnectionRefused() throws MessagingException {
        try (JakartaImapSession session = new JakartaImapSession("127.0.0.1", closedPort, false, 2000)) {
            assertThrows(MessagingException.class, () -> session.login("tony@example.com", "stark"));
        }
    }

    @Test
    void nothingSelected() throws MessagingException {
        try (JakartaImapSession session = new JakartaImapSession("127.0.0.1", closedPort, false, 2000)) {
            assertFalse(session.searchUnseen().isOk());
            assertFalse(session.fetch(1).isOk());
            assertFalse(session.clearSeen(1).isOk());
        }
    }

    @Test
    void selectWithoutLogin() throws MessagingException {
        try (JakartaImapSession session = new JakartaImapSession("127.0.0.1", closedPort, false, 2000)) {
            assertThrows(MessagingException.class, () -> session.select("INBOX"));
        }
    }

    @Test
    void serviceReportsTransportError() {
        MailConfig config = MailConfig.builder()
                .imapHost("127.0.0.1")
                .imapPort(closedPort)
                .imapUseSsl(false)
                .smtpUser("tony@example.com")
                .smtpPassword("stark")
                .timeoutSeconds(2)
                .build();

        assertThrows(MailTransportException.class, () -> new MailService(config).fetchUnseenImap());
    }
}
