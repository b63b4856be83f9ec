package com.mimecast.courier.contact;

import com.mimecast.courier.config.MailConfig;
import com.mimecast.courier.mime.InboundMessage;
import com.mimecast.courier.mime.InboundMessageParser;
import com.mimecast.courier.service.MailConfigurationException;
import com.mimecast.courier.service.MailException;
import com.mimecast.courier.service.MailService;
import com.mimecast.courier.service.MailTransportException;
import com.mimecast.courier.transport.FakeTransportFactory;
import com.mimecast.courier.transport.RecordingSmtpSession;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ContactRelayTest {

    private final ContactSubmission submission = new ContactSubmission(
            "Peter Parker", "peter@example.com", null, "Internship", "Can I come by on Friday?");

    private static MailService service(MailConfig config, RecordingSmtpSession session) {
        return new MailService(config, new FakeTransportFactory().smtp(session), Runnable::run);
    }

    @Test
    void relay() throws Exception {
        RecordingSmtpSession session = new RecordingSmtpSession();
        MailConfig config = MailConfig.builder()
                .smtpHost("smtp.example.com")
                .defaultFrom("office@example.com")
                .build();

        new ContactRelay(service(config, session), null).relay(submission);

        assertTrue(session.getEvents().contains("send office@example.com [office@example.com]"));

        InboundMessage message = InboundMessageParser.parse(session.getMessage());
        assertEquals("Website contact: Internship", message.getSubject());
        assertEquals("Name: Peter Parker\nEmail: peter@example.com\nPhone: \n\nMessage:\nCan I come by on Friday?",
                message.getPlainText().replace("\r\n", "\n"));

        MimeMessage mime = new MimeMessage(Session.getInstance(new Properties()), new ByteArrayInputStream(session.getMessage()));
        assertEquals("peter@example.com", mime.getReplyTo()[0].toString());
    }

    @Test
    void recipientOverride() throws MailException {
        RecordingSmtpSession session = new RecordingSmtpSession();
        MailConfig config = MailConfig.builder()
                .smtpHost("smtp.example.com")
                .smtpUser("tony@example.com")
                .smtpPassword("stark")
                .build();

        new ContactRelay(service(config, session), "contact@example.com").relay(submission);

        // No default from, so the recipient sends to itself.
        assertTrue(session.getEvents().contains("send contact@example.com [contact@example.com]"));
    }

    @Test
    void recipientFromSmtpUser() throws MailException {
        RecordingSmtpSession session = new RecordingSmtpSession();
        MailConfig config = MailConfig.builder()
                .smtpHost("smtp.example.com")
                .smtpUser("tony@example.com")
                .build();

        new ContactRelay(service(config, session), " ").relay(submission);

        assertTrue(session.getEvents().contains("send tony@example.com [tony@example.com]"));
    }

    @Test
    void recipientNotConfigured() {
        MailConfig config = MailConfig.builder().smtpHost("smtp.example.com").build();
        ContactRelay relay = new ContactRelay(service(config, new RecordingSmtpSession()), null);

        MailConfigurationException e = assertThrows(MailConfigurationException.class, () -> relay.relay(submission));
        assertEquals("Contact recipient not configured", e.getMessage());
    }

    @Test
    void transportErrorPropagates() {
        RecordingSmtpSession session = new RecordingSmtpSession().failOn("send", 451, "4.3.0 Try later");
        MailConfig config = MailConfig.builder().smtpHost("smtp.example.com").defaultFrom("office@example.com").build();
        ContactRelay relay = new ContactRelay(service(config, session), null);

        assertThrows(MailTransportException.class, () -> relay.relay(submission));
    }

    @Test
    void body() {
        ContactSubmission withPhone = new ContactSubmission("Pepper", "pepper@example.com", "555-0100", "Hi", "Hello");

        assertEquals("Name: Pepper\nEmail: pepper@example.com\nPhone: 555-0100\n\nMessage:\nHello", ContactRelay.body(withPhone));
    }
}
