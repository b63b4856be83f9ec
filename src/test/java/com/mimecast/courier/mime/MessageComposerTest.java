package com.mimecast.courier.mime;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MessageComposerTest {

    private static OutboundMessage.Builder base() {
        return OutboundMessage.builder()
                .from("Tony Stark <tony@example.com>")
                .to("pepper@example.com")
                .subject("Status");
    }

    @Test
    void plainOnly() throws MessagingException, IOException {
        MimeMessage mime = MessageComposer.compose(base().plainBody("All systems nominal.").build());

        assertTrue(mime.isMimeType("text/plain"));
        assertEquals("All systems nominal.", mime.getContent());
        assertNotNull(mime.getSentDate());
        assertNotNull(mime.getMessageID());
    }

    @Test
    void htmlOnly() throws MessagingException {
        MimeMessage mime = MessageComposer.compose(base().htmlBody("<p>Nominal</p>").build());

        assertTrue(mime.isMimeType("text/html"));
    }

    @Test
    void alternative() throws MessagingException, IOException {
        MimeMessage mime = MessageComposer.compose(base().plainBody("plain").htmlBody("<p>html</p>").build());

        assertTrue(mime.isMimeType("multipart/alternative"));
        MimeMultipart multipart = (MimeMultipart) mime.getContent();
        assertEquals(2, multipart.getCount());
        assertTrue(multipart.getBodyPart(0).isMimeType("text/plain"));
        assertTrue(multipart.getBodyPart(1).isMimeType("text/html"));
    }

    @Test
    void emptyHtmlIsPlainOnly() throws MessagingException, IOException {
        OutboundMessage message = base().plainBody("plain").htmlBody("").build();
        MimeMessage mime = MessageComposer.compose(message);

        assertTrue(message.getHtmlBody().isEmpty());
        assertTrue(mime.isMimeType("text/plain"));
        assertEquals("plain", mime.getContent());
    }

    @Test
    void headers() throws MessagingException {
        MimeMessage mime = MessageComposer.compose(base()
                .plainBody("body")
                .cc("happy@example.com")
                .bcc("secret@example.com")
                .replyTo("rhodey@example.com")
                .build());

        assertEquals("tony@example.com", ((InternetAddress) mime.getFrom()[0]).getAddress());
        assertEquals(1, mime.getRecipients(Message.RecipientType.TO).length);
        assertEquals(1, mime.getRecipients(Message.RecipientType.CC).length);
        assertNull(mime.getRecipients(Message.RecipientType.BCC));
        assertNull(mime.getHeader("Bcc"));
        assertEquals("rhodey@example.com", mime.getReplyTo()[0].toString());
    }

    @Test
    void bccNeverSerialized() throws MessagingException {
        String raw = new String(MessageComposer.toBytes(base()
                .plainBody("body")
                .bcc("secret@example.com")
                .build()), StandardCharsets.UTF_8);

        assertFalse(raw.contains("secret@example.com"));
        assertFalse(raw.toLowerCase().contains("bcc:"));
        assertTrue(raw.contains("To: pepper@example.com"));
    }

    @Test
    void utf8Subject() throws MessagingException {
        MimeMessage mime = MessageComposer.compose(base().subject("Café ☕").plainBody("body").build());

        assertTrue(mime.getHeader("Subject")[0].startsWith("=?UTF-8?"));
        assertEquals("Café ☕", mime.getSubject());
    }

    @Test
    void noFrom() {
        OutboundMessage message = OutboundMessage.builder().to("pepper@example.com").plainBody("body").build();

        assertThrows(AddressException.class, () -> MessageComposer.compose(message));
    }

    @Test
    void invalidAddress() {
        assertThrows(AddressException.class, () -> MessageComposer.compose(base().to("<pepper@example.com").plainBody("x").build()));
    }

    @Test
    void envelopeAddress() throws AddressException {
        assertEquals("tony@example.com", MessageComposer.envelopeAddress("Tony Stark <tony@example.com>"));
        assertEquals("pepper@example.com", MessageComposer.envelopeAddress("pepper@example.com"));
    }
}
