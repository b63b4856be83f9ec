package com.mimecast.courier.mime;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Properties;

/**
 * Builds the RFC 5322 form of an {@link OutboundMessage}.
 *
 * <p>A message with both bodies becomes multipart/alternative with the plain part first.
 * <br>A message with a single body becomes a single text part.
 * <br>Text and headers are UTF-8, encoded words are produced by Jakarta Mail where needed.
 * <br>Bcc never becomes a header.
 */
public final class MessageComposer {
    private static final String CHARSET = "UTF-8";

    /**
     * Detached session used only for building.
     */
    private static final Session SESSION = Session.getInstance(new Properties());

    private MessageComposer() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Composes a MIME message.
     *
     * @param message Outbound message with from address resolved.
     * @return MimeMessage instance.
     * @throws MessagingException Invalid address or unable to build.
     */
    public static MimeMessage compose(OutboundMessage message) throws MessagingException {
        String from = message.getFrom()
                .orElseThrow(() -> new AddressException("No from address"));

        MimeMessage mime = new MimeMessage(SESSION);
        mime.setFrom(new InternetAddress(from, true));
        mime.setRecipients(Message.RecipientType.TO, addresses(message.getTo()));
        if (!message.getCc().isEmpty()) {
            mime.setRecipients(Message.RecipientType.CC, addresses(message.getCc()));
        }
        if (message.getReplyTo().isPresent()) {
            mime.setReplyTo(new InternetAddress[]{new InternetAddress(message.getReplyTo().get(), true)});
        }
        mime.setSubject(message.getSubject(), CHARSET);
        mime.setSentDate(new Date());

        String plain = message.getPlainBody().orElse(null);
        String html = message.getHtmlBody().orElse(null);
        if (html != null && plain != null) {
            MimeBodyPart plainPart = new MimeBodyPart();
            plainPart.setText(plain, CHARSET, "plain");

            MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setText(html, CHARSET, "html");

            MimeMultipart alternative = new MimeMultipart("alternative");
            alternative.addBodyPart(plainPart);
            alternative.addBodyPart(htmlPart);
            mime.setContent(alternative);

        } else if (html != null) {
            mime.setText(html, CHARSET, "html");

        } else {
            mime.setText(plain != null ? plain : "", CHARSET, "plain");
        }

        // Sets Message-ID and MIME headers.
        mime.saveChanges();
        return mime;
    }

    /**
     * Composes and serializes a MIME message.
     *
     * @param message Outbound message with from address resolved.
     * @return Message bytes with CRLF line endings.
     * @throws MessagingException Invalid address or unable to build.
     */
    public static byte[] toBytes(OutboundMessage message) throws MessagingException {
        MimeMessage mime = compose(message);
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        try {
            mime.writeTo(stream);
        } catch (IOException e) {
            throw new MessagingException("Unable to serialize message", e);
        }
        return stream.toByteArray();
    }

    /**
     * Gets the bare addr-spec used in the SMTP envelope.
     * <p>Display names are dropped: "Tony Stark &lt;tony@example.com&gt;" gives "tony@example.com".
     *
     * @param address Address as given.
     * @return Address string.
     * @throws AddressException Invalid address.
     */
    public static String envelopeAddress(String address) throws AddressException {
        return new InternetAddress(address, true).getAddress();
    }

    private static InternetAddress[] addresses(List<String> list) throws AddressException {
        List<InternetAddress> addresses = new ArrayList<>();
        for (String address : list) {
            addresses.add(new InternetAddress(address, true));
        }
        return addresses.toArray(new InternetAddress[0]);
    }
}
