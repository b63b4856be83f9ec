package com.mimecast.courier.mime;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;

import java.io.ByteArrayInputStream;
import java.util.Properties;

/**
 * Parses raw fetched bytes into {@link InboundMessage} records.
 *
 * <p>The MIME structure is parsed by Jakarta Mail.
 * <br>Headers go through {@link HeaderDecoder}, bodies through {@link BodyExtractor}.
 */
public final class InboundMessageParser {

    /**
     * Detached session used only for parsing.
     */
    private static final Session SESSION = Session.getInstance(new Properties());

    private InboundMessageParser() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses a raw RFC 822 message.
     *
     * @param raw Raw message bytes.
     * @return InboundMessage instance.
     * @throws MessagingException Unable to parse.
     */
    public static InboundMessage parse(byte[] raw) throws MessagingException {
        MimeMessage message = new MimeMessage(SESSION, new ByteArrayInputStream(raw));

        return new InboundMessage(
                header(message, "Subject"),
                header(message, "From"),
                header(message, "To"),
                header(message, "Date"),
                BodyExtractor.extractBody(message),
                raw
        );
    }

    /**
     * Gets decoded header, multiple occurrences joined by comma.
     *
     * @param message MimeMessage instance.
     * @param name    Header name.
     * @return Decoded value or empty string.
     * @throws MessagingException Unable to read headers.
     */
    private static String header(MimeMessage message, String name) throws MessagingException {
        return HeaderDecoder.decodeHeaderValue(message.getHeader(name, ","));
    }
}
