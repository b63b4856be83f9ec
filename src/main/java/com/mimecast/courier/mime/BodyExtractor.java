package com.mimecast.courier.mime;

import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimePart;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.internet.ParseException;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.net.QuotedPrintableCodec;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Best-effort body extraction.
 *
 * <p>Produces a plain text and HTML pair from a message of any shape:
 * <ul>
 *     <li>Multipart messages are walked depth first.</li>
 *     <li>Parts with an attachment disposition are skipped with everything inside them.</li>
 *     <li>Every text/plain part is collected, joined by a line break and trimmed.</li>
 *     <li>The last text/html part wins.</li>
 *     <li>A single part message is decoded as plain text whatever its type.</li>
 * </ul>
 *
 * <p>Text is decoded with the charset the part declares, UTF-8 when absent or unknown.
 * <br>Malformed input is replaced. Content the strict MIME decoders reject is decoded again
 * <br>from its raw form with lenient codecs. Parts that cannot be read at all are skipped.
 */
public final class BodyExtractor {
    private static final Logger log = LogManager.getLogger(BodyExtractor.class);

    private BodyExtractor() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Extracts plain and HTML body text.
     *
     * @param message Message or part.
     * @return MessageBody instance.
     */
    public static MessageBody extractBody(Part message) {
        List<String> plain = new ArrayList<>();
        Collector collector = new Collector(plain);

        if (isMultipart(message)) {
            collector.walk(message);
        } else {
            String text = decode(message);
            if (text != null && !text.isEmpty()) {
                plain.add(text);
            }
        }

        return new MessageBody(String.join("\n", plain).trim(), collector.html);
    }

    /**
     * Decodes part content as text.
     *
     * @param part Part instance.
     * @return Text or null if unreadable.
     */
    static String decode(Part part) {
        try (InputStream stream = part.getInputStream()) {
            return new String(stream.readAllBytes(), charset(part));
        } catch (IOException e) {
            if (part instanceof MimePart) {
                log.debug("Decoding raw part content leniently: {}", e.getMessage());
                return decodeRaw((MimePart) part);
            }
            log.debug("Unable to read part content: {}", e.getMessage());
            return null;
        } catch (MessagingException e) {
            log.debug("Unable to read part content: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Decodes raw part content with lenient codecs.
     * <p>Base64 skips characters outside its alphabet.
     * <br>Quoted-printable that still fails is returned undecoded.
     *
     * @param part MimePart instance.
     * @return Text or null if unreadable.
     */
    static String decodeRaw(MimePart part) {
        try (InputStream stream = part.getRawInputStream()) {
            byte[] bytes = stream.readAllBytes();
            String encoding = StringUtils.trimToEmpty(part.getEncoding()).toLowerCase(Locale.ROOT);
            if (encoding.equals("base64")) {
                bytes = Base64.decodeBase64(bytes);
            } else if (encoding.equals("quoted-printable")) {
                try {
                    bytes = QuotedPrintableCodec.decodeQuotedPrintable(bytes);
                } catch (DecoderException e) {
                    log.debug("Keeping undecoded quoted-printable content: {}", e.getMessage());
                }
            }
            return new String(bytes, charset(part));
        } catch (IOException | MessagingException e) {
            log.debug("Unable to read raw part content: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Gets declared charset or UTF-8.
     *
     * @param part Part instance.
     * @return Charset instance.
     */
    static Charset charset(Part part) {
        try {
            String name = new ContentType(part.getContentType()).getParameter("charset");
            if (name != null) {
                String javaName = MimeUtility.javaCharset(name.trim());
                if (Charset.isSupported(javaName)) {
                    return Charset.forName(javaName);
                }
                log.debug("Unsupported charset {}, using UTF-8", name);
            }
        } catch (ParseException | IllegalCharsetNameException e) {
            log.debug("Unusable content type, using UTF-8: {}", e.getMessage());
        } catch (MessagingException e) {
            log.debug("Unable to read content type, using UTF-8: {}", e.getMessage());
        }
        return StandardCharsets.UTF_8;
    }

    private static boolean isMultipart(Part part) {
        try {
            return part.isMimeType("multipart/*");
        } catch (MessagingException e) {
            return false;
        }
    }

    private static boolean isAttachment(Part part) {
        try {
            String disposition = part.getDisposition();
            return disposition != null && disposition.trim().toLowerCase(Locale.ROOT).startsWith(Part.ATTACHMENT);
        } catch (MessagingException e) {
            // An unreadable disposition is treated as inline.
            return false;
        }
    }

    /**
     * Walk state.
     */
    private static final class Collector {
        private final List<String> plain;
        private String html;

        Collector(List<String> plain) {
            this.plain = plain;
        }

        void walk(Part part) {
            if (isAttachment(part)) {
                return;
            }

            try {
                if (part.isMimeType("multipart/*")) {
                    Multipart multipart = (Multipart) part.getContent();
                    for (int i = 0; i < multipart.getCount(); i++) {
                        walk(multipart.getBodyPart(i));
                    }

                } else if (part.isMimeType("message/rfc822")) {
                    Object content = part.getContent();
                    if (content instanceof Part) {
                        walk((Part) content);
                    }

                } else if (part.isMimeType("text/plain")) {
                    String text = decode(part);
                    if (text != null) {
                        plain.add(text);
                    }

                } else if (part.isMimeType("text/html")) {
                    String text = decode(part);
                    if (text != null) {
                        html = text;
                    }
                }
            } catch (IOException | MessagingException | ClassCastException e) {
                log.debug("Skipping unreadable part: {}", e.getMessage());
            }
        }
    }
}
