package com.mimecast.courier.mime;

import jakarta.mail.internet.MimeUtility;
import jakarta.mail.internet.ParseException;
import org.apache.commons.codec.binary.Base64;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RFC 2047 header value decoder.
 *
 * <p>Turns header values made of encoded words into display strings.
 * <br>Each encoded word is decoded on its own, so one header may mix charsets and encodings.
 * <br>Words that cannot be decoded under their declared charset or carry bad escapes are
 * <br>decoded leniently as UTF-8 with malformed input replaced, so decoding never fails
 * <br>and never returns the encoded word itself.
 *
 * <p>Whitespace between two adjacent encoded words is dropped as RFC 2047 section 6.2 asks.
 * <br>Whitespace next to plain text is kept.
 *
 * @see <a href="https://tools.ietf.org/html/rfc2047">RFC 2047</a>
 */
public final class HeaderDecoder {
    private static final Logger log = LogManager.getLogger(HeaderDecoder.class);

    /**
     * Encoded word pattern: charset, encoding and encoded text.
     */
    private static final Pattern ENCODED_WORD = Pattern.compile("=\\?([^?\\s]+)\\?([BbQq])\\?([^?\\s]*)\\?=");

    private HeaderDecoder() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Decodes a header value.
     *
     * @param raw Raw header value, may be folded or null.
     * @return Decoded string, empty for null input.
     */
    public static String decodeHeaderValue(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        String value = MimeUtility.unfold(raw);
        Matcher matcher = ENCODED_WORD.matcher(value);
        if (!matcher.find()) {
            return value;
        }

        StringBuilder decoded = new StringBuilder(value.length());
        int position = 0;
        boolean previousEncoded = false;
        do {
            String between = value.substring(position, matcher.start());
            if (!(previousEncoded && between.isBlank())) {
                decoded.append(between);
            }

            decoded.append(decodeWord(matcher.group(), matcher.group(2), matcher.group(3)));
            position = matcher.end();
            previousEncoded = true;
        } while (matcher.find());

        decoded.append(value.substring(position));
        return decoded.toString();
    }

    /**
     * Decodes one encoded word, falling back to permissive UTF-8.
     *
     * @param word     Whole encoded word.
     * @param encoding B or Q.
     * @param text     Encoded text.
     * @return Decoded string.
     */
    private static String decodeWord(String word, String encoding, String text) {
        try {
            return MimeUtility.decodeWord(word);
        } catch (ParseException | UnsupportedEncodingException | IllegalArgumentException e) {
            log.debug("Falling back to UTF-8 for encoded word {}: {}", word, e.getMessage());
        }

        byte[] bytes = encoding.equalsIgnoreCase("B")
                ? Base64.decodeBase64(text)
                : decodeQ(text.getBytes(StandardCharsets.UTF_8));
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Lenient Q decoding.
     * <p>Underscores become spaces and =XX escapes become bytes.
     * <br>An escape without two hex digits is kept as written.
     *
     * @param text Encoded text bytes.
     * @return Decoded bytes.
     */
    static byte[] decodeQ(byte[] text) {
        ByteArrayOutputStream decoded = new ByteArrayOutputStream(text.length);
        for (int i = 0; i < text.length; i++) {
            byte b = text[i];
            if (b == '_') {
                decoded.write(' ');
            } else if (b == '=' && i + 2 < text.length && isHex(text[i + 1]) && isHex(text[i + 2])) {
                decoded.write(Character.digit(text[i + 1], 16) << 4 | Character.digit(text[i + 2], 16));
                i += 2;
            } else {
                decoded.write(b);
            }
        }
        return decoded.toByteArray();
    }

    private static boolean isHex(byte b) {
        return Character.digit(b, 16) != -1;
    }
}
