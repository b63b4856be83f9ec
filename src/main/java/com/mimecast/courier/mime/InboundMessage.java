package com.mimecast.courier.mime;

import java.util.Optional;

/**
 * Normalized record of a fetched message.
 *
 * <p>Header fields are decoded display strings, never raw encoded words, and are empty when
 * <br>the header is absent. The original bytes are kept untouched.
 */
public final class InboundMessage {
    private final String subject;
    private final String from;
    private final String to;
    private final String date;
    private final MessageBody body;
    private final byte[] rawBytes;

    /**
     * Constructs a new InboundMessage instance.
     *
     * @param subject  Decoded subject.
     * @param from     Decoded from.
     * @param to       Decoded to.
     * @param date     Date header.
     * @param body     Extracted body.
     * @param rawBytes Original message bytes.
     */
    public InboundMessage(String subject, String from, String to, String date, MessageBody body, byte[] rawBytes) {
        this.subject = subject != null ? subject : "";
        this.from = from != null ? from : "";
        this.to = to != null ? to : "";
        this.date = date != null ? date : "";
        this.body = body != null ? body : new MessageBody("", null);
        this.rawBytes = rawBytes != null ? rawBytes.clone() : new byte[0];
    }

    public String getSubject() {
        return subject;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public String getDate() {
        return date;
    }

    public String getPlainText() {
        return body.getPlainText();
    }

    public Optional<String> getHtmlText() {
        return body.getHtmlText();
    }

    /**
     * Gets a copy of the original message bytes.
     *
     * @return Byte array.
     */
    public byte[] getRawBytes() {
        return rawBytes.clone();
    }

    @Override
    public String toString() {
        return "InboundMessage{" +
                "subject='" + subject + '\'' +
                ", from='" + from + '\'' +
                ", to='" + to + '\'' +
                ", date='" + date + '\'' +
                ", html=" + body.getHtmlText().isPresent() +
                ", size=" + rawBytes.length +
                '}';
    }
}
