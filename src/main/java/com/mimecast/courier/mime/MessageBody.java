package com.mimecast.courier.mime;

import java.util.Optional;

/**
 * Plain text and optional HTML text extracted from a message.
 */
public final class MessageBody {
    private final String plainText;
    private final String htmlText;

    /**
     * Constructs a new MessageBody instance.
     *
     * @param plainText Plain text, null is stored as empty.
     * @param htmlText  HTML text, may be null.
     */
    public MessageBody(String plainText, String htmlText) {
        this.plainText = plainText != null ? plainText : "";
        this.htmlText = htmlText;
    }

    public String getPlainText() {
        return plainText;
    }

    public Optional<String> getHtmlText() {
        return Optional.ofNullable(htmlText);
    }
}
