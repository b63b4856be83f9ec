package com.mimecast.courier.mime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Message to submit over SMTP.
 *
 * <p>The from address may be left empty, the mail service then resolves it from configuration.
 * <br>Bcc addresses only ever become envelope recipients.
 *
 * <p>Usage example:
 * <pre>
 * OutboundMessage message = OutboundMessage.builder()
 *         .to("pepper@example.com")
 *         .cc("happy@example.com")
 *         .subject("Suit fitting")
 *         .plainBody("Tomorrow at ten.")
 *         .build();
 * </pre>
 */
public final class OutboundMessage {
    private final String subject;
    private final String plainBody;
    private final String htmlBody;
    private final String from;
    private final List<String> to;
    private final List<String> cc;
    private final List<String> bcc;
    private final String replyTo;

    private OutboundMessage(Builder builder) {
        this.subject = builder.subject != null ? builder.subject : "";
        this.plainBody = builder.plainBody;
        this.htmlBody = builder.htmlBody;
        this.from = builder.from;
        this.to = Collections.unmodifiableList(new ArrayList<>(builder.to));
        this.cc = Collections.unmodifiableList(new ArrayList<>(builder.cc));
        this.bcc = Collections.unmodifiableList(new ArrayList<>(builder.bcc));
        this.replyTo = builder.replyTo;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSubject() {
        return subject;
    }

    public Optional<String> getPlainBody() {
        return Optional.ofNullable(plainBody);
    }

    public Optional<String> getHtmlBody() {
        return Optional.ofNullable(htmlBody);
    }

    public Optional<String> getFrom() {
        return Optional.ofNullable(from);
    }

    public List<String> getTo() {
        return to;
    }

    public List<String> getCc() {
        return cc;
    }

    public List<String> getBcc() {
        return bcc;
    }

    public Optional<String> getReplyTo() {
        return Optional.ofNullable(replyTo);
    }

    /**
     * Has at least one body.
     *
     * @return Boolean.
     */
    public boolean hasBody() {
        return plainBody != null || htmlBody != null;
    }

    /**
     * Gets envelope recipients.
     * <p>To, then cc, then bcc, as given.
     *
     * @return List of addresses.
     */
    public List<String> getEnvelopeRecipients() {
        List<String> recipients = new ArrayList<>(to.size() + cc.size() + bcc.size());
        recipients.addAll(to);
        recipients.addAll(cc);
        recipients.addAll(bcc);
        return recipients;
    }

    /**
     * Gets a copy with the given from address.
     *
     * @param from From address.
     * @return OutboundMessage instance.
     */
    public OutboundMessage withFrom(String from) {
        return toBuilder().from(from).build();
    }

    /**
     * Gets a builder initialised with this message.
     *
     * @return Builder instance.
     */
    public Builder toBuilder() {
        return new Builder()
                .subject(subject)
                .plainBody(plainBody)
                .htmlBody(htmlBody)
                .from(from)
                .to(to)
                .cc(cc)
                .bcc(bcc)
                .replyTo(replyTo);
    }

    /**
     * OutboundMessage builder.
     */
    public static final class Builder {
        private String subject;
        private String plainBody;
        private String htmlBody;
        private String from;
        private final List<String> to = new ArrayList<>();
        private final List<String> cc = new ArrayList<>();
        private final List<String> bcc = new ArrayList<>();
        private String replyTo;

        private Builder() {
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder plainBody(String plainBody) {
            this.plainBody = plainBody;
            return this;
        }

        // Empty HTML means a plain text only message.
        public Builder htmlBody(String htmlBody) {
            this.htmlBody = htmlBody == null || htmlBody.isEmpty() ? null : htmlBody;
            return this;
        }

        public Builder from(String from) {
            this.from = from == null || from.isBlank() ? null : from.trim();
            return this;
        }

        public Builder to(String... addresses) {
            return to(Arrays.asList(addresses));
        }

        public Builder to(Collection<String> addresses) {
            add(to, addresses);
            return this;
        }

        public Builder cc(String... addresses) {
            return cc(Arrays.asList(addresses));
        }

        public Builder cc(Collection<String> addresses) {
            add(cc, addresses);
            return this;
        }

        public Builder bcc(String... addresses) {
            return bcc(Arrays.asList(addresses));
        }

        public Builder bcc(Collection<String> addresses) {
            add(bcc, addresses);
            return this;
        }

        public Builder replyTo(String replyTo) {
            this.replyTo = replyTo == null || replyTo.isBlank() ? null : replyTo.trim();
            return this;
        }

        public OutboundMessage build() {
            return new OutboundMessage(this);
        }

        // Null lists and blank entries are ignored.
        private static void add(List<String> target, Collection<String> addresses) {
            if (addresses == null) {
                return;
            }
            for (String address : addresses) {
                if (address != null && !address.isBlank()) {
                    target.add(address.trim());
                }
            }
        }
    }
}
