package com.mimecast.courier.contact;

import com.mimecast.courier.config.MailConfig;
import com.mimecast.courier.mime.OutboundMessage;
import com.mimecast.courier.service.MailConfigurationException;
import com.mimecast.courier.service.MailException;
import com.mimecast.courier.service.MailService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Relays website contact submissions to a mailbox.
 *
 * <p>The recipient resolves as override, then configured default from, then SMTP user.
 * <br>The message goes out from the default from, or the recipient itself,
 * <br>with the submitter as Reply-To so answering reaches them directly.
 *
 * <p>HTTP callers map {@link MailConfigurationException} to 500 and transport errors to 502.
 */
public class ContactRelay {
    private static final Logger log = LogManager.getLogger(ContactRelay.class);

    public static final String CONTACT_RECIPIENT = "CONTACT_RECIPIENT";
    public static final String SUBJECT_PREFIX = "Website contact: ";

    private final MailService service;
    private final String recipientOverride;

    /**
     * Constructs a new ContactRelay instance reading the override from the CONTACT_RECIPIENT environment variable.
     *
     * @param service MailService instance.
     */
    public ContactRelay(MailService service) {
        this(service, System.getenv(CONTACT_RECIPIENT));
    }

    /**
     * Constructs a new ContactRelay instance.
     *
     * @param service           MailService instance.
     * @param recipientOverride Recipient override or null.
     */
    public ContactRelay(MailService service, String recipientOverride) {
        this.service = service;
        this.recipientOverride = recipientOverride == null || recipientOverride.isBlank() ? null : recipientOverride.trim();
    }

    /**
     * Sends a submission.
     *
     * @param submission ContactSubmission instance.
     * @throws MailException Recipient not configured or transport failure.
     */
    public void relay(ContactSubmission submission) throws MailException {
        MailConfig config = service.getConfig();

        String recipient = recipient(config);
        if (recipient == null) {
            throw new MailConfigurationException("Contact recipient not configured");
        }

        OutboundMessage message = OutboundMessage.builder()
                .to(recipient)
                .subject(SUBJECT_PREFIX + submission.getSubject())
                .plainBody(body(submission))
                .from(config.getDefaultFrom() != null ? config.getDefaultFrom() : recipient)
                .replyTo(submission.getEmail())
                .build();

        service.send(message);
        log.info("Relayed contact from {} to {}", submission.getEmail(), recipient);
    }

    /**
     * Builds the message body.
     *
     * @param submission ContactSubmission instance.
     * @return Body text.
     */
    static String body(ContactSubmission submission) {
        return String.join("\n",
                "Name: " + submission.getName(),
                "Email: " + submission.getEmail(),
                "Phone: " + submission.getPhone(),
                "",
                "Message:",
                submission.getMessage());
    }

    private String recipient(MailConfig config) {
        if (recipientOverride != null) {
            return recipientOverride;
        }
        if (config.getDefaultFrom() != null) {
            return config.getDefaultFrom();
        }
        return config.getSmtpUser();
    }
}
