package com.mimecast.courier.service;

import com.mimecast.courier.config.MailConfig;
import com.mimecast.courier.imap.ImapSession;
import com.mimecast.courier.mime.InboundMessage;
import com.mimecast.courier.mime.InboundMessageParser;
import com.mimecast.courier.mime.MessageComposer;
import com.mimecast.courier.mime.OutboundMessage;
import com.mimecast.courier.pop3.Pop3Session;
import com.mimecast.courier.smtp.SmtpSession;
import com.mimecast.courier.smtp.connection.SmtpException;
import com.mimecast.courier.transport.DefaultTransportFactory;
import com.mimecast.courier.transport.FetchResult;
import com.mimecast.courier.transport.Outcome;
import com.mimecast.courier.transport.SearchResult;
import com.mimecast.courier.transport.TransportFactory;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.AddressException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Mail service.
 *
 * <p>Sends messages over SMTP and fetches messages from IMAP and POP3 mailboxes.
 * <br>Every call opens its own session and closes it before returning, whatever the outcome.
 * <br>Configuration problems are raised before any network I/O as {@link MailConfigurationException}.
 * <br>Network, TLS, authentication and protocol problems are raised as {@link MailTransportException}.
 *
 * <p>Mailbox logins reuse the SMTP credentials.
 *
 * <p>Usage example:
 * <pre>
 * MailService service = new MailService(MailConfigLoader.fromEnvironment());
 * service.sendEmail(List.of("pepper@example.com"), "Status", "All systems nominal.");
 * List&lt;InboundMessage&gt; unseen = service.fetchUnseenImap();
 * </pre>
 */
public class MailService {
    private static final Logger log = LogManager.getLogger(MailService.class);

    public static final String DEFAULT_FOLDER = "INBOX";
    public static final int DEFAULT_IMAP_LIMIT = 20;
    public static final int DEFAULT_POP3_LIMIT = 10;

    /**
     * Shared pool for async sends without a supplied executor.
     */
    private static final ExecutorService sharedExecutor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "MailService-Async");
        thread.setDaemon(true);
        return thread;
    });

    private final MailConfig config;
    private final TransportFactory transports;
    private final Executor executor;

    /**
     * Constructs a new MailService instance over the network.
     *
     * @param config MailConfig instance.
     */
    public MailService(MailConfig config) {
        this(config, new DefaultTransportFactory(), sharedExecutor);
    }

    /**
     * Constructs a new MailService instance.
     *
     * @param config     MailConfig instance.
     * @param transports TransportFactory instance.
     * @param executor   Executor for async sends.
     */
    public MailService(MailConfig config, TransportFactory transports, Executor executor) {
        this.config = Objects.requireNonNull(config, "config");
        this.transports = Objects.requireNonNull(transports, "transports");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Gets configuration.
     *
     * @return MailConfig instance.
     */
    public MailConfig getConfig() {
        return config;
    }

    /**
     * Sends a plain text message.
     *
     * @param to      Recipients.
     * @param subject Subject.
     * @param body    Plain text body.
     * @throws MailException Configuration or transport failure.
     */
    public void sendEmail(List<String> to, String subject, String body) throws MailException {
        send(build(to, subject, body, null, null, null, null));
    }

    /**
     * Sends a message.
     *
     * @param to      Recipients.
     * @param subject Subject.
     * @param body    Plain text body.
     * @param html    HTML body or null.
     * @param cc      Carbon copy recipients or null.
     * @param bcc     Blind carbon copy recipients or null.
     * @param from    Sender or null for the configured default.
     * @throws MailException Configuration or transport failure.
     */
    public void sendEmail(List<String> to, String subject, String body, String html,
                          List<String> cc, List<String> bcc, String from) throws MailException {
        send(build(to, subject, body, html, cc, bcc, from));
    }

    /**
     * Sends a message.
     * <p>The sender resolves as explicit from, then configured default from, then SMTP user.
     * <br>The envelope goes to every To, Cc and Bcc address, one refused recipient fails the whole send.
     *
     * @param message OutboundMessage instance.
     * @throws MailException Configuration or transport failure.
     */
    public void send(OutboundMessage message) throws MailException {
        Objects.requireNonNull(message, "message");

        if (!config.hasSmtp()) {
            throw new MailConfigurationException("SMTP host not configured");
        }
        if (message.getTo().isEmpty()) {
            throw new MailConfigurationException("At least one recipient is required");
        }
        if (!message.hasBody()) {
            throw new MailConfigurationException("Message body is required");
        }

        String from = resolveFrom(message)
                .orElseThrow(() -> new MailConfigurationException("No sender address: set an explicit from, a default from or an SMTP user"));
        OutboundMessage resolved = message.withFrom(from);

        byte[] bytes;
        String envelopeFrom;
        List<String> envelopeRecipients = new ArrayList<>();
        try {
            bytes = MessageComposer.toBytes(resolved);
            envelopeFrom = MessageComposer.envelopeAddress(from);
            for (String recipient : resolved.getEnvelopeRecipients()) {
                envelopeRecipients.add(MessageComposer.envelopeAddress(recipient));
            }
        } catch (AddressException e) {
            throw new MailConfigurationException("Invalid address: " + e.getMessage(), e);
        } catch (MessagingException e) {
            throw new MailConfigurationException("Unable to compose message: " + e.getMessage(), e);
        }

        SSLContext tls = config.isSmtpUseStartTls() ? defaultTlsContext() : null;

        try (SmtpSession session = transports.openSmtp(config)) {
            session.ehlo();
            if (tls != null) {
                session.startTls(tls);
                session.ehlo();
            }
            if (config.hasCredentials()) {
                session.login(config.getSmtpUser(), config.getSmtpPassword());
            }
            session.send(envelopeFrom, envelopeRecipients, bytes);

        } catch (IOException e) {
            String detail = e instanceof SmtpException && ((SmtpException) e).getReply() != null
                    ? ((SmtpException) e).getReply().toString() : null;
            throw new MailTransportException("SMTP send failed: " + e.getMessage(), detail, e);
        }

        log.info("Sent \"{}\" from {} to {} recipient(s)", resolved.getSubject(), envelopeFrom, envelopeRecipients.size());
    }

    /**
     * Sends a message on the executor.
     * <p>The future completes exceptionally with the same exception {@link #send(OutboundMessage)} would throw.
     * <br>Cancelling the future does not stop a session in flight.
     *
     * @param message OutboundMessage instance.
     * @return CompletableFuture instance.
     */
    public CompletableFuture<Void> sendEmailAsync(OutboundMessage message) {
        Objects.requireNonNull(message, "message");

        CompletableFuture<Void> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                send(message);
                future.complete(null);
            } catch (MailException | RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /**
     * Sends a message on the executor.
     *
     * @param to      Recipients.
     * @param subject Subject.
     * @param body    Plain text body.
     * @param html    HTML body or null.
     * @param cc      Carbon copy recipients or null.
     * @param bcc     Blind carbon copy recipients or null.
     * @param from    Sender or null for the configured default.
     * @return CompletableFuture instance.
     */
    public CompletableFuture<Void> sendEmailAsync(List<String> to, String subject, String body, String html,
                                                  List<String> cc, List<String> bcc, String from) {
        return sendEmailAsync(build(to, subject, body, html, cc, bcc, from));
    }

    /**
     * Fetches up to 20 unseen messages from INBOX leaving them unseen.
     *
     * @return List of InboundMessage, newest first.
     * @throws MailException Configuration or transport failure.
     */
    public List<InboundMessage> fetchUnseenImap() throws MailException {
        return fetchUnseenImap(DEFAULT_FOLDER, DEFAULT_IMAP_LIMIT, false);
    }

    /**
     * Fetches unseen messages from an IMAP folder.
     * <p>Messages are taken highest id first.
     * <br>Fetching sets \Seen on the server, when markSeen is false the flag is cleared again best effort.
     * <br>A refused search yields an empty list, a refused fetch or unparsable message is skipped.
     *
     * @param folder   Folder name, INBOX when null or blank.
     * @param limit    Maximum messages to fetch.
     * @param markSeen Leave fetched messages seen.
     * @return List of InboundMessage, newest first.
     * @throws MailException Configuration or transport failure.
     */
    public List<InboundMessage> fetchUnseenImap(String folder, int limit, boolean markSeen) throws MailException {
        if (!config.hasImap()) {
            throw new MailConfigurationException("IMAP host not configured");
        }
        if (limit < 0) {
            throw new MailConfigurationException("Limit must not be negative: " + limit);
        }
        String name = folder == null || folder.isBlank() ? DEFAULT_FOLDER : folder;

        List<InboundMessage> messages = new ArrayList<>();
        try (ImapSession session = transports.openImap(config)) {
            if (config.hasCredentials()) {
                session.login(config.getSmtpUser(), config.getSmtpPassword());
            }
            session.select(name);

            SearchResult search = session.searchUnseen();
            if (!search.isOk()) {
                log.warn("UNSEEN search in {} not acknowledged: {}", name, search.getDetail());
                return messages;
            }

            List<Integer> ids = new ArrayList<>(search.getIds());
            Collections.reverse(ids);
            for (int id : ids.subList(0, Math.min(limit, ids.size()))) {
                FetchResult fetch = session.fetch(id);
                if (!fetch.isOk()) {
                    log.warn("Skipping IMAP message {}: {}", id, fetch.getDetail());
                    continue;
                }

                parse("IMAP", id, fetch.getBytes()).ifPresent(messages::add);

                if (!markSeen) {
                    Outcome outcome = session.clearSeen(id);
                    if (!outcome.isOk()) {
                        log.warn("Message {} left seen: {}", id, outcome);
                    }
                }
            }

        } catch (MessagingException e) {
            throw new MailTransportException("IMAP fetch failed", e.getMessage(), e);
        }

        log.info("Fetched {} message(s) from IMAP folder {}", messages.size(), name);
        return messages;
    }

    /**
     * Fetches up to 10 messages from the POP3 maildrop.
     *
     * @return List of InboundMessage, highest number first.
     * @throws MailException Configuration or transport failure.
     */
    public List<InboundMessage> fetchPop3() throws MailException {
        return fetchPop3(DEFAULT_POP3_LIMIT);
    }

    /**
     * Fetches messages from the POP3 maildrop.
     * <p>Authentication is best effort, a refused login is logged and the listing attempted anyway.
     * <br>A failed listing is a transport error, a failed retrieval or unparsable message is skipped.
     *
     * @param limit Maximum messages to fetch.
     * @return List of InboundMessage, highest number first.
     * @throws MailException Configuration or transport failure.
     */
    public List<InboundMessage> fetchPop3(int limit) throws MailException {
        if (!config.hasPop3()) {
            throw new MailConfigurationException("POP3 host not configured");
        }
        if (limit < 0) {
            throw new MailConfigurationException("Limit must not be negative: " + limit);
        }

        List<InboundMessage> messages = new ArrayList<>();
        try (Pop3Session session = transports.openPop3(config)) {
            if (config.hasCredentials()) {
                Outcome outcome = session.authenticate(config.getSmtpUser(), config.getSmtpPassword());
                if (!outcome.isOk()) {
                    log.warn("Continuing without POP3 login: {}", outcome);
                }
            }

            List<Integer> numbers = messageNumbers(session.list());
            numbers.sort(Collections.reverseOrder());
            for (int number : numbers.subList(0, Math.min(limit, numbers.size()))) {
                FetchResult retrieve = session.retrieve(number);
                if (!retrieve.isOk()) {
                    log.warn("Skipping POP3 message {}: {}", number, retrieve.getDetail());
                    continue;
                }
                parse("POP3", number, retrieve.getBytes()).ifPresent(messages::add);
            }

        } catch (MessagingException e) {
            throw new MailTransportException("POP3 fetch failed", e.getMessage(), e);
        }

        log.info("Fetched {} message(s) from POP3", messages.size());
        return messages;
    }

    /**
     * Gets message numbers from listing lines.
     *
     * @param lines Lines of form "number octets".
     * @return Mutable list of numbers.
     */
    static List<Integer> messageNumbers(List<String> lines) {
        List<Integer> numbers = new ArrayList<>(lines.size());
        for (String line : lines) {
            String[] words = line.trim().split("\\s+");
            try {
                numbers.add(Integer.parseInt(words[0]));
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed listing line: {}", line);
            }
        }
        return numbers;
    }

    private Optional<String> resolveFrom(OutboundMessage message) {
        if (message.getFrom().isPresent()) {
            return message.getFrom();
        }
        if (config.getDefaultFrom() != null) {
            return Optional.of(config.getDefaultFrom());
        }
        return Optional.ofNullable(config.getSmtpUser());
    }

    private static Optional<InboundMessage> parse(String protocol, int id, byte[] raw) {
        try {
            return Optional.of(InboundMessageParser.parse(raw));
        } catch (MessagingException e) {
            log.warn("Skipping unparsable {} message {}: {}", protocol, id, e.getMessage());
            return Optional.empty();
        }
    }

    private static SSLContext defaultTlsContext() throws MailTransportException {
        try {
            return SSLContext.getDefault();
        } catch (NoSuchAlgorithmException e) {
            throw new MailTransportException("No default TLS context", e.getMessage(), e);
        }
    }

    private static OutboundMessage build(List<String> to, String subject, String body, String html,
                                         List<String> cc, List<String> bcc, String from) {
        OutboundMessage.Builder builder = OutboundMessage.builder()
                .subject(subject)
                .plainBody(body)
                .htmlBody(html)
                .from(from);
        if (to != null) {
            builder.to(to);
        }
        if (cc != null) {
            builder.cc(cc);
        }
        if (bcc != null) {
            builder.bcc(bcc);
        }
        return builder.build();
    }
}
