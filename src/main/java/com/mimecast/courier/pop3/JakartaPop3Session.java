package com.mimecast.courier.pop3;

import com.mimecast.courier.transport.FetchResult;
import com.mimecast.courier.transport.MailSessionProperties;
import com.mimecast.courier.transport.Outcome;
import jakarta.mail.FetchProfile;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * POP3 session backed by a Jakarta Mail store.
 *
 * <p>The maildrop is opened read only, closing it sends QUIT without deleting anything.
 * <br>As with IMAP the socket is opened by the first successful authenticate,
 * <br>or by the listing when authentication was skipped or refused, where Jakarta Mail refuses it as unauthenticated.
 */
public class JakartaPop3Session implements Pop3Session {
    private static final Logger log = LogManager.getLogger(JakartaPop3Session.class);

    private static final String INBOX = "INBOX";

    private final String host;
    private final int port;
    private final Store store;

    private Folder inbox;

    /**
     * Constructs a new JakartaPop3Session instance.
     * <p>No connection is made yet.
     *
     * @param host          Server host.
     * @param port          Server port.
     * @param ssl           Use implicit TLS.
     * @param timeoutMillis Connect and read timeout.
     * @throws MessagingException No POP3 provider available.
     */
    public JakartaPop3Session(String host, int port, boolean ssl, int timeoutMillis) throws MessagingException {
        this.host = host;
        this.port = port;

        String protocol = ssl ? "pop3s" : "pop3";
        Properties props = MailSessionProperties.forStore(protocol, host, port, timeoutMillis);
        this.store = Session.getInstance(props).getStore(protocol);
    }

    @Override
    public Outcome authenticate(String username, String password) {
        try {
            store.connect(host, port, username, password);
            log.info("POP3 authenticated to {}:{} as {}", host, port, username);
            return Outcome.ok();
        } catch (MessagingException e) {
            return Outcome.failed("POP3 authentication failed for " + username, e);
        }
    }

    @Override
    public List<String> list() throws MessagingException {
        Folder folder = openInbox();

        Message[] messages = folder.getMessages();
        FetchProfile profile = new FetchProfile();
        profile.add(FetchProfile.Item.SIZE);
        folder.fetch(messages, profile);

        List<String> lines = new ArrayList<>(messages.length);
        for (Message message : messages) {
            lines.add(message.getMessageNumber() + " " + message.getSize());
        }
        log.debug("POP3 listing: {}", lines);
        return lines;
    }

    @Override
    public FetchResult retrieve(int number) {
        try {
            ByteArrayOutputStream stream = new ByteArrayOutputStream();
            openInbox().getMessage(number).writeTo(stream);
            return FetchResult.ok(stream.toByteArray());

        } catch (MessagingException | IOException | IndexOutOfBoundsException e) {
            log.warn("Retrieve of message {} failed: {}", number, e.getMessage());
            return FetchResult.notOk(e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            if (inbox != null && inbox.isOpen()) {
                inbox.close(false);
            }
        } catch (MessagingException e) {
            log.warn("Unable to close maildrop: {}", e.getMessage());
        }

        try {
            if (store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.warn("Unable to quit {}:{}: {}", host, port, e.getMessage());
        }
    }

    private Folder openInbox() throws MessagingException {
        if (inbox == null) {
            if (!store.isConnected()) {
                store.connect(host, port, null, null);
            }
            Folder folder = store.getFolder(INBOX);
            folder.open(Folder.READ_ONLY);
            inbox = folder;
        }
        return inbox;
    }
}
