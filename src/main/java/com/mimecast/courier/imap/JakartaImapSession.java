package com.mimecast.courier.imap;

import com.mimecast.courier.transport.FetchResult;
import com.mimecast.courier.transport.MailSessionProperties;
import com.mimecast.courier.transport.Outcome;
import com.mimecast.courier.transport.SearchResult;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.search.FlagTerm;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * IMAP session backed by a Jakarta Mail store.
 *
 * <p>Jakarta Mail opens the socket and authenticates in one step.
 * <br>The connection is therefore made by {@link #login(String, String)},
 * <br>or by {@link #select(String)} when no credentials were given, where Jakarta Mail refuses it as unauthenticated.
 *
 * <p>Usage example:
 * <pre>
 * try (ImapSession session = new JakartaImapSession("imap.example.com", 993, true, 30000)) {
 *     session.login("tony@example.com", "giveHerTheRing");
 *     session.select("INBOX");
 *     SearchResult unseen = session.searchUnseen();
 * }
 * </pre>
 */
public class JakartaImapSession implements ImapSession {
    private static final Logger log = LogManager.getLogger(JakartaImapSession.class);

    private final String host;
    private final int port;
    private final Store store;

    private Folder folder;

    /**
     * Constructs a new JakartaImapSession instance.
     * <p>No connection is made yet.
     *
     * @param host          Server host.
     * @param port          Server port.
     * @param ssl           Use implicit TLS.
     * @param timeoutMillis Connect and read timeout.
     * @throws MessagingException No IMAP provider available.
     */
    public JakartaImapSession(String host, int port, boolean ssl, int timeoutMillis) throws MessagingException {
        this.host = host;
        this.port = port;

        String protocol = ssl ? "imaps" : "imap";
        Properties props = MailSessionProperties.forStore(protocol, host, port, timeoutMillis);
        this.store = Session.getInstance(props).getStore(protocol);
    }

    @Override
    public void login(String username, String password) throws MessagingException {
        store.connect(host, port, username, password);
        log.info("IMAP logged in to {}:{} as {}", host, port, username);
    }

    @Override
    public void select(String name) throws MessagingException {
        if (!store.isConnected()) {
            store.connect(host, port, null, null);
            log.info("IMAP connected to {}:{} without login", host, port);
        }

        Folder candidate = store.getFolder(name);
        candidate.open(Folder.READ_WRITE);
        folder = candidate;
        log.debug("Selected folder {} with {} message(s)", name, folder.getMessageCount());
    }

    @Override
    public SearchResult searchUnseen() {
        if (folder == null) {
            return SearchResult.notOk("No folder selected");
        }

        try {
            Message[] messages = folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
            List<Integer> ids = new ArrayList<>(messages.length);
            for (Message message : messages) {
                ids.add(message.getMessageNumber());
            }
            log.debug("UNSEEN search returned {}", ids);
            return SearchResult.ok(ids);

        } catch (MessagingException e) {
            log.warn("UNSEEN search failed: {}", e.getMessage());
            return SearchResult.notOk(e.getMessage());
        }
    }

    @Override
    public FetchResult fetch(int id) {
        if (folder == null) {
            return FetchResult.notOk("No folder selected");
        }

        try {
            ByteArrayOutputStream stream = new ByteArrayOutputStream();
            folder.getMessage(id).writeTo(stream);
            return FetchResult.ok(stream.toByteArray());

        } catch (MessagingException | IOException | IndexOutOfBoundsException e) {
            log.warn("Fetch of message {} failed: {}", id, e.getMessage());
            return FetchResult.notOk(e.getMessage());
        }
    }

    @Override
    public Outcome clearSeen(int id) {
        if (folder == null) {
            return Outcome.failed("No folder selected", null);
        }

        try {
            folder.getMessage(id).setFlag(Flags.Flag.SEEN, false);
            return Outcome.ok();

        } catch (MessagingException | IndexOutOfBoundsException e) {
            return Outcome.failed("Unable to clear \\Seen on message " + id, e);
        }
    }

    @Override
    public void close() {
        try {
            if (folder != null && folder.isOpen()) {
                folder.close(false);
            }
        } catch (MessagingException e) {
            log.warn("Unable to close folder: {}", e.getMessage());
        }

        try {
            if (store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.warn("Unable to log out from {}:{}: {}", host, port, e.getMessage());
        }
    }
}
