package com.mimecast.courier.imap;

import com.mimecast.courier.transport.FetchResult;
import com.mimecast.courier.transport.Outcome;
import com.mimecast.courier.transport.SearchResult;
import jakarta.mail.MessagingException;

/**
 * One IMAP mailbox session.
 *
 * <p>Steps are driven in order: login (optional), select, search, then fetch and flag per message.
 * <br>Search, fetch and flag clearing report through result types rather than exceptions,
 * <br>so one unacknowledged command never ends the session.
 * <br>{@link #close()} closes the folder and logs out, it never throws.
 */
public interface ImapSession extends AutoCloseable {

    /**
     * Authenticates.
     *
     * @param username Username.
     * @param password Password.
     * @throws MessagingException Unable to connect or credentials refused.
     */
    void login(String username, String password) throws MessagingException;

    /**
     * Selects a folder for read and write.
     *
     * @param folder Folder name.
     * @throws MessagingException Unable to connect or folder not selectable.
     */
    void select(String folder) throws MessagingException;

    /**
     * Searches the selected folder for messages without the \Seen flag.
     *
     * @return SearchResult with ids in server order.
     */
    SearchResult searchUnseen();

    /**
     * Fetches the full raw message.
     * <p>This sets the \Seen flag on the server.
     *
     * @param id Message sequence number.
     * @return FetchResult instance.
     */
    FetchResult fetch(int id);

    /**
     * Removes the \Seen flag.
     *
     * @param id Message sequence number.
     * @return Outcome instance.
     */
    Outcome clearSeen(int id);

    /**
     * Closes the folder and logs out.
     */
    @Override
    void close();
}
