package com.mimecast.courier.pop3;

import com.mimecast.courier.transport.FetchResult;
import com.mimecast.courier.transport.Outcome;
import jakarta.mail.MessagingException;

import java.util.List;

/**
 * One POP3 maildrop session.
 */
public interface Pop3Session extends AutoCloseable {

    /**
     * Authenticates.
     *
     * @param username Username.
     * @param password Password.
     * @return Outcome instance.
     */
    Outcome authenticate(String username, String password);

    /**
     * Lists the maildrop.
     *
     * @return Lines of form "&lt;number&gt; &lt;octets&gt;".
     * @throws MessagingException Unable to connect or list.
     */
    List<String> list() throws MessagingException;

    /**
     * Retrieves the full raw message.
     *
     * @param number Message number.
     * @return FetchResult instance.
     */
    FetchResult retrieve(int number);

    /**
     * Quits and closes the connection.
     */
    @Override
    void close();
}
