package com.mimecast.courier.smtp.auth;

import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;

/**
 * Plain authentication mechanism.
 *
 * <p>Sends an empty authorization identity, then username and password, NUL separated.
 *
 * @see <a href="https://tools.ietf.org/html/rfc4616">RFC 4616</a>
 */
public class Plain {
    private final String username;
    private final String password;

    /**
     * Constructs a new Plain instance.
     *
     * @param username Username.
     * @param password Password.
     */
    public Plain(String username, String password) {
        this.username = username != null ? username : "";
        this.password = password != null ? password : "";
    }

    /**
     * Gets initial response.
     *
     * @return Base64 string.
     */
    public String getLogin() {
        String login = "\0" + username + "\0" + password;
        return Base64.encodeBase64String(login.getBytes(StandardCharsets.UTF_8));
    }
}
