package com.mimecast.courier.smtp.auth;

import org.apache.commons.codec.binary.Base64;

import java.nio.charset.StandardCharsets;

/**
 * Login authentication mechanism.
 *
 * <p>Username and password are sent in two separate Base64 encoded steps.
 *
 * @see <a href="https://tools.ietf.org/html/draft-murchison-sasl-login-00">DRAFT SASL LOGIN</a>
 */
public class Login {

    /**
     * Username.
     */
    private final String username;

    /**
     * Password.
     */
    private final String password;

    /**
     * Constructs a new Login instance.
     *
     * @param username Username.
     * @param password Password.
     */
    public Login(String username, String password) {
        this.username = username != null ? username : "";
        this.password = password != null ? password : "";
    }

    /**
     * Gets username.
     *
     * @return Username string.
     */
    public String getUsername() {
        return Base64.encodeBase64String(username.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Gets password.
     *
     * @return Password string.
     */
    public String getPassword() {
        return Base64.encodeBase64String(password.getBytes(StandardCharsets.UTF_8));
    }
}
