package com.mimecast.courier.smtp.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LoginTest {

    @Test
    void getUsernameAndPassword() {
        Login login = new Login("tony@example.com", "stark");

        assertEquals("dG9ueUBleGFtcGxlLmNvbQ==", login.getUsername());
        assertEquals("c3Rhcms=", login.getPassword());
    }

    @Test
    void utf8() {
        assertEquals("Q2Fmw6k=", new Login("Café", "").getUsername());
    }
}
