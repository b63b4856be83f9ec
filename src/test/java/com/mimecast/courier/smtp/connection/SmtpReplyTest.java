package com.mimecast.courier.smtp.connection;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SmtpReplyTest {

    @Test
    void positive() {
        SmtpReply reply = new SmtpReply(250, List.of("OK"));

        assertTrue(reply.isPositive());
        assertTrue(reply.is(250));
        assertFalse(reply.is(251));
        assertEquals("250 OK", reply.toString());
    }

    @Test
    void negative() {
        assertFalse(new SmtpReply(354, List.of("Go ahead")).isPositive());
        assertFalse(new SmtpReply(550, List.of("No")).isPositive());
    }
}
