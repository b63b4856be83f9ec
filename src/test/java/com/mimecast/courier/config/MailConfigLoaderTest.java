package com.mimecast.courier.config;

import com.mimecast.courier.service.MailConfigurationException;
import com.mimecast.courier.service.MailException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MailConfigLoaderTest {

    @Test
    void defaults() throws MailConfigurationException {
        MailConfig config = MailConfigLoader.fromMap(new HashMap<>());

        assertNull(config.getSmtpHost());
        assertEquals(587, config.getSmtpPort());
        assertTrue(config.isSmtpUseStartTls());
        assertEquals(993, config.getImapPort());
        assertTrue(config.isImapUseSsl());
        assertEquals(995, config.getPop3Port());
        assertTrue(config.isPop3UseSsl());
        assertEquals(30, config.getTimeoutSeconds());
        assertFalse(config.hasSmtp());
        assertFalse(config.hasImap());
        assertFalse(config.hasPop3());
        assertFalse(config.hasCredentials());
    }

    @Test
    void fromMap() throws MailConfigurationException {
        Map<String, String> env = new HashMap<>();
        env.put("SMTP_HOST", "smtp.example.com");
        env.put("SMTP_PORT", " 465 ");
        env.put("SMTP_USE_TLS", "false");
        env.put("SMTP_USER", "tony@example.com");
        env.put("SMTP_PASSWORD", "stark");
        env.put("SMTP_FROM", "  ");
        env.put("POP3_HOST", "pop3.example.com");
        env.put("POP3_SSL", "0");

        MailConfig config = MailConfigLoader.fromMap(env);

        assertEquals("smtp.example.com", config.getSmtpHost());
        assertEquals(465, config.getSmtpPort());
        assertFalse(config.isSmtpUseStartTls());
        assertTrue(config.hasCredentials());
        assertNull(config.getDefaultFrom());
        assertTrue(config.hasPop3());
        assertFalse(config.isPop3UseSsl());
        assertFalse(config.hasImap());
    }

    @Test
    void fromFile() throws MailConfigurationException {
        MailConfig config = MailConfigLoader.fromFile(Paths.get("src/test/resources/cfg/mail.json5"));

        assertEquals("smtp.example.com", config.getSmtpHost());
        assertEquals(2525, config.getSmtpPort());
        assertFalse(config.isSmtpUseStartTls());
        assertEquals("Tony Stark <tony@example.com>", config.getDefaultFrom());
        assertEquals("imap.example.com", config.getImapHost());
        assertEquals(143, config.getImapPort());
        assertFalse(config.isImapUseSsl());
        assertEquals("pop3.example.com", config.getPop3Host());
        assertEquals(995, config.getPop3Port());
        assertTrue(config.isPop3UseSsl());
        assertEquals(10, config.getTimeoutSeconds());
        assertEquals(10000, config.getTimeoutMillis());
    }

    @Test
    void fromFileMissing() {
        assertThrows(MailConfigurationException.class, () -> MailConfigLoader.fromFile(Paths.get("src/test/resources/cfg/missing.json5")));
    }

    @Test
    void fromFileMalformed() throws Exception {
        Path path = Files.createTempFile("mail", ".json5");
        try {
            Files.writeString(path, "{ SMTP_HOST: ");
            assertThrows(MailConfigurationException.class, () -> MailConfigLoader.fromFile(path));
        } finally {
            Files.deleteIfExists(path);
        }
    }

    @Test
    void invalidPort() {
        MailException e = assertThrows(MailConfigurationException.class, () -> MailConfigLoader.fromMap(Map.of("IMAP_PORT", "imap")));
        assertEquals(MailException.Kind.CONFIGURATION, e.getKind());
        assertTrue(e.getMessage().contains("IMAP_PORT"));
    }

    @Test
    void portOutOfRange() {
        assertThrows(MailConfigurationException.class, () -> MailConfigLoader.fromMap(Map.of("SMTP_PORT", "70000")));
    }

    @Test
    void invalidTimeout() {
        assertThrows(MailConfigurationException.class, () -> MailConfigLoader.fromMap(Map.of("MAIL_TIMEOUT", "0")));
        assertThrows(MailConfigurationException.class, () -> MailConfigLoader.fromMap(Map.of("MAIL_TIMEOUT", "2147484")));
    }

    @ParameterizedTest
    @CsvSource({
            "1, true",
            "true, true",
            "TRUE, true",
            "Yes, true",
            "0, false",
            "false, false",
            "no, false",
            "on, false",
            "enabled, false"
    })
    void parseBoolean(String value, boolean expected) {
        assertEquals(expected, MailConfigLoader.parseBoolean(value, !expected));
    }

    @Test
    void parseBooleanBlank() {
        assertTrue(MailConfigLoader.parseBoolean(null, true));
        assertTrue(MailConfigLoader.parseBoolean("  ", true));
        assertFalse(MailConfigLoader.parseBoolean("", false));
        assertTrue(MailConfigLoader.parseBoolean(" yes ", false));
    }
}
