package com.mimecast.courier.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.mimecast.courier.service.MailConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link MailConfig} instances from key/value sources.
 *
 * <p>Supported sources:
 * <ul>
 *   <li>Process environment, see {@link #fromEnvironment()}</li>
 *   <li>Any map of keys to values, see {@link #fromMap(Map)}</li>
 *   <li>A JSON5 file using the same keys, see {@link #fromFile(Path)}</li>
 * </ul>
 *
 * <p>Keys and defaults:
 * <pre>
 * SMTP_HOST, SMTP_PORT (587), SMTP_USE_TLS (true), SMTP_USER, SMTP_PASSWORD, SMTP_FROM,
 * IMAP_HOST, IMAP_PORT (993), IMAP_SSL (true),
 * POP3_HOST, POP3_PORT (995), POP3_SSL (true),
 * MAIL_TIMEOUT (30 seconds)
 * </pre>
 *
 * <p>Boolean values accept case-insensitive 1, true or yes as true and anything else as false.
 * <br>JSON booleans and numbers are accepted as well.
 */
public final class MailConfigLoader {
    private static final Logger log = LogManager.getLogger(MailConfigLoader.class);

    public static final String SMTP_HOST = "SMTP_HOST";
    public static final String SMTP_PORT = "SMTP_PORT";
    public static final String SMTP_USE_TLS = "SMTP_USE_TLS";
    public static final String SMTP_USER = "SMTP_USER";
    public static final String SMTP_PASSWORD = "SMTP_PASSWORD";
    public static final String SMTP_FROM = "SMTP_FROM";
    public static final String IMAP_HOST = "IMAP_HOST";
    public static final String IMAP_PORT = "IMAP_PORT";
    public static final String IMAP_SSL = "IMAP_SSL";
    public static final String POP3_HOST = "POP3_HOST";
    public static final String POP3_PORT = "POP3_PORT";
    public static final String POP3_SSL = "POP3_SSL";
    public static final String MAIL_TIMEOUT = "MAIL_TIMEOUT";

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes");

    private MailConfigLoader() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Reads configuration from the process environment.
     *
     * @return MailConfig instance.
     * @throws MailConfigurationException Invalid value.
     */
    public static MailConfig fromEnvironment() throws MailConfigurationException {
        return fromMap(System.getenv());
    }

    /**
     * Reads configuration from a JSON5 file.
     *
     * @param path File path.
     * @return MailConfig instance.
     * @throws MailConfigurationException Unreadable file or invalid value.
     */
    public static MailConfig fromFile(Path path) throws MailConfigurationException {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MailConfigurationException("Unable to read mail config file: " + path, e);
        }

        Map<String, Object> map;
        try {
            Type type = new TypeToken<Map<String, Object>>() {}.getType();
            map = new Gson().fromJson(content, type);
        } catch (JsonParseException e) {
            throw new MailConfigurationException("Malformed mail config file: " + path, e);
        }

        log.debug("Loaded mail config file: {}", path);
        return fromMap(map != null ? map : new HashMap<>());
    }

    /**
     * Reads configuration from a key/value map.
     *
     * @param source Source map.
     * @return MailConfig instance.
     * @throws MailConfigurationException Invalid value.
     */
    public static MailConfig fromMap(Map<String, ?> source) throws MailConfigurationException {
        Source values = new Source(source);
        try {
            return MailConfig.builder()
                    .smtpHost(values.getString(SMTP_HOST))
                    .smtpPort(values.getInt(SMTP_PORT, MailConfig.DEFAULT_SMTP_PORT))
                    .smtpUseStartTls(values.getBoolean(SMTP_USE_TLS, true))
                    .smtpUser(values.getString(SMTP_USER))
                    .smtpPassword(values.getString(SMTP_PASSWORD))
                    .defaultFrom(values.getString(SMTP_FROM))
                    .imapHost(values.getString(IMAP_HOST))
                    .imapPort(values.getInt(IMAP_PORT, MailConfig.DEFAULT_IMAP_PORT))
                    .imapUseSsl(values.getBoolean(IMAP_SSL, true))
                    .pop3Host(values.getString(POP3_HOST))
                    .pop3Port(values.getInt(POP3_PORT, MailConfig.DEFAULT_POP3_PORT))
                    .pop3UseSsl(values.getBoolean(POP3_SSL, true))
                    .timeoutSeconds(values.getInt(MAIL_TIMEOUT, MailConfig.DEFAULT_TIMEOUT_SECONDS))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new MailConfigurationException(e.getMessage(), e);
        }
    }

    /**
     * Parses a boolean flag.
     *
     * @param value        Raw value.
     * @param defaultValue Value used when raw value is blank.
     * @return Boolean.
     */
    static boolean parseBoolean(String value, boolean defaultValue) {
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        return TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Typed view over a raw map.
     */
    private static final class Source {
        private final Map<String, ?> map;

        Source(Map<String, ?> map) {
            this.map = map;
        }

        String getString(String key) {
            Object value = map.get(key);
            if (value instanceof Double && ((Double) value) % 1 == 0) {
                // Gson reads every JSON number as a double.
                return String.valueOf(((Double) value).longValue());
            }
            return value != null ? value.toString() : null;
        }

        int getInt(String key, int defaultValue) throws MailConfigurationException {
            String value = getString(key);
            if (StringUtils.isBlank(value)) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new MailConfigurationException("Invalid number for " + key + ": " + value, e);
            }
        }

        boolean getBoolean(String key, boolean defaultValue) {
            return parseBoolean(getString(key), defaultValue);
        }
    }
}
