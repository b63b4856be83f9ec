/**
 * Mail client configuration.
 *
 * <p>{@link com.mimecast.courier.config.MailConfig} is the immutable settings holder shared by every call
 * <br>of a {@link com.mimecast.courier.service.MailService}.
 *
 * <p>{@link com.mimecast.courier.config.MailConfigLoader} maps the environment, a plain map or a JSON5 file onto it.
 * <br><b>Example:</b>
 * <pre>
 * {
 *   // Submission.
 *   SMTP_HOST: "smtp.example.com",
 *   SMTP_PORT: 587,
 *   SMTP_USE_TLS: true,
 *   SMTP_USER: "tony@example.com",
 *   SMTP_PASSWORD: "giveHerTheRing",
 *
 *   // Retrieval.
 *   IMAP_HOST: "imap.example.com",
 *   POP3_HOST: "pop.example.com"
 * }
 * </pre>
 */
package com.mimecast.courier.config;
