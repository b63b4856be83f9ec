/**
 * SMTP submission client.
 *
 * <p>{@link com.mimecast.courier.smtp.SmtpSession} is the seam the mail service drives,
 * <br>the socket level implementation lives in {@link com.mimecast.courier.smtp.connection}.
 *
 * @see <a href="https://tools.ietf.org/html/rfc5321">RFC 5321</a>
 */
package com.mimecast.courier.smtp;
