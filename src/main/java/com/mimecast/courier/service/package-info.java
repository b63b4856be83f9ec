/**
 * Mail service facade and its exceptions.
 *
 * <p>{@link com.mimecast.courier.service.MailService} is the entry point for sending and fetching.
 * <br>Failures are {@link com.mimecast.courier.service.MailException} subclasses:
 * <ul>
 *     <li>{@link com.mimecast.courier.service.MailConfigurationException} raised before any network I/O.</li>
 *     <li>{@link com.mimecast.courier.service.MailTransportException} carrying the last server reply where there was one.</li>
 * </ul>
 */
package com.mimecast.courier.service;
