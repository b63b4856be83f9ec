/**
 * MIME handling for outbound and inbound messages.
 *
 * <p>Outbound, {@link com.mimecast.courier.mime.MessageComposer} turns an
 * <br>{@link com.mimecast.courier.mime.OutboundMessage} into RFC 5322 bytes.
 *
 * <p>Inbound, {@link com.mimecast.courier.mime.InboundMessageParser} turns fetched bytes into an
 * <br>{@link com.mimecast.courier.mime.InboundMessage} using:
 * <ul>
 *   <li>{@link com.mimecast.courier.mime.HeaderDecoder} for RFC 2047 encoded-word headers.</li>
 *   <li>{@link com.mimecast.courier.mime.BodyExtractor} for the plain text and HTML pair.</li>
 * </ul>
 *
 * <p>MIME parsing, serialization and word decoding are delegated to Jakarta Mail.
 */
package com.mimecast.courier.mime;
