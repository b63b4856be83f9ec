/**
 * SMTP socket connection, replies and protocol errors.
 */
package com.mimecast.courier.smtp.connection;
