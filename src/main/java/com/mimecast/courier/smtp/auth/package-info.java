/**
 * Client side SASL mechanisms for SMTP AUTH.
 *
 * <p>PLAIN is preferred when the server offers it, LOGIN otherwise.
 *
 * @see com.mimecast.courier.smtp.auth.Plain
 * @see com.mimecast.courier.smtp.auth.Login
 */
package com.mimecast.courier.smtp.auth;
