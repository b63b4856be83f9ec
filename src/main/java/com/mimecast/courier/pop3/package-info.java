/**
 * POP3 maildrop sessions.
 */
package com.mimecast.courier.pop3;
