/**
 * IMAP mailbox sessions.
 *
 * <p>{@link com.mimecast.courier.imap.ImapSession} is the seam the mail service drives,
 * <br>{@link com.mimecast.courier.imap.JakartaImapSession} implements it over a Jakarta Mail store.
 */
package com.mimecast.courier.imap;
