package com.mimecast.courier.transport;

import com.mimecast.courier.config.MailConfig;
import com.mimecast.courier.imap.ImapSession;
import com.mimecast.courier.pop3.Pop3Session;
import com.mimecast.courier.smtp.SmtpSession;

import java.io.IOException;

/**
 * Factory handing out prepared sessions.
 */
public class FakeTransportFactory implements TransportFactory {
    private SmtpSession smtp = new RecordingSmtpSession();
    private ImapSession imap = new FakeImapSession();
    private Pop3Session pop3 = new FakePop3Session();

    private int opened;

    public FakeTransportFactory smtp(SmtpSession smtp) {
        this.smtp = smtp;
        return this;
    }

    public FakeTransportFactory imap(ImapSession imap) {
        this.imap = imap;
        return this;
    }

    public FakeTransportFactory pop3(Pop3Session pop3) {
        this.pop3 = pop3;
        return this;
    }

    public int getOpened() {
        return opened;
    }

    @Override
    public SmtpSession openSmtp(MailConfig config) throws IOException {
        opened++;
        return smtp;
    }

    @Override
    public ImapSession openImap(MailConfig config) {
        opened++;
        return imap;
    }

    @Override
    public Pop3Session openPop3(MailConfig config) {
        opened++;
        return pop3;
    }
}
