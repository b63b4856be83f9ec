package com.mimecast.courier.smtp.connection;

import com.mimecast.courier.smtp.SmtpSession;
import com.mimecast.courier.smtp.auth.Login;
import com.mimecast.courier.smtp.auth.Plain;
import com.mimecast.courier.smtp.io.LineInputStream;
import com.mimecast.courier.transport.Outcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.SocketFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * SMTP client connection.
 *
 * <p>Socket level implementation of {@link SmtpSession}.
 * <br>Construction connects and reads the 220 banner.
 * <br>Every command is written as one CRLF terminated line and every reply is read in full,
 * <br>multiline replies included, before the next command.
 *
 * <p>Usage example:
 * <pre>
 * try (SmtpConnection connection = SmtpConnection.open("smtp.example.com", 587, false, 30000)) {
 *     connection.ehlo();
 *     connection.startTls(SSLContext.getDefault());
 *     connection.ehlo();
 *     connection.login("tony@example.com", "giveHerTheRing");
 *     connection.send("tony@example.com", List.of("pepper@example.com"), bytes);
 * }
 * </pre>
 *
 * @see <a href="https://tools.ietf.org/html/rfc5321">RFC 5321 - SMTP</a>
 * @see <a href="https://tools.ietf.org/html/rfc3207">RFC 3207 - STARTTLS</a>
 */
public class SmtpConnection implements SmtpSession {
    private static final Logger log = LogManager.getLogger(SmtpConnection.class);

    private static final byte[] CRLF = {'\r', '\n'};
    private static final int MAX_LINE_LENGTH = 8192;

    private final String host;
    private final int port;
    private final String localName;

    private Socket socket;
    private LineInputStream input;
    private OutputStream output;

    /**
     * EHLO keywords, upper case.
     */
    private final Set<String> extensions = new HashSet<>();

    /**
     * AUTH mechanisms offered, upper case.
     */
    private final Set<String> authMechanisms = new HashSet<>();

    /**
     * Opens a connection.
     *
     * @param host          Server host.
     * @param port          Server port.
     * @param implicitTls   Use TLS from the first byte.
     * @param timeoutMillis Connect and read timeout.
     * @return SmtpConnection instance.
     * @throws IOException Unable to connect, handshake or banner refused.
     */
    public static SmtpConnection open(String host, int port, boolean implicitTls, int timeoutMillis) throws IOException {
        SocketFactory factory;
        if (implicitTls) {
            try {
                factory = SSLContext.getDefault().getSocketFactory();
            } catch (NoSuchAlgorithmException e) {
                throw new SmtpException("No default TLS context", e);
            }
        } else {
            factory = SocketFactory.getDefault();
        }

        return new SmtpConnection(connect(factory, host, port, timeoutMillis), host, port, localName());
    }

    /**
     * Constructs a new SmtpConnection over a connected socket and reads the banner.
     *
     * @param socket    Connected socket.
     * @param host      Server host, used for TLS verification.
     * @param port      Server port.
     * @param localName Name announced in EHLO.
     * @throws IOException Unable to read banner or banner refused.
     */
    public SmtpConnection(Socket socket, String host, int port, String localName) throws IOException {
        this.socket = socket;
        this.host = host;
        this.port = port;
        this.localName = localName;
        buildStreams();

        try {
            SmtpReply banner = read();
            if (!banner.is(220)) {
                throw new SmtpException("Server refused connection", banner);
            }
            log.info("Connected to {}:{}", host, port);
        } catch (IOException e) {
            abort();
            throw e;
        }
    }

    /**
     * Gets EHLO extension keywords.
     *
     * @return Unmodifiable set.
     */
    public Set<String> getExtensions() {
        return Collections.unmodifiableSet(extensions);
    }

    /**
     * Is connection using TLS.
     *
     * @return Boolean.
     */
    public boolean isTls() {
        return socket instanceof SSLSocket;
    }

    @Override
    public void ehlo() throws IOException {
        extensions.clear();
        authMechanisms.clear();

        write("EHLO " + localName);
        SmtpReply reply = read();
        if (!reply.is(250)) {
            write("HELO " + localName);
            reply = read();
            if (!reply.is(250)) {
                throw new SmtpException("Greeting refused", reply);
            }
            return;
        }

        // First line is the server name.
        List<String> lines = reply.getLines();
        for (int i = 1; i < lines.size(); i++) {
            String[] words = lines.get(i).trim().toUpperCase(Locale.ROOT).split("[\\s=]+");
            if (words.length == 0 || words[0].isEmpty()) {
                continue;
            }
            extensions.add(words[0]);
            if (words[0].equals("AUTH")) {
                for (int j = 1; j < words.length; j++) {
                    authMechanisms.add(words[j]);
                }
            }
        }
    }

    @Override
    public void startTls(SSLContext context) throws IOException {
        if (!extensions.contains("STARTTLS")) {
            throw new SmtpException("STARTTLS extension not supported by server");
        }

        write("STARTTLS");
        SmtpReply reply = read();
        if (!reply.is(220)) {
            throw new SmtpException("STARTTLS refused", reply);
        }

        SSLSocketFactory factory = context.getSocketFactory();
        SSLSocket sslSocket = (SSLSocket) factory.createSocket(socket, host, port, true);
        verifyHostname(sslSocket);
        try {
            sslSocket.startHandshake();
        } catch (IOException e) {
            throw new SmtpException("TLS negotiation failed", e);
        }
        socket = sslSocket;
        buildStreams();

        // Server state is reset by the upgrade.
        extensions.clear();
        authMechanisms.clear();
        log.info("TLS negotiation successful: {}:{}", sslSocket.getSession().getProtocol(), sslSocket.getSession().getCipherSuite());
    }

    @Override
    public void login(String username, String password) throws IOException {
        if (!extensions.contains("AUTH")) {
            throw new SmtpException("SMTP AUTH extension not supported by server");
        }

        SmtpReply reply;
        if (authMechanisms.contains("PLAIN")) {
            write("AUTH PLAIN " + new Plain(username, password).getLogin(), "AUTH PLAIN *****");
            reply = read();

        } else if (authMechanisms.contains("LOGIN")) {
            Login login = new Login(username, password);
            write("AUTH LOGIN");
            reply = read();
            if (reply.is(334)) {
                write(login.getUsername());
                reply = read();
            }
            if (reply.is(334)) {
                write(login.getPassword(), "*****");
                reply = read();
            }

        } else {
            throw new SmtpException("No suitable authentication mechanism found in " + authMechanisms);
        }

        if (!reply.is(235)) {
            throw new SmtpException("Authentication failed", reply);
        }
        log.info("Authenticated as {}", username);
    }

    @Override
    public void send(String from, List<String> recipients, byte[] message) throws IOException {
        if (recipients.isEmpty()) {
            throw new SmtpException("No recipients");
        }

        write("MAIL FROM:<" + from + ">");
        SmtpReply reply = read();
        if (!reply.isPositive()) {
            throw new SmtpException("Sender refused", reply);
        }

        for (String recipient : recipients) {
            write("RCPT TO:<" + recipient + ">");
            reply = read();
            if (!reply.isPositive()) {
                throw new SmtpException("Recipient refused: " + recipient, reply);
            }
        }

        write("DATA");
        reply = read();
        if (!reply.is(354)) {
            throw new SmtpException("DATA refused", reply);
        }

        writeData(message);
        reply = read();
        if (!reply.isPositive()) {
            throw new SmtpException("Message refused", reply);
        }
        log.info("Message accepted for {} recipient(s): {}", recipients.size(), reply);
    }

    @Override
    public Outcome quit() {
        if (socket.isClosed()) {
            return Outcome.ok();
        }
        try {
            write("QUIT");
            read();
            socket.close();
            return Outcome.ok();
        } catch (IOException e) {
            log.warn("Graceful close failed: {}", e.getMessage());
            return Outcome.failed("QUIT failed", e);
        }
    }

    @Override
    public void abort() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }

    /**
     * Reads a full reply.
     *
     * @return SmtpReply instance.
     * @throws IOException Unable to read or malformed reply.
     */
    SmtpReply read() throws IOException {
        List<String> lines = new ArrayList<>();
        while (true) {
            byte[] bytes = input.readLine();
            if (bytes == null) {
                throw new SmtpException("Connection closed by server");
            }

            String line = new String(bytes, StandardCharsets.UTF_8);
            log.debug("<< {}", line);
            if (line.length() < 3) {
                throw new SmtpException("Malformed reply: " + line);
            }

            int code;
            try {
                code = Integer.parseInt(line.substring(0, 3));
            } catch (NumberFormatException e) {
                throw new SmtpException("Malformed reply: " + line);
            }

            lines.add(line.length() > 4 ? line.substring(4) : "");
            if (line.length() == 3 || line.charAt(3) != '-') {
                return new SmtpReply(code, lines);
            }
        }
    }

    /**
     * Writes a command.
     *
     * @param command Command line.
     * @throws IOException Unable to write.
     */
    void write(String command) throws IOException {
        write(command, command);
    }

    /**
     * Writes a command logging a masked form.
     *
     * @param command Command line.
     * @param logged  Command as logged.
     * @throws IOException Unable to write.
     */
    private void write(String command, String logged) throws IOException {
        log.debug(">> {}", logged);
        output.write(command.getBytes(StandardCharsets.UTF_8));
        output.write(CRLF);
        output.flush();
    }

    /**
     * Writes message content with dot stuffing and the terminating dot line.
     *
     * @param message Message bytes.
     * @throws IOException Unable to write.
     */
    private void writeData(byte[] message) throws IOException {
        boolean lineStart = true;
        byte previous = 0;
        for (byte b : message) {
            if (lineStart && b == '.') {
                output.write('.');
            }
            // Bare LF becomes CRLF.
            if (b == '\n' && previous != '\r') {
                output.write('\r');
            }
            output.write(b);
            lineStart = b == '\n';
            previous = b;
        }

        if (message.length > 0 && !lineStart) {
            output.write(CRLF);
        }
        output.write(new byte[]{'.', '\r', '\n'});
        output.flush();
        log.debug(">> [{} bytes] .", message.length);
    }

    private void buildStreams() throws IOException {
        input = new LineInputStream(socket.getInputStream(), MAX_LINE_LENGTH);
        output = new BufferedOutputStream(socket.getOutputStream());
    }

    private static void verifyHostname(SSLSocket sslSocket) {
        SSLParameters parameters = sslSocket.getSSLParameters();
        parameters.setEndpointIdentificationAlgorithm("HTTPS");
        sslSocket.setSSLParameters(parameters);
    }

    private static Socket connect(SocketFactory factory, String host, int port, int timeoutMillis) throws IOException {
        Socket socket = factory.createSocket();
        try {
            socket.connect(new InetSocketAddress(host, port), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            if (socket instanceof SSLSocket) {
                verifyHostname((SSLSocket) socket);
                ((SSLSocket) socket).startHandshake();
            }
            return socket;
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    private static String localName() {
        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
