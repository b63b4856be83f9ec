package com.mimecast.courier.smtp.io;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Input stream with binary line reading capability.
 *
 * <p>Lines are returned without their CRLF or LF terminator.
 * <br>Lines longer than the configured limit fail the read, a server never needs that many bytes
 * <br>for a reply line.
 */
public class LineInputStream extends BufferedInputStream {

    /**
     * Carriage return byte.
     */
    private static final int CR = 13; // \r

    /**
     * Line feed byte.
     */
    private static final int LF = 10; // \n

    /**
     * Line length limit.
     */
    private final int maxLineLength;

    /**
     * Current line number.
     */
    private int lineNumber = 0;

    /**
     * Reusable line buffer.
     */
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream(512);

    /**
     * Constructs a new LineInputStream instance.
     *
     * @param stream        InputStream instance.
     * @param maxLineLength Line length limit in bytes.
     */
    public LineInputStream(InputStream stream, int maxLineLength) {
        super(stream);
        this.maxLineLength = maxLineLength;
    }

    /**
     * Gets line number.
     *
     * @return Line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * Reads line as byte array.
     *
     * @return Byte array without terminator or null at end of stream.
     * @throws IOException Unable to read or line too long.
     */
    @SuppressWarnings("squid:S1168")
    public byte[] readLine() throws IOException {
        lineBuffer.reset();

        int intByte;
        while ((intByte = read()) != -1) {
            if (intByte == LF) {
                lineNumber++;
                return lineBuffer.toByteArray();
            }

            // CR is dropped only when LF follows.
            if (intByte == CR) {
                mark(1);
                int next = read();
                if (next == LF || next == -1) {
                    lineNumber++;
                    return lineBuffer.toByteArray();
                }
                reset();
            }

            lineBuffer.write(intByte);
            if (lineBuffer.size() > maxLineLength) {
                throw new IOException("Line " + (lineNumber + 1) + " exceeds " + maxLineLength + " bytes");
            }
        }

        // Return null if nothing was read.
        if (lineBuffer.size() == 0) {
            return null;
        }

        lineNumber++;
        return lineBuffer.toByteArray();
    }
}
