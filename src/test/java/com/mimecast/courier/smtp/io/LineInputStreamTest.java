package com.mimecast.courier.smtp.io;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LineInputStreamTest {

    private static LineInputStream stream(String text, int max) {
        return new LineInputStream(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), max);
    }

    private static String line(LineInputStream stream) throws IOException {
        byte[] bytes = stream.readLine();
        return bytes != null ? new String(bytes, StandardCharsets.UTF_8) : null;
    }

    @Test
    void readLine() throws IOException {
        LineInputStream stream = stream("250-first\r\n250 second\nlast", 100);

        assertEquals("250-first", line(stream));
        assertEquals("250 second", line(stream));
        assertEquals("last", line(stream));
        assertNull(line(stream));
        assertEquals(3, stream.getLineNumber());
    }

    @Test
    void loneCarriageReturnKept() throws IOException {
        LineInputStream stream = stream("a\rb\r\n", 100);

        assertEquals("a\rb", line(stream));
        assertNull(line(stream));
    }

    @Test
    void tooLong() {
        LineInputStream stream = stream("0123456789\r\n", 5);

        assertThrows(IOException.class, stream::readLine);
    }
}
