package com.mimecast.courier.mime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class HeaderDecoderTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "=?UTF-8?B?Q2Fmw6k=?=|Café",
            "=?ISO-8859-1?Q?caf=E9?= au lait|café au lait",
            "=?UTF-8?Q?Caf=C3=A9?= ouvert|Café ouvert",
            "Re: =?utf-8?q?r=C3=A9sum=C3=A9?=|Re: résumé",
            "=?UTF-8?B?SGVsbG8=?= =?ISO-8859-1?Q?W=F6rld?=|HelloWörld",
            "=?UTF-8?Q?Hello?= =?UTF-8?Q?_World?=|Hello World",
            "=?x-unknown?B?Q2Fmw6k=?=|Café",
            "=?x-unknown?Q?a_b?=|a b",
            "=?utf-8?Q?caf=C3=A9=ZZ?=|café=ZZ",
            "=?x-unknown?Q?caf=C3=A9=?=|café=",
            "=?x-unknown?B?Q2Fm*w6k=?=|Café"
    })
    void decode(String raw, String expected) {
        assertEquals(expected, HeaderDecoder.decodeHeaderValue(raw));
    }

    @Test
    void badEscapesNeverLeaveEncodedWord() {
        String decoded = HeaderDecoder.decodeHeaderValue("Re: =?utf-8?Q?r=C3=A9sum=C3=A9=G1?=");

        assertEquals("Re: résumé=G1", decoded);
        assertFalse(decoded.contains("=?"));
    }

    @Test
    void lenientQ() {
        assertArrayEquals("a b=\u00e9=4".getBytes(StandardCharsets.ISO_8859_1),
                HeaderDecoder.decodeQ("a_b=3D=E9=4".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void folded() {
        assertEquals("Hello World", HeaderDecoder.decodeHeaderValue("=?UTF-8?Q?Hello?=\r\n =?UTF-8?Q?_World?="));
    }

    @Test
    void ascii() {
        String value = "Quarterly report, draft 2";

        assertEquals(value, HeaderDecoder.decodeHeaderValue(value));
        assertEquals(value, HeaderDecoder.decodeHeaderValue(HeaderDecoder.decodeHeaderValue(value)));
    }

    @Test
    void absent() {
        assertEquals("", HeaderDecoder.decodeHeaderValue(null));
        assertEquals("", HeaderDecoder.decodeHeaderValue(""));
    }
}
