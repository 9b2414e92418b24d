/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.walstore.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link LogEntryCodec}.
 */
class LogEntryCodecTest {

    private final LogEntryCodec codec = new LogEntryCodec(1024 * 1024);

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testEncode_SingleLineJson() {
        byte[] payload = utf8("line one\nline two\r\n");
        String encoded = new String(codec.encode(new LogEntry(3, 1700000000L, payload)), StandardCharsets.UTF_8);

        assertFalse(encoded.contains("\n"));
        assertTrue(encoded.startsWith("{\"id\":3,\"timestamp\":1700000000,\"data\":\""));
        assertArrayEquals(payload, codec.decode(utf8(encoded)).data());
    }

    @Test
    void testDecode_Base64Payload() {
        LogEntry entry = codec.decode(utf8("{\"id\":1,\"timestamp\":2,\"data\":\"SGVsbG8=\"}"));

        assertEquals(new LogEntry(1, 2, utf8("Hello")), entry);
    }

    @Test
    void testDecode_ByteArrayPayload() {
        LogEntry entry = codec.decode(utf8("{\"id\":1,\"timestamp\":2,\"data\":[72,101,108,108,111]}"));

        assertArrayEquals(utf8("Hello"), entry.data());
    }

    @Test
    void testDecode_HighByteValues() {
        LogEntry entry = codec.decode(utf8("{\"id\":0,\"timestamp\":0,\"data\":[0,127,128,255]}"));

        assertArrayEquals(new byte[]{0, 127, (byte) 128, (byte) 255}, entry.data());
    }

    @Test
    void testDecode_EmptyPayloads() {
        assertEquals(0, codec.decode(utf8("{\"id\":0,\"timestamp\":0,\"data\":\"\"}")).data().length);
        assertEquals(0, codec.decode(utf8("{\"id\":0,\"timestamp\":0,\"data\":[]}")).data().length);
    }

    @Test
    void testDecode_FieldOrderAndExtraFieldsIgnored() {
        LogEntry entry = codec.decode(utf8("{\"data\":\"QQ==\",\"extra\":true,\"timestamp\":9,\"id\":4}"));

        assertEquals(new LogEntry(4, 9, utf8("A")), entry);
    }

    @Test
    void testDecode_Slice() {
        byte[] buf = utf8("garbage{\"id\":8,\"timestamp\":1,\"data\":\"QQ==\"}garbage");

        LogEntry entry = codec.decode(buf, 7, buf.length - 14);

        assertEquals(8L, entry.id());
    }

    @Test
    void testDecode_MaxLongId() {
        LogEntry entry = codec.decode(utf8("{\"id\":" + Long.MAX_VALUE + ",\"timestamp\":0,\"data\":\"\"}"));

        assertEquals(Long.MAX_VALUE, entry.id());
    }

    @ParameterizedTest
    @DisplayName("Malformed lines are rejected")
    @ValueSource(strings = {
            "not json",
            "[]",
            "42",
            "{}",
            "{\"id\":1,\"timestamp\":1}",
            "{\"id\":1,\"data\":\"\"}",
            "{\"timestamp\":1,\"data\":\"\"}",
            "{\"id\":\"1\",\"timestamp\":1,\"data\":\"\"}",
            "{\"id\":1.5,\"timestamp\":1,\"data\":\"\"}",
            "{\"id\":-1,\"timestamp\":1,\"data\":\"\"}",
            "{\"id\":1,\"timestamp\":-5,\"data\":\"\"}",
            "{\"id\":18446744073709551615,\"timestamp\":1,\"data\":\"\"}",
            "{\"id\":1,\"timestamp\":1,\"data\":null}",
            "{\"id\":1,\"timestamp\":1,\"data\":{}}",
            "{\"id\":1,\"timestamp\":1,\"data\":\"@@@@\"}",
            "{\"id\":1,\"timestamp\":1,\"data\":[256]}",
            "{\"id\":1,\"timestamp\":1,\"data\":[-1]}",
            "{\"id\":1,\"timestamp\":1,\"data\":[1.5]}",
            "{\"id\":1,\"timestamp\":1,\"data\":[\"a\"]}",
            "{\"id\":1,\"timestamp\":1,\"data\":\"\"}{\"id\":2,\"timestamp\":1,\"data\":\"\"}",
            "{\"id\":1,\"timestamp\":1,\"data\":\"\"",
            "{\"id\":7,\"timest"
    })
    void testDecode_Rejects(String line) {
        assertThrows(InvalidEntryException.class, () -> codec.decode(utf8(line)));
    }

    @Test
    void testIsTruncated_CutShortVersusInvalid() {
        InvalidEntryException cutShort = assertThrows(InvalidEntryException.class,
                () -> codec.decode(utf8("{\"id\":2,\"timestamp\":1,\"da")));
        InvalidEntryException invalid = assertThrows(InvalidEntryException.class,
                () -> codec.decode(utf8("{\"id\":1,\"timestamp\":1,\"data\":[1,2,300]}")));

        assertTrue(LogEntryCodec.isTruncated(cutShort));
        assertFalse(LogEntryCodec.isTruncated(invalid));
    }

    @Test
    void testDecode_PayloadOverLimit() {
        LogEntryCodec tiny = new LogEntryCodec(2);

        assertArrayEquals(new byte[]{1, 2}, tiny.decode(utf8("{\"id\":0,\"timestamp\":0,\"data\":[1,2]}")).data());
        assertThrows(InvalidEntryException.class,
                () -> tiny.decode(utf8("{\"id\":0,\"timestamp\":0,\"data\":[1,2,3]}")));
        assertThrows(InvalidEntryException.class,
                () -> tiny.decode(utf8("{\"id\":0,\"timestamp\":0,\"data\":\"AQIDBAUG\"}")));
    }

    @Test
    void testLogEntry_ValueEquality() {
        LogEntry a = new LogEntry(1, 2, utf8("x"));
        LogEntry b = new LogEntry(1, 2, utf8("x"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new LogEntry(1, 2, utf8("y")));
        assertEquals(0, new LogEntry(1, 2, null).data().length);
    }
}
