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

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * Encodes and decodes {@link LogEntry} instances as single-line JSON objects.
 * <p>
 * <b>Line format:</b>
 * <pre>
 * {"id":0,"timestamp":1767225600,"data":"SGVsbG8="}
 * </pre>
 * {@code data} is written as a Base64 string. On read it may also be a JSON array
 * of unsigned byte values ({@code [72,101,108,108,111]}), which is how some
 * existing log files store payloads.
 * <p>
 * The encoded form never contains a raw newline, so {@code '\n'} is a safe
 * record delimiter.
 */
final class LogEntryCodec {

    static final String FIELD_ID = "id";
    static final String FIELD_TIMESTAMP = "timestamp";
    static final String FIELD_DATA = "data";

    private final ObjectMapper mapper;
    private final int maxPayloadSize;

    /**
     * @param maxPayloadSize the largest payload, in bytes, accepted on decode
     */
    LogEntryCodec(int maxPayloadSize) {
        this.maxPayloadSize = maxPayloadSize;
        // Default string limit is below the Base64 form of a large payload
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxStringLength(base64Length(maxPayloadSize))
                        .build())
                .build();
        this.mapper = new ObjectMapper(factory)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    private static int base64Length(int size) {
        long length = 4L * ((size + 2L) / 3) + 16;
        return (int) Math.min(length, Integer.MAX_VALUE);
    }

    /**
     * Encodes an entry to its line form (without the trailing delimiter).
     *
     * @throws SerializationException if the entry cannot be written as JSON
     */
    byte[] encode(LogEntry entry) {
        ObjectNode node = mapper.createObjectNode();
        node.put(FIELD_ID, entry.id());
        node.put(FIELD_TIMESTAMP, entry.timestamp());
        node.put(FIELD_DATA, entry.data());
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to encode entry " + entry.id(), e);
        }
    }

    /**
     * Decodes one line.
     *
     * @throws InvalidEntryException if the bytes are not a well-formed entry
     */
    LogEntry decode(byte[] buf, int offset, int length) {
        JsonNode node;
        try {
            node = mapper.readTree(buf, offset, length);
        } catch (IOException e) {
            throw new InvalidEntryException("Malformed JSON: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidEntryException("Entry is not a JSON object");
        }

        long id = readUnsigned(node, FIELD_ID);
        long timestamp = readUnsigned(node, FIELD_TIMESTAMP);
        byte[] data = readData(node.get(FIELD_DATA));
        return new LogEntry(id, timestamp, data);
    }

    LogEntry decode(byte[] line) {
        return decode(line, 0, line.length);
    }

    /**
     * Returns true if {@code e} was raised because the input ended in the middle
     * of a JSON value, which is what an interrupted write leaves behind. A
     * complete value that fails validation returns false.
     */
    static boolean isTruncated(InvalidEntryException e) {
        return e.getCause() instanceof JsonEOFException;
    }

    private static long readUnsigned(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber()) {
            throw new InvalidEntryException("Missing or non-integer field '" + field + "'");
        }
        if (!value.canConvertToLong() || value.longValue() < 0) {
            throw new InvalidEntryException("Field '" + field + "' out of range: " + value.asText());
        }
        return value.longValue();
    }

    private byte[] readData(JsonNode value) {
        if (value == null || value.isNull()) {
            throw new InvalidEntryException("Missing field '" + FIELD_DATA + "'");
        }

        if (value.isTextual()) {
            // Base64 expands 3 bytes to 4 chars
            long estimated = (long) value.textValue().length() / 4 * 3;
            if (estimated > maxPayloadSize + 2L) {
                throw payloadTooLarge(estimated);
            }
            byte[] data;
            try {
                data = value.binaryValue();
            } catch (IOException e) {
                throw new InvalidEntryException("Field '" + FIELD_DATA + "' is not valid Base64", e);
            }
            if (data.length > maxPayloadSize) {
                throw payloadTooLarge(data.length);
            }
            return data;
        }

        if (value.isArray()) {
            if (value.size() > maxPayloadSize) {
                throw payloadTooLarge(value.size());
            }
            byte[] data = new byte[value.size()];
            for (int i = 0; i < data.length; i++) {
                JsonNode element = value.get(i);
                if (!element.isIntegralNumber() || !element.canConvertToInt()
                        || element.intValue() < 0 || element.intValue() > 255) {
                    throw new InvalidEntryException(
                            "Field '" + FIELD_DATA + "' element " + i + " is not a byte: " + element);
                }
                data[i] = (byte) element.intValue();
            }
            return data;
        }

        throw new InvalidEntryException("Field '" + FIELD_DATA + "' must be a string or an array");
    }

    private InvalidEntryException payloadTooLarge(long size) {
        return new InvalidEntryException(
                "Payload too large: " + size + " bytes (max: " + maxPayloadSize + ")");
    }
}
