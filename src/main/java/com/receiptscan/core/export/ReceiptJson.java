package com.receiptscan.core.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.receiptscan.core.scan.ReceiptRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Плоский JSON для слоя хранения: snake_case, даты yyyy-MM-dd,
 * суммы строками с фиксированной точкой, extracted_at в ISO-8601.
 */
public final class ReceiptJson {
    private ReceiptJson() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true)
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(ReceiptRecord r) {
        try {
            return MAPPER.writeValueAsString(r);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize receipt", e);
        }
    }

    public static ReceiptRecord fromJson(String json) {
        try {
            return MAPPER.readValue(json, ReceiptRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed receipt JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static List<ReceiptRecord> listFromJson(String json) {
        try {
            return MAPPER.readValue(json, new TypeReference<List<ReceiptRecord>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed receipt JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Массив записей, с отступами. */
    public static void writeAll(List<ReceiptRecord> records, Writer out) {
        try {
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, records);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write receipts JSON", e);
        }
    }
}
