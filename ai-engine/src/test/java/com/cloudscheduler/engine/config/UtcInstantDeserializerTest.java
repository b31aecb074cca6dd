package com.cloudscheduler.engine.config;

import com.cloudscheduler.common.model.MetricSample;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class UtcInstantDeserializerTest {

    private final ObjectMapper mapper = new EngineConfig().objectMapper();

    private Instant read(String json) throws Exception {
        return mapper.readValue(json, MetricSample.class).timestamp();
    }

    // ── text ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ISO-8601 text")
    class Text {

        @Test
        @DisplayName("no offset → read as UTC, microseconds kept")
        void naiveLocalDateTime() throws Exception {
            assertEquals(Instant.parse("2024-06-01T03:00:00.123456Z"),
                read("{\"timestamp\":\"2024-06-01T03:00:00.123456\"}"));
        }

        @Test
        void naiveWithoutFraction() throws Exception {
            assertEquals(Instant.parse("2024-06-01T03:00:00Z"), read("{\"timestamp\":\"2024-06-01T03:00:00\"}"));
        }

        @Test
        @DisplayName("Z and explicit offsets converted exactly")
        void offsets() throws Exception {
            assertEquals(Instant.parse("2024-06-01T03:00:00Z"), read("{\"timestamp\":\"2024-06-01T03:00:00Z\"}"));
            assertEquals(Instant.parse("2024-06-01T01:00:00Z"),
                read("{\"timestamp\":\"2024-06-01T03:00:00+02:00\"}"));
        }

        @Test
        void blankIsNull() throws Exception {
            assertNull(read("{\"timestamp\":\"  \"}"));
        }

        @Test
        void garbageRejected() {
            assertThrows(InvalidFormatException.class, () -> read("{\"timestamp\":\"yesterday\"}"));
        }
    }

    // ── numbers ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("numbers are epoch seconds")
    void epochSeconds() throws Exception {
        assertEquals(Instant.ofEpochSecond(1_717_200_000L), read("{\"timestamp\":1717200000}"));
        assertEquals(Instant.ofEpochSecond(1_717_200_000L, 500_000_000L), read("{\"timestamp\":1717200000.5}"));
    }

    @Test
    void explicitNullStaysNull() throws Exception {
        assertNull(read("{\"timestamp\":null}"));
    }
}
