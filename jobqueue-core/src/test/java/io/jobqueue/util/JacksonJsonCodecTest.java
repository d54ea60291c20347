package io.jobqueue.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JacksonJsonCodecTest {

    record Report(String name, List<Integer> values, Instant at) {
    }

    @Test
    void writesRecordsWithIsoTimestamps() {
        String json = JsonCodec.getDefault().toJson(
            new Report("daily", List.of(3, 1, 2), Instant.parse("2024-03-01T10:00:00Z")));

        assertEquals("{\"name\":\"daily\",\"values\":[3,1,2],\"at\":\"2024-03-01T10:00:00Z\"}", json);
    }

    @Test
    void readsRecordsIgnoringUnknownProperties() {
        Report report = JsonCodec.getDefault().fromJson(
            "{\"name\":\"daily\",\"values\":[1],\"at\":\"2024-03-01T10:00:00Z\",\"legacy\":true}", Report.class);

        assertEquals("daily", report.name());
        assertEquals(List.of(1), report.values());
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), report.at());
    }

    @Test
    void malformedJsonIsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> JsonCodec.getDefault().fromJson("{oops", Report.class));
    }

    @Test
    void nullPayloadIsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> JsonCodec.getDefault().fromJson(null, Report.class));
        assertThrows(IllegalArgumentException.class, () -> JsonCodec.getDefault().fromJson("null", Report.class));
    }
}
