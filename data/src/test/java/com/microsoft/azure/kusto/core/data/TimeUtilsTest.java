package com.microsoft.azure.kusto.core.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import com.microsoft.azure.kusto.core.data.exceptions.KustoParseException;

class TimeUtilsTest {
    @ParameterizedTest
    @CsvSource({
            "2023-04-05T10:15:30Z, 2023-04-05T10:15:30Z",
            "2023-04-05T10:15:30.1234567Z, 2023-04-05T10:15:30.1234567Z",
            "2023-04-05t10:15:30z, 2023-04-05T10:15:30Z",
            "2023-04-05T12:15:30+02:00, 2023-04-05T10:15:30Z"
    })
    void parsesServiceDateTimes(String value, String expected) {
        assertEquals(Instant.parse(expected), TimeUtils.parseDateTime(value));
    }

    @ParameterizedTest
    @CsvSource({
            "00:00:01, PT1S",
            "01:02:03, PT1H2M3S",
            "1.00:00:00, PT24H",
            "-00:30:00, PT-30M",
            "00:00:00.1234567, PT0.1234567S",
            "2.03:04:05.5, PT51H4M5.5S",
            "33:21, PT33M21S"
    })
    void parsesTimespans(String value, String expected) {
        assertEquals(Duration.parse(expected), TimeUtils.parseTimespan(value));
    }

    @Test
    void formatsDurationsAsTimespans() {
        assertEquals("00:01:00", TimeUtils.formatDurationAsTimespan(Duration.ofMinutes(1)));
        assertEquals("1.02:00:00", TimeUtils.formatDurationAsTimespan(Duration.ofHours(26)));
        assertEquals("-00:00:01.5000000", TimeUtils.formatDurationAsTimespan(Duration.ofMillis(-1500)));
    }

    @Test
    void blankValuesAreNull() {
        assertNull(TimeUtils.parseDateTime(""));
        assertNull(TimeUtils.parseTimespan(null));
    }

    @Test
    void malformedValuesFail() {
        assertThrows(KustoParseException.class, () -> TimeUtils.parseDateTime("yesterday"));
        assertThrows(KustoParseException.class, () -> TimeUtils.parseTimespan("1 hour"));
    }
}
