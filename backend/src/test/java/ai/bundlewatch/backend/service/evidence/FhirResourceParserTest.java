package ai.bundlewatch.backend.service.evidence;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FhirResourceParserTest {

    @Test
    void parseDateTime_ShouldAcceptOffsetLocalAndDateOnlyValues() {
        assertEquals(Instant.parse("2024-03-01T08:00:00Z"), FhirResourceParser.parseDateTime("2024-03-01T10:00:00+02:00"));
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), FhirResourceParser.parseDateTime("2024-03-01T10:00:00"));
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), FhirResourceParser.parseDateTime("2024-03-01"));
    }

    @Test
    void parseDateTime_InvalidOrBlank_ShouldReturnNull() {
        assertNull(FhirResourceParser.parseDateTime("yesterday"));
        assertNull(FhirResourceParser.parseDateTime(" "));
        assertNull(FhirResourceParser.parseDateTime(null));
    }
}
