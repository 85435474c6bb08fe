package ai.bundlewatch.backend.health;

import ai.bundlewatch.backend.service.evidence.FhirRestClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.web.client.ResourceAccessException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EvidenceSourceHealthIndicatorTest {

    @Mock
    private FhirRestClient fhirClient;

    private EvidenceSourceHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new EvidenceSourceHealthIndicator(fhirClient);
        when(fhirClient.getBaseUrl()).thenReturn("http://fhir.test/fhir");
    }

    @Test
    void health_WhenServerAnswers_ShouldBeUpWithVersion() {
        // Arrange
        ObjectNode capabilities = new ObjectMapper().createObjectNode();
        capabilities.put("fhirVersion", "4.0.1");
        capabilities.putObject("software").put("name", "HAPI FHIR Server");
        when(fhirClient.capabilities()).thenReturn(capabilities);

        // Act
        Health health = healthIndicator.health();

        // Assert
        assertEquals(Status.UP, health.getStatus());
        assertEquals("4.0.1", health.getDetails().get("fhir_version"));
        assertEquals("HAPI FHIR Server", health.getDetails().get("software"));
        assertEquals("http://fhir.test/fhir", health.getDetails().get("url"));
        assertTrue(health.getDetails().containsKey("response_time_ms"));
    }

    @Test
    void health_WhenServerUnreachable_ShouldBeDown() {
        when(fhirClient.capabilities()).thenThrow(new ResourceAccessException("Connection refused"));

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("ResourceAccessException", health.getDetails().get("error"));
        assertEquals("Connection refused", health.getDetails().get("message"));
    }
}
