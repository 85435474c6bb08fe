package ai.bundlewatch.backend.health;

import ai.bundlewatch.backend.service.evidence.FhirRestClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.time.Instant;

/**
 * Reports whether the FHIR server answers its capability statement.
 *
 * <p>Responses slower than {@link #SLOW_RESPONSE_TIME_MS} report DEGRADED.
 */
@Component
public class EvidenceSourceHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceSourceHealthIndicator.class);

    static final long SLOW_RESPONSE_TIME_MS = 3000;

    private final FhirRestClient fhirClient;

    @Autowired
    public EvidenceSourceHealthIndicator(FhirRestClient fhirClient) {
        this.fhirClient = fhirClient;
    }

    @Override
    public Health health() {
        Health.Builder healthBuilder = new Health.Builder();
        Instant startTime = Instant.now();
        try {
            JsonNode capabilities = fhirClient.capabilities();
            long responseTimeMs = Duration.between(startTime, Instant.now()).toMillis();

            healthBuilder.status(responseTimeMs > SLOW_RESPONSE_TIME_MS ? "DEGRADED" : "UP")
                    .withDetail("service", "FHIR evidence source")
                    .withDetail("url", fhirClient.getBaseUrl())
                    .withDetail("response_time_ms", responseTimeMs)
                    .withDetail("fhir_version", capabilities.path("fhirVersion").asText("unknown"))
                    .withDetail("software", capabilities.path("software").path("name").asText("unknown"));
        } catch (RestClientException e) {
            logger.warn("FHIR evidence source health check failed: {}", e.getMessage());
            healthBuilder.down()
                    .withDetail("service", "FHIR evidence source")
                    .withDetail("url", fhirClient.getBaseUrl())
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage());
        }
        return healthBuilder.build();
    }
}
