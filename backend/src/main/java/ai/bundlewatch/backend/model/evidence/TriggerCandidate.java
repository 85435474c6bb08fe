package ai.bundlewatch.backend.model.evidence;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A patient newly matching a bundle's entry criteria.
 */
@Value
@Builder
public class TriggerCandidate {

    @NotBlank(message = "patientId is required")
    String patientId;

    @NotBlank(message = "encounterId is required")
    String encounterId;

    String conditionCode;

    @NotNull(message = "triggerTime is required")
    Instant onsetTime;

    /** Age at onset, when known. */
    Integer ageDays;
}
