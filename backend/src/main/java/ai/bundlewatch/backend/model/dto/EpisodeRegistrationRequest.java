package ai.bundlewatch.backend.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Trigger data for registering an episode by hand.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EpisodeRegistrationRequest {

    @NotBlank(message = "Patient ID is required")
    private String patientId;

    @NotBlank(message = "Encounter ID is required")
    private String encounterId;

    @NotNull(message = "Trigger time is required")
    private Instant triggerTime;

    /**
     * Optional; looked up from the patient's birth date when absent
     */
    @PositiveOrZero(message = "Age in days must not be negative")
    private Integer ageDays;
}
