package ai.bundlewatch.backend.model.dto;

import ai.bundlewatch.backend.model.entity.Episode;
import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Episode header without element results, used for listings and registration replies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EpisodeResponse {

    private String episodeId;

    private String patientId;

    private String encounterId;

    private String bundleId;

    private Instant triggerTime;

    private EpisodeStatus status;

    private Integer ageDays;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * Only set on registration: true when a new episode was created
     */
    private Boolean created;

    public static EpisodeResponse from(Episode episode) {
        return EpisodeResponse.builder()
                .episodeId(episode.getId() != null ? episode.getId().toString() : null)
                .patientId(episode.getPatientId())
                .encounterId(episode.getEncounterId())
                .bundleId(episode.getBundleId())
                .triggerTime(episode.getTriggerTime())
                .status(episode.getStatus())
                .ageDays(episode.getAgeDays())
                .createdAt(episode.getCreatedAt())
                .updatedAt(episode.getUpdatedAt())
                .build();
    }
}
