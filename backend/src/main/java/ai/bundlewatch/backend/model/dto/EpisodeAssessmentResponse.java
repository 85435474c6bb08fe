package ai.bundlewatch.backend.model.dto;

import ai.bundlewatch.backend.model.entity.EpisodeStatus;
import ai.bundlewatch.backend.service.compliance.AdherenceLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Full state of one episode with both adherence figures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EpisodeAssessmentResponse {

    private String episodeId;

    private String patientId;

    private String encounterId;

    private String bundleId;

    private String bundleName;

    private Instant triggerTime;

    private EpisodeStatus status;

    private Integer ageDays;

    private String ageGroup;

    private int totalMet;

    private int totalNotMet;

    private int totalPending;

    private int totalNotApplicable;

    private int totalApplicable;

    /**
     * met / (met + notMet) * 100
     */
    private double adherencePercentage;

    /**
     * met / totalApplicable * 100, pending counted as not yet achieved
     */
    private double overallAdherencePercentage;

    private AdherenceLevel adherenceLevel;

    private List<ElementResultResponse> elements;
}
