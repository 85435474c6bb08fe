package ai.bundlewatch.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-element compliance over a reporting window. Pending results do not count toward the rate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ElementComplianceResponse {

    private String elementId;

    private String elementName;

    private long met;

    private long notMet;

    private long pending;

    private long notApplicable;

    /**
     * met + notMet
     */
    private long totalAssessed;

    /**
     * met / (met + notMet) * 100, one decimal; 0 when nothing was assessed
     */
    private double complianceRate;
}
