package ai.bundlewatch.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Compliance report for one bundle over a trailing window of days.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceReportResponse {

    private String bundleId;

    private String bundleName;

    private int days;

    private Instant since;

    /**
     * Episode counts keyed by episode status
     */
    private Map<String, Long> episodeCounts;

    private List<ElementComplianceResponse> elements;
}
