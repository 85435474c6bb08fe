package ai.bundlewatch.backend.model.dto;

import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ElementResultResponse {

    private String elementId;

    private String elementName;

    private boolean required;

    private ElementStatus status;

    private Double timeWindowHours;

    private Instant deadline;

    private Instant completedAt;

    private String value;

    private String notes;

    public static ElementResultResponse from(ElementCheckResult result) {
        return ElementResultResponse.builder()
                .elementId(result.getElementId())
                .elementName(result.getElementName())
                .required(result.isRequired())
                .status(result.getStatus())
                .timeWindowHours(result.getTimeWindowHours())
                .deadline(result.getDeadline())
                .completedAt(result.getCompletedAt())
                .value(result.getValue())
                .notes(result.getNotes())
                .build();
    }
}
