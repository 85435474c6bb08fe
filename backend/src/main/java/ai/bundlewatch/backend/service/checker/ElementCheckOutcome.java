package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.model.entity.ElementStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Decision produced by a checker for one element in one cycle.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ElementCheckOutcome {

    ElementStatus status;

    Instant completedAt;

    String value;

    String notes;

    public static ElementCheckOutcome met(Instant completedAt, String value, String notes) {
        return new ElementCheckOutcome(ElementStatus.MET, completedAt, value, notes);
    }

    public static ElementCheckOutcome notMet(String notes) {
        return new ElementCheckOutcome(ElementStatus.NOT_MET, null, null, notes);
    }

    public static ElementCheckOutcome pending(String notes) {
        return new ElementCheckOutcome(ElementStatus.PENDING, null, null, notes);
    }

    public static ElementCheckOutcome notApplicable(String notes) {
        return new ElementCheckOutcome(ElementStatus.NOT_APPLICABLE, null, null, notes);
    }
}
