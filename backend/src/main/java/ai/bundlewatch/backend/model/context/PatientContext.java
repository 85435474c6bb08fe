package ai.bundlewatch.backend.model.context;

import ai.bundlewatch.backend.model.bundle.AgeGroup;
import lombok.Builder;
import lombok.Value;

/**
 * Facts needed for conditional branching, rebuilt at the start of every evaluation cycle.
 */
@Value
@Builder
public class PatientContext {

    Integer ageDays;

    @Builder.Default
    AgeGroup ageGroup = AgeGroup.UNKNOWN;

    boolean inflammatoryMarkersAbnormal;

    boolean uaAbnormal;

    boolean lpPerformed;

    boolean dispositionHome;
}
