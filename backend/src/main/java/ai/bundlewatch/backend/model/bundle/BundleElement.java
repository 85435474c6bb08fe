package ai.bundlewatch.backend.model.bundle;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * One required action within a guideline bundle.
 * Besides the descriptive fields, an element carries the static configuration its checker
 * needs: which evidence codes satisfy it, which age groups and patient conditions it
 * applies to, and which prerequisite element it depends on.
 */
@Value
@Builder(toBuilder = true)
public class BundleElement {

    String elementId;

    String name;

    String description;

    @Builder.Default
    boolean required = true;

    /** Hours after the trigger by which the element must be completed; null means unbounded. */
    Double timeWindowHours;

    DataSource dataSource;

    @Singular
    List<String> resultCodes;

    MedicationCategory medicationCategory;

    NoteCategory noteCategory;

    FebrileInfantAction infantAction;

    /** Empty means the element applies to every age group. */
    @Singular
    Set<AgeGroup> applicableAgeGroups;

    ContextCondition condition;

    ElementDependency dependency;

    @Builder.Default
    DeviationSeverity severity = DeviationSeverity.WARNING;

    String recommendation;

    public boolean hasDependency() {
        return dependency != null;
    }
}
