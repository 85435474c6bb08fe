package ai.bundlewatch.backend.model.bundle;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable bundle definition: a named, ordered set of elements tied to a guideline.
 */
@Value
@Builder
public class GuidelineBundle {

    String bundleId;

    String name;

    String description;

    @Singular
    List<BundleElement> elements;

    /** Age groups excluded from the guideline entirely. */
    @Singular
    Set<AgeGroup> excludedAgeGroups;

    /** ICD-10 prefixes that identify candidate patients. */
    @Singular("triggerConditionPrefix")
    List<String> triggerConditionPrefixes;

    /** Inclusive age limits applied to trigger candidates; null means no limit. */
    Integer minTriggerAgeDays;

    Integer maxTriggerAgeDays;

    public Optional<BundleElement> findElement(String elementId) {
        return elements.stream()
                .filter(element -> element.getElementId().equals(elementId))
                .findFirst();
    }

    /**
     * Whether a candidate of the given age may start an episode. Unknown ages are accepted.
     */
    public boolean acceptsTriggerAge(Integer ageDays) {
        if (ageDays == null) {
            return true;
        }
        if (minTriggerAgeDays != null && ageDays < minTriggerAgeDays) {
            return false;
        }
        return maxTriggerAgeDays == null || ageDays <= maxTriggerAgeDays;
    }

    public boolean isAgeGroupExcluded(AgeGroup ageGroup) {
        return excludedAgeGroups.contains(ageGroup);
    }
}
