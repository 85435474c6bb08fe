package ai.bundlewatch.backend.service.context;

import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.ElementDependency;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.context.PatientContext;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import org.springframework.stereotype.Component;

/**
 * Gates an element before its checker runs: bundle-level age exclusion, element age
 * groups, context conditions, then prerequisite dependencies.
 */
@Component
public class ApplicabilityResolver {

    /**
     * @param prerequisite the prerequisite element's current result, or null when the element has no dependency
     */
    public Applicability resolve(GuidelineBundle bundle, BundleElement element, PatientContext context,
                                 ElementCheckResult prerequisite) {
        if (bundle.isAgeGroupExcluded(context.getAgeGroup())) {
            return Applicability.notApplicable("Age group " + context.getAgeGroup().getLabel() + " excluded from guideline");
        }

        if (!element.getApplicableAgeGroups().isEmpty()
                && !element.getApplicableAgeGroups().contains(context.getAgeGroup())) {
            return Applicability.notApplicable("Not applicable for age group " + context.getAgeGroup().getLabel());
        }

        if (element.getCondition() != null && !element.getCondition().test(context)) {
            return Applicability.notApplicable("Conditional requirement not met");
        }

        ElementDependency dependency = element.getDependency();
        if (dependency == null) {
            return Applicability.applicable();
        }
        if (prerequisite == null || prerequisite.getStatus() == ElementStatus.PENDING) {
            return Applicability.undecided();
        }
        if (prerequisite.getStatus() != ElementStatus.MET) {
            return Applicability.notApplicable("Prerequisite " + dependency.getDependsOn() + " "
                    + prerequisite.getStatus().name().toLowerCase() + " - not required");
        }
        Double value = prerequisite.numericValue();
        if (!dependency.isSatisfiedBy(value)) {
            return Applicability.notApplicable("Initial value "
                    + (value == null ? "not available" : prerequisite.getValue() + " <= " + dependency.getValueThreshold())
                    + " - repeat not required");
        }
        return Applicability.applicable();
    }
}
