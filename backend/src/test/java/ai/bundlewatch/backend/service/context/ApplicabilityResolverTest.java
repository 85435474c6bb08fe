package ai.bundlewatch.backend.service.context;

import ai.bundlewatch.backend.model.bundle.AgeGroup;
import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.context.PatientContext;
import ai.bundlewatch.backend.model.entity.ElementCheckResult;
import ai.bundlewatch.backend.model.entity.ElementStatus;
import ai.bundlewatch.backend.service.catalog.StaticBundleCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ApplicabilityResolverTest {

    private final StaticBundleCatalog catalog = new StaticBundleCatalog(Set.of());
    private final GuidelineBundle infant = catalog.findBundle(StaticBundleCatalog.FEBRILE_INFANT).orElseThrow();
    private final GuidelineBundle sepsis = catalog.findBundle(StaticBundleCatalog.SEPSIS).orElseThrow();
    private final ApplicabilityResolver resolver = new ApplicabilityResolver();

    @Test
    @DisplayName("22-28 day old with normal markers: LP and antibiotics branch not applicable")
    void resolve_NormalMarkersAt25Days_ShouldBeNotApplicable() {
        PatientContext context = infantContext(25, false);

        Applicability lp = resolver.resolve(infant, infant.findElement("fi_lp_22_28d_im_abnormal").orElseThrow(), context, null);
        Applicability abx = resolver.resolve(infant, infant.findElement("fi_abx_22_28d_im_abnormal").orElseThrow(), context, null);

        assertEquals(Applicability.Decision.NOT_APPLICABLE, lp.getDecision());
        assertEquals("Conditional requirement not met", lp.getReason());
        assertEquals(Applicability.Decision.NOT_APPLICABLE, abx.getDecision());
    }

    @Test
    @DisplayName("22-28 day old with abnormal markers: LP applicable")
    void resolve_AbnormalMarkersAt25Days_ShouldBeApplicable() {
        Applicability lp = resolver.resolve(infant, infant.findElement("fi_lp_22_28d_im_abnormal").orElseThrow(),
                infantContext(25, true), null);

        assertEquals(Applicability.Decision.APPLICABLE, lp.getDecision());
    }

    @Test
    void resolve_ElementForOtherAgeGroup_ShouldBeNotApplicable() {
        Applicability lp = resolver.resolve(infant, infant.findElement("fi_lp_8_21d").orElseThrow(),
                infantContext(25, true), null);

        assertEquals(Applicability.Decision.NOT_APPLICABLE, lp.getDecision());
        assertEquals("Not applicable for age group 22-28", lp.getReason());
    }

    @Test
    void resolve_ExcludedAgeGroup_ShouldMarkEveryElementNotApplicable() {
        PatientContext context = infantContext(5, true);

        for (BundleElement element : infant.getElements()) {
            Applicability applicability = resolver.resolve(infant, element, context, null);
            assertEquals(Applicability.Decision.NOT_APPLICABLE, applicability.getDecision(), element.getElementId());
        }
    }

    @Test
    void resolve_PrerequisitePending_ShouldBeUndecided() {
        BundleElement repeat = sepsis.findElement("sepsis_repeat_lactate").orElseThrow();

        Applicability applicability = resolver.resolve(sepsis, repeat, PatientContext.builder().build(),
                prerequisite(ElementStatus.PENDING, null));

        assertEquals(Applicability.Decision.UNDECIDED, applicability.getDecision());
    }

    @Test
    void resolve_PrerequisiteValueAtThreshold_ShouldBeNotApplicable() {
        BundleElement repeat = sepsis.findElement("sepsis_repeat_lactate").orElseThrow();

        Applicability applicability = resolver.resolve(sepsis, repeat, PatientContext.builder().build(),
                prerequisite(ElementStatus.MET, "2.0"));

        assertEquals(Applicability.Decision.NOT_APPLICABLE, applicability.getDecision());
        assertEquals("Initial value 2.0 <= 2.0 - repeat not required", applicability.getReason());
    }

    @Test
    void resolve_PrerequisiteElevated_ShouldBeApplicable() {
        BundleElement repeat = sepsis.findElement("sepsis_repeat_lactate").orElseThrow();

        Applicability applicability = resolver.resolve(sepsis, repeat, PatientContext.builder().build(),
                prerequisite(ElementStatus.MET, "4.5"));

        assertEquals(Applicability.Decision.APPLICABLE, applicability.getDecision());
    }

    @Test
    void resolve_PrerequisiteNotMet_ShouldBeNotApplicable() {
        BundleElement repeat = sepsis.findElement("sepsis_repeat_lactate").orElseThrow();

        Applicability applicability = resolver.resolve(sepsis, repeat, PatientContext.builder().build(),
                prerequisite(ElementStatus.NOT_MET, null));

        assertEquals(Applicability.Decision.NOT_APPLICABLE, applicability.getDecision());
        assertTrue(applicability.getReason().startsWith("Prerequisite sepsis_lactate not_met"));
    }

    private static PatientContext infantContext(int ageDays, boolean markersAbnormal) {
        return PatientContext.builder()
                .ageDays(ageDays)
                .ageGroup(AgeGroup.fromAgeDays(ageDays))
                .inflammatoryMarkersAbnormal(markersAbnormal)
                .build();
    }

    private static ElementCheckResult prerequisite(ElementStatus status, String value) {
        ElementCheckResult result = new ElementCheckResult();
        result.setElementId("sepsis_lactate");
        result.setStatus(status);
        result.setValue(value);
        return result;
    }
}
