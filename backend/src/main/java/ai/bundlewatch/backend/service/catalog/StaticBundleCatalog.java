package ai.bundlewatch.backend.service.catalog;

import ai.bundlewatch.backend.config.ClinicalCodes;
import ai.bundlewatch.backend.model.bundle.AgeGroup;
import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.ContextCondition;
import ai.bundlewatch.backend.model.bundle.DataSource;
import ai.bundlewatch.backend.model.bundle.DeviationSeverity;
import ai.bundlewatch.backend.model.bundle.ElementDependency;
import ai.bundlewatch.backend.model.bundle.FebrileInfantAction;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import ai.bundlewatch.backend.model.bundle.MedicationCategory;
import ai.bundlewatch.backend.model.bundle.NoteCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bundle definitions compiled into the application.
 * {@code adherence.bundles.enabled} selects which of them the monitor runs.
 */
@Component
public class StaticBundleCatalog implements BundleCatalog {

    private static final Logger logger = LoggerFactory.getLogger(StaticBundleCatalog.class);

    public static final String SEPSIS = "sepsis_peds_2024";
    public static final String FEBRILE_INFANT = "febrile_infant_2024";
    public static final String FEBRILE_NEUTROPENIA = "fn_peds_2024";
    public static final String SSTI = "ssti_peds_2024";
    public static final String PNEUMONIA = "cap_peds_2024";
    public static final String UTI = "uti_peds_2024";
    public static final String SURGICAL_PROPHYLAXIS = "surgical_prophy_2024";

    private final Map<String, GuidelineBundle> bundles;
    private final List<GuidelineBundle> enabledBundles;

    public StaticBundleCatalog(@Value("${adherence.bundles.enabled:sepsis_peds_2024,febrile_infant_2024}") Set<String> enabledIds) {
        Map<String, GuidelineBundle> all = new LinkedHashMap<>();
        for (GuidelineBundle bundle : List.of(sepsisBundle(), pneumoniaBundle(), utiBundle(), sstiBundle(),
                surgicalProphylaxisBundle(), febrileNeutropeniaBundle(), febrileInfantBundle())) {
            all.put(bundle.getBundleId(), bundle);
        }
        this.bundles = Collections.unmodifiableMap(all);

        List<GuidelineBundle> enabled = new ArrayList<>();
        for (GuidelineBundle bundle : all.values()) {
            if (enabledIds.contains(bundle.getBundleId())) {
                enabled.add(bundle);
            }
        }
        for (String id : enabledIds) {
            if (!all.containsKey(id)) {
                logger.warn("Ignoring unknown bundle in adherence.bundles.enabled: {}", id);
            }
        }
        this.enabledBundles = List.copyOf(enabled);
        logger.info("Bundle catalog loaded {} bundle(s), {} enabled", bundles.size(), enabledBundles.size());
    }

    @Override
    public Optional<GuidelineBundle> findBundle(String bundleId) {
        return Optional.ofNullable(bundles.get(bundleId));
    }

    @Override
    public List<GuidelineBundle> getAllBundles() {
        return List.copyOf(bundles.values());
    }

    @Override
    public List<GuidelineBundle> getEnabledBundles() {
        return enabledBundles;
    }

    // Pediatric sepsis (Surviving Sepsis Campaign 2020)

    static GuidelineBundle sepsisBundle() {
        return GuidelineBundle.builder()
                .bundleId(SEPSIS)
                .name("Pediatric Sepsis Bundle")
                .description("Evidence-based bundle for recognition and treatment of pediatric sepsis")
                .triggerConditionPrefixes(List.of("A41", "A40", "R65.2", "P36"))
                .element(BundleElement.builder()
                        .elementId("sepsis_blood_cx")
                        .name("Blood culture obtained")
                        .description("Blood culture collected before or within 1 hour of antibiotics")
                        .timeWindowHours(1.0)
                        .dataSource(DataSource.LAB)
                        .resultCode(ClinicalCodes.LOINC_BLOOD_CULTURE)
                        .recommendation("Obtain blood cultures before antibiotics if not already collected.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("sepsis_lactate")
                        .name("Lactate measured")
                        .description("Serum lactate obtained within 3 hours of sepsis recognition")
                        .timeWindowHours(3.0)
                        .dataSource(DataSource.LAB)
                        .resultCode(ClinicalCodes.LOINC_LACTATE)
                        .recommendation("Obtain serum lactate to assess severity and guide resuscitation.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("sepsis_abx_1hr")
                        .name("Antibiotics within 1 hour")
                        .description("Broad-spectrum antibiotics administered within 1 hour of recognition")
                        .timeWindowHours(1.0)
                        .dataSource(DataSource.MEDICATION)
                        .medicationCategory(MedicationCategory.BROAD_SPECTRUM_ANTIBIOTIC)
                        .severity(DeviationSeverity.CRITICAL)
                        .recommendation("Administer broad-spectrum antibiotics immediately.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("sepsis_fluid_bolus")
                        .name("Fluid resuscitation initiated")
                        .description("IV fluid bolus (20 mL/kg) initiated within 1 hour if hypotensive/hypoperfused")
                        .timeWindowHours(1.0)
                        .dataSource(DataSource.MEDICATION)
                        .medicationCategory(MedicationCategory.CRYSTALLOID_BOLUS)
                        .recommendation("Initiate fluid resuscitation (20 mL/kg crystalloid bolus).")
                        .build())
                .element(BundleElement.builder()
                        .elementId("sepsis_repeat_lactate")
                        .name("Repeat lactate if initially elevated")
                        .description("Repeat lactate within 6 hours if initial lactate >2 mmol/L")
                        .required(false)
                        .timeWindowHours(6.0)
                        .dataSource(DataSource.LAB)
                        .resultCode(ClinicalCodes.LOINC_LACTATE)
                        .dependency(ElementDependency.of("sepsis_lactate", ClinicalCodes.LACTATE_ELEVATED_MMOL_L))
                        .recommendation("Repeat lactate to assess response to treatment.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("sepsis_reassess_48h")
                        .name("Antibiotic reassessment at 48 hours")
                        .description("Documented reassessment of antibiotic therapy at 48-72 hours")
                        .timeWindowHours(72.0)
                        .dataSource(DataSource.NOTE)
                        .noteCategory(NoteCategory.REASSESSMENT)
                        .recommendation("Document antibiotic reassessment in clinical notes.")
                        .build())
                .build();
    }

    // Febrile infant 8-60 days (AAP 2021)

    static GuidelineBundle febrileInfantBundle() {
        Set<AgeGroup> neonatal = Set.of(AgeGroup.DAYS_8_21, AgeGroup.DAYS_22_28);
        return GuidelineBundle.builder()
                .bundleId(FEBRILE_INFANT)
                .name("Febrile Infant Bundle (0-60 days)")
                .description("Evidence-based bundle for evaluation of well-appearing febrile infants 8-60 days old (AAP 2021)")
                .triggerConditionPrefixes(List.of("R50", "P81.9"))
                .excludedAgeGroup(AgeGroup.DAYS_0_7)
                .minTriggerAgeDays(8)
                .maxTriggerAgeDays(60)
                .element(infantElement("fi_ua", "Urinalysis obtained",
                        "Urinalysis performed via catheter or suprapubic aspiration", 2.0, FebrileInfantAction.URINALYSIS)
                        .resultCodes(List.of(ClinicalCodes.LOINC_UA, ClinicalCodes.LOINC_UA_WBC, ClinicalCodes.LOINC_UA_LE))
                        .recommendation("Obtain urinalysis via catheter or suprapubic aspiration.")
                        .build())
                .element(infantElement("fi_blood_culture", "Blood culture obtained",
                        "Blood culture obtained prior to antibiotics", 2.0, FebrileInfantAction.BLOOD_CULTURE)
                        .resultCode(ClinicalCodes.LOINC_BLOOD_CULTURE)
                        .recommendation("Obtain blood culture prior to antibiotic administration.")
                        .build())
                .element(infantElement("fi_inflammatory_markers", "Inflammatory markers obtained",
                        "ANC and CRP obtained; procalcitonin recommended for 29-60 days", 2.0,
                        FebrileInfantAction.INFLAMMATORY_MARKERS)
                        .resultCodes(List.of(ClinicalCodes.LOINC_ANC, ClinicalCodes.LOINC_CRP))
                        .recommendation("Obtain ANC and CRP. Consider procalcitonin if 29-60 days old.")
                        .build())
                .element(infantElement("fi_procalcitonin", "Procalcitonin obtained (29-60 days)",
                        "Procalcitonin recommended for infants 29-60 days; most useful if fever onset >6 hours", 2.0,
                        FebrileInfantAction.PROCALCITONIN)
                        .required(false)
                        .resultCode(ClinicalCodes.LOINC_PROCALCITONIN)
                        .applicableAgeGroup(AgeGroup.DAYS_29_60)
                        .recommendation("Procalcitonin recommended for infants 29-60 days (most useful if fever >6h).")
                        .build())
                .element(infantElement("fi_urine_culture", "Urine culture obtained (UA abnormal)",
                        "Urine culture sent when urinalysis is abnormal", 2.0, FebrileInfantAction.URINE_CULTURE)
                        .resultCode(ClinicalCodes.LOINC_URINE_CULTURE)
                        .condition(ContextCondition.UA_ABNORMAL)
                        .recommendation("Send urine culture for abnormal urinalysis.")
                        .build())
                .element(infantElement("fi_lp_8_21d", "LP performed (8-21 days)",
                        "Lumbar puncture required for all febrile infants 8-21 days", 2.0,
                        FebrileInfantAction.LUMBAR_PUNCTURE)
                        .resultCodes(List.of(ClinicalCodes.LOINC_CSF_WBC, ClinicalCodes.LOINC_CSF_RBC))
                        .applicableAgeGroup(AgeGroup.DAYS_8_21)
                        .recommendation("LP required for all febrile infants 8-21 days per AAP 2021.")
                        .build())
                .element(infantElement("fi_lp_22_28d_im_abnormal", "LP performed (22-28 days, IMs abnormal)",
                        "LP required if inflammatory markers abnormal in 22-28 day old", 2.0,
                        FebrileInfantAction.LUMBAR_PUNCTURE)
                        .resultCodes(List.of(ClinicalCodes.LOINC_CSF_WBC, ClinicalCodes.LOINC_CSF_RBC))
                        .applicableAgeGroup(AgeGroup.DAYS_22_28)
                        .condition(ContextCondition.INFLAMMATORY_MARKERS_ABNORMAL)
                        .recommendation("LP required for 22-28 day old with abnormal inflammatory markers.")
                        .build())
                .element(infantElement("fi_abx_8_21d", "Parenteral antibiotics (8-21 days)",
                        "Start parenteral antimicrobials for all febrile infants 8-21 days", 1.0,
                        FebrileInfantAction.PARENTERAL_ANTIBIOTICS)
                        .applicableAgeGroup(AgeGroup.DAYS_8_21)
                        .severity(DeviationSeverity.CRITICAL)
                        .recommendation("Start parenteral antibiotics for febrile infants 8-21 days.")
                        .build())
                .element(infantElement("fi_abx_22_28d_im_abnormal", "Parenteral antibiotics (22-28 days, IMs abnormal)",
                        "Start empiric parenteral antimicrobials if inflammatory markers abnormal", 1.0,
                        FebrileInfantAction.PARENTERAL_ANTIBIOTICS)
                        .applicableAgeGroup(AgeGroup.DAYS_22_28)
                        .condition(ContextCondition.INFLAMMATORY_MARKERS_ABNORMAL)
                        .severity(DeviationSeverity.CRITICAL)
                        .recommendation("Start parenteral antibiotics for abnormal inflammatory markers.")
                        .build())
                .element(infantElement("fi_hsv_risk_assessment", "HSV risk assessment",
                        "Consider HSV risk factors and need for acyclovir (8-28 days)", 4.0,
                        FebrileInfantAction.HSV_ASSESSMENT)
                        .applicableAgeGroups(neonatal)
                        .recommendation("Document HSV risk assessment. Consider acyclovir if risk factors present.")
                        .build())
                .element(infantElement("fi_admit_8_21d", "Hospital admission (8-21 days)",
                        "Admit to hospital for all febrile infants 8-21 days", null, FebrileInfantAction.ADMISSION)
                        .applicableAgeGroup(AgeGroup.DAYS_8_21)
                        .recommendation("Hospital admission required for all febrile infants 8-21 days.")
                        .build())
                .element(infantElement("fi_admit_22_28d_im_abnormal", "Hospital admission (22-28 days, IMs abnormal)",
                        "Admit to hospital if inflammatory markers abnormal", null, FebrileInfantAction.ADMISSION)
                        .applicableAgeGroup(AgeGroup.DAYS_22_28)
                        .condition(ContextCondition.INFLAMMATORY_MARKERS_ABNORMAL)
                        .recommendation("Hospital admission required for abnormal inflammatory markers.")
                        .build())
                .element(infantElement("fi_safe_discharge_checklist", "Safe discharge checklist",
                        "If discharging: documented follow-up within 24h, working phone number, reliable transportation",
                        null, FebrileInfantAction.DISCHARGE_CHECKLIST)
                        .required(false)
                        .condition(ContextCondition.DISPOSITION_HOME)
                        .recommendation("Document follow-up plan, contact information, and return precautions.")
                        .build())
                .build();
    }

    private static BundleElement.BundleElementBuilder infantElement(String id, String name, String description,
                                                                    Double windowHours, FebrileInfantAction action) {
        return BundleElement.builder()
                .elementId(id)
                .name(name)
                .description(description)
                .timeWindowHours(windowHours)
                .dataSource(DataSource.AGE_STRATIFIED)
                .infantAction(action);
    }

    // Febrile neutropenia (IDSA, COG supportive care)

    static GuidelineBundle febrileNeutropeniaBundle() {
        return GuidelineBundle.builder()
                .bundleId(FEBRILE_NEUTROPENIA)
                .name("Pediatric Febrile Neutropenia Bundle")
                .description("Evidence-based bundle for management of febrile neutropenia")
                .triggerConditionPrefixes(List.of("D70"))
                .element(BundleElement.builder()
                        .elementId("fn_blood_cx_peripheral")
                        .name("Peripheral blood culture obtained")
                        .description("Blood culture from peripheral site")
                        .timeWindowHours(1.0)
                        .dataSource(DataSource.LAB)
                        .resultCode(ClinicalCodes.LOINC_BLOOD_CULTURE)
                        .build())
                .element(BundleElement.builder()
                        .elementId("fn_blood_cx_central")
                        .name("Central line blood culture (if present)")
                        .description("Blood culture from central line if patient has CVC")
                        .required(false)
                        .timeWindowHours(1.0)
                        .dataSource(DataSource.LAB)
                        .resultCode(ClinicalCodes.LOINC_BLOOD_CULTURE)
                        .build())
                .element(BundleElement.builder()
                        .elementId("fn_abx_1hr")
                        .name("Empiric antibiotics within 1 hour")
                        .description("Broad-spectrum empiric therapy initiated within 1 hour of fever")
                        .timeWindowHours(1.0)
                        .dataSource(DataSource.MEDICATION)
                        .medicationCategory(MedicationCategory.BROAD_SPECTRUM_ANTIBIOTIC)
                        .severity(DeviationSeverity.CRITICAL)
                        .build())
                .element(BundleElement.builder()
                        .elementId("fn_abx_appropriate")
                        .name("Appropriate empiric regimen")
                        .description("Antipseudomonal beta-lactam monotherapy or per protocol")
                        .timeWindowHours(1.0)
                        .dataSource(DataSource.MEDICATION)
                        .medicationCategory(MedicationCategory.ANTIPSEUDOMONAL_BETA_LACTAM)
                        .recommendation("Start cefepime, piperacillin-tazobactam or meropenem per protocol.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("fn_risk_stratification")
                        .name("Risk stratification performed")
                        .description("High vs low risk assessment documented")
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.NOTE)
                        .noteCategory(NoteCategory.RISK_STRATIFICATION)
                        .build())
                .element(BundleElement.builder()
                        .elementId("fn_daily_assessment")
                        .name("Daily reassessment documented")
                        .description("Daily assessment of need for continued antibiotics")
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.NOTE)
                        .noteCategory(NoteCategory.GENERIC)
                        .build())
                .build();
    }

    // Skin and soft tissue infection (IDSA 2014)

    static GuidelineBundle sstiBundle() {
        return GuidelineBundle.builder()
                .bundleId(SSTI)
                .name("Pediatric Skin and Soft Tissue Infection Bundle")
                .description("Evidence-based bundle for management of pediatric SSTI including cellulitis and abscess")
                .triggerConditionPrefixes(List.of("L03", "L02"))
                .element(BundleElement.builder()
                        .elementId("ssti_margins_marked")
                        .name("Cellulitis margins marked")
                        .description("Borders of cellulitis marked to monitor progression")
                        .timeWindowHours(12.0)
                        .dataSource(DataSource.NOTE)
                        .noteCategory(NoteCategory.MARGIN_MARKING)
                        .build())
                .element(BundleElement.builder()
                        .elementId("ssti_mrsa_coverage")
                        .name("MRSA coverage if indicated")
                        .description("Antibiotic with MRSA activity if purulent or MRSA risk factors")
                        .required(false)
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.MEDICATION)
                        .build())
                .element(BundleElement.builder()
                        .elementId("ssti_id_no_purulence")
                        .name("I&D performed if purulent/abscess")
                        .description("Incision and drainage performed for abscess or purulent collection")
                        .required(false)
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.PROCEDURE)
                        .build())
                .element(BundleElement.builder()
                        .elementId("ssti_culture_purulent")
                        .name("Wound culture if I&D performed")
                        .description("Culture obtained from drained purulent material")
                        .required(false)
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.LAB)
                        .resultCode(ClinicalCodes.LOINC_WOUND_CULTURE)
                        .build())
                .element(BundleElement.builder()
                        .elementId("ssti_no_abx_simple_abscess")
                        .name("No antibiotics for simple abscess (post-I&D)")
                        .description("Simple abscess treated with I&D alone (no antibiotics) per guidelines")
                        .required(false)
                        .dataSource(DataSource.MEDICATION)
                        .build())
                .element(BundleElement.builder()
                        .elementId("ssti_reassess_48h")
                        .name("Clinical reassessment at 48-72h")
                        .description("Documented reassessment of clinical response")
                        .timeWindowHours(72.0)
                        .dataSource(DataSource.NOTE)
                        .noteCategory(NoteCategory.REASSESSMENT)
                        .build())
                .build();
    }

    // Community-acquired pneumonia, older than 3 months (PIDS/IDSA 2011)

    static GuidelineBundle pneumoniaBundle() {
        return GuidelineBundle.builder()
                .bundleId(PNEUMONIA)
                .name("Pediatric Community-Acquired Pneumonia Bundle")
                .description("Evidence-based bundle for treatment of pediatric CAP (>3 months)")
                .triggerConditionPrefixes(List.of("J13", "J14", "J15", "J16", "J17", "J18"))
                .minTriggerAgeDays(90)
                .element(BundleElement.builder()
                        .elementId("cap_cxr")
                        .name("Chest radiograph obtained")
                        .description("Chest X-ray performed to confirm pneumonia diagnosis")
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.IMAGING)
                        .build())
                .element(BundleElement.builder()
                        .elementId("cap_pulse_ox")
                        .name("Oxygen saturation documented")
                        .description("SpO2 measured and documented")
                        .timeWindowHours(4.0)
                        .dataSource(DataSource.VITALS)
                        .build())
                .element(BundleElement.builder()
                        .elementId("cap_abx_appropriate")
                        .name("Appropriate empiric antibiotic")
                        .description("First-line antibiotic per guidelines (ampicillin/amoxicillin for typical)")
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.MEDICATION)
                        .medicationCategory(MedicationCategory.FIRST_LINE_PNEUMONIA_ANTIBIOTIC)
                        .recommendation("Use ampicillin or amoxicillin unless an exception is documented.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("cap_blood_cx_severe")
                        .name("Blood culture if severe/complicated")
                        .description("Blood culture for patients with severe pneumonia or empyema")
                        .required(false)
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.LAB)
                        .resultCode(ClinicalCodes.LOINC_BLOOD_CULTURE)
                        .build())
                .element(BundleElement.builder()
                        .elementId("cap_duration_appropriate")
                        .name("Treatment duration 7 days or less (uncomplicated)")
                        .description("Antibiotic duration 5-7 days for uncomplicated CAP")
                        .dataSource(DataSource.MEDICATION)
                        .build())
                .element(BundleElement.builder()
                        .elementId("cap_followup_arranged")
                        .name("Follow-up arranged")
                        .description("Follow-up visit scheduled or communicated for clinical reassessment")
                        .required(false)
                        .dataSource(DataSource.SCHEDULING)
                        .build())
                .build();
    }

    // Urinary tract infection (AAP 2011, reaffirmed 2016)

    static GuidelineBundle utiBundle() {
        return GuidelineBundle.builder()
                .bundleId(UTI)
                .name("Pediatric Urinary Tract Infection Bundle")
                .description("Evidence-based bundle for diagnosis and treatment of pediatric UTI")
                .triggerConditionPrefixes(List.of("N39.0", "N10", "N11", "N12", "N30"))
                .element(BundleElement.builder()
                        .elementId("uti_ua_obtained")
                        .name("Urinalysis obtained")
                        .description("Urinalysis performed before or at time of treatment")
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.LAB)
                        .resultCodes(List.of(ClinicalCodes.LOINC_UA, ClinicalCodes.LOINC_UA_WBC, ClinicalCodes.LOINC_UA_LE))
                        .recommendation("Obtain urinalysis before starting antibiotics.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("uti_culture_obtained")
                        .name("Urine culture obtained")
                        .description("Urine culture collected via appropriate method (cath/clean catch)")
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.LAB)
                        .resultCode(ClinicalCodes.LOINC_URINE_CULTURE)
                        .recommendation("Send urine culture by catheter or clean catch.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("uti_culture_positive")
                        .name("Culture confirms diagnosis")
                        .description("Urine culture positive with appropriate colony count")
                        .timeWindowHours(72.0)
                        .dataSource(DataSource.MICROBIOLOGY)
                        .build())
                .element(BundleElement.builder()
                        .elementId("uti_empiric_appropriate")
                        .name("Appropriate empiric antibiotic")
                        .description("Empiric antibiotic based on local resistance patterns")
                        .timeWindowHours(24.0)
                        .dataSource(DataSource.MEDICATION)
                        .medicationCategory(MedicationCategory.UTI_EMPIRIC_ANTIBIOTIC)
                        .recommendation("Start cephalexin, cefixime, TMP-SMX or nitrofurantoin per local resistance.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("uti_narrowed_to_culture")
                        .name("Therapy narrowed to culture results")
                        .description("Antibiotic adjusted based on culture and susceptibility")
                        .timeWindowHours(96.0)
                        .dataSource(DataSource.MEDICATION)
                        .build())
                .element(BundleElement.builder()
                        .elementId("uti_rbus_febrile")
                        .name("Renal ultrasound if febrile UTI")
                        .description("RBUS for first febrile UTI in children <2 years")
                        .required(false)
                        .timeWindowHours(48.0)
                        .dataSource(DataSource.IMAGING)
                        .build())
                .element(BundleElement.builder()
                        .elementId("uti_vcug_considered")
                        .name("VCUG consideration documented")
                        .description("VCUG discussed/ordered if abnormal RBUS or recurrent febrile UTI")
                        .required(false)
                        .dataSource(DataSource.NOTE)
                        .noteCategory(NoteCategory.GENERIC)
                        .build())
                .build();
    }

    // Surgical antimicrobial prophylaxis (ASHP/IDSA/SHEA/SIS 2013)

    /**
     * Triggered by procedure codes rather than diagnoses, so the trigger finder never proposes
     * these episodes; they are registered directly with the trigger time set to the opening of
     * the pre-incision dosing window.
     */
    static GuidelineBundle surgicalProphylaxisBundle() {
        return GuidelineBundle.builder()
                .bundleId(SURGICAL_PROPHYLAXIS)
                .name("Surgical Antimicrobial Prophylaxis Bundle")
                .description("Evidence-based bundle for appropriate surgical antimicrobial prophylaxis")
                .element(BundleElement.builder()
                        .elementId("surg_abx_selection")
                        .name("Appropriate prophylactic antibiotic selected")
                        .description("Antibiotic matches guideline recommendation for procedure type")
                        .dataSource(DataSource.MEDICATION)
                        .build())
                .element(BundleElement.builder()
                        .elementId("surg_abx_timing")
                        .name("Antibiotic given within 60 minutes of incision")
                        .description("Prophylaxis administered 0-60 min before surgical incision")
                        .timeWindowHours(1.0)
                        .dataSource(DataSource.MEDICATION)
                        .medicationCategory(MedicationCategory.PARENTERAL_ANTIBIOTIC)
                        .severity(DeviationSeverity.CRITICAL)
                        .recommendation("Give prophylaxis in the 60 minutes before incision.")
                        .build())
                .element(BundleElement.builder()
                        .elementId("surg_abx_weight_dose")
                        .name("Appropriate weight-based dosing")
                        .description("Dose appropriate for patient weight")
                        .dataSource(DataSource.MEDICATION)
                        .build())
                .element(BundleElement.builder()
                        .elementId("surg_abx_redose")
                        .name("Redosing for prolonged procedures")
                        .description("Redose given if procedure duration exceeds 2 half-lives")
                        .required(false)
                        .dataSource(DataSource.MEDICATION)
                        .build())
                .element(BundleElement.builder()
                        .elementId("surg_abx_discontinued")
                        .name("Prophylaxis discontinued within 24-48 hours")
                        .description("Prophylactic antibiotics stopped within guideline timeframe")
                        .timeWindowHours(48.0)
                        .dataSource(DataSource.MEDICATION)
                        .build())
                .build();
    }
}
