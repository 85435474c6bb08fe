package ai.bundlewatch.backend.service.checker;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword classification of administered medications.
 * Keywords match on word boundaries so short names such as "ns" or "lr" do not match inside other words.
 */
public final class MedicationClassifier {

    static final List<String> BROAD_SPECTRUM_ANTIBIOTICS = List.of(
            "piperacillin", "piperacillin-tazobactam", "zosyn",
            "meropenem", "imipenem", "ertapenem",
            "cefepime", "ceftazidime",
            "ampicillin-sulbactam",
            "gentamicin", "tobramycin", "amikacin",
            "ciprofloxacin", "levofloxacin",
            "vancomycin", "linezolid");

    static final List<String> INFANT_ANTIBIOTICS = List.of(
            "ampicillin", "gentamicin", "cefotaxime", "ceftriaxone", "vancomycin", "acyclovir",
            "penicillin", "cephalosporin", "amoxicillin", "cefazolin", "azithromycin", "metronidazole");

    static final List<String> FIRST_LINE_PNEUMONIA_ANTIBIOTICS = List.of("ampicillin", "amoxicillin", "penicillin");

    static final List<String> UTI_EMPIRIC_ANTIBIOTICS = List.of(
            "cephalexin", "cefixime", "cefdinir",
            "tmp-smx", "trimethoprim-sulfamethoxazole", "bactrim",
            "nitrofurantoin");

    static final List<String> ANTIPSEUDOMONAL_BETA_LACTAMS = List.of(
            "cefepime", "piperacillin", "piperacillin-tazobactam", "zosyn", "meropenem");

    static final List<String> CRYSTALLOIDS = List.of(
            "normal saline", "0.9% sodium chloride", "ns",
            "lactated ringer", "ringer's lactate", "lr",
            "plasmalyte", "plasma-lyte");

    static final List<String> PARENTERAL_ROUTES = List.of("iv", "intravenous", "parenteral");

    private static final List<Pattern> BROAD_SPECTRUM_PATTERNS = compile(BROAD_SPECTRUM_ANTIBIOTICS);
    private static final List<Pattern> INFANT_ANTIBIOTIC_PATTERNS = compile(INFANT_ANTIBIOTICS);
    private static final List<Pattern> CRYSTALLOID_PATTERNS = compile(CRYSTALLOIDS);
    private static final List<Pattern> FIRST_LINE_PNEUMONIA_PATTERNS = compile(FIRST_LINE_PNEUMONIA_ANTIBIOTICS);
    private static final List<Pattern> UTI_EMPIRIC_PATTERNS = compile(UTI_EMPIRIC_ANTIBIOTICS);
    private static final List<Pattern> ANTIPSEUDOMONAL_PATTERNS = compile(ANTIPSEUDOMONAL_BETA_LACTAMS);

    private static final Pattern VOLUME = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(ml|milliliter)");
    private static final double BOLUS_MIN_VOLUME_ML = 100;

    private MedicationClassifier() {
    }

    public static boolean isBroadSpectrumAntibiotic(String medicationName) {
        return containsAny(medicationName, BROAD_SPECTRUM_PATTERNS);
    }

    public static boolean isAntibiotic(String medicationName) {
        return containsAny(medicationName, INFANT_ANTIBIOTIC_PATTERNS) || isBroadSpectrumAntibiotic(medicationName);
    }

    /** Beta-lactamase inhibitor combinations are not first line. */
    public static boolean isFirstLinePneumoniaAntibiotic(String medicationName) {
        if (!containsAny(medicationName, FIRST_LINE_PNEUMONIA_PATTERNS)) {
            return false;
        }
        String lower = medicationName.toLowerCase(Locale.ROOT);
        return !lower.contains("sulbactam") && !lower.contains("clavulan");
    }

    public static boolean isUtiEmpiricAntibiotic(String medicationName) {
        return containsAny(medicationName, UTI_EMPIRIC_PATTERNS);
    }

    public static boolean isAntipseudomonalBetaLactam(String medicationName) {
        return containsAny(medicationName, ANTIPSEUDOMONAL_PATTERNS);
    }

    public static boolean isCrystalloid(String medicationName) {
        return containsAny(medicationName, CRYSTALLOID_PATTERNS);
    }

    public static boolean isParenteralRoute(String route) {
        return route != null && PARENTERAL_ROUTES.contains(route.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * A bolus is dosed per weight (mL/kg) or is an absolute volume of at least 100 mL.
     * Anything else is treated as maintenance fluid.
     */
    public static boolean isBolusDose(String dose) {
        if (dose == null) {
            return false;
        }
        String lower = dose.toLowerCase(Locale.ROOT);
        if (lower.contains("ml/kg") || lower.contains("ml per kg")) {
            return true;
        }
        Matcher matcher = VOLUME.matcher(lower);
        return matcher.find() && Double.parseDouble(matcher.group(1)) >= BOLUS_MIN_VOLUME_ML;
    }

    private static boolean containsAny(String text, List<Pattern> patterns) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return patterns.stream().anyMatch(pattern -> pattern.matcher(lower).find());
    }

    private static List<Pattern> compile(List<String> keywords) {
        return keywords.stream()
                .map(keyword -> Pattern.compile("(?<![a-z0-9])" + Pattern.quote(keyword) + "(?![a-z0-9])"))
                .toList();
    }
}
