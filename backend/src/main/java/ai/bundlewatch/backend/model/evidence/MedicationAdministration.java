package ai.bundlewatch.backend.model.evidence;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A recorded medication administration (actual given time, not the order).
 */
@Value
@Builder
public class MedicationAdministration {

    String medicationName;

    /** Free-text dose, e.g. "20 mL/kg" or "1000 mL". */
    String dose;

    String route;

    String status;

    Instant adminTime;
}
