package ai.bundlewatch.backend.model.evidence;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Free-text clinical note with its type code and authored date.
 */
@Value
@Builder
public class ClinicalNote {

    String typeCode;

    String typeDisplay;

    Instant date;

    String author;

    String text;
}
