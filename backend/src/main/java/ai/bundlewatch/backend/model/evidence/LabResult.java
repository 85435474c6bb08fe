package ai.bundlewatch.backend.model.evidence;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A laboratory observation. Numeric results carry {@code numericValue}; coded or textual
 * results such as "positive" carry {@code textValue}.
 */
@Value
@Builder
public class LabResult {

    String code;

    Double numericValue;

    String textValue;

    String unit;

    Instant effectiveTime;

    /**
     * Value as recorded on an element result.
     *
     * @return the numeric value without a trailing ".0" for whole numbers, the text value, or null
     */
    public String displayValue() {
        if (numericValue != null) {
            if (numericValue == Math.rint(numericValue) && !Double.isInfinite(numericValue)) {
                return String.valueOf(numericValue.longValue());
            }
            return String.valueOf(numericValue);
        }
        return textValue;
    }
}
