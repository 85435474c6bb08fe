package ai.bundlewatch.backend.model.evidence;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class VitalSign {

    String code;

    String display;

    Double value;

    String unit;

    Instant effectiveTime;
}
