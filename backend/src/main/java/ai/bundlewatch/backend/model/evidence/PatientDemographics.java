package ai.bundlewatch.backend.model.evidence;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class PatientDemographics {

    String patientId;

    String name;

    String mrn;

    LocalDate birthDate;

    String gender;
}
