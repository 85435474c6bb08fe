package ai.bundlewatch.backend.service.evidence;

import ai.bundlewatch.backend.model.evidence.ClinicalNote;
import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.model.evidence.MedicationAdministration;
import ai.bundlewatch.backend.model.evidence.PatientDemographics;
import ai.bundlewatch.backend.model.evidence.VitalSign;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Maps FHIR R4 JSON resources onto evidence value types.
 */
final class FhirResourceParser {

    private static final Logger logger = LoggerFactory.getLogger(FhirResourceParser.class);

    private FhirResourceParser() {
    }

    static LabResult toLabResult(JsonNode observation) {
        JsonNode quantity = observation.path("valueQuantity");
        Double numeric = quantity.path("value").isNumber() ? quantity.path("value").asDouble() : null;
        String text = null;
        if (observation.hasNonNull("valueString")) {
            text = observation.get("valueString").asText();
        } else if (observation.has("valueCodeableConcept")) {
            text = conceptText(observation.get("valueCodeableConcept"));
        }
        return LabResult.builder()
                .code(codingCode(observation.path("code"), "loinc"))
                .numericValue(numeric)
                .textValue(text)
                .unit(textOrNull(quantity, "unit"))
                .effectiveTime(parseDateTime(firstText(observation, "effectiveDateTime", "issued")))
                .build();
    }

    static VitalSign toVitalSign(JsonNode observation) {
        JsonNode coding = observation.path("code").path("coding").path(0);
        JsonNode quantity = observation.path("valueQuantity");
        return VitalSign.builder()
                .code(textOrNull(coding, "code"))
                .display(textOrNull(coding, "display"))
                .value(quantity.path("value").isNumber() ? quantity.path("value").asDouble() : null)
                .unit(textOrNull(quantity, "unit"))
                .effectiveTime(parseDateTime(textOrNull(observation, "effectiveDateTime")))
                .build();
    }

    static MedicationAdministration toMedicationAdministration(JsonNode resource) {
        JsonNode dosage = resource.path("dosage");
        String dose = "";
        if (dosage.has("dose")) {
            JsonNode qty = dosage.get("dose");
            dose = (qty.path("value").asText("") + " " + qty.path("unit").asText("")).trim();
        }
        Instant adminTime = parseDateTime(textOrNull(resource, "effectiveDateTime"));
        if (adminTime == null) {
            adminTime = parseDateTime(textOrNull(resource.path("effectivePeriod"), "start"));
        }
        return MedicationAdministration.builder()
                .medicationName(conceptText(resource.path("medicationCodeableConcept")))
                .dose(dose)
                .route(conceptText(dosage.path("route")))
                .status(resource.path("status").asText(""))
                .adminTime(adminTime)
                .build();
    }

    /**
     * @return the note, or empty when the document carries no inline text
     */
    static Optional<ClinicalNote> toClinicalNote(JsonNode documentReference) {
        String text = null;
        for (JsonNode content : documentReference.path("content")) {
            text = decodeAttachment(content.path("attachment").path("data").asText(null));
            if (text != null) {
                break;
            }
        }
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        JsonNode typeCoding = documentReference.path("type").path("coding").path(0);
        String date = textOrNull(documentReference, "date");
        if (date == null) {
            date = textOrNull(documentReference.path("context").path("period"), "start");
        }
        JsonNode author = documentReference.path("author").path(0);
        String authorName = author.hasNonNull("display") ? author.get("display").asText()
                : textOrNull(author, "reference");
        if (authorName != null) {
            authorName = authorName.replace("Practitioner/", "");
        }
        return Optional.of(ClinicalNote.builder()
                .typeCode(textOrNull(typeCoding, "code"))
                .typeDisplay(typeCoding.path("display").asText(typeCoding.path("code").asText("Unknown")))
                .date(parseDateTime(date))
                .author(authorName)
                .text(text)
                .build());
    }

    static PatientDemographics toPatient(JsonNode patient) {
        JsonNode name = patient.path("name").path(0);
        String displayName = name.hasNonNull("text") ? name.get("text").asText()
                : (joinText(name.path("given")) + " " + name.path("family").asText("")).trim();
        String mrn = null;
        for (JsonNode identifier : patient.path("identifier")) {
            if ("MR".equals(identifier.path("type").path("coding").path(0).path("code").asText())) {
                mrn = identifier.path("value").asText(null);
                break;
            }
        }
        String birthDate = textOrNull(patient, "birthDate");
        LocalDate birth = null;
        if (birthDate != null) {
            try {
                birth = LocalDate.parse(birthDate.length() > 10 ? birthDate.substring(0, 10) : birthDate);
            } catch (DateTimeParseException e) {
                birth = null;
            }
        }
        return PatientDemographics.builder()
                .patientId(textOrNull(patient, "id"))
                .name(displayName)
                .mrn(mrn)
                .birthDate(birth)
                .gender(textOrNull(patient, "gender"))
                .build();
    }

    /**
     * Parses a FHIR dateTime. Date-only values resolve to midnight UTC and values without
     * an offset are read as UTC.
     *
     * @return the instant, or null when absent or unparseable
     */
    static Instant parseDateTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Instant parsed = tryParse(() -> OffsetDateTime.parse(value).toInstant());
        if (parsed == null) {
            parsed = tryParse(() -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = tryParse(() -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        return parsed;
    }

    private static Instant tryParse(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String decodeAttachment(String data) {
        if (data == null) {
            return null;
        }
        try {
            return new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            logger.debug("Skipping attachment that is not base64 encoded");
            return null;
        }
    }

    static String stripReference(JsonNode reference, String prefix) {
        String value = reference.path("reference").asText("");
        return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
    }

    static String codingCode(JsonNode concept, String systemHint) {
        for (JsonNode coding : concept.path("coding")) {
            if (coding.path("system").asText("").toLowerCase().contains(systemHint)) {
                return coding.path("code").asText(null);
            }
        }
        return null;
    }

    private static String conceptText(JsonNode concept) {
        if (concept.hasNonNull("text") && !concept.get("text").asText().isEmpty()) {
            return concept.get("text").asText();
        }
        for (JsonNode coding : concept.path("coding")) {
            String display = coding.path("display").asText("");
            if (!display.isEmpty()) {
                return display;
            }
        }
        return "";
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = textOrNull(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static String joinText(JsonNode array) {
        StringBuilder builder = new StringBuilder();
        for (JsonNode item : array) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(item.asText());
        }
        return builder.toString();
    }
}
