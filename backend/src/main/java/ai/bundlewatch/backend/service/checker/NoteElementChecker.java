package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.DataSource;
import ai.bundlewatch.backend.model.bundle.NoteCategory;
import ai.bundlewatch.backend.model.evidence.ClinicalNote;
import ai.bundlewatch.backend.service.evidence.EvidenceSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks documentation elements by scanning notes for the category's keywords.
 *
 * A category may open its note window some hours after the trigger (reassessment opens at
 * 48h); before that the element stays PENDING regardless of notes. The window closes at the
 * element deadline.
 */
@Component
public class NoteElementChecker extends AbstractElementChecker {

    @Autowired
    public NoteElementChecker(EvidenceSource evidenceSource) {
        super(evidenceSource);
    }

    @Override
    public DataSource dataSource() {
        return DataSource.NOTE;
    }

    @Override
    public ElementCheckOutcome check(ElementEvaluationRequest request) {
        BundleElement element = request.getElement();
        NoteCategory category = element.getNoteCategory() != null ? element.getNoteCategory() : NoteCategory.GENERIC;

        List<String> keywords = category == NoteCategory.GENERIC
                ? NoteKeywords.extract(element.getDescription())
                : category.getKeywords();
        if (keywords.isEmpty()) {
            return ElementCheckOutcome.pending("Unable to determine documentation requirements");
        }

        Instant windowOpens = request.getTriggerTime().plus(TimeWindows.hours(category.getOpensAfterHours()));
        if (request.getNow().isBefore(windowOpens)) {
            return ElementCheckOutcome.pending("Documentation window opens at " + windowOpens);
        }

        List<ClinicalNote> notes = evidenceSource.getRecentNotes(
                request.getPatientId(), windowOpens, category.getNoteTypes());

        Instant deadline = request.deadline();
        Optional<ClinicalNote> match = sortedByTime(notes, ClinicalNote::getDate).stream()
                .filter(note -> !note.getDate().isBefore(windowOpens))
                .filter(note -> TimeWindows.onOrBefore(note.getDate(), deadline))
                .filter(note -> NoteKeywords.mentionsAny(note.getText(), keywords))
                .findFirst();

        if (match.isPresent()) {
            ClinicalNote note = match.get();
            return metOutcome(category, element, note);
        }

        return noEvidence(request,
                "Awaiting documentation for: " + element.getName(),
                "Time window expired - no documentation found for: " + element.getName());
    }

    private ElementCheckOutcome metOutcome(NoteCategory category, BundleElement element, ClinicalNote note) {
        switch (category) {
            case RISK_STRATIFICATION:
                String level = riskLevel(note.getText());
                return ElementCheckOutcome.met(note.getDate(), level, "Risk stratification: " + level);
            case REASSESSMENT:
                String type = note.getTypeDisplay() != null ? note.getTypeDisplay() : "note";
                return ElementCheckOutcome.met(note.getDate(), type, "Reassessment documented in " + type);
            case MARGIN_MARKING:
                return ElementCheckOutcome.met(note.getDate(), null, "Margins marked per documentation");
            default:
                return ElementCheckOutcome.met(note.getDate(), null, "Documentation found matching: " + element.getName());
        }
    }

    static String riskLevel(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("high risk")) {
            return "high risk";
        }
        if (lower.contains("low risk")) {
            return "low risk";
        }
        return "documented";
    }
}
