package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.model.evidence.LabResult;
import ai.bundlewatch.backend.service.evidence.EvidenceSource;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Shared evidence lookups and the PENDING/NOT_MET fallback.
 */
public abstract class AbstractElementChecker implements ElementChecker {

    protected final EvidenceSource evidenceSource;

    protected AbstractElementChecker(EvidenceSource evidenceSource) {
        this.evidenceSource = evidenceSource;
    }

    /**
     * Outcome when no qualifying evidence was found: PENDING while the window is open,
     * NOT_MET once "now" is past the deadline.
     */
    protected ElementCheckOutcome noEvidence(ElementEvaluationRequest request, String pendingNote, String notMetNote) {
        if (request.withinWindow()) {
            return ElementCheckOutcome.pending(pendingNote);
        }
        return ElementCheckOutcome.notMet(notMetNote);
    }

    /**
     * Returns the earliest item whose timestamp is at or before the deadline.
     */
    protected static <T> Optional<T> earliestOnTime(List<T> items, Function<T, Instant> time, Instant deadline) {
        return sortedByTime(items, time).stream()
                .filter(item -> TimeWindows.onOrBefore(time.apply(item), deadline))
                .findFirst();
    }

    /**
     * Sorts by timestamp ascending; items without a timestamp are dropped.
     */
    protected static <T> List<T> sortedByTime(List<T> items, Function<T, Instant> time) {
        return items.stream()
                .filter(item -> time.apply(item) != null)
                .sorted(Comparator.comparing(time))
                .toList();
    }

    /**
     * Earliest on-time lab result for the given codes.
     */
    protected ElementCheckOutcome checkEarliestLab(ElementEvaluationRequest request, Collection<String> codes,
                                                   Function<LabResult, String> metNote) {
        if (codes.isEmpty()) {
            return ElementCheckOutcome.pending("No result codes configured");
        }
        List<LabResult> labs = evidenceSource.getLabResults(request.getPatientId(), codes, request.getTriggerTime());
        if (labs.isEmpty()) {
            return noEvidence(request, "Awaiting lab results", "Time window expired without lab result");
        }
        return earliestOnTime(labs, LabResult::getEffectiveTime, request.deadline())
                .map(lab -> ElementCheckOutcome.met(lab.getEffectiveTime(), lab.displayValue(), metNote.apply(lab)))
                .orElseGet(() -> noEvidence(request,
                        "Results found but not within required window",
                        "Time window expired - no result within required timeframe"));
    }

    protected static String resultNote(LabResult lab) {
        String value = lab.displayValue();
        return Objects.isNull(value) ? "Result obtained" : "Result: " + value;
    }
}
