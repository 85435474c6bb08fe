package ai.bundlewatch.backend.service.checker;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Deadline and window arithmetic shared by every checker.
 *
 * Evidence dated exactly at the deadline is on time; an element only expires once
 * "now" is strictly after the deadline. An absent window never expires.
 */
public final class TimeWindows {

    private TimeWindows() {
    }

    /**
     * @return trigger + hours, or empty when the element has no window
     */
    public static Optional<Instant> deadline(Instant triggerTime, Double windowHours) {
        if (windowHours == null) {
            return Optional.empty();
        }
        return Optional.of(triggerTime.plus(hours(windowHours)));
    }

    /**
     * @return true when there is no window, or "now" is not after the deadline
     */
    public static boolean withinWindow(Instant now, Instant triggerTime, Double windowHours) {
        return deadline(triggerTime, windowHours)
                .map(deadline -> !now.isAfter(deadline))
                .orElse(true);
    }

    /**
     * Whether evidence dated {@code evidenceTime} counts toward a deadline.
     * Evidence without a timestamp never counts.
     */
    public static boolean onOrBefore(Instant evidenceTime, Instant deadline) {
        if (evidenceTime == null) {
            return false;
        }
        return deadline == null || !evidenceTime.isAfter(deadline);
    }

    public static Duration hours(double hours) {
        return Duration.ofMillis(Math.round(hours * 3_600_000d));
    }
}
