package ai.bundlewatch.backend.model.bundle;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Dependency edge from one element to a prerequisite element in the same bundle.
 * The dependent element only applies when the prerequisite was met with a numeric
 * value strictly above {@code valueThreshold}, and its completion needs a later,
 * distinct piece of evidence.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class ElementDependency {

    String dependsOn;

    double valueThreshold;

    public boolean isSatisfiedBy(Double prerequisiteValue) {
        return prerequisiteValue != null && prerequisiteValue > valueThreshold;
    }
}
