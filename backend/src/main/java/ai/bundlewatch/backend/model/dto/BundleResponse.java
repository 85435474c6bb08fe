package ai.bundlewatch.backend.model.dto;

import ai.bundlewatch.backend.model.bundle.AgeGroup;
import ai.bundlewatch.backend.model.bundle.BundleElement;
import ai.bundlewatch.backend.model.bundle.GuidelineBundle;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Catalog entry as exposed over REST.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BundleResponse {

    private String bundleId;

    private String name;

    private String description;

    private boolean enabled;

    private List<Element> elements;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Element {
        private String elementId;
        private String name;
        private boolean required;
        private Double timeWindowHours;
        private String dataSource;
        private String severity;
        private List<String> ageGroups;
        private String dependsOn;
    }

    public static BundleResponse from(GuidelineBundle bundle, boolean enabled) {
        return BundleResponse.builder()
                .bundleId(bundle.getBundleId())
                .name(bundle.getName())
                .description(bundle.getDescription())
                .enabled(enabled)
                .elements(bundle.getElements().stream().map(BundleResponse::element).collect(Collectors.toList()))
                .build();
    }

    private static Element element(BundleElement element) {
        return Element.builder()
                .elementId(element.getElementId())
                .name(element.getName())
                .required(element.isRequired())
                .timeWindowHours(element.getTimeWindowHours())
                .dataSource(element.getDataSource() != null ? element.getDataSource().name() : null)
                .severity(element.getSeverity().getValue())
                .ageGroups(element.getApplicableAgeGroups().stream().map(AgeGroup::getLabel).collect(Collectors.toList()))
                .dependsOn(element.hasDependency() ? element.getDependency().getDependsOn() : null)
                .build();
    }
}
