package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.model.bundle.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches elements to the checker registered for their data source.
 * A data source without a checker leaves the element PENDING with a diagnostic note.
 */
@Component
public class ElementCheckerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ElementCheckerRegistry.class);

    private final Map<DataSource, ElementChecker> checkers = new EnumMap<>(DataSource.class);

    @Autowired
    public ElementCheckerRegistry(List<ElementChecker> checkers) {
        for (ElementChecker checker : checkers) {
            ElementChecker previous = this.checkers.put(checker.dataSource(), checker);
            if (previous != null) {
                throw new IllegalStateException("Duplicate checker for data source " + checker.dataSource());
            }
        }
        logger.info("Registered element checkers for {}", this.checkers.keySet());
    }

    public ElementCheckOutcome check(ElementEvaluationRequest request) {
        DataSource dataSource = request.getElement().getDataSource();
        ElementChecker checker = dataSource != null ? checkers.get(dataSource) : null;
        if (checker == null) {
            logger.warn("No checker for data source {} (element {})", dataSource, request.getElement().getElementId());
            return ElementCheckOutcome.pending("No checker available for data source: " + dataSource);
        }
        return checker.check(request);
    }
}
