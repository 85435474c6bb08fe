package ai.bundlewatch.backend.service.checker;

import ai.bundlewatch.backend.model.bundle.DataSource;

/**
 * Decides one element from the available evidence. One implementation per data source.
 */
public interface ElementChecker {

    DataSource dataSource();

    /**
     * Searches for qualifying evidence dated at or before the element deadline.
     *
     * @param request element, patient, trigger time and current instant
     * @return MET with the evidence, NOT_MET once the window has expired, otherwise PENDING
     */
    ElementCheckOutcome check(ElementEvaluationRequest request);
}
