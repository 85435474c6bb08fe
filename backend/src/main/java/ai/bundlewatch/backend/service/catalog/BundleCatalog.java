package ai.bundlewatch.backend.service.catalog;

import ai.bundlewatch.backend.model.bundle.GuidelineBundle;

import java.util.List;
import java.util.Optional;

/**
 * Read-only source of bundle definitions.
 */
public interface BundleCatalog {

    Optional<GuidelineBundle> findBundle(String bundleId);

    /**
     * @return every known bundle, in catalog order
     */
    List<GuidelineBundle> getAllBundles();

    /**
     * @return the bundles the monitor should run, in catalog order
     */
    List<GuidelineBundle> getEnabledBundles();
}
