package io.flowscan.detectors;

import io.flowscan.ScanConfig;
import io.flowscan.model.Finding;

import java.util.List;

/**
 * Base interface for all detectors.
 * Each detector turns one aspect of the analysis results into findings.
 */
public interface Detector {

    /**
     * Returns a unique identifier for this detector.
     */
    String id();

    /**
     * Returns a human-readable description of what this detector finds.
     */
    String description();

    /**
     * Produces findings from the analysis results.
     *
     * @param context Summaries, optional dependency graph and configuration
     * @return List of findings from this detector
     */
    List<Finding> detect(DetectionContext context);

    /**
     * Returns true if this detector is enabled by default.
     */
    default boolean enabledByDefault() {
        return true;
    }

    /**
     * Checks if the configuration switches this detector on.
     */
    default boolean isEnabled(ScanConfig config) {
        return enabledByDefault();
    }
}
