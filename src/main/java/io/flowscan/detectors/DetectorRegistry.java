package io.flowscan.detectors;

import io.flowscan.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of all available detectors.
 * Manages detector execution and result aggregation.
 */
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final List<Detector> detectors;

    private DetectorRegistry(List<Detector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    /**
     * Creates a registry with all default detectors.
     */
    public static DetectorRegistry createDefault() {
        return new DetectorRegistry(List.of(
                new InfiniteLoopDetector(),
                new DivergingCallDetector(),
                new UnreachableCodeDetector(),
                new ComplexityDetector(),
                new CircularDependencyDetector()
        ));
    }

    /**
     * Creates a registry with specific detectors.
     */
    public static DetectorRegistry of(Detector... detectors) {
        return new DetectorRegistry(Arrays.asList(detectors));
    }

    /**
     * Runs all enabled detectors and returns aggregated findings, most severe first and
     * capped at the configured maximum.
     */
    public List<Finding> runAll(DetectionContext context) {
        List<Finding> allFindings = new ArrayList<>();
        for (Detector detector : detectors) {
            if (detector.isEnabled(context.config())) {
                allFindings.addAll(detector.detect(context));
            }
        }
        return cap(allFindings, context);
    }

    /**
     * Runs specific detectors by ID, whether enabled or not.
     */
    public List<Finding> run(DetectionContext context, Set<String> detectorIds) {
        List<Finding> allFindings = new ArrayList<>();
        for (Detector detector : detectors) {
            if (detectorIds.contains(detector.id())) {
                allFindings.addAll(detector.detect(context));
            }
        }
        return cap(allFindings, context);
    }

    private static List<Finding> cap(List<Finding> findings, DetectionContext context) {
        findings.sort(Comparator.comparingInt(f -> f.riskLevel().severity()));
        int max = context.config().getMaxFindings();
        if (findings.size() > max) {
            log.warn("{} findings exceed the limit of {}, dropping the least severe", findings.size(), max);
            return List.copyOf(findings.subList(0, max));
        }
        return List.copyOf(findings);
    }

    /**
     * Returns all registered detectors.
     */
    public List<Detector> allDetectors() {
        return detectors;
    }

    /**
     * Returns a detector by ID, if present.
     */
    public Optional<Detector> getById(String id) {
        return detectors.stream()
                .filter(d -> d.id().equals(id))
                .findFirst();
    }
}
