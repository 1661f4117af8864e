package io.flowdetect.report;

import io.flowdetect.compile.Detector;

import java.time.Instant;
import java.util.List;

/**
 * Detectors computed for a templated experiment, with the settings used.
 *
 * @param k                scaling parameter of the templates
 * @param radius           initial situation radius
 * @param maxRadius        upper bound of the radius expansion
 * @param generatedAt      when the computation started
 * @param durationMs       how long the computation took
 * @param database         database file used, or null
 * @param detectorsByRound detectors found at the end of each round
 */
public record DetectorReport(
        int k,
        int radius,
        int maxRadius,
        Instant generatedAt,
        long durationMs,
        String database,
        List<List<Detector>> detectorsByRound
) {
    public DetectorReport {
        if (detectorsByRound == null) {
            throw new IllegalArgumentException("detectorsByRound cannot be null");
        }
        detectorsByRound = detectorsByRound.stream().map(List::copyOf).toList();
    }

    public int totalDetectors() {
        return detectorsByRound.stream().mapToInt(List::size).sum();
    }
}
