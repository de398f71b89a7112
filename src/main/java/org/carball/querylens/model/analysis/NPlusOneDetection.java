package org.carball.querylens.model.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A fingerprint that repeated abnormally often inside the detection window.
 * The confidence score is advisory: the detector favours recall over precision.
 */
@Value
@Builder
public class NPlusOneDetection {
    String repeatedFingerprint;
    String repeatedQuery;
    int occurrenceCount;
    double totalDurationMs;
    List<String> affectedTables;
    String suggestedSolution;
    double confidenceScore;
}
