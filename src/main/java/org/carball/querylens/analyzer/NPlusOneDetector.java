package org.carball.querylens.analyzer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.analysis.NPlusOneDetection;
import org.carball.querylens.model.query.QueryMetrics;
import org.carball.querylens.model.query.QueryOccurrence;
import org.carball.querylens.parser.QueryNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Sliding-window detection of fingerprints that repeat abnormally often, the usual symptom
 * of a loop issuing one query per parent row.
 * <p>
 * Every run of {@code windowSize} consecutive occurrences is examined. A fingerprint that
 * reaches the threshold inside a window is a candidate, and its per-window counts are
 * averaged so one burst is reported once. A log shorter than one window counts as a single
 * window. Results are advisory.
 */
@Slf4j
@RequiredArgsConstructor
public class NPlusOneDetector {

    private final int threshold;
    private final int windowSize;

    public List<NPlusOneDetection> detect(List<QueryOccurrence> occurrences,
                                          Function<String, Optional<QueryMetrics>> metricsLookup) {
        if (occurrences.isEmpty()) {
            return List.of();
        }

        Map<String, CandidateCounts> candidates = collectCandidates(occurrences);

        List<NPlusOneDetection> detections = new ArrayList<>();
        for (Map.Entry<String, CandidateCounts> entry : candidates.entrySet()) {
            Optional<QueryMetrics> metrics = metricsLookup.apply(entry.getKey());
            if (metrics.isEmpty()) {
                log.debug("Skipping N+1 candidate {} without metrics", entry.getKey());
                continue;
            }
            detections.add(toDetection(metrics.get(), entry.getValue().average()));
        }

        detections.sort(Comparator.comparingDouble(NPlusOneDetection::getConfidenceScore).reversed()
                .thenComparing(Comparator.comparingInt(NPlusOneDetection::getOccurrenceCount).reversed())
                .thenComparing(NPlusOneDetection::getRepeatedFingerprint));

        if (!detections.isEmpty()) {
            log.info("Detected {} potential N+1 patterns in {} occurrences", detections.size(), occurrences.size());
        }
        return detections;
    }

    private Map<String, CandidateCounts> collectCandidates(List<QueryOccurrence> occurrences) {
        Map<String, CandidateCounts> candidates = new LinkedHashMap<>();
        int span = Math.min(windowSize, occurrences.size());

        Map<String, Integer> windowCounts = new HashMap<>();
        for (int i = 0; i < span; i++) {
            windowCounts.merge(occurrences.get(i).fingerprint(), 1, Integer::sum);
        }
        addCandidates(windowCounts, candidates);

        // slide one entry at a time: drop the leaving entry, add the entering one
        for (int start = 1; start + span <= occurrences.size(); start++) {
            windowCounts.computeIfPresent(occurrences.get(start - 1).fingerprint(),
                    (fingerprint, count) -> count > 1 ? count - 1 : null);
            windowCounts.merge(occurrences.get(start + span - 1).fingerprint(), 1, Integer::sum);
            addCandidates(windowCounts, candidates);
        }
        return candidates;
    }

    private void addCandidates(Map<String, Integer> windowCounts, Map<String, CandidateCounts> candidates) {
        for (Map.Entry<String, Integer> entry : windowCounts.entrySet()) {
            if (entry.getValue() >= threshold) {
                candidates.computeIfAbsent(entry.getKey(), fingerprint -> new CandidateCounts())
                        .add(entry.getValue());
            }
        }
    }

    private NPlusOneDetection toDetection(QueryMetrics metrics, double averageCount) {
        List<String> tables = new ArrayList<>(QueryNormalizer.extractTableNames(metrics.getSampleText()));

        return NPlusOneDetection.builder()
                .repeatedFingerprint(metrics.getFingerprint())
                .repeatedQuery(metrics.getSampleText())
                .occurrenceCount((int) Math.round(averageCount))
                .totalDurationMs(metrics.getTotalDurationMs())
                .affectedTables(List.copyOf(tables))
                .suggestedSolution(suggestSolution(tables))
                .confidenceScore(confidence(averageCount))
                .build();
    }

    double confidence(double averageCount) {
        double score = (averageCount - threshold) / (4.0 * threshold);
        return Math.max(0.0, Math.min(1.0, score));
    }

    static String suggestSolution(List<String> tables) {
        if (tables.isEmpty()) {
            return "Consider using bulk queries or joins to fetch related data";
        }
        if (tables.size() == 1) {
            return "Use bulk query with IN clause for " + tables.get(0) + " instead of individual queries";
        }
        return "Use JOIN to fetch data from " + String.join(", ", tables) + " in single query";
    }

    private static class CandidateCounts {
        private long sum;
        private int windows;

        void add(int count) {
            sum += count;
            windows++;
        }

        double average() {
            return (double) sum / windows;
        }
    }
}
