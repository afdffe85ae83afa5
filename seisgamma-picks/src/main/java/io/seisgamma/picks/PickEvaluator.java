package io.seisgamma.picks;

/*
 * Copyright (c) seisgamma
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Scores extracted picks against reference (manually reviewed) picks.
///
/// A predicted pick is a true positive when an unmatched reference pick with
/// the same file name, station id and phase type lies within the tolerance.
/// Predictions are matched in index order, each to the closest reference pick
/// not matched yet, so a reference pick counts at most once.
public final class PickEvaluator {

    /// Default matching tolerance in seconds.
    public static final double DEFAULT_TOLERANCE_SEC = 0.1;

    private final double toleranceSec;

    public PickEvaluator() {
        this(DEFAULT_TOLERANCE_SEC);
    }

    public PickEvaluator(double toleranceSec) {
        if (!(toleranceSec >= 0) || !Double.isFinite(toleranceSec)) {
            throw new IllegalArgumentException("toleranceSec must be finite and >= 0, got: " + toleranceSec);
        }
        this.toleranceSec = toleranceSec;
    }

    /// Per-phase detection scores, keyed by phase type in natural order.
    public Map<String, DetectionMetrics.Scores> evaluate(List<PickRecord> predicted, List<PickRecord> reference) {
        Objects.requireNonNull(predicted, "predicted");
        Objects.requireNonNull(reference, "reference");

        Map<Key, List<PickRecord>> predictedByKey = group(predicted);
        Map<Key, List<PickRecord>> referenceByKey = group(reference);

        Map<String, long[]> counts = new TreeMap<>();
        predictedByKey.forEach((key, picks) -> counts.computeIfAbsent(key.phase(), k -> new long[3])[1] += picks.size());
        referenceByKey.forEach((key, picks) -> counts.computeIfAbsent(key.phase(), k -> new long[3])[2] += picks.size());

        for (Map.Entry<Key, List<PickRecord>> entry : predictedByKey.entrySet()) {
            List<PickRecord> truth = referenceByKey.get(entry.getKey());
            if (truth != null) {
                counts.get(entry.getKey().phase())[0] += countMatches(entry.getValue(), truth);
            }
        }

        Map<String, DetectionMetrics.Scores> scores = new TreeMap<>();
        counts.forEach((phase, c) -> scores.put(phase, DetectionMetrics.calc(c[0], c[1], c[2])));
        return scores;
    }

    private int countMatches(List<PickRecord> predicted, List<PickRecord> truth) {
        boolean[] used = new boolean[truth.size()];
        int matches = 0;
        for (PickRecord pick : predicted) {
            int best = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int i = 0; i < truth.size(); i++) {
                if (used[i]) continue;
                double distance = Math.abs(pick.phaseIndex() * pick.dt() - truth.get(i).phaseIndex() * truth.get(i).dt());
                if (distance <= toleranceSec && distance < bestDistance) {
                    best = i;
                    bestDistance = distance;
                }
            }
            if (best >= 0) {
                used[best] = true;
                matches++;
            }
        }
        return matches;
    }

    private static Map<Key, List<PickRecord>> group(List<PickRecord> picks) {
        Map<Key, List<PickRecord>> grouped = new HashMap<>();
        for (PickRecord pick : picks) {
            grouped.computeIfAbsent(new Key(pick.fileName(), pick.stationId(), pick.phaseType()), k -> new ArrayList<>())
                .add(pick);
        }
        grouped.values().forEach(list -> list.sort(Comparator.comparingInt(PickRecord::phaseIndex)));
        return grouped;
    }

    private record Key(String fileName, String stationId, String phase) {}
}
