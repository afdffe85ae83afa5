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

/**
 * Precision, recall and F1 from detection counts.
 */
public final class DetectionMetrics {

    private DetectionMetrics() {
    }

    /**
     * Detection scores.
     *
     * @param precision true positives over predicted positives
     * @param recall true positives over reference positives
     * @param f1 harmonic mean of precision and recall
     */
    public record Scores(double precision, double recall, double f1) {
        @Override
        public String toString() {
            return String.format("precision=%.3f, recall=%.3f, f1=%.3f", precision, recall, f1);
        }
    }

    /**
     * Computes scores from counts. A zero denominator gives a score of 0 rather than NaN.
     *
     * @param nTP true positives
     * @param nP predicted positives
     * @param nT reference (true) positives
     * @throws IllegalArgumentException if a count is negative or nTP exceeds nP or nT
     */
    public static Scores calc(long nTP, long nP, long nT) {
        if (nTP < 0 || nP < 0 || nT < 0) {
            throw new IllegalArgumentException(String.format(
                "counts must be non-negative, got nTP=%d, nP=%d, nT=%d", nTP, nP, nT));
        }
        if (nTP > nP || nTP > nT) {
            throw new IllegalArgumentException(String.format(
                "nTP must not exceed nP or nT, got nTP=%d, nP=%d, nT=%d", nTP, nP, nT));
        }
        double precision = nP == 0 ? 0.0 : (double) nTP / nP;
        double recall = nT == 0 ? 0.0 : (double) nTP / nT;
        double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
        return new Scores(precision, recall, f1);
    }
}
