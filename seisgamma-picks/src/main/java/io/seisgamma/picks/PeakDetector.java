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

import java.util.Arrays;
import java.util.Objects;

/**
 * Detects peaks (local maxima, or minima in valley mode) in a 1-D score sequence.
 *
 * <h2>Algorithm</h2>
 *
 * <ol>
 *   <li>Compute first differences; NaN differences are treated as +&infin;</li>
 *   <li>Mark candidates from the sign of the left and right differences,
 *       according to the {@link EdgeMode plateau policy}</li>
 *   <li>Drop NaN samples, their immediate neighbors, and the first and last sample</li>
 *   <li>Drop candidates below the minimum peak height</li>
 *   <li>Drop candidates that do not exceed both neighbors by the threshold</li>
 *   <li>Walk candidates from tallest to shortest; each surviving peak removes
 *       every neighbor within the minimum peak distance</li>
 * </ol>
 *
 * <p>When two peaks of equal height compete inside one distance window the
 * earlier index is visited first and therefore survives.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Peaks peaks = PeakDetector.detect(scores, PeakDetectionOptions.builder()
 *     .minPeakHeight(0.3)
 *     .minPeakDistance(50)
 *     .build());
 * for (int i = 0; i < peaks.size(); i++) {
 *     int index = peaks.indices()[i];
 *     double amplitude = peaks.amplitudes()[i];
 * }
 * }</pre>
 */
public final class PeakDetector {

    private PeakDetector() {
        // Static utility class
    }

    /**
     * Detected peaks, ascending by index.
     *
     * @param indices offsets into the input sequence
     * @param amplitudes input values at those offsets (never negated, also in valley mode)
     */
    public record Peaks(int[] indices, double[] amplitudes) {

        static final Peaks EMPTY = new Peaks(new int[0], new double[0]);

        public int size() {
            return indices.length;
        }

        public boolean isEmpty() {
            return indices.length == 0;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Peaks other)) return false;
            return Arrays.equals(indices, other.indices) && Arrays.equals(amplitudes, other.amplitudes);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(indices) + Arrays.hashCode(amplitudes);
        }

        @Override
        public String toString() {
            return "Peaks[indices=" + Arrays.toString(indices) + ", amplitudes=" + Arrays.toString(amplitudes) + "]";
        }
    }

    /**
     * Detects peaks with {@link PeakDetectionOptions#defaults() default options}.
     */
    public static Peaks detect(double[] values) {
        return detect(values, PeakDetectionOptions.defaults());
    }

    /**
     * Detects peaks in single-precision scores, as produced by detector output tensors.
     */
    public static Peaks detect(float[] values, PeakDetectionOptions options) {
        Objects.requireNonNull(values, "values");
        double[] widened = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            widened[i] = values[i];
        }
        return detect(widened, options);
    }

    /**
     * Detects peaks in the given sequence.
     *
     * @param values the score sequence; not modified
     * @param options filtering rules
     * @return detected peaks, empty when fewer than 3 samples are given or nothing qualifies
     */
    public static Peaks detect(double[] values, PeakDetectionOptions options) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(options, "options");

        int n = values.length;
        if (n < 3) {
            return Peaks.EMPTY;
        }

        double sign = options.valley() ? -1.0 : 1.0;
        double[] x = new double[n];
        boolean[] nan = new boolean[n];
        boolean anyNaN = false;
        for (int i = 0; i < n; i++) {
            x[i] = sign * values[i];
            if (Double.isNaN(x[i])) {
                nan[i] = true;
                anyNaN = true;
            }
        }

        double[] dx = new double[n - 1];
        for (int i = 0; i < n - 1; i++) {
            double d = x[i + 1] - x[i];
            dx[i] = Double.isNaN(d) ? Double.POSITIVE_INFINITY : d;
        }
        if (anyNaN) {
            for (int i = 0; i < n; i++) {
                if (nan[i]) x[i] = Double.POSITIVE_INFINITY;
            }
        }

        int[] candidates = findCandidates(dx, n, options.edge(), nan, anyNaN);
        int count = candidates.length;

        if (count > 0 && options.minPeakHeight() != null) {
            double mph = sign * options.minPeakHeight();
            int kept = 0;
            for (int i = 0; i < count; i++) {
                if (x[candidates[i]] >= mph) {
                    candidates[kept++] = candidates[i];
                }
            }
            count = kept;
        }

        if (count > 0 && options.threshold() > 0) {
            int kept = 0;
            for (int i = 0; i < count; i++) {
                int idx = candidates[i];
                double rise = Math.min(x[idx] - x[idx - 1], x[idx] - x[idx + 1]);
                if (rise >= options.threshold()) {
                    candidates[kept++] = idx;
                }
            }
            count = kept;
        }

        int[] indices = Arrays.copyOf(candidates, count);
        if (count > 0 && options.minPeakDistance() > 1) {
            indices = suppressByDistance(indices, x, options.minPeakDistance(), options.keepPeaksSameHeight());
        }

        double[] amplitudes = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            amplitudes[i] = values[indices[i]];
        }
        return new Peaks(indices, amplitudes);
    }

    /**
     * Finds raw peak candidates from the signs of neighboring differences.
     * The difference to the left of the first sample and to the right of the
     * last sample is taken as zero.
     */
    private static int[] findCandidates(double[] dx, int n, EdgeMode edge, boolean[] nan, boolean anyNaN) {
        int[] out = new int[n];
        int count = 0;
        // first and last samples cannot be peaks
        for (int i = 1; i < n - 1; i++) {
            double left = dx[i - 1];
            double right = dx[i];
            boolean peak;
            if (edge == EdgeMode.NONE) {
                peak = right < 0 && left > 0;
            } else {
                peak = (edge.includesRising() && right <= 0 && left > 0)
                    || (edge.includesFalling() && right < 0 && left >= 0);
            }
            if (!peak) {
                continue;
            }
            if (anyNaN && (nan[i] || nan[i - 1] || nan[i + 1])) {
                continue;
            }
            out[count++] = i;
        }
        return Arrays.copyOf(out, count);
    }

    /**
     * Removes peaks closer than {@code mpd} samples to a taller retained peak.
     *
     * @param ascending candidate indices in ascending order
     * @return surviving indices in ascending order
     */
    private static int[] suppressByDistance(int[] ascending, double[] x, int mpd, boolean keepSameHeight) {
        int count = ascending.length;
        Integer[] order = new Integer[count];
        for (int i = 0; i < count; i++) {
            order[i] = i;
        }
        // tallest first; equal heights keep ascending index order
        Arrays.sort(order, (a, b) -> {
            int byHeight = Double.compare(x[ascending[b]], x[ascending[a]]);
            return byHeight != 0 ? byHeight : Integer.compare(a, b);
        });

        boolean[] removed = new boolean[count];
        for (int pos : order) {
            if (removed[pos]) {
                continue;
            }
            int center = ascending[pos];
            double height = x[center];
            for (int j = pos - 1; j >= 0 && ascending[j] >= center - mpd; j--) {
                if (!keepSameHeight || height > x[ascending[j]]) {
                    removed[j] = true;
                }
            }
            for (int j = pos + 1; j < count && ascending[j] <= center + mpd; j++) {
                if (!keepSameHeight || height > x[ascending[j]]) {
                    removed[j] = true;
                }
            }
        }

        int[] kept = new int[count];
        int k = 0;
        for (int i = 0; i < count; i++) {
            if (!removed[i]) {
                kept[k++] = ascending[i];
            }
        }
        return Arrays.copyOf(kept, k);
    }
}
