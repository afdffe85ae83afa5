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
 * Filtering rules applied by {@link PeakDetector}.
 *
 * <p>Instances are immutable and validated when built:
 * <pre>{@code
 * PeakDetectionOptions options = PeakDetectionOptions.builder()
 *     .minPeakHeight(0.3)
 *     .minPeakDistance(50)
 *     .build();
 * }</pre>
 *
 * @param minPeakHeight minimum amplitude of a peak, or {@code null} for no floor
 * @param minPeakDistance minimum index separation between retained peaks (values below 2 disable suppression)
 * @param threshold minimum difference between a peak and both of its neighbors
 * @param edge plateau handling
 * @param keepPeaksSameHeight when true, distance suppression only removes strictly shorter neighbors
 * @param valley detect minima instead of maxima
 */
public record PeakDetectionOptions(
    Double minPeakHeight,
    int minPeakDistance,
    double threshold,
    EdgeMode edge,
    boolean keepPeaksSameHeight,
    boolean valley
) {

    public PeakDetectionOptions {
        if (minPeakHeight != null && minPeakHeight.isNaN()) {
            throw new IllegalArgumentException("minPeakHeight must not be NaN");
        }
        if (minPeakDistance < 0) {
            throw new IllegalArgumentException("minPeakDistance must be >= 0, got: " + minPeakDistance);
        }
        if (Double.isNaN(threshold) || threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0, got: " + threshold);
        }
        if (edge == null) {
            edge = EdgeMode.NONE;
        }
    }

    /**
     * Options matching the classic defaults: no height floor, no distance
     * suppression, no threshold, rising-edge plateaus.
     */
    public static PeakDetectionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .minPeakHeight(minPeakHeight)
            .minPeakDistance(minPeakDistance)
            .threshold(threshold)
            .edge(edge)
            .keepPeaksSameHeight(keepPeaksSameHeight)
            .valley(valley);
    }

    public static final class Builder {
        private Double minPeakHeight;
        private int minPeakDistance = 1;
        private double threshold = 0.0;
        private EdgeMode edge = EdgeMode.RISING;
        private boolean keepPeaksSameHeight;
        private boolean valley;

        private Builder() {
        }

        public Builder minPeakHeight(Double minPeakHeight) {
            this.minPeakHeight = minPeakHeight;
            return this;
        }

        public Builder minPeakDistance(int minPeakDistance) {
            this.minPeakDistance = minPeakDistance;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder edge(EdgeMode edge) {
            this.edge = edge;
            return this;
        }

        public Builder keepPeaksSameHeight(boolean keepPeaksSameHeight) {
            this.keepPeaksSameHeight = keepPeaksSameHeight;
            return this;
        }

        public Builder valley(boolean valley) {
            this.valley = valley;
            return this;
        }

        public PeakDetectionOptions build() {
            return new PeakDetectionOptions(minPeakHeight, minPeakDistance, threshold,
                edge, keepPeaksSameHeight, valley);
        }
    }
}
