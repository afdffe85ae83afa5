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

import io.seisgamma.picks.DetectionMetrics.Scores;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
public class DetectionMetricsTest {

    @Test
    void perfectDetection() {
        Scores scores = DetectionMetrics.calc(10, 10, 10);
        assertThat(scores.precision()).isEqualTo(1.0);
        assertThat(scores.recall()).isEqualTo(1.0);
        assertThat(scores.f1()).isEqualTo(1.0);
    }

    @Test
    void halfPrecision() {
        Scores scores = DetectionMetrics.calc(5, 10, 5);
        assertThat(scores.precision()).isEqualTo(0.5);
        assertThat(scores.recall()).isEqualTo(1.0);
    }

    @Test
    void lowRecall() {
        Scores scores = DetectionMetrics.calc(2, 2, 10);
        assertThat(scores.precision()).isEqualTo(1.0);
        assertThat(scores.recall()).isEqualTo(0.2);
    }

    @Test
    void f1IsHarmonicMean() {
        Scores scores = DetectionMetrics.calc(6, 10, 8);
        double p = 6 / 10.0;
        double r = 6 / 8.0;
        assertThat(scores.f1()).isCloseTo(2 * p * r / (p + r), within(1e-12));

        Scores other = DetectionMetrics.calc(3, 5, 8);
        double p2 = 3 / 5.0;
        double r2 = 3 / 8.0;
        assertThat(other.f1()).isCloseTo(2 * p2 * r2 / (p2 + r2), within(1e-12));
    }

    @Test
    void zeroDenominatorsGiveZero() {
        Scores scores = DetectionMetrics.calc(0, 0, 0);
        assertThat(scores.precision()).isZero();
        assertThat(scores.recall()).isZero();
        assertThat(scores.f1()).isZero();
    }

    @Test
    void rejectsInconsistentCounts() {
        assertThatThrownBy(() -> DetectionMetrics.calc(-1, 2, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DetectionMetrics.calc(5, 4, 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
