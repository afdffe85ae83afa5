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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link PickExtractor} on synthetic detector output.
 */
@Tag("unit")
public class PickExtractorTest {

    private static final int SAMPLES = 3000;
    private static final int P_INDEX = 500;
    private static final int S_INDEX = 1200;

    /// One Gaussian arrival per phase channel, sigma 5 samples; channel 0 is the remainder.
    private static PredictionTensor arrivals(int batches, int stations, int shiftPerBatch) {
        return PredictionTensor.generate(batches, SAMPLES, stations, 3, (b, t, s, c) -> {
            double p = gaussian(t, P_INDEX + b * shiftPerBatch);
            double sw = gaussian(t, S_INDEX + b * shiftPerBatch);
            switch (c) {
                case 1:
                    return (float) p;
                case 2:
                    return (float) sw;
                default:
                    return (float) Math.max(0.0, 1.0 - p - sw);
            }
        });
    }

    private static double gaussian(int t, int center) {
        double d = t - center;
        return Math.exp(-d * d / (2 * 5.0 * 5.0));
    }

    // ==================== Basic extraction ====================

    @Test
    void extractsOnePickPerPhase() {
        PickExtractor extractor = new PickExtractor();
        List<PickRecord> picks = extractor.extract(arrivals(1, 1, 0),
            List.of("2019-07-06.mseed"), List.of("2019-07-06T02:15:00.000"), List.of(List.of("CI.PASC")));

        assertThat(picks).hasSize(2);
        PickRecord p = picks.get(0);
        assertThat(p.phaseType()).isEqualTo("P");
        assertThat(p.phaseIndex()).isEqualTo(P_INDEX);
        assertThat(p.phaseTime()).isEqualTo("2019-07-06T02:15:05.000");
        assertThat(p.phaseScore()).isEqualTo(1.0);
        assertThat(p.fileName()).isEqualTo("2019-07-06.mseed");
        assertThat(p.stationId()).isEqualTo("CI.PASC");
        assertThat(p.beginTime()).isEqualTo("2019-07-06T02:15:00.000");
        assertEquals(0.01, p.dt(), 0.0);
        assertThat(p.hasAmplitude()).isFalse();

        PickRecord s = picks.get(1);
        assertThat(s.phaseType()).isEqualTo("S");
        assertThat(s.phaseIndex()).isEqualTo(S_INDEX);
        assertThat(s.phaseTime()).isEqualTo("2019-07-06T02:15:12.000");
        assertThat(p.phaseIndex()).isLessThan(s.phaseIndex());
    }

    @Test
    void missingMetadataGetsPlaceholders() {
        List<PickRecord> picks = new PickExtractor().extract(arrivals(1, 2, 0));

        assertThat(picks).hasSize(4);
        assertThat(picks).extracting(PickRecord::fileName).containsOnly("0000");
        assertThat(picks).extracting(PickRecord::stationId).containsExactly("0000", "0000", "0001", "0001");
        assertThat(picks).extracting(PickRecord::beginTime).containsOnly(Timestamps.EPOCH);
        assertThat(picks.get(0).phaseTime()).isEqualTo("1970-01-01T00:00:05.000");
    }

    @Test
    void scoresAreProbabilitiesAboveThreshold() {
        PickExtractorConfig config = PickExtractorConfig.builder().minProb(0.5).build();
        List<PickRecord> picks = new PickExtractor(config).extract(arrivals(2, 3, 37));

        assertThat(picks).isNotEmpty();
        for (PickRecord pick : picks) {
            assertThat(pick.phaseScore()).isBetween(0.5, 1.0);
            assertThat(pick.phaseIndex()).isBetween(0, SAMPLES - 1);
        }
    }

    @Test
    void noiseOnlyInputHasNoPicks() {
        Random rng = new Random(20190706L);
        PredictionTensor noise = PredictionTensor.generate(1, SAMPLES, 2, 3,
            (b, t, s, c) -> c == 0 ? 0.9f : (float) (rng.nextDouble() * 0.1));

        assertThat(new PickExtractor().extract(noise)).isEmpty();

        // the same noise has local maxima, which only the height threshold removes
        PickExtractorConfig permissive = PickExtractorConfig.builder().minProb(0.01).build();
        assertThat(new PickExtractor(permissive).extract(noise)).isNotEmpty();
    }

    @Test
    void singleStationRowAppliesToEveryItem() {
        PickBatch batch = PickBatch.builder(arrivals(3, 1, 0))
            .stationIds(List.of(List.of("CI.PASC")))
            .build();
        List<PickRecord> picks = new PickExtractor().extract(batch);

        assertThat(picks).hasSize(6);
        assertThat(picks).extracting(PickRecord::stationId).containsOnly("CI.PASC");
    }

    @Test
    void tooFewStationRowsAreRejected() {
        assertThatThrownBy(() -> PickBatch.builder(arrivals(3, 1, 0))
            .stationIds(List.of(List.of("CI.PASC"), List.of("CI.RPV")))
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("stationIds");
    }

    @Test
    void byteNamesAreDecoded() {
        PickBatch batch = PickBatch.builder(arrivals(1, 1, 0))
            .fileNames(List.of("wave_ü.mseed".getBytes(StandardCharsets.UTF_8)))
            .stationIds(List.of(List.of("NC.KRP".getBytes(StandardCharsets.UTF_8))))
            .build();
        List<PickRecord> picks = new PickExtractor().extract(batch);

        assertThat(picks).extracting(PickRecord::fileName).containsOnly("wave_ü.mseed");
        assertThat(picks).extracting(PickRecord::stationId).containsOnly("NC.KRP");
    }

    @Test
    void eachBatchItemKeepsItsFileName() {
        List<PickRecord> picks = new PickExtractor().extract(arrivals(3, 1, 100));

        assertThat(picks).extracting(PickRecord::fileName).containsExactly(
            "0000", "0000", "0001", "0001", "0002", "0002");
        assertThat(picks).extracting(PickRecord::phaseIndex).containsExactly(
            500, 1200, 600, 1300, 700, 1400);
    }

    @Test
    void sharedFileNameAppliesToAllItems() {
        PickBatch batch = PickBatch.builder(arrivals(2, 1, 0)).fileName("day.h5").build();
        assertThat(new PickExtractor().extract(batch)).extracting(PickRecord::fileName).containsOnly("day.h5");
    }

    @Test
    void perPhaseThresholdOverridesDefault() {
        PredictionTensor tensor = PredictionTensor.generate(1, SAMPLES, 1, 3, (b, t, s, c) -> {
            if (c == 1) return (float) (0.4 * gaussian(t, P_INDEX));
            if (c == 2) return (float) (0.4 * gaussian(t, S_INDEX));
            return 0.6f;
        });
        PickExtractorConfig config = PickExtractorConfig.builder().minProb(0.3).minSProb(0.5).build();

        List<PickRecord> picks = new PickExtractor(config).extract(tensor);

        assertThat(picks).extracting(PickRecord::phaseType).containsExactly("P");
        assertThat(picks.get(0).phaseScore()).isEqualTo(0.4);
    }

    // ==================== Parallel extraction ====================

    @Test
    void parallelExtractionEqualsSequential() {
        PickBatch batch = PickBatch.of(arrivals(6, 4, 53));
        PickExtractor extractor = new PickExtractor();
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            assertThat(extractor.extract(batch, executor)).isEqualTo(extractor.extract(batch));
        } finally {
            executor.shutdownNow();
        }
    }

    // ==================== Amplitudes ====================

    @Test
    void amplitudeIsMaxAbsoluteWaveformAfterPick() {
        PredictionTensor waveforms = PredictionTensor.generate(1, SAMPLES, 1, 3, (b, t, s, c) -> {
            if (c == 2 && t >= 600 && t < 610) return -5.0f;
            if (c == 0 && t == 1300) return 2.0f;
            return 0.1f;
        });
        PickBatch batch = PickBatch.builder(arrivals(1, 1, 0)).waveforms(waveforms).build();
        PickExtractorConfig config = PickExtractorConfig.builder().useAmplitude(true).build();

        List<PickRecord> picks = new PickExtractor(config).extract(batch);

        assertThat(picks).hasSize(2);
        assertThat(picks.get(0).phaseAmplitude()).isEqualTo(5.0);
        assertThat(picks.get(1).phaseAmplitude()).isEqualTo(2.0);
        assertThat(picks).allMatch(PickRecord::hasAmplitude);
    }

    @Test
    void amplitudeIsNotMeasuredWithoutWaveforms() {
        PickExtractorConfig config = PickExtractorConfig.builder().useAmplitude(true).build();
        List<PickRecord> picks = new PickExtractor(config).extract(arrivals(1, 1, 0));
        assertThat(picks).noneMatch(PickRecord::hasAmplitude);
    }

    // ==================== Validation ====================

    @Test
    void rejectsMorePhaseChannelsThanNames() {
        PickExtractorConfig config = PickExtractorConfig.builder().phases(List.of("P")).build();
        assertThatThrownBy(() -> new PickExtractor(config).extract(arrivals(1, 1, 0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("phase");
    }

    @Test
    void rejectsMismatchedWaveforms() {
        PredictionTensor waveforms = PredictionTensor.generate(1, 100, 1, 3, (b, t, s, c) -> 0f);
        assertThatThrownBy(() -> PickBatch.builder(arrivals(1, 1, 0)).waveforms(waveforms).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsTooFewFileNames() {
        assertThatThrownBy(() -> PickBatch.builder(arrivals(2, 1, 0)).fileNames(List.of("only-one")).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("fileNames");
    }
}
