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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Turns detector probability tensors into discrete {@link PickRecord picks}.
 *
 * <p>Every (batch item, station slot, phase channel) slice is scanned with
 * {@link PeakDetector}; channel 0 is the noise channel and is skipped. Channel
 * {@code c >= 1} is labelled with the {@code (c - 1)}-th configured phase name.
 *
 * <p>Picks are returned ordered by batch item, station slot, phase channel and
 * sample index. The extractor keeps the order in which arrivals occur in the
 * input; it does not reorder or pair P and S picks.
 *
 * <p>Instances hold only their configuration and may be shared between threads.
 */
public final class PickExtractor {

    private static final Logger logger = LogManager.getLogger(PickExtractor.class);

    /** Amplitude search window after a pick, in multiples of the post window. */
    private static final int AMPLITUDE_WINDOW_MULTIPLE = 3;

    private final PickExtractorConfig config;

    public PickExtractor() {
        this(PickExtractorConfig.defaults());
    }

    public PickExtractor(PickExtractorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public PickExtractorConfig config() {
        return config;
    }

    /**
     * Extracts picks with default metadata.
     */
    public List<PickRecord> extract(PredictionTensor predictions) {
        return extract(PickBatch.of(predictions));
    }

    /**
     * Extracts picks; any metadata list may be null.
     *
     * @param predictions detector output, channels [noise, phases...]
     * @param fileNames one name per batch item ({@code String} or UTF-8 {@code byte[]})
     * @param beginTimes one ISO-8601 start time per batch item
     * @param stationIds station ids per batch item and station slot
     */
    public List<PickRecord> extract(PredictionTensor predictions, List<?> fileNames,
                                    List<?> beginTimes, List<? extends List<?>> stationIds) {
        return extract(PickBatch.builder(predictions)
            .fileNames(fileNames)
            .beginTimes(beginTimes)
            .stationIds(stationIds)
            .build());
    }

    /**
     * Extracts picks from every batch item, sequentially.
     */
    public List<PickRecord> extract(PickBatch batch) {
        checkChannels(batch.predictions());
        List<PickRecord> picks = new ArrayList<>();
        for (int b = 0; b < batch.predictions().batches(); b++) {
            picks.addAll(extractItem(batch, b));
        }
        logger.debug("Extracted {} picks from {}", picks.size(), batch.predictions());
        return picks;
    }

    /**
     * Extracts picks with one task per batch item on the given executor.
     * The result is concatenated in batch order, so it equals the sequential result.
     *
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public List<PickRecord> extract(PickBatch batch, ExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        checkChannels(batch.predictions());
        int nb = batch.predictions().batches();
        List<Future<List<PickRecord>>> futures = new ArrayList<>(nb);
        for (int b = 0; b < nb; b++) {
            final int item = b;
            futures.add(executor.submit(() -> extractItem(batch, item)));
        }

        List<PickRecord> picks = new ArrayList<>();
        try {
            for (Future<List<PickRecord>> future : futures) {
                picks.addAll(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while extracting picks", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Pick extraction failed", cause);
        }
        logger.debug("Extracted {} picks from {} on {} tasks", picks.size(), batch.predictions(), nb);
        return picks;
    }

    private void checkChannels(PredictionTensor predictions) {
        int phaseChannels = predictions.channels() - 1;
        if (phaseChannels > config.phases().size()) {
            throw new IllegalArgumentException(String.format(
                "Tensor has %d phase channels but only %d phase names are configured: %s",
                phaseChannels, config.phases().size(), config.phases()));
        }
    }

    private List<PickRecord> extractItem(PickBatch batch, int b) {
        PredictionTensor predictions = batch.predictions();
        PredictionTensor waveforms = config.useAmplitude() ? batch.waveforms() : null;
        String fileName = batch.fileName(b);
        String beginTime = batch.beginTime(b);
        LocalDateTime begin = Timestamps.parseLocal(beginTime);
        double dt = config.dt();
        int amplitudeWindow = config.postWindowSamples() * AMPLITUDE_WINDOW_MULTIPLE;

        List<PickRecord> picks = new ArrayList<>();
        for (int s = 0; s < predictions.stations(); s++) {
            String stationId = batch.stationId(b, s);
            double[] amplitude = waveforms == null ? null : waveforms.maxAbsOverChannels(b, s);

            for (int c = 1; c < predictions.channels(); c++) {
                String phase = config.phases().get(c - 1);
                PeakDetectionOptions options = PeakDetectionOptions.builder()
                    .minPeakHeight(config.minProbability(phase))
                    .minPeakDistance(config.minPeakDistance())
                    .build();
                PeakDetector.Peaks peaks = PeakDetector.detect(predictions.slice(b, s, c), options);

                int[] idx = peaks.indices();
                for (int l = 0; l < idx.length; l++) {
                    int index = idx[l];
                    double phaseAmplitude = Double.NaN;
                    if (amplitude != null) {
                        int next = l < idx.length - 1 ? idx[l + 1] : index + amplitudeWindow;
                        int end = Math.min(Math.min(index + amplitudeWindow, next), amplitude.length);
                        phaseAmplitude = max(amplitude, index, Math.max(end, index + 1));
                    }
                    picks.add(new PickRecord(
                        fileName,
                        stationId,
                        beginTime,
                        index,
                        Timestamps.format(Timestamps.plusSeconds(begin, index * dt)),
                        roundScore(peaks.amplitudes()[l]),
                        phase,
                        dt,
                        phaseAmplitude));
                }
            }
        }
        return picks;
    }

    private static double max(double[] values, int from, int to) {
        double max = values[from];
        for (int i = from + 1; i < to; i++) {
            max = Math.max(max, values[i]);
        }
        return max;
    }

    private static double roundScore(double score) {
        return Math.round(score * 1000.0) / 1000.0;
    }
}
