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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Detector output for one extraction call, with the per-item metadata that
/// turns sample offsets into named, timestamped picks.
///
/// Metadata may be absent; defaults are filled in deterministically:
///
/// | Field | Default |
/// |-------|---------|
/// | file name | batch index as `%04d` |
/// | station id | station slot as `%04d` (also when an item's station list is empty) |
/// | begin time | `1970-01-01T00:00:00.000` |
///
/// Names may be given as `String` or as UTF-8 `byte[]`; bytes are decoded.
public final class PickBatch {

    private final PredictionTensor predictions;
    private final PredictionTensor waveforms;
    private final List<String> fileNames;
    private final List<String> beginTimes;
    private final List<List<String>> stationIds;

    private PickBatch(Builder builder) {
        this.predictions = Objects.requireNonNull(builder.predictions, "predictions");
        this.waveforms = builder.waveforms;
        int nb = predictions.batches();
        this.fileNames = resolveFileNames(builder.fileNames, builder.singleFileName, nb);
        this.beginTimes = resolveBeginTimes(builder.beginTimes, nb);
        this.stationIds = resolveStationIds(builder.stationIds, nb, predictions.stations());
        if (waveforms != null
            && (waveforms.batches() != nb
                || waveforms.samples() != predictions.samples()
                || waveforms.stations() != predictions.stations())) {
            throw new IllegalArgumentException("waveforms " + waveforms
                + " do not match predictions " + predictions + " in batch, time and station axes");
        }
    }

    public static PickBatch of(PredictionTensor predictions) {
        return builder(predictions).build();
    }

    public static Builder builder(PredictionTensor predictions) {
        return new Builder(predictions);
    }

    public PredictionTensor predictions() {
        return predictions;
    }

    /// Waveforms aligned with the predictions, or null when amplitudes are not measured.
    public PredictionTensor waveforms() {
        return waveforms;
    }

    public String fileName(int batch) {
        return fileNames.get(batch);
    }

    public String beginTime(int batch) {
        return beginTimes.get(batch);
    }

    public String stationId(int batch, int station) {
        return stationIds.get(batch).get(station);
    }

    private static List<String> resolveFileNames(List<?> names, Object single, int nb) {
        List<String> out = new ArrayList<>(nb);
        for (int i = 0; i < nb; i++) {
            if (names != null) {
                out.add(decode(element(names, i, "fileNames"), "fileNames"));
            } else if (single != null) {
                out.add(decode(single, "fileName"));
            } else {
                out.add(placeholder(i));
            }
        }
        return Collections.unmodifiableList(out);
    }

    private static List<String> resolveBeginTimes(List<?> times, int nb) {
        List<String> out = new ArrayList<>(nb);
        for (int i = 0; i < nb; i++) {
            String raw = times == null ? Timestamps.EPOCH : decode(element(times, i, "beginTimes"), "beginTimes");
            // re-rendered so that every pick carries the same millisecond format
            out.add(Timestamps.calcTimestamp(raw, 0.0));
        }
        return Collections.unmodifiableList(out);
    }

    private static List<List<String>> resolveStationIds(List<? extends List<?>> ids, int nb, int ns) {
        List<List<String>> out = new ArrayList<>(nb);
        for (int i = 0; i < nb; i++) {
            List<?> row;
            if (ids == null || ids.isEmpty()) {
                row = null;
            } else if (ids.size() == 1) {
                // one row applies to every batch item
                row = ids.get(0);
            } else {
                row = (List<?>) element(ids, i, "stationIds");
            }
            List<String> resolved = new ArrayList<>(ns);
            for (int j = 0; j < ns; j++) {
                if (row == null || row.isEmpty()) {
                    resolved.add(placeholder(j));
                } else {
                    resolved.add(decode(element(row, j, "stationIds[" + i + "]"), "stationIds"));
                }
            }
            out.add(Collections.unmodifiableList(resolved));
        }
        return Collections.unmodifiableList(out);
    }

    private static Object element(List<?> values, int index, String name) {
        if (index >= values.size()) {
            throw new IllegalArgumentException(String.format(
                "%s has %d entries but entry %d was requested", name, values.size(), index));
        }
        return values.get(index);
    }

    static String placeholder(int index) {
        return String.format("%04d", index);
    }

    static String decode(Object value, String name) {
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        throw new IllegalArgumentException(name + " entries must be String or byte[], got: "
            + (value == null ? "null" : value.getClass().getName()));
    }

    public static final class Builder {
        private final PredictionTensor predictions;
        private PredictionTensor waveforms;
        private List<?> fileNames;
        private Object singleFileName;
        private List<?> beginTimes;
        private List<? extends List<?>> stationIds;

        private Builder(PredictionTensor predictions) {
            this.predictions = predictions;
        }

        /// One name per batch item.
        public Builder fileNames(List<?> fileNames) {
            this.fileNames = fileNames;
            return this;
        }

        /// One name shared by every batch item.
        public Builder fileName(Object fileName) {
            this.singleFileName = fileName;
            return this;
        }

        public Builder beginTimes(List<?> beginTimes) {
            this.beginTimes = beginTimes;
            return this;
        }

        /// Station ids per batch item; a single row is reused for all items.
        public Builder stationIds(List<? extends List<?>> stationIds) {
            this.stationIds = stationIds;
            return this;
        }

        public Builder waveforms(PredictionTensor waveforms) {
            this.waveforms = waveforms;
            return this;
        }

        public PickBatch build() {
            return new PickBatch(this);
        }
    }
}
