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

import java.util.Objects;

/**
 * Immutable 4-D single-precision array indexed by (batch, time, station, channel).
 *
 * <p>For detector output the channel axis is [noise, first phase, second phase, ...].
 * The same layout carries waveforms, where the channel axis holds the recorded
 * components. Storage is one flat row-major array; the channel index varies fastest.
 */
public final class PredictionTensor {

    private final float[] data;
    private final int batches;
    private final int samples;
    private final int stations;
    private final int channels;

    private PredictionTensor(float[] data, int batches, int samples, int stations, int channels) {
        this.data = data;
        this.batches = batches;
        this.samples = samples;
        this.stations = stations;
        this.channels = channels;
    }

    /**
     * Copies a nested {@code [batch][time][station][channel]} array.
     *
     * @throws IllegalArgumentException if the nested array is ragged
     */
    public static PredictionTensor of(float[][][][] values) {
        Objects.requireNonNull(values, "values");
        int nb = values.length;
        int nt = nb > 0 ? values[0].length : 0;
        int ns = nt > 0 ? values[0][0].length : 0;
        int nc = ns > 0 ? values[0][0][0].length : 0;
        float[] flat = new float[Math.multiplyExact(Math.multiplyExact(nb, nt), Math.multiplyExact(ns, nc))];
        int pos = 0;
        for (int b = 0; b < nb; b++) {
            requireLength(values[b].length, nt, "time", b);
            for (int t = 0; t < nt; t++) {
                requireLength(values[b][t].length, ns, "station", b);
                for (int s = 0; s < ns; s++) {
                    requireLength(values[b][t][s].length, nc, "channel", b);
                    System.arraycopy(values[b][t][s], 0, flat, pos, nc);
                    pos += nc;
                }
            }
        }
        return new PredictionTensor(flat, nb, nt, ns, nc);
    }

    /**
     * Copies a flat row-major array with the given dimensions.
     */
    public static PredictionTensor of(float[] flat, int batches, int samples, int stations, int channels) {
        Objects.requireNonNull(flat, "flat");
        if (batches < 0 || samples < 0 || stations < 0 || channels < 0) {
            throw new IllegalArgumentException("dimensions must be non-negative");
        }
        long expected = (long) batches * samples * stations * channels;
        if (flat.length != expected) {
            throw new IllegalArgumentException(String.format(
                "flat array has %d values, expected %d for shape (%d, %d, %d, %d)",
                flat.length, expected, batches, samples, stations, channels));
        }
        return new PredictionTensor(flat.clone(), batches, samples, stations, channels);
    }

    /**
     * Creates a tensor of zeros, filled through a {@link Filler}.
     */
    public static PredictionTensor generate(int batches, int samples, int stations, int channels, Filler filler) {
        float[] flat = new float[Math.multiplyExact(Math.multiplyExact(batches, samples), Math.multiplyExact(stations, channels))];
        int pos = 0;
        for (int b = 0; b < batches; b++) {
            for (int t = 0; t < samples; t++) {
                for (int s = 0; s < stations; s++) {
                    for (int c = 0; c < channels; c++) {
                        flat[pos++] = filler.value(b, t, s, c);
                    }
                }
            }
        }
        return new PredictionTensor(flat, batches, samples, stations, channels);
    }

    /** Supplies one value per (batch, time, station, channel) position. */
    @FunctionalInterface
    public interface Filler {
        float value(int batch, int time, int station, int channel);
    }

    private static void requireLength(int actual, int expected, String axis, int batch) {
        if (actual != expected) {
            throw new IllegalArgumentException(String.format(
                "ragged tensor: %s axis has length %d in batch %d, expected %d", axis, actual, batch, expected));
        }
    }

    public int batches() {
        return batches;
    }

    public int samples() {
        return samples;
    }

    public int stations() {
        return stations;
    }

    public int channels() {
        return channels;
    }

    public float get(int batch, int time, int station, int channel) {
        return data[offset(batch, time, station, channel)];
    }

    /**
     * Copies the time series of one (batch, station, channel) slice.
     */
    public double[] slice(int batch, int station, int channel) {
        checkIndex(batch, station, channel);
        double[] out = new double[samples];
        int stride = stations * channels;
        int pos = offset(batch, 0, station, channel);
        for (int t = 0; t < samples; t++, pos += stride) {
            out[t] = data[pos];
        }
        return out;
    }

    /**
     * Per-sample maximum absolute value across all channels of one (batch, station) slot.
     */
    public double[] maxAbsOverChannels(int batch, int station) {
        checkIndex(batch, station, 0);
        double[] out = new double[samples];
        for (int t = 0; t < samples; t++) {
            int pos = offset(batch, t, station, 0);
            double max = 0;
            for (int c = 0; c < channels; c++) {
                max = Math.max(max, Math.abs(data[pos + c]));
            }
            out[t] = max;
        }
        return out;
    }

    private void checkIndex(int batch, int station, int channel) {
        Objects.checkIndex(batch, batches);
        Objects.checkIndex(station, stations);
        Objects.checkIndex(channel, channels);
    }

    private int offset(int batch, int time, int station, int channel) {
        return ((batch * samples + time) * stations + station) * channels + channel;
    }

    @Override
    public String toString() {
        return String.format("PredictionTensor[shape=(%d, %d, %d, %d)]", batches, samples, stations, channels);
    }
}
