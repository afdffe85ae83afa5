package io.seisgamma.associate;

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

/// Row-aligned engine inputs produced by [PickFeatureConverter].
///
/// Row `i` of every array describes the same pick; `pickIndex[i]` is that
/// pick's position in the converter's input list.
///
/// @param data feature matrix: epoch seconds, plus `log10(amp * 100)` when amplitudes are used
/// @param locations station coordinates in configured dim order
/// @param phaseTypes lowercase phase types
/// @param phaseWeights pick weights as an `n x 1` column
/// @param pickIndex original input position of each row
/// @param pickStationIds `id + "_" + type` of each row
public record PickFeatures(
    double[][] data,
    double[][] locations,
    String[] phaseTypes,
    double[][] phaseWeights,
    int[] pickIndex,
    String[] pickStationIds
) {

    /// Number of surviving picks.
    public int size() {
        return data.length;
    }

    /// The weight column flattened to a vector.
    public double[] weights() {
        double[] w = new double[phaseWeights.length];
        for (int i = 0; i < w.length; i++) {
            w[i] = phaseWeights[i][0];
        }
        return w;
    }
}
