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

/**
 * Caller-supplied starting point for a fit. Any part may be null, in which
 * case it is initialized from the picks.
 *
 * <p>With {@code K} components, {@code D} dims and {@code F} features the
 * expected shapes are:
 * <ul>
 *   <li>{@code weights}: (K,)</li>
 *   <li>{@code means}: (K, D + F), rows {@code [coordinates..., origin time, magnitude]},
 *       the magnitude column only when amplitudes are used</li>
 *   <li>{@code covariances}: {@code double[K][F][F]} for {@link CovarianceType#FULL},
 *       {@code double[K][F]} for {@link CovarianceType#DIAGONAL}</li>
 * </ul>
 * Shapes are checked when the fit starts.
 */
public record InitialParameters(double[] weights, double[][] means, Object covariances) {

    public static InitialParameters none() {
        return new InitialParameters(null, null, null);
    }

    public InitialParameters withWeights(double[] weights) {
        return new InitialParameters(weights, means, covariances);
    }

    public InitialParameters withMeans(double[][] means) {
        return new InitialParameters(weights, means, covariances);
    }

    public InitialParameters withCovariances(Object covariances) {
        return new InitialParameters(weights, means, covariances);
    }
}
