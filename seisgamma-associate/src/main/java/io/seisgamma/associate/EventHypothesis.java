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

/// One fitted mixture component: a candidate seismic source.
///
/// @param location event coordinates in configured dim order
/// @param originTime origin time, epoch seconds
/// @param magnitude magnitude, NaN when amplitudes are not used
/// @param covariance feature covariance around the predicted arrivals (F x F)
/// @param weight mixing weight
/// @param pickCount effective pick count, the weighted responsibility sum
public record EventHypothesis(
    double[] location,
    double originTime,
    double magnitude,
    double[][] covariance,
    double weight,
    double pickCount
) {

    /// Standard deviation of arrival-time residuals, seconds.
    public double sigmaTime() {
        return Math.sqrt(covariance[0][0]);
    }

    /// Standard deviation of log-amplitude residuals, NaN without amplitudes.
    public double sigmaAmplitude() {
        return covariance.length > 1 ? Math.sqrt(covariance[1][1]) : Double.NaN;
    }

    /// Time/amplitude residual covariance, NaN without amplitudes.
    public double covTimeAmplitude() {
        return covariance.length > 1 ? covariance[0][1] : Double.NaN;
    }

    @Override
    public String toString() {
        StringBuilder loc = new StringBuilder();
        for (int d = 0; d < location.length; d++) {
            if (d > 0) loc.append(", ");
            loc.append(String.format("%.3f", location[d]));
        }
        return String.format("EventHypothesis[loc=(%s), t0=%.3f, M=%.2f, sigmaT=%.3f, weight=%.3f, picks=%.1f]",
            loc, originTime, magnitude, sigmaTime(), weight, pickCount);
    }
}
