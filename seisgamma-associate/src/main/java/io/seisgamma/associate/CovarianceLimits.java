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

/// Regularization floor and caps applied to every estimated covariance.
///
/// In order:
///
/// 1. `regCovar` is added to the diagonal, which is then floored at [#MIN_VARIANCE];
/// 2. the time variance is capped at `maxSigma11²`, the amplitude variance at `maxSigma22²`;
/// 3. the time/amplitude covariance is clamped to `±maxSigma12` and to
///    `±0.99 sqrt(var_time var_amp)` so the matrix stays positive definite.
///
/// Non-finite entries are replaced by the cap (diagonal) or zero (off-diagonal).
///
/// @param regCovar non-negative value added to the diagonal
/// @param maxSigma11 maximum time standard deviation, seconds
/// @param maxSigma22 maximum log-amplitude standard deviation
/// @param maxSigma12 maximum absolute time/amplitude covariance
public record CovarianceLimits(double regCovar, double maxSigma11, double maxSigma22, double maxSigma12) {

    /// Diagonal floor after regularization.
    public static final double MIN_VARIANCE = 1e-8;

    private static final double MAX_CORRELATION = 0.99;

    public static CovarianceLimits of(AssociationConfig config) {
        return new CovarianceLimits(config.regCovar(), config.maxSigma11(), config.maxSigma22(), config.maxSigma12());
    }

    /// Returns a regularized copy of `cov`.
    public double[][] apply(double[][] cov) {
        int nf = cov.length;
        double[][] out = new double[nf][nf];
        for (int a = 0; a < nf; a++) {
            double cap = a == 0 ? maxSigma11 * maxSigma11 : maxSigma22 * maxSigma22;
            double v = cov[a][a] + regCovar;
            if (!Double.isFinite(v)) {
                v = cap;
            }
            out[a][a] = Math.min(Math.max(v, MIN_VARIANCE), Math.max(cap, MIN_VARIANCE));
        }
        for (int a = 0; a < nf; a++) {
            for (int b = a + 1; b < nf; b++) {
                double c = Double.isFinite(cov[a][b]) ? cov[a][b] : 0.0;
                double limit = Math.min(maxSigma12, MAX_CORRELATION * Math.sqrt(out[a][a] * out[b][b]));
                c = Math.max(-limit, Math.min(limit, c));
                out[a][b] = c;
                out[b][a] = c;
            }
        }
        return out;
    }
}
