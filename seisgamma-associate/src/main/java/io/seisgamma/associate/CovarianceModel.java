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

/// Estimates a component's feature covariance from its pick residuals.
///
/// Residuals are observed features minus the features the component predicts
/// for each pick (arrival time from the travel-time model, log amplitude from
/// the amplitude model), so the covariance describes the spread around the
/// physical prediction rather than around a free mean. Regularization and the
/// sigma caps are applied by the engine afterwards through [CovarianceLimits].
///
/// @see CovarianceType
public interface CovarianceModel {

    /// Weighted covariance of the residual rows.
    ///
    /// @param residuals one row per pick, `nFeatures` columns
    /// @param weights non-negative pick weights times responsibilities
    /// @param totalWeight sum of `weights`, positive
    /// @return an `nFeatures x nFeatures` symmetric matrix
    double[][] estimate(double[][] residuals, double[] weights, double totalWeight);

    /// Expected shape of caller-supplied initial covariances.
    int[] parameterShape(int nComponents, int nFeatures);

    /// Expands one component of caller-supplied initial covariances to a full matrix.
    double[][] initialCovariance(Object covariances, int component, int nFeatures);
}
