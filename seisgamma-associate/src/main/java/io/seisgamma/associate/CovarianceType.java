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

import com.google.gson.annotations.SerializedName;

/**
 * Built-in covariance structures, selected by {@code covariance_type}.
 */
public enum CovarianceType implements CovarianceModel {

    /** Full time/amplitude covariance, initial covariances shaped (K, F, F). */
    @SerializedName("full")
    FULL {
        @Override
        public double[][] estimate(double[][] residuals, double[] weights, double totalWeight) {
            int nf = residuals.length > 0 ? residuals[0].length : 0;
            double[][] cov = new double[nf][nf];
            for (int i = 0; i < residuals.length; i++) {
                double w = weights[i];
                if (w == 0) continue;
                for (int a = 0; a < nf; a++) {
                    for (int b = a; b < nf; b++) {
                        cov[a][b] += w * residuals[i][a] * residuals[i][b];
                    }
                }
            }
            for (int a = 0; a < nf; a++) {
                for (int b = a; b < nf; b++) {
                    cov[a][b] /= totalWeight;
                    cov[b][a] = cov[a][b];
                }
            }
            return cov;
        }

        @Override
        public int[] parameterShape(int nComponents, int nFeatures) {
            return new int[]{nComponents, nFeatures, nFeatures};
        }

        @Override
        public double[][] initialCovariance(Object covariances, int component, int nFeatures) {
            double[][] source = ((double[][][]) covariances)[component];
            double[][] copy = new double[nFeatures][];
            for (int a = 0; a < nFeatures; a++) {
                copy[a] = source[a].clone();
            }
            return copy;
        }
    },

    /** Independent time and amplitude residuals, initial covariances shaped (K, F). */
    @SerializedName("diag")
    DIAGONAL {
        @Override
        public double[][] estimate(double[][] residuals, double[] weights, double totalWeight) {
            int nf = residuals.length > 0 ? residuals[0].length : 0;
            double[][] cov = new double[nf][nf];
            for (int i = 0; i < residuals.length; i++) {
                for (int a = 0; a < nf; a++) {
                    cov[a][a] += weights[i] * residuals[i][a] * residuals[i][a];
                }
            }
            for (int a = 0; a < nf; a++) {
                cov[a][a] /= totalWeight;
            }
            return cov;
        }

        @Override
        public int[] parameterShape(int nComponents, int nFeatures) {
            return new int[]{nComponents, nFeatures};
        }

        @Override
        public double[][] initialCovariance(Object covariances, int component, int nFeatures) {
            double[] variances = ((double[][]) covariances)[component];
            double[][] cov = new double[nFeatures][nFeatures];
            for (int a = 0; a < nFeatures; a++) {
                cov[a][a] = variances[a];
            }
            return cov;
        }
    };

    /**
     * Parses {@code full} or {@code diag} (also {@code diagonal}), case-insensitively.
     */
    public static CovarianceType fromName(String name) {
        if (name != null) {
            switch (name.trim().toLowerCase()) {
                case "full":
                    return FULL;
                case "diag":
                case "diagonal":
                    return DIAGONAL;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("covariance_type must be 'full' or 'diag', got: " + name);
    }
}
