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

import java.util.Arrays;
import java.util.StringJoiner;

/// Validation gates run by [GaussianMixtureAssociator] before any numeric work.
///
/// ## Shapes
///
/// Shapes are written as tuples: `()` for a scalar, `(3,)` for a vector of
/// three, `(2, 4)` for a matrix. Supported parameter types:
///
/// | Type | Shape |
/// |------|-------|
/// | `Number` | `()` |
/// | `double[]` | `(n,)` |
/// | `double[][]` | `(n, m)`, rows must be equal length |
/// | `double[][][]` | `(n, m, l)`, must be rectangular |
///
/// ## Observations
///
/// [#checkObservations] accepts `double[][]`, `float[][]`, `int[][]` and
/// `long[][]` and always returns a fresh `double[][]`; caller arrays are never
/// modified or aliased.
public final class MixtureValidation {

    private MixtureValidation() {
    }

    /// Fails unless `param` has exactly the `expected` shape.
    ///
    /// @throws ParameterShapeException on mismatch
    /// @throws IllegalArgumentException if `param` is null, ragged, or of an unsupported type
    public static void checkShape(Object param, int[] expected, String name) {
        int[] actual = shapeOf(param, name);
        if (!Arrays.equals(actual, expected)) {
            throw new ParameterShapeException(name, formatShape(expected), formatShape(actual));
        }
    }

    /// Shape of a supported parameter value.
    public static int[] shapeOf(Object param, String name) {
        if (param == null) {
            throw new IllegalArgumentException("The parameter '" + name + "' must not be null");
        }
        if (param instanceof Number) {
            return new int[0];
        }
        if (param instanceof double[] vector) {
            return new int[]{vector.length};
        }
        if (param instanceof double[][] matrix) {
            return new int[]{matrix.length, rectangularWidth(matrix, name)};
        }
        if (param instanceof double[][][] cube) {
            int rows = cube.length > 0 ? cube[0].length : 0;
            int cols = rows > 0 ? cube[0][0].length : 0;
            for (double[][] slab : cube) {
                if (slab.length != rows || (rows > 0 && rectangularWidth(slab, name) != cols)) {
                    throw new IllegalArgumentException("The parameter '" + name + "' is ragged");
                }
            }
            return new int[]{cube.length, rows, cols};
        }
        throw new IllegalArgumentException("The parameter '" + name + "' has unsupported type "
            + param.getClass().getSimpleName());
    }

    /// Renders a shape as a tuple, e.g. `(3,)` or `(2, 4)`.
    public static String formatShape(int[] shape) {
        if (shape.length == 1) {
            return "(" + shape[0] + ",)";
        }
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (int dim : shape) {
            joiner.add(Integer.toString(dim));
        }
        return joiner.toString();
    }

    /// Validates an observation matrix and copies it to `double[][]`.
    ///
    /// @param observations `double[][]`, `float[][]`, `int[][]` or `long[][]`
    /// @param nComponents required minimum row count, or null for no constraint
    /// @param nFeatures required column count, or null for any
    /// @return a new matrix holding the observations as doubles
    /// @throws InputCardinalityException if there are fewer rows than components or the column count differs
    /// @throws IllegalArgumentException if the matrix is ragged or holds a NaN or infinite value
    public static double[][] checkObservations(Object observations, Integer nComponents, Integer nFeatures) {
        double[][] x = toDoubles(observations);
        int nSamples = x.length;
        int width = nSamples > 0 ? x[0].length : 0;
        for (int i = 0; i < nSamples; i++) {
            double[] row = x[i];
            if (row.length != width) {
                throw new IllegalArgumentException("observations are ragged: rows of length "
                    + width + " and " + row.length);
            }
            for (int j = 0; j < width; j++) {
                if (!Double.isFinite(row[j])) {
                    throw new IllegalArgumentException(String.format(
                        "observations must be finite, got %s at row %d, column %d", row[j], i, j));
                }
            }
        }
        if (nComponents != null && nSamples < nComponents) {
            throw new InputCardinalityException(String.format(
                "Expected n_samples >= n_components but got n_components = %d, n_samples = %d",
                nComponents, nSamples));
        }
        if (nFeatures != null && width != nFeatures) {
            throw new InputCardinalityException(String.format(
                "Expected the input data X have %d features, but got %d features", nFeatures, width));
        }
        return x;
    }

    private static double[][] toDoubles(Object observations) {
        if (observations instanceof double[][] values) {
            double[][] out = new double[values.length][];
            for (int i = 0; i < values.length; i++) {
                out[i] = values[i].clone();
            }
            return out;
        }
        if (observations instanceof float[][] values) {
            double[][] out = new double[values.length][];
            for (int i = 0; i < values.length; i++) {
                out[i] = new double[values[i].length];
                for (int j = 0; j < values[i].length; j++) {
                    out[i][j] = values[i][j];
                }
            }
            return out;
        }
        if (observations instanceof int[][] values) {
            double[][] out = new double[values.length][];
            for (int i = 0; i < values.length; i++) {
                out[i] = Arrays.stream(values[i]).asDoubleStream().toArray();
            }
            return out;
        }
        if (observations instanceof long[][] values) {
            double[][] out = new double[values.length][];
            for (int i = 0; i < values.length; i++) {
                out[i] = Arrays.stream(values[i]).asDoubleStream().toArray();
            }
            return out;
        }
        throw new IllegalArgumentException("observations must be a double, float, int or long matrix, got: "
            + (observations == null ? "null" : observations.getClass().getSimpleName()));
    }

    private static int rectangularWidth(double[][] matrix, String name) {
        int width = matrix.length > 0 ? matrix[0].length : 0;
        for (double[] row : matrix) {
            if (row.length != width) {
                throw new IllegalArgumentException("The parameter '" + name + "' is ragged");
            }
        }
        return width;
    }
}
