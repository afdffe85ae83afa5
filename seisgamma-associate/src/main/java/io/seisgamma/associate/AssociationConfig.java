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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.seisgamma.picks.SeisgammaGson;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Settings for pick conversion and the association engine.
///
/// ## JSON Schema
///
/// ```json
/// {
///   "dims": ["x(km)", "y(km)", "z(km)"],
///   "use_amplitude": true,
///   "n_components": null,
///   "oversample_factor": 1.0,
///   "max_iter": 100,
///   "tol": 0.001,
///   "reg_covar": 1e-6,
///   "covariance_type": "full",
///   "vel": {"p": 6.0, "s": 3.4286},
///   "bounds": {"z(km)": [0, 30]},
///   "min_picks_per_eq": 3,
///   "max_sigma11": 2.0,
///   "max_sigma22": 1.0,
///   "max_sigma12": 1.0,
///   "weight_concentration_prior": null
/// }
/// ```
///
/// Absent fields take the defaults above. `n_components` null means the
/// component count is derived from the picks (see [PickAssociator]).
/// `weight_concentration_prior` null disables Dirichlet smoothing of the
/// mixing weights.
///
/// Instances are immutable once built or loaded, and validated exactly once.
public final class AssociationConfig {

    public static final List<String> DEFAULT_DIMS = List.of("x(km)", "y(km)", "z(km)");
    public static final int DEFAULT_MAX_ITER = 100;
    public static final double DEFAULT_TOL = 1e-3;
    public static final double DEFAULT_REG_COVAR = 1e-6;
    public static final int DEFAULT_MIN_PICKS_PER_EQ = 3;

    @SerializedName("dims")
    private List<String> dims = DEFAULT_DIMS;

    @SerializedName("use_amplitude")
    private boolean useAmplitude = true;

    @SerializedName("n_components")
    private Integer nComponents;

    @SerializedName("oversample_factor")
    private double oversampleFactor = 1.0;

    @SerializedName("max_iter")
    private int maxIter = DEFAULT_MAX_ITER;

    @SerializedName("tol")
    private double tol = DEFAULT_TOL;

    @SerializedName("reg_covar")
    private double regCovar = DEFAULT_REG_COVAR;

    @SerializedName("covariance_type")
    private CovarianceType covarianceType = CovarianceType.FULL;

    @SerializedName("vel")
    private Velocity vel = new Velocity();

    @SerializedName("bounds")
    private Map<String, double[]> bounds = new LinkedHashMap<>();

    @SerializedName("min_picks_per_eq")
    private int minPicksPerEq = DEFAULT_MIN_PICKS_PER_EQ;

    @SerializedName("max_sigma11")
    private double maxSigma11 = 2.0;

    @SerializedName("max_sigma22")
    private double maxSigma22 = 1.0;

    @SerializedName("max_sigma12")
    private double maxSigma12 = 1.0;

    @SerializedName("weight_concentration_prior")
    private Double weightConcentrationPrior;

    /// Phase velocities in km/s.
    public static final class Velocity {
        @SerializedName("p")
        private double p = UniformVelocityModel.DEFAULT_VP;

        @SerializedName("s")
        private double s = UniformVelocityModel.DEFAULT_VS;

        public double p() {
            return p;
        }

        public double s() {
            return s;
        }
    }

    private AssociationConfig() {
    }

    public static AssociationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Loads and validates a configuration from JSON.
    ///
    /// @throws IllegalArgumentException if the JSON is malformed or a value is invalid
    public static AssociationConfig fromJson(Reader reader) {
        AssociationConfig config;
        try {
            config = SeisgammaGson.gson().fromJson(reader, AssociationConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid association configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            config = new AssociationConfig();
        }
        return config.validated();
    }

    public static AssociationConfig fromJson(String json) {
        return fromJson(new StringReader(json));
    }

    public String toJson() {
        return SeisgammaGson.gson().toJson(this);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.target.copyFrom(this);
        return builder;
    }

    private void copyFrom(AssociationConfig other) {
        dims = other.dims;
        useAmplitude = other.useAmplitude;
        nComponents = other.nComponents;
        oversampleFactor = other.oversampleFactor;
        maxIter = other.maxIter;
        tol = other.tol;
        regCovar = other.regCovar;
        covarianceType = other.covarianceType;
        vel = new Velocity();
        vel.p = other.vel.p;
        vel.s = other.vel.s;
        bounds = new LinkedHashMap<>();
        other.bounds.forEach((dim, range) -> bounds.put(dim, range.clone()));
        minPicksPerEq = other.minPicksPerEq;
        maxSigma11 = other.maxSigma11;
        maxSigma22 = other.maxSigma22;
        maxSigma12 = other.maxSigma12;
        weightConcentrationPrior = other.weightConcentrationPrior;
    }

    private AssociationConfig validated() {
        if (dims == null || dims.isEmpty()) {
            throw new IllegalArgumentException("dims must name at least one coordinate column");
        }
        for (String dim : dims) {
            if (dim == null || dim.isBlank()) {
                throw new IllegalArgumentException("dims must not contain blank names: " + dims);
            }
        }
        if (dims.stream().distinct().count() != dims.size()) {
            throw new IllegalArgumentException("dims must not repeat a column: " + dims);
        }
        dims = Collections.unmodifiableList(new ArrayList<>(dims));
        if (nComponents != null && nComponents < 1) {
            throw new IllegalArgumentException("n_components must be >= 1, got: " + nComponents);
        }
        requirePositive("oversample_factor", oversampleFactor);
        if (maxIter < 1) {
            throw new IllegalArgumentException("max_iter must be >= 1, got: " + maxIter);
        }
        requirePositive("tol", tol);
        if (!(regCovar >= 0) || !Double.isFinite(regCovar)) {
            throw new IllegalArgumentException("reg_covar must be >= 0, got: " + regCovar);
        }
        if (covarianceType == null) {
            throw new IllegalArgumentException("covariance_type must be 'full' or 'diag'");
        }
        if (vel == null) {
            vel = new Velocity();
        }
        requirePositive("vel.p", vel.p);
        requirePositive("vel.s", vel.s);
        if (bounds == null) {
            bounds = new LinkedHashMap<>();
        }
        for (Map.Entry<String, double[]> entry : bounds.entrySet()) {
            double[] range = entry.getValue();
            if (!dims.contains(entry.getKey())) {
                throw new IllegalArgumentException("bounds names unknown dim '" + entry.getKey() + "', dims are " + dims);
            }
            if (range == null || range.length != 2 || !(range[0] <= range[1])) {
                throw new IllegalArgumentException("bounds for '" + entry.getKey() + "' must be [min, max] with min <= max");
            }
        }
        if (minPicksPerEq < 0) {
            throw new IllegalArgumentException("min_picks_per_eq must be >= 0, got: " + minPicksPerEq);
        }
        requirePositive("max_sigma11", maxSigma11);
        requirePositive("max_sigma22", maxSigma22);
        requirePositive("max_sigma12", maxSigma12);
        if (weightConcentrationPrior != null) {
            requirePositive("weight_concentration_prior", weightConcentrationPrior);
        }
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    public List<String> dims() {
        return dims;
    }

    public boolean useAmplitude() {
        return useAmplitude;
    }

    /// Columns of the feature matrix: time, plus log amplitude when enabled.
    public int featureCount() {
        return useAmplitude ? 2 : 1;
    }

    /// Fixed component count, or null when it is derived from the picks.
    public Integer nComponents() {
        return nComponents;
    }

    public double oversampleFactor() {
        return oversampleFactor;
    }

    public int maxIter() {
        return maxIter;
    }

    public double tol() {
        return tol;
    }

    public double regCovar() {
        return regCovar;
    }

    public CovarianceType covarianceType() {
        return covarianceType;
    }

    public Velocity vel() {
        return vel;
    }

    /// `[min, max]` for a dim, or null when it is unbounded.
    public double[] bounds(String dim) {
        double[] range = bounds.get(dim);
        return range == null ? null : range.clone();
    }

    public int minPicksPerEq() {
        return minPicksPerEq;
    }

    public double maxSigma11() {
        return maxSigma11;
    }

    public double maxSigma22() {
        return maxSigma22;
    }

    public double maxSigma12() {
        return maxSigma12;
    }

    /// Dirichlet concentration for the mixing weights, or null.
    public Double weightConcentrationPrior() {
        return weightConcentrationPrior;
    }

    @Override
    public String toString() {
        return "AssociationConfig{dims=" + dims + ", useAmplitude=" + useAmplitude
            + ", nComponents=" + nComponents + ", maxIter=" + maxIter + ", tol=" + tol
            + ", covarianceType=" + covarianceType + ", vp=" + vel.p + ", vs=" + vel.s + "}";
    }

    public static final class Builder {
        private final AssociationConfig target = new AssociationConfig();

        private Builder() {
        }

        public Builder dims(List<String> dims) {
            target.dims = Objects.requireNonNull(dims, "dims");
            return this;
        }

        public Builder dims(String... dims) {
            return dims(List.of(dims));
        }

        public Builder useAmplitude(boolean useAmplitude) {
            target.useAmplitude = useAmplitude;
            return this;
        }

        public Builder nComponents(Integer nComponents) {
            target.nComponents = nComponents;
            return this;
        }

        public Builder oversampleFactor(double oversampleFactor) {
            target.oversampleFactor = oversampleFactor;
            return this;
        }

        public Builder maxIter(int maxIter) {
            target.maxIter = maxIter;
            return this;
        }

        public Builder tol(double tol) {
            target.tol = tol;
            return this;
        }

        public Builder regCovar(double regCovar) {
            target.regCovar = regCovar;
            return this;
        }

        public Builder covarianceType(CovarianceType covarianceType) {
            target.covarianceType = covarianceType;
            return this;
        }

        public Builder velocity(double vp, double vs) {
            target.vel.p = vp;
            target.vel.s = vs;
            return this;
        }

        public Builder bounds(String dim, double min, double max) {
            target.bounds.put(dim, new double[]{min, max});
            return this;
        }

        public Builder minPicksPerEq(int minPicksPerEq) {
            target.minPicksPerEq = minPicksPerEq;
            return this;
        }

        public Builder maxSigma11(double maxSigma11) {
            target.maxSigma11 = maxSigma11;
            return this;
        }

        public Builder maxSigma22(double maxSigma22) {
            target.maxSigma22 = maxSigma22;
            return this;
        }

        public Builder maxSigma12(double maxSigma12) {
            target.maxSigma12 = maxSigma12;
            return this;
        }

        public Builder weightConcentrationPrior(Double weightConcentrationPrior) {
            target.weightConcentrationPrior = weightConcentrationPrior;
            return this;
        }

        public AssociationConfig build() {
            AssociationConfig copy = new AssociationConfig();
            copy.copyFrom(target);
            return copy.validated();
        }
    }
}
