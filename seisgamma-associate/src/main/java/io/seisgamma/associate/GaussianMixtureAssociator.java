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

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/// Expectation-Maximization over picks where every mixture component is a
/// physical event hypothesis.
///
/// ## Model
///
/// Component `k` holds an event location `e_k`, an origin time `t_k`, a
/// magnitude `m_k` (amplitude mode only), a feature covariance `Σ_k` and a
/// mixing weight `π_k`. Its mean for pick `i` at station `s_i` is not a free
/// parameter but the physical prediction
///
/// ```
/// μ_ik = [ t_k + T(e_k, s_i, phase_i),  A(m_k, e_k, s_i) ]
/// ```
///
/// with `T` from the [TravelTimeModel] and `A` from the [AmplitudeModel].
///
/// ## Algorithm
///
/// 1. **E-step**: `log r_ik = log π_k + log N(x_i - μ_ik | 0, Σ_k)`, normalized
///    per pick with log-sum-exp. Returns the weighted mean log-likelihood.
/// 2. **M-step**, with `ω_ik = w_i r_ik` and `N_k = Σ_i ω_ik`:
///    - `π_k ∝ N_k`, or `max(N_k + α - 1, 0)` with a concentration prior `α`,
///      floored at [#MIN_WEIGHT] and renormalized;
///    - `e_k, t_k` by damped Gauss-Newton on the weighted arrival residuals,
///      clamped to the configured bounds;
///    - `m_k` in closed form, the weighted mean of per-pick magnitude inversions;
///    - `Σ_k` from the [CovarianceModel] on the residuals, then [CovarianceLimits].
///
/// A component whose `N_k` falls below [#MIN_EFFECTIVE_PICKS] keeps its previous
/// event parameters; its weight decays to the floor.
///
/// ## Convergence
///
/// Stops when the log-likelihood changes by less than `tol` between
/// iterations, or after `max_iter` iterations (logged as a warning).
///
/// ## Usage
///
/// ```java
/// GaussianMixtureAssociator associator = GaussianMixtureAssociator.builder(config)
///     .nComponents(4)
///     .build();
/// MixtureFit fit = associator.fit(features);
/// int[] eventOfPick = fit.hardAssignments();
/// ```
///
/// ## Thread Safety
///
/// Instances are immutable; each fit keeps its state in a private run object,
/// so one associator may fit several pick sets concurrently.
public final class GaussianMixtureAssociator {

    private static final Logger logger = LogManager.getLogger(GaussianMixtureAssociator.class);

    /// Floor for mixing weights
    public static final double MIN_WEIGHT = 1e-10;

    /// Effective pick count below which a component is treated as collapsed
    public static final double MIN_EFFECTIVE_PICKS = 1e-3;

    private static final int GAUSS_NEWTON_STEPS = 3;
    private static final double DAMPING = 1e-3;
    private static final double RIDGE = 1e-6;
    private static final double STEP_TOLERANCE = 1e-6;
    private static final double LOG_2PI = Math.log(2 * Math.PI);

    private final int nComponents;
    private final AssociationConfig config;
    private final TravelTimeModel travelTimeModel;
    private final AmplitudeModel amplitudeModel;
    private final CovarianceModel covarianceModel;
    private final CovarianceLimits limits;
    private final InitialParameters initialParameters;

    public GaussianMixtureAssociator(int nComponents, AssociationConfig config) {
        this(builder(config).nComponents(nComponents));
    }

    private GaussianMixtureAssociator(Builder builder) {
        this.config = builder.config;
        if (builder.nComponents == null) {
            throw new IllegalArgumentException("n_components must be set on the builder or in the configuration");
        }
        if (builder.nComponents < 1) {
            throw new IllegalArgumentException("n_components must be >= 1, got: " + builder.nComponents);
        }
        this.nComponents = builder.nComponents;
        this.travelTimeModel = builder.travelTimeModel != null
            ? builder.travelTimeModel
            : new UniformVelocityModel(config.vel().p(), config.vel().s());
        this.amplitudeModel = builder.amplitudeModel != null ? builder.amplitudeModel : new MagnitudeAttenuationModel();
        this.covarianceModel = builder.covarianceModel != null ? builder.covarianceModel : config.covarianceType();
        this.limits = CovarianceLimits.of(config);
        this.initialParameters = builder.initialParameters != null ? builder.initialParameters : InitialParameters.none();
    }

    public static Builder builder(AssociationConfig config) {
        return new Builder(config);
    }

    public int nComponents() {
        return nComponents;
    }

    public AssociationConfig config() {
        return config;
    }

    /// Fits converter output.
    public MixtureFit fit(PickFeatures features) {
        return fit(features.data(), features.locations(), features.phaseTypes(), features.weights());
    }

    /// Fits the mixture.
    ///
    /// @param data feature matrix (n x F)
    /// @param locations station coordinates per pick (n x D)
    /// @param phaseTypes phase type per pick
    /// @param weights pick weights, or null for all ones
    /// @throws ParameterShapeException if an initial parameter has the wrong shape
    /// @throws InputCardinalityException if n < n_components or the feature count is wrong
    public MixtureFit fit(double[][] data, double[][] locations, String[] phaseTypes, double[] weights) {
        return run(data, locations, phaseTypes, weights);
    }

    /// Fits single-precision features; they are copied to double precision first.
    public MixtureFit fit(float[][] data, double[][] locations, String[] phaseTypes, double[] weights) {
        return run(data, locations, phaseTypes, weights);
    }

    /// Fits integer features; they are copied to double precision first.
    public MixtureFit fit(int[][] data, double[][] locations, String[] phaseTypes, double[] weights) {
        return run(data, locations, phaseTypes, weights);
    }

    public MixtureFit fit(long[][] data, double[][] locations, String[] phaseTypes, double[] weights) {
        return run(data, locations, phaseTypes, weights);
    }

    private MixtureFit run(Object data, double[][] locations, String[] phaseTypes, double[] weights) {
        double[][] x = MixtureValidation.checkObservations(data, nComponents, config.featureCount());
        checkParameters();
        int n = x.length;
        double[][] locs = checkLocations(locations, n);
        String[] phases = checkPhases(phaseTypes, n, locs);
        double[] w = checkWeights(weights, n);
        return new Run(x, locs, phases, w).fit();
    }

    private void checkParameters() {
        int nd = config.dims().size();
        int nf = config.featureCount();
        if (initialParameters.weights() != null) {
            MixtureValidation.checkShape(initialParameters.weights(), new int[]{nComponents}, "weights_init");
            double sum = 0;
            for (double v : initialParameters.weights()) {
                if (!(v >= 0) || !Double.isFinite(v)) {
                    throw new IllegalArgumentException("weights_init must be finite and non-negative: "
                        + Arrays.toString(initialParameters.weights()));
                }
                sum += v;
            }
            if (sum <= 0) {
                throw new IllegalArgumentException("weights_init must not sum to zero");
            }
        }
        if (initialParameters.means() != null) {
            MixtureValidation.checkShape(initialParameters.means(), new int[]{nComponents, nd + nf}, "means_init");
            double[][] means = initialParameters.means();
            for (int k = 0; k < means.length; k++) {
                for (double v : means[k]) {
                    if (!Double.isFinite(v)) {
                        throw new IllegalArgumentException("means_init row " + k + " must be finite: "
                            + Arrays.toString(means[k]));
                    }
                }
            }
        }
        if (initialParameters.covariances() != null) {
            MixtureValidation.checkShape(initialParameters.covariances(),
                covarianceModel.parameterShape(nComponents, nf), "covariances_init");
        }
        if (config.weightConcentrationPrior() != null) {
            MixtureValidation.checkShape(config.weightConcentrationPrior(), new int[0], "weight_concentration_prior");
        }
    }

    private double[][] checkLocations(double[][] locations, int n) {
        Objects.requireNonNull(locations, "locations");
        int nd = config.dims().size();
        if (locations.length != n) {
            throw new InputCardinalityException(String.format(
                "Expected one location per pick but got %d locations for %d picks", locations.length, n));
        }
        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            if (locations[i].length != nd) {
                throw new IllegalArgumentException(String.format(
                    "location %d has %d coordinates, expected %d for dims %s", i, locations[i].length, nd, config.dims()));
            }
            for (double v : locations[i]) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("location " + i + " is not finite: " + Arrays.toString(locations[i]));
                }
            }
            copy[i] = locations[i].clone();
        }
        return copy;
    }

    private String[] checkPhases(String[] phaseTypes, int n, double[][] locs) {
        Objects.requireNonNull(phaseTypes, "phaseTypes");
        if (phaseTypes.length != n) {
            throw new InputCardinalityException(String.format(
                "Expected one phase type per pick but got %d phase types for %d picks", phaseTypes.length, n));
        }
        String[] phases = new String[n];
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < n; i++) {
            phases[i] = Objects.requireNonNull(phaseTypes[i], "phase type").toLowerCase(Locale.ROOT);
            if (seen.add(phases[i])) {
                // unknown phase types fail here rather than mid-fit
                travelTimeModel.travelTime(locs[i], locs[i], phases[i]);
            }
        }
        return phases;
    }

    private static double[] checkWeights(double[] weights, int n) {
        double[] w = new double[n];
        if (weights == null) {
            Arrays.fill(w, 1.0);
            return w;
        }
        if (weights.length != n) {
            throw new InputCardinalityException(String.format(
                "Expected one weight per pick but got %d weights for %d picks", weights.length, n));
        }
        double sum = 0;
        for (int i = 0; i < n; i++) {
            if (!(weights[i] >= 0) || !Double.isFinite(weights[i])) {
                throw new IllegalArgumentException("pick weight " + i + " must be finite and non-negative, got: " + weights[i]);
            }
            w[i] = weights[i];
            sum += w[i];
        }
        if (sum <= 0) {
            throw new IllegalArgumentException("pick weights must not all be zero");
        }
        return w;
    }

    /// State of a single fit.
    private final class Run {
        private final double[][] x;
        private final double[][] loc;
        private final String[] phase;
        private final double[] w;
        private final int n;
        private final int nd;
        private final int nf;
        private final int nk = nComponents;
        private final double[][] bounds;

        private final double[][] eventLoc;
        private final double[] originTime;
        private final double[] magnitude;
        private final double[][][] cov;
        private final double[] mixWeights;

        private final double[][][] precision;
        private final double[] logDet;
        private final double[][] resp;
        private final boolean[] collapsed;

        private double lastLogLikelihood = Double.NEGATIVE_INFINITY;
        private int iterationsRun;
        private boolean converged;

        Run(double[][] x, double[][] loc, String[] phase, double[] w) {
            this.x = x;
            this.loc = loc;
            this.phase = phase;
            this.w = w;
            this.n = x.length;
            this.nd = config.dims().size();
            this.nf = config.featureCount();
            this.bounds = new double[nd][];
            for (int d = 0; d < nd; d++) {
                bounds[d] = config.bounds(config.dims().get(d));
            }
            this.eventLoc = new double[nk][nd];
            this.originTime = new double[nk];
            this.magnitude = new double[nk];
            this.cov = new double[nk][][];
            this.mixWeights = new double[nk];
            this.precision = new double[nk][][];
            this.logDet = new double[nk];
            this.resp = new double[n][nk];
            this.collapsed = new boolean[nk];
            initialize();
        }

        private void initialize() {
            double[] centroid = new double[nd];
            for (double[] station : loc) {
                for (int d = 0; d < nd; d++) {
                    centroid[d] += station[d] / n;
                }
            }
            for (int d = 0; d < nd; d++) {
                // the third dim is depth; start mid-range when it is bounded
                if (d == 2 && bounds[d] != null) {
                    centroid[d] = 0.5 * (bounds[d][0] + bounds[d][1]);
                }
            }
            clamp(centroid);

            double meanTravelTime = 0;
            for (int i = 0; i < n; i++) {
                meanTravelTime += travelTimeModel.travelTime(centroid, loc[i], phase[i]) / n;
            }
            double[] times = new double[n];
            for (int i = 0; i < n; i++) {
                times[i] = x[i][0];
            }
            Arrays.sort(times);

            double[][] means = initialParameters.means();
            for (int k = 0; k < nk; k++) {
                if (means != null) {
                    System.arraycopy(means[k], 0, eventLoc[k], 0, nd);
                    clamp(eventLoc[k]);
                    originTime[k] = means[k][nd];
                    magnitude[k] = nf > 1 ? means[k][nd + 1] : Double.NaN;
                } else {
                    System.arraycopy(centroid, 0, eventLoc[k], 0, nd);
                    int q = (int) Math.min(n - 1, Math.floor((k + 0.5) / nk * n));
                    originTime[k] = times[q] - meanTravelTime;
                    magnitude[k] = nf > 1 ? initialMagnitude(eventLoc[k]) : Double.NaN;
                }

                double[][] start;
                if (initialParameters.covariances() != null) {
                    start = covarianceModel.initialCovariance(initialParameters.covariances(), k, nf);
                } else {
                    start = new double[nf][nf];
                    start[0][0] = config.maxSigma11() * config.maxSigma11();
                    if (nf > 1) {
                        start[1][1] = config.maxSigma22() * config.maxSigma22();
                    }
                }
                cov[k] = limits.apply(start);
            }

            double[] init = initialParameters.weights();
            double sum = 0;
            for (int k = 0; k < nk; k++) {
                mixWeights[k] = init != null ? init[k] : 1.0;
                sum += mixWeights[k];
            }
            for (int k = 0; k < nk; k++) {
                mixWeights[k] /= sum;
            }
            normalizeWeights();
        }

        private double initialMagnitude(double[] event) {
            double sum = 0;
            for (int i = 0; i < n; i++) {
                sum += amplitudeModel.magnitude(x[i][1], event, loc[i]);
            }
            return sum / n;
        }

        MixtureFit fit() {
            for (iterationsRun = 0; iterationsRun < config.maxIter(); iterationsRun++) {
                double logLikelihood = estep();
                logger.debug("EM iteration {}: log-likelihood {}", iterationsRun, logLikelihood);

                if (iterationsRun > 0 && Math.abs(logLikelihood - lastLogLikelihood) < config.tol()) {
                    converged = true;
                    lastLogLikelihood = logLikelihood;
                    break;
                }
                lastLogLikelihood = logLikelihood;

                mstep();
            }
            if (!converged) {
                lastLogLikelihood = estep();
                logger.warn("Association EM did not converge within max_iter={} (log-likelihood {})",
                    config.maxIter(), lastLogLikelihood);
            }

            List<EventHypothesis> events = new ArrayList<>(nk);
            for (int k = 0; k < nk; k++) {
                double picks = 0;
                for (int i = 0; i < n; i++) {
                    picks += w[i] * resp[i][k];
                }
                double[][] covCopy = new double[nf][];
                for (int a = 0; a < nf; a++) {
                    covCopy[a] = cov[k][a].clone();
                }
                events.add(new EventHypothesis(eventLoc[k].clone(), originTime[k], magnitude[k], covCopy,
                    mixWeights[k], picks));
            }
            double[][] respCopy = new double[n][];
            for (int i = 0; i < n; i++) {
                respCopy[i] = resp[i].clone();
            }
            logger.info("Fitted {} components to {} picks in {} iterations (converged={}, log-likelihood {})",
                nk, n, iterationsRun, converged, lastLogLikelihood);
            return new MixtureFit(events, respCopy, lastLogLikelihood, iterationsRun, converged);
        }

        /// E-step: responsibilities and weighted mean log-likelihood.
        private double estep() {
            for (int k = 0; k < nk; k++) {
                factorize(k);
            }
            double[] logp = new double[nk];
            double[] r = new double[nf];
            double total = 0;
            double weightSum = 0;
            for (int i = 0; i < n; i++) {
                double max = Double.NEGATIVE_INFINITY;
                for (int k = 0; k < nk; k++) {
                    residual(i, k, r);
                    logp[k] = Math.log(mixWeights[k]) + logGaussian(r, k);
                    max = Math.max(max, logp[k]);
                }
                double sum = 0;
                for (int k = 0; k < nk; k++) {
                    sum += Math.exp(logp[k] - max);
                }
                double lse = max + Math.log(sum);
                for (int k = 0; k < nk; k++) {
                    resp[i][k] = Math.exp(logp[k] - lse);
                }
                total += w[i] * lse;
                weightSum += w[i];
            }
            return total / weightSum;
        }

        /// M-step: mixing weights, then event parameters and covariance per component.
        private void mstep() {
            double[] effective = new double[nk];
            double[][] omega = new double[nk][n];
            for (int i = 0; i < n; i++) {
                for (int k = 0; k < nk; k++) {
                    omega[k][i] = w[i] * resp[i][k];
                    effective[k] += omega[k][i];
                }
            }

            Double prior = config.weightConcentrationPrior();
            double sum = 0;
            for (int k = 0; k < nk; k++) {
                mixWeights[k] = prior == null ? effective[k] : Math.max(effective[k] + prior - 1.0, 0.0);
                sum += mixWeights[k];
            }
            for (int k = 0; k < nk; k++) {
                mixWeights[k] = sum > 0 ? mixWeights[k] / sum : 1.0 / nk;
            }
            normalizeWeights();

            for (int k = 0; k < nk; k++) {
                if (effective[k] < MIN_EFFECTIVE_PICKS) {
                    if (!collapsed[k]) {
                        collapsed[k] = true;
                        logger.warn("Component {} collapsed (effective picks {}), keeping its previous event parameters",
                            k, effective[k]);
                    }
                    continue;
                }
                collapsed[k] = false;
                double[] om = omega[k];
                for (int i = 0; i < n; i++) {
                    om[i] /= effective[k];
                }
                updateLocation(k, om);
                if (nf > 1) {
                    updateMagnitude(k, om);
                }
                updateCovariance(k, om);
            }
        }

        private void updateLocation(int k, double[] om) {
            int np = nd + 1;
            for (int step = 0; step < GAUSS_NEWTON_STEPS; step++) {
                double[][] a = new double[np][np];
                double[] b = new double[np];
                double[] jac = new double[np];
                for (int i = 0; i < n; i++) {
                    if (om[i] == 0) continue;
                    double[] grad = travelTimeModel.gradient(eventLoc[k], loc[i], phase[i]);
                    System.arraycopy(grad, 0, jac, 0, nd);
                    jac[nd] = 1.0;
                    double res = x[i][0] - originTime[k] - travelTimeModel.travelTime(eventLoc[k], loc[i], phase[i]);
                    for (int p = 0; p < np; p++) {
                        b[p] += om[i] * jac[p] * res;
                        for (int q = p; q < np; q++) {
                            a[p][q] += om[i] * jac[p] * jac[q];
                        }
                    }
                }
                for (int p = 0; p < np; p++) {
                    for (int q = 0; q < p; q++) {
                        a[p][q] = a[q][p];
                    }
                    a[p][p] += DAMPING * a[p][p] + RIDGE;
                }

                DecompositionSolver solver = new LUDecomposition(MatrixUtils.createRealMatrix(a)).getSolver();
                if (!solver.isNonSingular()) {
                    logger.debug("Component {}: singular location system, skipping update", k);
                    return;
                }
                double[] delta = solver.solve(new ArrayRealVector(b, false)).toArray();
                double norm = 0;
                for (double v : delta) {
                    if (!Double.isFinite(v)) {
                        return;
                    }
                    norm += v * v;
                }
                for (int d = 0; d < nd; d++) {
                    eventLoc[k][d] += delta[d];
                }
                clamp(eventLoc[k]);
                originTime[k] += delta[nd];
                if (Math.sqrt(norm) < STEP_TOLERANCE) {
                    return;
                }
            }
        }

        private void updateMagnitude(int k, double[] om) {
            double sum = 0;
            double total = 0;
            for (int i = 0; i < n; i++) {
                if (om[i] == 0) continue;
                sum += om[i] * amplitudeModel.magnitude(x[i][1], eventLoc[k], loc[i]);
                total += om[i];
            }
            double m = sum / total;
            if (Double.isFinite(m)) {
                magnitude[k] = m;
            }
        }

        private void updateCovariance(int k, double[] om) {
            double[][] residuals = new double[n][nf];
            for (int i = 0; i < n; i++) {
                residual(i, k, residuals[i]);
            }
            cov[k] = limits.apply(covarianceModel.estimate(residuals, om, 1.0));
        }

        private void residual(int i, int k, double[] out) {
            out[0] = x[i][0] - originTime[k] - travelTimeModel.travelTime(eventLoc[k], loc[i], phase[i]);
            if (nf > 1) {
                out[1] = x[i][1] - amplitudeModel.logAmplitude(magnitude[k], eventLoc[k], loc[i]);
            }
        }

        private double logGaussian(double[] r, int k) {
            double[][] p = precision[k];
            double quad = 0;
            for (int a = 0; a < nf; a++) {
                for (int b = 0; b < nf; b++) {
                    quad += r[a] * p[a][b] * r[b];
                }
            }
            return -0.5 * (nf * LOG_2PI + logDet[k] + quad);
        }

        private void factorize(int k) {
            try {
                CholeskyDecomposition chol = new CholeskyDecomposition(MatrixUtils.createRealMatrix(cov[k]));
                precision[k] = chol.getSolver().getInverse().getData();
                logDet[k] = Math.log(chol.getDeterminant());
            } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
                logger.debug("Component {}: covariance not positive definite ({}), using its diagonal", k, e.getMessage());
                double[][] diagonal = new double[nf][nf];
                precision[k] = new double[nf][nf];
                logDet[k] = 0;
                for (int a = 0; a < nf; a++) {
                    double v = Math.max(cov[k][a][a], CovarianceLimits.MIN_VARIANCE);
                    diagonal[a][a] = v;
                    precision[k][a][a] = 1.0 / v;
                    logDet[k] += Math.log(v);
                }
                cov[k] = diagonal;
            }
        }

        private void normalizeWeights() {
            double sum = 0;
            for (int k = 0; k < nk; k++) {
                mixWeights[k] = Math.max(mixWeights[k], MIN_WEIGHT);
                sum += mixWeights[k];
            }
            for (int k = 0; k < nk; k++) {
                mixWeights[k] /= sum;
            }
        }

        private void clamp(double[] point) {
            for (int d = 0; d < nd; d++) {
                if (bounds[d] != null) {
                    point[d] = Math.max(bounds[d][0], Math.min(bounds[d][1], point[d]));
                }
            }
        }
    }

    public static final class Builder {
        private final AssociationConfig config;
        private Integer nComponents;
        private TravelTimeModel travelTimeModel;
        private AmplitudeModel amplitudeModel;
        private CovarianceModel covarianceModel;
        private InitialParameters initialParameters;

        private Builder(AssociationConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            this.nComponents = config.nComponents();
        }

        public Builder nComponents(int nComponents) {
            this.nComponents = nComponents;
            return this;
        }

        public Builder travelTimeModel(TravelTimeModel travelTimeModel) {
            this.travelTimeModel = travelTimeModel;
            return this;
        }

        public Builder amplitudeModel(AmplitudeModel amplitudeModel) {
            this.amplitudeModel = amplitudeModel;
            return this;
        }

        public Builder covarianceModel(CovarianceModel covarianceModel) {
            this.covarianceModel = covarianceModel;
            return this;
        }

        public Builder initialParameters(InitialParameters initialParameters) {
            this.initialParameters = initialParameters;
            return this;
        }

        public GaussianMixtureAssociator build() {
            return new GaussianMixtureAssociator(this);
        }
    }
}
