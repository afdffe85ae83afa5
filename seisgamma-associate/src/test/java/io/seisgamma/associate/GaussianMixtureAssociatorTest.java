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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link GaussianMixtureAssociator}.
 */
@Tag("unit")
public class GaussianMixtureAssociatorTest {

    private static PickFeatures twoEventFeatures(AssociationConfig config) {
        return PickFeatureConverter.convert(SyntheticCatalog.twoEvents(), SyntheticCatalog.stations(), config);
    }

    private static double distance(double[] a, double[] b) {
        return UniformVelocityModel.distance(a, b);
    }

    // ==================== Recovery ====================

    @Test
    void recoversTwoSyntheticEvents() {
        AssociationConfig config = SyntheticCatalog.config().build();
        PickFeatures features = twoEventFeatures(config);
        assertThat(features.size()).isEqualTo(32);

        MixtureFit fit = new GaussianMixtureAssociator(2, config).fit(features);

        List<EventHypothesis> events = fit.events().stream()
            .sorted(Comparator.comparingDouble(EventHypothesis::originTime))
            .collect(Collectors.toList());
        EventHypothesis a = events.get(0);
        EventHypothesis b = events.get(1);

        assertThat(a.originTime()).isCloseTo(SyntheticCatalog.T_A, within(0.1));
        assertThat(b.originTime()).isCloseTo(SyntheticCatalog.T_B, within(0.1));
        assertThat(distance(a.location(), SyntheticCatalog.EVENT_A)).isLessThan(1.0);
        assertThat(distance(b.location(), SyntheticCatalog.EVENT_B)).isLessThan(1.0);
        assertThat(a.magnitude()).isCloseTo(SyntheticCatalog.M_A, within(0.1));
        assertThat(b.magnitude()).isCloseTo(SyntheticCatalog.M_B, within(0.1));
        assertThat(a.pickCount()).isCloseTo(16 * 0.9, within(0.1));
        assertThat(a.weight() + b.weight()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void hardAssignmentsSeparateEvents() {
        AssociationConfig config = SyntheticCatalog.config().build();
        MixtureFit fit = new GaussianMixtureAssociator(2, config).fit(twoEventFeatures(config));

        int[] hard = fit.hardAssignments();
        for (int i = 1; i < 16; i++) {
            assertThat(hard[i]).isEqualTo(hard[0]);
        }
        for (int i = 17; i < 32; i++) {
            assertThat(hard[i]).isEqualTo(hard[16]);
        }
        assertThat(hard[0]).isNotEqualTo(hard[16]);
    }

    @Test
    void recoversEventsFromTimesOnly() {
        AssociationConfig config = SyntheticCatalog.config().useAmplitude(false).build();
        PickFeatures features = twoEventFeatures(config);
        assertThat(features.data()[0]).hasSize(1);

        MixtureFit fit = new GaussianMixtureAssociator(2, config).fit(features);

        double earliest = Math.min(fit.events().get(0).originTime(), fit.events().get(1).originTime());
        assertThat(earliest).isCloseTo(SyntheticCatalog.T_A, within(0.1));
        for (EventHypothesis event : fit.events()) {
            assertThat(event.magnitude()).isNaN();
        }
    }

    @Test
    void diagonalCovarianceHasNoCrossTerm() {
        AssociationConfig config = SyntheticCatalog.config().covarianceType(CovarianceType.DIAGONAL).build();
        MixtureFit fit = new GaussianMixtureAssociator(2, config).fit(twoEventFeatures(config));

        for (EventHypothesis event : fit.events()) {
            assertThat(event.covTimeAmplitude()).isZero();
            assertThat(event.sigmaTime()).isLessThanOrEqualTo(config.maxSigma11());
        }
    }

    // ==================== Numerical guards ====================

    @Test
    void responsibilitiesAreFiniteAndNormalized() {
        AssociationConfig config = SyntheticCatalog.config().maxIter(30).build();
        MixtureFit fit = new GaussianMixtureAssociator(4, config).fit(twoEventFeatures(config));

        for (double[] row : fit.responsibilities()) {
            double sum = 0;
            for (double r : row) {
                assertThat(r).isBetween(0.0, 1.0);
                sum += r;
            }
            assertThat(sum).isCloseTo(1.0, within(1e-9));
        }
        double weights = 0;
        for (EventHypothesis event : fit.events()) {
            assertThat(event.weight()).isGreaterThanOrEqualTo(GaussianMixtureAssociator.MIN_WEIGHT / 2);
            assertThat(event.originTime()).isFinite();
            for (double coordinate : event.location()) {
                assertThat(coordinate).isFinite();
            }
            assertThat(event.sigmaTime()).isFinite().isPositive();
            weights += event.weight();
        }
        assertThat(weights).isCloseTo(1.0, within(1e-9));
        assertThat(fit.logLikelihood()).isFinite();
    }

    @Test
    void locationsStayWithinBounds() {
        AssociationConfig config = SyntheticCatalog.config().bounds("z(km)", 0, 5).build();
        MixtureFit fit = new GaussianMixtureAssociator(2, config).fit(twoEventFeatures(config));

        for (EventHypothesis event : fit.events()) {
            assertThat(event.location()[2]).isBetween(0.0, 5.0);
        }
    }

    @Test
    void concentrationPriorKeepsWeightsValid() {
        AssociationConfig config = SyntheticCatalog.config().weightConcentrationPrior(0.5).maxIter(20).build();
        MixtureFit fit = new GaussianMixtureAssociator(3, config).fit(twoEventFeatures(config));

        assertThat(fit.events().stream().mapToDouble(EventHypothesis::weight).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void integerObservationsAreUpcast() {
        AssociationConfig config = AssociationConfig.builder().useAmplitude(false).maxIter(5).build();
        long[][] data = {{100}, {101}, {102}, {200}, {201}};
        double[][] locations = new double[5][3];
        String[] phases = {"P", "P", "S", "p", "s"};

        MixtureFit fit = new GaussianMixtureAssociator(2, config).fit(data, locations, phases, null);

        assertThat(fit.responsibilities()).hasNumberOfRows(5);
        assertThat(data[0][0]).isEqualTo(100L);
    }

    @Test
    void callerArraysAreNotModified() {
        AssociationConfig config = SyntheticCatalog.config().maxIter(5).build();
        PickFeatures features = twoEventFeatures(config);
        double[][] data = features.data();
        double first = data[0][0];
        double[] firstLocation = features.locations()[0].clone();

        new GaussianMixtureAssociator(2, config).fit(features);

        assertThat(data[0][0]).isEqualTo(first);
        assertThat(features.locations()[0]).containsExactly(firstLocation);
    }

    // ==================== Caller-supplied parameters ====================

    @Test
    void acceptsWellShapedInitialParameters() {
        AssociationConfig config = SyntheticCatalog.config().maxIter(50).build();
        InitialParameters init = InitialParameters.none()
            .withWeights(new double[]{0.5, 0.5})
            .withMeans(new double[][]{
                {40, 40, 5, SyntheticCatalog.T_A, 3.0},
                {60, 60, 5, SyntheticCatalog.T_B, 3.0}})
            .withCovariances(new double[][][]{
                {{1, 0}, {0, 0.5}},
                {{1, 0}, {0, 0.5}}});

        MixtureFit fit = GaussianMixtureAssociator.builder(config)
            .nComponents(2)
            .initialParameters(init)
            .build()
            .fit(twoEventFeatures(config));

        assertThat(fit.events().get(0).originTime()).isCloseTo(SyntheticCatalog.T_A, within(0.1));
        assertThat(fit.events().get(1).originTime()).isCloseTo(SyntheticCatalog.T_B, within(0.1));
    }

    @Test
    void rejectsMisshapedWeights() {
        AssociationConfig config = SyntheticCatalog.config().build();
        GaussianMixtureAssociator associator = GaussianMixtureAssociator.builder(config)
            .nComponents(3)
            .initialParameters(InitialParameters.none().withWeights(new double[]{0.5, 0.5}))
            .build();

        assertThatThrownBy(() -> associator.fit(twoEventFeatures(config)))
            .isInstanceOf(ParameterShapeException.class)
            .hasMessageContaining("'weights_init'")
            .hasMessageContaining("should have the shape of (3,), but got (2,)");
    }

    @Test
    void rejectsMisshapedMeansAndCovariances() {
        AssociationConfig config = SyntheticCatalog.config().build();
        GaussianMixtureAssociator badMeans = GaussianMixtureAssociator.builder(config)
            .nComponents(2)
            .initialParameters(InitialParameters.none().withMeans(new double[2][4]))
            .build();
        assertThatThrownBy(() -> badMeans.fit(twoEventFeatures(config)))
            .isInstanceOf(ParameterShapeException.class)
            .hasMessageContaining("(2, 5)");

        GaussianMixtureAssociator badCovariances = GaussianMixtureAssociator.builder(config)
            .nComponents(2)
            .initialParameters(InitialParameters.none().withCovariances(new double[2][2]))
            .build();
        assertThatThrownBy(() -> badCovariances.fit(twoEventFeatures(config)))
            .isInstanceOf(ParameterShapeException.class)
            .hasMessageContaining("(2, 2, 2)");
    }

    @Test
    void diagonalModelExpectsVectorCovariances() {
        AssociationConfig config = SyntheticCatalog.config().covarianceType(CovarianceType.DIAGONAL).maxIter(10).build();
        GaussianMixtureAssociator associator = GaussianMixtureAssociator.builder(config)
            .nComponents(2)
            .initialParameters(InitialParameters.none().withCovariances(new double[][]{{1, 0.5}, {1, 0.5}}))
            .build();

        assertThat(associator.fit(twoEventFeatures(config)).numComponents()).isEqualTo(2);
    }

    // ==================== Input validation ====================

    @Test
    void rejectsFewerSamplesThanComponents() {
        AssociationConfig config = AssociationConfig.builder().useAmplitude(false).build();
        double[][] data = {{1}, {2}, {3}};

        assertThatThrownBy(() -> new GaussianMixtureAssociator(5, config)
            .fit(data, new double[3][3], new String[]{"p", "p", "s"}, null))
            .isInstanceOf(InputCardinalityException.class)
            .hasMessageContaining("n_samples >= n_components");
    }

    @Test
    void rejectsWrongFeatureCount() {
        AssociationConfig config = AssociationConfig.builder().useAmplitude(true).build();
        double[][] data = {{1}, {2}, {3}};

        assertThatThrownBy(() -> new GaussianMixtureAssociator(1, config)
            .fit(data, new double[3][3], new String[]{"p", "p", "s"}, null))
            .isInstanceOf(InputCardinalityException.class)
            .hasMessageContaining("features");
    }

    @Test
    void rejectsMisalignedInputs() {
        AssociationConfig config = AssociationConfig.builder().useAmplitude(false).build();
        double[][] data = {{1}, {2}, {3}};
        GaussianMixtureAssociator associator = new GaussianMixtureAssociator(1, config);

        assertThatThrownBy(() -> associator.fit(data, new double[2][3], new String[]{"p", "p", "s"}, null))
            .isInstanceOf(InputCardinalityException.class);
        assertThatThrownBy(() -> associator.fit(data, new double[3][2], new String[]{"p", "p", "s"}, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> associator.fit(data, new double[3][3], new String[]{"p", "s"}, null))
            .isInstanceOf(InputCardinalityException.class);
        assertThatThrownBy(() -> associator.fit(data, new double[3][3], new String[]{"p", "p", "s"}, new double[]{1, -1, 1}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> associator.fit(data, new double[3][3], new String[]{"p", "x", "s"}, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("phase");
    }

    @Test
    void rejectsNonFiniteObservations() {
        AssociationConfig config = AssociationConfig.builder().useAmplitude(false).build();
        GaussianMixtureAssociator associator = new GaussianMixtureAssociator(2, config);
        String[] phases = {"p", "p", "s", "s"};

        assertThatThrownBy(() -> associator.fit(new double[][]{{0}, {1}, {Double.NaN}, {3}}, new double[4][3], phases, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("row 2, column 0");
        assertThatThrownBy(() -> associator.fit(
            new double[][]{{0}, {Double.POSITIVE_INFINITY}, {2}, {3}}, new double[4][3], phases, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("finite");
    }

    @Test
    void rejectsNonFiniteInitialMeans() {
        AssociationConfig config = SyntheticCatalog.config().build();
        GaussianMixtureAssociator associator = GaussianMixtureAssociator.builder(config)
            .nComponents(2)
            .initialParameters(InitialParameters.none().withMeans(new double[][]{
                {40, 40, 5, SyntheticCatalog.T_A, 3.0},
                {60, Double.NaN, 5, SyntheticCatalog.T_B, 3.0}}))
            .build();

        assertThatThrownBy(() -> associator.fit(twoEventFeatures(config)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("means_init row 1");
    }

    @Test
    void requiresComponentCount() {
        assertThatThrownBy(() -> GaussianMixtureAssociator.builder(AssociationConfig.defaults()).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("n_components");
        assertThatThrownBy(() -> new GaussianMixtureAssociator(0, AssociationConfig.defaults()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
