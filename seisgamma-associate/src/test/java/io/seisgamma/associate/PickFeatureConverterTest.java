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

import io.seisgamma.picks.PickRecord;
import io.seisgamma.picks.Timestamps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link PickFeatureConverter}.
 */
@Tag("unit")
public class PickFeatureConverterTest {

    private static final List<String> DIMS = AssociationConfig.DEFAULT_DIMS;

    private List<PickRow> picks;
    private List<StationRow> stations;
    private AssociationConfig config;

    private static PickRow pick(String id, String time, String type, Double prob, Double amp) {
        return new PickRow(id, Timestamps.parse(time), type, prob, amp);
    }

    @BeforeEach
    void setUp() {
        picks = List.of(
            pick("STA1_P", "2019-07-06T02:15:00.000", "P", 0.9, 1e-5),
            pick("STA1_S", "2019-07-06T02:15:05.000", "S", 0.8, 2e-5),
            pick("STA2_P", "2019-07-06T02:15:01.000", "P", 0.85, 1.5e-5),
            pick("STA2_S", "2019-07-06T02:15:07.000", "S", 0.75, 3e-5));
        stations = List.of(
            StationRow.of("STA1_P", DIMS, 0.0, 0.0, 0.0),
            StationRow.of("STA1_S", DIMS, 0.0, 0.0, 0.0),
            StationRow.of("STA2_P", DIMS, 10.0, 5.0, -0.5),
            StationRow.of("STA2_S", DIMS, 10.0, 5.0, -0.5));
        config = AssociationConfig.defaults();
    }

    @Test
    void outputsAreRowAligned() {
        PickFeatures features = PickFeatureConverter.convert(picks, stations, config);

        int n = picks.size();
        assertThat(features.data()).hasDimensions(n, 2);
        assertThat(features.locations()).hasDimensions(n, 3);
        assertThat(features.phaseTypes()).hasSize(n);
        assertThat(features.phaseWeights()).hasDimensions(n, 1);
        assertThat(features.pickIndex()).containsExactly(0, 1, 2, 3);
        assertThat(features.pickStationIds()).containsExactly("STA1_P_P", "STA1_S_S", "STA2_P_P", "STA2_S_S");
        assertThat(features.locations()[2]).containsExactly(10.0, 5.0, -0.5);
    }

    @Test
    void phaseTypesAreLowercased() {
        PickFeatures features = PickFeatureConverter.convert(picks, stations, config);
        assertThat(features.phaseTypes()).containsExactly("p", "s", "p", "s");
    }

    @Test
    void timeIsEpochSeconds() {
        PickFeatures features = PickFeatureConverter.convert(picks, stations, config);
        assertThat(features.data()[0][0]).isEqualTo(1562379300.0);
        assertThat(features.data()[3][0]).isEqualTo(1562379307.0);
    }

    @Test
    void amplitudeIsLogTransformed() {
        PickFeatures features = PickFeatureConverter.convert(picks, stations, config);
        for (int i = 0; i < picks.size(); i++) {
            assertThat(features.data()[i][1]).isCloseTo(Math.log10(picks.get(i).amp() * 1e2), within(1e-12));
        }
        assertThat(features.data()[0][1]).isCloseTo(-3.0, within(1e-9));
    }

    @Test
    void withoutAmplitudeOnlyTimeRemains() {
        AssociationConfig timeOnly = AssociationConfig.builder().useAmplitude(false).build();
        PickFeatures features = PickFeatureConverter.convert(picks, stations, timeOnly);
        assertThat(features.data()).hasDimensions(4, 1);
    }

    @Test
    void weightsComeFromProbability() {
        List<PickRow> mixed = List.of(
            pick("STA1_P", "2019-07-06T02:15:00.000", "P", 0.9, 1e-5),
            pick("STA1_S", "2019-07-06T02:15:05.000", "S", null, 2e-5));
        PickFeatures features = PickFeatureConverter.convert(mixed, stations, config);
        assertThat(features.weights()).containsExactly(0.9, 1.0);
    }

    // ==================== Filtering ====================

    @Test
    void unmatchedPickIsDroppedEverywhere() {
        List<PickRow> withMissing = List.of(
            pick("STA1_P", "2019-07-06T02:15:00.000", "P", 0.9, 1e-5),
            pick("MISSING_P", "2019-07-06T02:15:01.000", "P", 0.8, 2e-5),
            pick("STA2_S", "2019-07-06T02:15:07.000", "S", 0.75, 3e-5));

        PickFeatures features = PickFeatureConverter.convert(withMissing, stations, config);

        assertThat(features.size()).isEqualTo(2);
        assertThat(features.locations()).hasNumberOfRows(2);
        assertThat(features.phaseTypes()).hasSize(2);
        assertThat(features.phaseWeights()).hasNumberOfRows(2);
        assertThat(features.pickStationIds()).containsExactly("STA1_P_P", "STA2_S_S");
        assertThat(features.pickIndex()).containsExactly(0, 2);
    }

    @Test
    void fallsBackToBareStationId() {
        List<StationRow> bare = List.of(StationRow.of("STA1", DIMS, 1.0, 2.0, 3.0));
        PickFeatures features = PickFeatureConverter.convert(picks, bare, config);

        assertThat(features.pickIndex()).containsExactly(0, 1);
        assertThat(features.locations()[1]).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void stationsWithMissingCoordinatesMatchNothing() {
        Map<String, Double> partial = new HashMap<>();
        partial.put("x(km)", 1.0);
        partial.put("y(km)", Double.NaN);
        partial.put("z(km)", 0.0);
        List<StationRow> rows = List.of(
            new StationRow("STA1", partial),
            StationRow.of("STA1", DIMS, 1.0, 2.0, 3.0),
            StationRow.of("STA2", DIMS, 4.0, 5.0, 6.0));

        PickFeatures features = PickFeatureConverter.convert(picks, rows, config);

        assertThat(features.pickIndex()).containsExactly(2, 3);
    }

    @Test
    void unusableAmplitudesAreDroppedOnlyWhenUsed() {
        List<PickRow> rows = List.of(
            pick("STA1_P", "2019-07-06T02:15:00.000", "P", 0.9, null),
            pick("STA1_S", "2019-07-06T02:15:05.000", "S", 0.8, 0.0),
            pick("STA2_P", "2019-07-06T02:15:01.000", "P", 0.85, 1.5e-5));

        assertThat(PickFeatureConverter.convert(rows, stations, config).pickIndex()).containsExactly(2);

        AssociationConfig timeOnly = AssociationConfig.builder().useAmplitude(false).build();
        assertThat(PickFeatureConverter.convert(rows, stations, timeOnly).pickIndex()).containsExactly(0, 1, 2);
    }

    @Test
    void emptyInputGivesEmptyFeatures() {
        PickFeatures features = PickFeatureConverter.convert(List.of(), stations, config);
        assertThat(features.size()).isZero();
        assertThat(features.pickIndex()).isEmpty();
    }

    // ==================== Extractor bridge ====================

    @Test
    void pickRecordsBecomeRows() {
        List<PickRecord> records = List.of(
            new PickRecord("f", "STA1", "2019-07-06T02:15:00.000", 500, "2019-07-06T02:15:05.000",
                0.91, "P", 0.01, 2e-5),
            new PickRecord("f", "STA2", "2019-07-06T02:15:00.000", 700, "2019-07-06T02:15:07.000",
                0.8, "S", 0.01, Double.NaN));

        List<PickRow> rows = PickRow.fromPickRecords(records);

        assertThat(rows.get(0).id()).isEqualTo("STA1");
        assertThat(rows.get(0).timestamp()).isEqualTo(Timestamps.parse("2019-07-06T02:15:05.000"));
        assertThat(rows.get(0).prob()).isEqualTo(0.91);
        assertThat(rows.get(0).amp()).isEqualTo(2e-5);
        assertThat(rows.get(1).amp()).isNull();

        List<StationRow> bare = List.of(
            StationRow.of("STA1", DIMS, 0.0, 0.0, 0.0),
            StationRow.of("STA2", DIMS, 1.0, 1.0, 0.0));
        PickFeatures features = PickFeatureConverter.convert(rows, bare, config);
        assertThat(features.pickIndex()).containsExactly(0);
    }
}
