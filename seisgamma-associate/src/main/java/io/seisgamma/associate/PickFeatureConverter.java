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

import io.seisgamma.picks.Timestamps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Joins the pick table with the station table and builds the engine inputs.
///
/// ## Join
///
/// A pick's station is looked up by its id; when that fails and the id has the
/// composite form `station_phase`, by the text before the last `_`. The first
/// station row with a given id wins.
///
/// ## Filtering
///
/// A pick is dropped from every output when
///
/// - no station matches,
/// - any configured dim is missing or NaN for the station, or
/// - amplitudes are used and the pick has no positive, finite amplitude.
///
/// Dropping is not an error; the count is logged at debug level.
public final class PickFeatureConverter {

    private static final Logger logger = LogManager.getLogger(PickFeatureConverter.class);

    /// Weight of a pick without a probability.
    public static final double DEFAULT_WEIGHT = 1.0;

    private PickFeatureConverter() {
    }

    public static PickFeatures convert(List<PickRow> picks, List<StationRow> stations, AssociationConfig config) {
        Map<String, double[]> locationById = indexStations(stations, config.dims());
        boolean useAmplitude = config.useAmplitude();

        List<double[]> data = new ArrayList<>();
        List<double[]> locations = new ArrayList<>();
        List<String> phaseTypes = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        List<Integer> pickIndex = new ArrayList<>();
        List<String> pickStationIds = new ArrayList<>();

        for (int i = 0; i < picks.size(); i++) {
            PickRow pick = picks.get(i);
            double[] location = lookup(locationById, pick.id());
            if (location == null) {
                continue;
            }
            double time = Timestamps.toSeconds(pick.timestamp());
            if (useAmplitude) {
                Double amp = pick.amp();
                if (amp == null || !(amp > 0) || !Double.isFinite(amp)) {
                    continue;
                }
                data.add(new double[]{time, Math.log10(amp * 1e2)});
            } else {
                data.add(new double[]{time});
            }
            locations.add(location.clone());
            phaseTypes.add(pick.type().toLowerCase(Locale.ROOT));
            Double prob = pick.prob();
            weights.add(prob == null || prob.isNaN() ? DEFAULT_WEIGHT : prob);
            pickIndex.add(i);
            pickStationIds.add(pick.id() + "_" + pick.type());
        }

        int n = data.size();
        if (n < picks.size()) {
            logger.debug("Dropped {} of {} picks without usable station or amplitude", picks.size() - n, picks.size());
        }
        double[][] phaseWeights = new double[n][1];
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            phaseWeights[i][0] = weights.get(i);
            indices[i] = pickIndex.get(i);
        }
        return new PickFeatures(
            data.toArray(new double[0][]),
            locations.toArray(new double[0][]),
            phaseTypes.toArray(new String[0]),
            phaseWeights,
            indices,
            pickStationIds.toArray(new String[0]));
    }

    private static Map<String, double[]> indexStations(List<StationRow> stations, List<String> dims) {
        Map<String, double[]> byId = new HashMap<>();
        for (StationRow station : stations) {
            if (byId.containsKey(station.id())) {
                continue;
            }
            double[] location = new double[dims.size()];
            boolean complete = true;
            for (int d = 0; d < dims.size(); d++) {
                Double value = station.coordinate(dims.get(d));
                if (value == null || value.isNaN()) {
                    complete = false;
                    break;
                }
                location[d] = value;
            }
            // incomplete rows still claim the id so a later duplicate cannot fill it in
            byId.put(station.id(), complete ? location : null);
        }
        return byId;
    }

    private static double[] lookup(Map<String, double[]> locationById, String id) {
        if (locationById.containsKey(id)) {
            return locationById.get(id);
        }
        String bare = bareStationId(id);
        return bare == null ? null : locationById.get(bare);
    }

    /// Text before the last `_`, or null when the id has none.
    static String bareStationId(String id) {
        int cut = id.lastIndexOf('_');
        return cut > 0 ? id.substring(0, cut) : null;
    }
}
