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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Associates a pick table with a station table into an event catalog.
///
/// ## Steps
///
/// 1. [PickFeatureConverter#convert] joins picks with stations;
/// 2. a [GaussianMixtureAssociator] is fitted with the configured component
///    count, or by default `ceil(picks / station-phase pairs * oversample_factor)`,
///    capped by the pick count;
/// 3. every pick goes to its most likely component, and components with at
///    least `min_picks_per_eq` picks become catalog events, ordered by origin time.
///
/// Picks of rejected components, and picks the converter dropped, are
/// reported with event index [PickAssignment#UNASSOCIATED].
public final class PickAssociator {

    private static final Logger logger = LogManager.getLogger(PickAssociator.class);

    private final AssociationConfig config;

    public PickAssociator() {
        this(AssociationConfig.defaults());
    }

    public PickAssociator(AssociationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public AssociationConfig config() {
        return config;
    }

    /// Associates extractor output; see [PickRow#fromPickRecords].
    ///
    /// @throws IllegalArgumentException if `use_amplitude` is on and a record carries
    ///     no amplitude, i.e. the extractor ran without `use_amplitude`
    public AssociationResult associateRecords(List<PickRecord> picks, List<StationRow> stations) {
        Objects.requireNonNull(picks, "picks");
        if (config.useAmplitude()) {
            for (int i = 0; i < picks.size(); i++) {
                if (!picks.get(i).hasAmplitude()) {
                    throw new IllegalArgumentException(String.format(
                        "use_amplitude is set but pick record %d has no amplitude; extract with "
                            + "use_amplitude and waveforms, or associate with use_amplitude=false", i));
                }
            }
        }
        return associate(PickRow.fromPickRecords(picks), stations);
    }

    public AssociationResult associate(List<PickRow> picks, List<StationRow> stations) {
        Objects.requireNonNull(picks, "picks");
        Objects.requireNonNull(stations, "stations");
        PickAssignment[] byPick = new PickAssignment[picks.size()];
        for (int i = 0; i < byPick.length; i++) {
            byPick[i] = new PickAssignment(i, PickAssignment.UNASSOCIATED, 0.0);
        }

        PickFeatures features = PickFeatureConverter.convert(picks, stations, config);
        if (features.size() == 0) {
            logger.info("No associable picks among {} input picks", picks.size());
            return new AssociationResult(List.of(), Arrays.asList(byPick));
        }

        int nComponents = componentCount(features);
        MixtureFit fit = GaussianMixtureAssociator.builder(config)
            .nComponents(nComponents)
            .build()
            .fit(features);

        int[] hard = fit.hardAssignments();
        int[] counts = new int[nComponents];
        for (int component : hard) {
            counts[component]++;
        }
        List<Integer> accepted = new ArrayList<>();
        for (int k = 0; k < nComponents; k++) {
            if (counts[k] >= config.minPicksPerEq() && counts[k] > 0) {
                accepted.add(k);
            }
        }
        accepted.sort(Comparator.comparingDouble(k -> fit.events().get(k).originTime()));

        int[] catalogIndex = new int[nComponents];
        Arrays.fill(catalogIndex, PickAssignment.UNASSOCIATED);
        for (int e = 0; e < accepted.size(); e++) {
            catalogIndex[accepted.get(e)] = e;
        }

        double[] gammaScore = new double[nComponents];
        for (int i = 0; i < hard.length; i++) {
            int k = hard[i];
            double probability = fit.responsibilities()[i][k];
            gammaScore[k] += probability;
            int original = features.pickIndex()[i];
            byPick[original] = new PickAssignment(original, catalogIndex[k], probability);
        }

        List<AssociatedEvent> events = new ArrayList<>(accepted.size());
        for (int e = 0; e < accepted.size(); e++) {
            int k = accepted.get(e);
            EventHypothesis hypothesis = fit.events().get(k);
            events.add(new AssociatedEvent(
                e,
                Timestamps.fromSeconds(hypothesis.originTime()),
                hypothesis.originTime(),
                locationByDim(hypothesis.location()),
                hypothesis.magnitude(),
                hypothesis.sigmaTime(),
                hypothesis.sigmaAmplitude(),
                hypothesis.covTimeAmplitude(),
                gammaScore[k],
                counts[k]));
        }

        int associated = 0;
        for (PickAssignment assignment : byPick) {
            if (assignment.isAssociated()) associated++;
        }
        logger.info("Associated {} of {} picks into {} events ({} components)",
            associated, picks.size(), events.size(), nComponents);
        return new AssociationResult(events, Arrays.asList(byPick));
    }

    /// Component count for the given features: the configured count, or the
    /// picks per station-phase pair times `oversample_factor`; always within [1, n].
    int componentCount(PickFeatures features) {
        int n = features.size();
        if (config.nComponents() != null) {
            return Math.max(1, Math.min(config.nComponents(), n));
        }
        Set<String> stationPhases = new HashSet<>(Arrays.asList(features.pickStationIds()));
        int estimate = (int) Math.ceil((double) n / stationPhases.size() * config.oversampleFactor());
        return Math.max(1, Math.min(estimate, n));
    }

    private Map<String, Double> locationByDim(double[] location) {
        Map<String, Double> byDim = new LinkedHashMap<>();
        for (int d = 0; d < location.length; d++) {
            byDim.put(config.dims().get(d), location[d]);
        }
        return Collections.unmodifiableMap(byDim);
    }
}
