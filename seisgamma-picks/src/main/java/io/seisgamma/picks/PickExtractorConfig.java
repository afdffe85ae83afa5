package io.seisgamma.picks;

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

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Settings for {@link PickExtractor}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "dt": 0.01,
 *   "phases": ["P", "S"],
 *   "min_prob": 0.3,
 *   "min_p_prob": 0.3,      // optional, overrides min_prob for P
 *   "min_s_prob": 0.3,      // optional, overrides min_prob for S
 *   "mpd": 50,
 *   "post_window_sec": 4.0,
 *   "use_amplitude": false
 * }
 * }</pre>
 *
 * <p>Instances are validated once, when built or loaded.
 */
public final class PickExtractorConfig {

    public static final double DEFAULT_DT = 0.01;
    public static final double DEFAULT_MIN_PROB = 0.3;
    public static final int DEFAULT_MPD = 50;
    public static final double DEFAULT_POST_WINDOW_SEC = 4.0;
    public static final List<String> DEFAULT_PHASES = List.of("P", "S");

    @SerializedName("dt")
    private double dt = DEFAULT_DT;

    @SerializedName("phases")
    private List<String> phases = DEFAULT_PHASES;

    @SerializedName("min_prob")
    private double minProb = DEFAULT_MIN_PROB;

    @SerializedName("min_p_prob")
    private Double minPProb;

    @SerializedName("min_s_prob")
    private Double minSProb;

    @SerializedName("mpd")
    private int mpd = DEFAULT_MPD;

    @SerializedName("post_window_sec")
    private double postWindowSec = DEFAULT_POST_WINDOW_SEC;

    @SerializedName("use_amplitude")
    private boolean useAmplitude;

    private PickExtractorConfig() {
    }

    public static PickExtractorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads and validates a configuration from JSON; absent fields take their defaults.
     *
     * @throws IllegalArgumentException if the JSON is malformed or a value is invalid
     */
    public static PickExtractorConfig fromJson(Reader reader) {
        PickExtractorConfig config;
        try {
            config = SeisgammaGson.gson().fromJson(reader, PickExtractorConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid pick extractor configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            config = new PickExtractorConfig();
        }
        return config.validated();
    }

    public static PickExtractorConfig fromJson(String json) {
        return fromJson(new StringReader(json));
    }

    public String toJson() {
        return SeisgammaGson.gson().toJson(this);
    }

    private PickExtractorConfig validated() {
        if (!(dt > 0) || !Double.isFinite(dt)) {
            throw new IllegalArgumentException("dt must be positive, got: " + dt);
        }
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("phases must name at least one phase");
        }
        for (String phase : phases) {
            if (phase == null || phase.isBlank()) {
                throw new IllegalArgumentException("phases must not contain blank names: " + phases);
            }
        }
        phases = Collections.unmodifiableList(new ArrayList<>(phases));
        requireProbability("min_prob", minProb);
        if (minPProb != null) requireProbability("min_p_prob", minPProb);
        if (minSProb != null) requireProbability("min_s_prob", minSProb);
        if (mpd < 0) {
            throw new IllegalArgumentException("mpd must be >= 0, got: " + mpd);
        }
        if (!(postWindowSec > 0) || !Double.isFinite(postWindowSec)) {
            throw new IllegalArgumentException("post_window_sec must be positive, got: " + postWindowSec);
        }
        return this;
    }

    private static void requireProbability(String name, double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must not be NaN");
        }
    }

    public double dt() {
        return dt;
    }

    public List<String> phases() {
        return phases;
    }

    /**
     * Minimum peak probability for the given phase.
     */
    public double minProbability(String phase) {
        if ("P".equals(phase) && minPProb != null) {
            return minPProb;
        }
        if ("S".equals(phase) && minSProb != null) {
            return minSProb;
        }
        return minProb;
    }

    public int minPeakDistance() {
        return mpd;
    }

    public double postWindowSec() {
        return postWindowSec;
    }

    /**
     * Post window length in samples, {@code (int) (post_window_sec / dt)}.
     */
    public int postWindowSamples() {
        return (int) (postWindowSec / dt);
    }

    public boolean useAmplitude() {
        return useAmplitude;
    }

    @Override
    public String toString() {
        return "PickExtractorConfig{dt=" + dt + ", phases=" + phases + ", minProb=" + minProb
            + ", minPProb=" + minPProb + ", minSProb=" + minSProb + ", mpd=" + mpd
            + ", postWindowSec=" + postWindowSec + ", useAmplitude=" + useAmplitude + "}";
    }

    public static final class Builder {
        private final PickExtractorConfig config = new PickExtractorConfig();

        private Builder() {
        }

        public Builder dt(double dt) {
            config.dt = dt;
            return this;
        }

        public Builder phases(List<String> phases) {
            config.phases = Objects.requireNonNull(phases, "phases");
            return this;
        }

        public Builder minProb(double minProb) {
            config.minProb = minProb;
            return this;
        }

        public Builder minPProb(double minPProb) {
            config.minPProb = minPProb;
            return this;
        }

        public Builder minSProb(double minSProb) {
            config.minSProb = minSProb;
            return this;
        }

        public Builder minPeakDistance(int mpd) {
            config.mpd = mpd;
            return this;
        }

        public Builder postWindowSec(double postWindowSec) {
            config.postWindowSec = postWindowSec;
            return this;
        }

        public Builder useAmplitude(boolean useAmplitude) {
            config.useAmplitude = useAmplitude;
            return this;
        }

        public PickExtractorConfig build() {
            PickExtractorConfig copy = new PickExtractorConfig();
            copy.dt = config.dt;
            copy.phases = config.phases;
            copy.minProb = config.minProb;
            copy.minPProb = config.minPProb;
            copy.minSProb = config.minSProb;
            copy.mpd = config.mpd;
            copy.postWindowSec = config.postWindowSec;
            copy.useAmplitude = config.useAmplitude;
            return copy.validated();
        }
    }
}
