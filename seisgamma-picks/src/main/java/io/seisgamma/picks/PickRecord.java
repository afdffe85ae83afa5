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

import com.google.gson.annotations.SerializedName;

/**
 * One detected phase arrival at one station.
 *
 * @param fileName source file identifier
 * @param stationId station identifier
 * @param beginTime start time of the analysed window
 * @param phaseIndex sample offset of the peak within the window
 * @param phaseTime begin time advanced by {@code phaseIndex * dt} seconds
 * @param phaseScore peak probability, rounded to 3 decimals
 * @param phaseType phase code such as {@code P} or {@code S}
 * @param dt sampling interval in seconds
 * @param phaseAmplitude peak waveform amplitude after the pick, or NaN when not measured
 */
public record PickRecord(
    @SerializedName("file_name") String fileName,
    @SerializedName("station_id") String stationId,
    @SerializedName("begin_time") String beginTime,
    @SerializedName("phase_index") int phaseIndex,
    @SerializedName("phase_time") String phaseTime,
    @SerializedName("phase_score") double phaseScore,
    @SerializedName("phase_type") String phaseType,
    @SerializedName("dt") double dt,
    @SerializedName("phase_amplitude") double phaseAmplitude
) {

    public boolean hasAmplitude() {
        return !Double.isNaN(phaseAmplitude);
    }
}
