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

import java.util.Map;

/**
 * A catalog entry: one accepted event hypothesis.
 *
 * @param eventIndex position in the catalog, ordered by origin time
 * @param time origin time, millisecond UTC text
 * @param originTime origin time, epoch seconds
 * @param location coordinates keyed by dim name, in dim order
 * @param magnitude magnitude, NaN without amplitudes
 * @param sigmaTime arrival-time residual standard deviation, seconds
 * @param sigmaAmplitude log-amplitude residual standard deviation, NaN without amplitudes
 * @param covTimeAmplitude time/amplitude residual covariance, NaN without amplitudes
 * @param gammaScore sum of the assignment probabilities of its picks
 * @param numPicks number of picks assigned to the event
 */
public record AssociatedEvent(
    @SerializedName("event_index") int eventIndex,
    @SerializedName("time") String time,
    @SerializedName("origin_time") double originTime,
    @SerializedName("location") Map<String, Double> location,
    @SerializedName("magnitude") double magnitude,
    @SerializedName("sigma_time") double sigmaTime,
    @SerializedName("sigma_amp") double sigmaAmplitude,
    @SerializedName("cov_time_amp") double covTimeAmplitude,
    @SerializedName("gamma_score") double gammaScore,
    @SerializedName("num_picks") int numPicks
) {
}
