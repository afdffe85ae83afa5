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

/**
 * Event assignment of one input pick.
 *
 * @param pickIndex position of the pick in the input list
 * @param eventIndex catalog index of its event, or {@link #UNASSOCIATED}
 * @param probability responsibility of its most likely component, 0 for picks that were filtered out
 */
public record PickAssignment(
    @SerializedName("pick_index") int pickIndex,
    @SerializedName("event_index") int eventIndex,
    @SerializedName("gamma_score") double probability
) {

    public static final int UNASSOCIATED = -1;

    public boolean isAssociated() {
        return eventIndex != UNASSOCIATED;
    }
}
