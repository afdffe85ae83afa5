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
import io.seisgamma.picks.SeisgammaGson;

import java.util.List;

/**
 * Event catalog plus one assignment per input pick, in input order.
 */
public record AssociationResult(
    @SerializedName("events") List<AssociatedEvent> events,
    @SerializedName("assignments") List<PickAssignment> assignments
) {

    public AssociationResult {
        events = List.copyOf(events);
        assignments = List.copyOf(assignments);
    }

    /**
     * Picks assigned to the given catalog event.
     */
    public List<PickAssignment> picksOf(int eventIndex) {
        return assignments.stream().filter(a -> a.eventIndex() == eventIndex).toList();
    }

    public String toJson() {
        return SeisgammaGson.gson().toJson(this);
    }
}
