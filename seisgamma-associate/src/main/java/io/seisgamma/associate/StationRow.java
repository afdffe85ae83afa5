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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of the station table: an id and named coordinates.
 * Coordinates may be missing (absent or null); such stations match no pick.
 */
public record StationRow(String id, Map<String, Double> coordinates) {

    public StationRow {
        Objects.requireNonNull(id, "id");
        coordinates = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(coordinates, "coordinates")));
    }

    /**
     * Station with one value per named dim, in order.
     */
    public static StationRow of(String id, List<String> dims, double... values) {
        if (dims.size() != values.length) {
            throw new IllegalArgumentException(String.format(
                "station %s has %d values for %d dims", id, values.length, dims.size()));
        }
        Map<String, Double> coordinates = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            coordinates.put(dims.get(i), values[i]);
        }
        return new StationRow(id, coordinates);
    }

    /**
     * Coordinate for a dim, or null when absent.
     */
    public Double coordinate(String dim) {
        return coordinates.get(dim);
    }
}
