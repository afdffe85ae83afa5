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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One row of the pick table fed to association.
 *
 * @param id station key, either a composite {@code station_phase} id or a bare station id
 * @param timestamp arrival time
 * @param type phase type, any case
 * @param prob detection probability, or null
 * @param amp peak amplitude, or null
 */
public record PickRow(String id, Instant timestamp, String type, Double prob, Double amp) {

    public PickRow {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Pick without probability or amplitude.
     */
    public static PickRow of(String id, String timestamp, String type) {
        return new PickRow(id, Timestamps.parse(timestamp), type, null, null);
    }

    /**
     * Converts extractor output; the station id becomes the row id and the
     * phase time its timestamp. Unmeasured amplitudes become null.
     */
    public static List<PickRow> fromPickRecords(List<PickRecord> records) {
        List<PickRow> rows = new ArrayList<>(records.size());
        for (PickRecord record : records) {
            rows.add(new PickRow(
                record.stationId(),
                Timestamps.parse(record.phaseTime()),
                record.phaseType(),
                record.phaseScore(),
                record.hasAmplitude() ? record.phaseAmplitude() : null));
        }
        return rows;
    }
}
