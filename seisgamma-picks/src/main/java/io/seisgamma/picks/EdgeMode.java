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

import java.util.Locale;

/// Which index of a flat-topped maximum (plateau) is reported as a peak.
public enum EdgeMode {
    /// Only strict local maxima; plateaus never produce a peak.
    NONE,
    /// The first sample of a plateau, reached by a rising step.
    RISING,
    /// The last sample of a plateau, left by a falling step.
    FALLING,
    /// Both the rising and the falling edge of a plateau.
    BOTH;

    boolean includesRising() {
        return this == RISING || this == BOTH;
    }

    boolean includesFalling() {
        return this == FALLING || this == BOTH;
    }

    /// Parses `rising`, `falling`, `both` or `none` (case-insensitive). A null name means [#NONE].
    public static EdgeMode fromName(String name) {
        if (name == null) {
            return NONE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "edge must be one of rising, falling, both or none, got: " + name, e);
        }
    }
}
