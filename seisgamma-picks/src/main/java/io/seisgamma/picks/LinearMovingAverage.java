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

/**
 * Running arithmetic mean of all values seen so far. Not thread-safe.
 */
public final class LinearMovingAverage {

    private double value = Double.NaN;
    private long count;

    public double update(double x) {
        count++;
        value = count == 1 ? x : value + (x - value) / count;
        return value;
    }

    /**
     * Current mean, NaN before the first update.
     */
    public double value() {
        return value;
    }

    public long count() {
        return count;
    }
}
