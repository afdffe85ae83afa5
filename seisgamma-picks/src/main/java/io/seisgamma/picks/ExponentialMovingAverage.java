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
 * Exponentially smoothed running value, e.g. for pick rates or scores over time.
 *
 * <p>The first update sets the value; later updates compute
 * {@code alpha * previous + (1 - alpha) * x}. Not thread-safe; owned by one caller.
 */
public final class ExponentialMovingAverage {

    private final double alpha;
    private double value = Double.NaN;
    private boolean initialized;

    /**
     * @param alpha weight of the previous value, in [0, 1]
     */
    public ExponentialMovingAverage(double alpha) {
        if (!(alpha >= 0 && alpha <= 1)) {
            throw new IllegalArgumentException("alpha must be in [0, 1], got: " + alpha);
        }
        this.alpha = alpha;
    }

    public double update(double x) {
        if (!initialized) {
            value = x;
            initialized = true;
        } else {
            value = alpha * value + (1 - alpha) * x;
        }
        return value;
    }

    /**
     * Current value, NaN before the first update.
     */
    public double value() {
        return value;
    }

    public double alpha() {
        return alpha;
    }
}
