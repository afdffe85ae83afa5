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

/// Straight-ray travel times through a homogeneous medium: `distance / velocity`.
///
/// Phase types starting with `p` use the P velocity, those starting with `s`
/// the S velocity (so `pn`, `sg` and the like resolve too).
public final class UniformVelocityModel implements TravelTimeModel {

    /// Default P velocity, km/s.
    public static final double DEFAULT_VP = 6.0;

    /// Default S velocity, km/s.
    public static final double DEFAULT_VS = DEFAULT_VP / 1.75;

    /// Distances below this are treated as this, so gradients stay finite.
    private static final double MIN_DISTANCE = 1e-6;

    private final double vp;
    private final double vs;

    public UniformVelocityModel() {
        this(DEFAULT_VP, DEFAULT_VS);
    }

    public UniformVelocityModel(double vp, double vs) {
        if (!(vp > 0) || !(vs > 0) || !Double.isFinite(vp) || !Double.isFinite(vs)) {
            throw new IllegalArgumentException("velocities must be positive and finite, got vp=" + vp + ", vs=" + vs);
        }
        this.vp = vp;
        this.vs = vs;
    }

    @Override
    public double travelTime(double[] event, double[] station, String phase) {
        return distance(event, station) / velocity(phase);
    }

    @Override
    public double[] gradient(double[] event, double[] station, String phase) {
        double scale = 1.0 / (Math.max(distance(event, station), MIN_DISTANCE) * velocity(phase));
        double[] grad = new double[event.length];
        for (int d = 0; d < event.length; d++) {
            grad[d] = (event[d] - station[d]) * scale;
        }
        return grad;
    }

    public double velocity(String phase) {
        if (phase != null && !phase.isEmpty()) {
            char first = Character.toLowerCase(phase.charAt(0));
            if (first == 'p') return vp;
            if (first == 's') return vs;
        }
        throw new IllegalArgumentException("Unknown phase type: " + phase);
    }

    static double distance(double[] a, double[] b) {
        double sum = 0;
        for (int d = 0; d < a.length; d++) {
            double diff = a[d] - b[d];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    @Override
    public String toString() {
        return String.format("UniformVelocityModel[vp=%.3f, vs=%.3f]", vp, vs);
    }
}
