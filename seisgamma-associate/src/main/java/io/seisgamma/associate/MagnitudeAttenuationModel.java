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

/**
 * Empirical amplitude attenuation:
 * {@code log A = c0 + c1 (M - 3.5) + c3 log10(r)}, with {@code r} the
 * hypocentral distance in km, floored at {@value #MIN_DISTANCE_KM} km.
 */
public final class MagnitudeAttenuationModel implements AmplitudeModel {

    public static final double DEFAULT_C0 = 1.08;
    public static final double DEFAULT_C1 = 0.93;
    public static final double DEFAULT_C3 = -1.68;
    public static final double REFERENCE_MAGNITUDE = 3.5;

    static final double MIN_DISTANCE_KM = 0.1;

    private final double c0;
    private final double c1;
    private final double c3;

    public MagnitudeAttenuationModel() {
        this(DEFAULT_C0, DEFAULT_C1, DEFAULT_C3);
    }

    public MagnitudeAttenuationModel(double c0, double c1, double c3) {
        if (c1 == 0 || !Double.isFinite(c0) || !Double.isFinite(c1) || !Double.isFinite(c3)) {
            throw new IllegalArgumentException(String.format(
                "coefficients must be finite with c1 != 0, got c0=%s, c1=%s, c3=%s", c0, c1, c3));
        }
        this.c0 = c0;
        this.c1 = c1;
        this.c3 = c3;
    }

    @Override
    public double logAmplitude(double magnitude, double[] event, double[] station) {
        return c0 + c1 * (magnitude - REFERENCE_MAGNITUDE) + c3 * Math.log10(distance(event, station));
    }

    @Override
    public double magnitude(double logAmplitude, double[] event, double[] station) {
        return REFERENCE_MAGNITUDE + (logAmplitude - c0 - c3 * Math.log10(distance(event, station))) / c1;
    }

    private static double distance(double[] event, double[] station) {
        return Math.max(UniformVelocityModel.distance(event, station), MIN_DISTANCE_KM);
    }

    @Override
    public String toString() {
        return String.format("MagnitudeAttenuationModel[c0=%.2f, c1=%.2f, c3=%.2f]", c0, c1, c3);
    }
}
