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

/// Relates event magnitude and event-station geometry to the log amplitude
/// feature, `log10(amplitude * 100)`.
///
/// The model must be linear in magnitude: the engine estimates each event's
/// magnitude in closed form as the weighted mean of [#magnitude] over its picks.
///
/// @see MagnitudeAttenuationModel
public interface AmplitudeModel {

    /// Predicted log amplitude for a pick.
    double logAmplitude(double magnitude, double[] event, double[] station);

    /// Magnitude that explains one observed log amplitude exactly.
    double magnitude(double logAmplitude, double[] event, double[] station);
}
