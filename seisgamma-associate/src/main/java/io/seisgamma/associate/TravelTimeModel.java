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

/// Predicts the travel time of a phase from an event to a station.
///
/// Coordinates are in the units of the configured dimensions (kilometres for
/// the default `x(km)`, `y(km)`, `z(km)`), times in seconds. Implementations
/// must be stateless or immutable; one instance is shared by every component
/// of a fit.
///
/// @see UniformVelocityModel
public interface TravelTimeModel {

    /// Travel time in seconds.
    ///
    /// @param event event location
    /// @param station station location, same dimensionality as `event`
    /// @param phase lowercase phase type, e.g. `p` or `s`
    double travelTime(double[] event, double[] station, String phase);

    /// Partial derivatives of [#travelTime] with respect to each event coordinate.
    double[] gradient(double[] event, double[] station, String phase);
}
