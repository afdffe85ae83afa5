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

package io.seisgamma.picks;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;

/// Millisecond-precision timestamp text used for pick and event times.
///
/// ## Format
///
/// Output is always `yyyy-MM-dd'T'HH:mm:ss.SSS` in UTC, e.g.
/// `2019-07-06T02:15:05.120`. The zero epoch renders as
/// `1970-01-01T00:00:00.000`.
///
/// Input accepts any ISO-8601 local date-time, optionally with a fraction of
/// any length and an offset (`Z`, `+00:00`, ...). Offsets are normalized to UTC.
///
/// ## Precision
///
/// Second offsets are rounded to the nearest microsecond before they are
/// added, and the result is truncated (not rounded) to milliseconds when
/// formatted.
public final class Timestamps {

    /// The zero epoch, as rendered by [#format(LocalDateTime)].
    public static final String EPOCH = "1970-01-01T00:00:00.000";

    private static final DateTimeFormatter OUTPUT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

    private Timestamps() {
    }

    /// Adds `seconds` to a textual timestamp and formats the result.
    ///
    /// @param timestamp ISO-8601 date-time text
    /// @param seconds offset in seconds, may be negative
    /// @return the shifted time at millisecond precision
    /// @throws IllegalArgumentException if the timestamp cannot be parsed or the offset is not finite
    public static String calcTimestamp(String timestamp, double seconds) {
        return format(plusSeconds(parseLocal(timestamp), seconds));
    }

    /// Renders epoch seconds (UTC) at millisecond precision.
    public static String fromSeconds(double epochSeconds) {
        return format(plusSeconds(LocalDateTime.ofEpochSecond(0, 0, ZoneOffset.UTC), epochSeconds));
    }

    /// Epoch seconds of an instant, with sub-second precision.
    public static double toSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1e9;
    }

    /// Parses timestamp text into an instant; text without an offset is taken as UTC.
    public static Instant parse(String timestamp) {
        return parseLocal(timestamp).toInstant(ZoneOffset.UTC);
    }

    /// Formats a UTC wall-clock time at millisecond precision.
    public static String format(LocalDateTime utc) {
        return OUTPUT.format(utc);
    }

    /// Formats an instant at millisecond precision.
    public static String format(Instant instant) {
        return format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    static LocalDateTime parseLocal(String timestamp) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                timestamp.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable timestamp: " + timestamp, e);
        }
    }

    static LocalDateTime plusSeconds(LocalDateTime base, double seconds) {
        if (!Double.isFinite(seconds)) {
            throw new IllegalArgumentException("seconds must be finite, got: " + seconds);
        }
        long micros = Math.round(seconds * 1_000_000.0);
        return base.plus(micros, ChronoUnit.MICROS);
    }
}
