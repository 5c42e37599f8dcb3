package io.sigmaremap.units;

/*
 * Copyright (c) nosqlbench
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


/// Raised when a unit string is not in the converter's table, or when the source and
/// destination of a conversion have different dimensional types.
public class UnitConversionException extends RuntimeException {

  /// Distinguishes the two failure conditions of a conversion.
  public enum Reason {
    UNIT_NOT_FOUND,
    INCOMPATIBLE_UNITS
  }

  private final Reason reason;
  private final String source;
  private final String destination;

  private UnitConversionException(Reason reason, String source, String destination, String message) {
    super(message);
    this.reason = reason;
    this.source = source;
    this.destination = destination;
  }

  public static UnitConversionException notFound(String units) {
    return new UnitConversionException(
        Reason.UNIT_NOT_FOUND, units, null, units + " not found in converter.");
  }

  public static UnitConversionException incompatible(String source, String destination) {
    return new UnitConversionException(
        Reason.INCOMPATIBLE_UNITS,
        source,
        destination,
        "Cannot convert " + source + " to " + destination + "."
    );
  }

  public Reason getReason() {
    return reason;
  }

  /// @return the unit being converted from, or the unit which was not found
  public String getSource() {
    return source;
  }

  /// @return the unit being converted to, or null when a lookup failed
  public String getDestination() {
    return destination;
  }
}
