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


import java.util.Optional;

/// A units conversion calculator over a [UnitTable].
///
/// Every unit string resolves to a dimensional [UnitType] and a factor to SI. Converting
/// from one unit to another multiplies the source's factor to SI with the destination's
/// factor from SI, provided both have the same type.
///
/// Instances hold no mutable state and may be shared between threads.
public class UnitsConverter {

  private final UnitTable table;

  /// @param table the unit spellings this converter recognizes
  public UnitsConverter(UnitTable table) {
    this.table = table;
  }

  public UnitTable getTable() {
    return table;
  }

  /// A unit's type together with a conversion factor.
  /// @param type the dimensional signature of the unit
  /// @param factor the multiplier in the requested direction
  public record Scale(UnitType type, double factor) {
  }

  /// Resolve a unit to its SI factor.
  /// @param units the unit string
  /// @return the type of the unit, and the factor which converts values in it to SI
  /// @throws UnitConversionException if the unit is not in the table
  public Scale toSi(String units) {
    return lookup(units)
        .map(c -> new Scale(c.type(), c.factor()))
        .orElseThrow(() -> UnitConversionException.notFound(units));
  }

  /// Resolve a unit to its factor from SI.
  /// @param units the unit string
  /// @return the type of the unit, and the factor which converts SI values into it
  /// @throws UnitConversionException if the unit is not in the table
  public Scale fromSi(String units) {
    Scale scale = toSi(units);
    return new Scale(scale.type(), 1.0d / scale.factor());
  }

  /// Compute the factor converting values in one unit into another.
  /// @param source the units to convert from
  /// @param destination the units to convert to
  /// @return the conversion factor from source to destination
  /// @throws UnitConversionException if either unit is unknown or they are dimensionally incompatible
  public double convert(String source, String destination) {
    Scale to = toSi(source);
    Scale from = fromSi(destination);
    if (!to.type().equals(from.type())) {
      throw UnitConversionException.incompatible(source, destination);
    }
    if (source.equals(destination)) {
      return 1.0d;
    }
    return to.factor() * from.factor();
  }

  /// @param units a unit string, possibly null
  /// @param type the dimensional type to test for
  /// @return true if the unit string matches a table entry of the given type
  public boolean isType(String units, UnitType type) {
    if (units == null) {
      return false;
    }
    for (Conversion conversion : table) {
      if (conversion.matches(units) && conversion.type().equals(type)) {
        return true;
      }
    }
    return false;
  }

  /// @param units a unit string, possibly null
  /// @return true if the unit string is a recognized pressure unit
  public boolean isPressure(String units) {
    return isType(units, UnitType.PRESSURE);
  }

  private Optional<Conversion> lookup(String units) {
    if (units == null) {
      return Optional.empty();
    }
    for (Conversion conversion : table) {
      if (conversion.matches(units)) {
        return Optional.of(conversion);
      }
    }
    return Optional.empty();
  }
}
