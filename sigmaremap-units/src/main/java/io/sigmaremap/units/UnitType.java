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


/// The dimensional signature of a unit, expressed as integer exponents over the seven
/// base dimensions. Two units can only be converted into each other when their types are
/// equal component-wise.
///
/// Derived types are built with [#combine] (multiplication of units) and [#separate]
/// (division of units), e.g. pressure is `force / area`.
public record UnitType(
    int current,
    int distance,
    int intensity,
    int mass,
    int mole,
    int temperature,
    int time
)
{
  public static final UnitType DIMENSIONLESS = new UnitType(0, 0, 0, 0, 0, 0, 0);

  public static final UnitType CURRENT = new UnitType(1, 0, 0, 0, 0, 0, 0);
  public static final UnitType DISTANCE = new UnitType(0, 1, 0, 0, 0, 0, 0);
  public static final UnitType INTENSITY = new UnitType(0, 0, 1, 0, 0, 0, 0);
  public static final UnitType MASS = new UnitType(0, 0, 0, 1, 0, 0, 0);
  public static final UnitType MOLE = new UnitType(0, 0, 0, 0, 1, 0, 0);
  public static final UnitType TEMPERATURE = new UnitType(0, 0, 0, 0, 0, 1, 0);
  public static final UnitType TIME = new UnitType(0, 0, 0, 0, 0, 0, 1);

  public static final UnitType VELOCITY = DISTANCE.separate(TIME);
  public static final UnitType ACCELERATION = VELOCITY.separate(TIME);
  public static final UnitType FORCE = MASS.combine(ACCELERATION);
  public static final UnitType AREA = DISTANCE.combine(DISTANCE);
  public static final UnitType VOLUME = DISTANCE.combine(AREA);
  public static final UnitType PRESSURE = FORCE.separate(AREA);

  /// @param other the type to multiply by
  /// @return the type of the product of two units
  public UnitType combine(UnitType other) {
    return new UnitType(
        current + other.current,
        distance + other.distance,
        intensity + other.intensity,
        mass + other.mass,
        mole + other.mole,
        temperature + other.temperature,
        time + other.time
    );
  }

  /// @param other the type to divide by
  /// @return the type of the quotient of two units
  public UnitType separate(UnitType other) {
    return new UnitType(
        current - other.current,
        distance - other.distance,
        intensity - other.intensity,
        mass - other.mass,
        mole - other.mole,
        temperature - other.temperature,
        time - other.time
    );
  }

  /// Look up a type by name, for configuration files.
  /// @param name one of the base or derived type names, case-insensitive
  /// @return the named type
  /// @throws IllegalArgumentException if the name is not a known type
  public static UnitType named(String name) {
    switch (name.trim().toLowerCase()) {
      case "dimensionless":
        return DIMENSIONLESS;
      case "current":
        return CURRENT;
      case "distance":
        return DISTANCE;
      case "intensity":
        return INTENSITY;
      case "mass":
        return MASS;
      case "mole":
        return MOLE;
      case "temperature":
        return TEMPERATURE;
      case "time":
        return TIME;
      case "velocity":
        return VELOCITY;
      case "acceleration":
        return ACCELERATION;
      case "force":
        return FORCE;
      case "area":
        return AREA;
      case "volume":
        return VOLUME;
      case "pressure":
        return PRESSURE;
      default:
        throw new IllegalArgumentException("Unknown unit type: " + name);
    }
  }
}
