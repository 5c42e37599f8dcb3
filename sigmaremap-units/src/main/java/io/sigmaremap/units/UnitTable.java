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


import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/// An ordered, immutable list of [Conversion] entries. Lookups scan the entries in order and
/// the first match wins, so more specific spellings must come before more general ones.
///
/// Tables are plain values: build one with [#defaults()] or [#load(Path)] and hand it to each
/// [UnitsConverter] that needs it.
///
/// The YAML form is a list under `units`:
/// ```
/// units:
///   - pattern: "(hPa|mb)"
///     factor: 100.0
///     type: pressure
///   - pattern: "g/kg"
///     factor: 0.001
///     type: { }
/// ```
/// `type` is either the name of a base or derived type, or a map of exponents keyed by base
/// dimension name.
public final class UnitTable implements Iterable<Conversion> {

  private final List<Conversion> conversions;

  public UnitTable(List<Conversion> conversions) {
    this.conversions = List.copyOf(conversions);
  }

  /// The recognized spellings of meters, atmospheres, bars, decibars, hectopascals (millibars),
  /// pascals and kelvin.
  /// @return a new table holding the default registry
  public static UnitTable defaults() {
    return new UnitTable(List.of(
        Conversion.of("(m|[Mm]eter(s)?)", 1.0d, UnitType.DISTANCE),
        Conversion.of("(atm|[Aa]tmosphere(s)?)", 101325.0d, UnitType.PRESSURE),
        Conversion.of("[Bb]ar(s)?", 100000.0d, UnitType.PRESSURE),
        Conversion.of("[Dd]ecibar(s)?", 10000.0d, UnitType.PRESSURE),
        Conversion.of("(hPa|mb|([Mm]|[Mm]illi)bar(s)?)", 100.0d, UnitType.PRESSURE),
        Conversion.of("(Pa|[Pp]ascal(s)?)", 1.0d, UnitType.PRESSURE),
        Conversion.of("K", 1.0d, UnitType.TEMPERATURE)
    ));
  }

  /// Read a table from a YAML file.
  /// @param path the YAML file
  /// @return the table described by the file
  public static UnitTable load(Path path) {
    try {
      return parse(Files.readString(path), path.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("unable to read unit table " + path, e);
    }
  }

  /// Read a table from YAML text.
  /// @param yaml the table definition
  /// @param label a name for the source, used in error messages
  /// @return the table described by the text
  public static UnitTable parse(String yaml, String label) {
    Load load = new Load(LoadSettings.builder().setLabel(label).build());
    Object document = load.loadFromString(yaml);
    if (!(document instanceof Map<?, ?> root) || !(root.get("units") instanceof List<?> entries)) {
      throw new IllegalArgumentException("unit table " + label + " must contain a 'units' list");
    }
    List<Conversion> conversions = new ArrayList<>();
    for (Object entry : entries) {
      if (!(entry instanceof Map<?, ?> fields)) {
        throw new IllegalArgumentException("unit table " + label + " has a malformed entry: " + entry);
      }
      Object pattern = fields.get("pattern");
      Object factor = fields.get("factor");
      if (pattern == null || !(factor instanceof Number number)) {
        throw new IllegalArgumentException(
            "unit table " + label + " entry needs a pattern and a numeric factor: " + entry);
      }
      conversions.add(Conversion.of(pattern.toString(), number.doubleValue(), parseType(fields.get("type"), label)));
    }
    return new UnitTable(conversions);
  }

  private static UnitType parseType(Object type, String label) {
    if (type instanceof String name) {
      return UnitType.named(name);
    }
    if (type instanceof Map<?, ?> exponents) {
      UnitType result = UnitType.DIMENSIONLESS;
      for (Map.Entry<?, ?> e : exponents.entrySet()) {
        if (!(e.getValue() instanceof Number power)) {
          throw new IllegalArgumentException(
              "unit table " + label + " exponent for " + e.getKey() + " must be an integer");
        }
        UnitType base = UnitType.named(e.getKey().toString());
        for (int i = 0; i < Math.abs(power.intValue()); i++) {
          result = power.intValue() > 0 ? result.combine(base) : result.separate(base);
        }
      }
      return result;
    }
    throw new IllegalArgumentException("unit table " + label + " entry has no usable type: " + type);
  }

  public List<Conversion> conversions() {
    return Collections.unmodifiableList(conversions);
  }

  public int size() {
    return conversions.size();
  }

  @Override
  public Iterator<Conversion> iterator() {
    return conversions.iterator();
  }
}
