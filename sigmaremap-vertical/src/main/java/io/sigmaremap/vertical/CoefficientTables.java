package io.sigmaremap.vertical;

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


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/// Hybrid coefficient tables in YAML form:
/// ```
/// name: era-interim
/// units: hPa
/// a: [0.96, 1.81, ...]
/// b: [0.0, 0.0, ...]
/// level_map: [0, 2, 4]   # optional
/// ```
/// Tables are read from files, or from the `hybrid-tables` directory on the classpath.
public final class CoefficientTables {
  private static final Logger logger = LogManager.getLogger(CoefficientTables.class);

  public static final String ERA_INTERIM = "era-interim";
  public static final List<String> BUNDLED = List.of(ERA_INTERIM);

  private static final String RESOURCE_DIR = "/hybrid-tables/";

  private CoefficientTables() {
  }

  /// @return the ERA-Interim coefficients, in hPa
  public static HybridCoefficients eraInterim() {
    return bundled(ERA_INTERIM);
  }

  /// @param name the table name, without extension
  /// @return the coefficients of a table shipped with this library
  public static HybridCoefficients bundled(String name) {
    String resource = RESOURCE_DIR + name + ".yaml";
    try (InputStream in = CoefficientTables.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException(
            "no bundled coefficient table '" + name + "', expected one of " + BUNDLED);
      }
      return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource);
    } catch (IOException e) {
      throw new UncheckedIOException("unable to read " + resource, e);
    }
  }

  public static HybridCoefficients load(Path path) {
    try {
      return parse(Files.readString(path), path.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("unable to read coefficient table " + path, e);
    }
  }

  /// @param yaml the table definition
  /// @param label a name for the source, used in error messages
  /// @return the coefficients the text describes
  public static HybridCoefficients parse(String yaml, String label) {
    Load load = new Load(LoadSettings.builder().setLabel(label).build());
    Object document = load.loadFromString(yaml);
    if (!(document instanceof Map<?, ?> table)) {
      throw new IllegalArgumentException("coefficient table " + label + " must be a mapping");
    }
    Object units = table.get("units");
    if (units == null) {
      throw new IllegalArgumentException("coefficient table " + label + " has no units");
    }
    double[] a = doubles(table.get("a"), "a", label);
    double[] b = doubles(table.get("b"), "b", label);
    int[] levelMap = null;
    if (table.get("level_map") != null) {
      double[] levels = doubles(table.get("level_map"), "level_map", label);
      levelMap = new int[levels.length];
      for (int i = 0; i < levels.length; i++) {
        if (levels[i] != Math.rint(levels[i])) {
          throw new IllegalArgumentException("coefficient table " + label
                                             + " has a level_map entry which is not a whole number: " + levels[i]);
        }
        levelMap[i] = (int) levels[i];
      }
    }
    HybridCoefficients coefficients = new HybridCoefficients(a, b, units.toString(), levelMap);
    logger.debug("loaded {} from {}", coefficients, label);
    return coefficients;
  }

  private static double[] doubles(Object value, String field, String label) {
    if (!(value instanceof List<?> list)) {
      throw new IllegalArgumentException("coefficient table " + label + " needs a list named " + field);
    }
    double[] result = new double[list.size()];
    for (int i = 0; i < result.length; i++) {
      if (!(list.get(i) instanceof Number number)) {
        throw new IllegalArgumentException(
            "coefficient table " + label + " has a non-numeric " + field + " entry: " + list.get(i));
      }
      result[i] = number.doubleValue();
    }
    return result;
  }
}
