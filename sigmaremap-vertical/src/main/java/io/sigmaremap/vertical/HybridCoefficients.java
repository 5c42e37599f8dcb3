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


import java.util.Arrays;

/// The coefficients of a hybrid sigma-pressure grid. The pressure at level `i` over a surface
/// pressure `sp` is `a[i] + b[i] * sp`, with `a` in [#units()].
///
/// When a level map is given, each entry `k` selects the full level halfway between half
/// levels `k` and `k + 1`, so that a subset of a finer half-level table can be used.
///
/// @param a the pressure offset of each level
/// @param b the surface pressure multiplier of each level
/// @param units the units of `a`
/// @param levelMap half-level indices defining each output level, or null
public record HybridCoefficients(double[] a, double[] b, String units, int[] levelMap) {

  public HybridCoefficients {
    if (a == null || b == null) {
      throw new IllegalArgumentException("both a and b coefficients are required");
    }
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "a and b must have the same length, not " + a.length + " and " + b.length);
    }
    if (a.length == 0) {
      throw new IllegalArgumentException("at least one level is required");
    }
    if (units == null || units.isBlank()) {
      throw new IllegalArgumentException("the units of a are required");
    }
    a = a.clone();
    b = b.clone();
    if (levelMap != null) {
      levelMap = levelMap.clone();
      for (int level : levelMap) {
        if (level < 0 || level + 1 >= a.length) {
          throw new IllegalArgumentException(
              "level map entry " + level + " needs half levels " + level + " and " + (level + 1)
              + " but only " + a.length + " are defined");
        }
      }
    }
  }

  public HybridCoefficients(double[] a, double[] b, String units) {
    this(a, b, units, null);
  }

  @Override
  public double[] a() {
    return a.clone();
  }

  @Override
  public double[] b() {
    return b.clone();
  }

  @Override
  public int[] levelMap() {
    return levelMap == null ? null : levelMap.clone();
  }

  public boolean hasLevelMap() {
    return levelMap != null;
  }

  /// @return the number of output levels
  public int levelCount() {
    return levelMap != null ? levelMap.length : a.length;
  }

  /// @param offsetScale factor taking `a` into the target pressure units
  /// @param surfacePressure the surface pressure, in the target units
  /// @return the pressure of each output level
  double[] pressures(double offsetScale, double surfacePressure) {
    double[] p = new double[levelCount()];
    if (levelMap == null) {
      for (int i = 0; i < p.length; i++) {
        p[i] = a[i] * offsetScale + b[i] * surfacePressure;
      }
      return p;
    }
    for (int i = 0; i < p.length; i++) {
      int k = levelMap[i];
      double lower = a[k] * offsetScale + b[k] * surfacePressure;
      double upper = a[k + 1] * offsetScale + b[k + 1] * surfacePressure;
      p[i] = 0.5d * (lower + upper);
    }
    return p;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HybridCoefficients that)) {
      return false;
    }
    return Arrays.equals(a, that.a) && Arrays.equals(b, that.b) && units.equals(that.units)
           && Arrays.equals(levelMap, that.levelMap);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(a);
    result = 31 * result + Arrays.hashCode(b);
    result = 31 * result + units.hashCode();
    result = 31 * result + Arrays.hashCode(levelMap);
    return result;
  }

  @Override
  public String toString() {
    return "HybridCoefficients[levels=" + levelCount() + ", units=" + units
           + (levelMap != null ? ", levelMap=" + Arrays.toString(levelMap) : "") + "]";
  }
}
