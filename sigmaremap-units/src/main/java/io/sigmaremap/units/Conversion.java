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


import java.util.regex.Pattern;

/// One entry of a [UnitTable]: every unit string matching [#pattern] in full converts to SI
/// by multiplying with [#factor], and has the dimensional signature [#type].
/// @param pattern the unit spellings this entry accepts
/// @param factor the multiplier from this unit to the SI unit of the same type
/// @param type the dimensional signature of the unit
public record Conversion(Pattern pattern, double factor, UnitType type) {

  public Conversion {
    if (pattern == null || type == null) {
      throw new IllegalArgumentException("pattern and type cannot be null");
    }
    if (factor == 0.0d || !Double.isFinite(factor)) {
      throw new IllegalArgumentException("conversion factor must be finite and non-zero, got " + factor);
    }
  }

  /// @param regex the unit spellings, as a regular expression
  /// @param factor the multiplier to SI
  /// @param type the dimensional signature
  /// @return a new conversion
  public static Conversion of(String regex, double factor, UnitType type) {
    return new Conversion(Pattern.compile(regex), factor, type);
  }

  /// @param units a unit string, e.g. `hPa`
  /// @return true if the whole unit string is one of this entry's spellings
  public boolean matches(String units) {
    return pattern.matcher(units).matches();
  }
}
