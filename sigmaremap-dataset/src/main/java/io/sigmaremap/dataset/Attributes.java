package io.sigmaremap.dataset;

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


import java.lang.reflect.Array;
import java.util.Map;
import java.util.Optional;

/// Well-known attribute names and typed reads over attribute maps.
///
/// Attribute values are strings, boxed numbers, or one-dimensional primitive arrays. A
/// single-element array reads the same as its only element.
public final class Attributes {

  public static final String UNITS = "units";
  public static final String SCALE_FACTOR = "scale_factor";
  public static final String ADD_OFFSET = "add_offset";
  public static final String FILL_VALUE = "_FillValue";
  public static final String MISSING_VALUE = "missing_value";
  public static final String POSITIVE = "positive";
  public static final String AXIS = "axis";
  public static final String STANDARD_NAME = "standard_name";
  public static final String LONG_NAME = "long_name";

  private Attributes() {
  }

  public static Optional<String> getString(Map<String, Object> attributes, String name) {
    Object value = unwrap(attributes.get(name));
    return value == null ? Optional.empty() : Optional.of(value.toString());
  }

  public static Optional<Double> getDouble(Map<String, Object> attributes, String name) {
    Object value = unwrap(attributes.get(name));
    if (value instanceof Number number) {
      return Optional.of(number.doubleValue());
    }
    if (value instanceof String text) {
      try {
        return Optional.of(Double.parseDouble(text.trim()));
      } catch (NumberFormatException e) {
        throw new DatasetException("attribute " + name + " is not numeric: " + text, e);
      }
    }
    return Optional.empty();
  }

  /// Reduce single-element arrays to their element.
  /// @param value an attribute value
  /// @return the value, or its only element
  public static Object unwrap(Object value) {
    if (value != null && value.getClass().isArray() && Array.getLength(value) == 1) {
      return Array.get(value, 0);
    }
    return value;
  }
}
