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


/// A named axis of a dataset.
/// @param name the dimension name
/// @param size the current number of entries along the axis
/// @param unlimited whether the axis may grow, as a record dimension such as time does
public record Dimension(String name, int size, boolean unlimited) {

  public Dimension {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("dimension name cannot be null or empty");
    }
    if (size < 0) {
      throw new IllegalArgumentException("dimension " + name + " cannot have negative size " + size);
    }
  }

  public Dimension(String name, int size) {
    this(name, size, false);
  }

  public Dimension withSize(int newSize) {
    return new Dimension(name, newSize, unlimited);
  }
}
