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


/// Raised when a variable depends on a pressure coordinate whose values or units cannot be
/// used to locate its levels.
public class MissingCoordinateException extends RuntimeException {

  private final String variable;
  private final String coordinate;

  public MissingCoordinateException(String variable, String coordinate, String problem) {
    super("variable " + variable + " cannot be remapped on " + coordinate + ": " + problem);
    this.variable = variable;
    this.coordinate = coordinate;
  }

  public String getVariable() {
    return variable;
  }

  public String getCoordinate() {
    return coordinate;
  }
}
