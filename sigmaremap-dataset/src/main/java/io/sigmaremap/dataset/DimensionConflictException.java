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


/// Raised when a dimension is copied into a dataset which already has a dimension of the same
/// name but a different size. This usually means two inputs are on different grids.
public class DimensionConflictException extends DatasetException {

  private final String dimension;
  private final int existingSize;
  private final int requestedSize;

  public DimensionConflictException(String dimension, int existingSize, int requestedSize) {
    super(String.format(
        "dimension '%s' already exists with size %d, cannot redefine it with size %d",
        dimension, existingSize, requestedSize));
    this.dimension = dimension;
    this.existingSize = existingSize;
    this.requestedSize = requestedSize;
  }

  public String getDimension() {
    return dimension;
  }

  public int getExistingSize() {
    return existingSize;
  }

  public int getRequestedSize() {
    return requestedSize;
  }
}
