package io.sigmaremap.dataset.hdf5;

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


import io.sigmaremap.dataset.DataType;
import io.sigmaremap.dataset.DatasetException;

import java.lang.reflect.Array;

/// Conversion between the nested primitive arrays jhdf reads and writes, and flat row-major
/// double storage.
final class ArrayShapes {

  private ArrayShapes() {
  }

  /// @param data a boxed scalar, or a (possibly nested) primitive numeric array
  /// @param size the number of elements expected
  /// @return the elements in row-major order
  static double[] flatten(Object data, int size) {
    double[] flat = new double[size];
    int filled = fill(data, flat, 0);
    if (filled != size) {
      throw new DatasetException("expected " + size + " values but read " + filled);
    }
    return flat;
  }

  private static int fill(Object data, double[] flat, int offset) {
    if (data instanceof Number number) {
      flat[offset] = number.doubleValue();
      return offset + 1;
    }
    if (data == null || !data.getClass().isArray()) {
      throw new DatasetException("not a numeric array: " + data);
    }
    Class<?> component = data.getClass().getComponentType();
    int length = Array.getLength(data);
    if (component.isArray()) {
      for (int i = 0; i < length; i++) {
        offset = fill(Array.get(data, i), flat, offset);
      }
      return offset;
    }
    if (component == double.class) {
      System.arraycopy((double[]) data, 0, flat, offset, length);
      return offset + length;
    }
    for (int i = 0; i < length; i++) {
      flat[offset + i] = ((Number) Array.get(data, i)).doubleValue();
    }
    return offset + length;
  }

  /// @param values flat row-major values
  /// @param shape the extent of each axis; empty for a scalar
  /// @param dataType the element type of the result
  /// @return a boxed scalar, or a nested primitive array of the given shape
  static Object unflatten(double[] values, int[] shape, DataType dataType) {
    if (shape.length == 0) {
      return dataType.box(values[0]);
    }
    Object array = Array.newInstance(dataType.javaType(), shape);
    int filled = store(array, shape, 0, values, 0, dataType);
    if (filled != values.length) {
      throw new DatasetException("shape does not cover " + values.length + " values");
    }
    return array;
  }

  private static int store(Object array, int[] shape, int axis, double[] values, int offset, DataType dataType) {
    if (axis == shape.length - 1) {
      for (int i = 0; i < shape[axis]; i++) {
        dataType.store(array, i, values[offset + i]);
      }
      return offset + shape[axis];
    }
    for (int i = 0; i < shape[axis]; i++) {
      offset = store(Array.get(array, i), shape, axis + 1, values, offset, dataType);
    }
    return offset;
  }
}
