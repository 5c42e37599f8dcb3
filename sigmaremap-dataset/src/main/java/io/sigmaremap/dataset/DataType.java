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

/// The numeric storage types a [Variable] can hold. Values are kept as doubles in memory
/// and converted to the declared type when persisted.
public enum DataType {
  BYTE(byte.class, -127d),
  SHORT(short.class, -32767d),
  INT(int.class, -2147483647d),
  LONG(long.class, -9223372036854775806d),
  FLOAT(float.class, 9.9692099683868690e+36f),
  DOUBLE(double.class, 9.9692099683868690e+36d);

  private final Class<?> javaType;
  private final double defaultFill;

  DataType(Class<?> javaType, double defaultFill) {
    this.javaType = javaType;
    this.defaultFill = defaultFill;
  }

  public Class<?> javaType() {
    return javaType;
  }

  /// @return the fill value used when a variable declares none, matching the netCDF defaults
  public double defaultFill() {
    return defaultFill;
  }

  public boolean isIntegral() {
    return this != FLOAT && this != DOUBLE;
  }

  /// Narrow a value to what this type can represent.
  /// @param value a value in memory
  /// @return the value as it would read back after storage
  public double narrow(double value) {
    switch (this) {
      case BYTE:
        return (byte) value;
      case SHORT:
        return (short) value;
      case INT:
        return (int) value;
      case LONG:
        return (long) value;
      case FLOAT:
        return (float) value;
      default:
        return value;
    }
  }

  /// Store a value into a primitive array of this type.
  /// @param array a one-dimensional primitive array of [#javaType()]
  /// @param index the element index
  /// @param value the value to narrow and store
  public void store(Object array, int index, double value) {
    switch (this) {
      case BYTE:
        Array.setByte(array, index, (byte) value);
        break;
      case SHORT:
        Array.setShort(array, index, (short) value);
        break;
      case INT:
        Array.setInt(array, index, (int) value);
        break;
      case LONG:
        Array.setLong(array, index, (long) value);
        break;
      case FLOAT:
        Array.setFloat(array, index, (float) value);
        break;
      default:
        Array.setDouble(array, index, value);
    }
  }

  /// Box a value as this type's wrapper, for scalar storage.
  public Number box(double value) {
    switch (this) {
      case BYTE:
        return (byte) value;
      case SHORT:
        return (short) value;
      case INT:
        return (int) value;
      case LONG:
        return (long) value;
      case FLOAT:
        return (float) value;
      default:
        return value;
    }
  }

  /// @param type a primitive or boxed numeric class
  /// @return the matching data type
  /// @throws DatasetException if the class is not numeric
  public static DataType fromJavaType(Class<?> type) {
    if (type == byte.class || type == Byte.class) {
      return BYTE;
    } else if (type == short.class || type == Short.class) {
      return SHORT;
    } else if (type == int.class || type == Integer.class) {
      return INT;
    } else if (type == long.class || type == Long.class) {
      return LONG;
    } else if (type == float.class || type == Float.class) {
      return FLOAT;
    } else if (type == double.class || type == Double.class) {
      return DOUBLE;
    }
    throw new DatasetException("unsupported variable type: " + type.getName());
  }
}
