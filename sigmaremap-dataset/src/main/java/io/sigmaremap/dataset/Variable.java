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


import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A named n-dimensional array in a [LabeledDataset], indexed by an ordered list of the
/// dataset's dimension names and described by an ordered attribute map.
///
/// Values are held in row-major order as the raw stored numbers, i.e. still packed when the
/// variable declares `scale_factor` or `add_offset`. Use [#getUnpacked()] and
/// [#setUnpacked(double\[\])] to work in physical values.
///
/// A variable whose name equals one of its own dimension names is a coordinate variable.
public class Variable {

  private final LabeledDataset dataset;
  private final String name;
  private final DataType dataType;
  private final List<String> dimensions;
  private final Map<String, Object> attributes = new LinkedHashMap<>();
  private double[] values;

  Variable(LabeledDataset dataset, String name, DataType dataType, List<String> dimensions) {
    this.dataset = dataset;
    this.name = name;
    this.dataType = dataType;
    this.dimensions = List.copyOf(dimensions);
    this.values = new double[computeSize()];
  }

  public String getName() {
    return name;
  }

  public DataType getDataType() {
    return dataType;
  }

  /// @return the dimension names this variable is indexed by, outermost first
  public List<String> getDimensions() {
    return dimensions;
  }

  public LabeledDataset getDataset() {
    return dataset;
  }

  public boolean isCoordinate() {
    return dimensions.contains(name);
  }

  /// @return the current extent of each dimension, in dimension order
  public int[] shape() {
    int[] shape = new int[dimensions.size()];
    for (int i = 0; i < shape.length; i++) {
      shape[i] = dataset.getDimension(dimensions.get(i)).size();
    }
    return shape;
  }

  public int size() {
    return values.length;
  }

  private int computeSize() {
    long size = 1;
    for (int extent : shape()) {
      size *= extent;
    }
    if (size > Integer.MAX_VALUE) {
      throw new DatasetException("variable " + name + " is too large to hold in memory: " + size);
    }
    return (int) size;
  }

  /// Called by the dataset after an unlimited dimension grew.
  void resize() {
    int size = computeSize();
    if (size != values.length) {
      values = Arrays.copyOf(values, size);
    }
  }

  //
  // attributes
  //

  /// @return a read-only view of the attributes, in definition order
  public Map<String, Object> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public Set<String> attributeNames() {
    return Collections.unmodifiableSet(attributes.keySet());
  }

  public boolean hasAttribute(String attr) {
    return attributes.containsKey(attr);
  }

  public Object getAttribute(String attr) {
    return attributes.get(attr);
  }

  public Optional<String> getStringAttribute(String attr) {
    return Attributes.getString(attributes, attr);
  }

  public Optional<Double> getDoubleAttribute(String attr) {
    return Attributes.getDouble(attributes, attr);
  }

  /// @return the `units` attribute, if present
  public Optional<String> getUnits() {
    return getStringAttribute(Attributes.UNITS);
  }

  public Variable setAttribute(String attr, Object value) {
    dataset.checkWritable();
    if (value == null) {
      throw new DatasetException("attribute " + attr + " of " + name + " cannot be null");
    }
    attributes.put(attr, value);
    return this;
  }

  public Variable setAttributes(Map<String, ?> attrs) {
    attrs.forEach(this::setAttribute);
    return this;
  }

  public void removeAttribute(String attr) {
    dataset.checkWritable();
    attributes.remove(attr);
  }

  //
  // values
  //

  /// @return a copy of the raw stored values, row-major
  public double[] getValues() {
    return values.clone();
  }

  /// Replace all raw values. The values are narrowed to the variable's type.
  /// @param newValues row-major values, one per element
  public void setValues(double[] newValues) {
    dataset.checkWritable();
    if (newValues.length != values.length) {
      throw new DatasetException(String.format(
          "variable %s holds %d values, cannot assign %d", name, values.length, newValues.length));
    }
    for (int i = 0; i < newValues.length; i++) {
      values[i] = dataType.narrow(newValues[i]);
    }
  }

  public double get(int index) {
    return values[index];
  }

  /// Set one raw value. Writes to distinct indices may come from different threads.
  public void set(int index, double value) {
    dataset.checkWritable();
    values[index] = dataType.narrow(value);
  }

  /// @return the packing parameters currently declared by this variable's attributes
  public Packing getPacking() {
    return new Packing(
        dataType,
        getDoubleAttribute(Attributes.SCALE_FACTOR).orElse(1.0d),
        getDoubleAttribute(Attributes.ADD_OFFSET).orElse(0.0d),
        getDoubleAttribute(Attributes.FILL_VALUE).orElse(null),
        getDoubleAttribute(Attributes.MISSING_VALUE).orElse(null)
    );
  }

  /// Read values in physical units: `raw * scale_factor + add_offset`, with fill and missing
  /// values replaced by NaN.
  /// @return the unpacked values, row-major
  public double[] getUnpacked() {
    Packing packing = getPacking();
    double[] unpacked = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      unpacked[i] = packing.unpack(values[i]);
    }
    return unpacked;
  }

  /// Write values given in physical units, packing them with the variable's `scale_factor`
  /// and `add_offset`. NaN is stored as the fill value.
  /// @param physical row-major values, one per element
  public void setUnpacked(double[] physical) {
    Packing packing = getPacking();
    double[] packed = new double[physical.length];
    for (int i = 0; i < physical.length; i++) {
      packed[i] = packing.pack(physical[i]);
    }
    setValues(packed);
  }

  /// The transform between raw stored values and physical values.
  /// @param dataType the storage type
  /// @param scale the `scale_factor`, 1 when absent
  /// @param offset the `add_offset`, 0 when absent
  /// @param fill the `_FillValue`, or null
  /// @param missing the `missing_value`, or null
  public record Packing(DataType dataType, double scale, double offset, Double fill, Double missing) {

    /// Without a declared `_FillValue`, the type's default fill marks missing values.
    public double unpack(double raw) {
      double effectiveFill = fill != null ? fill : dataType.defaultFill();
      if (raw == effectiveFill || (missing != null && raw == missing)) {
        return Double.NaN;
      }
      return raw * scale + offset;
    }

    public double pack(double physical) {
      if (Double.isNaN(physical)) {
        return fill != null ? fill : dataType.defaultFill();
      }
      double raw = (physical - offset) / scale;
      return dataType.isIntegral() ? Math.rint(raw) : raw;
    }
  }

  @Override
  public String toString() {
    return dataType.name().toLowerCase() + " " + name + "(" + String.join(",", dimensions) + ")";
  }
}
