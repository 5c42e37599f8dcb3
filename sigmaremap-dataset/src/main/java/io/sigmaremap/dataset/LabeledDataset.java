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


import io.sigmaremap.units.UnitsConverter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A multidimensional labeled dataset: named [Dimension]s, and named [Variable]s indexed by
/// them, each carrying attributes.
///
/// Dimensions and variables are kept in declaration order. Every listing on this type
/// ([#getVariables()], [#dimensionVariables()], [#pressureCoordinates(UnitsConverter)] ...)
/// follows that order, and each call returns a fresh list, so that several consumers can
/// traverse independently.
///
/// The copy operations replicate a variable from another dataset together with the
/// dimensions and coordinate variables it depends on. Storage is left to subclasses, which
/// load the model when opened and persist it in [#close()].
public abstract class LabeledDataset implements AutoCloseable {
  private static final Logger logger = LogManager.getLogger(LabeledDataset.class);

  private static final Set<String> VERTICAL_SENSES = Set.of("up", "down");

  private final String name;
  private final Map<String, Dimension> dimensions = new LinkedHashMap<>();
  private final Map<String, Variable> variables = new LinkedHashMap<>();
  private boolean writable = true;
  private boolean closed = false;

  protected LabeledDataset(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /// Called once a subclass has finished loading a read-only dataset.
  protected void setWritable(boolean writable) {
    this.writable = writable;
  }

  public boolean isWritable() {
    return writable && !closed;
  }

  void checkWritable() {
    if (closed) {
      throw new DatasetException("dataset " + name + " is closed");
    }
    if (!writable) {
      throw new DatasetException("dataset " + name + " is open read-only");
    }
  }

  //
  // dimensions
  //

  /// @return the dimensions, in declaration order
  public List<Dimension> getDimensions() {
    return new ArrayList<>(dimensions.values());
  }

  public Optional<Dimension> findDimension(String dimension) {
    return Optional.ofNullable(dimensions.get(dimension));
  }

  public Dimension getDimension(String dimension) {
    Dimension found = dimensions.get(dimension);
    if (found == null) {
      throw new DatasetException("dataset " + name + " has no dimension '" + dimension + "'");
    }
    return found;
  }

  public boolean hasDimension(String dimension) {
    return dimensions.containsKey(dimension);
  }

  public Dimension createDimension(String dimension, int size) {
    return addDimension(new Dimension(dimension, size, false));
  }

  /// Create a dimension which can grow with [#growDimension(String, int)].
  public Dimension createUnlimitedDimension(String dimension, int initialSize) {
    return addDimension(new Dimension(dimension, initialSize, true));
  }

  private Dimension addDimension(Dimension dimension) {
    checkWritable();
    if (dimensions.containsKey(dimension.name())) {
      throw new DatasetException(
          "dataset " + name + " already has a dimension '" + dimension.name() + "'");
    }
    dimensions.put(dimension.name(), dimension);
    return dimension;
  }

  /// The outcome of [#getOrCreateDimension(String, int, boolean)].
  public enum DimensionStatus {
    CREATED,
    EXISTING,
    CONFLICT
  }

  /// @param dimension the dimension found or created
  /// @param status whether it was created, already present with the requested size, or
  ///     present with a different size (in which case it is left unchanged)
  public record DimensionLookup(Dimension dimension, DimensionStatus status) {
  }

  /// Look up a dimension by name and create it only if absent. An existing dimension of a
  /// different size is reported as a conflict rather than changed.
  /// @param dimension the dimension name
  /// @param size the required size
  /// @param unlimited whether a newly created dimension may grow
  /// @return the dimension, with how it was obtained
  public DimensionLookup getOrCreateDimension(String dimension, int size, boolean unlimited) {
    Dimension existing = dimensions.get(dimension);
    if (existing == null) {
      return new DimensionLookup(
          addDimension(new Dimension(dimension, size, unlimited)), DimensionStatus.CREATED);
    }
    if (existing.size() == size) {
      return new DimensionLookup(existing, DimensionStatus.EXISTING);
    }
    return new DimensionLookup(existing, DimensionStatus.CONFLICT);
  }

  /// Extend an unlimited dimension, growing every variable which depends on it. The
  /// dimension must be the outermost dimension of each such variable.
  /// @param dimension an unlimited dimension
  /// @param size the new size, at least the current size
  public Dimension growDimension(String dimension, int size) {
    checkWritable();
    Dimension existing = getDimension(dimension);
    if (!existing.unlimited()) {
      throw new DatasetException("dimension '" + dimension + "' is not unlimited");
    }
    if (size < existing.size()) {
      throw new DatasetException("dimension '" + dimension + "' cannot shrink from "
                                 + existing.size() + " to " + size);
    }
    for (Variable variable : variables.values()) {
      int axis = variable.getDimensions().indexOf(dimension);
      if (axis > 0) {
        throw new DatasetException("variable " + variable.getName() + " uses unlimited dimension '"
                                   + dimension + "' as an inner axis");
      }
    }
    Dimension grown = existing.withSize(size);
    dimensions.put(dimension, grown);
    for (Variable variable : variables.values()) {
      if (variable.getDimensions().contains(dimension)) {
        variable.resize();
      }
    }
    return grown;
  }

  //
  // variables
  //

  /// @return the variables, in declaration order
  public List<Variable> getVariables() {
    return new ArrayList<>(variables.values());
  }

  public Collection<String> variableNames() {
    return Collections.unmodifiableCollection(new ArrayList<>(variables.keySet()));
  }

  public Optional<Variable> findVariable(String variable) {
    return Optional.ofNullable(variables.get(variable));
  }

  public Variable getVariable(String variable) {
    Variable found = variables.get(variable);
    if (found == null) {
      throw new DatasetException("dataset " + name + " has no variable '" + variable + "'");
    }
    return found;
  }

  public boolean hasVariable(String variable) {
    return variables.containsKey(variable);
  }

  /// Create a dimension and its coordinate variable.
  /// @param coordinate the dimension and variable name
  /// @param length the dimension size
  /// @param dataType the variable type
  /// @param attrs attributes for the variable, may be null
  /// @return the new coordinate variable
  public Variable createCoordinate(String coordinate, int length, DataType dataType, Map<String, ?> attrs) {
    createDimension(coordinate, length);
    return createVariable(coordinate, dataType, List.of(coordinate), attrs);
  }

  public Variable createCoordinate(String coordinate, int length, DataType dataType) {
    return createCoordinate(coordinate, length, dataType, null);
  }

  /// Create a variable over existing dimensions.
  /// @param variable the variable name
  /// @param dataType the storage type
  /// @param dimensionNames the dimensions, outermost first; each must already exist
  /// @param attrs attributes for the variable, may be null
  /// @return the new variable, filled with zeros
  public Variable createVariable(String variable, DataType dataType, List<String> dimensionNames, Map<String, ?> attrs) {
    checkWritable();
    if (variables.containsKey(variable)) {
      throw new DatasetException("dataset " + name + " already has a variable '" + variable + "'");
    }
    for (String dimension : dimensionNames) {
      if (!dimensions.containsKey(dimension)) {
        throw new DatasetException(
            "cannot create " + variable + ": dataset " + name + " has no dimension '" + dimension + "'");
      }
    }
    Variable created = new Variable(this, variable, dataType, dimensionNames);
    variables.put(variable, created);
    if (attrs != null) {
      created.setAttributes(attrs);
    }
    return created;
  }

  public Variable createVariable(String variable, DataType dataType, List<String> dimensionNames) {
    return createVariable(variable, dataType, dimensionNames, null);
  }

  //
  // copying from other datasets
  //

  /// Copy one attribute from a variable of another dataset onto the variable of the same
  /// name in this dataset.
  public void copyAttribute(Variable source, String attr) {
    if (!source.hasAttribute(attr)) {
      throw new DatasetException("variable " + source.getName() + " has no attribute '" + attr + "'");
    }
    getVariable(source.getName()).setAttribute(attr, source.getAttribute(attr));
  }

  /// Create a dimension matching one from another dataset. Copying a dimension which is
  /// already present with the same size does nothing.
  /// @throws DimensionConflictException if it is present with a different size
  public Dimension copyDimension(Dimension source) {
    DimensionLookup lookup = getOrCreateDimension(source.name(), source.size(), source.unlimited());
    if (lookup.status() == DimensionStatus.CONFLICT) {
      throw new DimensionConflictException(source.name(), lookup.dimension().size(), source.size());
    }
    return lookup.dimension();
  }

  /// Make sure a dimension of another dataset, and its coordinate variable if it has one,
  /// exist in this dataset.
  /// @param source the dimension to replicate
  /// @param sourceDataset the dataset the dimension belongs to
  public void ensureDimension(Dimension source, LabeledDataset sourceDataset) {
    DimensionLookup lookup = getOrCreateDimension(source.name(), source.size(), source.unlimited());
    switch (lookup.status()) {
      case CONFLICT:
        throw new DimensionConflictException(source.name(), lookup.dimension().size(), source.size());
      case CREATED:
        Optional<Variable> coordinate = sourceDataset.findVariable(source.name())
            .filter(v -> v.getDimensions().contains(source.name()));
        if (coordinate.isPresent() && !hasVariable(source.name())) {
          copyVariable(coordinate.get(), sourceDataset);
        }
        break;
      default:
        logger.trace("dimension {} already present in {}", source.name(), name);
    }
  }

  /// Replicate a variable's definition from another dataset: its dimensions (with their
  /// coordinate variables, recursively), its type, and all of its attributes. No values are
  /// copied.
  /// @param source the variable to replicate
  /// @param sourceDataset the dataset it belongs to
  /// @return the new, zero-filled variable in this dataset
  public Variable copyVariableMetadata(Variable source, LabeledDataset sourceDataset) {
    for (String dimensionName : source.getDimensions()) {
      Dimension dimension = sourceDataset.getDimension(dimensionName);
      if (dimensionName.equals(source.getName())) {
        copyDimension(dimension);
      } else {
        ensureDimension(dimension, sourceDataset);
      }
    }
    Variable created = createVariable(source.getName(), source.getDataType(), source.getDimensions());
    if (source.hasAttribute(Attributes.FILL_VALUE)) {
      created.setAttribute(Attributes.FILL_VALUE, source.getAttribute(Attributes.FILL_VALUE));
    }
    for (String attr : source.attributeNames()) {
      if (!attr.equals(Attributes.FILL_VALUE)) {
        copyAttribute(source, attr);
      }
    }
    return created;
  }

  /// Copy all values of a variable from another dataset into the like-named variable here.
  public void copyVariableData(Variable source) {
    Variable target = getVariable(source.getName());
    if (target.size() != source.size()) {
      throw new DatasetException(String.format(
          "cannot copy %d values of %s into %d slots", source.size(), source.getName(), target.size()));
    }
    target.setValues(source.getValues());
  }

  /// Replicate a variable, with its values, its dimensions and their coordinate variables.
  public Variable copyVariable(Variable source, LabeledDataset sourceDataset) {
    Variable created = copyVariableMetadata(source, sourceDataset);
    copyVariableData(source);
    logger.debug("copied {} from {} to {}", source, sourceDataset.getName(), name);
    return created;
  }

  //
  // coordinate classification
  //

  /// @return the coordinate variable of each dimension which has one, in dimension order
  public List<Variable> dimensionVariables() {
    List<Variable> coordinates = new ArrayList<>();
    for (String dimension : dimensions.keySet()) {
      Variable variable = variables.get(dimension);
      if (variable != null && variable.isCoordinate()) {
        coordinates.add(variable);
      }
    }
    return coordinates;
  }

  /// @param variable a variable of this dataset
  /// @param converter the units registry to classify with
  /// @return true if the variable's `units` are a pressure unit
  public boolean isPressureCoordinate(Variable variable, UnitsConverter converter) {
    return converter.isPressure(variable.getUnits().orElse(null));
  }

  /// @return the coordinate variables whose units are pressure units
  public List<Variable> pressureCoordinates(UnitsConverter converter) {
    List<Variable> pressure = new ArrayList<>();
    for (Variable variable : dimensionVariables()) {
      if (isPressureCoordinate(variable, converter)) {
        pressure.add(variable);
      }
    }
    return pressure;
  }

  /// Vertical coordinates are pressure coordinates, and coordinate variables with
  /// `positive` of `up` or `down` (any case), or with `axis` of `Z`. Each appears once.
  /// @return the vertical coordinate variables
  public List<Variable> verticalCoordinates(UnitsConverter converter) {
    Set<Variable> vertical = new LinkedHashSet<>();
    for (Variable variable : dimensionVariables()) {
      if (isPressureCoordinate(variable, converter)) {
        vertical.add(variable);
      }
      Optional<String> positive = variable.getStringAttribute(Attributes.POSITIVE);
      if (positive.isPresent() && VERTICAL_SENSES.contains(positive.get().toLowerCase(Locale.ROOT))) {
        vertical.add(variable);
      }
      if (variable.getStringAttribute(Attributes.AXIS).filter("Z"::equals).isPresent()) {
        vertical.add(variable);
      }
    }
    return new ArrayList<>(vertical);
  }

  //
  // lifecycle
  //

  public boolean isClosed() {
    return closed;
  }

  /// Persist the dataset, if the backing store needs it.
  protected abstract void flush();

  /// Persist any changes and release the dataset. Closing twice does nothing.
  @Override
  public void close() {
    if (closed) {
      return;
    }
    try {
      flush();
    } finally {
      closed = true;
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + ", dimensions=" + dimensions.keySet()
           + ", variables=" + variables.keySet() + "]";
  }
}
