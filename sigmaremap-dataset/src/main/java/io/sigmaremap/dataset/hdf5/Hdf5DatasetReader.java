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


import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Node;
import io.sigmaremap.dataset.Attributes;
import io.sigmaremap.dataset.DataType;
import io.sigmaremap.dataset.DatasetException;
import io.sigmaremap.dataset.LabeledDataset;
import io.sigmaremap.dataset.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Load the structure and values of an HDF5 file into a [LabeledDataset].
final class Hdf5DatasetReader {
  private static final Logger logger = LogManager.getLogger(Hdf5DatasetReader.class);

  private Hdf5DatasetReader() {
  }

  static void read(Path path, LabeledDataset target) {
    try (HdfFile file = new HdfFile(path)) {
      Map<String, Attribute> rootAttributes = file.getAttributes();
      Map<String, Dataset> datasets = datasets(file);
      if (rootAttributes.containsKey(Hdf5Layout.DIMENSION_NAMES)
          || rootAttributes.containsKey(Hdf5Layout.VARIABLE_ORDER)) {
        readLabeled(rootAttributes, datasets, target);
      } else {
        readDimensionScales(datasets, target);
      }
    } catch (DatasetException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DatasetException("unable to read " + path + ": " + e.getMessage(), e);
    }
  }

  private static Map<String, Dataset> datasets(HdfFile file) {
    Map<String, Dataset> datasets = new LinkedHashMap<>();
    for (Map.Entry<String, Node> child : file.getChildren().entrySet()) {
      if (child.getValue() instanceof Dataset dataset) {
        datasets.put(child.getKey(), dataset);
      } else {
        logger.debug("ignoring non-dataset node {}", child.getKey());
      }
    }
    return datasets;
  }

  /// Files written by [Hdf5DatasetWriter] list their dimensions and variables explicitly.
  private static void readLabeled(Map<String, Attribute> root, Map<String, Dataset> datasets, LabeledDataset target) {
    List<String> names = split(stringAttribute(root, Hdf5Layout.DIMENSION_NAMES));
    int[] sizes = intArray(root.containsKey(Hdf5Layout.DIMENSION_SIZES)
                           ? root.get(Hdf5Layout.DIMENSION_SIZES).getData() : new int[0]);
    if (sizes.length != names.size()) {
      throw new DatasetException("dimension names " + names + " do not match sizes " + Arrays.toString(sizes));
    }
    Set<String> unlimited = new HashSet<>(split(stringAttribute(root, Hdf5Layout.UNLIMITED)));
    for (int i = 0; i < sizes.length; i++) {
      if (unlimited.contains(names.get(i))) {
        target.createUnlimitedDimension(names.get(i), sizes[i]);
      } else {
        target.createDimension(names.get(i), sizes[i]);
      }
    }

    List<String> order = split(stringAttribute(root, Hdf5Layout.VARIABLE_ORDER));
    for (String name : datasets.keySet()) {
      if (!order.contains(name)) {
        order.add(name);
      }
    }
    for (String name : order) {
      Dataset dataset = datasets.get(name);
      if (dataset == null) {
        logger.warn("variable {} is listed but not stored; skipping it", name);
        continue;
      }
      List<String> dims = split(stringAttribute(dataset.getAttributes(), Hdf5Layout.DIMENSIONS));
      loadVariable(name, dataset, dims, target);
    }
  }

  /// netCDF-4 files mark each dimension with an HDF5 dimension scale. A variable's axes are
  /// resolved from its `_Netcdf4Coordinates` dimension ids, then from its `DIMENSION_LIST`
  /// references, and only then by size, which must be unambiguous.
  private static void readDimensionScales(Map<String, Dataset> datasets, LabeledDataset target) {
    List<String> scaleNames = new ArrayList<>();
    Map<Integer, String> scalesById = new HashMap<>();
    Map<Long, String> scalesByAddress = new HashMap<>();
    Set<String> phony = new HashSet<>();
    for (Map.Entry<String, Dataset> entry : datasets.entrySet()) {
      Dataset dataset = entry.getValue();
      Map<String, Attribute> attrs = dataset.getAttributes();
      if (!Hdf5Layout.DIMENSION_SCALE.equals(stringAttribute(attrs, Hdf5Layout.CLASS))) {
        continue;
      }
      int size = dataset.getDimensions().length == 0 ? 1 : dataset.getDimensions()[0];
      long[] maxSize = dataset.getMaxSize();
      boolean unlimited = maxSize != null && maxSize.length > 0 && maxSize[0] < 0;
      if (unlimited) {
        target.createUnlimitedDimension(entry.getKey(), size);
      } else {
        target.createDimension(entry.getKey(), size);
      }
      scaleNames.add(entry.getKey());
      scalesByAddress.put(dataset.getAddress(), entry.getKey());
      Attribute dimid = attrs.get(Hdf5Layout.NETCDF4_DIMID);
      if (dimid != null) {
        int[] ids = intArray(dimid.getData());
        if (ids.length == 1) {
          scalesById.put(ids[0], entry.getKey());
        }
      }
      String label = stringAttribute(attrs, Hdf5Layout.NAME);
      if (label != null && label.startsWith(Hdf5Layout.PHONY_DIMENSION_PREFIX)) {
        phony.add(entry.getKey());
      }
    }

    for (Map.Entry<String, Dataset> entry : datasets.entrySet()) {
      String name = entry.getKey();
      if (phony.contains(name)) {
        continue;
      }
      Dataset dataset = entry.getValue();
      int[] extents = dataset.isScalar() ? new int[0] : dataset.getDimensions();
      List<String> dims;
      if (scaleNames.contains(name) && extents.length <= 1) {
        dims = List.of(name);
      } else {
        dims = byDimensionIds(dataset, extents, scalesById, target);
        if (dims == null) {
          dims = byReferences(name, dataset, extents, scalesByAddress, target);
        }
        if (dims == null) {
          dims = bySize(name, extents, scaleNames, target);
        }
      }
      loadVariable(name, dataset, dims, target);
    }
  }

  private static List<String> byDimensionIds(Dataset dataset, int[] extents, Map<Integer, String> scalesById,
                                             LabeledDataset target) {
    Attribute coordinates = dataset.getAttributes().get(Hdf5Layout.NETCDF4_COORDINATES);
    if (coordinates == null || scalesById.isEmpty()) {
      return null;
    }
    int[] ids = intArray(coordinates.getData());
    List<String> dims = new ArrayList<>();
    for (int id : ids) {
      dims.add(scalesById.get(id));
    }
    return consistent(dims, extents, target) ? dims : null;
  }

  private static List<String> byReferences(String name, Dataset dataset, int[] extents,
                                           Map<Long, String> scalesByAddress, LabeledDataset target) {
    Attribute dimensionList = dataset.getAttributes().get(Hdf5Layout.DIMENSION_LIST);
    if (dimensionList == null) {
      return null;
    }
    List<Long> addresses = new ArrayList<>();
    try {
      collectAddresses(dimensionList.getData(), addresses);
    } catch (RuntimeException e) {
      logger.debug("unable to resolve the dimension references of {}: {}", name, e.getMessage());
      return null;
    }
    List<String> dims = new ArrayList<>();
    for (Long address : addresses) {
      dims.add(scalesByAddress.get(address));
    }
    return consistent(dims, extents, target) ? dims : null;
  }

  private static void collectAddresses(Object data, List<Long> addresses) {
    if (data == null) {
      return;
    }
    if (data instanceof Number number) {
      addresses.add(number.longValue());
    } else if (data.getClass().isArray()) {
      for (int i = 0; i < Array.getLength(data); i++) {
        collectAddresses(Array.get(data, i), addresses);
      }
    }
  }

  /// @return true if every axis resolved to a distinct dimension of the axis' size
  private static boolean consistent(List<String> dims, int[] extents, LabeledDataset target) {
    if (dims.size() != extents.length || dims.contains(null) || new HashSet<>(dims).size() != dims.size()) {
      return false;
    }
    for (int axis = 0; axis < extents.length; axis++) {
      if (target.getDimension(dims.get(axis)).size() != extents[axis]) {
        return false;
      }
    }
    return true;
  }

  private static List<String> bySize(String name, int[] extents, List<String> scaleNames, LabeledDataset target) {
    List<String> dims = new ArrayList<>();
    for (int extent : extents) {
      List<String> candidates = new ArrayList<>();
      for (String scale : scaleNames) {
        if (!dims.contains(scale) && target.getDimension(scale).size() == extent) {
          candidates.add(scale);
        }
      }
      if (candidates.isEmpty()) {
        throw new DatasetException("no dimension of size " + extent + " for an axis of " + name);
      }
      if (candidates.size() > 1) {
        throw new DatasetException("axis " + dims.size() + " of " + name + " could be any of " + candidates
                                   + "; the file does not say which");
      }
      dims.add(candidates.get(0));
    }
    return dims;
  }

  private static void loadVariable(String name, Dataset dataset, List<String> dims, LabeledDataset target) {
    Class<?> javaType = dataset.getJavaType();
    if (javaType == null || !(javaType.isPrimitive() || Number.class.isAssignableFrom(javaType))) {
      logger.warn("skipping {}: values of type {} are not numeric", name, javaType);
      return;
    }
    Variable variable = target.createVariable(name, DataType.fromJavaType(javaType), dims);
    for (Map.Entry<String, Attribute> attr : dataset.getAttributes().entrySet()) {
      if (Hdf5Layout.RESERVED.contains(attr.getKey())) {
        continue;
      }
      Object value = attr.getValue().getData();
      if (value == null) {
        continue;
      }
      variable.setAttribute(attr.getKey(), Attributes.unwrap(value));
    }
    if (variable.size() > 0) {
      variable.setValues(ArrayShapes.flatten(dataset.getData(), variable.size()));
    }
  }

  private static String stringAttribute(Map<String, Attribute> attrs, String name) {
    Attribute attribute = attrs.get(name);
    if (attribute == null) {
      return null;
    }
    Object value = Attributes.unwrap(attribute.getData());
    return value == null ? null : value.toString();
  }

  private static List<String> split(String joined) {
    List<String> parts = new ArrayList<>();
    if (joined == null || joined.isEmpty()) {
      return parts;
    }
    for (String part : joined.split(Hdf5Layout.SEPARATOR)) {
      if (!part.isEmpty()) {
        parts.add(part);
      }
    }
    return parts;
  }

  private static int[] intArray(Object data) {
    if (data instanceof Number number) {
      return new int[] {number.intValue()};
    }
    int[] values = new int[Array.getLength(data)];
    for (int i = 0; i < values.length; i++) {
      values[i] = ((Number) Array.get(data, i)).intValue();
    }
    return values;
  }
}
