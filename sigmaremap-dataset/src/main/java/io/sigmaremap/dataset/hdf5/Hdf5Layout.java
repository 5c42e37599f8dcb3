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


import java.util.Set;

/// Attribute names used to keep the labeled structure of a dataset in an HDF5 file, and the
/// names of attributes the netCDF-4 library and the HDF5 dimension scale API add.
final class Hdf5Layout {

  /// per variable: comma separated dimension names
  static final String DIMENSIONS = "_dimensions";
  /// root: comma separated dimension names, in declaration order
  static final String DIMENSION_NAMES = "_dimension_names";
  /// root: dimension sizes, parallel to [#DIMENSION_NAMES]
  static final String DIMENSION_SIZES = "_dimension_sizes";
  /// root: comma separated names of unlimited dimensions
  static final String UNLIMITED = "_unlimited_dimensions";
  /// root: comma separated variable names, in declaration order
  static final String VARIABLE_ORDER = "_variable_order";

  static final String SEPARATOR = ",";

  static final String CLASS = "CLASS";
  static final String DIMENSION_SCALE = "DIMENSION_SCALE";
  static final String NAME = "NAME";
  /// the NAME the netCDF-4 library gives dimension scales which are not variables
  static final String PHONY_DIMENSION_PREFIX = "This is a netCDF dimension but not a netCDF variable";

  /// per variable: references to the dimension scale of each axis
  static final String DIMENSION_LIST = "DIMENSION_LIST";
  /// per dimension scale: the netCDF dimension id
  static final String NETCDF4_DIMID = "_Netcdf4Dimid";
  /// per variable: the netCDF dimension id of each axis
  static final String NETCDF4_COORDINATES = "_Netcdf4Coordinates";

  static final Set<String> RESERVED = Set.of(
      DIMENSIONS, CLASS, NAME, DIMENSION_LIST, "REFERENCE_LIST",
      NETCDF4_DIMID, NETCDF4_COORDINATES, "_nc3_strict", "_NCProperties"
  );

  private Hdf5Layout() {
  }
}
