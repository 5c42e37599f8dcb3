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
import io.jhdf.WritableHdfFile;
import io.jhdf.api.WritableDataset;
import io.sigmaremap.dataset.DatasetException;
import io.sigmaremap.dataset.Dimension;
import io.sigmaremap.dataset.LabeledDataset;
import io.sigmaremap.dataset.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// Render a [LabeledDataset] into a new HDF5 file.
final class Hdf5DatasetWriter {
  private static final Logger logger = LogManager.getLogger(Hdf5DatasetWriter.class);

  private Hdf5DatasetWriter() {
  }

  static void write(LabeledDataset dataset, Path path) {
    List<Dimension> dimensions = dataset.getDimensions();
    List<Variable> variables = dataset.getVariables();
    try (WritableHdfFile out = HdfFile.write(path)) {
      if (!dimensions.isEmpty()) {
        out.putAttribute(Hdf5Layout.DIMENSION_NAMES,
            dimensions.stream().map(Dimension::name).collect(Collectors.joining(Hdf5Layout.SEPARATOR)));
        out.putAttribute(Hdf5Layout.DIMENSION_SIZES,
            dimensions.stream().mapToInt(Dimension::size).toArray());
        String unlimited = dimensions.stream().filter(Dimension::unlimited).map(Dimension::name)
            .collect(Collectors.joining(Hdf5Layout.SEPARATOR));
        if (!unlimited.isEmpty()) {
          out.putAttribute(Hdf5Layout.UNLIMITED, unlimited);
        }
      }
      if (!variables.isEmpty()) {
        out.putAttribute(Hdf5Layout.VARIABLE_ORDER,
            variables.stream().map(Variable::getName).collect(Collectors.joining(Hdf5Layout.SEPARATOR)));
      }
      for (Variable variable : variables) {
        if (variable.size() == 0) {
          logger.warn("skipping {}: HDF5 output of empty variables is not supported", variable);
          continue;
        }
        Object data = ArrayShapes.unflatten(variable.getValues(), variable.shape(), variable.getDataType());
        WritableDataset written = out.putDataset(variable.getName(), data);
        if (!variable.getDimensions().isEmpty()) {
          written.putAttribute(Hdf5Layout.DIMENSIONS,
              String.join(Hdf5Layout.SEPARATOR, variable.getDimensions()));
        }
        for (Map.Entry<String, Object> attr : variable.getAttributes().entrySet()) {
          written.putAttribute(attr.getKey(), attr.getValue());
        }
      }
    } catch (DatasetException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DatasetException("unable to write " + path + ": " + e.getMessage(), e);
    }
    logger.debug("wrote {} variables to {}", variables.size(), path);
  }
}
