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


import io.sigmaremap.dataset.DatasetException;
import io.sigmaremap.dataset.DatasetMode;
import io.sigmaremap.dataset.LabeledDataset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/// A [LabeledDataset] stored in an HDF5 file.
///
/// jhdf writes whole files at once, so the dataset is held in memory while open:
/// - [DatasetMode#READ] loads the file and releases it immediately; the dataset is read-only.
/// - [DatasetMode#WRITE] starts empty and writes the file on [#close()].
/// - [DatasetMode#APPEND] loads the file and rewrites it on [#close()].
///
/// Files written here carry their dimension structure in attributes (see [Hdf5Layout]).
/// Files without it, such as netCDF-4 files, are read through their HDF5 dimension scales.
public class Hdf5Dataset extends LabeledDataset {
  private static final Logger logger = LogManager.getLogger(Hdf5Dataset.class);

  private final Path path;
  private final DatasetMode mode;
  private boolean discarded = false;

  private Hdf5Dataset(Path path, DatasetMode mode) {
    super(path.getFileName().toString());
    this.path = path;
    this.mode = mode;
  }

  /// Open an existing file, or start a new one in [DatasetMode#WRITE].
  /// @param path the HDF5 file
  /// @param mode how the file is used
  /// @return the open dataset
  public static Hdf5Dataset open(Path path, DatasetMode mode) {
    Hdf5Dataset dataset = new Hdf5Dataset(path, mode);
    if (mode != DatasetMode.WRITE) {
      if (!Files.isRegularFile(path)) {
        throw new DatasetException("dataset file does not exist: " + path);
      }
      Hdf5DatasetReader.read(path, dataset);
      logger.debug("loaded {} ({} dimensions, {} variables)", path,
          dataset.getDimensions().size(), dataset.getVariables().size());
    }
    dataset.setWritable(mode.isWritable());
    return dataset;
  }

  public static Hdf5Dataset openForRead(Path path) {
    return open(path, DatasetMode.READ);
  }

  public static Hdf5Dataset create(Path path) {
    return open(path, DatasetMode.WRITE);
  }

  public Path getPath() {
    return path;
  }

  public DatasetMode getMode() {
    return mode;
  }

  /// Close without writing anything, e.g. after a failure left the contents incomplete.
  public void discard() {
    discarded = true;
    close();
  }

  @Override
  protected void flush() {
    if (!mode.isWritable() || discarded) {
      return;
    }
    if (mode == DatasetMode.WRITE) {
      Hdf5DatasetWriter.write(this, path);
      return;
    }
    // the loaded file is rewritten beside the original, then swapped in
    Path staged = path.resolveSibling(path.getFileName() + ".rewrite");
    Hdf5DatasetWriter.write(this, staged);
    try {
      Files.move(staged, path, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new DatasetException("unable to replace " + path + " with " + staged, e);
    }
  }
}
