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


/// A [LabeledDataset] with no persistent storage, for staging and tests.
public class MemoryDataset extends LabeledDataset {

  public MemoryDataset(String name) {
    super(name);
  }

  /// Make the dataset read-only, as a persistent dataset opened for reading would be.
  public MemoryDataset freeze() {
    setWritable(false);
    return this;
  }

  @Override
  protected void flush() {
  }
}
