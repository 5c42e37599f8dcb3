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


/// How a persistent dataset is opened.
public enum DatasetMode {
  /// structure and values are loaded; nothing is written back
  READ,
  /// starts empty and is written on close, replacing any existing file
  WRITE,
  /// loaded like READ, and written back on close
  APPEND;

  public boolean isWritable() {
    return this != READ;
  }
}
