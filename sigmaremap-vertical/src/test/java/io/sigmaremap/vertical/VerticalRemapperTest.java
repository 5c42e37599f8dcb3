package io.sigmaremap.vertical;

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


import io.sigmaremap.dataset.Attributes;
import io.sigmaremap.dataset.DataType;
import io.sigmaremap.dataset.DatasetException;
import io.sigmaremap.dataset.Dimension;
import io.sigmaremap.dataset.LabeledDataset;
import io.sigmaremap.dataset.MemoryDataset;
import io.sigmaremap.dataset.Variable;
import io.sigmaremap.dataset.hdf5.Hdf5Dataset;
import io.sigmaremap.units.UnitTable;
import io.sigmaremap.units.UnitsConverter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("VerticalRemapper")
class VerticalRemapperTest {

  private static final double[] LEVELS = {100, 500, 900};
  private static final double[] SURFACE_PA = {95000, 100000, 85000, 92000};
  private static final HybridCoefficients GRID = new HybridCoefficients(
      new double[] {0, 100, 200, 0}, new double[] {0, 0.2, 0.5, 0.98}, "hPa");

  private final UnitsConverter converter = new UnitsConverter(UnitTable.defaults());

  /// temperature follows 200 + 0.1 p everywhere above ground
  private static double profile(double p) {
    return 200 + 0.1 * p;
  }

  private static void fillLevels(LabeledDataset dataset, boolean descending) {
    double[] levels = new double[LEVELS.length];
    for (int i = 0; i < levels.length; i++) {
      levels[i] = descending ? LEVELS[LEVELS.length - 1 - i] : LEVELS[i];
    }
    dataset.createCoordinate("level", 3, DataType.FLOAT, Map.of(Attributes.UNITS, "millibars"))
        .setValues(levels);
    dataset.createCoordinate("lat", 2, DataType.FLOAT, Map.of(Attributes.UNITS, "degrees_north"))
        .setValues(new double[] {10, 20});
    dataset.createCoordinate("lon", 2, DataType.FLOAT, Map.of(Attributes.UNITS, "degrees_east"))
        .setValues(new double[] {30, 40});
    double[] temperature = new double[12];
    for (int lev = 0; lev < 3; lev++) {
      for (int c = 0; c < 4; c++) {
        temperature[lev * 4 + c] = profile(levels[lev]);
      }
    }
    // underground at the third column, must not show through
    int deepest = descending ? 0 : 2;
    temperature[deepest * 4 + 2] = 999;
    dataset.createVariable("t", DataType.DOUBLE, List.of("level", "lat", "lon"),
            Map.of(Attributes.UNITS, "K", Attributes.LONG_NAME, "Temperature", Attributes.FILL_VALUE, -999.0))
        .setValues(temperature);
    dataset.createVariable("orog", DataType.FLOAT, List.of("lat", "lon"), Map.of(Attributes.UNITS, "m"))
        .setValues(new double[] {1, 2, 3, 4});
  }

  private static void fillSurface(LabeledDataset dataset) {
    dataset.createDimension("lat", 2);
    dataset.createDimension("lon", 2);
    dataset.createVariable("sp", DataType.DOUBLE, List.of("lat", "lon"), Map.of(Attributes.UNITS, "Pa"))
        .setValues(SURFACE_PA);
    double[] t2m = new double[4];
    for (int c = 0; c < 4; c++) {
      t2m[c] = profile(SURFACE_PA[c] / 100);
    }
    dataset.createVariable("t2m", DataType.DOUBLE, List.of("lat", "lon"), Map.of(Attributes.UNITS, "K"))
        .setValues(t2m);
  }

  private MemoryDataset remap(boolean descending, int threads, Map<String, String> aliases) {
    return remap(GRID, descending, threads, aliases);
  }

  private MemoryDataset remap(HybridCoefficients grid, boolean descending, int threads, Map<String, String> aliases) {
    MemoryDataset level = new MemoryDataset("levels");
    fillLevels(level, descending);
    MemoryDataset surface = new MemoryDataset("surface");
    fillSurface(surface);
    MemoryDataset output = new MemoryDataset("output");
    new VerticalRemapper(grid, threads).remapAll(level.freeze(), surface.freeze(), output, "sp", aliases, converter);
    return output;
  }

  @Nested
  @DisplayName("single columns")
  class Columns {

    @Test
    @DisplayName("values are held constant above the highest sample")
    void constantAboveTop() {
      VerticalRemapper remapper = new VerticalRemapper(
          new HybridCoefficients(new double[] {50, 900}, new double[] {0, 0}, "hPa"));
      VerticalRemapper.RemappedColumn column = remapper.remapColumn(
          new double[] {1, 2, 3, 3}, new double[] {100, 500, 900, 950}, 950, "hPa", converter, 1);
      assertThat(column.pressures()).containsExactly(50.0, 900.0);
      assertThat(column.values()).containsExactly(1.0, 3.0);
    }

    @Test
    void interpolatesLinearly() {
      VerticalRemapper remapper = new VerticalRemapper(
          new HybridCoefficients(new double[] {300, 700}, new double[] {0, 0}, "hPa"));
      VerticalRemapper.RemappedColumn column = remapper.remapColumn(
          new double[] {1, 2, 3}, new double[] {100, 500, 900}, 1000, "hPa", converter, 0);
      assertThat(column.values()).containsExactly(1.5, 2.5);
    }

    @Test
    void acceptsDescendingPressures() {
      VerticalRemapper remapper = new VerticalRemapper(
          new HybridCoefficients(new double[] {300, 700}, new double[] {0, 0}, "hPa"));
      VerticalRemapper.RemappedColumn column = remapper.remapColumn(
          new double[] {3, 2, 1}, new double[] {900, 500, 100}, 1000, "hPa", converter, 0);
      assertThat(column.values()).containsExactly(1.5, 2.5);
    }

    @Test
    @DisplayName("a single sample gives a constant column")
    void singleSample() {
      VerticalRemapper remapper = new VerticalRemapper(GRID);
      VerticalRemapper.RemappedColumn column = remapper.remapColumn(
          new double[] {7}, new double[] {950}, 950, "hPa", converter, 7);
      assertThat(column.values()).containsOnly(7.0);
    }
  }

  @Nested
  @DisplayName("whole datasets")
  class Datasets {

    @Test
    @DisplayName("pressure level variables move onto sigma levels")
    void structure() {
      MemoryDataset output = remap(false, 1, Map.of("t", "t2m"));

      assertThat(output.getDimensions()).extracting(Dimension::name)
          .containsExactly("sigma_level", "lat", "lon");
      assertThat(output.getDimension("sigma_level").size()).isEqualTo(GRID.levelCount());
      assertThat(output.variableNames()).containsExactly("sigma_level", "lat", "lon", "p", "t", "orog");
      assertThat(output.getVariable("sigma_level").getValues()).containsExactly(1, 2, 3, 4);
      assertThat(output.getVariable("p").getDimensions()).containsExactly("sigma_level", "lat", "lon");
      assertThat(output.getVariable("p").getAttributes())
          .containsEntry(Attributes.UNITS, "millibars")
          .containsEntry(Attributes.STANDARD_NAME, "air_pressure");

      Variable t = output.getVariable("t");
      assertThat(t.getDimensions()).containsExactly("sigma_level", "lat", "lon");
      assertThat(t.getAttributes())
          .containsEntry(Attributes.UNITS, "K")
          .containsEntry(Attributes.LONG_NAME, "Temperature")
          .doesNotContainKey(Attributes.FILL_VALUE);
      assertThat(output.getVariable("orog").getValues()).containsExactly(1, 2, 3, 4);
      assertThat(output.getVariable("lat").getValues()).containsExactly(10, 20);
    }

    @Test
    @DisplayName("sigma level pressures follow the surface pressure")
    void pressures() {
      MemoryDataset output = remap(false, 1, Map.of("t", "t2m"));
      double[] p = output.getVariable("p").getValues();
      double[] a = GRID.a();
      double[] b = GRID.b();
      for (int lev = 0; lev < 4; lev++) {
        for (int c = 0; c < 4; c++) {
          assertThat(p[lev * 4 + c]).isCloseTo(a[lev] + b[lev] * SURFACE_PA[c] / 100, within(1e-9));
        }
      }
    }

    @Test
    @DisplayName("values follow the source profile and ignore underground levels")
    void values() {
      MemoryDataset output = remap(false, 1, Map.of("t", "t2m"));
      double[] p = output.getVariable("p").getValues();
      double[] t = output.getVariable("t").getValues();
      for (int c = 0; c < 4; c++) {
        double previous = Double.NEGATIVE_INFINITY;
        for (int lev = 0; lev < 4; lev++) {
          int index = lev * 4 + c;
          double expected = p[index] < LEVELS[0] ? profile(LEVELS[0]) : profile(p[index]);
          assertThat(t[index]).as("column %d level %d", c, lev).isCloseTo(expected, within(1e-9));
          assertThat(t[index]).isGreaterThanOrEqualTo(previous);
          previous = t[index];
        }
      }
    }

    @Test
    void descendingCoordinateGivesSameResult() {
      MemoryDataset ascending = remap(false, 1, Map.of("t", "t2m"));
      MemoryDataset descending = remap(true, 1, Map.of("t", "t2m"));
      assertThat(descending.getVariable("t").getValues())
          .containsExactly(ascending.getVariable("t").getValues(), within(1e-9));
    }

    @Test
    void threadsGiveSameResult() {
      MemoryDataset serial = remap(false, 1, Map.of("t", "t2m"));
      MemoryDataset parallel = remap(false, 2, Map.of("t", "t2m"));
      assertThat(parallel.getVariable("t").getValues()).containsExactly(serial.getVariable("t").getValues());
      assertThat(parallel.getVariable("p").getValues()).containsExactly(serial.getVariable("p").getValues());
    }

    @Test
    @DisplayName("without a surface field the deepest level above ground stands in")
    void withoutAlias() {
      MemoryDataset output = remap(false, 1, Map.of());
      double[] t = output.getVariable("t").getValues();
      // column 0: sp 950 hPa, deepest level above ground is 900 hPa; bottom sigma level at 931 hPa
      assertThat(t[3 * 4]).isCloseTo(profile(900), within(1e-9));
    }

    @Test
    @DisplayName("a level map averages half levels into full levels")
    void levelMap() {
      HybridCoefficients halfLevels = new HybridCoefficients(
          GRID.a(), GRID.b(), "hPa", new int[] {1, 2});
      MemoryDataset output = remap(halfLevels, false, 1, Map.of("t", "t2m"));

      assertThat(output.getDimension("sigma_level").size()).isEqualTo(2);
      assertThat(output.getVariable("sigma_level").getValues()).containsExactly(1, 2);
      double[] p = output.getVariable("p").getValues();
      double[] t = output.getVariable("t").getValues();
      assertThat(p).hasSize(8);
      for (int c = 0; c < 4; c++) {
        double sp = SURFACE_PA[c] / 100;
        assertThat(p[c]).isCloseTo(0.5 * ((100 + 0.2 * sp) + (200 + 0.5 * sp)), within(1e-9));
        assertThat(p[4 + c]).isCloseTo(0.5 * ((200 + 0.5 * sp) + (0 + 0.98 * sp)), within(1e-9));
        assertThat(t[c]).isCloseTo(profile(p[c]), within(1e-9));
        assertThat(t[4 + c]).isCloseTo(profile(p[4 + c]), within(1e-9));
      }
    }

    @Test
    @DisplayName("several level variables share one sigma level and one pressure variable")
    void sharedPressure() {
      MemoryDataset level = new MemoryDataset("levels");
      fillLevels(level, false);
      double[] q = new double[12];
      Arrays.fill(q, 5.0);
      level.createVariable("q", DataType.FLOAT, List.of("level", "lat", "lon"))
          .setValues(q);
      MemoryDataset surface = new MemoryDataset("surface");
      fillSurface(surface);
      MemoryDataset output = new MemoryDataset("output");

      VerticalRemapper.RemapSummary summary = new VerticalRemapper(GRID)
          .remapAll(level.freeze(), surface.freeze(), output, "sp", Map.of("t", "t2m"), converter);

      assertThat(summary.remapped()).containsExactly("t", "q");
      assertThat(summary.copied()).containsExactly("orog");
      assertThat(output.variableNames()).containsExactly("sigma_level", "lat", "lon", "p", "t", "orog", "q");
      assertThat(output.getDimensions()).extracting(Dimension::name)
          .containsExactly("sigma_level", "lat", "lon");
      assertThat(output.getVariable("q").getDimensions()).containsExactly("sigma_level", "lat", "lon");
      assertThat(output.getVariable("q").getValues()).containsOnly(5.0);
      assertThat(output.getVariable("p").getValues())
          .containsExactly(remap(false, 1, Map.of("t", "t2m")).getVariable("p").getValues(), within(1e-12));
    }

    @Test
    @DisplayName("missing packed values stay missing after the remap")
    void packedMissingValues() {
      MemoryDataset level = new MemoryDataset("levels");
      level.createCoordinate("level", 4, DataType.FLOAT, Map.of(Attributes.UNITS, "hPa"))
          .setValues(new double[] {100, 300, 500, 900});
      level.createVariable("t", DataType.SHORT, List.of("level"), Map.of(Attributes.UNITS, "K",
              Attributes.SCALE_FACTOR, 0.01, Attributes.ADD_OFFSET, 250.0, Attributes.FILL_VALUE, (short) -32767))
          .setValues(new double[] {100, 300, -32767, 900});
      MemoryDataset surface = new MemoryDataset("surface");
      surface.createVariable("sp", DataType.DOUBLE, List.of(), Map.of(Attributes.UNITS, "hPa"))
          .setValues(new double[] {1000});
      MemoryDataset output = new MemoryDataset("output");
      HybridCoefficients grid = new HybridCoefficients(new double[] {200, 500}, new double[] {0, 0}, "hPa");

      new VerticalRemapper(grid).remapAll(level.freeze(), surface.freeze(), output, "sp", Map.of(), converter);

      Variable t = output.getVariable("t");
      assertThat(t.hasAttribute(Attributes.FILL_VALUE)).isFalse();
      double[] unpacked = t.getUnpacked();
      assertThat(unpacked[0]).isCloseTo(252.0, within(1e-9));
      assertThat(unpacked[1]).isNaN();
    }

    @Test
    void missingSurfacePressure() {
      MemoryDataset level = new MemoryDataset("levels");
      fillLevels(level, false);
      MemoryDataset surface = new MemoryDataset("surface");
      fillSurface(surface);
      VerticalRemapper remapper = new VerticalRemapper(GRID);
      assertThatThrownBy(() -> remapper.remapAll(level, surface, new MemoryDataset("out"), "ps", Map.of(), converter))
          .isInstanceOf(DatasetException.class)
          .hasMessageContaining("'ps'");
    }

    @Test
    void surfaceFieldMustCoverColumns() {
      MemoryDataset level = new MemoryDataset("levels");
      fillLevels(level, false);
      MemoryDataset surface = new MemoryDataset("surface");
      surface.createDimension("lat", 2);
      surface.createVariable("sp", DataType.DOUBLE, List.of("lat"), Map.of(Attributes.UNITS, "Pa"))
          .setValues(new double[] {100000, 100000});
      VerticalRemapper remapper = new VerticalRemapper(GRID);
      assertThatThrownBy(() -> remapper.remapAll(level, surface, new MemoryDataset("out"), "sp", Map.of(), converter))
          .isInstanceOf(DatasetException.class)
          .hasMessageContaining("2 points");
    }

    @Test
    void unorderedCoordinateIsRejected() {
      MemoryDataset level = new MemoryDataset("levels");
      level.createCoordinate("level", 3, DataType.FLOAT, Map.of(Attributes.UNITS, "hPa"))
          .setValues(new double[] {100, 900, 500});
      level.createVariable("q", DataType.FLOAT, List.of("level"));
      MemoryDataset surface = new MemoryDataset("surface");
      surface.createVariable("sp", DataType.DOUBLE, List.of(), Map.of(Attributes.UNITS, "hPa"))
          .setValues(new double[] {1000});
      VerticalRemapper remapper = new VerticalRemapper(GRID);
      assertThatThrownBy(() -> remapper.remapAll(level, surface, new MemoryDataset("out"), "sp", Map.of(), converter))
          .isInstanceOf(MissingCoordinateException.class)
          .hasMessageContaining("monotonic");
    }
  }

  @Test
  @DisplayName("HDF5 files are remapped end to end")
  void files(@TempDir Path tempDir) {
    Path levelFile = tempDir.resolve("levels.h5");
    Path surfaceFile = tempDir.resolve("surface.h5");
    Path outputFile = tempDir.resolve("remapped.h5");
    try (Hdf5Dataset level = Hdf5Dataset.create(levelFile)) {
      fillLevels(level, false);
    }
    try (Hdf5Dataset surface = Hdf5Dataset.create(surfaceFile)) {
      fillSurface(surface);
    }

    VerticalRemapper.RemapSummary summary = new VerticalRemapper(GRID)
        .remapAll(levelFile, surfaceFile, outputFile, "sp", VerticalRemapper.DEFAULT_SURFACE_ALIASES, converter);

    assertThat(summary.remapped()).containsExactly("t");
    assertThat(summary.copied()).containsExactly("orog");
    try (Hdf5Dataset output = Hdf5Dataset.openForRead(outputFile)) {
      assertThat(output.variableNames()).containsExactly("sigma_level", "lat", "lon", "p", "t", "orog");
      assertThat(output.getVariable("t").shape()).containsExactly(4, 2, 2);
    }
  }
}
