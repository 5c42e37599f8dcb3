package io.sigmaremap.command.gather_surface_pressure;

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
import io.sigmaremap.dataset.MemoryDataset;
import io.sigmaremap.dataset.Variable;
import io.sigmaremap.dataset.hdf5.Hdf5Dataset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SurfacePressureGathererTest {

    private static final String UNITS = "days since 2000-01-01 00:00:00";

    @TempDir
    Path tempDir;

    /** Month m of the year file holds 1000 * (m + 1) + column. */
    private void writeYear(int year, boolean packed) {
        try (Hdf5Dataset out = Hdf5Dataset.create(tempDir.resolve(year + "-era5.nc"))) {
            out.createDimension("time", 12);
            out.createCoordinate("latitude", 2, DataType.FLOAT, Map.of(Attributes.UNITS, "degrees_north"))
                .setValues(new double[] {45, 50});
            double[] values = new double[24];
            for (int month = 0; month < 12; month++) {
                values[month * 2] = 1000 * (month + 1);
                values[month * 2 + 1] = 1000 * (month + 1) + 1;
            }
            Variable sp;
            if (packed) {
                sp = out.createVariable("sp", DataType.SHORT, List.of("time", "latitude"),
                    Map.of(Attributes.UNITS, "Pa", Attributes.SCALE_FACTOR, 1.0d, Attributes.ADD_OFFSET, 10000.0d));
                sp.setUnpacked(values);
            } else {
                sp = out.createVariable("sp", DataType.FLOAT, List.of("time", "latitude"),
                    Map.of(Attributes.UNITS, "Pa"));
                sp.setValues(values);
            }
        }
    }

    private static MemoryDataset input(double... days) {
        MemoryDataset input = new MemoryDataset("input");
        input.createUnlimitedDimension("time", days.length);
        input.createVariable("time", DataType.DOUBLE, List.of("time"), Map.of(Attributes.UNITS, UNITS))
            .setValues(days);
        return input.freeze();
    }

    @Test
    public void testReferenceTime() {
        assertThat(SurfacePressureGatherer.referenceTime("days since 1979-01-01 00:00:00"))
            .isEqualTo(LocalDateTime.of(1979, 1, 1, 0, 0, 0));
        assertThat(SurfacePressureGatherer.referenceTime("days since 2000-3-15 6:30:00 UTC"))
            .isEqualTo(LocalDateTime.of(2000, 3, 15, 6, 30, 0));
        assertThatThrownBy(() -> SurfacePressureGatherer.referenceTime("hours since 1900-01-01 00:00:00"))
            .isInstanceOf(DatasetException.class)
            .hasMessageContaining("days since");
    }

    @Test
    public void testMonthlyFieldsAreGathered() {
        writeYear(2000, false);
        MemoryDataset output = new MemoryDataset("output");

        SurfacePressureGatherer.Result result =
            new SurfacePressureGatherer(tempDir).gather(input(0, 31, 45, 340), output);

        assertThat(result.isComplete()).isTrue();
        assertThat(output.getDimensions()).containsExactly(
            new Dimension("time", 4, true), new Dimension("latitude", 2, false));
        assertThat(output.getVariable("latitude").getValues()).containsExactly(45, 50);
        assertThat(output.getVariable("time").getValues()).containsExactly(0, 31, 45, 340);
        assertThat(output.getVariable("time").getUnits()).contains(UNITS);
        Variable sp = output.getVariable("sp");
        assertThat(sp.getDataType()).isEqualTo(DataType.FLOAT);
        assertThat(sp.getUnits()).contains("Pa");
        assertThat(sp.getValues()).containsExactly(1000, 1001, 2000, 2001, 2000, 2001, 12000, 12001);
    }

    @Test
    public void testPackedFieldsAreStoredUnpacked() {
        writeYear(2000, true);
        MemoryDataset output = new MemoryDataset("output");

        new SurfacePressureGatherer(tempDir).gather(input(60), output);

        Variable sp = output.getVariable("sp");
        assertThat(sp.getDataType()).isEqualTo(DataType.DOUBLE);
        assertThat(sp.hasAttribute(Attributes.SCALE_FACTOR)).isFalse();
        assertThat(sp.getValues()).containsExactly(3000, 3001);
    }

    @Test
    public void testGatheringStopsAtMissingYear() {
        writeYear(2000, false);
        MemoryDataset output = new MemoryDataset("output");

        SurfacePressureGatherer.Result result =
            new SurfacePressureGatherer(tempDir).gather(input(0, 366, 400), output);

        assertThat(result).isEqualTo(new SurfacePressureGatherer.Result(1, 3));
        assertThat(result.isComplete()).isFalse();
        assertThat(output.getDimension("time").size()).isEqualTo(1);
        assertThat(output.getVariable("sp").getValues()).containsExactly(1000, 1001);
    }

    @Test
    public void testCommandWritesSurfaceFile() {
        writeYear(2000, false);
        Path inputFile = tempDir.resolve("levels.h5");
        try (Hdf5Dataset out = Hdf5Dataset.create(inputFile)) {
            out.createUnlimitedDimension("time", 2);
            out.createVariable("time", DataType.DOUBLE, List.of("time"), Map.of(Attributes.UNITS, UNITS))
                .setValues(new double[] {0, 400});
        }
        Path outputFile = tempDir.resolve("surface.h5");

        int exitCode = new CommandLine(new CMD_gather_surface_pressure())
            .execute(inputFile.toString(), outputFile.toString(), tempDir.toString(), "-q");

        assertThat(exitCode).isEqualTo(1);
        try (Hdf5Dataset in = Hdf5Dataset.openForRead(outputFile)) {
            assertThat(in.getDimension("time")).isEqualTo(new Dimension("time", 1, true));
            assertThat(in.getVariable("sp").getValues()).containsExactly(1000, 1001);
        }
    }
}
