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
import io.sigmaremap.dataset.LabeledDataset;
import io.sigmaremap.dataset.Variable;
import io.sigmaremap.dataset.hdf5.Hdf5Dataset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the surface pressure dataset a vertical remap needs, from a directory of yearly
 * ERA5 monthly mean files named {@code <year>-era5.nc}. For every time of an input dataset,
 * the surface pressure of that month is copied into the output, along an unlimited time
 * dimension. Gathering stops at the first year without a file.
 */
public class SurfacePressureGatherer {
    private static final Logger logger = LogManager.getLogger(SurfacePressureGatherer.class);

    public static final String DEFAULT_SURFACE_PRESSURE = "sp";
    public static final String DEFAULT_TIME = "time";

    private static final Pattern DAYS_SINCE =
        Pattern.compile("days since ([0-9]+)-([0-9]+)-([0-9]+) ([0-9]+):([0-9]+):([0-9]+)");

    private final Path era5Dir;
    private final String surfacePressureName;
    private final String timeName;

    public SurfacePressureGatherer(Path era5Dir) {
        this(era5Dir, DEFAULT_SURFACE_PRESSURE, DEFAULT_TIME);
    }

    public SurfacePressureGatherer(Path era5Dir, String surfacePressureName, String timeName) {
        this.era5Dir = era5Dir;
        this.surfacePressureName = surfacePressureName;
        this.timeName = timeName;
    }

    /**
     * @param gathered how many time steps received a surface pressure field
     * @param requested how many time steps the input has
     */
    public record Result(int gathered, int requested) {
        public boolean isComplete() {
            return gathered == requested;
        }
    }

    /**
     * Parse the reference time of CF time units in days.
     *
     * @param units e.g. {@code days since 1979-01-01 00:00:00}
     * @return the reference time
     * @throws DatasetException if the units are not days since a date and time
     */
    static LocalDateTime referenceTime(String units) {
        Matcher matcher = DAYS_SINCE.matcher(units);
        if (!matcher.lookingAt()) {
            throw new DatasetException("time units must be 'days since Y-M-D h:m:s', not '" + units + "'");
        }
        return LocalDateTime.of(
            Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
            Integer.parseInt(matcher.group(3)), Integer.parseInt(matcher.group(4)),
            Integer.parseInt(matcher.group(5)), Integer.parseInt(matcher.group(6)));
    }

    Path yearFile(int year) {
        return era5Dir.resolve(year + "-era5.nc");
    }

    /**
     * Copy the monthly surface pressure for each time of {@code input} into {@code output}.
     *
     * @param input a dataset with a time coordinate in days
     * @param output an empty, writable dataset
     * @return how many times were gathered
     */
    public Result gather(LabeledDataset input, LabeledDataset output) {
        Variable time = input.getVariable(timeName);
        String units = time.getUnits().orElseThrow(
            () -> new DatasetException("time variable " + timeName + " has no units"));
        LocalDateTime start = referenceTime(units);
        double[] days = time.getUnpacked();

        output.createUnlimitedDimension(timeName, 0);
        Variable outTime = output.createVariable(timeName, time.getDataType(), List.of(timeName),
            Map.of(Attributes.UNITS, units));
        Variable outPressure = null;

        Path currentPath = null;
        Hdf5Dataset current = null;
        Variable pressure = null;
        double[] monthly = null;
        int gathered = 0;
        try {
            for (int i = 0; i < days.length; i++) {
                LocalDateTime when = start.plusDays((long) days[i]);
                Path path = yearFile(when.getYear());
                if (!path.equals(currentPath)) {
                    if (current != null) {
                        current.close();
                        current = null;
                    }
                    if (!Files.isRegularFile(path)) {
                        logger.warn("{} not found, stopping after {} of {} times", path, gathered, days.length);
                        break;
                    }
                    logger.info("new path: {}", path);
                    current = Hdf5Dataset.openForRead(path);
                    currentPath = path;
                    pressure = current.getVariable(surfacePressureName);
                    monthly = pressure.getUnpacked();
                }
                if (outPressure == null) {
                    outPressure = createOutput(output, current, pressure);
                }

                int frameSize = frameSize(pressure, outPressure);
                int month = when.getMonthValue() - 1;
                if (month >= pressure.shape()[0]) {
                    throw new DatasetException(String.format(
                        "%s in %s has %d months, month %d was requested",
                        surfacePressureName, path, pressure.shape()[0], month + 1));
                }
                output.growDimension(timeName, i + 1);
                outTime.set(i, days[i]);
                for (int j = 0; j < frameSize; j++) {
                    outPressure.set(i * frameSize + j, monthly[month * frameSize + j]);
                }
                gathered++;
            }
        } finally {
            if (current != null) {
                current.close();
            }
        }
        return new Result(gathered, days.length);
    }

    private Variable createOutput(LabeledDataset output, LabeledDataset source, Variable pressure) {
        List<String> sourceDimensions = pressure.getDimensions();
        if (sourceDimensions.isEmpty()) {
            throw new DatasetException(surfacePressureName + " in " + source.getName() + " has no month axis");
        }
        List<String> dimensions = new ArrayList<>();
        dimensions.add(timeName);
        for (String dimension : sourceDimensions.subList(1, sourceDimensions.size())) {
            output.ensureDimension(source.getDimension(dimension), source);
            dimensions.add(dimension);
        }
        boolean packed = pressure.hasAttribute(Attributes.SCALE_FACTOR) || pressure.hasAttribute(Attributes.ADD_OFFSET);
        Variable created = output.createVariable(surfacePressureName,
            packed ? DataType.DOUBLE : pressure.getDataType(), dimensions);
        pressure.getUnits().ifPresent(units -> created.setAttribute(Attributes.UNITS, units));
        return created;
    }

    private static int frameSize(Variable pressure, Variable outPressure) {
        int[] shape = pressure.shape();
        int frameSize = shape[0] == 0 ? 0 : pressure.size() / shape[0];
        int[] outShape = outPressure.shape();
        int outFrame = 1;
        for (int axis = 1; axis < outShape.length; axis++) {
            outFrame *= outShape[axis];
        }
        if (frameSize != outFrame) {
            throw new DatasetException(String.format(
                "%s has %d points per month, but earlier years had %d", pressure.getName(), frameSize, outFrame));
        }
        return frameSize;
    }
}
