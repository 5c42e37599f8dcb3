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


import io.sigmaremap.command.common.StagedOutput;
import io.sigmaremap.command.common.VerbosityOption;
import io.sigmaremap.dataset.hdf5.Hdf5Dataset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Collect the ERA5 monthly mean surface pressure for every time of a dataset, producing the
 * surface file {@code vertical-remap} needs.
 */
@CommandLine.Command(name = "gather-surface-pressure",
    header = "Collect monthly surface pressures for the times of a dataset",
    description = "For each time of INPUT, copies the surface pressure of that month from\n"
        + "ERA5_DIR/<year>-era5.nc into OUTPUT. Stops at the first missing year file.",
    exitCodeList = {"0: success", "1: warning (some times had no year file)", "2: error"})
public class CMD_gather_surface_pressure implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_gather_surface_pressure.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_WARNING = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(index = "0", paramLabel = "INPUT", description = "Dataset whose times are used")
    private Path input;

    @CommandLine.Parameters(index = "1", paramLabel = "OUTPUT", description = "Output file path")
    private Path output;

    @CommandLine.Parameters(index = "2", paramLabel = "ERA5_DIR",
        description = "Directory of yearly ERA5 monthly mean files")
    private Path era5Dir;

    @CommandLine.Option(names = {"--name"},
        description = "ERA5 surface pressure variable name (default: ${DEFAULT-VALUE})",
        defaultValue = SurfacePressureGatherer.DEFAULT_SURFACE_PRESSURE)
    private String surfacePressureName = SurfacePressureGatherer.DEFAULT_SURFACE_PRESSURE;

    @CommandLine.Option(names = {"--time"},
        description = "Time coordinate of INPUT (default: ${DEFAULT-VALUE})",
        defaultValue = SurfacePressureGatherer.DEFAULT_TIME)
    private String timeName = SurfacePressureGatherer.DEFAULT_TIME;

    @CommandLine.Option(names = {"-f", "--force"},
        description = "Force overwrite if output file already exists")
    private boolean force = false;

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosity.apply();
            if (!Files.isRegularFile(input)) {
                logger.error("Input file {} does not exist", input);
                return EXIT_ERROR;
            }
            if (!Files.isDirectory(era5Dir)) {
                logger.error("ERA5 directory {} does not exist", era5Dir);
                return EXIT_ERROR;
            }
            logger.info("gathering surface pressures ...");
            SurfacePressureGatherer gatherer = new SurfacePressureGatherer(era5Dir, surfacePressureName, timeName);
            SurfacePressureGatherer.Result result;
            try (StagedOutput staged = StagedOutput.stage(output, force);
                 Hdf5Dataset source = Hdf5Dataset.openForRead(input)) {
                Hdf5Dataset surface = Hdf5Dataset.create(staged.getPath());
                try {
                    result = gatherer.gather(source, surface);
                } catch (RuntimeException e) {
                    surface.discard();
                    throw e;
                }
                surface.close();
                staged.commit();
            }
            logger.info("Wrote {} of {} surface pressure fields to {}", result.gathered(), result.requested(), output);
            return result.isComplete() ? EXIT_SUCCESS : EXIT_WARNING;
        } catch (Exception e) {
            logger.error("Error gathering surface pressure: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }
}
