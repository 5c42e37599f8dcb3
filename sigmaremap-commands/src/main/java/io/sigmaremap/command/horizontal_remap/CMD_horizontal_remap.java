package io.sigmaremap.command.horizontal_remap;

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


import io.sigmaremap.command.common.ExternalTool;
import io.sigmaremap.command.common.TemporaryDirectory;
import io.sigmaremap.command.common.VerbosityOption;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Regrid a dataset onto a regular longitude-latitude grid with first order conservative
 * remapping, using {@code cdo}. The remap weights are generated once into a scratch directory
 * and applied in a second pass which writes netCDF-4 output.
 */
@CommandLine.Command(name = "horizontal-remap",
    header = "Conservatively regrid a dataset onto a regular lon-lat grid",
    description = "Runs cdo gencon to build remap weights for an NLON x NLAT grid, then\n"
        + "cdo remap to apply them. Requires cdo on the PATH.",
    exitCodeList = {"0: success", "2: error"})
public class CMD_horizontal_remap implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_horizontal_remap.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    static final String CDO = "cdo";

    @CommandLine.Parameters(index = "0", paramLabel = "DATASET", description = "Dataset to be remapped")
    private Path dataset;

    @CommandLine.Parameters(index = "1", paramLabel = "OUTPUT", description = "Output file path")
    private Path output;

    @CommandLine.Parameters(index = "2", paramLabel = "NLON", description = "Number of longitude points")
    private int nlon;

    @CommandLine.Parameters(index = "3", paramLabel = "NLAT", description = "Number of latitude points")
    private int nlat;

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosity.apply();
            if (nlon < 1 || nlat < 1) {
                logger.error("Grid size must be positive, not {} x {}", nlon, nlat);
                return EXIT_ERROR;
            }
            ExternalTool cdo = ExternalTool.locate(CDO);
            if (!Files.isRegularFile(dataset)) {
                logger.error("Input file {} does not exist", dataset);
                return EXIT_ERROR;
            }
            String grid = gridName(nlon, nlat);
            try (TemporaryDirectory scratch = TemporaryDirectory.create("horizontal-remap")) {
                Path weights = scratch.resolve("remap-weights.nc");
                cdo.run("gencon," + grid, dataset.toString(), weights.toString());
                cdo.run("-f", "nc4", "remap," + grid + "," + weights, dataset.toString(), output.toString());
            }
            logger.info("Regridded {} onto {} in {}", dataset, grid, output);
            return EXIT_SUCCESS;
        } catch (Exception e) {
            logger.error("Error during horizontal remap: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    /**
     * @return the cdo name of a global regular grid, e.g. {@code r144x90}
     */
    static String gridName(int nlon, int nlat) {
        return "r" + nlon + "x" + nlat;
    }
}
