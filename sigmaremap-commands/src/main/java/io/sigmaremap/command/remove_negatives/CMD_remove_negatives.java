package io.sigmaremap.command.remove_negatives;

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


import io.sigmaremap.command.common.VerbosityOption;
import io.sigmaremap.dataset.DatasetMode;
import io.sigmaremap.dataset.hdf5.Hdf5Dataset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Replace negative values in a dataset, in place.
 */
@CommandLine.Command(name = "remove-negatives",
    header = "Replace negative values with the smallest positive packed value",
    description = "Rewrites DATASET with every negative value of its non-coordinate variables\n"
        + "replaced. Signed radiation fluxes are left unchanged.",
    exitCodeList = {"0: success", "2: error"})
public class CMD_remove_negatives implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_remove_negatives.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(index = "0", paramLabel = "DATASET", description = "Dataset to be modified")
    private Path dataset;

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosity.apply();
            if (!Files.isRegularFile(dataset)) {
                logger.error("Input file {} does not exist", dataset);
                return EXIT_ERROR;
            }
            Map<String, Integer> replaced;
            try (Hdf5Dataset data = Hdf5Dataset.open(dataset, DatasetMode.APPEND)) {
                replaced = new NegativeValueRemover().removeNegatives(data);
            }
            int total = replaced.values().stream().mapToInt(Integer::intValue).sum();
            logger.info("Replaced {} negative values in {} variables of {}", total, replaced.size(), dataset);
            return EXIT_SUCCESS;
        } catch (Exception e) {
            logger.error("Error removing negative values: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }
}
