package io.sigmaremap.command.vertical_remap;

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


import io.sigmaremap.command.common.ParallelExecutionOption;
import io.sigmaremap.command.common.StagedOutput;
import io.sigmaremap.command.common.UnitTableOption;
import io.sigmaremap.command.common.VerbosityOption;
import io.sigmaremap.units.UnitsConverter;
import io.sigmaremap.vertical.CoefficientTables;
import io.sigmaremap.vertical.HybridCoefficients;
import io.sigmaremap.vertical.VerticalRemapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Remap every pressure level variable of a dataset onto hybrid sigma-pressure levels.
 *
 * <pre>
 * sigmaremap vertical-remap levels.h5 surface.h5 remapped.h5
 * sigmaremap vertical-remap levels.h5 surface.h5 remapped.h5 --alias t=t2m --alias q=q2m --threads 4
 * sigmaremap vertical-remap levels.h5 surface.h5 remapped.h5 --table-file my-grid.yaml
 * </pre>
 *
 * The output is written beside its destination and moved into place only when the whole
 * remap succeeds.
 */
@CommandLine.Command(name = "vertical-remap",
    header = "Remap pressure level variables onto hybrid sigma-pressure levels",
    description = "Interpolate each column of every variable on a pressure coordinate to the\n"
        + "levels a + b*sp of a hybrid grid, ignoring levels below the surface.\n"
        + "Variables without a pressure coordinate are copied unchanged.",
    exitCodeList = {"0: success", "2: error"})
public class CMD_vertical_remap implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_vertical_remap.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(index = "0", paramLabel = "LEVEL_FILE",
        description = "Dataset of variables on pressure levels")
    private Path levelFile;

    @CommandLine.Parameters(index = "1", paramLabel = "SURFACE_FILE",
        description = "Dataset with the surface pressure and surface fields")
    private Path surfaceFile;

    @CommandLine.Parameters(index = "2", paramLabel = "OUTPUT",
        description = "Output dataset path")
    private Path outputFile;

    @CommandLine.Option(names = {"--surface-pressure"},
        description = "Name of the surface pressure variable (default: ${DEFAULT-VALUE})",
        defaultValue = VerticalRemapper.DEFAULT_SURFACE_PRESSURE)
    private String surfacePressure = VerticalRemapper.DEFAULT_SURFACE_PRESSURE;

    @CommandLine.Option(names = {"-a", "--alias"}, paramLabel = "VARIABLE=SURFACE",
        description = "Use a surface field as the surface value of a level variable "
            + "(default: t=t2m)")
    private Map<String, String> aliases;

    @CommandLine.Option(names = {"--no-aliases"},
        description = "Use no surface fields, only the surface pressure")
    private boolean noAliases = false;

    @CommandLine.Option(names = {"--table"},
        description = "Bundled hybrid coefficient table: ${COMPLETION-CANDIDATES}",
        completionCandidates = BundledTables.class,
        defaultValue = CoefficientTables.ERA_INTERIM)
    private String table = CoefficientTables.ERA_INTERIM;

    @CommandLine.Option(names = {"--table-file"}, paramLabel = "YAML",
        description = "YAML hybrid coefficient table, instead of a bundled one")
    private Path tableFile;

    @CommandLine.Option(names = {"-f", "--force"},
        description = "Force overwrite if output file already exists")
    private boolean force = false;

    @CommandLine.Mixin
    private UnitTableOption unitTableOption = new UnitTableOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    public static class BundledTables implements Iterable<String> {
        @Override
        public Iterator<String> iterator() {
            return CoefficientTables.BUNDLED.iterator();
        }
    }

    @Override
    public Integer call() {
        try {
            verbosity.apply();
            for (Path input : new Path[] {levelFile, surfaceFile}) {
                if (!Files.isRegularFile(input)) {
                    logger.error("Input file {} does not exist", input);
                    return EXIT_ERROR;
                }
            }

            HybridCoefficients coefficients = tableFile != null
                ? CoefficientTables.load(tableFile)
                : CoefficientTables.bundled(table);
            UnitsConverter converter = unitTableOption.getConverter();
            Map<String, String> surfaceAliases = effectiveAliases();
            int threads = parallelOption.getOptimalThreadCount();
            logger.info("Remapping {} onto {} levels using {} thread(s), surface aliases {}",
                levelFile, coefficients.levelCount(), threads, surfaceAliases);

            VerticalRemapper remapper = new VerticalRemapper(coefficients, threads);
            try (StagedOutput staged = StagedOutput.stage(outputFile, force)) {
                VerticalRemapper.RemapSummary summary = remapper.remapAll(
                    levelFile, surfaceFile, staged.getPath(), surfacePressure, surfaceAliases, converter);
                staged.commit();
                logger.info("Wrote {}: remapped {}, copied {}",
                    outputFile, summary.remapped(), summary.copied());
            }
            return EXIT_SUCCESS;
        } catch (Exception e) {
            logger.error("Error during vertical remap: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    Map<String, String> effectiveAliases() {
        if (noAliases) {
            return Map.of();
        }
        if (aliases == null || aliases.isEmpty()) {
            return VerticalRemapper.DEFAULT_SURFACE_ALIASES;
        }
        return new LinkedHashMap<>(aliases);
    }
}
