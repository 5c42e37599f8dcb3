package io.sigmaremap.command.combine;

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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Concatenate datasets along their record dimension with {@code ncrcat}. Each input is
 * first unpacked with {@code ncpdq --unpack}, since inputs packed with different scale
 * factors cannot be concatenated directly.
 */
@CommandLine.Command(name = "combine",
    header = "Concatenate datasets along their record dimension",
    description = "Unpacks every input with ncpdq, then joins them in path order with ncrcat.\n"
        + "Requires ncpdq and ncrcat on the PATH.",
    exitCodeList = {"0: success", "2: error"})
public class CMD_combine implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_combine.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    static final String NCRCAT = "ncrcat";
    static final String NCPDQ = "ncpdq";

    @CommandLine.Parameters(arity = "2..*", paramLabel = "DATASETS... OUTPUT",
        description = "Input datasets, followed by the output file path")
    private List<Path> paths;

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @Override
    public Integer call() {
        try {
            verbosity.apply();
            ExternalTool ncrcat = ExternalTool.locate(NCRCAT);
            ExternalTool ncpdq = ExternalTool.locate(NCPDQ);
            List<Path> inputs = inputs();
            Path output = paths.get(paths.size() - 1);
            for (Path input : inputs) {
                if (!Files.isRegularFile(input)) {
                    logger.error("Input file {} does not exist", input);
                    return EXIT_ERROR;
                }
            }

            try (TemporaryDirectory scratch = TemporaryDirectory.create("combine")) {
                List<String> arguments = new ArrayList<>();
                for (int i = 0; i < inputs.size(); i++) {
                    Path input = inputs.get(i);
                    Path unpacked = scratch.resolve(String.format("%04d-%s", i, input.getFileName()));
                    ncpdq.run("--unpack", input.toString(), unpacked.toString());
                    arguments.add(unpacked.toString());
                }
                arguments.add(output.toString());
                ncrcat.run(arguments.toArray(new String[0]));
            }
            logger.info("Combined {} datasets into {}", inputs.size(), output);
            return EXIT_SUCCESS;
        } catch (Exception e) {
            logger.error("Error while combining datasets: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    /**
     * @return the input datasets, sorted by path
     */
    List<Path> inputs() {
        List<Path> inputs = new ArrayList<>(paths.subList(0, paths.size() - 1));
        inputs.sort(null);
        return inputs;
    }
}
