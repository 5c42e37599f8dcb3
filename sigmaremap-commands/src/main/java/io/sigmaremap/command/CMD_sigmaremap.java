package io.sigmaremap.command;

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


import io.sigmaremap.command.combine.CMD_combine;
import io.sigmaremap.command.gather_surface_pressure.CMD_gather_surface_pressure;
import io.sigmaremap.command.horizontal_remap.CMD_horizontal_remap;
import io.sigmaremap.command.remove_negatives.CMD_remove_negatives;
import io.sigmaremap.command.units.CMD_units;
import io.sigmaremap.command.vertical_remap.CMD_vertical_remap;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Reanalysis Preparation Tool

 Prepares pressure level reanalysis data for use on a hybrid sigma-pressure grid.

 ## Subcommands
 - `horizontal-remap`: regrid onto a regular lon-lat grid (cdo)
 - `combine`: concatenate datasets in time (ncpdq, ncrcat)
 - `remove-negatives`: replace negative values of packed fields
 - `gather-surface-pressure`: collect monthly surface pressures for the times of a dataset
 - `vertical-remap`: remap pressure level variables onto sigma levels
 - `units`: convert a value between units

 # Basic Usage
 ```
 sigmaremap horizontal-remap levels.nc regridded.nc 144 90
 sigmaremap gather-surface-pressure regridded.nc sp.h5 /archive/era5
 sigmaremap vertical-remap regridded.nc sp.h5 remapped.h5
 ```
 */
@CommandLine.Command(name = "sigmaremap",
    header = "Prepare reanalysis fields for a hybrid sigma-pressure grid",
    description = "Regrid, combine, clean and vertically remap pressure level datasets.",
    mixinStandardHelpOptions = true,
    versionProvider = CMD_sigmaremap.VersionProvider.class,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"},
    subcommands = {
        CMD_vertical_remap.class,
        CMD_horizontal_remap.class,
        CMD_combine.class,
        CMD_remove_negatives.class,
        CMD_gather_surface_pressure.class,
        CMD_units.class,
        CommandLine.HelpCommand.class
    })
public class CMD_sigmaremap implements Callable<Integer> {

    /**
     * Run the tool
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        System.setProperty("slf4j.internal.verbosity", "ERROR");
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * @return a command line for this tool, configured as {@link #main(String[])} uses it
     */
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_sigmaremap())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CMD_sigmaremap.class.getPackage().getImplementationVersion();
            return new String[] {"sigmaremap " + (version != null ? version : "development")};
        }
    }
}
