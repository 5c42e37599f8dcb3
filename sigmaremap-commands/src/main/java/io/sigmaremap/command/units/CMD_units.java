package io.sigmaremap.command.units;

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


import io.sigmaremap.command.common.UnitTableOption;
import io.sigmaremap.units.UnitConversionException;
import io.sigmaremap.units.UnitsConverter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Convert a value between two units of the unit table, e.g.
 * <pre>
 * sigmaremap units 1013.25 hPa atm
 * </pre>
 */
@CommandLine.Command(name = "units",
    header = "Convert a value between units",
    description = "Prints VALUE, given in FROM, expressed in TO.",
    exitCodeList = {"0: success", "2: error"})
public class CMD_units implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_units.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(index = "0", paramLabel = "VALUE", description = "The value to convert")
    private double value;

    @CommandLine.Parameters(index = "1", paramLabel = "FROM", description = "Units of the value")
    private String from;

    @CommandLine.Parameters(index = "2", paramLabel = "TO", description = "Units to convert to")
    private String to;

    @CommandLine.Mixin
    private UnitTableOption unitTableOption = new UnitTableOption();

    @Override
    public Integer call() {
        try {
            UnitsConverter converter = unitTableOption.getConverter();
            double converted = value * converter.convert(from, to);
            System.out.println(value + " " + from + " = " + converted + " " + to);
            return EXIT_SUCCESS;
        } catch (UnitConversionException e) {
            logger.error("{} ({})", e.getMessage(), e.getReason());
            return EXIT_ERROR;
        } catch (Exception e) {
            logger.error("Error converting units: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }
}
