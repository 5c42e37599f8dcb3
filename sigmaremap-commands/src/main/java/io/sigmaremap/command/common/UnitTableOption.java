package io.sigmaremap.command.common;

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


import io.sigmaremap.units.UnitTable;
import io.sigmaremap.units.UnitsConverter;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Shared unit table option.
 * Provides {@code --units-table} for replacing the built-in unit registry with a YAML table.
 */
public class UnitTableOption {

    @CommandLine.Option(
        names = {"--units-table"},
        paramLabel = "YAML",
        description = "YAML unit table to use instead of the built-in units"
    )
    private Path unitsTable;

    public Path getUnitsTable() {
        return unitsTable;
    }

    /**
     * Gets the unit table named by the option, or the built-in table.
     */
    public UnitTable getTable() {
        return unitsTable != null ? UnitTable.load(unitsTable) : UnitTable.defaults();
    }

    /**
     * Gets a converter over {@link #getTable()}.
     */
    public UnitsConverter getConverter() {
        return new UnitsConverter(getTable());
    }
}
