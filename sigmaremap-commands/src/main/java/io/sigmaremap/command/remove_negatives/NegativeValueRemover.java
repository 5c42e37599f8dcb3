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


import io.sigmaremap.dataset.Attributes;
import io.sigmaremap.dataset.Dimension;
import io.sigmaremap.dataset.LabeledDataset;
import io.sigmaremap.dataset.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Replaces negative values of packed fields with the smallest positive value their packing
 * can represent. Clear-sky and top of atmosphere radiation fluxes, which are negative by
 * sign convention, and coordinate variables are left alone.
 */
public class NegativeValueRemover {
    private static final Logger logger = LogManager.getLogger(NegativeValueRemover.class);

    /** Fluxes whose negative values are meaningful. */
    public static final Set<String> SIGNED_FLUXES = Set.of(
        "msdwlwrfcs", "msdwswrfcs", "msnlwrfcs", "msnswrfcs", "mtdwswrf", "mtnlwrfcs", "mtnswrfcs");

    /**
     * The smallest positive physical value representable with a packing.
     * Without a scale factor or offset the replacement is zero.
     *
     * @param packing the variable's packing
     * @return the replacement raw value
     */
    static double replacementRaw(Variable.Packing packing) {
        if (packing.scale() == 1.0d && packing.offset() == 0.0d) {
            return 0.0d;
        }
        double steps = -packing.offset() / packing.scale();
        return (packing.dataType().isIntegral() ? (long) steps : steps) + 1.0d;
    }

    /**
     * Replace the negative values of every eligible variable.
     *
     * @param dataset a writable dataset
     * @return the number of values replaced, by variable, for variables that had any
     */
    public Map<String, Integer> removeNegatives(LabeledDataset dataset) {
        Set<String> skipped = new HashSet<>(SIGNED_FLUXES);
        for (Dimension dimension : dataset.getDimensions()) {
            skipped.add(dimension.name());
        }
        Map<String, Integer> replaced = new LinkedHashMap<>();
        for (Variable variable : dataset.getVariables()) {
            if (skipped.contains(variable.getName())) {
                logger.debug("leaving {} unchanged", variable);
                continue;
            }
            Variable.Packing packing = variable.getPacking();
            double[] physical = variable.getUnpacked();
            double replacement = replacementRaw(packing);
            int count = 0;
            for (int i = 0; i < physical.length; i++) {
                if (physical[i] < 0.0d) {
                    variable.set(i, replacement);
                    count++;
                }
            }
            if (count > 0) {
                replaced.put(variable.getName(), count);
                logger.info("replaced {} negative values of {} with {} {}", count, variable.getName(),
                    packing.unpack(replacement), variable.getStringAttribute(Attributes.UNITS).orElse(""));
            }
        }
        return replaced;
    }
}
