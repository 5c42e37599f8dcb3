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


import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * An output file written under a temporary name beside its destination, and moved into
 * place only by {@link #commit()}. Closing without a commit removes the partial file.
 */
public final class StagedOutput implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(StagedOutput.class);

    private final Path destination;
    private final Path staged;
    private final boolean force;
    private boolean committed = false;

    private StagedOutput(Path destination, Path staged, boolean force) {
        this.destination = destination;
        this.staged = staged;
        this.force = force;
    }

    /**
     * @param destination the final output path
     * @param force whether an existing destination may be replaced
     * @return the staging area for the output
     * @throws IllegalStateException if the destination exists and force is not set
     */
    public static StagedOutput stage(Path destination, boolean force) {
        Path absolute = destination.toAbsolutePath().normalize();
        if (Files.exists(absolute) && !force) {
            throw new IllegalStateException(
                "Output file " + destination + " already exists. Use --force to overwrite.");
        }
        try {
            Files.createDirectories(absolute.getParent());
            Path staged = absolute.resolveSibling("." + absolute.getFileName() + ".partial");
            Files.deleteIfExists(staged);
            return new StagedOutput(absolute, staged, force);
        } catch (IOException e) {
            throw new UncheckedIOException("unable to prepare output " + destination, e);
        }
    }

    /**
     * @return where the output should be written until it is committed
     */
    public Path getPath() {
        return staged;
    }

    public Path getDestination() {
        return destination;
    }

    /**
     * Move the staged file to its destination.
     */
    public void commit() {
        try {
            if (force) {
                Files.move(staged, destination, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.move(staged, destination);
            }
            committed = true;
            logger.debug("moved {} to {}", staged, destination);
        } catch (IOException e) {
            throw new UncheckedIOException("unable to move " + staged + " to " + destination, e);
        }
    }

    @Override
    public void close() {
        if (committed) {
            return;
        }
        try {
            if (Files.deleteIfExists(staged)) {
                logger.debug("removed incomplete output {}", staged);
            }
        } catch (IOException e) {
            logger.warn("unable to remove incomplete output {}: {}", staged, e.getMessage(), e);
        }
    }
}
