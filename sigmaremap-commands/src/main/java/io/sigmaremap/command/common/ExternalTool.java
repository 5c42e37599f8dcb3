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

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An executable found on the search path, such as {@code cdo} or {@code ncrcat}.
 * Tools are located before any work starts, so that a missing installation is reported
 * before inputs are touched.
 */
public final class ExternalTool {
    private static final Logger logger = LogManager.getLogger(ExternalTool.class);

    private final String name;
    private final Path executable;

    private ExternalTool(String name, Path executable) {
        this.name = name;
        this.executable = executable;
    }

    /**
     * Find a tool on the {@code PATH} of this process.
     *
     * @param name the executable name
     * @return the located tool
     * @throws ExternalToolException if the tool is not installed
     */
    public static ExternalTool locate(String name) {
        return locate(name, System.getenv("PATH"));
    }

    /**
     * Find a tool on a search path.
     *
     * @param name the executable name
     * @param searchPath directories separated by the platform path separator
     * @return the located tool
     * @throws ExternalToolException if no directory holds an executable of that name
     */
    public static ExternalTool locate(String name, String searchPath) {
        if (searchPath != null) {
            for (String directory : searchPath.split(File.pathSeparator)) {
                if (directory.isEmpty()) {
                    continue;
                }
                Path candidate = Path.of(directory).resolve(name);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    logger.debug("found {} at {}", name, candidate);
                    return new ExternalTool(name, candidate);
                }
            }
        }
        throw new ExternalToolException(name, "you must have " + name + " installed");
    }

    public String getName() {
        return name;
    }

    public Path getExecutable() {
        return executable;
    }

    /**
     * Run the tool to completion, sharing this process's standard streams.
     *
     * @param args the tool arguments
     * @throws ExternalToolException if the tool cannot be started or exits non-zero
     */
    public void run(String... args) {
        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.addAll(Arrays.asList(args));
        logger.info("running {}", String.join(" ", command));
        int exitCode;
        try {
            Process process = new ProcessBuilder(command).inheritIO().start();
            exitCode = process.waitFor();
        } catch (IOException e) {
            throw new ExternalToolException(name, -1, "unable to start " + name + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException(name, -1, "interrupted while waiting for " + name, e);
        }
        if (exitCode != 0) {
            throw new ExternalToolException(name, exitCode, name + " exited with status " + exitCode, null);
        }
    }

    @Override
    public String toString() {
        return name + " (" + executable + ")";
    }
}
