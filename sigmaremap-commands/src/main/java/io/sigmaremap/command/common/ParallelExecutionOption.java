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


import picocli.CommandLine;

/**
 * Shared parallel execution options.
 * Provides standard {@code --parallel} and {@code --threads} options for commands
 * that interpolate independent columns concurrently.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Enable parallel processing (auto-sizes based on available CPU cores)"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of parallel threads (default: 1, or all cores but one with --parallel)"
    )
    private Integer explicitThreads;

    public boolean isParallel() {
        return parallel;
    }

    public Integer getExplicitThreads() {
        return explicitThreads;
    }

    /**
     * Calculates the thread count to use.
     * Auto-detection always leaves at least 1 core free for system processes.
     *
     * @return the thread count, at least 1
     */
    public int getOptimalThreadCount() {
        if (explicitThreads != null) {
            return Math.max(1, explicitThreads);
        } else if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
        return 1;
    }
}
