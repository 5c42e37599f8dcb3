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


/**
 * Raised when a required command line tool is not installed, cannot be started, or exits
 * with a non-zero status.
 */
public class ExternalToolException extends RuntimeException {

    private final String tool;
    private final int exitCode;

    public ExternalToolException(String tool, String message) {
        this(tool, -1, message, null);
    }

    public ExternalToolException(String tool, int exitCode, String message, Throwable cause) {
        super(message, cause);
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public String getTool() {
        return tool;
    }

    /**
     * @return the exit status of the tool, or -1 if it did not run to completion
     */
    public int getExitCode() {
        return exitCode;
    }
}
