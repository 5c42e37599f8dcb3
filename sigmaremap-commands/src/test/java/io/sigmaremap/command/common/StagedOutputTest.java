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


import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StagedOutputTest {

    @TempDir
    Path tempDir;

    @Test
    public void testCommitMovesIntoPlace() throws IOException {
        Path destination = tempDir.resolve("out").resolve("result.h5");
        try (StagedOutput staged = StagedOutput.stage(destination, false)) {
            assertThat(staged.getPath().getParent()).isEqualTo(destination.getParent());
            Files.writeString(staged.getPath(), "done");
            staged.commit();
        }
        assertThat(destination).hasContent("done");
        assertThat(Files.list(destination.getParent())).hasSize(1);
    }

    @Test
    public void testUncommittedOutputIsRemoved() throws IOException {
        Path destination = tempDir.resolve("result.h5");
        Path partial;
        try (StagedOutput staged = StagedOutput.stage(destination, false)) {
            partial = staged.getPath();
            Files.writeString(partial, "half");
        }
        assertThat(partial).doesNotExist();
        assertThat(destination).doesNotExist();
    }

    @Test
    public void testExistingOutputNeedsForce() throws IOException {
        Path destination = tempDir.resolve("result.h5");
        Files.writeString(destination, "old");
        assertThatThrownBy(() -> StagedOutput.stage(destination, false))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("--force");

        try (StagedOutput staged = StagedOutput.stage(destination, true)) {
            Files.writeString(staged.getPath(), "new");
            staged.commit();
        }
        assertThat(destination).hasContent("new");
    }
}
