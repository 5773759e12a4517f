/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


package me.golemcore.codeact.adapter.outbound.execution;

import me.golemcore.codeact.domain.model.ExecutionUpdate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs cells through {@code sh} reading the script from stdin.
 */
@EnabledOnOs({ OS.LINUX, OS.MAC })
class ProcessExecutionSessionTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private Path workDir;
    private ProcessExecutionSession session;

    @BeforeEach
    void setUp() {
        workDir = tempDir.resolve("main");
        session = new ProcessExecutionSession("main", List.of("sh"), workDir);
        session.start();
    }

    @AfterEach
    void tearDown() {
        session.stop();
    }

    @Test
    void shouldCreateWorkDirOnStart() {
        assertTrue(Files.isDirectory(workDir));
        assertEquals(workDir, session.getWorkDir());
        assertEquals("execution-session:main", session.resourceName());
    }

    @Test
    void shouldStreamLinesThenResult() {
        StepVerifier.create(session.execute("echo one\necho two\n"))
                .expectNext(new ExecutionUpdate.OutputChunk("one\n"))
                .expectNext(new ExecutionUpdate.OutputChunk("two\n"))
                .assertNext(update -> {
                    ExecutionUpdate.Result result = assertInstanceOf(ExecutionUpdate.Result.class, update);
                    assertEquals("one\ntwo", result.text());
                    assertTrue(result.images().isEmpty());
                })
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void shouldMergeStderrAndReportExitCode() {
        ExecutionUpdate.Result result = lastResult("echo boom 1>&2\nexit 3\n");

        assertEquals("boom\nExit code: 3", result.text());
    }

    @Test
    void shouldReportSilentCellAsNullText() {
        ExecutionUpdate.Result result = lastResult("true\n");

        assertNull(result.text());
    }

    @Test
    void shouldReportNewImagesOnly() throws Exception {
        Files.writeString(workDir.resolve("old.png"), "x");

        ExecutionUpdate.Result result = lastResult("touch plot.png notes.txt\n");

        assertEquals(List.of(workDir.resolve("plot.png")), result.images());
    }

    @Test
    void shouldKeepFilesBetweenCells() {
        lastResult("echo 42 > state.txt\n");

        assertEquals("42", lastResult("cat state.txt\n").text());
    }

    @Test
    void resetShouldEmptyWorkDir() throws Exception {
        lastResult("mkdir -p data && echo 1 > data/a.txt\n");

        StepVerifier.create(session.reset()).expectComplete().verify(TIMEOUT);

        assertTrue(Files.isDirectory(workDir));
        try (Stream<Path> entries = Files.list(workDir)) {
            assertEquals(0, entries.count());
        }
    }

    @Test
    void cancellingShouldDestroyProcess() throws Exception {
        Path marker = workDir.resolve("finished.txt");
        Disposable subscription = session.execute("sleep 1\ntouch finished.txt\n").subscribe();

        Thread.sleep(300);
        subscription.dispose();
        Thread.sleep(1500);

        assertFalse(Files.exists(marker));
    }

    private ExecutionUpdate.Result lastResult(String code) {
        ExecutionUpdate last = session.execute(code).blockLast(TIMEOUT);
        return assertInstanceOf(ExecutionUpdate.Result.class, last);
    }
}
