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


package me.golemcore.codeact.adapter.outbound.storage;

import me.golemcore.codeact.infrastructure.config.CodeActProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TEST_DIR = "sessions/s1";
    private static final String LOG_FILE = "main.jsonl";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        CodeActProperties properties = new CodeActProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesSessionsDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve("sessions")));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "note.txt", "Hello, World!").get();

        assertEquals("Hello, World!", storageAdapter.getText(TEST_DIR, "note.txt").get());
    }

    @Test
    void putTextReplacesExistingContent() throws ExecutionException, InterruptedException {
        storageAdapter.putText(TEST_DIR, "note.txt", "a much longer first version").get();
        storageAdapter.putText(TEST_DIR, "note.txt", "short").get();

        assertEquals("short", storageAdapter.getText(TEST_DIR, "note.txt").get());
    }

    @Test
    void getTextReturnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TEST_DIR, "missing.txt").get());
    }

    @Test
    void existsReflectsFileState() throws ExecutionException, InterruptedException {
        assertFalse(storageAdapter.exists(TEST_DIR, LOG_FILE).get());

        storageAdapter.appendText(TEST_DIR, LOG_FILE, "{}\n", false).get();

        assertTrue(storageAdapter.exists(TEST_DIR, LOG_FILE).get());
    }

    @Test
    void appendTextKeepsEarlierLines() throws Exception {
        storageAdapter.appendText(TEST_DIR, LOG_FILE, "{\"n\":1}\n", false).get();
        storageAdapter.appendText(TEST_DIR, LOG_FILE, "{\"n\":2}\n", true).get();

        List<String> lines = Files.readAllLines(tempDir.resolve(TEST_DIR).resolve(LOG_FILE),
                StandardCharsets.UTF_8);
        assertEquals(List.of("{\"n\":1}", "{\"n\":2}"), lines);
    }

    @Test
    void appendTextCreatesNestedDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.appendText("sessions/s2/tool-results", "call-1.txt", "output", true).get();

        assertTrue(Files.exists(tempDir.resolve("sessions/s2/tool-results/call-1.txt")));
    }

    @Test
    void resolveReturnsAbsolutePathInsideBase() {
        Path resolved = storageAdapter.resolve(TEST_DIR, LOG_FILE);

        assertTrue(resolved.isAbsolute());
        assertEquals(tempDir.toAbsolutePath().normalize().resolve(TEST_DIR).resolve(LOG_FILE), resolved);
        assertFalse(Files.exists(resolved));
    }

    // ==================== Path traversal ====================

    @Test
    void resolveBlocksTraversalOutsideBase() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> storageAdapter.resolve(TEST_DIR, "../../../etc/passwd"));

        assertTrue(error.getMessage().startsWith("Path traversal blocked"));
    }

    @Test
    void putTextBlocksTraversalOutsideBase() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storageAdapter.putText("..", "escape.txt", "x").get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertFalse(Files.exists(tempDir.getParent().resolve("escape.txt")));
    }
}
