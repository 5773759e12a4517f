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


package me.golemcore.codeact.domain.service;

import me.golemcore.codeact.infrastructure.config.AgentConfiguration;
import me.golemcore.codeact.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolResultMaterializerTest {

    private InMemoryStoragePort storage;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        store = new SessionStore(storage, AgentConfiguration.objectMapper(), Clock.systemUTC(), "sessions", "s1",
                false);
    }

    private static String numberedLines(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "line " + i).collect(Collectors.joining("\n"));
    }

    @Test
    void shouldKeepSmallResultInline() {
        ToolResultMaterializer materializer = new ToolResultMaterializer(store, 100, 2);

        ToolResultMaterializer.Materialized result = materializer.materialize("small");

        assertEquals("small", result.content());
        assertFalse(result.overflowed());
        assertEquals(0, storage.fileCount());
    }

    @Test
    void shouldPassNullThrough() {
        ToolResultMaterializer materializer = new ToolResultMaterializer(store, 10, 2);

        assertNull(materializer.materialize(null).content());
    }

    @Test
    void shouldReplaceLargeResultWithNotice() {
        ToolResultMaterializer materializer = new ToolResultMaterializer(store, 50, 2);
        String content = numberedLines(10);

        ToolResultMaterializer.Materialized result = materializer.materialize(content);

        assertTrue(result.overflowed());
        List<String> lines = result.content().lines().toList();
        assertEquals("Tool result exceeded configured inline threshold (50 bytes).", lines.get(0));
        assertEquals("Actual size: " + content.getBytes(StandardCharsets.UTF_8).length + " bytes.", lines.get(1));
        assertEquals("Preview (first and last 2 lines):", lines.get(2));
        assertEquals(List.of("line 1", "line 2", "... (6 lines omitted) ...", "line 9", "line 10"),
                lines.subList(3, 8));
        assertTrue(lines.get(8).startsWith("Full content saved to: /in-memory/sessions/s1/tool-results/"));
        assertEquals(1, storage.fileCount());
    }

    @Test
    void shouldStoreFullContent() {
        ToolResultMaterializer materializer = new ToolResultMaterializer(store, 5, 1);
        String content = "0123456789";

        String notice = materializer.materialize(content).content();

        String path = notice.substring(notice.indexOf("/in-memory/") + "/in-memory/".length()).trim();
        String directory = path.substring(0, path.lastIndexOf('/'));
        String file = path.substring(path.lastIndexOf('/') + 1);
        assertEquals(content, storage.content(directory, file));
    }

    @Test
    void shouldKeepLargeResultInlineWithoutStore() {
        ToolResultMaterializer materializer = new ToolResultMaterializer(null, 5, 1);

        ToolResultMaterializer.Materialized result = materializer.materialize("0123456789");

        assertEquals("0123456789", result.content());
        assertFalse(result.overflowed());
    }

    @Test
    void shouldCapLongPreviewLines() {
        ToolResultMaterializer materializer = new ToolResultMaterializer(store, 10, 10);
        String longLine = "x".repeat(300);

        List<String> preview = materializer.previewLines(longLine);

        assertEquals(1, preview.size());
        assertEquals("x".repeat(240) + "... [truncated 60 chars]", preview.get(0));
    }

    @Test
    void shouldNotSplitSurrogatePairWhenCappingLine() {
        ToolResultMaterializer materializer = new ToolResultMaterializer(store, 10, 10);
        String line = "x".repeat(239) + "\uD83D\uDE00" + "z".repeat(60);

        String capped = materializer.previewLines(line).get(0);

        assertEquals("x".repeat(239) + "... [truncated 62 chars]", capped);
    }

    @Test
    void shouldCapTotalPreviewSize() {
        ToolResultMaterializer materializer = new ToolResultMaterializer(store, 10, 50);
        String text = IntStream.range(0, 100).mapToObj(i -> "y".repeat(200)).collect(Collectors.joining("\n"));

        List<String> preview = materializer.previewLines(text);

        int bytes = String.join("\n", preview).getBytes(StandardCharsets.UTF_8).length;
        assertTrue(bytes <= ToolResultMaterializer.MAX_PREVIEW_TOTAL_BYTES, "preview bytes: " + bytes);
        assertTrue(preview.size() < 100);
    }

    @Test
    void shouldMarkEmptyPreview() {
        ToolResultMaterializer materializer = new ToolResultMaterializer(store, 10, 2);

        assertEquals(List.of("<empty>"), materializer.previewLines(""));
    }
}
