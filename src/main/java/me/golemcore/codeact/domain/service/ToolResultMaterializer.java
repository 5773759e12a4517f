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

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Replaces tool results above the inline threshold with a notice pointing at a
 * stored copy.
 *
 * <p>
 * The notice states the threshold and the actual size, previews the first and
 * last {@code previewLines} lines, and names the stored file. Preview lines are
 * capped at 240 characters and the whole preview at 4096 bytes. Without a
 * session store, or when storing fails, the result stays inline.
 */
@Slf4j
public class ToolResultMaterializer {

    static final int MAX_PREVIEW_LINE_CHARS = 240;
    static final int MAX_PREVIEW_TOTAL_BYTES = 4096;

    private final SessionStore sessionStore;
    private final int inlineMaxBytes;
    private final int previewLines;

    /**
     * @param sessionStore
     *            store for overflow files, or {@code null} when persistence is
     *            disabled
     */
    public ToolResultMaterializer(SessionStore sessionStore, int inlineMaxBytes, int previewLines) {
        this.sessionStore = sessionStore;
        this.inlineMaxBytes = inlineMaxBytes;
        this.previewLines = previewLines;
    }

    public Materialized materialize(String content) {
        if (content == null) {
            return new Materialized(null, false);
        }
        int size = content.getBytes(StandardCharsets.UTF_8).length;
        if (size <= inlineMaxBytes) {
            return new Materialized(content, false);
        }
        if (sessionStore == null) {
            log.warn("[ToolResults] Result exceeded inline threshold but no session store is configured "
                    + "(size={}, threshold={})", size, inlineMaxBytes);
            return new Materialized(content, false);
        }

        Path stored;
        try {
            stored = sessionStore.saveToolResult(content, "txt");
        } catch (RuntimeException e) {
            log.warn("[ToolResults] Failed to store large result, keeping it inline (size={}, threshold={})",
                    size, inlineMaxBytes, e);
            return new Materialized(content, false);
        }
        return new Materialized(buildNotice(content, size, stored), true);
    }

    private String buildNotice(String content, int size, Path stored) {
        List<String> lines = new ArrayList<>();
        lines.add("Tool result exceeded configured inline threshold (" + inlineMaxBytes + " bytes).");
        lines.add("Actual size: " + size + " bytes.");
        lines.add("Preview (first and last " + previewLines + " lines):");
        lines.addAll(previewLines(content));
        lines.add("Full content saved to: " + stored);
        return String.join("\n", lines);
    }

    List<String> previewLines(String text) {
        List<String> lines = text.lines().toList();
        if (lines.isEmpty()) {
            return List.of("<empty>");
        }
        List<String> selected = new ArrayList<>();
        if (lines.size() <= previewLines * 2) {
            selected.addAll(lines);
        } else {
            int omitted = lines.size() - previewLines * 2;
            selected.addAll(lines.subList(0, previewLines));
            selected.add("... (" + omitted + " lines omitted) ...");
            selected.addAll(lines.subList(lines.size() - previewLines, lines.size()));
        }

        List<String> kept = new ArrayList<>();
        int used = 0;
        for (String line : selected) {
            String capped = capLine(line);
            int separator = kept.isEmpty() ? 0 : 1;
            int budget = MAX_PREVIEW_TOTAL_BYTES - used - separator;
            if (budget <= 0) {
                break;
            }
            int bytes = capped.getBytes(StandardCharsets.UTF_8).length;
            if (bytes <= budget) {
                kept.add(capped);
                used += separator + bytes;
                continue;
            }
            String trimmed = trimToBytes(capped, budget);
            if (!trimmed.isEmpty()) {
                kept.add(trimmed);
            }
            break;
        }
        return kept.isEmpty() ? List.of("<preview truncated>") : kept;
    }

    private static String capLine(String line) {
        if (line.length() <= MAX_PREVIEW_LINE_CHARS) {
            return line;
        }
        int cut = cutPoint(line, MAX_PREVIEW_LINE_CHARS);
        int omitted = line.length() - cut;
        return line.substring(0, cut) + "... [truncated " + omitted + " chars]";
    }

    private static String trimToBytes(String text, int budget) {
        String trimmed = text;
        while (!trimmed.isEmpty() && trimmed.getBytes(StandardCharsets.UTF_8).length > budget) {
            trimmed = trimmed.substring(0, cutPoint(trimmed, trimmed.length() - 1));
        }
        return trimmed;
    }

    // Never split a surrogate pair.
    private static int cutPoint(String text, int end) {
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            return end - 1;
        }
        return end;
    }

    /**
     * Result text to emit and feed back, and whether it replaced the original.
     */
    public record Materialized(String content, boolean overflowed) {
    }
}
