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


package me.golemcore.codeact.port.outbound;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage operations within the local workspace. Provides
 * file operations organized by directory with support for text and append-only
 * (JSONL) writes.
 */
public interface StoragePort {

    /**
     * Write text content to file, replacing it.
     *
     * @param directory
     *            subdirectory (e.g., "sessions")
     * @param path
     *            relative path within directory
     * @param content
     *            text content
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file.
     *
     * @return file content, or {@code null} if the file does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Append text to a file (for JSONL logs).
     *
     * @param sync
     *            if true, force the appended bytes to disk before completing
     */
    CompletableFuture<Void> appendText(String directory, String path, String content, boolean sync);

    /**
     * Absolute location of a file, whether or not it exists.
     */
    Path resolve(String directory, String path);
}
