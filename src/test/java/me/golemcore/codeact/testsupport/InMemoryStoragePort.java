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


package me.golemcore.codeact.testsupport;

import me.golemcore.codeact.port.outbound.StoragePort;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Storage port keeping files in memory, with switchable append failures.
 */
public class InMemoryStoragePort implements StoragePort {

    private static final Path ROOT = Path.of("/in-memory");

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private volatile boolean failAppends;

    public void failAppends(boolean fail) {
        this.failAppends = fail;
    }

    public String content(String directory, String path) {
        return files.get(key(directory, path));
    }

    public void write(String directory, String path, String content) {
        files.put(key(directory, path), content);
    }

    public int fileCount() {
        return files.size();
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        files.put(key(directory, path), content);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.completedFuture(files.get(key(directory, path)));
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.completedFuture(files.containsKey(key(directory, path)));
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content, boolean sync) {
        if (failAppends) {
            return CompletableFuture.failedFuture(new IOException("Disk full"));
        }
        files.merge(key(directory, path), content, String::concat);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Path resolve(String directory, String path) {
        return ROOT.resolve(directory).resolve(path);
    }

    private static String key(String directory, String path) {
        return directory + "/" + path;
    }
}
