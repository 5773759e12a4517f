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
import me.golemcore.codeact.port.outbound.ExecutionSession;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Execution session that runs each code cell as a fresh interpreter process
 * inside a private working directory.
 *
 * <p>
 * The cell source is written to the interpreter's stdin; stdout and stderr are
 * merged and streamed line by line. Images written to the working directory
 * during the cell are reported as artifacts. Cancelling the subscription
 * destroys the process. Files persist between cells; {@link #reset()} empties
 * the working directory.
 */
@Slf4j
public class ProcessExecutionSession implements ExecutionSession {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "svg");

    private final String agentId;
    private final List<String> command;
    private final Path workDir;
    private volatile Process running;

    public ProcessExecutionSession(String agentId, List<String> command, Path workDir) {
        this.agentId = agentId;
        this.command = List.copyOf(command);
        this.workDir = workDir;
    }

    @Override
    public String resourceName() {
        return "execution-session:" + agentId;
    }

    @Override
    public void start() {
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create working directory " + workDir, e);
        }
        log.debug("[Exec] {} working directory: {}", agentId, workDir);
    }

    @Override
    public void stop() {
        Process process = running;
        if (process != null && process.isAlive()) {
            process.destroyForcibly();
            log.info("[Exec] {} destroyed running process on stop", agentId);
        }
    }

    @Override
    public Flux<ExecutionUpdate> execute(String code) {
        return Flux.<ExecutionUpdate>create(sink -> run(code, sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> reset() {
        return Mono.<Void>fromRunnable(() -> {
            stop();
            clearWorkDir();
            log.info("[Exec] {} session reset", agentId);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public Path getWorkDir() {
        return workDir;
    }

    private void run(String code, FluxSink<ExecutionUpdate> sink) {
        Set<Path> before = listImages();
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            sink.error(new IOException("Failed to start interpreter " + command + ": " + e.getMessage(), e));
            return;
        }
        running = process;
        sink.onDispose(() -> {
            if (process.isAlive()) {
                process.destroyForcibly();
                log.debug("[Exec] {} destroyed cell process", agentId);
            }
        });

        StringBuilder output = new StringBuilder();
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(code.getBytes(StandardCharsets.UTF_8));
            }
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line = reader.readLine();
                while (line != null) {
                    output.append(line).append('\n');
                    sink.next(new ExecutionUpdate.OutputChunk(line + "\n"));
                    line = reader.readLine();
                }
            }
            int exitCode = process.waitFor();
            String text = output.toString().stripTrailing();
            if (exitCode != 0) {
                text = text.isEmpty() ? "Exit code: " + exitCode : text + "\nExit code: " + exitCode;
            }
            sink.next(new ExecutionUpdate.Result(text.isEmpty() ? null : text, newImages(before)));
            sink.complete();
        } catch (IOException e) {
            if (sink.isCancelled()) {
                log.debug("[Exec] {} cell cancelled: {}", agentId, e.getMessage());
                return;
            }
            sink.error(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            sink.error(e);
        } finally {
            running = null;
        }
    }

    private List<Path> newImages(Set<Path> before) {
        List<Path> images = new ArrayList<>();
        for (Path image : listImages()) {
            if (!before.contains(image)) {
                images.add(image);
            }
        }
        images.sort(Comparator.naturalOrder());
        return images;
    }

    private Set<Path> listImages() {
        Set<Path> images = new HashSet<>();
        if (!Files.isDirectory(workDir)) {
            return images;
        }
        try (Stream<Path> paths = Files.walk(workDir)) {
            paths.filter(Files::isRegularFile)
                    .filter(ProcessExecutionSession::isImage)
                    .forEach(images::add);
        } catch (IOException e) {
            log.warn("[Exec] {} failed to list artifacts: {}", agentId, e.getMessage());
        }
        return images;
    }

    private static boolean isImage(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private void clearWorkDir() {
        if (!Files.isDirectory(workDir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(workDir)) {
            List<Path> entries = paths.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(workDir))
                    .toList();
            for (Path entry : entries) {
                Files.delete(entry);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to clear " + workDir + ": " + e.getMessage(), e);
        }
    }
}
