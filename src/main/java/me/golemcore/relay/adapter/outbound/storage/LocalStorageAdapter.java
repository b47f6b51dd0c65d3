package me.golemcore.relay.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Workspace on the local filesystem.
 *
 * <ul>
 * <li>{@code cron/jobs.json} job store, {@code cron/runs/<jobId>.jsonl} run
 * logs</li>
 * <li>{@code sessions/} shared session store</li>
 * </ul>
 *
 * <p>
 * The root comes from {@code relay.storage.local.base-path}; a leading
 * {@code ~} or {@code ${user.home}} is expanded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final List<String> WORKSPACE_DIRECTORIES = List.of("cron/runs", "sessions");

    private final RelayProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        basePath = expandHome(properties.getStorage().getLocal().getBasePath()).toAbsolutePath().normalize();
        try {
            for (String dir : WORKSPACE_DIRECTORIES) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Workspace at {}", basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create relay workspace at " + basePath, e);
        }
    }

    Path getBasePath() {
        return basePath;
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolve(directory, path);
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path file = resolve(directory, path);
            try {
                Files.createDirectories(file.getParent());
                Files.writeString(file, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot append to " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolve(directory, path);
            Path temp = null;
            try {
                Files.createDirectories(target.getParent());
                temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
                writeDurably(temp, content.getBytes(StandardCharsets.UTF_8));
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + ".bak"),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                replace(temp, target);
                log.debug("[Storage] Wrote {}/{} ({} chars)", directory, path, content.length());
            } catch (IOException e) {
                discard(temp);
                throw new UncheckedIOException("Cannot write " + directory + "/" + path, e);
            }
        });
    }

    private static void writeDurably(Path file, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic rename unsupported for {}, falling back to plain move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[Storage] Leftover temp file {}: {}", temp, e.getMessage());
        }
    }

    private Path resolve(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath) || resolved.equals(basePath)) {
            throw new IllegalArgumentException("Path escapes the workspace: " + directory + "/" + path);
        }
        return resolved;
    }

    private static Path expandHome(String configured) {
        String home = System.getProperty("user.home");
        String expanded = configured.replace("${user.home}", home);
        if (expanded.equals("~") || expanded.startsWith("~/")) {
            expanded = home + expanded.substring(1);
        }
        return Paths.get(expanded);
    }
}
