package me.golemcore.hindsight.adapter.outbound.storage;

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

import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Bank snapshots live under {@code <base-path>/<directory>/}, one JSON file per
 * bank. Base path configured via {@code hindsight.storage.base-path}, defaults
 * to {@code ${user.home}/.hindsight/workspace}.
 *
 * @see me.golemcore.hindsight.port.outbound.StoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final HindsightProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        if (!properties.getStorage().isSnapshotsEnabled()) {
            log.debug("[Storage] Snapshots disabled, not creating {}", basePath);
            return;
        }
        try {
            Files.createDirectories(basePath.resolve(properties.getStorage().getDirectory()));
            log.info("Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new RuntimeException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolvePath(directory, path));
            } catch (IOException e) {
                throw new RuntimeException("Failed to delete file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path dirPath = basePath.resolve(directory);
                if (!Files.exists(dirPath)) {
                    return Collections.emptyList();
                }
                try (Stream<Path> paths = Files.list(dirPath)) {
                    return paths
                            .filter(Files::isRegularFile)
                            .map(p -> p.getFileName().toString())
                            .filter(name -> prefix == null || name.startsWith(prefix))
                            .sorted()
                            .toList();
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to list files: " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(basePath.resolve(directory));
            } catch (IOException e) {
                throw new RuntimeException("Failed to create directory: " + directory, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");

            try {
                Path parent = targetPath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }

                byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
                try (OutputStream os = Files.newOutputStream(tempPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING);
                        FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                    os.write(bytes);
                    os.flush();
                    channel.force(true);
                }

                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }
                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);

            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
                }
                throw new RuntimeException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
