package me.golemcore.hindsight.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for text persistence within the local workspace, organized by
 * directory.
 */
public interface StoragePort {

    /**
     * Read text content from file; completes with {@code null} when absent.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Delete a file.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files by prefix.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Atomically write text content to file.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    /**
     * Ensure directory exists.
     */
    CompletableFuture<Void> ensureDirectory(String directory);
}
