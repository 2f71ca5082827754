package me.golemcore.proxy.port.outbound;


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
 * Port for file storage within the local workspace, used by the file-backed
 * schedule store and lease when the proxy runs outside a cluster. Files are
 * organized by directory ("schedules", "leases").
 */
public interface StoragePort {

    /**
     * Read text content from file.
     *
     * @return the content, or {@code null} if the file does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Atomically replace a file's text content.
     *
     * <p>
     * The content is written to a {@code .tmp} sibling, synced to disk and then
     * moved over the target, so readers see either the old or the new content
     * and never a partial write.
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    /**
     * Delete a file.
     *
     * @return {@code true} if the file existed
     */
    CompletableFuture<Boolean> deleteObject(String directory, String path);

    /**
     * List file names directly under a directory that end with the given suffix.
     */
    CompletableFuture<List<String>> listObjects(String directory, String suffix);

    /**
     * Ensure directory exists.
     */
    CompletableFuture<Void> ensureDirectory(String directory);
}
