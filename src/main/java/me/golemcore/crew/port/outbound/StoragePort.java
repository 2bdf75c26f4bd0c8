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

package me.golemcore.crew.port.outbound;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage inside the local workspace, organized by
 * directory ("conversations", "lessons").
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with null when the file is absent.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * List files by prefix, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (JSONL).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Write text through a temporary file and an atomic rename so readers never
     * observe a partially written file.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
