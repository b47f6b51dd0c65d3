package me.golemcore.relay.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Text files under the relay workspace. Paths are given as a top-level
 * directory ({@code cron}, {@code sessions}) plus a path inside it; neither may
 * escape the workspace.
 */
public interface StoragePort {

    /**
     * @return the file content, or null when the file does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Appends to the file, creating it and its parent directories when missing.
     * Used for JSONL logs, so the caller supplies the line terminator.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Replaces the file so that readers see either the old or the new content,
     * never a partial write. With {@code backup} the previous content is kept
     * next to it as {@code <file>.bak}.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
