/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.orioledb.testkit.backup;

/**
 * Metadata of a backup, persisted as {@value Backup#MANIFEST_FILE} next to the copied data directory.
 *
 * @param sourceName    name of the node the backup was taken from
 * @param sourceDataDir absolute path of the source data directory
 * @param sourcePort    port of the source node
 * @param online        whether the source was running while it was copied
 * @param createdAt     creation time in epoch milliseconds
 */
public record BackupManifest(String sourceName, String sourceDataDir, int sourcePort, boolean online, long createdAt) {
}
