package me.golemcore.reminder.migration;

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

/**
 * Result of one migration pass.
 *
 * @param migrated
 *            ids written to a workspace store
 * @param alreadyPresent
 *            ids found in their workspace store already
 * @param skipped
 *            records that could not be migrated
 * @param archivedAs
 *            new name of the legacy file, or {@code null} if it was not renamed
 */
public record MigrationReport(
        List<String> migrated,
        List<String> alreadyPresent,
        List<SkippedRecord> skipped,
        String archivedAs) {

    public MigrationReport {
        migrated = List.copyOf(migrated);
        alreadyPresent = List.copyOf(alreadyPresent);
        skipped = List.copyOf(skipped);
    }

    public static MigrationReport empty() {
        return new MigrationReport(List.of(), List.of(), List.of(), null);
    }

    /**
     * A legacy record left behind, with the reason.
     */
    public record SkippedRecord(String id, String reason) {
    }
}
