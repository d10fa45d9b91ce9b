package me.golemcore.reminder.domain.model;

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
 * An import without skipping was rejected because some ids already exist.
 * Nothing was imported.
 */
public class ImportConflictException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<String> conflictingIds;

    public ImportConflictException(List<String> conflictingIds) {
        super("Reminders already exist: " + String.join(", ", conflictingIds));
        this.conflictingIds = List.copyOf(conflictingIds);
    }

    public List<String> getConflictingIds() {
        return conflictingIds;
    }
}
