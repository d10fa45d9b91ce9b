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

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Decodes legacy job records of one schema version.
 */
public interface LegacyRecordDecoder {

    /**
     * Schema version handled, matched against the record's {@code version}
     * field.
     */
    int version();

    /**
     * Decode one record. Never throws for bad input; problems are returned as
     * {@link LegacyDecodeResult#failure(String, String)}.
     *
     * @param node
     *            the raw record
     * @param fallbackZone
     *            timezone for triggers and timestamps that do not name one
     * @param now
     *            anchor for interval triggers without a start
     */
    LegacyDecodeResult decode(JsonNode node, ZoneId fallbackZone, Instant now);
}
