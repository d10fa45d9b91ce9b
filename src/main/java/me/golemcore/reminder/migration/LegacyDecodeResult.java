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

/**
 * Outcome of decoding one legacy record: either the record or the reason it
 * could not be decoded.
 */
public record LegacyDecodeResult(String id, LegacyRecord record, String error) {

    public static LegacyDecodeResult success(LegacyRecord record) {
        return new LegacyDecodeResult(record.id(), record, null);
    }

    public static LegacyDecodeResult failure(String id, String error) {
        return new LegacyDecodeResult(id, null, error);
    }

    public boolean isSuccess() {
        return record != null;
    }
}
