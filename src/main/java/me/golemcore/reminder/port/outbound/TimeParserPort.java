package me.golemcore.reminder.port.outbound;

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

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Port for turning user-entered time text ("in 5 minutes", "22:00",
 * "2026-11-02 14:00") into an instant.
 */
public interface TimeParserPort {

    /**
     * Parse {@code text}, reading wall-clock times in {@code zone}.
     *
     * @return the instant, or empty if the text is ambiguous or unparseable
     */
    Optional<Instant> parse(String text, ZoneId zone);
}
