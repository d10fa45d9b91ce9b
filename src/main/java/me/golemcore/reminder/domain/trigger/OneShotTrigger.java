package me.golemcore.reminder.domain.trigger;

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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

/**
 * Fires once at {@code fireAt}. Once that instant has passed the trigger is
 * exhausted.
 */
public record OneShotTrigger(Instant fireAt) implements Trigger {

    public static final String TYPE = "date";

    public OneShotTrigger {
        Objects.requireNonNull(fireAt, "fireAt must not be null");
    }

    @Override
    public Instant next(Instant now) {
        return fireAt.isAfter(now) ? fireAt : null;
    }

    @JsonIgnore
    @Override
    public boolean isOneShot() {
        return true;
    }

    @Override
    public String describe() {
        return "once at " + fireAt;
    }
}
