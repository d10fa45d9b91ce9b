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

/**
 * A scheduling request was rejected because one of its inputs could not be
 * understood. No store was changed. The message names the offending input and
 * is safe to show to the requesting user.
 */
public class ReminderRequestException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final Kind kind;
    private final String input;

    public ReminderRequestException(Kind kind, String input, String message) {
        super(message);
        this.kind = kind;
        this.input = input;
    }

    public ReminderRequestException(Kind kind, String input, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.input = input;
    }

    public Kind getKind() {
        return kind;
    }

    public String getInput() {
        return input;
    }

    /**
     * Which input failed.
     */
    public enum Kind {
        TIME, TIMEZONE, CRON, INTERVAL, MESSAGE
    }
}
