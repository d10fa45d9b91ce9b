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
 * A job together with its rendered schedule, as shown in listings.
 *
 * @param job
 *            the job
 * @param description
 *            trigger description, e.g. {@code every 1d}
 * @param countdown
 *            decomposed countdown, e.g. {@code 1 day, 2 minutes}, or
 *            {@code Paused}
 * @param relative
 *            relative timestamp token, e.g. {@code <t:1700000000:R>}, or
 *            {@code Paused}
 */
public record ReminderView(ReminderJob job, String description, String countdown, String relative) {
}
