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
 * How a scheduler handles instants that became due while it could not fire
 * them (process down, workspace disabled).
 */
public enum MisfirePolicy {

    /**
     * Report late instants, then fire once.
     */
    COALESCE,

    /**
     * Report late instants, then fire once per due instant up to the catch-up
     * cap.
     */
    FIRE_EACH,

    /**
     * Report late instants and do not fire them; only an instant within the
     * grace period fires.
     */
    SKIP_LATE
}
