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


package me.golemcore.codeact.domain.model;

/**
 * How a turn ended.
 */
public enum TurnStatus {
    /** The model stopped proposing actions. */
    COMPLETED,
    /** An approval was rejected or expired and the round was truncated. */
    REJECTED,
    /** The turn budget ran out while the model still proposed actions. */
    MAX_TURNS_REACHED,
    /** Record of a finished round; more records of the same turn follow. */
    IN_PROGRESS,
    /** The turn failed or was cancelled after some of its rounds were logged. */
    INCOMPLETE
}
