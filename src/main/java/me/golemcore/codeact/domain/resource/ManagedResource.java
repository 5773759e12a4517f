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


package me.golemcore.codeact.domain.resource;

/**
 * External resource with an explicit lifecycle: a model session, an execution
 * session or a tool connection.
 */
public interface ManagedResource {

    /**
     * Name used in logs and start failures.
     */
    String resourceName();

    /**
     * Acquires the resource. Throws any runtime exception on failure.
     */
    void start();

    /**
     * Releases the resource. Called at most once per successful start.
     */
    void stop();
}
