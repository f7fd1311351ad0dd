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

package me.golemcore.virality.domain.exception;

import lombok.Getter;

/**
 * Failure of the heavy-scorer process. Recovered by the fallback orchestrator,
 * never surfaced to callers.
 */
@Getter
public class ExternalProcessException extends ViralityException {

    private final Kind kind;

    public ExternalProcessException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExternalProcessException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public enum Kind {
        /** No command configured, or the scorer is disabled. */
        NOT_CONFIGURED,
        /** The process could not be started. */
        SPAWN_FAILED,
        /** The process did not finish within its time budget and was killed. */
        TIMEOUT,
        /** The process exited with a non-zero status. */
        NON_ZERO_EXIT,
        /** The calling thread was interrupted while waiting. */
        INTERRUPTED
    }
}
