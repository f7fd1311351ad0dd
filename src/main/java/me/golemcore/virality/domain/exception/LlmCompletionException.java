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

/**
 * The text-completion collaborator failed or is not configured. Only the
 * sub-feature that needed the completion is dropped.
 */
public class LlmCompletionException extends ViralityException {

    public LlmCompletionException(String message) {
        super(message);
    }

    public LlmCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
