/*
 * Copyright 2025 The ConvoEngine Authors
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
 * SPDX-License-Identifier: Apache-2.0
 */

package io.convoengine.core;

/**
 * Thrown when an operation addresses a conversation that has no live session.
 * Surfaced to the caller as-is; never retried automatically.
 */
public class NotFoundException extends ConvoException {

  public static final String ERROR_CODE = "NOT_FOUND";

  public NotFoundException(String conversationId) {
    super("No active session for conversation '" + conversationId + "'", null, ERROR_CODE, null,
        conversationId);
  }

  public NotFoundException(String message, String conversationId) {
    super(message, null, ERROR_CODE, null, conversationId);
  }
}
