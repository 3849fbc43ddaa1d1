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
 * Thrown for invalid setup, most notably creating a session for a conversation
 * that already has a live one. The caller must end the existing session first.
 */
public class ConfigurationException extends ConvoException {

  public static final String ERROR_CODE = "CONFIGURATION";

  public ConfigurationException(String message) {
    super(message, null, ERROR_CODE, null, null);
  }

  public ConfigurationException(String message, String conversationId) {
    super(message, null, ERROR_CODE, null, conversationId);
  }
}
