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

package io.convoengine.session.engine;

import java.util.List;

/**
 * One session inside the execution engine. A session runs at most one turn at
 * a time; distinct sessions may run turns concurrently.
 */
public interface EngineSession {

  /**
   * Returns the engine-side session id.
   *
   * @return the session id
   */
  String getSessionId();

  /**
   * Runs one turn. Blocks the calling thread until the turn completes; events
   * are emitted to the listener bound at creation while it runs.
   *
   * @param message
   *            the user message
   * @return the final response text, possibly empty
   * @throws Exception
   *             if the turn fails
   */
  String execute(String message) throws Exception;

  /**
   * Returns the model the session currently uses.
   *
   * @return the model info, {@link ModelInfo#UNKNOWN} by default
   */
  default ModelInfo getModelInfo() {
    return ModelInfo.UNKNOWN;
  }

  /**
   * Switches the active model.
   *
   * @param modelName
   *            the model to switch to
   * @return true if a provider accepted the switch
   */
  default boolean switchModel(String modelName) {
    return false;
  }

  /**
   * Lists the models offered by the session's providers.
   *
   * @return the provider models, empty by default
   */
  default List<ProviderModel> listProviderModels() {
    return List.of();
  }
}
