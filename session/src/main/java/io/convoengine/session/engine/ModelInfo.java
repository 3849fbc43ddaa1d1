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

/**
 * Model details reported by an engine session.
 */
public final class ModelInfo {

  /** Returned when the engine cannot tell which model is active. */
  public static final ModelInfo UNKNOWN = new ModelInfo("", 0);

  private final String modelName;
  private final int contextWindow;

  /**
   * Creates a new ModelInfo.
   *
   * @param modelName
   *            the active model, null or empty if unknown
   * @param contextWindow
   *            the context window size in tokens, 0 if unknown
   */
  public ModelInfo(String modelName, int contextWindow) {
    this.modelName = modelName != null ? modelName : "";
    this.contextWindow = contextWindow;
  }

  public String getModelName() {
    return modelName;
  }

  public int getContextWindow() {
    return contextWindow;
  }

  @Override
  public String toString() {
    return "ModelInfo{modelName='" + modelName + "', contextWindow=" + contextWindow + "}";
  }
}
