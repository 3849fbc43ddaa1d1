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

import java.util.Objects;

/**
 * A model offered by one of a session's providers.
 */
public final class ProviderModel {

  private final String modelName;
  private final String provider;

  public ProviderModel(String modelName, String provider) {
    this.modelName = modelName;
    this.provider = provider;
  }

  public String getModelName() {
    return modelName;
  }

  public String getProvider() {
    return provider;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProviderModel)) {
      return false;
    }
    ProviderModel that = (ProviderModel) o;
    return Objects.equals(modelName, that.modelName) && Objects.equals(provider, that.provider);
  }

  @Override
  public int hashCode() {
    return Objects.hash(modelName, provider);
  }

  @Override
  public String toString() {
    return modelName + " (" + provider + ")";
  }
}
