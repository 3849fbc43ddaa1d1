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

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * SessionConfig contains the options used to create one engine session.
 */
public class SessionConfig {

  /** Default cap on the tool result text forwarded to the display. */
  public static final int DEFAULT_TOOL_RESULT_MAX_CHARS = 2000;

  private final Path workingDir;
  private final String modelOverride;
  private final int toolResultMaxChars;

  private SessionConfig(Builder builder) {
    this.workingDir = builder.workingDir;
    this.modelOverride = builder.modelOverride;
    this.toolResultMaxChars = builder.toolResultMaxChars;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a config with every option at its default.
   *
   * @return the default config
   */
  public static SessionConfig defaults() {
    return builder().build();
  }

  /**
   * Returns the directory the session works in.
   *
   * @return the working directory
   */
  public Path getWorkingDir() {
    return workingDir;
  }

  /**
   * Returns the model to switch to right after the session is created.
   *
   * @return the model name, or null to keep the engine's default
   */
  public String getModelOverride() {
    return modelOverride;
  }

  /**
   * Returns the maximum length of a tool result forwarded to the display.
   *
   * @return the character limit
   */
  public int getToolResultMaxChars() {
    return toolResultMaxChars;
  }

  /**
   * Builder for SessionConfig.
   */
  public static class Builder {
    private Path workingDir = getWorkingDirFromEnv();
    private String modelOverride = getModelOverrideFromEnv();
    private int toolResultMaxChars = DEFAULT_TOOL_RESULT_MAX_CHARS;

    private static Path getWorkingDirFromEnv() {
      String dir = System.getenv("CONVOENGINE_WORKING_DIR");
      if (dir != null && !dir.isEmpty()) {
        return Paths.get(dir);
      }
      return Paths.get(System.getProperty("user.dir"));
    }

    private static String getModelOverrideFromEnv() {
      String model = System.getenv("CONVOENGINE_MODEL");
      return model != null && !model.isEmpty() ? model : null;
    }

    public Builder workingDir(Path workingDir) {
      this.workingDir = workingDir;
      return this;
    }

    public Builder modelOverride(String modelOverride) {
      this.modelOverride = modelOverride;
      return this;
    }

    public Builder toolResultMaxChars(int toolResultMaxChars) {
      this.toolResultMaxChars = toolResultMaxChars;
      return this;
    }

    public SessionConfig build() {
      if (workingDir == null) {
        throw new IllegalStateException("workingDir is required");
      }
      if (toolResultMaxChars <= 0) {
        throw new IllegalStateException("toolResultMaxChars must be positive");
      }
      return new SessionConfig(this);
    }
  }
}
