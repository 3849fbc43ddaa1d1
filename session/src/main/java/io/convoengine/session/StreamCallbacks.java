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

package io.convoengine.session;

import java.util.Map;

/**
 * StreamCallbacks is the set of eight callback slots a {@link SessionHandle}
 * dispatches engine events to. Any slot may be null, meaning "ignore".
 *
 * <p>
 * Instances are immutable. A new set is built and installed for every turn,
 * replacing the previous turn's set in one step, so a finished turn's closures
 * can never observe the next turn's state.
 */
public final class StreamCallbacks {

  /** A set with every slot empty. */
  public static final StreamCallbacks NONE = builder().build();

  /** Called when a content block opens. */
  @FunctionalInterface
  public interface BlockStart {
    void onBlockStart(String blockType, int blockIndex);
  }

  /** Called with each non-empty text delta of a content block. */
  @FunctionalInterface
  public interface BlockDelta {
    void onBlockDelta(String blockType, String delta);
  }

  /** Called when a text or thinking block closes. */
  @FunctionalInterface
  public interface BlockEnd {
    void onBlockEnd(String blockType, String finalText);
  }

  /** Called before a tool runs. */
  @FunctionalInterface
  public interface ToolPre {
    void onToolPre(String toolName, Map<String, Object> toolInput);
  }

  /** Called after a tool has run. */
  @FunctionalInterface
  public interface ToolPost {
    void onToolPost(String toolName, Map<String, Object> toolInput, String result);
  }

  private final BlockStart blockStart;
  private final BlockDelta blockDelta;
  private final BlockEnd blockEnd;
  private final ToolPre toolPre;
  private final ToolPost toolPost;
  private final Runnable executionStart;
  private final Runnable executionEnd;
  private final Runnable usageUpdate;

  private StreamCallbacks(Builder builder) {
    this.blockStart = builder.blockStart;
    this.blockDelta = builder.blockDelta;
    this.blockEnd = builder.blockEnd;
    this.toolPre = builder.toolPre;
    this.toolPost = builder.toolPost;
    this.executionStart = builder.executionStart;
    this.executionEnd = builder.executionEnd;
    this.usageUpdate = builder.usageUpdate;
  }

  public static Builder builder() {
    return new Builder();
  }

  public BlockStart getBlockStart() {
    return blockStart;
  }

  public BlockDelta getBlockDelta() {
    return blockDelta;
  }

  public BlockEnd getBlockEnd() {
    return blockEnd;
  }

  public ToolPre getToolPre() {
    return toolPre;
  }

  public ToolPost getToolPost() {
    return toolPost;
  }

  public Runnable getExecutionStart() {
    return executionStart;
  }

  public Runnable getExecutionEnd() {
    return executionEnd;
  }

  public Runnable getUsageUpdate() {
    return usageUpdate;
  }

  /**
   * Builder for StreamCallbacks.
   */
  public static class Builder {
    private BlockStart blockStart;
    private BlockDelta blockDelta;
    private BlockEnd blockEnd;
    private ToolPre toolPre;
    private ToolPost toolPost;
    private Runnable executionStart;
    private Runnable executionEnd;
    private Runnable usageUpdate;

    public Builder onBlockStart(BlockStart blockStart) {
      this.blockStart = blockStart;
      return this;
    }

    public Builder onBlockDelta(BlockDelta blockDelta) {
      this.blockDelta = blockDelta;
      return this;
    }

    public Builder onBlockEnd(BlockEnd blockEnd) {
      this.blockEnd = blockEnd;
      return this;
    }

    public Builder onToolPre(ToolPre toolPre) {
      this.toolPre = toolPre;
      return this;
    }

    public Builder onToolPost(ToolPost toolPost) {
      this.toolPost = toolPost;
      return this;
    }

    public Builder onExecutionStart(Runnable executionStart) {
      this.executionStart = executionStart;
      return this;
    }

    public Builder onExecutionEnd(Runnable executionEnd) {
      this.executionEnd = executionEnd;
      return this;
    }

    public Builder onUsageUpdate(Runnable usageUpdate) {
      this.usageUpdate = usageUpdate;
      return this;
    }

    public StreamCallbacks build() {
      return new StreamCallbacks(this);
    }
  }
}
