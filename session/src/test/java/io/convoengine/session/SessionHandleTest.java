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

import static io.convoengine.session.FakeExecutionEngine.payload;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.convoengine.core.EngineFailureException;
import io.convoengine.session.engine.ProviderModel;
import io.convoengine.session.engine.SessionConfig;

/**
 * Unit tests for SessionHandle event dispatch and model helpers.
 */
class SessionHandleTest {

  private SessionHandle handle;
  private List<String> calls;

  @BeforeEach
  void setUp() {
    handle = new SessionHandle("t1", SessionConfig.DEFAULT_TOOL_RESULT_MAX_CHARS);
    calls = new ArrayList<>();
    handle.install(recordingCallbacks(calls));
  }

  private static StreamCallbacks recordingCallbacks(List<String> calls) {
    return StreamCallbacks.builder()
        .onBlockStart((type, index) -> calls.add("start:" + type + ":" + index))
        .onBlockDelta((type, delta) -> calls.add("delta:" + type + ":" + delta))
        .onBlockEnd((type, text) -> calls.add("end:" + type + ":" + text))
        .onToolPre((name, input) -> calls.add("pre:" + name + ":" + input))
        .onToolPost((name, input, result) -> calls.add("post:" + name + ":" + result))
        .onExecutionStart(() -> calls.add("exec-start")).onExecutionEnd(() -> calls.add("exec-end"))
        .onUsageUpdate(() -> calls.add("usage")).build();
  }

  @Test
  void testBlockStartDefaults() {
    handle.dispatch("content_block:start", Map.of());

    assertEquals(List.of("start:text:0"), calls);
  }

  @Test
  void testBlockStartParsesNumericString() {
    handle.dispatch("content_block:start", payload("block_type", "thinking", "block_index", "3"));
    handle.dispatch("content_block:start", payload("block_index", "not-a-number"));

    assertEquals(List.of("start:thinking:3", "start:text:0"), calls);
  }

  @Test
  void testDeltaUsesFirstNonEmptyField() {
    handle.dispatch("content_block:delta", payload("delta", "a", "text", "b"));
    handle.dispatch("content_block:delta", payload("delta", "", "text", "b", "content", "c"));
    handle.dispatch("content_block:delta", payload("content", "c"));

    assertEquals(List.of("delta:text:a", "delta:text:b", "delta:text:c"), calls);
  }

  @Test
  void testEmptyDeltaIsDropped() {
    handle.dispatch("content_block:delta", payload("block_type", "text"));

    assertTrue(calls.isEmpty());
  }

  @Test
  void testBlockEndTextAndThinking() {
    handle.dispatch("content_block:end", payload("block", payload("type", "text", "text", "hello")));
    handle.dispatch("content_block:end", payload("block", payload("type", "thinking", "thinking", "hmm")));
    handle.dispatch("content_block:end", payload("block", payload("type", "reasoning", "text", "because")));

    assertEquals(List.of("end:text:hello", "end:thinking:hmm", "end:thinking:because"), calls);
  }

  @Test
  void testBlockEndOtherTypesIgnored() {
    handle.dispatch("content_block:end", payload("block", payload("type", "tool_use")));
    handle.dispatch("content_block:end", Map.of());

    assertTrue(calls.isEmpty());
  }

  @Test
  void testToolPreDefaults() {
    handle.dispatch("tool:pre", Map.of());
    handle.dispatch("tool:pre", payload("tool_name", "bash", "tool_input", payload("command", "ls")));

    assertEquals(List.of("pre:unknown:{}", "pre:bash:{command=ls}"), calls);
  }

  @Test
  void testToolPostRendersStructuredResultAsJson() {
    handle.dispatch("tool:post", payload("tool_name", "bash", "result", payload("exit_code", 0)));

    assertEquals(1, calls.size());
    assertTrue(calls.get(0).startsWith("post:bash:{"));
    assertTrue(calls.get(0).contains("\"exit_code\" : 0"));
  }

  @Test
  void testToolPostNullResultIsEmpty() {
    handle.dispatch("tool:post", payload("tool_name", "read"));

    assertEquals(List.of("post:read:"), calls);
  }

  @Test
  void testToolResultTruncated() {
    SessionHandle small = new SessionHandle("t2", 10);
    List<String> smallCalls = new ArrayList<>();
    small.install(recordingCallbacks(smallCalls));

    small.dispatch("tool:post", payload("tool_name", "cat", "result", "0123456789abcdef"));

    assertEquals(List.of("post:cat:0123456789"), smallCalls);
  }

  @Test
  void testUsageAccumulatesAcrossResponses() {
    handle.dispatch("llm:response", payload("usage", payload("input", 100, "output", 20), "model", "m-1"));
    handle.dispatch("llm:response", payload("usage", payload("input", 50, "output", 5), "model", "m-2"));
    handle.dispatch("llm:response", Map.of());

    assertEquals(150, handle.getTotalInputTokens());
    assertEquals(25, handle.getTotalOutputTokens());
    assertEquals("m-1", handle.getModelName());
    assertEquals(List.of("usage", "usage", "usage"), calls);
  }

  @Test
  void testExecutionEvents() {
    handle.dispatch("execution:start", null);
    handle.dispatch("execution:end", null);

    assertEquals(List.of("exec-start", "exec-end"), calls);
  }

  @Test
  void testUnknownEventIgnored() {
    handle.dispatch("session:fork", payload("x", 1));
    handle.dispatch(null, null);

    assertTrue(calls.isEmpty());
  }

  @Test
  void testMalformedPayloadDoesNotThrow() {
    assertDoesNotThrow(() -> handle.dispatch("tool:pre", payload("tool_name", "bash", "tool_input", "oops")));
    assertTrue(calls.isEmpty());
  }

  @Test
  void testFailingCallbackIsContained() {
    AtomicInteger seen = new AtomicInteger();
    handle.install(StreamCallbacks.builder().onBlockStart((type, index) -> {
      seen.incrementAndGet();
      throw new IllegalStateException("display gone");
    }).build());

    assertDoesNotThrow(() -> handle.dispatch("content_block:start", Map.of()));
    assertEquals(1, seen.get());
  }

  @Test
  void testEmptySlotsAreSkipped() {
    handle.install(null);

    assertSame(StreamCallbacks.NONE, handle.getCallbacks());
    assertDoesNotThrow(() -> handle.dispatch("content_block:delta", payload("delta", "x")));
  }

  @Test
  void testResetUsage() {
    handle.dispatch("llm:response", payload("usage", payload("input", 7, "output", 3), "model", "m"));

    handle.resetUsage();

    assertEquals(0, handle.getTotalInputTokens());
    assertEquals(0, handle.getTotalOutputTokens());
    assertEquals("", handle.getModelName());
    assertEquals(0, handle.getContextWindow());
  }

  @Test
  void testCreateBindsListenerAndExtractsModelInfo() {
    FakeExecutionEngine engine = new FakeExecutionEngine();
    SessionHandle created = SessionHandle.create("t1", engine, SessionConfig.defaults());
    List<String> createdCalls = new ArrayList<>();
    created.install(recordingCallbacks(createdCalls));

    engine.getSessions().get(0).emit("content_block:delta", payload("delta", "hi"));

    assertTrue(created.isActive());
    assertEquals("fake-1", created.getSessionId());
    assertEquals("fake-model", created.getModelName());
    assertEquals(200000, created.getContextWindow());
    assertEquals(List.of("delta:text:hi"), createdCalls);
  }

  @Test
  void testCreateAppliesModelOverride() {
    FakeExecutionEngine engine = new FakeExecutionEngine();
    engine.setDefaultScript(FakeExecutionEngine.ECHO);
    SessionConfig config = SessionConfig.builder().modelOverride("fake-model").build();

    SessionHandle created = SessionHandle.create("t1", engine, config);

    assertEquals("fake-model", created.getModelName());
  }

  @Test
  void testCreateFailureIsWrapped() {
    FakeExecutionEngine engine = new FakeExecutionEngine();
    engine.failCreateWith(new IllegalStateException("no credentials"));

    EngineFailureException thrown = assertThrows(EngineFailureException.class,
        () -> SessionHandle.create("t1", engine, SessionConfig.defaults()));

    assertTrue(thrown.getMessage().startsWith("Could not start session"));
    assertEquals("t1", thrown.getConversationId());
  }

  @Test
  void testResumeKeepsEngineSessionId() {
    FakeExecutionEngine engine = new FakeExecutionEngine();

    SessionHandle resumed = SessionHandle.resume("old-42", "t1", engine, SessionConfig.defaults());

    assertEquals("old-42", resumed.getSessionId());
  }

  @Test
  void testSwitchModelAndProviderModels() {
    FakeExecutionEngine engine = new FakeExecutionEngine();
    SessionHandle created = SessionHandle.create("t1", engine, SessionConfig.defaults());
    engine.getSessions().get(0)
        .setProviderModels(List.of(new ProviderModel("fake-model", "fake"), new ProviderModel("big", "fake")));

    assertTrue(created.switchModel("big"));
    assertEquals("big", created.getModelName());
    assertFalse(created.switchModel("missing"));
    assertEquals("big", created.getModelName());
    assertEquals(2, created.providerModels().size());
  }

  @Test
  void testModelHelpersWithoutSession() {
    assertFalse(handle.switchModel("any"));
    assertTrue(handle.providerModels().isEmpty());
    assertDoesNotThrow(() -> handle.extractModelInfo());
  }

  @Test
  void testDetachClearsSessionAndCallbacks() {
    FakeExecutionEngine engine = new FakeExecutionEngine();
    SessionHandle created = SessionHandle.create("t1", engine, SessionConfig.defaults());
    created.install(recordingCallbacks(calls));

    assertNotNull(created.detach());

    assertFalse(created.isActive());
    assertSame(StreamCallbacks.NONE, created.getCallbacks());
  }
}
